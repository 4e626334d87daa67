package com.lightwatch.security;

import com.lightwatch.config.AppConfig;
import com.lightwatch.service.ApiException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import ru.tinkoff.kora.common.Component;

@Component
public final class AdminTokenGuard {
    private final byte[] expected;

    public AdminTokenGuard(AppConfig appConfig) {
        String token = appConfig.admin().token();
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("ADMIN_TOKEN must be configured");
        }
        this.expected = token.getBytes(StandardCharsets.UTF_8);
    }

    public void require(String providedToken) {
        if (providedToken == null || providedToken.isBlank()) {
            throw ApiException.unauthorized("admin_token_required");
        }
        byte[] provided = providedToken.trim().getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, provided)) {
            throw ApiException.unauthorized("invalid_admin_token");
        }
    }
}
