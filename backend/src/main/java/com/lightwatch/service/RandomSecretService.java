package com.lightwatch.service;

import java.security.SecureRandom;
import java.util.Base64;
import ru.tinkoff.kora.common.Component;

@Component
public final class RandomSecretService {
    private static final int KEY_BYTES = 32;

    private final SecureRandom random = new SecureRandom();

    public String generateChannelKey() {
        byte[] bytes = new byte[KEY_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
