package com.lightwatch.config;

import jakarta.annotation.Nullable;
import java.time.Duration;
import ru.tinkoff.kora.config.common.annotation.ConfigSource;
import ru.tinkoff.kora.config.common.annotation.ConfigValueExtractor;

@ConfigSource("app")
@ConfigValueExtractor
public interface AppConfig {
    String publicBaseUrl();
    MonitorConfig monitor();
    NotificationConfig notifications();
    AdminConfig admin();
    SecurityConfig security();

    @ConfigValueExtractor
    interface MonitorConfig {
        Duration gracePeriod();
        Duration scanInterval();
        String defaultTimezone();
    }

    @ConfigValueExtractor
    interface NotificationConfig {
        @Nullable
        String telegramBotToken();
        String telegramApiUrl();
        int threads();
    }

    @ConfigValueExtractor
    interface AdminConfig {
        String token();
    }

    @ConfigValueExtractor
    interface SecurityConfig {
        String encryptionKey();
    }
}
