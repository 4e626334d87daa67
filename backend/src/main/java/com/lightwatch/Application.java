package com.lightwatch;

import com.lightwatch.config.AppConfig;
import com.lightwatch.notify.LoggingNotificationDispatcher;
import com.lightwatch.notify.NotificationDispatcher;
import com.lightwatch.notify.TelegramNotificationDispatcher;
import java.time.Clock;
import ru.tinkoff.kora.application.graph.KoraApplication;
import ru.tinkoff.kora.common.KoraApp;
import ru.tinkoff.kora.config.hocon.HoconConfigModule;
import ru.tinkoff.kora.database.jdbc.JdbcDatabaseModule;
import ru.tinkoff.kora.http.server.undertow.UndertowHttpServerModule;
import ru.tinkoff.kora.json.module.JsonModule;
import ru.tinkoff.kora.logging.logback.LogbackModule;

@KoraApp
public interface Application extends
    HoconConfigModule,
    LogbackModule,
    JsonModule,
    JdbcDatabaseModule,
    UndertowHttpServerModule {

    static void main(String[] args) {
        KoraApplication.run(ApplicationGraph::graph);
    }

    default Clock clock() {
        return Clock.systemUTC();
    }

    default NotificationDispatcher notificationDispatcher(AppConfig appConfig) {
        AppConfig.NotificationConfig notifications = appConfig.notifications();
        String token = notifications.telegramBotToken();
        if (token == null || token.isBlank()) {
            return new LoggingNotificationDispatcher();
        }
        return new TelegramNotificationDispatcher(notifications.telegramApiUrl(), token);
    }
}
