package com.lightwatch.notify;

import com.lightwatch.domain.TransitionNotice;
import com.lightwatch.util.Jsons;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TelegramNotificationDispatcher implements NotificationDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(TelegramNotificationDispatcher.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final URI sendMessageUri;

    public TelegramNotificationDispatcher(String apiUrl, String botToken) {
        this(HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build(), apiUrl, botToken);
    }

    TelegramNotificationDispatcher(HttpClient httpClient, String apiUrl, String botToken) {
        this.httpClient = httpClient;
        String base = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.sendMessageUri = URI.create(base + "/bot" + botToken + "/sendMessage");
    }

    @Override
    public void dispatch(TransitionNotice notice) {
        String body = Jsons.stringify(Map.of(
            "chat_id", notice.deviceId(),
            "text", NotificationFormatter.format(notice)
        ));
        HttpRequest request = HttpRequest.newBuilder(sendMessageUri)
            .timeout(REQUEST_TIMEOUT)
            .header("Content-Type", "application/json; charset=utf-8")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new NotificationDeliveryException("Telegram request failed for channel " + notice.deviceId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationDeliveryException("Interrupted while notifying channel " + notice.deviceId(), e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new NotificationDeliveryException(
                "Telegram rejected message for channel " + notice.deviceId() + ": HTTP " + response.statusCode()
            );
        }
        logger.debug("Telegram message delivered to channel {}", notice.deviceId());
    }
}
