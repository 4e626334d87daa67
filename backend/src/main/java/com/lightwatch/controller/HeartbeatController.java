package com.lightwatch.controller;

import com.lightwatch.domain.HeartbeatResult;
import com.lightwatch.service.HeartbeatProcessor;
import com.lightwatch.util.HttpResponseFactory;
import jakarta.annotation.Nullable;
import java.time.Clock;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.http.common.HttpMethod;
import ru.tinkoff.kora.http.common.annotation.HttpRoute;
import ru.tinkoff.kora.http.common.annotation.Query;
import ru.tinkoff.kora.http.server.common.HttpServerResponse;
import ru.tinkoff.kora.http.server.common.annotation.HttpController;

@Component
@HttpController
public final class HeartbeatController {
    private final HeartbeatProcessor heartbeatProcessor;
    private final HttpResponseFactory responses;
    private final Clock clock;

    public HeartbeatController(HeartbeatProcessor heartbeatProcessor, HttpResponseFactory responses, Clock clock) {
        this.heartbeatProcessor = heartbeatProcessor;
        this.responses = responses;
        this.clock = clock;
    }

    @HttpRoute(method = HttpMethod.GET, path = "/channelPing")
    public HttpServerResponse ping(@Nullable @Query("channel_key") String channelKey) {
        return handle(channelKey);
    }

    @HttpRoute(method = HttpMethod.POST, path = "/channelPing")
    public HttpServerResponse pingPost(@Nullable @Query("channel_key") String channelKey) {
        return handle(channelKey);
    }

    private HttpServerResponse handle(String channelKey) {
        try {
            if (channelKey == null || channelKey.isBlank()) {
                return responses.text(400, "Missing channel_key parameter");
            }
            HeartbeatResult result = heartbeatProcessor.process(channelKey, clock.instant());
            if (!result.accepted()) {
                return responses.text(403, "Invalid key");
            }
            return responses.text(200, "OK");
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }
}
