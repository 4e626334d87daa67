package com.lightwatch.controller;

import com.lightwatch.domain.ChannelApi;
import com.lightwatch.security.AdminTokenGuard;
import com.lightwatch.service.ApiException;
import com.lightwatch.service.DeviceManagementService;
import com.lightwatch.service.DeviceQueryService;
import com.lightwatch.util.HttpResponseFactory;
import jakarta.annotation.Nullable;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.http.common.HttpMethod;
import ru.tinkoff.kora.http.common.annotation.Header;
import ru.tinkoff.kora.http.common.annotation.HttpRoute;
import ru.tinkoff.kora.http.common.annotation.Path;
import ru.tinkoff.kora.http.common.annotation.Query;
import ru.tinkoff.kora.http.server.common.HttpServerResponse;
import ru.tinkoff.kora.http.server.common.annotation.HttpController;
import ru.tinkoff.kora.json.common.annotation.Json;

@Component
@HttpController
public final class ChannelController {
    private static final String TOKEN_HEADER = "X-Admin-Token";

    private final AdminTokenGuard adminTokenGuard;
    private final DeviceManagementService managementService;
    private final DeviceQueryService queryService;
    private final HttpResponseFactory responses;
    private final Clock clock;

    public ChannelController(AdminTokenGuard adminTokenGuard,
                             DeviceManagementService managementService,
                             DeviceQueryService queryService,
                             HttpResponseFactory responses,
                             Clock clock) {
        this.adminTokenGuard = adminTokenGuard;
        this.managementService = managementService;
        this.queryService = queryService;
        this.responses = responses;
        this.clock = clock;
    }

    @HttpRoute(method = HttpMethod.POST, path = "/api/channels")
    public HttpServerResponse create(@Nullable @Header(TOKEN_HEADER) String token,
                                     @Json ChannelApi.CreateChannelRequest request) {
        try {
            adminTokenGuard.require(token);
            if (request == null) {
                throw ApiException.badRequest("request_body_required");
            }
            var result = request.secretKey() == null
                ? managementService.createDevice(request.channelId(), request.ownerRef())
                : managementService.importDevice(request.channelId(), request.ownerRef(), request.secretKey());
            return responses.json(200, result);
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/api/channels")
    public HttpServerResponse overview(@Nullable @Header(TOKEN_HEADER) String token,
                                       @Nullable @Query("owner") String owner) {
        try {
            adminTokenGuard.require(token);
            long ownerRef = parseId(owner, "owner_required");
            return responses.json(200, queryService.overview(ownerRef, clock.instant()));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/api/channels/{channelId}")
    public HttpServerResponse status(@Nullable @Header(TOKEN_HEADER) String token,
                                     @Path("channelId") String channelId) {
        try {
            adminTokenGuard.require(token);
            return responses.json(200, queryService.status(parseId(channelId, "channel_id_invalid"), clock.instant()));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/api/channels/{channelId}/stats")
    public HttpServerResponse stats(@Nullable @Header(TOKEN_HEADER) String token,
                                    @Path("channelId") String channelId,
                                    @Nullable @Query("asOf") String asOf) {
        try {
            adminTokenGuard.require(token);
            long id = parseId(channelId, "channel_id_invalid");
            var stats = queryService.dailyStats(id, parseInstant(asOf))
                .map(ChannelApi.DailyStatsRecord::of)
                .orElseThrow(() -> ApiException.notFound("no_data"));
            return responses.json(200, stats);
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/api/channels/{channelId}/history")
    public HttpServerResponse history(@Nullable @Header(TOKEN_HEADER) String token,
                                      @Path("channelId") String channelId,
                                      @Nullable @Query("limit") Integer limit) {
        try {
            adminTokenGuard.require(token);
            return responses.json(200, queryService.history(parseId(channelId, "channel_id_invalid"), limit));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/api/channels/{channelId}/export")
    public HttpServerResponse export(@Nullable @Header(TOKEN_HEADER) String token,
                                     @Path("channelId") String channelId) {
        try {
            adminTokenGuard.require(token);
            return responses.json(200, queryService.export(parseId(channelId, "channel_id_invalid"), clock.instant()));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.GET, path = "/api/channels/{channelId}/key")
    public HttpServerResponse getKey(@Nullable @Header(TOKEN_HEADER) String token,
                                     @Path("channelId") String channelId) {
        try {
            adminTokenGuard.require(token);
            return responses.json(200, managementService.getKey(parseId(channelId, "channel_id_invalid")));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.POST, path = "/api/channels/{channelId}/rotate-key")
    public HttpServerResponse rotateKey(@Nullable @Header(TOKEN_HEADER) String token,
                                        @Path("channelId") String channelId) {
        try {
            adminTokenGuard.require(token);
            return responses.json(200, managementService.rotateKey(parseId(channelId, "channel_id_invalid")));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.PUT, path = "/api/channels/{channelId}/key")
    public HttpServerResponse replaceKey(@Nullable @Header(TOKEN_HEADER) String token,
                                         @Path("channelId") String channelId,
                                         @Json ChannelApi.ReplaceKeyRequest request) {
        try {
            adminTokenGuard.require(token);
            if (request == null) {
                throw ApiException.badRequest("request_body_required");
            }
            long id = parseId(channelId, "channel_id_invalid");
            return responses.json(200, managementService.replaceKey(id, request.secretKey()));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.PUT, path = "/api/channels/{channelId}/timezone")
    public HttpServerResponse setTimezone(@Nullable @Header(TOKEN_HEADER) String token,
                                          @Path("channelId") String channelId,
                                          @Json ChannelApi.TimezoneRequest request) {
        try {
            adminTokenGuard.require(token);
            if (request == null) {
                throw ApiException.badRequest("request_body_required");
            }
            managementService.setTimezone(parseId(channelId, "channel_id_invalid"), request.timezone());
            return responses.json(200, new ChannelApi.MessageResponse("ok"));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.PUT, path = "/api/channels/{channelId}/paused")
    public HttpServerResponse setPaused(@Nullable @Header(TOKEN_HEADER) String token,
                                        @Path("channelId") String channelId,
                                        @Json ChannelApi.PausedRequest request) {
        try {
            adminTokenGuard.require(token);
            if (request == null) {
                throw ApiException.badRequest("request_body_required");
            }
            managementService.setPaused(parseId(channelId, "channel_id_invalid"), request.paused());
            return responses.json(200, new ChannelApi.MessageResponse("ok"));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.PUT, path = "/api/channels/{channelId}/owner")
    public HttpServerResponse transfer(@Nullable @Header(TOKEN_HEADER) String token,
                                       @Path("channelId") String channelId,
                                       @Json ChannelApi.TransferRequest request) {
        try {
            adminTokenGuard.require(token);
            if (request == null) {
                throw ApiException.badRequest("request_body_required");
            }
            managementService.transferOwner(parseId(channelId, "channel_id_invalid"), request.ownerRef());
            return responses.json(200, new ChannelApi.MessageResponse("ok"));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    @HttpRoute(method = HttpMethod.DELETE, path = "/api/channels/{channelId}")
    public HttpServerResponse delete(@Nullable @Header(TOKEN_HEADER) String token,
                                     @Path("channelId") String channelId) {
        try {
            adminTokenGuard.require(token);
            managementService.deleteDevice(parseId(channelId, "channel_id_invalid"));
            return responses.json(200, new ChannelApi.MessageResponse("ok"));
        } catch (ApiException e) {
            return responses.fromException(e);
        } catch (Exception e) {
            return responses.internalError(e);
        }
    }

    private static long parseId(String value, String errorCode) {
        if (value == null || value.isBlank()) {
            throw ApiException.badRequest(errorCode);
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw ApiException.badRequest(errorCode);
        }
    }

    private Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return clock.instant();
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw ApiException.badRequest("as_of_invalid");
        }
    }
}
