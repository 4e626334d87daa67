package com.lightwatch.service;

import com.lightwatch.dao.DeviceStore;
import com.lightwatch.domain.Device;
import com.lightwatch.domain.HeartbeatResult;
import com.lightwatch.domain.PowerState;
import com.lightwatch.domain.TransitionNotice;
import com.lightwatch.security.SecretHashService;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class HeartbeatProcessor {
    private static final Logger logger = LoggerFactory.getLogger(HeartbeatProcessor.class);

    private final DeviceStore deviceStore;
    private final DeviceLocks deviceLocks;
    private final SecretHashService secretHashService;
    private final TransitionNotifier notifier;

    public HeartbeatProcessor(DeviceStore deviceStore,
                              DeviceLocks deviceLocks,
                              SecretHashService secretHashService,
                              TransitionNotifier notifier) {
        this.deviceStore = deviceStore;
        this.deviceLocks = deviceLocks;
        this.secretHashService = secretHashService;
        this.notifier = notifier;
    }

    public HeartbeatResult process(String channelKey, Instant arrival) {
        if (channelKey == null || channelKey.isBlank()) {
            return HeartbeatResult.invalidKey();
        }

        String secretHash = secretHashService.sha256Hex(channelKey.trim());
        Optional<Device> match = deviceStore.findBySecretHash(secretHash);
        if (match.isEmpty()) {
            logger.debug("Heartbeat rejected: unknown channel key");
            return HeartbeatResult.invalidKey();
        }

        long deviceId = match.get().id();
        Applied applied = deviceLocks.withLock(deviceId, () -> apply(deviceId, secretHash, arrival));
        if (applied.kind() == Kind.REJECTED) {
            return HeartbeatResult.invalidKey();
        }
        if (applied.kind() == Kind.REFRESHED) {
            return HeartbeatResult.accepted(deviceId, false);
        }

        logger.info("Channel {} power restored at {}", deviceId, applied.at());
        notifier.committed(deviceId, TransitionNotice.Direction.RECOVERED, applied.at(), applied.elapsed(), arrival);
        return HeartbeatResult.accepted(deviceId, true);
    }

    private Applied apply(long deviceId, String secretHash, Instant arrival) {
        Optional<Device> current = deviceStore.findById(deviceId);
        if (current.isEmpty() || !secretHash.equals(current.get().secretHash())) {
            return Applied.of(Kind.REJECTED);
        }

        Device device = current.get();
        if (device.state() == PowerState.ON) {
            deviceStore.touchLastSeen(deviceId, arrival);
            return Applied.of(Kind.REFRESHED);
        }

        Instant lastChange = device.lastChange();
        Instant at = lastChange != null && arrival.isBefore(lastChange) ? lastChange : arrival;
        boolean committed = deviceStore.commitTransition(
            new DeviceStore.Transition(deviceId, device.state(), PowerState.ON, at, arrival)
        );
        if (!committed) {
            logger.debug("Channel {} changed state concurrently, heartbeat only refreshes last_seen", deviceId);
            deviceStore.touchLastSeen(deviceId, arrival);
            return Applied.of(Kind.REFRESHED);
        }
        return new Applied(Kind.RECOVERED, at, lastChange == null ? null : Duration.between(lastChange, at));
    }

    private enum Kind {
        REJECTED,
        REFRESHED,
        RECOVERED
    }

    private record Applied(Kind kind, Instant at, Duration elapsed) {
        static Applied of(Kind kind) {
            return new Applied(kind, null, null);
        }
    }
}
