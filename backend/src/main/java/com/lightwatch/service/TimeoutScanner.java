package com.lightwatch.service;

import com.lightwatch.config.AppConfig;
import com.lightwatch.dao.DeviceStore;
import com.lightwatch.domain.Device;
import com.lightwatch.domain.PowerState;
import com.lightwatch.domain.TransitionNotice;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class TimeoutScanner {
    private static final Logger logger = LoggerFactory.getLogger(TimeoutScanner.class);

    private final DeviceStore deviceStore;
    private final DeviceLocks deviceLocks;
    private final TransitionNotifier notifier;
    private final Duration gracePeriod;

    public TimeoutScanner(DeviceStore deviceStore,
                          DeviceLocks deviceLocks,
                          TransitionNotifier notifier,
                          AppConfig appConfig) {
        this.deviceStore = deviceStore;
        this.deviceLocks = deviceLocks;
        this.notifier = notifier;
        this.gracePeriod = appConfig.monitor().gracePeriod();
    }

    public ScanReport scan(Instant now) {
        List<Device> candidates = deviceStore.findExpired(now.minus(gracePeriod));
        int transitioned = 0;
        int failed = 0;
        for (Device candidate : candidates) {
            try {
                if (expire(candidate.id(), now)) {
                    transitioned++;
                }
            } catch (RuntimeException e) {
                failed++;
                logger.error("Timeout check failed for channel {}", candidate.id(), e);
            }
        }
        return new ScanReport(candidates.size(), transitioned, failed);
    }

    private boolean expire(long deviceId, Instant now) {
        Outage outage = deviceLocks.withLock(deviceId, () -> decide(deviceId, now));
        if (outage == null) {
            return false;
        }
        logger.info("Channel {} lost power at {}", deviceId, outage.at());
        notifier.committed(deviceId, TransitionNotice.Direction.LOST, outage.at(), outage.elapsed(), now);
        return true;
    }

    private Outage decide(long deviceId, Instant now) {
        Optional<Device> current = deviceStore.findById(deviceId);
        if (current.isEmpty()) {
            return null;
        }
        Device device = current.get();
        Instant lastSeen = device.lastSeen();
        if (device.state() != PowerState.ON || device.paused() || lastSeen == null) {
            return null;
        }
        if (Duration.between(lastSeen, now).compareTo(gracePeriod) <= 0) {
            return null;
        }

        Instant lastChange = device.lastChange();
        Instant at = lastChange != null && lastSeen.isBefore(lastChange) ? lastChange : lastSeen;
        boolean committed = deviceStore.commitTransition(
            new DeviceStore.Transition(deviceId, PowerState.ON, PowerState.OFF, at, lastSeen)
        );
        if (!committed) {
            return null;
        }
        return new Outage(at, lastChange == null ? null : Duration.between(lastChange, at));
    }

    private record Outage(Instant at, Duration elapsed) {
    }
}
