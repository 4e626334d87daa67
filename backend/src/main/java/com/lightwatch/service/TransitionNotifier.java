package com.lightwatch.service;

import com.lightwatch.dao.DeviceStore;
import com.lightwatch.domain.DailyStats;
import com.lightwatch.domain.Device;
import com.lightwatch.domain.TransitionNotice;
import com.lightwatch.notify.NotificationPublisher;
import jakarta.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class TransitionNotifier {
    private static final Logger logger = LoggerFactory.getLogger(TransitionNotifier.class);

    private final DeviceStore deviceStore;
    private final StatsAggregator statsAggregator;
    private final NotificationPublisher publisher;

    public TransitionNotifier(DeviceStore deviceStore,
                              StatsAggregator statsAggregator,
                              NotificationPublisher publisher) {
        this.deviceStore = deviceStore;
        this.statsAggregator = statsAggregator;
        this.publisher = publisher;
    }

    public void committed(long deviceId,
                          TransitionNotice.Direction direction,
                          Instant occurredAt,
                          @Nullable Duration elapsedSincePriorChange,
                          Instant now) {
        try {
            Optional<Device> device = deviceStore.findById(deviceId);
            if (device.isEmpty()) {
                return;
            }
            DailyStats stats = statsAggregator.dailyStats(device.get(), now).orElse(null);
            publisher.publish(new TransitionNotice(
                deviceId,
                direction,
                occurredAt,
                elapsedSincePriorChange,
                stats,
                device.get().timezone()
            ));
        } catch (RuntimeException e) {
            logger.warn("Cannot compose {} notice for channel {}", direction, deviceId, e);
        }
    }
}
