package com.lightwatch.notify;

import com.lightwatch.config.AppConfig;
import com.lightwatch.domain.TransitionNotice;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.application.graph.Lifecycle;
import ru.tinkoff.kora.common.Component;

@Component
public final class NotificationPublisher implements Lifecycle {
    private static final Logger logger = LoggerFactory.getLogger(NotificationPublisher.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private final NotificationDispatcher dispatcher;
    private final ExecutorService executor;

    public NotificationPublisher(NotificationDispatcher dispatcher, AppConfig appConfig) {
        this.dispatcher = dispatcher;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, appConfig.notifications().threads()), r -> {
            Thread thread = new Thread(r, "notify-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void publish(TransitionNotice notice) {
        try {
            executor.execute(() -> deliver(notice));
        } catch (RejectedExecutionException e) {
            logger.warn("Notification for channel {} dropped: publisher is shut down", notice.deviceId());
        }
    }

    private void deliver(TransitionNotice notice) {
        try {
            dispatcher.dispatch(notice);
        } catch (RuntimeException e) {
            logger.warn("Notification {} for channel {} not delivered: {}",
                notice.direction(), notice.deviceId(), e.getMessage(), e);
        }
    }

    @Override
    public void init() {
        logger.info("Notification publisher started with {}", dispatcher.getClass().getSimpleName());
    }

    @Override
    public void release() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
            logger.warn("Pending notifications abandoned after {}s", SHUTDOWN_WAIT_SECONDS);
            executor.shutdownNow();
        }
    }
}
