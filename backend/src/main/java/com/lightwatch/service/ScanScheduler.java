package com.lightwatch.service;

import com.lightwatch.config.AppConfig;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.application.graph.Lifecycle;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.common.annotation.Root;

@Component
@Root
public final class ScanScheduler implements Lifecycle {
    private static final Logger logger = LoggerFactory.getLogger(ScanScheduler.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final TimeoutScanner scanner;
    private final Clock clock;
    private final Duration interval;
    private volatile ScheduledExecutorService executor;

    public ScanScheduler(TimeoutScanner scanner, MigrationRunner migrationRunner, Clock clock, AppConfig appConfig) {
        this.scanner = scanner;
        this.clock = clock;
        this.interval = appConfig.monitor().scanInterval();
    }

    @Override
    public void init() {
        ScheduledExecutorService scheduled = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "timeout-scanner");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = interval.toMillis();
        scheduled.scheduleAtFixedRate(this::tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        this.executor = scheduled;
        logger.info("Timeout scanner scheduled every {}", interval);
    }

    void tick() {
        try {
            ScanReport report = scanner.scan(clock.instant());
            if (report.transitioned() > 0 || report.failed() > 0) {
                logger.info("Timeout scan: {} expired, {} switched off, {} failed",
                    report.candidates(), report.transitioned(), report.failed());
            }
        } catch (RuntimeException e) {
            logger.error("Timeout scan aborted, retrying on next tick", e);
        }
    }

    @Override
    public void release() throws InterruptedException {
        ScheduledExecutorService scheduled = this.executor;
        if (scheduled == null) {
            return;
        }
        scheduled.shutdown();
        if (!scheduled.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
            logger.warn("Timeout scan still running after {}s, interrupting", SHUTDOWN_WAIT_SECONDS);
            scheduled.shutdownNow();
        }
        logger.info("Timeout scanner stopped");
    }
}
