package io.ringcluster.transport.impl;

import io.ringcluster.transport.type.Notification;
import io.ringcluster.transport.type.NotificationSink;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Interval timers of the reactor: emits {@link Notification.Tick} and
 * {@link Notification.ExecutorTick} into the same sink as socket events.
 */
@Slf4j
public final class TickScheduler implements AutoCloseable {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "cluster-ticker");
        t.setDaemon(true);
        return t;
    });

    private final long tickMillis;
    private final long executorTickMillis;

    public TickScheduler(final long tickMillis, final long executorTickMillis) {
        this.tickMillis = tickMillis;
        this.executorTickMillis = executorTickMillis;
    }

    public void start(final NotificationSink sink) {
        scheduler.scheduleAtFixedRate(() -> sink.deliver(List.of(new Notification.Tick())),
                tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(() -> sink.deliver(List.of(new Notification.ExecutorTick())),
                executorTickMillis, executorTickMillis, TimeUnit.MILLISECONDS);
        log.debug("Tick timers armed: tick={}ms executorTick={}ms", tickMillis, executorTickMillis);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                log.warn("Tick scheduler did not terminate within 1s");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
