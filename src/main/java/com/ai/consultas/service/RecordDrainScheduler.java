package com.ai.consultas.service;

import com.ai.consultas.config.FormBotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link QueuedRecordSink#drain()} on a fixed delay from its own timer thread.
 * Stopping performs one last drain so queued records survive an orderly shutdown.
 */
@Component
public class RecordDrainScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RecordDrainScheduler.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private final QueuedRecordSink sink;
    private final Duration interval;

    private ScheduledExecutorService executor;
    private volatile boolean running;

    public RecordDrainScheduler(QueuedRecordSink sink, FormBotProperties properties) {
        this.sink = sink;
        this.interval = properties.getDrainInterval();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "record-drain");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = Math.max(1L, interval.toMillis());
        executor.scheduleWithFixedDelay(this::drainSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
        running = true;
        log.info("Record drain scheduled every {} ms", periodMs);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Record drain did not finish in {}s, forcing shutdown", SHUTDOWN_WAIT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            running = false;
        }
        int remaining = sink.drain();
        log.info("Record drain stopped ({} record(s) flushed on shutdown)", remaining);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void drainSafely() {
        try {
            sink.drain();
        } catch (RuntimeException e) {
            // a thrown task would cancel every later run
            log.error("Record drain run failed", e);
        }
    }
}
