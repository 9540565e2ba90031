package com.nemweb.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the timers of a group of pollers. Each poller gets its own fixed-rate timer with its
 * product's cadence and a jittered first tick, so cadences never depend on one another.
 */
public class PollScheduler {

    private static final Logger log = LoggerFactory.getLogger(PollScheduler.class);

    private static final long DRAIN_POLL_MS = 10;

    private final TaskScheduler taskScheduler;
    private final PollerSettings settings;
    private final List<ProductPoller> pollers;

    /** Guarded by {@code this}. */
    private final List<ScheduledFuture<?>> timers = new ArrayList<>();

    public PollScheduler(TaskScheduler taskScheduler, PollerSettings settings, List<ProductPoller> pollers) {
        this.taskScheduler = taskScheduler;
        this.settings = settings;
        this.pollers = List.copyOf(pollers);
    }

    public synchronized void start() {
        if (!timers.isEmpty()) {
            return;
        }
        Instant now = Instant.now();
        for (ProductPoller poller : pollers) {
            Duration cadence = settings.cadence(poller.getKind());
            Duration jitter = settings.initialJitter(poller.getKind());
            timers.add(taskScheduler.scheduleAtFixedRate(poller::tick, now.plus(jitter), cadence));
            log.info("[{}/{}] Polling every {}ms, first tick in {}ms",
                    poller.getRegion(), poller.getKind().getLabel(), cadence.toMillis(), jitter.toMillis());
        }
    }

    /**
     * Cancel all timers, interrupt in-flight cycles and wait up to {@code grace} for them to finish.
     *
     * @return true if no cycle was still in flight when this returned
     */
    public boolean stop(Duration grace) {
        cancel();
        return awaitDrained(System.nanoTime() + grace.toNanos());
    }

    /**
     * Cancel all timers and interrupt in-flight cycles without waiting for them.
     */
    public synchronized void cancel() {
        timers.forEach(timer -> timer.cancel(false));
        timers.clear();
        pollers.forEach(ProductPoller::cancel);
    }

    /**
     * Wait until no cycle is in flight or until {@code deadlineNanos} (a {@link System#nanoTime()} value).
     *
     * @return true if every cycle finished before the deadline
     */
    public boolean awaitDrained(long deadlineNanos) {
        while (pollers.stream().anyMatch(ProductPoller::isInFlight)) {
            if (System.nanoTime() - deadlineNanos >= 0) {
                log.warn("Grace period elapsed with cycles still in flight");
                return false;
            }
            try {
                Thread.sleep(DRAIN_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    public synchronized boolean isRunning() {
        return !timers.isEmpty();
    }

    public List<ProductPoller> getPollers() {
        return pollers;
    }
}
