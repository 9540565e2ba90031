package com.nemweb.region;

import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;
import com.nemweb.scheduler.PollScheduler;
import com.nemweb.scheduler.PollerStats;
import com.nemweb.scheduler.ProductPoller;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Everything that polls one region: its fetcher, parser and one poller per product, driven by
 * its own timers. Pipelines share nothing mutable except the store they write to.
 */
public class RegionPipeline {

    private final Region region;
    private final PollScheduler scheduler;

    public RegionPipeline(Region region, PollScheduler scheduler) {
        this.region = region;
        this.scheduler = scheduler;
    }

    public void start() {
        scheduler.start();
    }

    /**
     * @return true if every in-flight cycle finished within {@code grace}
     */
    public boolean stop(Duration grace) {
        return scheduler.stop(grace);
    }

    /**
     * Cancel timers and interrupt in-flight cycles without waiting.
     */
    public void cancel() {
        scheduler.cancel();
    }

    /**
     * @param deadlineNanos {@link System#nanoTime()} value to wait until
     * @return true if every in-flight cycle finished before the deadline
     */
    public boolean awaitDrained(long deadlineNanos) {
        return scheduler.awaitDrained(deadlineNanos);
    }

    public boolean isRunning() {
        return scheduler.isRunning();
    }

    public Region getRegion() {
        return region;
    }

    public Map<ProductKind, PollerStats> stats() {
        Map<ProductKind, PollerStats> stats = new EnumMap<>(ProductKind.class);
        for (ProductPoller poller : scheduler.getPollers()) {
            stats.put(poller.getKind(), poller.stats());
        }
        return stats;
    }
}
