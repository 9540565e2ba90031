package com.nemweb.scheduler;

import com.nemweb.fetcher.FetchException;
import com.nemweb.fetcher.ReportFetcher;
import com.nemweb.model.ForecastSeries;
import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;
import com.nemweb.model.ReportBundle;
import com.nemweb.parser.ReportParser;
import com.nemweb.store.ForecastStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs fetch/parse/update cycles for a single (region, product) pair.
 *
 * <p>{@link #tick()} is called from a timer thread and only hands the cycle to the worker
 * executor. At most one cycle per poller is in flight: a tick that arrives while a cycle is
 * running is dropped, not queued, so cycle N has always committed (or failed) before cycle
 * N+1 fetches.
 *
 * <p>Every error of a cycle is absorbed here. Failures increment a consecutive-failure counter;
 * once it reaches the threshold the store marks the key stale, keeping the last good series.
 *
 * <p>Once {@link #cancel()} has been called the poller is finished: no further cycle is
 * dispatched and a cycle still running never commits to the store.
 */
public class ProductPoller {

    private static final Logger log = LoggerFactory.getLogger(ProductPoller.class);

    private final Region region;
    private final ProductKind kind;
    private final ReportFetcher fetcher;
    private final ReportParser parser;
    private final ForecastStore store;
    private final AsyncTaskExecutor worker;
    private final int failureThreshold;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong cycles = new AtomicLong(0);
    private final AtomicLong updates = new AtomicLong(0);
    private final AtomicLong failures = new AtomicLong(0);
    private final AtomicLong droppedTicks = new AtomicLong(0);

    /** File name of the last bundle committed to the store. Only written by the in-flight cycle. */
    private volatile String lastIdentifier;
    private volatile CycleOutcome lastOutcome;
    private volatile Future<?> current;
    private volatile boolean stopped;
    /** Orders {@link #cancel()} against store commits; no commit happens once cancel returns. */
    private final Object commitLock = new Object();
    /** Claimed by whichever comes first: the dispatched cycle starting, or its cancellation. */
    private volatile AtomicBoolean currentClaim;

    public ProductPoller(Region region, ProductKind kind, ReportFetcher fetcher, ReportParser parser,
                         ForecastStore store, AsyncTaskExecutor worker, int failureThreshold) {
        this.region = region;
        this.kind = kind;
        this.fetcher = fetcher;
        this.parser = parser;
        this.store = store;
        this.worker = worker;
        this.failureThreshold = failureThreshold;
    }

    /**
     * Timer entry point. Dispatches a cycle unless one is already in flight.
     *
     * @return true if a cycle was dispatched
     */
    public boolean tick() {
        if (stopped) {
            return false;
        }
        if (!inFlight.compareAndSet(false, true)) {
            long dropped = droppedTicks.incrementAndGet();
            log.debug("[{}/{}] Tick dropped, cycle still in flight (dropped={})", region, kind.getLabel(), dropped);
            return false;
        }
        AtomicBoolean claim = new AtomicBoolean(false);
        currentClaim = claim;
        try {
            current = worker.submit(() -> runAndRelease(claim));
            return true;
        } catch (TaskRejectedException e) {
            inFlight.set(false);
            log.warn("[{}/{}] Cycle rejected by worker pool: {}", region, kind.getLabel(), e.getMessage());
            return false;
        }
    }

    private void runAndRelease(AtomicBoolean claim) {
        if (!claim.compareAndSet(false, true)) {
            return;
        }
        try {
            runCycle();
        } finally {
            current = null;
            inFlight.set(false);
        }
    }

    /**
     * Execute one cycle on the calling thread.
     * Callers outside {@link #tick()} must not run cycles for the same poller concurrently.
     */
    public CycleOutcome runCycle() {
        cycles.incrementAndGet();
        CycleOutcome outcome;
        try {
            Optional<ReportBundle> bundle = fetcher.fetch(region, kind, lastIdentifier);
            if (bundle.isEmpty()) {
                consecutiveFailures.set(0);
                outcome = CycleOutcome.UNCHANGED;
            } else {
                ForecastSeries series = parser.decode(bundle.get(), region, kind);
                outcome = commit(series, bundle.get().fileName());
            }
        } catch (FetchException e) {
            if (e.getKind() == FetchException.Kind.NOT_FOUND) {
                log.debug("[{}/{}] Nothing new this cycle: {}", region, kind.getLabel(), e.getMessage());
                outcome = CycleOutcome.NO_DATA;
            } else {
                outcome = fail(e);
            }
        } catch (RuntimeException e) {
            outcome = fail(e);
        }
        lastOutcome = outcome;
        return outcome;
    }

    private CycleOutcome commit(ForecastSeries series, String identifier) {
        synchronized (commitLock) {
            if (isCancelled()) {
                log.debug("[{}/{}] Poller stopped, discarding {}", region, kind.getLabel(), series.sourceFile());
                return CycleOutcome.CANCELLED;
            }
            store.update(series);
        }
        lastIdentifier = identifier;
        consecutiveFailures.set(0);
        updates.incrementAndGet();
        log.info("[{}/{}] Updated from {}: {} points", region, kind.getLabel(), series.sourceFile(), series.size());
        return CycleOutcome.UPDATED;
    }

    private CycleOutcome fail(RuntimeException e) {
        if (isCancelled()) {
            log.debug("[{}/{}] Cycle interrupted by stop: {}", region, kind.getLabel(), e.getMessage());
            return CycleOutcome.CANCELLED;
        }
        int consecutive = consecutiveFailures.incrementAndGet();
        failures.incrementAndGet();
        log.warn("[{}/{}] Cycle failed ({} consecutive): {}", region, kind.getLabel(), consecutive, e.getMessage());
        if (consecutive >= failureThreshold) {
            store.markStale(region, kind).ifPresent(snapshot -> {
                if (consecutive == failureThreshold) {
                    log.warn("[{}/{}] Marked stale after {} consecutive failures; keeping series from {}",
                            region, kind.getLabel(), consecutive, snapshot.series().sourceFile());
                }
            });
        }
        return CycleOutcome.FAILED;
    }

    private boolean isCancelled() {
        return stopped || Thread.currentThread().isInterrupted();
    }

    /**
     * Stop the poller and interrupt the in-flight cycle, if any. A started cycle releases the
     * single-flight slot when it unwinds; a cycle cancelled before it started is released here.
     */
    public void cancel() {
        synchronized (commitLock) {
            stopped = true;
        }
        Future<?> running = current;
        AtomicBoolean claim = currentClaim;
        if (running != null && running.cancel(true) && claim != null && claim.compareAndSet(false, true)) {
            current = null;
            inFlight.set(false);
        }
    }

    public boolean isStopped() {
        return stopped;
    }

    public boolean isInFlight() {
        return inFlight.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public PollerStats stats() {
        return new PollerStats(cycles.get(), updates.get(), failures.get(), consecutiveFailures.get(),
                droppedTicks.get(), lastOutcome, lastIdentifier);
    }

    public Region getRegion() {
        return region;
    }

    public ProductKind getKind() {
        return kind;
    }
}
