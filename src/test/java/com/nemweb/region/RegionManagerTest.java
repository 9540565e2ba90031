package com.nemweb.region;

import com.nemweb.BundleFixtures;
import com.nemweb.fetcher.ReportFetcher;
import com.nemweb.model.ForecastSeries;
import com.nemweb.model.PricePoint;
import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;
import com.nemweb.model.ReportBundle;
import com.nemweb.parser.ReportParser;
import com.nemweb.scheduler.PollScheduler;
import com.nemweb.scheduler.PollerSettings;
import com.nemweb.scheduler.ProductPoller;
import com.nemweb.store.ForecastStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RegionManager")
class RegionManagerTest {

    private static final PollerSettings SLOW = new PollerSettings(
            Map.of(ProductKind.REALTIME, Duration.ofHours(1),
                    ProductKind.FIVE_MINUTE, Duration.ofHours(1),
                    ProductKind.PREDISPATCH, Duration.ofHours(1)),
            3, Duration.ZERO, Duration.ofMillis(500));

    private static final PollerSettings SHORT_GRACE = new PollerSettings(
            SLOW.cadences(), 3, Duration.ZERO, Duration.ofMillis(300));

    private ThreadPoolTaskScheduler timers;
    private ThreadPoolTaskExecutor workers;
    private ForecastStore store;
    private final List<ProductPoller> blockedPollers = new ArrayList<>();
    private final List<Region> created = new ArrayList<>();

    @BeforeEach
    void setUp() {
        timers = new ThreadPoolTaskScheduler();
        timers.setPoolSize(1);
        timers.initialize();
        workers = new ThreadPoolTaskExecutor();
        workers.setCorePoolSize(4);
        workers.initialize();
        store = new ForecastStore(Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        timers.shutdown();
        workers.shutdown();
    }

    /**
     * Pipelines whose pollers never find anything new, with hour-long cadences.
     */
    private RegionPipeline idlePipeline(Region region) {
        created.add(region);
        List<ProductPoller> pollers = new ArrayList<>();
        for (ProductKind kind : ProductKind.values()) {
            pollers.add(new ProductPoller(region, kind, (r, k, previous) -> Optional.empty(), new ReportParser(),
                    store, new TaskExecutorAdapter(Runnable::run), SLOW.failureThreshold()));
        }
        return new RegionPipeline(region, new PollScheduler(timers, SLOW, pollers));
    }

    /**
     * Pipelines with a single realtime poller whose fetch blocks until {@code release} opens,
     * ignoring interrupts, and then returns a bundle for the region.
     */
    private RegionPipeline blockedPipeline(Region region, CountDownLatch entered, CountDownLatch release) {
        ReportBundle bundle = BundleFixtures.bundle("PUBLIC_DISPATCHIS_202512251520_1.zip", BundleFixtures.csv(
                BundleFixtures.DISPATCH_HEADER,
                BundleFixtures.dispatchRow("2025/12/25 15:20:00", region.getCode(), "120.0")));
        ReportFetcher fetcher = (r, k, previous) -> {
            entered.countDown();
            while (true) {
                try {
                    release.await();
                    return Optional.of(bundle);
                } catch (InterruptedException e) {
                    // a read that does not respond to interrupts
                }
            }
        };
        ProductPoller poller = new ProductPoller(region, ProductKind.REALTIME, fetcher, new ReportParser(), store,
                workers, SHORT_GRACE.failureThreshold());
        blockedPollers.add(poller);
        return new RegionPipeline(region, new PollScheduler(timers, SHORT_GRACE, List.of(poller)));
    }

    private boolean awaitIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (blockedPollers.stream().anyMatch(ProductPoller::isInFlight)) {
            if (System.currentTimeMillis() > deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    private RegionManager manager(List<String> configured) {
        return new RegionManager(store, this::idlePipeline, SLOW, configured, true);
    }

    @Test
    @DisplayName("configured regions start and invalid codes are skipped")
    void startsConfiguredRegions() {
        RegionManager manager = manager(List.of("NSW1", "XX9", "vic1"));

        manager.startConfiguredRegions();

        assertThat(manager.activeRegions()).containsExactly(Region.NSW1, Region.VIC1);
        assertThat(manager.pipeline(Region.NSW1)).map(RegionPipeline::isRunning).contains(true);
        manager.shutdown();
    }

    @Test
    @DisplayName("nothing starts when polling is disabled")
    void pollingDisabled() {
        RegionManager manager = new RegionManager(store, this::idlePipeline, SLOW, List.of("NSW1"), false);

        manager.startConfiguredRegions();

        assertThat(manager.activeRegions()).isEmpty();
        assertThat(created).isEmpty();
    }

    @Test
    @DisplayName("adding an unsupported region raises a configuration error naming the code")
    void invalidRegion() {
        RegionManager manager = manager(List.of());

        assertThatThrownBy(() -> manager.addRegion("WA1"))
                .isInstanceOf(RegionConfigException.class)
                .hasMessageContaining("WA1")
                .hasMessageContaining("NSW1");
        assertThat(manager.activeRegions()).isEmpty();
    }

    @Test
    @DisplayName("adding a region twice keeps the running pipeline")
    void addIsIdempotent() {
        RegionManager manager = manager(List.of());

        RegionPipeline first = manager.addRegion("SA1");
        RegionPipeline second = manager.addRegion(Region.SA1);

        assertThat(second).isSameAs(first);
        assertThat(created).containsExactly(Region.SA1);
        manager.shutdown();
    }

    @Test
    @DisplayName("removing a region stops its pipeline and drops only its data")
    void removeRegion() {
        RegionManager manager = manager(List.of());
        RegionPipeline qld = manager.addRegion("QLD1");
        manager.addRegion("TAS1");
        Instant now = Instant.now();
        store.update(new ForecastSeries(Region.QLD1, ProductKind.REALTIME, List.of(new PricePoint(now, 40.0)), now, "a.zip"));
        store.update(new ForecastSeries(Region.TAS1, ProductKind.REALTIME, List.of(new PricePoint(now, 30.0)), now, "a.zip"));

        assertThat(manager.removeRegion("QLD1")).isTrue();

        assertThat(qld.isRunning()).isFalse();
        assertThat(manager.activeRegions()).containsExactly(Region.TAS1);
        assertThat(store.read(Region.QLD1, ProductKind.REALTIME)).isEmpty();
        assertThat(store.read(Region.TAS1, ProductKind.REALTIME)).isPresent();
        assertThat(manager.removeRegion("QLD1")).isFalse();
        manager.shutdown();
    }

    @Test
    @DisplayName("shutdown stops every pipeline")
    void shutdownStopsAll() {
        RegionManager manager = manager(List.of("NSW1", "VIC1"));
        manager.startConfiguredRegions();
        RegionPipeline nsw = manager.pipeline(Region.NSW1).orElseThrow();

        manager.shutdown();

        assertThat(nsw.isRunning()).isFalse();
        assertThat(manager.activeRegions()).isEmpty();
    }

    @Test
    @DisplayName("a cycle that finishes after its region was removed leaves nothing in the store")
    void removedRegionStaysEmpty() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RegionManager manager = new RegionManager(store, region -> blockedPipeline(region, entered, release),
                SHORT_GRACE, List.of(), true);

        manager.addRegion("SA1");
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(manager.removeRegion("SA1")).isTrue();
        release.countDown();

        assertThat(awaitIdle()).isTrue();
        assertThat(manager.activeRegions()).isEmpty();
        assertThat(store.read(Region.SA1, ProductKind.REALTIME)).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("shutdown waits one grace period for all pipelines together")
    void shutdownSharesGracePeriod() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(3);
        CountDownLatch release = new CountDownLatch(1);
        RegionManager manager = new RegionManager(store, region -> blockedPipeline(region, entered, release),
                SHORT_GRACE, List.of("NSW1", "VIC1", "QLD1"), true);
        manager.startConfiguredRegions();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        long started = System.nanoTime();
        manager.shutdown();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        release.countDown();

        assertThat(elapsed).isLessThan(SHORT_GRACE.shutdownGrace().multipliedBy(2));
        assertThat(manager.activeRegions()).isEmpty();
        assertThat(awaitIdle()).isTrue();
        assertThat(store.size()).isZero();
    }
}
