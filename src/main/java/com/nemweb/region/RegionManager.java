package com.nemweb.region;

import com.nemweb.model.Region;
import com.nemweb.scheduler.PollerSettings;
import com.nemweb.store.ForecastStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Central orchestration service that:
 * <ul>
 *   <li>Maintains one {@link RegionPipeline} per configured region</li>
 *   <li>Starts the regions listed in {@code nemweb.regions} once the application is ready</li>
 *   <li>Adds and removes regions at runtime without touching other pipelines</li>
 *   <li>Stops every pipeline on shutdown within the configured grace period</li>
 * </ul>
 */
@Service
public class RegionManager {

    private static final Logger log = LoggerFactory.getLogger(RegionManager.class);

    private final ForecastStore store;
    private final RegionPipelineFactory pipelineFactory;
    private final PollerSettings settings;
    private final List<String> configuredRegions;
    private final boolean pollingEnabled;

    private final ConcurrentMap<Region, RegionPipeline> pipelines = new ConcurrentHashMap<>();

    public RegionManager(
            ForecastStore store,
            RegionPipelineFactory pipelineFactory,
            PollerSettings settings,
            @Value("${nemweb.regions:NSW1}") List<String> configuredRegions,
            @Value("${nemweb.polling.enabled:true}") boolean pollingEnabled) {
        this.store = store;
        this.pipelineFactory = pipelineFactory;
        this.settings = settings;
        this.configuredRegions = configuredRegions;
        this.pollingEnabled = pollingEnabled;
    }

    /**
     * Start a pipeline for every configured region. An invalid code is logged and skipped;
     * it does not prevent the other regions from starting.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void startConfiguredRegions() {
        if (!pollingEnabled) {
            log.info("Polling disabled; configured regions {} not started", configuredRegions);
            return;
        }
        for (String code : configuredRegions) {
            try {
                addRegion(code);
            } catch (RegionConfigException e) {
                log.error("Skipping configured region: {}", e.getMessage());
            }
        }
    }

    /**
     * Create and start the pipeline for a region code.
     *
     * @throws RegionConfigException if the code is not a NEM region
     */
    public RegionPipeline addRegion(String code) {
        Region region = Region.fromCode(code).orElseThrow(() -> new RegionConfigException(code));
        return addRegion(region);
    }

    /**
     * Create and start the pipeline for a region. Returns the running pipeline if there already is one.
     */
    public RegionPipeline addRegion(Region region) {
        RegionPipeline existing = pipelines.get(region);
        if (existing != null) {
            return existing;
        }
        RegionPipeline created = pipelineFactory.create(region);
        existing = pipelines.putIfAbsent(region, created);
        if (existing != null) {
            return existing;
        }
        created.start();
        log.info("Started pipeline for region={} ({})", region, region.getDisplayName());
        return created;
    }

    /**
     * Stop a region's pipeline and drop its stored series.
     *
     * @return false if the region had no pipeline
     * @throws RegionConfigException if the code is not a NEM region
     */
    public boolean removeRegion(String code) {
        Region region = Region.fromCode(code).orElseThrow(() -> new RegionConfigException(code));
        return removeRegion(region);
    }

    public boolean removeRegion(Region region) {
        RegionPipeline pipeline = pipelines.remove(region);
        if (pipeline == null) {
            return false;
        }
        boolean drained = pipeline.stop(settings.shutdownGrace());
        store.removeRegion(region);
        log.info("Removed pipeline for region={} (drained={})", region, drained);
        return true;
    }

    /**
     * Returns the regions that currently have a pipeline, in code order.
     */
    public List<Region> activeRegions() {
        return pipelines.keySet().stream()
                .sorted(Comparator.comparing(Region::getCode))
                .toList();
    }

    public Optional<RegionPipeline> pipeline(Region region) {
        return Optional.ofNullable(pipelines.get(region));
    }

    /**
     * Periodic one-line status per region.
     */
    @Scheduled(fixedRateString = "${nemweb.status-log.interval-ms:60000}",
            initialDelayString = "${nemweb.status-log.interval-ms:60000}")
    public void logStatus() {
        pipelines.values().forEach(pipeline ->
                log.debug("Polling status: region={} stale={} pollers={}",
                        pipeline.getRegion(), store.readRegion(pipeline.getRegion()).stale(), pipeline.stats()));
    }

    /**
     * On shutdown, stop every pipeline so no timer or request outlives the context. All pipelines
     * are cancelled first and then share a single grace period.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutdown: stopping {} region pipelines", pipelines.size());
        List<RegionPipeline> stopping = List.copyOf(pipelines.values());
        pipelines.clear();
        stopping.forEach(RegionPipeline::cancel);

        long deadline = System.nanoTime() + settings.shutdownGrace().toNanos();
        for (RegionPipeline pipeline : stopping) {
            boolean drained = pipeline.awaitDrained(deadline);
            log.info("Stopped pipeline for region={} (drained={})", pipeline.getRegion(), drained);
        }
    }
}
