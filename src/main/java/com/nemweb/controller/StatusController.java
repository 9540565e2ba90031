package com.nemweb.controller;

import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;
import com.nemweb.model.RegionSnapshot;
import com.nemweb.model.SeriesSnapshot;
import com.nemweb.region.RegionManager;
import com.nemweb.region.RegionPipeline;
import com.nemweb.store.ForecastStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints for health monitoring and service introspection.
 */
@RestController
public class StatusController {

    private final RegionManager regionManager;
    private final ForecastStore store;

    public StatusController(RegionManager regionManager, ForecastStore store) {
        this.regionManager = regionManager;
        this.store = store;
    }

    /**
     * Simple liveness check.
     * GET /ping → {"status": "ok"}
     */
    @GetMapping("/ping")
    public ResponseEntity<Map<String, String>> ping() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * Detailed service status.
     * GET /status → active regions, per-product staleness and poller counters.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> regions = new LinkedHashMap<>();
        for (Region region : regionManager.activeRegions()) {
            regions.put(region.getCode(), regionStatus(region));
        }

        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", store.now().getEpochSecond(),
                "activeRegions", regionManager.activeRegions().stream().map(Region::getCode).toList(),
                "storedSeries", store.size(),
                "regions", regions,
                "supportedRegions", Arrays.asList(Region.supportedCodes()),
                "supportedProducts", Arrays.asList(ProductKind.supportedLabels())
        ));
    }

    /**
     * Lists all supported products.
     * GET /products → ["realtime", "five_minute", "predispatch"]
     */
    @GetMapping("/products")
    public ResponseEntity<List<String>> products() {
        return ResponseEntity.ok(
                Arrays.stream(ProductKind.values()).map(ProductKind::getLabel).toList()
        );
    }

    private Map<String, Object> regionStatus(Region region) {
        RegionSnapshot snapshot = store.readRegion(region);
        Map<String, Object> products = new LinkedHashMap<>();
        for (ProductKind kind : ProductKind.values()) {
            Map<String, Object> product = new LinkedHashMap<>();
            SeriesSnapshot series = snapshot.product(kind).orElse(null);
            product.put("available", series != null);
            if (series != null) {
                product.put("stale", series.stale());
                product.put("points", series.series().size());
                product.put("last_update", series.lastSuccessfulUpdate().toString());
                product.put("source_file", series.series().sourceFile());
            }
            regionManager.pipeline(region)
                    .map(RegionPipeline::stats)
                    .map(stats -> stats.get(kind))
                    .ifPresent(stats -> product.put("poller", stats));
            products.put(kind.getLabel(), product);
        }

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("name", region.getDisplayName());
        status.put("stale", snapshot.stale());
        status.put("last_update", snapshot.lastSuccessfulUpdate().map(Object::toString).orElse(null));
        status.put("products", products);
        return status;
    }
}
