package com.nemweb.controller;

import com.nemweb.model.Region;
import com.nemweb.region.RegionConfigException;
import com.nemweb.region.RegionManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Runtime management of the polled regions.
 */
@RestController
@RequestMapping("/regions")
public class RegionController {

    private final RegionManager regionManager;

    public RegionController(RegionManager regionManager) {
        this.regionManager = regionManager;
    }

    /**
     * GET /regions → ["NSW1", "VIC1"]
     */
    @GetMapping
    public ResponseEntity<List<String>> regions() {
        return ResponseEntity.ok(regionManager.activeRegions().stream().map(Region::getCode).toList());
    }

    /**
     * PUT /regions/SA1 starts polling SA1. Idempotent.
     */
    @PutMapping("/{code}")
    public ResponseEntity<?> add(@PathVariable String code) {
        try {
            Region region = regionManager.addRegion(code).getRegion();
            return ResponseEntity.ok(Map.of("region", region.getCode(), "status", "polling"));
        } catch (RegionConfigException e) {
            return ResponseEntity.badRequest().body(ErrorResponse.error(e.getMessage()));
        }
    }

    /**
     * DELETE /regions/SA1 stops polling SA1 and drops its data.
     */
    @DeleteMapping("/{code}")
    public ResponseEntity<?> remove(@PathVariable String code) {
        try {
            if (!regionManager.removeRegion(code)) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorResponse.noData("Region " + code + " is not being polled"));
            }
            return ResponseEntity.ok(Map.of("region", Region.fromCode(code).map(Region::getCode).orElse(code), "status", "removed"));
        } catch (RegionConfigException e) {
            return ResponseEntity.badRequest().body(ErrorResponse.error(e.getMessage()));
        }
    }
}
