package com.nemweb.region;

import com.nemweb.model.Region;

/**
 * Builds a fresh, not yet started pipeline for a region.
 */
@FunctionalInterface
public interface RegionPipelineFactory {

    RegionPipeline create(Region region);
}
