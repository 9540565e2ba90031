package com.nemweb.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counters of a single poller, exposed on the status endpoint.
 */
public record PollerStats(
        @JsonProperty("cycles") long cycles,
        @JsonProperty("updates") long updates,
        @JsonProperty("failures") long failures,
        @JsonProperty("consecutive_failures") int consecutiveFailures,
        @JsonProperty("dropped_ticks") long droppedTicks,
        @JsonProperty("last_outcome") CycleOutcome lastOutcome,
        @JsonProperty("last_bundle") String lastBundle
) {}
