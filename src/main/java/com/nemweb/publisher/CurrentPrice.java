package com.nemweb.publisher;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nemweb.model.SpikeInfo;

/**
 * The latest spot price of a region.
 *
 * @param region        Region code
 * @param price         Price in $/MWh
 * @param timestamp     Interval the price applies to, ISO-8601 in market time
 * @param lastUpdate    When the underlying series was committed, ISO-8601 UTC
 * @param stale         True if the underlying series is stale
 * @param source        {@code DISPATCH} for the realtime product, {@code P5MIN} when falling back to the 5-minute run
 * @param spike         Spike metrics against recent realtime prices, absent before the first realtime update
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CurrentPrice(
        @JsonProperty("region") String region,
        @JsonProperty("price_mwh") double price,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("last_update") String lastUpdate,
        @JsonProperty("stale") boolean stale,
        @JsonProperty("source") String source,
        @JsonProperty("spike") SpikeInfo spike
) {

    static final String SOURCE_DISPATCH = "DISPATCH";
    static final String SOURCE_P5MIN = "P5MIN";

    @JsonProperty("price_cents")
    public double priceCents() {
        return price / 10.0;
    }

    @JsonProperty("price_kwh")
    public double pricePerKwh() {
        return price / 1000.0;
    }
}
