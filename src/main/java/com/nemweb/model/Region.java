package com.nemweb.model;

import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * NEM market pricing regions.
 *
 * <p>AEMO publishes every region in market time, which is a fixed UTC+10 offset
 * with no daylight saving, regardless of the region's civil time zone.
 */
public enum Region {

    NSW1("New South Wales"),
    QLD1("Queensland"),
    VIC1("Victoria"),
    SA1("South Australia"),
    TAS1("Tasmania");

    /** AEMO market time (AEST), used for every region. */
    public static final ZoneOffset MARKET_OFFSET = ZoneOffset.ofHours(10);

    private static final Map<String, Region> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toMap(Region::getCode, Function.identity()));

    private final String displayName;

    Region(String displayName) {
        this.displayName = displayName;
    }

    public String getCode() {
        return name();
    }

    public String getDisplayName() {
        return displayName;
    }

    public ZoneOffset offset() {
        return MARKET_OFFSET;
    }

    /**
     * Look up a Region by its code (e.g., "NSW1"). Surrounding whitespace and case are ignored.
     */
    public static Optional<Region> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE.get(code.trim().toUpperCase(Locale.ROOT)));
    }

    /**
     * Returns all supported region codes for validation or documentation.
     */
    public static String[] supportedCodes() {
        return Arrays.stream(values()).map(Region::getCode).toArray(String[]::new);
    }
}
