package com.nemweb.fetcher;

import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * NEMWEB directory conventions for each product.
 *
 * <p>File names embed the interval they were published for, e.g.
 * {@code PUBLIC_DISPATCHIS_202512251520_0000000495664033.zip}. The latest bundle is the one
 * with the greatest embedded timestamp; ties are broken by the full name.
 */
public final class ReportListing {

    private static final DateTimeFormatter NAME_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmm");

    private static final Pattern DISPATCH = Pattern.compile("PUBLIC_DISPATCHIS_(\\d{12})_\\d+\\.zip", Pattern.CASE_INSENSITIVE);
    private static final Pattern P5MIN = Pattern.compile("PUBLIC_P5MIN_(\\d{12})_\\d{14}\\.zip", Pattern.CASE_INSENSITIVE);
    private static final Pattern PREDISPATCH = Pattern.compile("PUBLIC_PREDISPATCH_(\\d{12})_\\d{14}_LEGACY\\.zip", Pattern.CASE_INSENSITIVE);

    /**
     * A bundle named in a directory listing.
     *
     * @param name        File name, also the change-detection token
     * @param publishedAt Timestamp embedded in the name
     */
    public record ListedFile(String name, Instant publishedAt) {}

    private ReportListing() {
    }

    public static String directoryPath(ProductKind kind) {
        return switch (kind) {
            case REALTIME -> "/Reports/Current/DispatchIS_Reports/";
            case FIVE_MINUTE -> "/Reports/Current/P5_Reports/";
            case PREDISPATCH -> "/Reports/Current/Predispatch_Reports/";
        };
    }

    public static String directoryUrl(String baseUrl, ProductKind kind) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + directoryPath(kind);
    }

    static Pattern fileNamePattern(ProductKind kind) {
        return switch (kind) {
            case REALTIME -> DISPATCH;
            case FIVE_MINUTE -> P5MIN;
            case PREDISPATCH -> PREDISPATCH;
        };
    }

    /**
     * Finds the most recent bundle for {@code kind} in an HTML directory listing.
     */
    public static Optional<ListedFile> latest(String listingHtml, ProductKind kind) {
        if (listingHtml == null || listingHtml.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = fileNamePattern(kind).matcher(listingHtml);
        String bestName = null;
        String bestStamp = null;
        Comparator<String> order = Comparator.naturalOrder();
        while (matcher.find()) {
            String name = matcher.group();
            String stamp = matcher.group(1);
            if (bestName == null
                    || order.compare(stamp, bestStamp) > 0
                    || (stamp.equals(bestStamp) && order.compare(name, bestName) > 0)) {
                bestName = name;
                bestStamp = stamp;
            }
        }
        if (bestName == null) {
            return Optional.empty();
        }
        return Optional.of(new ListedFile(bestName, parseStamp(bestStamp)));
    }

    static Instant parseStamp(String stamp) {
        return LocalDateTime.parse(stamp, NAME_TIMESTAMP).toInstant(Region.MARKET_OFFSET);
    }
}
