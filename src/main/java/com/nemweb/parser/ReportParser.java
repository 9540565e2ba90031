package com.nemweb.parser;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.nemweb.model.ForecastSeries;
import com.nemweb.model.PricePoint;
import com.nemweb.model.ProductKind;
import com.nemweb.model.Region;
import com.nemweb.model.ReportBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Decodes a zipped AEMO MMS CSV bundle into a {@link ForecastSeries} for one region.
 *
 * <p>MMS CSV files interleave several reports. {@code C} rows are comments, an {@code I} row
 * declares the columns of a report, and the {@code D} rows that follow carry its data:
 * <pre>
 * I,DISPATCH,PRICE,5,SETTLEMENTDATE,RUNNO,REGIONID,DISPATCHINTERVAL,INTERVENTION,RRP,...
 * D,DISPATCH,PRICE,5,"2025/12/25 15:20:00",1,NSW1,20251225184,0,85.12,...
 * </pre>
 *
 * <p>Rows with unparseable timestamps or prices are skipped with a warning. A missing report or
 * a header without the required columns fails the whole decode.
 */
public class ReportParser {

    private static final Logger log = LoggerFactory.getLogger(ReportParser.class);

    static final DateTimeFormatter MARKET_TIME = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss");

    private static final CsvMapper CSV = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    /** Default cap on the uncompressed size of a single CSV entry. */
    public static final long DEFAULT_MAX_ENTRY_BYTES = 256L * 1024 * 1024;

    private final ObjectReader rowReader = CSV.readerFor(String[].class);
    private final long maxEntryBytes;

    public ReportParser() {
        this(DEFAULT_MAX_ENTRY_BYTES);
    }

    public ReportParser(long maxEntryBytes) {
        if (maxEntryBytes <= 0) {
            throw new IllegalArgumentException("Maximum entry size must be positive");
        }
        this.maxEntryBytes = maxEntryBytes;
    }

    /**
     * Decode the report for {@code kind} and keep the rows for {@code region}.
     *
     * @return non-empty series sorted ascending, de-duplicated (last row wins) and capped at the product's periods
     * @throws ParseException if the report is missing or its header does not match, if the archive is
     *                        unreadable, or if no row for the region survives decoding
     */
    public ForecastSeries decode(ReportBundle bundle, Region region, ProductKind kind) {
        ReportSchema schema = ReportSchema.forKind(kind);
        DecodeState state = new DecodeState(region);

        int csvEntries = 0;
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bundle.payload()))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory() || !entry.getName().toUpperCase(Locale.ROOT).endsWith(".CSV")) {
                    continue;
                }
                csvEntries++;
                readEntry(entry.getName(), readBounded(zip, entry.getName(), bundle), schema, state);
            }
        } catch (ParseException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ParseException(ParseException.Reason.CORRUPT_BUNDLE,
                    "Cannot read " + bundle.fileName() + ": " + e.getMessage(), e);
        }

        if (csvEntries == 0) {
            throw new ParseException(ParseException.Reason.CORRUPT_BUNDLE,
                    bundle.fileName() + " contains no CSV reports");
        }
        if (!state.headerSeen) {
            throw new ParseException(ParseException.Reason.SCHEMA_MISMATCH,
                    "No " + schema.describe() + " report in " + bundle.fileName());
        }

        if (state.skipped > 0) {
            log.warn("[{}/{}] Skipped {} malformed {} rows in {}",
                    region, kind.getLabel(), state.skipped, schema.describe(), bundle.fileName());
        }
        if (state.byTime.isEmpty()) {
            throw new ParseException(ParseException.Reason.NO_REGION_DATA,
                    "No usable " + schema.describe() + " rows for " + region + " in " + bundle.fileName());
        }

        List<PricePoint> points = new ArrayList<>(Math.min(state.byTime.size(), kind.getMaxPeriods()));
        for (Map.Entry<Instant, Double> e : state.byTime.entrySet()) {
            if (points.size() >= kind.getMaxPeriods()) {
                break;
            }
            points.add(new PricePoint(e.getKey(), e.getValue()));
        }

        log.debug("[{}/{}] Decoded {} points from {} ({} matching rows)",
                region, kind.getLabel(), points.size(), bundle.fileName(), state.matched);

        return new ForecastSeries(region, kind, points, bundle.publishedAt(), bundle.fileName());
    }

    private byte[] readBounded(ZipInputStream zip, String entryName, ReportBundle bundle) throws IOException {
        int limit = (int) Math.min(maxEntryBytes + 1, Integer.MAX_VALUE - 8);
        byte[] content = zip.readNBytes(limit);
        if (content.length > maxEntryBytes) {
            throw new ParseException(ParseException.Reason.CORRUPT_BUNDLE,
                    entryName + " in " + bundle.fileName() + " exceeds " + maxEntryBytes + " bytes uncompressed");
        }
        return content;
    }

    private void readEntry(String entryName, byte[] content, ReportSchema schema, DecodeState state) throws IOException {
        ReportSchema.Columns columns = null;
        long rowNumber = 0;
        try (MappingIterator<String[]> rows = rowReader.readValues(content)) {
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                rowNumber++;
                if (row.length < 3) {
                    continue;
                }
                String type = row[0].trim();
                if ("I".equalsIgnoreCase(type)) {
                    if (schema.matches(row)) {
                        columns = schema.resolve(row);
                        state.headerSeen = true;
                    }
                } else if ("D".equalsIgnoreCase(type) && schema.matches(row)) {
                    if (columns == null) {
                        log.warn("{} row {}: {} data before its header, skipped", entryName, rowNumber, schema.describe());
                        state.skipped++;
                        continue;
                    }
                    readDataRow(entryName, rowNumber, row, columns, state);
                }
            }
        }
    }

    private void readDataRow(String entryName, long rowNumber, String[] row, ReportSchema.Columns columns,
                             DecodeState state) {
        if (row.length <= columns.maxIndex()) {
            log.warn("{} row {}: expected at least {} fields, got {}", entryName, rowNumber, columns.maxIndex() + 1, row.length);
            state.skipped++;
            return;
        }
        if (!state.region.getCode().equalsIgnoreCase(row[columns.region()].trim())) {
            return;
        }
        try {
            if (columns.intervention() >= 0 && Integer.parseInt(row[columns.intervention()].trim()) != 0) {
                return;
            }
            Instant timestamp = LocalDateTime.parse(row[columns.time()].trim(), MARKET_TIME)
                    .toInstant(state.region.offset());
            double price = Double.parseDouble(row[columns.price()].trim());
            if (Double.isNaN(price) || Double.isInfinite(price)) {
                throw new NumberFormatException("non-finite price " + row[columns.price()]);
            }
            state.byTime.put(timestamp, price);
            state.matched++;
        } catch (DateTimeParseException | NumberFormatException e) {
            log.warn("{} row {}: malformed {} row skipped: {}", entryName, rowNumber, state.region, e.getMessage());
            state.skipped++;
        }
    }

    private static final class DecodeState {
        private final Region region;
        private final TreeMap<Instant, Double> byTime = new TreeMap<>();
        private boolean headerSeen;
        private int matched;
        private int skipped;

        private DecodeState(Region region) {
            this.region = region;
        }
    }
}
