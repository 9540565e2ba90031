package com.nemweb.parser;

import com.nemweb.model.ProductKind;

import java.util.Locale;

/**
 * The report table and columns a product is read from.
 *
 * @param report     Report name in column 1 of I/D rows (e.g., "DISPATCH")
 * @param subType    Report sub-type in column 2, or null to accept any
 * @param timeColumn Column holding the interval timestamp
 * @param altTimeColumn Column used when {@code timeColumn} is absent, or null
 */
record ReportSchema(String report, String subType, String timeColumn, String altTimeColumn) {

    static final String REGION_COLUMN = "REGIONID";
    static final String PRICE_COLUMN = "RRP";
    static final String INTERVENTION_COLUMN = "INTERVENTION";

    static ReportSchema forKind(ProductKind kind) {
        return switch (kind) {
            case REALTIME -> new ReportSchema("DISPATCH", "PRICE", "SETTLEMENTDATE", null);
            case FIVE_MINUTE -> new ReportSchema("P5MIN", "REGIONSOLUTION", "INTERVAL_DATETIME", null);
            case PREDISPATCH -> new ReportSchema("PDREGION", null, "DATETIME", "PERIODID");
        };
    }

    boolean matches(String[] row) {
        if (row.length < 3 || !report.equalsIgnoreCase(row[1].trim())) {
            return false;
        }
        return subType == null || subType.equalsIgnoreCase(row[2].trim());
    }

    String describe() {
        return subType == null ? report : report + "." + subType;
    }

    /**
     * Resolves column positions from an I (header) row.
     *
     * @throws ParseException if a required column is absent
     */
    Columns resolve(String[] header) {
        int region = -1;
        int time = -1;
        int altTime = -1;
        int price = -1;
        int intervention = -1;
        for (int i = 4; i < header.length; i++) {
            String name = header[i].trim().toUpperCase(Locale.ROOT);
            if (name.equals(REGION_COLUMN)) {
                region = i;
            } else if (name.equals(timeColumn)) {
                time = i;
            } else if (name.equals(altTimeColumn)) {
                altTime = i;
            } else if (name.equals(PRICE_COLUMN)) {
                price = i;
            } else if (name.equals(INTERVENTION_COLUMN)) {
                intervention = i;
            }
        }
        if (time < 0) {
            time = altTime;
        }
        if (region < 0 || time < 0 || price < 0) {
            throw new ParseException(ParseException.Reason.SCHEMA_MISMATCH,
                    describe() + " header lacks required columns " + REGION_COLUMN + ", " + timeColumn
                            + ", " + PRICE_COLUMN);
        }
        return new Columns(region, time, price, intervention);
    }

    /**
     * Column positions within a D row. {@code intervention} is -1 when the report has none.
     */
    record Columns(int region, int time, int price, int intervention) {

        int maxIndex() {
            return Math.max(Math.max(region, time), Math.max(price, intervention));
        }
    }
}
