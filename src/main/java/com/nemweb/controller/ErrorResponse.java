package com.nemweb.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body returned when a request cannot be answered with data.
 *
 * <pre>
 * {"s": "error", "message": "Unsupported region: XX1. Supported: NSW1, QLD1, VIC1, SA1, TAS1"}
 * </pre>
 */
public record ErrorResponse(
        @JsonProperty("s") String status,
        @JsonProperty("message") String message
) {

    public static ErrorResponse error(String message) {
        return new ErrorResponse("error", message);
    }

    public static ErrorResponse noData(String message) {
        return new ErrorResponse("no_data", message);
    }
}
