package com.nemweb.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Raw report archive downloaded from NEMWEB.
 *
 * @param fileName    Published file name, used as the change-detection token
 * @param publishedAt Publish timestamp embedded in the file name
 * @param payload     Zipped report bytes
 */
public record ReportBundle(String fileName, Instant publishedAt, byte[] payload) {

    public ReportBundle {
        if (fileName == null || fileName.isBlank()) throw new IllegalArgumentException("File name must not be blank");
        Objects.requireNonNull(publishedAt, "publishedAt");
        Objects.requireNonNull(payload, "payload");
    }
}
