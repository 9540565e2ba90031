package com.nemweb.region;

import com.nemweb.model.Region;

/**
 * Raised when a pipeline is requested for a code that is not a supported NEM region.
 */
public class RegionConfigException extends IllegalArgumentException {

    private final String code;

    public RegionConfigException(String code) {
        super("Unsupported region: " + code + ". Supported: " + String.join(", ", Region.supportedCodes()));
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
