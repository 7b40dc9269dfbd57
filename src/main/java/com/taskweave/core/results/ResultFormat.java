package com.taskweave.core.results;

/**
 * Presentation formats for {@link ResultAggregator#formatFinalOutput}.
 */
public enum ResultFormat {
    SUMMARY,
    DETAILED,
    JSON;

    /**
     * Case-insensitive lookup; null falls back to {@link #SUMMARY}.
     *
     * @throws IllegalArgumentException for an unknown format name
     */
    public static ResultFormat fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SUMMARY;
        }
        for (var format : values()) {
            if (format.name().equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown result format: " + value
                + ". Valid formats: summary, detailed, json");
    }
}
