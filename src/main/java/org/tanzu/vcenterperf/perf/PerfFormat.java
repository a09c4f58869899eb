package org.tanzu.vcenterperf.perf;

import org.tanzu.vcenterperf.error.ValidationException;

/**
 * Output format of {@code QueryPerf}.
 */
public enum PerfFormat {

    CSV("csv"),
    NORMAL("normal");

    private final String wireName;

    PerfFormat(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * @param value wire name, case insensitive; null selects CSV
     * @throws ValidationException for an unknown format
     */
    public static PerfFormat fromWireName(String value) {
        if (value == null || value.trim().isEmpty()) {
            return CSV;
        }
        for (PerfFormat format : values()) {
            if (format.wireName.equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        throw new ValidationException("Unknown performance data format '" + value + "', expected csv or normal");
    }
}
