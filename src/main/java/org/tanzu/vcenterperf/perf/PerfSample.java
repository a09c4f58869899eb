package org.tanzu.vcenterperf.perf;

import java.time.Instant;

/**
 * One sample of a metric series. A value of -1 marks a sample the server could not collect.
 */
public final class PerfSample {

    private final Instant timestamp;
    private final int interval;
    private final long value;

    public PerfSample(Instant timestamp, int interval, long value) {
        this.timestamp = timestamp;
        this.interval = interval;
        this.value = value;
    }

    public Instant getTimestamp() { return timestamp; }

    /** Sampling interval in seconds. */
    public int getInterval() { return interval; }

    public long getValue() { return value; }

    @Override
    public String toString() {
        return timestamp + "=" + value;
    }
}
