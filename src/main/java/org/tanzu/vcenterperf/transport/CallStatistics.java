package org.tanzu.vcenterperf.transport;

import java.time.Duration;

/**
 * Immutable snapshot of API call statistics for a {@link PacedTransport}.
 */
public class CallStatistics {

    static final CallStatistics EMPTY = new CallStatistics(0, Duration.ZERO, Duration.ZERO, Duration.ZERO);

    private final long totalCalls;
    private final Duration totalTime;
    private final Duration averageLatency;
    private final Duration lastLatency;

    public CallStatistics(long totalCalls, Duration totalTime, Duration averageLatency, Duration lastLatency) {
        this.totalCalls = totalCalls;
        this.totalTime = totalTime;
        this.averageLatency = averageLatency;
        this.lastLatency = lastLatency;
    }

    /**
     * Returns the statistics after one more call of the given latency.
     * The average is the cumulative mean over all calls.
     */
    CallStatistics record(Duration latency) {
        long calls = totalCalls + 1;
        Duration total = totalTime.plus(latency);
        return new CallStatistics(calls, total, total.dividedBy(calls), latency);
    }

    public long getTotalCalls() { return totalCalls; }
    public Duration getTotalTime() { return totalTime; }
    public Duration getAverageLatency() { return averageLatency; }
    public Duration getLastLatency() { return lastLatency; }

    @Override
    public String toString() {
        return "CallStatistics{totalCalls=" + totalCalls + ", totalTime=" + totalTime +
               ", averageLatency=" + averageLatency + ", lastLatency=" + lastLatency + "}";
    }
}
