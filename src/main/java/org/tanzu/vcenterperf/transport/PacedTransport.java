package org.tanzu.vcenterperf.transport;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tanzu.vcenterperf.error.TransportException;

/**
 * Rate-limiting and measuring wrapper around a {@link Transport}.
 *
 * Successive calls start at least {@code minInterval} apart, measured on call
 * start times and enforced across every thread that shares this instance. A
 * caller that arrives early reserves the next free slot and sleeps until it.
 *
 * Each call's latency feeds the running statistics: count, total time, last
 * latency and cumulative average. Statistics are updated under the same lock as
 * the slot reservation, so concurrent callers never lose an update.
 *
 * Failures of the wrapped transport are counted and then rethrown unchanged.
 */
public class PacedTransport {

    private static final Logger logger = LoggerFactory.getLogger(PacedTransport.class);

    private final Transport delegate;
    private final long minIntervalNanos;
    private final Object lock = new Object();

    private boolean anyCallStarted;
    private long lastStartNanos;
    private CallStatistics statistics = CallStatistics.EMPTY;

    public PacedTransport(Transport delegate, Duration minInterval) {
        this.delegate = delegate;
        this.minIntervalNanos = minInterval != null && !minInterval.isNegative() ? minInterval.toNanos() : 0L;
        logger.info("PacedTransport initialized (minInterval={}ms)", TimeUnit.NANOSECONDS.toMillis(minIntervalNanos));
    }

    /**
     * Sends one payload once the pacing gate allows it.
     *
     * @param payload serialized request
     * @param headers per-call headers
     * @return the answer and the measured latency
     * @throws TransportException if the wrapped transport fails or the wait is interrupted
     */
    public TransportExchange call(byte[] payload, Map<String, String> headers) {
        awaitSlot();
        long start = System.nanoTime();
        boolean completed = false;
        try {
            TransportResponse response = delegate.call(payload, headers);
            completed = true;
            Duration latency = record(start);
            logger.debug("API call completed: status={}, latency={}ms", response.getStatus(), latency.toMillis());
            return new TransportExchange(response, latency);
        } finally {
            if (!completed) {
                Duration latency = record(start);
                logger.warn("API call failed after {}ms", latency.toMillis());
            }
        }
    }

    /**
     * Gets a snapshot of the call statistics collected so far.
     * @return current statistics
     */
    public CallStatistics statistics() {
        synchronized (lock) {
            return statistics;
        }
    }

    private void awaitSlot() {
        long slot;
        synchronized (lock) {
            long now = System.nanoTime();
            slot = anyCallStarted ? Math.max(now, lastStartNanos + minIntervalNanos) : now;
            lastStartNanos = slot;
            anyCallStarted = true;
        }
        long waitNanos = slot - System.nanoTime();
        if (waitNanos > 0) {
            logger.debug("Pacing API call, waiting {}ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
            try {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("Interrupted while waiting for the next API call slot", e);
            }
        }
    }

    private Duration record(long startNanos) {
        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
        synchronized (lock) {
            statistics = statistics.record(latency);
        }
        return latency;
    }
}
