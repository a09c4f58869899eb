package org.tanzu.vcenterperf.transport;

import java.time.Duration;

/**
 * A transport answer together with the measured call latency.
 */
public class TransportExchange {

    private final TransportResponse response;
    private final Duration latency;

    public TransportExchange(TransportResponse response, Duration latency) {
        this.response = response;
        this.latency = latency;
    }

    public TransportResponse getResponse() { return response; }
    public Duration getLatency() { return latency; }
}
