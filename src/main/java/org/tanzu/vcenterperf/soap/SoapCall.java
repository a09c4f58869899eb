package org.tanzu.vcenterperf.soap;

import java.time.Duration;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;

/**
 * Diagnostics and decoded answer of one SOAP call.
 *
 * Returned to the caller of every call instead of being kept as shared
 * "last call" state, so concurrent calls never see each other's data.
 */
public class SoapCall {

    private final SoapOperation operation;
    private final int status;
    private final String raw;
    private final HttpHeaders headers;
    private final JsonNode value;
    private final Duration latency;

    public SoapCall(SoapOperation operation, int status, String raw, HttpHeaders headers,
                    JsonNode value, Duration latency) {
        this.operation = operation;
        this.status = status;
        this.raw = raw;
        this.headers = headers;
        this.value = value;
        this.latency = latency;
    }

    public SoapOperation getOperation() { return operation; }
    public int getStatus() { return status; }

    /** The raw response document. */
    public String getRaw() { return raw; }

    public HttpHeaders getHeaders() { return headers; }

    /**
     * The transcoded {@code <Operation>Response} element, or the whole SOAP body
     * when the server did not wrap its answer.
     */
    public JsonNode getValue() { return value; }

    public Duration getLatency() { return latency; }

    @Override
    public String toString() {
        return "SoapCall{operation=" + operation + ", status=" + status + ", latency=" + latency + "}";
    }
}
