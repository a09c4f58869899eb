package org.tanzu.vcenterperf.transport;

import java.util.Map;

import org.tanzu.vcenterperf.error.TransportException;

/**
 * Raw request/response capability against the vSphere SDK endpoint.
 *
 * Implementations POST the payload and return whatever the server answered,
 * including non-2xx answers that carry a body (SOAP faults arrive as HTTP 500).
 * They never retry.
 */
public interface Transport {

    /**
     * Sends one payload.
     *
     * @param payload the serialized SOAP envelope
     * @param headers additional request headers for this call (e.g. the session cookie)
     * @return the server answer
     * @throws TransportException on connection, TLS or timeout failures
     */
    TransportResponse call(byte[] payload, Map<String, String> headers);
}
