package org.tanzu.vcenterperf.transport;

import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpHeaders;

/**
 * One HTTP answer: status code, response headers and raw body bytes.
 */
public class TransportResponse {

    private final int status;
    private final HttpHeaders headers;
    private final byte[] body;

    public TransportResponse(int status, HttpHeaders headers, byte[] body) {
        this.status = status;
        this.headers = HttpHeaders.readOnlyHttpHeaders(headers != null ? headers : new HttpHeaders());
        this.body = body != null ? body : new byte[0];
    }

    public int getStatus() { return status; }
    public HttpHeaders getHeaders() { return headers; }
    public byte[] getBody() { return body; }

    /**
     * Decodes the body as UTF-8 text.
     * @return the body as a string
     */
    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "TransportResponse{status=" + status + ", bodyBytes=" + body.length + "}";
    }
}
