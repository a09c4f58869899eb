package org.tanzu.vcenterperf.soap;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterperf.error.ProtocolException;
import org.tanzu.vcenterperf.transport.PacedTransport;
import org.tanzu.vcenterperf.transport.TransportExchange;
import org.tanzu.vcenterperf.transport.TransportResponse;

/**
 * Sends typed SOAP requests through the paced transport and decodes their answers.
 *
 * The answer is transcoded with the operation's cardinality schema and unwrapped:
 * the value of a call is {@code Envelope/Body/<Operation>Response} when present,
 * otherwise the body itself. A {@code Fault} in the body becomes a
 * {@link SoapFaultException}.
 */
@Component
public class SoapClient {

    private static final Logger logger = LoggerFactory.getLogger(SoapClient.class);

    private final PacedTransport transport;
    private final DocumentTranscoder transcoder;

    public SoapClient(PacedTransport transport, DocumentTranscoder transcoder) {
        this.transport = transport;
        this.transcoder = transcoder;
    }

    /**
     * Issues one request.
     *
     * @param request typed request
     * @param headers per-call headers, e.g. the session cookie
     * @return the decoded call
     * @throws org.tanzu.vcenterperf.error.TransportException on network failures
     * @throws ProtocolException if the answer cannot be decoded or is a SOAP fault
     */
    public SoapCall invoke(SoapRequest request, Map<String, String> headers) {
        SoapOperation operation = request.getOperation();
        logger.info("=== SOAP CALL: {} ===", operation.getOperationName());

        byte[] payload = SoapEnvelopeWriter.write(request);
        TransportExchange exchange = transport.call(payload, headers);
        TransportResponse response = exchange.getResponse();
        String raw = response.getBodyAsString();
        logger.debug("{} raw response (HTTP {}): {}", operation.getOperationName(), response.getStatus(), raw);

        JsonNode value;
        try {
            value = unwrap(operation, response.getStatus(), transcoder.transcode(response.getBody(), operation.getResponseSchema()));
        } catch (SoapFaultException e) {
            logger.error("{} returned a SOAP fault: {}", operation.getOperationName(), e.getFaultString());
            throw e;
        } catch (ProtocolException e) {
            logger.error("{} answer could not be decoded (HTTP {}): {}",
                        operation.getOperationName(), response.getStatus(), e.getMessage());
            throw response.getStatus() >= 400 ? e.withContext("HTTP " + response.getStatus()) : e;
        }

        logger.info("{} completed in {}ms", operation.getOperationName(), exchange.getLatency().toMillis());
        return new SoapCall(operation, response.getStatus(), raw, response.getHeaders(), value, exchange.getLatency());
    }

    private static JsonNode unwrap(SoapOperation operation, int status, JsonNode document) {
        JsonNode body = document.path("Envelope").path("Body");
        if (body.isMissingNode()) {
            throw new ProtocolException("Response is not a SOAP envelope");
        }
        if (body.has("Fault")) {
            JsonNode fault = body.get("Fault");
            throw new SoapFaultException(fault.path("faultcode").asText(""),
                                         fault.path("faultstring").asText("Unknown SOAP fault"));
        }
        if (body.has(operation.getResponseElement())) {
            return body.get(operation.getResponseElement());
        }
        if (status >= 400) {
            throw new ProtocolException("No <" + operation.getResponseElement() + "> element in SOAP body");
        }
        logger.warn("No <{}> element in SOAP body, passing the body through", operation.getResponseElement());
        return body;
    }
}
