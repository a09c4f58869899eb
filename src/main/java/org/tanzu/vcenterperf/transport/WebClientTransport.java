package org.tanzu.vcenterperf.transport;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.tanzu.vcenterperf.config.VCenterConfig;
import org.tanzu.vcenterperf.error.ConfigException;
import org.tanzu.vcenterperf.error.TransportException;

import reactor.core.Exceptions;

/**
 * {@link Transport} that POSTs SOAP envelopes to the vCenter SDK endpoint using Spring WebClient.
 *
 * The WebClient comes pre-configured from {@link org.tanzu.vcenterperf.config.WebClientConfig}
 * with the fixed SOAP headers and the TLS policy. Every call is bounded by the configured
 * call timeout; an expired call surfaces as a {@link TransportException} instead of
 * blocking the caller indefinitely.
 *
 * The endpoint is read from the configuration on every call, so a URL filled in from
 * a service binding after startup is picked up.
 *
 * Non-2xx answers are returned with their body rather than raised, because the SDK
 * reports SOAP faults as HTTP 500 with an XML envelope the caller needs to decode.
 */
@Component
public class WebClientTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(WebClientTransport.class);

    private final VCenterConfig vCenterConfig;
    private final Duration callTimeout;
    private final WebClient webClient;

    /**
     * Constructs the transport for the configured SDK endpoint.
     *
     * @param vCenterConfig configuration holding the endpoint URL and call timeout
     * @param webClientBuilder pre-configured WebClient.Builder with headers and SSL settings
     */
    public WebClientTransport(VCenterConfig vCenterConfig, WebClient.Builder webClientBuilder) {
        this.vCenterConfig = vCenterConfig;
        this.callTimeout = vCenterConfig.getCallTimeout();
        this.webClient = webClientBuilder.build();
        logger.info("Initializing WebClientTransport for vCenter SDK: {} (timeout={}s, insecure={})",
                   vCenterConfig.getUrl(), callTimeout.toSeconds(), vCenterConfig.isInsecure());
    }

    @Override
    public TransportResponse call(byte[] payload, Map<String, String> headers) {
        String endpoint = vCenterConfig.getUrl();
        if (endpoint == null || endpoint.isBlank()) {
            throw new ConfigException("URL is not set");
        }
        try {
            ResponseEntity<byte[]> entity = webClient.post()
                .uri(endpoint)
                .headers(h -> headers.forEach(h::set))
                .bodyValue(payload)
                .exchangeToMono(response -> response.toEntity(byte[].class))
                .timeout(callTimeout)
                .block();

            if (entity == null) {
                throw new TransportException("No response received from " + endpoint);
            }
            logger.debug("SDK POST to {} returned HTTP {}", endpoint, entity.getStatusCode().value());
            return new TransportResponse(entity.getStatusCode().value(), entity.getHeaders(), entity.getBody());
        } catch (TransportException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                logger.error("SDK call to {} timed out after {}ms", endpoint, callTimeout.toMillis());
                throw new TransportException("API call timed out after " + callTimeout.toMillis() + "ms", cause);
            }
            logger.error("SDK call to {} failed: {}", endpoint, cause.getMessage(), cause);
            throw new TransportException("API call failed: " + cause.getMessage(), cause);
        }
    }
}
