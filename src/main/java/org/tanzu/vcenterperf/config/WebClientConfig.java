package org.tanzu.vcenterperf.config;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.tanzu.vcenterperf.transport.PacedTransport;
import org.tanzu.vcenterperf.transport.WebClientTransport;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;

/**
 * Configuration of the HTTP stack used to talk to the vSphere SDK endpoint.
 * 
 * Provides a WebClient.Builder carrying the fixed SOAP request headers
 * (SOAPAction, User-Agent and the UTF-8 XML content type) and the TLS policy:
 * when the vCenter configuration has insecure=true, certificates are trusted
 * without validation, which lab installations with self-signed certificates need.
 * 
 * It also wraps the WebClient transport into the process-wide PacedTransport so
 * that every API call, whatever operation issues it, goes through one pacing gate.
 */
@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /** SOAP action advertised on every request */
    public static final String SOAP_ACTION = "\"urn:vim25/4.0\"";

    /** User agent advertised on every request */
    public static final String USER_AGENT = "vcenter-perf/1.0";

    /** Content type of every request */
    public static final String CONTENT_TYPE = "text/xml; charset=UTF-8";

    /** Property retrieval over a large inventory easily exceeds the default 256KB buffer */
    private static final int MAX_IN_MEMORY_SIZE = 64 * 1024 * 1024;

    /**
     * Creates and configures a WebClient.Builder for SDK communication.
     * 
     * @param vCenterConfig The vCenter configuration containing SSL settings
     * @return A configured WebClient.Builder
     * @throws RuntimeException if SSL context configuration fails
     */
    @Bean
    public WebClient.Builder webClientBuilder(VCenterConfig vCenterConfig) {
        logger.info("Configuring WebClient.Builder for vCenter SDK: {} (insecure={})", 
                   vCenterConfig.getUrl(), vCenterConfig.isInsecure());

        WebClient.Builder builder = WebClient.builder()
            .defaultHeader("SOAPAction", SOAP_ACTION)
            .defaultHeader("User-Agent", USER_AGENT)
            .defaultHeader("Content-Type", CONTENT_TYPE)
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build());

        if (vCenterConfig.isInsecure()) {
            try {
                logger.warn("SSL validation is DISABLED for vCenter connection (insecure=true). This is not recommended for production!");
                
                SslContext sslContext = SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();
                
                HttpClient httpClient = HttpClient.create()
                    .secure(spec -> spec.sslContext(sslContext));
                
                builder.clientConnector(new ReactorClientHttpConnector(httpClient));
                
                logger.info("Successfully configured insecure SSL context for vCenter connection");
            } catch (SSLException e) {
                logger.error("Failed to configure insecure SSL context: {}", e.getMessage(), e);
                throw new RuntimeException("Failed to configure insecure SSL context", e);
            }
        } else {
            logger.info("Using default SSL validation for vCenter connection");
        }

        return builder;
    }

    /**
     * Creates the shared pacing gate in front of the SDK transport.
     * 
     * @param transport the WebClient-based transport
     * @param vCenterConfig configuration holding the minimum call interval
     * @return the process-wide PacedTransport
     */
    @Bean
    public PacedTransport pacedTransport(WebClientTransport transport, VCenterConfig vCenterConfig) {
        return new PacedTransport(transport, vCenterConfig.getMinCallInterval());
    }
}
