package org.tanzu.vcenterperf.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

/**
 * Processor for Cloud Foundry service bindings carrying vCenter credentials.
 * 
 * When the application is bound to a service whose name contains "vcenter",
 * Cloud Foundry exposes its credentials in the VCAP_SERVICES environment variable.
 * After the context starts, this component fills every missing SDK setting
 * (url, username, password) from that binding. Values already supplied through
 * environment variables or application.properties are left untouched.
 * 
 * A binding may provide either a full "url" or just a "host" (and optional
 * "port"), in which case the SDK URL is derived as https://host[:port]/sdk.
 * 
 * Configuration priority for missing values (highest to lowest):
 * 1. Environment variables / application.properties
 * 2. Cloud Foundry service binding (VCAP_SERVICES)
 */
@Component
public class VCenterConfigProcessor {

    private static final Logger logger = LoggerFactory.getLogger(VCenterConfigProcessor.class);

    /** The vCenter configuration object to be updated */
    private final VCenterConfig vCenterConfig;

    /** Spring environment for accessing environment variables */
    private final Environment environment;

    public VCenterConfigProcessor(VCenterConfig vCenterConfig, Environment environment) {
        this.vCenterConfig = vCenterConfig;
        this.environment = environment;
    }

    /**
     * Fills incomplete vCenter settings from VCAP_SERVICES.
     * 
     * Called once after the Spring context is initialized. Does nothing when the
     * configuration is already complete or no binding is available. Parse errors
     * are logged and leave the configuration as it was; login later reports the
     * missing settings as a configuration error.
     */
    @PostConstruct
    public void processVCapServices() {
        logger.info("Processing vCenter configuration...");
        logger.info("Current config - URL: '{}', Username: '{}', Password: '{}'", 
                   vCenterConfig.getUrl(), 
                   vCenterConfig.getUsername(), 
                   vCenterConfig.getPassword() != null ? "***" : "null");
        
        if (isConfigurationComplete()) {
            logger.info("vCenter configuration is complete from environment variables");
            return;
        }

        String vcapServices = environment.getProperty("VCAP_SERVICES");
        if (vcapServices == null || vcapServices.isEmpty()) {
            logger.warn("VCAP_SERVICES not available and configuration incomplete");
            return;
        }

        try {
            JsonNode vcapServicesNode = new ObjectMapper().readTree(vcapServices);
            JsonNode credentials = findVCenterCredentials(vcapServicesNode);
            if (credentials != null) {
                updateConfigurationFromVCap(credentials);
                logger.info("vCenter configuration updated from VCAP_SERVICES");
                logger.info("Final config - URL: '{}', Username: '{}', Password: '{}'", 
                           vCenterConfig.getUrl(), 
                           vCenterConfig.getUsername(), 
                           vCenterConfig.getPassword() != null ? "***" : "null");
            } else {
                logger.warn("No vCenter service found in VCAP_SERVICES");
            }
        } catch (Exception e) {
            logger.error("Error processing VCAP_SERVICES: {}", e.getMessage(), e);
        }
    }

    /**
     * Checks whether url, username and password are all present.
     * A value counts as missing when null, blank or an unresolved ${...} placeholder.
     * 
     * @return true if the configuration is complete
     */
    boolean isConfigurationComplete() {
        boolean urlValid = isSet(vCenterConfig.getUrl());
        boolean usernameValid = isSet(vCenterConfig.getUsername());
        boolean passwordValid = isSet(vCenterConfig.getPassword());
        
        logger.debug("Configuration validation - URL valid: {}, Username valid: {}, Password valid: {}", 
                    urlValid, usernameValid, passwordValid);
        
        return urlValid && usernameValid && passwordValid;
    }

    /**
     * Finds the credentials of the first bound service whose name contains "vcenter".
     * 
     * @param vcapServicesNode The parsed VCAP_SERVICES JSON node
     * @return The credentials node, or null if no vCenter service is bound
     */
    private JsonNode findVCenterCredentials(JsonNode vcapServicesNode) {
        for (JsonNode serviceNode : vcapServicesNode) {
            for (JsonNode service : serviceNode) {
                String serviceName = service.path("name").asText();
                logger.debug("Found service: {}", serviceName);
                if (serviceName.toLowerCase().contains("vcenter")) {
                    logger.info("Found vCenter service: {}", serviceName);
                    return service.path("credentials");
                }
            }
        }
        return null;
    }

    private void updateConfigurationFromVCap(JsonNode credentials) {
        if (!isSet(vCenterConfig.getUrl())) {
            String url = credentials.path("url").asText("");
            if (url.isEmpty() && credentials.hasNonNull("host")) {
                int port = credentials.path("port").asInt(443);
                url = "https://" + credentials.get("host").asText() + (port == 443 ? "" : ":" + port) + "/sdk";
            }
            vCenterConfig.setUrl(url);
            logger.info("Set url from VCAP: {}", url);
        }

        if (!isSet(vCenterConfig.getUsername())) {
            String username = credentials.path("username").asText();
            vCenterConfig.setUsername(username);
            logger.info("Set username from VCAP: {}", username);
        }

        if (!isSet(vCenterConfig.getPassword())) {
            vCenterConfig.setPassword(credentials.path("password").asText());
            logger.info("Set password from VCAP: ***");
        }

        if (credentials.has("insecure")) {
            boolean insecure = credentials.path("insecure").asBoolean(true);
            vCenterConfig.setInsecure(insecure);
            logger.info("Set insecure from VCAP: {}", insecure);
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.trim().isEmpty() && !value.contains("${");
    }
}
