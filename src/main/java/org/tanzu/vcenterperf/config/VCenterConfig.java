package org.tanzu.vcenterperf.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class for the vSphere SDK connection.
 * 
 * This class uses Spring Boot's @ConfigurationProperties to bind settings from
 * application.properties, environment variables and Cloud Foundry service
 * bindings (via VCenterConfigProcessor) using the "vcenter" prefix.
 * 
 * Besides the endpoint and credentials it carries the pacing interval between
 * API calls, the per-call timeout, the fan-out used by metric pipelines and the
 * default output-inclusion flags applied to API results.
 */
@Component
@ConfigurationProperties(prefix = "vcenter")
public class VCenterConfig {

    /** Full URL of the SDK endpoint, e.g. https://vcenter.example.com/sdk */
    private String url;
    
    /** Username for vCenter authentication */
    private String username;
    
    /** Password for vCenter authentication */
    private String password;
    
    /** Whether to skip SSL certificate validation (default: true, like most lab vCenters need) */
    private boolean insecure = true;

    /** Minimum time between the start of two API calls (default: no pacing) */
    private Duration minCallInterval = Duration.ZERO;

    /** Upper bound for a single API call (default: 60 seconds) */
    private Duration callTimeout = Duration.ofSeconds(60);

    /** Metric pipeline settings */
    private final Pipeline pipeline = new Pipeline();

    /** Default output-inclusion flags for API results */
    private final Output output = new Output();

    /**
     * Gets the SDK endpoint URL.
     * @return The endpoint URL
     */
    public String getUrl() { return url; }
    
    /**
     * Sets the SDK endpoint URL.
     * @param url The endpoint URL
     */
    public void setUrl(String url) { this.url = url; }

    /**
     * Gets the username for vCenter authentication.
     * @return The username
     */
    public String getUsername() { return username; }
    
    /**
     * Sets the username for vCenter authentication.
     * @param username The username
     */
    public void setUsername(String username) { this.username = username; }

    /**
     * Gets the password for vCenter authentication.
     * @return The password
     */
    public String getPassword() { return password; }
    
    /**
     * Sets the password for vCenter authentication.
     * @param password The password
     */
    public void setPassword(String password) { this.password = password; }

    /**
     * Checks if SSL certificate validation should be skipped.
     * @return true if SSL validation is disabled, false for strict verification
     */
    public boolean isInsecure() { return insecure; }
    
    /**
     * Sets whether SSL certificate validation should be skipped.
     * @param insecure true to disable SSL validation, false to enable it
     */
    public void setInsecure(boolean insecure) { this.insecure = insecure; }

    public Duration getMinCallInterval() { return minCallInterval; }
    public void setMinCallInterval(Duration minCallInterval) { this.minCallInterval = minCallInterval; }

    public Duration getCallTimeout() { return callTimeout; }
    public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }

    public Pipeline getPipeline() { return pipeline; }

    public Output getOutput() { return output; }

    /**
     * Returns a string representation of the configuration.
     * 
     * The password is hidden to keep it out of logs and debug output.
     * 
     * @return String representation with password hidden
     */
    @Override
    public String toString() {
        return "VCenterConfig{" +
                "url='" + url + '\'' +
                ", username='" + username + '\'' +
                ", password='[HIDDEN]'" +
                ", insecure=" + insecure +
                ", minCallInterval=" + minCallInterval +
                ", callTimeout=" + callTimeout +
                ", pipeline.parallelism=" + pipeline.getParallelism() +
                '}';
    }

    /**
     * Metric pipeline settings.
     */
    public static class Pipeline {

        /** Number of concurrent metric-discovery calls; 1 keeps the pipeline sequential */
        private int parallelism = 1;

        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
    }

    /**
     * Which parts of a call are copied into its result by default.
     * Any subset may be enabled.
     */
    public static class Output {

        private boolean raw = true;
        private boolean headers = true;
        private boolean json = true;
        private boolean structured = true;

        public boolean isRaw() { return raw; }
        public void setRaw(boolean raw) { this.raw = raw; }

        public boolean isHeaders() { return headers; }
        public void setHeaders(boolean headers) { this.headers = headers; }

        public boolean isJson() { return json; }
        public void setJson(boolean json) { this.json = json; }

        public boolean isStructured() { return structured; }
        public void setStructured(boolean structured) { this.structured = structured; }
    }
}
