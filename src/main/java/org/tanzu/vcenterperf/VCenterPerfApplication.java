package org.tanzu.vcenterperf;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.tanzu.vcenterperf.vcenter.VCenterService;

import java.util.List;

/**
 * Main Spring Boot application class for the vSphere performance client.
 * 
 * The application talks to the vSphere Web Services SOAP API: it logs in,
 * walks the managed-object inventory, discovers performance counters and
 * retrieves their samples. The same operations are exposed as Model Context
 * Protocol tools for AI assistants and other MCP clients.
 * 
 * Key features:
 * - SOAP client with schema-driven response decoding
 * - Metric catalogs per inventory root (VMs, clusters, hosts)
 * - Paced API calls with latency statistics
 * - Supports Cloud Foundry deployment with service binding
 * 
 * @version 1.0.0
 */
@SpringBootApplication
@EnableConfigurationProperties
public class VCenterPerfApplication {

    /**
     * Main application entry point.
     * 
     * The MCP server identity is set programmatically so the server is always
     * reported as "vcenter-perf" whatever the environment provides.
     * 
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        System.setProperty("spring.application.name", "vcenter-perf");
        System.setProperty("spring.ai.mcp.server.name", "vcenter-perf");
        System.setProperty("spring.ai.mcp.server.version", "1.0.0");
        
        SpringApplication.run(VCenterPerfApplication.class, args);
    }

    /**
     * Registers the vSphere tools with the MCP server.
     * 
     * @param vCenterService The service containing the MCP tools
     * @return List of ToolCallback objects representing the available MCP tools
     */
    @Bean
    public List<ToolCallback> registerTools(VCenterService vCenterService) {
        return List.of(ToolCallbacks.from(vCenterService));
    }
}
