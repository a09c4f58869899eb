package org.tanzu.vcenterperf.vcenter;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;
import org.tanzu.vcenterperf.perf.InventoryRoot;
import org.tanzu.vcenterperf.perf.MetricCatalogResult;
import org.tanzu.vcenterperf.perf.MetricDescriptor;
import org.tanzu.vcenterperf.perf.MetricId;
import org.tanzu.vcenterperf.perf.MetricSeries;
import org.tanzu.vcenterperf.perf.PerfFormat;
import org.tanzu.vcenterperf.perf.PerfQuery;
import org.tanzu.vcenterperf.soap.ObjectRef;
import org.tanzu.vcenterperf.transport.CallStatistics;

/**
 * Service class that provides MCP (Model Context Protocol) tools for vSphere
 * inventory and performance data.
 * 
 * This service acts as the bridge between the MCP server and the {@link VimApiClient}.
 * All operations are read-only. The tools log in lazily with the configured
 * credentials on first use.
 * 
 * The service provides the following MCP tools:
 * - listVirtualMachines(), listHosts(), listClusters(): inventory listings
 * - getMetricCatalog(): metrics available on every object of an inventory root
 * - getAvailableMetrics(): metrics available on one object
 * - getCounterInfo(): metadata of performance counters
 * - getMetricSeries(): sampled values of counters on one object
 * - getMetricValues(): counter values as returned by the server, csv or normal
 * - getApiStatistics(): call count and latency of the SOAP API
 * 
 * Failures are logged and rethrown as RuntimeException carrying the API error
 * text, so MCP clients receive a meaningful message.
 */
@Service
public class VCenterService {

    private static final Logger logger = LoggerFactory.getLogger(VCenterService.class);

    /** The SOAP API client */
    private final VimApiClient apiClient;

    /**
     * Constructs a new VCenterService with the specified API client.
     * 
     * @param apiClient The vSphere API client
     */
    public VCenterService(VimApiClient apiClient) {
        this.apiClient = apiClient;
        logger.info("VCenterService initialized with VimApiClient");
    }

    /**
     * MCP tool: Lists all virtual machines.
     * 
     * @return ID and name of every virtual machine
     * @throws RuntimeException if the login or the inventory call fails
     */
    @Tool(description = "Get a list of all virtual machines in the vCenter with their managed object IDs")
    public List<InventoryItem> listVirtualMachines() {
        logger.info("=== MCP TOOL CALLED: listVirtualMachines() ===");
        ensureLoggedIn();
        return toItems(unwrap(apiClient.virtualMachines(ResultOptions.valueOnly()), "retrieve virtual machines"));
    }

    /**
     * MCP tool: Lists all ESXi hosts.
     */
    @Tool(description = "Get a list of all ESXi hosts in the vCenter with their managed object IDs")
    public List<InventoryItem> listHosts() {
        logger.info("=== MCP TOOL CALLED: listHosts() ===");
        ensureLoggedIn();
        return toItems(unwrap(apiClient.hosts(ResultOptions.valueOnly()), "retrieve hosts"));
    }

    /**
     * MCP tool: Lists all compute resources, i.e. clusters and standalone hosts.
     */
    @Tool(description = "Get a list of all clusters (compute resources) in the vCenter with their managed object IDs")
    public List<InventoryItem> listClusters() {
        logger.info("=== MCP TOOL CALLED: listClusters() ===");
        ensureLoggedIn();
        return toItems(unwrap(apiClient.hostClusters(ResultOptions.valueOnly()), "retrieve clusters"));
    }

    /**
     * MCP tool: Builds the metric catalog of an inventory root.
     * 
     * Each object of the root is returned with the metrics it exposes; descriptors
     * are listed once in the shared catalog.
     * 
     * @param root one of VIRTUAL_MACHINE, COMPUTE_RESOURCE, HOST_SYSTEM
     * @return enriched objects and catalog
     */
    @Tool(description = "Get the performance metrics available on every object of an inventory root, with the metadata of each distinct counter")
    public MetricCatalogResult getMetricCatalog(
            @ToolParam(description = "Inventory root: VIRTUAL_MACHINE, COMPUTE_RESOURCE or HOST_SYSTEM") String root) {
        logger.info("=== MCP TOOL CALLED: getMetricCatalog({}) ===", root);
        InventoryRoot inventoryRoot = parseRoot(root);
        ensureLoggedIn();
        return unwrap(apiClient.metricCatalog(inventoryRoot, ResultOptions.valueOnly()), "build the metric catalog");
    }

    /**
     * MCP tool: Lists the metrics available on one object.
     */
    @Tool(description = "Get the counter IDs and instances of the performance metrics available on one object")
    public List<MetricId> getAvailableMetrics(
            @ToolParam(description = "Managed object type, e.g. VirtualMachine, HostSystem, ComputeResource") String entityType,
            @ToolParam(description = "Managed object ID, e.g. vm-42") String entityId) {
        logger.info("=== MCP TOOL CALLED: getAvailableMetrics({}, {}) ===", entityType, entityId);
        ensureLoggedIn();
        return unwrap(apiClient.availableMetrics(ref(entityType, entityId), null, null, null, ResultOptions.valueOnly()),
                      "retrieve available metrics of " + entityType + " '" + entityId + "'");
    }

    /**
     * MCP tool: Gets the metadata of performance counters.
     */
    @Tool(description = "Get label, unit, rollup and stats type of performance counters by counter ID")
    public List<MetricDescriptor> getCounterInfo(
            @ToolParam(description = "Counter IDs to describe") List<Integer> counterIds) {
        logger.info("=== MCP TOOL CALLED: getCounterInfo({}) ===", counterIds);
        ensureLoggedIn();
        return unwrap(apiClient.counterInfo(counterIds, ResultOptions.valueOnly()), "retrieve counter info");
    }

    /**
     * MCP tool: Gets sampled values of counters on one object.
     * 
     * @param entityType managed object type
     * @param entityId managed object ID
     * @param counterIds counters to query
     * @param instance counter instance, empty for the aggregate
     * @param startTime optional ISO-8601 start
     * @param endTime optional ISO-8601 end
     * @param maxSample optional maximum number of samples per counter
     * @param intervalId optional sampling interval in seconds
     * @return one series per counter instance
     */
    @Tool(description = "Get sampled values of performance counters on one object")
    public List<MetricSeries> getMetricSeries(
            @ToolParam(description = "Managed object type, e.g. VirtualMachine") String entityType,
            @ToolParam(description = "Managed object ID, e.g. vm-42") String entityId,
            @ToolParam(description = "Counter IDs to query") List<Integer> counterIds,
            @ToolParam(description = "Counter instance, empty for the aggregate", required = false) String instance,
            @ToolParam(description = "ISO-8601 start time, e.g. 2024-01-01T00:00:00Z", required = false) String startTime,
            @ToolParam(description = "ISO-8601 end time", required = false) String endTime,
            @ToolParam(description = "Maximum number of samples per counter", required = false) Integer maxSample,
            @ToolParam(description = "Sampling interval in seconds, e.g. 20 for real-time", required = false) Integer intervalId) {
        logger.info("=== MCP TOOL CALLED: getMetricSeries({}, {}, {}) ===", entityType, entityId, counterIds);
        PerfQuery.Builder query = PerfQuery.builder(ref(entityType, entityId))
            .startTime(parseTime(startTime, "startTime"))
            .endTime(parseTime(endTime, "endTime"))
            .maxSample(maxSample)
            .intervalId(intervalId);
        addMetrics(query, counterIds, instance);
        ensureLoggedIn();
        return unwrap(apiClient.metricSeries(query.build(), ResultOptions.valueOnly()), "retrieve metric series");
    }

    /**
     * MCP tool: Gets counter values in the server's own layout.
     * 
     * The answer is the transcoded QueryPerf result, in CSV or normal form.
     */
    @Tool(description = "Get raw performance counter values on one object, in csv (default) or normal format")
    public JsonNode getMetricValues(
            @ToolParam(description = "Managed object type, e.g. VirtualMachine") String entityType,
            @ToolParam(description = "Managed object ID, e.g. vm-42") String entityId,
            @ToolParam(description = "Counter IDs to query") List<Integer> counterIds,
            @ToolParam(description = "Counter instance, empty for the aggregate", required = false) String instance,
            @ToolParam(description = "Result format: csv or normal", required = false) String format) {
        logger.info("=== MCP TOOL CALLED: getMetricValues({}, {}, {}, {}) ===", entityType, entityId, counterIds, format);
        PerfQuery.Builder query = PerfQuery.builder(ref(entityType, entityId))
            .format(PerfFormat.fromWireName(format));
        addMetrics(query, counterIds, instance);
        ensureLoggedIn();
        return unwrap(apiClient.metricValues(query.build(), ResultOptions.valueOnly()), "retrieve metric values");
    }

    /**
     * MCP tool: Gets SOAP API call statistics.
     */
    @Tool(description = "Get the number of vSphere API calls made so far and their latency")
    public CallStatistics getApiStatistics() {
        logger.info("=== MCP TOOL CALLED: getApiStatistics() ===");
        return apiClient.apiStats();
    }

    private void ensureLoggedIn() {
        if (!apiClient.isLoggedIn()) {
            logger.info("No vSphere session yet, logging in with configured credentials");
            unwrap(apiClient.login(ResultOptions.valueOnly()), "log in to vCenter");
        }
    }

    private static <T> T unwrap(ApiResult<T> result, String action) {
        if (result.hasError()) {
            logger.error("Failed to {}: {}", action, result.getError());
            throw new RuntimeException("Failed to " + action + ": " + result.getError());
        }
        return result.getValue();
    }

    private static void addMetrics(PerfQuery.Builder query, List<Integer> counterIds, String instance) {
        if (counterIds != null) {
            for (Integer counterId : counterIds) {
                query.metric(counterId != null ? counterId : -1, instance);
            }
        }
    }

    private static List<InventoryItem> toItems(Map<String, String> names) {
        List<InventoryItem> items = new ArrayList<>(names.size());
        names.forEach((id, name) -> items.add(new InventoryItem(id, name)));
        return items;
    }

    private static InventoryRoot parseRoot(String root) {
        try {
            if (root != null) {
                return InventoryRoot.valueOf(root.trim().toUpperCase(Locale.ROOT));
            }
        } catch (IllegalArgumentException e) {
            logger.debug("Unknown inventory root '{}'", root);
        }
        throw new RuntimeException("Unknown inventory root '" + root +
                                   "', expected VIRTUAL_MACHINE, COMPUTE_RESOURCE or HOST_SYSTEM");
    }

    private static ObjectRef ref(String type, String id) {
        if (type == null || id == null) {
            throw new RuntimeException("Both the object type and the object ID are required");
        }
        return new ObjectRef(type, id);
    }

    private static Instant parseTime(String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new RuntimeException("Invalid " + name + " '" + value + "', expected ISO-8601 such as 2024-01-01T00:00:00Z", e);
        }
    }

    /**
     * Data class representing an inventory object.
     */
    public static class InventoryItem {
        private final String id;
        private final String name;

        public InventoryItem(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public String getId() { return id; }
        public String getName() { return name; }

        @Override
        public String toString() {
            return "InventoryItem{id='" + id + "', name='" + name + "'}";
        }
    }
}
