package org.tanzu.vcenterperf.vcenter;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterperf.config.VCenterConfig;
import org.tanzu.vcenterperf.error.ConfigException;
import org.tanzu.vcenterperf.error.ProtocolException;
import org.tanzu.vcenterperf.error.VCenterApiException;
import org.tanzu.vcenterperf.inventory.InventoryTraversal;
import org.tanzu.vcenterperf.inventory.PropertySet;
import org.tanzu.vcenterperf.perf.InventoryRoot;
import org.tanzu.vcenterperf.perf.MetricCatalogResult;
import org.tanzu.vcenterperf.perf.MetricDescriptor;
import org.tanzu.vcenterperf.perf.MetricId;
import org.tanzu.vcenterperf.perf.MetricPipeline;
import org.tanzu.vcenterperf.perf.MetricSeries;
import org.tanzu.vcenterperf.perf.PerfFormat;
import org.tanzu.vcenterperf.perf.PerfQuery;
import org.tanzu.vcenterperf.perf.PerformanceManager;
import org.tanzu.vcenterperf.session.SessionManager;
import org.tanzu.vcenterperf.soap.DocumentTranscoder;
import org.tanzu.vcenterperf.soap.ObjectRef;
import org.tanzu.vcenterperf.soap.SoapCall;
import org.tanzu.vcenterperf.transport.CallStatistics;
import org.tanzu.vcenterperf.transport.PacedTransport;

/**
 * Public entry point of the vSphere client.
 * 
 * Every operation returns an {@link ApiResult} instead of throwing: typed
 * exceptions raised underneath are logged here and turned into the result's
 * {@code error}. Which diagnostic parts are kept (raw document, headers, JSON
 * text, decoded value) is decided per call by {@link ResultOptions}; the
 * no-options overloads use the defaults from {@code vcenter.output.*}.
 * 
 * Operations backed by one SOAP call expose that call's raw answer and headers.
 * Composite operations (listings and metric catalogs) carry an empty raw
 * document and no headers, and their JSON text is the JSON of their value.
 */
@Component
public class VimApiClient {

    private static final Logger logger = LoggerFactory.getLogger(VimApiClient.class);

    private final VCenterConfig config;
    private final SessionManager sessionManager;
    private final InventoryTraversal inventory;
    private final PerformanceManager performanceManager;
    private final MetricPipeline pipeline;
    private final PacedTransport transport;
    private final DocumentTranscoder transcoder;
    private final ObjectMapper objectMapper;

    public VimApiClient(VCenterConfig config, SessionManager sessionManager, InventoryTraversal inventory,
                        PerformanceManager performanceManager, MetricPipeline pipeline,
                        PacedTransport transport, DocumentTranscoder transcoder) {
        this.config = config;
        this.sessionManager = sessionManager;
        this.inventory = inventory;
        this.performanceManager = performanceManager;
        this.pipeline = pipeline;
        this.transport = transport;
        this.transcoder = transcoder;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @return result options built from {@code vcenter.output.*}
     */
    public ResultOptions defaultOptions() {
        return ResultOptions.fromConfig(config.getOutput());
    }

    public boolean isLoggedIn() {
        return sessionManager.getSession().isAuthenticated();
    }

    public ApiResult<JsonNode> serviceContent() {
        return serviceContent(defaultOptions());
    }

    /**
     * Retrieves the service content and refreshes the stored endpoint references.
     */
    public ApiResult<JsonNode> serviceContent(ResultOptions options) {
        return soap("serviceContent", options, sessionManager::discoverService, SoapCall::getValue);
    }

    public ApiResult<JsonNode> login() {
        return login(defaultOptions());
    }

    /**
     * Logs in with the configured credentials.
     */
    public ApiResult<JsonNode> login(ResultOptions options) {
        return login(config.getUsername(), config.getPassword(), options);
    }

    public ApiResult<JsonNode> login(String username, String password, ResultOptions options) {
        return soap("login", options, () -> {
            if (config.getUrl() == null || config.getUrl().trim().isEmpty()) {
                throw new ConfigException("Must set URL, Username, and Password");
            }
            return sessionManager.login(username, password);
        }, SoapCall::getValue);
    }

    /**
     * Retrieves properties of every object of a type, returning the undecoded answer.
     */
    public ApiResult<JsonNode> inventory(String objectType, Collection<String> propertyPaths, boolean includeAll,
                                         ResultOptions options) {
        return soap("inventory", options,
                    () -> inventory.retrieveCall(objectType, propertyPaths, includeAll), SoapCall::getValue);
    }

    public ApiResult<Map<String, String>> virtualMachines() {
        return virtualMachines(defaultOptions());
    }

    /** Lists virtual machines as id to name. */
    public ApiResult<Map<String, String>> virtualMachines(ResultOptions options) {
        return composite("virtualMachines", options, () -> names(InventoryRoot.VIRTUAL_MACHINE.getObjectType()));
    }

    public ApiResult<Map<String, String>> hostClusters() {
        return hostClusters(defaultOptions());
    }

    /** Lists compute resources (clusters and standalone hosts) as id to name. */
    public ApiResult<Map<String, String>> hostClusters(ResultOptions options) {
        return composite("hostClusters", options, () -> names(InventoryRoot.COMPUTE_RESOURCE.getObjectType()));
    }

    public ApiResult<Map<String, String>> hosts() {
        return hosts(defaultOptions());
    }

    /** Lists hosts as id to name. */
    public ApiResult<Map<String, String>> hosts(ResultOptions options) {
        return composite("hosts", options, () -> names(InventoryRoot.HOST_SYSTEM.getObjectType()));
    }

    public ApiResult<List<MetricId>> availableMetrics(ObjectRef entity, Instant beginTime, Instant endTime,
                                                      Integer intervalId, ResultOptions options) {
        return soap("availableMetrics", options,
                    () -> performanceManager.availableMetricsCall(entity, beginTime, endTime, intervalId),
                    PerformanceManager::toMetricIds);
    }

    public ApiResult<List<MetricDescriptor>> counterInfo(List<Integer> counterIds, ResultOptions options) {
        return soap("counterInfo", options,
                    () -> performanceManager.counterMetadataCall(counterIds), PerformanceManager::toDescriptors);
    }

    /**
     * Queries metric values in the format asked by the query; the value is the transcoded answer.
     */
    public ApiResult<JsonNode> metricValues(PerfQuery query, ResultOptions options) {
        return soap("metricValues", options, () -> performanceManager.metricValuesCall(query), SoapCall::getValue);
    }

    /**
     * Queries metric values in CSV form and parses them into series.
     */
    public ApiResult<List<MetricSeries>> metricSeries(PerfQuery query, ResultOptions options) {
        PerfQuery csv = query != null ? query.withFormat(PerfFormat.CSV) : null;
        return soap("metricSeries", options,
                    () -> performanceManager.metricValuesCall(csv), call -> PerformanceManager.toSeries(csv, call));
    }

    public ApiResult<MetricCatalogResult> metricCatalog(InventoryRoot root) {
        return metricCatalog(root, defaultOptions());
    }

    /**
     * Builds the metric catalog of an inventory root.
     */
    public ApiResult<MetricCatalogResult> metricCatalog(InventoryRoot root, ResultOptions options) {
        return composite("metricCatalog(" + root + ")", options, () -> pipeline.run(root));
    }

    public ApiResult<MetricCatalogResult> virtualMachineMetricCatalog(ResultOptions options) {
        return metricCatalog(InventoryRoot.VIRTUAL_MACHINE, options);
    }

    public ApiResult<MetricCatalogResult> hostClusterMetricCatalog(ResultOptions options) {
        return metricCatalog(InventoryRoot.COMPUTE_RESOURCE, options);
    }

    public ApiResult<MetricCatalogResult> hostMetricCatalog(ResultOptions options) {
        return metricCatalog(InventoryRoot.HOST_SYSTEM, options);
    }

    /**
     * @return call count and latency statistics of the transport
     */
    public CallStatistics apiStats() {
        return transport.statistics();
    }

    private Map<String, String> names(String objectType) {
        Map<String, String> names = new LinkedHashMap<>();
        for (PropertySet set : inventory.retrieve(objectType, Collections.singletonList("name"), false)) {
            names.put(set.getObj().getId(), set.getName());
        }
        return names;
    }

    private <T> ApiResult<T> soap(String operation, ResultOptions options, Supplier<SoapCall> invocation,
                                  Function<SoapCall, T> decode) {
        try {
            SoapCall call = invocation.get();
            T value = decode.apply(call);
            return ApiResult.success(options, call.getRaw(), headersOf(call.getHeaders()),
                                     options.isJson() ? transcoder.toJson(call.getValue()) : null, value);
        } catch (VCenterApiException e) {
            logger.error("{} failed ({}): {}", operation, e.getKind(), e.getMessage());
            return ApiResult.failure(e);
        }
    }

    private <T> ApiResult<T> composite(String operation, ResultOptions options, Supplier<T> work) {
        try {
            T value = work.get();
            return ApiResult.success(options, "", Collections.emptyMap(),
                                     options.isJson() ? writeJson(value) : null, value);
        } catch (VCenterApiException e) {
            logger.error("{} failed ({}): {}", operation, e.getKind(), e.getMessage());
            return ApiResult.failure(e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Could not render result as JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, List<String>> headersOf(HttpHeaders headers) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        return copy;
    }
}
