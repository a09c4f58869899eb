package org.tanzu.vcenterperf.perf;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterperf.error.ProtocolException;
import org.tanzu.vcenterperf.error.ValidationException;
import org.tanzu.vcenterperf.session.Session;
import org.tanzu.vcenterperf.session.SessionManager;
import org.tanzu.vcenterperf.soap.ObjectRef;
import org.tanzu.vcenterperf.soap.SoapCall;

/**
 * Metric operations of the vSphere performance manager.
 * 
 * Each operation comes in two flavours: {@code ...Call} returns the decoded SOAP call
 * for callers that want the raw answer, the plain method returns typed values.
 * Arguments are validated before the session check, and both happen before any
 * network call.
 */
@Component
public class PerformanceManager {

    private static final Logger logger = LoggerFactory.getLogger(PerformanceManager.class);

    private final SessionManager sessionManager;

    public PerformanceManager(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    /**
     * Lists the counters available on an entity.
     * 
     * @param entity entity reference
     * @param beginTime optional start of the window
     * @param endTime optional end of the window
     * @param intervalId optional sampling interval
     * @return counter id and instance pairs, in server order
     */
    public List<MetricId> availableMetrics(ObjectRef entity, Instant beginTime, Instant endTime, Integer intervalId) {
        List<MetricId> ids = toMetricIds(availableMetricsCall(entity, beginTime, endTime, intervalId));
        logger.debug("{} exposes {} metric instance(s)", entity, ids.size());
        return ids;
    }

    public List<MetricId> availableMetrics(ObjectRef entity) {
        return availableMetrics(entity, null, null, null);
    }

    public SoapCall availableMetricsCall(ObjectRef entity, Instant beginTime, Instant endTime, Integer intervalId) {
        requireEntity(entity);
        Session session = sessionManager.requireAuthenticated();
        return sessionManager.call(session, new AvailableMetricRequest(
            session.endpoint(Session.PERF_MANAGER), entity, beginTime, endTime, intervalId));
    }

    /**
     * Fetches the metadata of a batch of counters in one call.
     * 
     * @param counterIds counter ids, not empty
     * @return descriptors in server order
     * @throws ValidationException if no counter id is given
     */
    public List<MetricDescriptor> counterMetadata(List<Integer> counterIds) {
        List<MetricDescriptor> descriptors = toDescriptors(counterMetadataCall(counterIds));
        logger.info("Fetched metadata for {} of {} requested counter(s)", descriptors.size(), counterIds.size());
        return descriptors;
    }

    public SoapCall counterMetadataCall(List<Integer> counterIds) {
        if (counterIds == null || counterIds.isEmpty()) {
            throw new ValidationException("Invalid function call, must supply array of counterIds");
        }
        for (Integer counterId : counterIds) {
            if (counterId == null) {
                throw new ValidationException("Invalid function call, counterIds must not contain null");
            }
        }
        Session session = sessionManager.requireAuthenticated();
        return sessionManager.call(session, new PerfCounterRequest(session.endpoint(Session.PERF_MANAGER), counterIds));
    }

    /**
     * Queries metric values; the answer is returned as transcoded.
     */
    public JsonNode metricValues(PerfQuery query) {
        return metricValuesCall(query).getValue();
    }

    public SoapCall metricValuesCall(PerfQuery query) {
        validate(query);
        Session session = sessionManager.requireAuthenticated();
        return sessionManager.call(session, new PerfQueryRequest(session.endpoint(Session.PERF_MANAGER), query));
    }

    /**
     * Queries metric values in CSV form and parses them into series.
     * The format requested by the query is ignored.
     */
    public List<MetricSeries> metricSeries(PerfQuery query) {
        PerfQuery csv = query != null ? query.withFormat(PerfFormat.CSV) : null;
        List<MetricSeries> series = toSeries(csv, metricValuesCall(csv));
        logger.info("Parsed {} series for {}", series.size(), csv.getEntity());
        return series;
    }

    /**
     * Decodes a {@code QueryAvailablePerfMetric} call.
     */
    public static List<MetricId> toMetricIds(SoapCall call) {
        List<MetricId> ids = new ArrayList<>();
        for (JsonNode metric : returnval(call)) {
            ids.add(new MetricId(counterId(metric.path("counterId")), metric.path("instance").asText("")));
        }
        return ids;
    }

    /**
     * Decodes a {@code QueryPerfCounter} call.
     */
    public static List<MetricDescriptor> toDescriptors(SoapCall call) {
        List<MetricDescriptor> descriptors = new ArrayList<>();
        for (JsonNode info : returnval(call)) {
            descriptors.add(toDescriptor(info));
        }
        return descriptors;
    }

    /**
     * Decodes a CSV-format {@code QueryPerf} call issued for {@code query}.
     */
    public static List<MetricSeries> toSeries(PerfQuery query, SoapCall call) {
        return PerfSeriesParser.parse(query.getEntity(), call.getValue());
    }

    private static void validate(PerfQuery query) {
        if (query == null) {
            throw new ValidationException("Invalid function call, must supply a performance query");
        }
        requireEntity(query.getEntity());
        if (query.getMetrics().isEmpty()) {
            throw new ValidationException("Invalid function call, must supply array of metric definitions.  " +
                                          "ex: [ {\"id\": 2, \"instance\": \"\"}, {\"id\": 266, \"instance\": \"FILEGROUP\"} ]");
        }
        for (MetricId metric : query.getMetrics()) {
            if (metric == null || metric.getCounterId() < 0) {
                throw new ValidationException("Malformed array of metric definitions.  Each entry must have id and instance.");
            }
        }
        if (query.getMaxSample() != null && query.getMaxSample() < 1) {
            throw new ValidationException("maxSample must be positive");
        }
    }

    private static void requireEntity(ObjectRef entity) {
        if (entity == null || entity.getKind().trim().isEmpty() || entity.getId().trim().isEmpty()) {
            throw new ValidationException("Invalid function call, must supply itemType and itemID");
        }
    }

    private static JsonNode returnval(SoapCall call) {
        JsonNode returnval = call.getValue().path("returnval");
        if (!returnval.isArray()) {
            throw new ProtocolException(call.getOperation().getOperationName() + " response has no returnval list");
        }
        return returnval;
    }

    static MetricDescriptor toDescriptor(JsonNode info) {
        return new MetricDescriptor(
            counterId(info.path("key")),
            info.path("groupInfo").path("label").asText(""),
            info.path("nameInfo").path("label").asText(""),
            info.path("nameInfo").path("summary").asText(""),
            info.path("unitInfo").path("label").asText(""),
            info.path("rollupType").asText(""),
            info.path("statsType").asText(""),
            info.path("level").asInt(0));
    }

    private static int counterId(JsonNode node) {
        String text = node.asText("");
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new ProtocolException("Malformed counter id '" + text + "'", e);
        }
    }
}
