package org.tanzu.vcenterperf.perf;

import javax.xml.stream.XMLStreamException;

import org.tanzu.vcenterperf.soap.ObjectRef;
import org.tanzu.vcenterperf.soap.SoapBodyWriter;
import org.tanzu.vcenterperf.soap.SoapOperation;
import org.tanzu.vcenterperf.soap.SoapRequest;

/**
 * {@code QueryPerf} with a single query spec.
 */
class PerfQueryRequest extends SoapRequest {

    private final ObjectRef perfManager;
    private final PerfQuery query;

    PerfQueryRequest(ObjectRef perfManager, PerfQuery query) {
        super(SoapOperation.QUERY_PERF);
        this.perfManager = perfManager;
        this.query = query;
    }

    @Override
    protected void writeContent(SoapBodyWriter body) throws XMLStreamException {
        body.ref("_this", perfManager);
        body.start("querySpec")
            .ref("entity", query.getEntity())
            .timestamp("startTime", query.getStartTime())
            .timestamp("endTime", query.getEndTime())
            .optional("maxSample", query.getMaxSample());
        for (MetricId metric : query.getMetrics()) {
            body.start("metricId")
                .text("counterId", metric.getCounterId())
                .text("instance", metric.getInstance())
                .end();
        }
        body.optional("intervalId", query.getIntervalId())
            .text("format", query.getFormat().getWireName())
            .end();
    }
}
