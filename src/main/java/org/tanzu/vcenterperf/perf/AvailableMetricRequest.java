package org.tanzu.vcenterperf.perf;

import java.time.Instant;

import javax.xml.stream.XMLStreamException;

import org.tanzu.vcenterperf.soap.ObjectRef;
import org.tanzu.vcenterperf.soap.SoapBodyWriter;
import org.tanzu.vcenterperf.soap.SoapOperation;
import org.tanzu.vcenterperf.soap.SoapRequest;

/**
 * {@code QueryAvailablePerfMetric} for one entity and an optional time window.
 */
class AvailableMetricRequest extends SoapRequest {

    private final ObjectRef perfManager;
    private final ObjectRef entity;
    private final Instant beginTime;
    private final Instant endTime;
    private final Integer intervalId;

    AvailableMetricRequest(ObjectRef perfManager, ObjectRef entity, Instant beginTime, Instant endTime,
                           Integer intervalId) {
        super(SoapOperation.QUERY_AVAILABLE_PERF_METRIC);
        this.perfManager = perfManager;
        this.entity = entity;
        this.beginTime = beginTime;
        this.endTime = endTime;
        this.intervalId = intervalId;
    }

    @Override
    protected void writeContent(SoapBodyWriter body) throws XMLStreamException {
        body.ref("_this", perfManager)
            .ref("entity", entity)
            .timestamp("beginTime", beginTime)
            .timestamp("endTime", endTime)
            .optional("intervalId", intervalId);
    }
}
