package org.tanzu.vcenterperf.perf;

import java.util.Collections;
import java.util.List;

import org.tanzu.vcenterperf.soap.ObjectRef;

/**
 * Time series of one counter instance on one entity.
 */
public final class MetricSeries {

    private final ObjectRef entity;
    private final MetricId metricId;
    private final List<PerfSample> samples;

    public MetricSeries(ObjectRef entity, MetricId metricId, List<PerfSample> samples) {
        this.entity = entity;
        this.metricId = metricId;
        this.samples = Collections.unmodifiableList(samples);
    }

    public ObjectRef getEntity() { return entity; }
    public MetricId getMetricId() { return metricId; }
    public List<PerfSample> getSamples() { return samples; }

    @Override
    public String toString() {
        return "MetricSeries{entity=" + entity + ", metricId=" + metricId + ", samples=" + samples.size() + "}";
    }
}
