package org.tanzu.vcenterperf.perf;

import java.util.Collections;
import java.util.List;

import org.tanzu.vcenterperf.soap.ObjectRef;

/**
 * An inventory object with the metrics it exposes, in discovery order.
 */
public final class EnrichedObject {

    private final ObjectRef obj;
    private final String name;
    private final List<EnrichedMetric> metrics;

    public EnrichedObject(ObjectRef obj, String name, List<EnrichedMetric> metrics) {
        this.obj = obj;
        this.name = name;
        this.metrics = Collections.unmodifiableList(metrics);
    }

    public ObjectRef getObj() { return obj; }
    public String getName() { return name; }
    public List<EnrichedMetric> getMetrics() { return metrics; }

    @Override
    public String toString() {
        return "EnrichedObject{obj=" + obj + ", name='" + name + "', metrics=" + metrics.size() + "}";
    }
}
