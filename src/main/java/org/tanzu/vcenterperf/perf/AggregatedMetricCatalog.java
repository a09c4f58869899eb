package org.tanzu.vcenterperf.perf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deduplicated descriptors of one pipeline run, keyed by counter id in first-seen order.
 */
public final class AggregatedMetricCatalog {

    private final Map<Integer, MetricDescriptor> descriptors;

    public AggregatedMetricCatalog(Map<Integer, MetricDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(new LinkedHashMap<>(descriptors));
    }

    public Map<Integer, MetricDescriptor> getDescriptors() {
        return descriptors;
    }

    /**
     * @return the descriptor, or null for a counter outside this catalog
     */
    public MetricDescriptor get(int counterId) {
        return descriptors.get(counterId);
    }

    public int size() {
        return descriptors.size();
    }

    @Override
    public String toString() {
        return "AggregatedMetricCatalog" + descriptors.keySet();
    }
}
