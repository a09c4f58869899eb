package org.tanzu.vcenterperf.perf;

/**
 * A counter instance available on one object, joined with the shared descriptor.
 */
public final class EnrichedMetric {

    private final MetricDescriptor descriptor;
    private final String instance;

    public EnrichedMetric(MetricDescriptor descriptor, String instance) {
        this.descriptor = descriptor;
        this.instance = instance;
    }

    public int getCounterId() { return descriptor.getCounterId(); }
    public MetricDescriptor getDescriptor() { return descriptor; }
    public String getInstance() { return instance; }

    @Override
    public String toString() {
        return "EnrichedMetric{" + descriptor.getCounterId() + ", instance='" + instance + "'}";
    }
}
