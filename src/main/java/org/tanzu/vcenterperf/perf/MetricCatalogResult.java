package org.tanzu.vcenterperf.perf;

import java.util.Collections;
import java.util.List;

/**
 * Output of a {@link MetricPipeline} run.
 */
public final class MetricCatalogResult {

    private final InventoryRoot root;
    private final List<EnrichedObject> objects;
    private final AggregatedMetricCatalog catalog;

    public MetricCatalogResult(InventoryRoot root, List<EnrichedObject> objects, AggregatedMetricCatalog catalog) {
        this.root = root;
        this.objects = Collections.unmodifiableList(objects);
        this.catalog = catalog;
    }

    public InventoryRoot getRoot() { return root; }
    public List<EnrichedObject> getObjects() { return objects; }
    public AggregatedMetricCatalog getCatalog() { return catalog; }

    @Override
    public String toString() {
        return "MetricCatalogResult{root=" + root + ", objects=" + objects.size() + ", catalog=" + catalog.size() + "}";
    }
}
