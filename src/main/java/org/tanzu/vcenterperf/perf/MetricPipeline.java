package org.tanzu.vcenterperf.perf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterperf.config.VCenterConfig;
import org.tanzu.vcenterperf.error.ProtocolException;
import org.tanzu.vcenterperf.error.TransportException;
import org.tanzu.vcenterperf.inventory.InventoryTraversal;
import org.tanzu.vcenterperf.inventory.PropertySet;
import org.tanzu.vcenterperf.soap.ObjectRef;

/**
 * Builds the metric catalog of an inventory root.
 * 
 * A run retrieves the objects of the root with their names, discovers the
 * metrics available on each of them, fetches the metadata of the distinct
 * counters in one batch and joins everything into {@link EnrichedObject}s that
 * share the descriptors of one {@link AggregatedMetricCatalog}.
 * 
 * Discovery runs sequentially unless {@code vcenter.pipeline.parallelism} is
 * greater than one, in which case it fans out on a pool created for the run.
 * Results keep the inventory order either way. The first failure aborts the run.
 */
@Component
public class MetricPipeline {

    private static final Logger logger = LoggerFactory.getLogger(MetricPipeline.class);

    private final InventoryTraversal inventory;
    private final PerformanceManager performanceManager;
    private final VCenterConfig config;

    public MetricPipeline(InventoryTraversal inventory, PerformanceManager performanceManager, VCenterConfig config) {
        this.inventory = inventory;
        this.performanceManager = performanceManager;
        this.config = config;
    }

    /**
     * Runs the pipeline for one inventory root.
     * 
     * @param root inventory root
     * @return the enriched objects and the shared catalog
     * @throws org.tanzu.vcenterperf.error.VCenterApiException from the first failing step
     */
    public MetricCatalogResult run(InventoryRoot root) {
        logger.info("=== METRIC CATALOG: {} ===", root);

        List<PropertySet> objects = inventory.retrieve(root.getObjectType(), Collections.singletonList("name"), false);

        List<List<MetricId>> discovered = discover(root, objects);

        Set<Integer> distinct = new LinkedHashSet<>();
        for (List<MetricId> ids : discovered) {
            for (MetricId id : ids) {
                distinct.add(id.getCounterId());
            }
        }

        AggregatedMetricCatalog catalog = fetchCatalog(new ArrayList<>(distinct));

        List<EnrichedObject> enriched = new ArrayList<>(objects.size());
        for (int i = 0; i < objects.size(); i++) {
            PropertySet object = objects.get(i);
            List<EnrichedMetric> metrics = new ArrayList<>(discovered.get(i).size());
            for (MetricId id : discovered.get(i)) {
                metrics.add(new EnrichedMetric(catalog.get(id.getCounterId()), id.getInstance()));
            }
            enriched.add(new EnrichedObject(object.getObj(), object.getName(), metrics));
        }

        logger.info("Metric catalog for {}: {} object(s), {} distinct counter(s)", root, enriched.size(), catalog.size());
        return new MetricCatalogResult(root, enriched, catalog);
    }

    private List<List<MetricId>> discover(InventoryRoot root, List<PropertySet> objects) {
        int parallelism = Math.min(config.getPipeline().getParallelism(), objects.size());
        if (parallelism <= 1) {
            List<List<MetricId>> discovered = new ArrayList<>(objects.size());
            for (PropertySet object : objects) {
                discovered.add(performanceManager.availableMetrics(entity(root, object)));
            }
            return discovered;
        }
        return discoverConcurrently(root, objects, parallelism);
    }

    /**
     * Fans discovery out over a fixed pool. Results are stored by object index;
     * the first failure cancels whatever is still pending and is rethrown.
     */
    private List<List<MetricId>> discoverConcurrently(InventoryRoot root, List<PropertySet> objects, int parallelism) {
        logger.debug("Discovering metrics of {} object(s) with {} thread(s)", objects.size(), parallelism);
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, new CustomizableThreadFactory("metric-discovery-"));
        List<List<MetricId>> discovered = new ArrayList<>(Collections.nCopies(objects.size(), (List<MetricId>) null));
        List<Future<Discovery>> futures = new ArrayList<>(objects.size());
        try {
            CompletionService<Discovery> completion = new ExecutorCompletionService<>(pool);
            for (int i = 0; i < objects.size(); i++) {
                final int index = i;
                final ObjectRef entity = entity(root, objects.get(i));
                futures.add(completion.submit(() -> new Discovery(index, performanceManager.availableMetrics(entity))));
            }
            for (int done = 0; done < objects.size(); done++) {
                Discovery result = completion.take().get();
                discovered.set(result.index, result.metrics);
            }
            return discovered;
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            logger.error("Metric discovery failed, aborting {} pipeline: {}", root, cause.getMessage());
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ProtocolException("Metric discovery failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while discovering metrics", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private AggregatedMetricCatalog fetchCatalog(List<Integer> counterIds) {
        if (counterIds.isEmpty()) {
            logger.info("No metrics discovered, skipping counter metadata");
            return new AggregatedMetricCatalog(Collections.emptyMap());
        }
        Map<Integer, MetricDescriptor> byId = new LinkedHashMap<>();
        for (MetricDescriptor descriptor : performanceManager.counterMetadata(counterIds)) {
            byId.put(descriptor.getCounterId(), descriptor);
        }
        Map<Integer, MetricDescriptor> ordered = new LinkedHashMap<>();
        for (Integer counterId : counterIds) {
            MetricDescriptor descriptor = byId.get(counterId);
            if (descriptor == null) {
                throw new ProtocolException("No metadata returned for counter " + counterId);
            }
            ordered.put(counterId, descriptor);
        }
        return new AggregatedMetricCatalog(ordered);
    }

    private static ObjectRef entity(InventoryRoot root, PropertySet object) {
        return new ObjectRef(root.getMetricEntityType(), object.getObj().getId());
    }

    private static void cancelAll(List<Future<Discovery>> futures) {
        for (Future<Discovery> future : futures) {
            future.cancel(true);
        }
    }

    private static final class Discovery {
        private final int index;
        private final List<MetricId> metrics;

        private Discovery(int index, List<MetricId> metrics) {
            this.index = index;
            this.metrics = metrics;
        }
    }
}
