package org.tanzu.vcenterperf.perf;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.tanzu.vcenterperf.soap.ObjectRef;

/**
 * Parameters of a {@code QueryPerf} call for one entity.
 * Optional parts are null when unset and are then left out of the request.
 */
public final class PerfQuery {

    private final ObjectRef entity;
    private final List<MetricId> metrics;
    private final Instant startTime;
    private final Instant endTime;
    private final Integer maxSample;
    private final Integer intervalId;
    private final PerfFormat format;

    private PerfQuery(Builder builder) {
        this.entity = builder.entity;
        this.metrics = Collections.unmodifiableList(new ArrayList<>(builder.metrics));
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.maxSample = builder.maxSample;
        this.intervalId = builder.intervalId;
        this.format = builder.format;
    }

    public static Builder builder(ObjectRef entity) {
        return new Builder(entity);
    }

    public ObjectRef getEntity() { return entity; }
    public List<MetricId> getMetrics() { return metrics; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public Integer getMaxSample() { return maxSample; }
    public Integer getIntervalId() { return intervalId; }
    public PerfFormat getFormat() { return format; }

    /**
     * @return a copy of this query asking for another output format
     */
    public PerfQuery withFormat(PerfFormat other) {
        return builder(entity)
            .metrics(metrics)
            .startTime(startTime)
            .endTime(endTime)
            .maxSample(maxSample)
            .intervalId(intervalId)
            .format(other)
            .build();
    }

    @Override
    public String toString() {
        return "PerfQuery{entity=" + entity + ", metrics=" + metrics + ", start=" + startTime +
               ", end=" + endTime + ", maxSample=" + maxSample + ", intervalId=" + intervalId +
               ", format=" + format + "}";
    }

    public static final class Builder {

        private final ObjectRef entity;
        private final List<MetricId> metrics = new ArrayList<>();
        private Instant startTime;
        private Instant endTime;
        private Integer maxSample;
        private Integer intervalId;
        private PerfFormat format = PerfFormat.CSV;

        private Builder(ObjectRef entity) {
            this.entity = entity;
        }

        public Builder metric(int counterId, String instance) {
            metrics.add(new MetricId(counterId, instance));
            return this;
        }

        public Builder metrics(Collection<MetricId> ids) {
            metrics.addAll(ids);
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder maxSample(Integer maxSample) {
            this.maxSample = maxSample;
            return this;
        }

        public Builder intervalId(Integer intervalId) {
            this.intervalId = intervalId;
            return this;
        }

        public Builder format(PerfFormat format) {
            this.format = format != null ? format : PerfFormat.CSV;
            return this;
        }

        public PerfQuery build() {
            return new PerfQuery(this);
        }
    }
}
