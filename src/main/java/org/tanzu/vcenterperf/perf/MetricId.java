package org.tanzu.vcenterperf.perf;

import java.util.Objects;

/**
 * A counter available on an entity, optionally narrowed to one instance
 * (a disk, a NIC...). The empty instance means the aggregate.
 */
public final class MetricId {

    private final int counterId;
    private final String instance;

    public MetricId(int counterId, String instance) {
        this.counterId = counterId;
        this.instance = instance != null ? instance : "";
    }

    public int getCounterId() { return counterId; }
    public String getInstance() { return instance; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricId)) return false;
        MetricId other = (MetricId) o;
        return counterId == other.counterId && instance.equals(other.instance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counterId, instance);
    }

    @Override
    public String toString() {
        return instance.isEmpty() ? String.valueOf(counterId) : counterId + "[" + instance + "]";
    }
}
