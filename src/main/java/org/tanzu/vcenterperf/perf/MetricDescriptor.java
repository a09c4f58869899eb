package org.tanzu.vcenterperf.perf;

/**
 * Server-side metadata of a performance counter.
 * 
 * Descriptors are immutable and shared: the same instance is referenced by
 * every object of a pipeline run that exposes the counter.
 */
public final class MetricDescriptor {

    private final int counterId;
    private final String groupLabel;
    private final String nameLabel;
    private final String description;
    private final String unit;
    private final String rollupType;
    private final String statsType;
    private final int level;

    public MetricDescriptor(int counterId, String groupLabel, String nameLabel, String description,
                            String unit, String rollupType, String statsType, int level) {
        this.counterId = counterId;
        this.groupLabel = groupLabel;
        this.nameLabel = nameLabel;
        this.description = description;
        this.unit = unit;
        this.rollupType = rollupType;
        this.statsType = statsType;
        this.level = level;
    }

    public int getCounterId() { return counterId; }
    public String getGroupLabel() { return groupLabel; }
    public String getNameLabel() { return nameLabel; }
    public String getDescription() { return description; }
    public String getUnit() { return unit; }
    public String getRollupType() { return rollupType; }
    public String getStatsType() { return statsType; }
    public int getLevel() { return level; }

    /**
     * @return label shown to users, e.g. {@code "CPU - Usage"}
     */
    public String getDisplayName() {
        return groupLabel + " - " + nameLabel;
    }

    @Override
    public String toString() {
        return "MetricDescriptor{" + counterId + " '" + getDisplayName() + "' " + unit + ", " + rollupType + "}";
    }
}
