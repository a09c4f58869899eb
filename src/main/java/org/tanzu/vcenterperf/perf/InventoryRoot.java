package org.tanzu.vcenterperf.perf;

/**
 * Inventory roots a metric catalog can be built for.
 */
public enum InventoryRoot {

    VIRTUAL_MACHINE("VirtualMachine", "VirtualMachine"),
    COMPUTE_RESOURCE("ComputeResource", "ComputeResource"),
    HOST_SYSTEM("HostSystem", "HostSystem");

    private final String objectType;
    private final String metricEntityType;

    InventoryRoot(String objectType, String metricEntityType) {
        this.objectType = objectType;
        this.metricEntityType = metricEntityType;
    }

    /** Type retrieved from the inventory. */
    public String getObjectType() {
        return objectType;
    }

    /** Entity type given to metric discovery for each retrieved object. */
    public String getMetricEntityType() {
        return metricEntityType;
    }
}
