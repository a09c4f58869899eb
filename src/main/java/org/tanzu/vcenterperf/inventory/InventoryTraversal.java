package org.tanzu.vcenterperf.inventory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterperf.error.ProtocolException;
import org.tanzu.vcenterperf.error.ValidationException;
import org.tanzu.vcenterperf.session.Session;
import org.tanzu.vcenterperf.session.SessionManager;
import org.tanzu.vcenterperf.soap.ObjectRef;
import org.tanzu.vcenterperf.soap.SoapCall;

/**
 * Retrieves flat property sets for every inventory object of one type.
 * 
 * The walk starts at the root folder and follows a fixed traversal graph that
 * reaches datacenters, folders, compute resources, hosts, resource pools and
 * virtual machines. The graph is built once and reused for every call.
 */
@Component
public class InventoryTraversal {

    private static final Logger logger = LoggerFactory.getLogger(InventoryTraversal.class);

    public static final String FOLDER = "folderTraversalSpec";
    public static final String DATACENTER_DATASTORE = "datacenterDatastoreTraversalSpec";
    public static final String DATACENTER_NETWORK = "datacenterNetworkTraversalSpec";
    public static final String DATACENTER_VM = "datacenterVmTraversalSpec";
    public static final String DATACENTER_HOST = "datacenterHostTraversalSpec";
    public static final String COMPUTE_RESOURCE_HOST = "computeResourceHostTraversalSpec";
    public static final String COMPUTE_RESOURCE_RP = "computeResourceRpTraversalSpec";
    public static final String RESOURCE_POOL = "resourcePoolTraversalSpec";
    public static final String HOST_VM = "hostVmTraversalSpec";
    public static final String RESOURCE_POOL_VM = "resourcePoolVmTraversalSpec";

    /** Traversal graph from the root folder to every managed entity. */
    public static final List<TraversalSpec> DEFAULT_SPECS = List.of(
        TraversalSpec.of(FOLDER, "Folder", "childEntity",
            FOLDER, DATACENTER_HOST, DATACENTER_VM, DATACENTER_DATASTORE, DATACENTER_NETWORK,
            COMPUTE_RESOURCE_RP, COMPUTE_RESOURCE_HOST, HOST_VM, RESOURCE_POOL_VM),
        TraversalSpec.of(DATACENTER_DATASTORE, "Datacenter", "datastoreFolder", FOLDER),
        TraversalSpec.of(DATACENTER_NETWORK, "Datacenter", "networkFolder", FOLDER),
        TraversalSpec.of(DATACENTER_VM, "Datacenter", "vmFolder", FOLDER),
        TraversalSpec.of(DATACENTER_HOST, "Datacenter", "hostFolder", FOLDER),
        TraversalSpec.of(COMPUTE_RESOURCE_HOST, "ComputeResource", "host"),
        TraversalSpec.of(COMPUTE_RESOURCE_RP, "ComputeResource", "resourcePool",
            RESOURCE_POOL, RESOURCE_POOL_VM),
        TraversalSpec.of(RESOURCE_POOL, "ResourcePool", "resourcePool",
            RESOURCE_POOL, RESOURCE_POOL_VM),
        TraversalSpec.of(HOST_VM, "HostSystem", "vm", FOLDER),
        TraversalSpec.of(RESOURCE_POOL_VM, "ResourcePool", "vm")
    );

    static {
        checkGraph(DEFAULT_SPECS);
    }

    private final SessionManager sessionManager;

    public InventoryTraversal(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    /**
     * Retrieves the requested properties of every object of {@code objectType}.
     * 
     * @param objectType managed object type, e.g. {@code VirtualMachine}
     * @param propertyPaths property paths to fetch, may be empty
     * @param includeAll whether to fetch every property of the objects
     * @return one property set per object, in server order
     * @throws ValidationException if the type is blank or the paths are missing
     * @throws org.tanzu.vcenterperf.error.SessionException if not logged in
     */
    public List<PropertySet> retrieve(String objectType, Collection<String> propertyPaths, boolean includeAll) {
        SoapCall call = retrieveCall(objectType, propertyPaths, includeAll);
        List<PropertySet> sets = toPropertySets(objectType, call.getValue());
        logger.info("Retrieved {} {} object(s)", sets.size(), objectType);
        return sets;
    }

    /**
     * Issues the {@code RetrieveProperties} call and returns it undecoded, for diagnostics.
     */
    public SoapCall retrieveCall(String objectType, Collection<String> propertyPaths, boolean includeAll) {
        if (objectType == null || objectType.trim().isEmpty()) {
            throw new ValidationException("Invalid function call, must supply itemType");
        }
        if (propertyPaths == null) {
            throw new ValidationException("Invalid function call, property paths must be a list");
        }
        for (String path : propertyPaths) {
            if (path == null || path.trim().isEmpty()) {
                throw new ValidationException("Invalid function call, property paths must not be blank");
            }
        }
        Session session = sessionManager.requireAuthenticated();

        logger.debug("Retrieving {} properties {} (all={})", objectType, propertyPaths, includeAll);
        RetrievePropertiesRequest request = new RetrievePropertiesRequest(
            session.endpoint(Session.PROPERTY_COLLECTOR),
            session.endpoint(Session.ROOT_FOLDER),
            objectType,
            new ArrayList<>(propertyPaths),
            includeAll,
            DEFAULT_SPECS);
        return sessionManager.call(session, request);
    }

    /**
     * Decodes the {@code returnval} list of a {@code RetrieveProperties} answer.
     * 
     * @param objectType kind given to every returned reference
     * @param value the transcoded response element
     * @return property sets in document order
     */
    static List<PropertySet> toPropertySets(String objectType, JsonNode value) {
        JsonNode returnval = value.path("returnval");
        if (!returnval.isArray()) {
            throw new ProtocolException("RetrieveProperties response has no returnval list");
        }
        List<PropertySet> sets = new ArrayList<>(returnval.size());
        for (JsonNode content : returnval) {
            String id = content.path("obj").asText("");
            if (id.isEmpty()) {
                throw new ProtocolException("RetrieveProperties result without an object reference");
            }
            Map<String, JsonNode> properties = new LinkedHashMap<>();
            for (JsonNode property : content.path("propSet")) {
                String name = property.path("name").asText("");
                if (name.isEmpty()) {
                    continue;
                }
                JsonNode val = property.get("val");
                properties.put(name, val != null ? val : NullNode.getInstance());
            }
            sets.add(new PropertySet(new ObjectRef(objectType, id), properties));
        }
        return sets;
    }

    /**
     * Every name referenced from a select set must be defined in the graph.
     */
    static void checkGraph(List<TraversalSpec> specs) {
        Set<String> names = new HashSet<>();
        for (TraversalSpec spec : specs) {
            if (!names.add(spec.getName())) {
                throw new IllegalStateException("Duplicate traversal spec " + spec.getName());
            }
        }
        for (TraversalSpec spec : specs) {
            for (String next : spec.getSelectSet()) {
                if (!names.contains(next)) {
                    throw new IllegalStateException(spec.getName() + " references unknown traversal spec " + next);
                }
            }
        }
    }
}
