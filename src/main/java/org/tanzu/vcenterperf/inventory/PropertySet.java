package org.tanzu.vcenterperf.inventory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import org.tanzu.vcenterperf.soap.ObjectRef;

/**
 * One inventory object with the properties retrieved for it, keyed by property path.
 * Values are kept as the transcoder produced them.
 */
public final class PropertySet {

    private final ObjectRef obj;
    private final Map<String, JsonNode> properties;

    public PropertySet(ObjectRef obj, Map<String, JsonNode> properties) {
        this.obj = obj;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public ObjectRef getObj() { return obj; }
    public Map<String, JsonNode> getProperties() { return properties; }

    /**
     * @return the text of the {@code name} property, or null when it was not retrieved
     */
    public String getName() {
        JsonNode name = properties.get("name");
        return name != null && name.isValueNode() ? name.asText() : null;
    }

    @Override
    public String toString() {
        return "PropertySet{obj=" + obj + ", properties=" + properties.keySet() + "}";
    }
}
