package org.tanzu.vcenterperf.inventory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Named rule for walking from objects of one type to related objects through a property.
 * 
 * Follow-up rules are referenced by name in {@code selectSet}, which is how
 * recursive walks (a folder inside a folder) are expressed without unrolling.
 */
public final class TraversalSpec {

    private final String name;
    private final String type;
    private final String path;
    private final boolean skip;
    private final List<String> selectSet;

    public TraversalSpec(String name, String type, String path, boolean skip, List<String> selectSet) {
        this.name = name;
        this.type = type;
        this.path = path;
        this.skip = skip;
        this.selectSet = Collections.unmodifiableList(selectSet);
    }

    /**
     * Creates a non-skipping rule.
     */
    public static TraversalSpec of(String name, String type, String path, String... selectSet) {
        return new TraversalSpec(name, type, path, false, Arrays.asList(selectSet));
    }

    public String getName() { return name; }
    public String getType() { return type; }
    public String getPath() { return path; }
    public boolean isSkip() { return skip; }
    public List<String> getSelectSet() { return selectSet; }

    @Override
    public String toString() {
        return "TraversalSpec{" + name + ": " + type + "." + path + " -> " + selectSet + "}";
    }
}
