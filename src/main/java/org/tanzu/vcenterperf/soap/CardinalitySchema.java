package org.tanzu.vcenterperf.soap;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Declared cardinality of response elements, consulted by {@link DocumentTranscoder}.
 *
 * A document alone cannot tell a single optional element from a one-element list,
 * so every element whose cardinality matters is declared here. Array fields are
 * always transcoded as JSON arrays, whatever the number of occurrences. An array
 * field declared under a parent tag is also materialized as an empty array when the
 * parent has no such child.
 *
 * Elements that are not declared keep the legacy scalar treatment: repeated
 * siblings collapse to the last occurrence.
 */
public final class CardinalitySchema {

    /** Schema without any array field. */
    public static final CardinalitySchema NONE = builder().build();

    private final Set<String> arrayFields;
    private final Map<String, Set<String>> requiredArrays;

    private CardinalitySchema(Set<String> arrayFields, Map<String, Set<String>> requiredArrays) {
        this.arrayFields = Collections.unmodifiableSet(arrayFields);
        this.requiredArrays = Collections.unmodifiableMap(requiredArrays);
    }

    /**
     * Shortcut for a schema made of plain array fields.
     * @param names element local names
     * @return the schema
     */
    public static CardinalitySchema arrays(String... names) {
        return builder().array(names).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param name element local name
     * @return true if the element is always an array
     */
    public boolean isArray(String name) {
        return arrayFields.contains(name);
    }

    /**
     * @param parent element local name
     * @return array fields that must exist on the given parent, possibly empty
     */
    public Set<String> requiredArraysOf(String parent) {
        return requiredArrays.getOrDefault(parent, Collections.emptySet());
    }

    @Override
    public String toString() {
        return "CardinalitySchema{arrays=" + arrayFields + ", required=" + requiredArrays + "}";
    }

    public static final class Builder {

        private final Set<String> arrayFields = new LinkedHashSet<>();
        private final Map<String, Set<String>> requiredArrays = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder array(String... names) {
            arrayFields.addAll(Arrays.asList(names));
            return this;
        }

        /**
         * Declares array fields that are always present on {@code parent}.
         */
        public Builder arrayUnder(String parent, String... names) {
            array(names);
            requiredArrays.computeIfAbsent(parent, p -> new LinkedHashSet<>()).addAll(Arrays.asList(names));
            return this;
        }

        public CardinalitySchema build() {
            Map<String, Set<String>> required = new LinkedHashMap<>();
            requiredArrays.forEach((parent, names) ->
                required.put(parent, Collections.unmodifiableSet(new LinkedHashSet<>(names))));
            return new CardinalitySchema(new LinkedHashSet<>(arrayFields), required);
        }
    }
}
