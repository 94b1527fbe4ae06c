package com.grapher.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable point-in-time copy of a graph node.
 *
 * <p>Property values may be {@code null}, so the property map is an
 * unmodifiable view over a private copy rather than {@link Map#copyOf}.</p>
 *
 * @param id the unique, non-empty node id
 * @param labels the node labels, order irrelevant
 * @param properties the node properties
 */
public record Node(
        String id,
        Set<String> labels,
        Map<String, Object> properties) {

    /**
     * Creates a node copy, defensively copying labels and properties.
     */
    public Node {
        Objects.requireNonNull(id, "id");
        labels = labels == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(labels));
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Returns whether the node carries the given label.
     *
     * @param label the label to look for
     * @return true if present
     */
    public boolean hasLabel(final String label) {
        return labels.contains(label);
    }

    /**
     * Returns a property value.
     *
     * @param key the property key
     * @return the value, or {@code null} if absent
     */
    public Object property(final String key) {
        return properties.get(key);
    }
}
