package com.bdfrenumber.core.plan;

import com.bdfrenumber.core.model.IdRange;
import com.bdfrenumber.core.model.Namespace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bijective old-to-new ID map of one file and namespace.
 *
 * @param fileIndex owning file in the include tree
 * @param namespace namespace
 * @param range assigned range, or null for a frozen namespace mapped to itself
 * @param mapping old ID to new ID, in ascending old ID order
 */
public record IdMap(int fileIndex, Namespace namespace, IdRange range, Map<Integer, Integer> mapping) {

    /**
     * Compact constructor with validation.
     */
    public IdMap {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(mapping, "mapping must not be null");
        mapping = Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
    }

    /**
     * Returns the new ID of an old one.
     *
     * @param oldId old ID
     * @return new ID, or null when the ID is not in this map
     */
    public Integer newId(int oldId) {
        return mapping.get(oldId);
    }

    public int size() {
        return mapping.size();
    }

    public boolean isIdentity() {
        return range == null;
    }
}
