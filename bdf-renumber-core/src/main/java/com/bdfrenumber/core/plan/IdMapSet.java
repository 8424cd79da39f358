package com.bdfrenumber.core.plan;

import com.bdfrenumber.core.model.Namespace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * All ID maps of a plan, with a namespace-wide lookup.
 *
 * <p>The lookup is the union of the per-file maps of a namespace. It is a
 * function because every old ID is owned by exactly one file: entity IDs are
 * unique, and a set ID defined in several files belongs to the first one.
 */
public final class IdMapSet {

    private final List<IdMap> maps;
    private final Map<Namespace, NavigableMap<Integer, Integer>> union = new EnumMap<>(Namespace.class);
    private final Map<Namespace, NavigableSet<Integer>> newIds = new EnumMap<>(Namespace.class);

    public IdMapSet(List<IdMap> maps) {
        this.maps = List.copyOf(maps);
        for (IdMap map : this.maps) {
            NavigableMap<Integer, Integer> namespaceUnion = union.computeIfAbsent(map.namespace(), n -> new TreeMap<>());
            map.mapping().forEach(namespaceUnion::putIfAbsent);
        }
        union.forEach((namespace, mapping) -> newIds.put(namespace, new TreeSet<>(mapping.values())));
    }

    public static IdMapSet empty() {
        return new IdMapSet(List.of());
    }

    /**
     * Maps an old ID through the namespace-wide union.
     *
     * @param namespace namespace
     * @param oldId old ID
     * @return new ID, or -1 when no file maps the ID
     */
    public int lookup(Namespace namespace, int oldId) {
        Integer newId = union(namespace).get(oldId);
        return newId == null ? -1 : newId;
    }

    public boolean contains(Namespace namespace, int oldId) {
        return union(namespace).containsKey(oldId);
    }

    /**
     * Old IDs of a namespace that some file maps.
     *
     * @param namespace namespace
     * @return sorted, unmodifiable old IDs
     */
    public NavigableSet<Integer> mappedIds(Namespace namespace) {
        NavigableMap<Integer, Integer> mapping = union.get(namespace);
        return mapping == null
            ? Collections.emptyNavigableSet()
            : Collections.unmodifiableNavigableSet(mapping.navigableKeySet());
    }

    /**
     * IDs of a namespace that the maps assign.
     *
     * @param namespace namespace
     * @return sorted, unmodifiable new IDs
     */
    public NavigableSet<Integer> newIds(Namespace namespace) {
        NavigableSet<Integer> ids = newIds.get(namespace);
        return ids == null ? Collections.emptyNavigableSet() : Collections.unmodifiableNavigableSet(ids);
    }

    /**
     * Union map of a namespace.
     *
     * @param namespace namespace
     * @return unmodifiable old-to-new map
     */
    public NavigableMap<Integer, Integer> union(Namespace namespace) {
        NavigableMap<Integer, Integer> mapping = union.get(namespace);
        return mapping == null ? Collections.emptyNavigableMap() : Collections.unmodifiableNavigableMap(mapping);
    }

    public List<IdMap> maps() {
        return maps;
    }

    /**
     * Maps of one namespace, in file order.
     *
     * @param namespace namespace
     * @return per-file maps
     */
    public List<IdMap> maps(Namespace namespace) {
        List<IdMap> result = new ArrayList<>();
        for (IdMap map : maps) {
            if (map.namespace() == namespace) {
                result.add(map);
            }
        }
        return result;
    }

    /**
     * Map of one file and namespace.
     *
     * @param fileIndex file index
     * @param namespace namespace
     * @return the map, if the file has one for the namespace
     */
    public Optional<IdMap> map(int fileIndex, Namespace namespace) {
        return maps.stream()
            .filter(m -> m.fileIndex() == fileIndex && m.namespace() == namespace)
            .findFirst();
    }

    /**
     * Number of IDs that change value.
     *
     * @return count of entries with a new ID different from the old one
     */
    public int changedCount() {
        int changed = 0;
        for (IdMap map : maps) {
            for (Map.Entry<Integer, Integer> entry : map.mapping().entrySet()) {
                if (!entry.getKey().equals(entry.getValue())) {
                    changed++;
                }
            }
        }
        return changed;
    }
}
