package com.bdfrenumber.core.model;

import java.util.Arrays;
import java.util.List;

/**
 * Global identifier namespaces of a bulk data deck.
 *
 * <p>Declaration order is the canonical order used for Simple-mode block
 * allocation and for every per-namespace listing. IDs are unique within a
 * namespace but not across namespaces: element 10 and property 10 coexist.
 *
 * <p>Set namespaces ({@link #isSetNamespace()}) allow many cards under one ID
 * (several {@code FORCE} cards in load set 10). Contact IDs are unique per card
 * type only, so {@code BSURF 1} and {@code BCTSET 1} may coexist.
 */
public enum Namespace {
    NODE("nid", "Node ID", Uniqueness.NAMESPACE),
    ELEMENT("eid", "Element ID", Uniqueness.NAMESPACE),
    PROPERTY("pid", "Property ID", Uniqueness.NAMESPACE),
    MATERIAL("mid", "Material ID", Uniqueness.NAMESPACE),
    COORDINATE_SYSTEM("cid", "Coord ID", Uniqueness.NAMESPACE),
    CONSTRAINT_SET("spc_id", "SPC ID", Uniqueness.NONE),
    MPC_SET("mpc_id", "MPC ID", Uniqueness.NONE),
    LOAD_SET("load_id", "Load ID", Uniqueness.NONE),
    CONTACT("contact_id", "Contact ID", Uniqueness.CARD_TYPE),
    OUTPUT_SET("set_id", "Set ID", Uniqueness.NAMESPACE),
    METHOD("method_id", "Method ID", Uniqueness.NAMESPACE),
    TABLE("table_id", "Table ID", Uniqueness.NAMESPACE);

    /**
     * Scope within which a single ID may be defined only once.
     */
    public enum Uniqueness {
        /** One definition per ID across every card type of the namespace. */
        NAMESPACE,
        /** One definition per ID within each card type. */
        CARD_TYPE,
        /** Any number of cards may share an ID. */
        NONE
    }

    private final String key;
    private final String label;
    private final Uniqueness uniqueness;

    Namespace(String key, String label, Uniqueness uniqueness) {
        this.key = key;
        this.label = label;
        this.uniqueness = uniqueness;
    }

    /**
     * Short key used in snapshots and configuration (e.g. {@code nid}).
     *
     * @return namespace key
     */
    public String key() {
        return key;
    }

    /**
     * Human-readable label used in reports.
     *
     * @return display label
     */
    public String label() {
        return label;
    }

    /**
     * Whether several cards may share one ID in this namespace.
     *
     * @return true for constraint, MPC and load sets
     */
    public boolean isSetNamespace() {
        return uniqueness == Uniqueness.NONE;
    }

    /**
     * Scope within which an ID must be unique.
     *
     * @return uniqueness scope
     */
    public Uniqueness uniqueness() {
        return uniqueness;
    }

    /**
     * Returns all namespaces in canonical order.
     *
     * @return canonical order
     */
    public static List<Namespace> canonicalOrder() {
        return List.of(values());
    }

    /**
     * Returns the set namespaces, frozen when set renumbering is disabled.
     *
     * @return set namespaces in canonical order
     */
    public static List<Namespace> setNamespaces() {
        return Arrays.stream(values()).filter(Namespace::isSetNamespace).toList();
    }

    /**
     * Resolves a namespace from its key or enum name, case-insensitively.
     *
     * @param value key ({@code nid}) or name ({@code NODE})
     * @return matching namespace
     * @throws IllegalArgumentException if nothing matches
     */
    public static Namespace fromKey(String value) {
        for (Namespace namespace : values()) {
            if (namespace.key.equalsIgnoreCase(value) || namespace.name().equalsIgnoreCase(value)) {
                return namespace;
            }
        }
        throw new IllegalArgumentException("Unknown namespace: " + value);
    }
}
