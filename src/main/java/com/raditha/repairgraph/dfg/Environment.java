package com.raditha.repairgraph.dfg;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reaching versions along one control-flow path: base name to the id of the version node
 * (definition, phi or input) that a read of that name resolves to.
 * <p>
 * Mutable; branches work on copies.
 */
final class Environment {

    private final Map<String, Integer> versions;

    Environment() {
        this.versions = new LinkedHashMap<>();
    }

    private Environment(Map<String, Integer> versions) {
        this.versions = new LinkedHashMap<>(versions);
    }

    Environment copy() {
        return new Environment(versions);
    }

    boolean has(String name) {
        return versions.containsKey(name);
    }

    Integer get(String name) {
        return versions.get(name);
    }

    void put(String name, int versionNode) {
        versions.put(name, versionNode);
    }

    Set<String> names() {
        return versions.keySet();
    }
}
