package com.raditha.repairgraph.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A node of a program graph. Immutable once added to a graph.
 *
 * @param id            identifier, unique within its graph only
 * @param kind          structural kind
 * @param label         matching label: two nodes substitute for free iff their labels are equal
 * @param position      source position, for traceability
 * @param statementKeys identities of the source statements this node stands for; the merger
 *                      coalesces nodes of different graphs that share a key
 * @param attributes    small free-form metadata (variable, version, unreachable flag, ...)
 */
public record ProgramNode(
        int id,
        NodeKind kind,
        String label,
        SourcePosition position,
        Set<String> statementKeys,
        Map<String, String> attributes) {

    public static final String ATTR_VARIABLE = "variable";
    public static final String ATTR_VERSION = "version";
    public static final String ATTR_UNREACHABLE = "unreachable";
    public static final String ATTR_CALLABLE = "callable";

    public ProgramNode {
        Objects.requireNonNull(kind, "kind");
        label = Optional.ofNullable(label).orElse("");
        position = Optional.ofNullable(position).orElse(SourcePosition.UNKNOWN);
        statementKeys = statementKeys == null ? Set.of() : Set.copyOf(statementKeys);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public boolean isUnreachable() {
        return Boolean.parseBoolean(attributes.get(ATTR_UNREACHABLE));
    }

    /**
     * The versioned variable this node stands for, when it is a definition, use or phi.
     */
    public Optional<VersionedVariable> variable() {
        String name = attributes.get(ATTR_VARIABLE);
        String version = attributes.get(ATTR_VERSION);
        if (name == null || version == null) {
            return Optional.empty();
        }
        return Optional.of(new VersionedVariable(name, Integer.parseInt(version)));
    }

    public ProgramNode withId(int newId) {
        return new ProgramNode(newId, kind, label, position, statementKeys, attributes);
    }

    public ProgramNode withAttribute(String name, String value) {
        Map<String, String> copy = new HashMap<>(attributes);
        copy.put(name, value);
        return new ProgramNode(id, kind, label, position, statementKeys, copy);
    }

    @Override
    public String toString() {
        return "Node(" + id + ", " + kind + ", " + label + ")";
    }
}
