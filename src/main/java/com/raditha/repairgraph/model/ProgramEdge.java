package com.raditha.repairgraph.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A directed, typed edge between two node ids of the same graph.
 * Identity is (source, target, kind); the label is informational and does not take part in
 * equality, so an edge set never holds two edges of the same kind between the same pair.
 */
public record ProgramEdge(int source, int target, EdgeKind kind, String label) {

    public ProgramEdge {
        Objects.requireNonNull(kind, "kind");
        label = Optional.ofNullable(label).orElse("");
    }

    public ProgramEdge(int source, int target, EdgeKind kind) {
        this(source, target, kind, "");
    }

    /**
     * Same edge with its endpoints passed through an id remapping.
     */
    public ProgramEdge remap(int newSource, int newTarget) {
        return new ProgramEdge(newSource, newTarget, kind, label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProgramEdge other)) {
            return false;
        }
        return source == other.source && target == other.target && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, kind);
    }

    @Override
    public String toString() {
        return "Edge(" + source + " -> " + target + ", " + kind + ")";
    }
}
