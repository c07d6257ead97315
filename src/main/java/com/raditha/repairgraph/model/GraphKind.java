package com.raditha.repairgraph.model;

/**
 * The graph views built for a version of a program fragment.
 */
public enum GraphKind {
    CFG("cfg"),
    DFG("dfg"),
    CALL_GRAPH("callgraph"),
    PDG("pdg"),
    CPG("cpg");

    private final String key;

    GraphKind(String key) {
        this.key = key;
    }

    /**
     * Short lower-case name used in configuration files, CLI options and exported columns.
     */
    public String key() {
        return key;
    }

    /**
     * Check if this graph is produced by merging other graphs.
     */
    public boolean isMerged() {
        return this == PDG || this == CPG;
    }

    /**
     * Resolve a kind from its key or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if no kind matches
     */
    public static GraphKind fromString(String value) {
        for (GraphKind kind : values()) {
            if (kind.key.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown graph kind: " + value);
    }
}
