package com.raditha.repairgraph.model;

/**
 * Kind of an edge. Two edges between the same pair of nodes are distinct when their kinds differ.
 */
public enum EdgeKind {
    CONTROL_FLOW,
    CONTROL_FLOW_TRUE,
    CONTROL_FLOW_FALSE,
    CONTROL_FLOW_LOOPBACK,
    CONTROL_FLOW_EXCEPTION,

    /** Version node to a use of that version, or to a phi merging it */
    DEF_USE,

    /** Use to the statement that reads it, and statement to the definition it writes */
    DATA_FLOW,

    /** Call site (or caller) to callee */
    CALL,

    /** Callable declaration to a call site inside it */
    CONTAINS,

    /** Type declaration to its members */
    DECLARES;

    public boolean isControlFlow() {
        return ordinal() <= CONTROL_FLOW_EXCEPTION.ordinal();
    }
}
