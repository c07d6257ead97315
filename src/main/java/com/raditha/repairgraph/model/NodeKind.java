package com.raditha.repairgraph.model;

/**
 * Kind of a node in a program graph.
 * The kind is structural metadata; edit distance compares nodes by label only.
 */
public enum NodeKind {
    /** Plain statement (expression statement, return, declaration, ...) */
    STATEMENT,

    /** Condition of an if or the selector of a switch */
    BRANCH,

    /** Condition / iteration head of a loop */
    LOOP_HEADER,

    /** Entry of a callable, or the synthetic entry of a whole unit */
    FUNCTION_ENTRY,

    /** Exit of a callable */
    FUNCTION_EXIT,

    /** One version of a variable (assignment, declaration, parameter, enclosing-scope input) */
    VARIABLE_DEFINITION,

    /** One read of a variable */
    VARIABLE_USE,

    /** Confluence of two or more versions of the same variable */
    PHI,

    /** Static call site */
    CALL_SITE,

    /** Type or callable declaration in the call graph */
    DECLARATION,

    /** Sink for names and locations that cannot be resolved statically */
    UNKNOWN,

    /** Sink for a callee that is not declared in the analysed unit */
    EXTERNAL;

    /**
     * Check if this kind is a version of a variable, i.e. something a read can resolve to.
     */
    public boolean isVersion() {
        return this == VARIABLE_DEFINITION || this == PHI || this == UNKNOWN;
    }
}
