package com.raditha.repairgraph.extraction;

import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;

/**
 * Statement identity across graph views. Two nodes of different graphs built from the same
 * file carry the same key exactly when they stand for the same source construct.
 */
public final class StatementKeys {

    private StatementKeys() {
    }

    /**
     * Key of an AST node: file path plus its exact source range.
     *
     * @throws IllegalStateException if the node has no range (only synthesized nodes lack one)
     */
    public static String of(String path, Node node) {
        Range range = node.getRange()
                .orElseThrow(() -> new IllegalStateException("Node without range: " + node.getClass().getSimpleName()));
        return path + ":" + range.begin.line + ":" + range.begin.column
                + "-" + range.end.line + ":" + range.end.column;
    }
}
