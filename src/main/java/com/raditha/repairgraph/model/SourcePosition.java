package com.raditha.repairgraph.model;

import com.github.javaparser.ast.Node;

/**
 * Represents a source code range (line and column positions) of the construct a graph node came from.
 * Simplified wrapper around JavaParser's Range; used for traceability only.
 *
 * @param startLine   Starting line number (1-indexed, 0 when unknown)
 * @param endLine     Ending line number (1-indexed, inclusive)
 * @param startColumn Starting column number (1-indexed)
 * @param endColumn   Ending column number (1-indexed, inclusive)
 */
public record SourcePosition(
        int startLine,
        int endLine,
        int startColumn,
        int endColumn) {

    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0, 0, 0);

    /**
     * Create from JavaParser Range.
     */
    public static SourcePosition from(com.github.javaparser.Range jpRange) {
        return new SourcePosition(
                jpRange.begin.line,
                jpRange.end.line,
                jpRange.begin.column,
                jpRange.end.column);
    }

    /**
     * Position of an AST node, or {@link #UNKNOWN} for synthesized nodes without a range.
     */
    public static SourcePosition of(Node node) {
        return node.getRange().map(SourcePosition::from).orElse(UNKNOWN);
    }

    public boolean isKnown() {
        return startLine > 0;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (!isKnown()) {
            return "L?";
        }
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
