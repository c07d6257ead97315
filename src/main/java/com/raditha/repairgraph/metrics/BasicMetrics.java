package com.raditha.repairgraph.metrics;

/**
 * Text-level measures of a change, reported next to the graph distances.
 * <p>
 * Line counts come from the raw text and are always known. Token and complexity values need a
 * parsed file and are {@link #UNAVAILABLE} for a side that did not parse, so they are never
 * mistaken for "no change".
 *
 * @param linesAdded          lines present only after the change
 * @param linesDeleted        lines present only before the change
 * @param tokenDistance       token-level edit distance, comments and whitespace ignored
 * @param tokensBefore        significant tokens before the change
 * @param tokensAfter         significant tokens after the change
 * @param complexityBefore    cyclomatic complexity of the code before the change
 * @param complexityAfter     cyclomatic complexity of the code after the change
 */
public record BasicMetrics(
        int linesAdded,
        int linesDeleted,
        int tokenDistance,
        int tokensBefore,
        int tokensAfter,
        int complexityBefore,
        int complexityAfter) {

    public static final int UNAVAILABLE = -1;

    public static final BasicMetrics EMPTY = new BasicMetrics(0, 0, 0, 0, 0, 0, 0);

    public int linesChanged() {
        return linesAdded + linesDeleted;
    }

    public boolean hasTokenDistance() {
        return tokenDistance != UNAVAILABLE;
    }

    public boolean hasComplexityDelta() {
        return complexityBefore != UNAVAILABLE && complexityAfter != UNAVAILABLE;
    }

    /**
     * @return the change in complexity, or {@link #UNAVAILABLE} when either side is unknown
     */
    public int complexityDelta() {
        return hasComplexityDelta() ? complexityAfter - complexityBefore : UNAVAILABLE;
    }

    /**
     * Token distance relative to the size of the code before the change, or -1 when unknown.
     */
    public double tokenChangeRatio() {
        return hasTokenDistance() ? (double) tokenDistance / Math.max(tokensBefore, 1) : UNAVAILABLE;
    }

    /**
     * Sum over files. An unavailable value on either side stays unavailable in the sum.
     */
    public BasicMetrics plus(BasicMetrics other) {
        return new BasicMetrics(
                linesAdded + other.linesAdded,
                linesDeleted + other.linesDeleted,
                sum(tokenDistance, other.tokenDistance),
                sum(tokensBefore, other.tokensBefore),
                sum(tokensAfter, other.tokensAfter),
                sum(complexityBefore, other.complexityBefore),
                sum(complexityAfter, other.complexityAfter));
    }

    private static int sum(int a, int b) {
        return a == UNAVAILABLE || b == UNAVAILABLE ? UNAVAILABLE : a + b;
    }
}
