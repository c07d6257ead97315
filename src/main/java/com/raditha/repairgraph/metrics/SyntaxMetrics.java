package com.raditha.repairgraph.metrics;

import com.raditha.repairgraph.extraction.SourceFile;

import java.util.List;

/**
 * Syntax-level measures of a change. Only computed when every file parsed on both sides.
 *
 * @param ast             tree edit distance between the syntax trees
 * @param halsteadBefore  Halstead measures before the change
 * @param halsteadAfter   Halstead measures after the change
 * @param exceptions      changes to exception handling
 * @param types           changes to declared and used types
 * @param scopes          moves between local and field scope
 */
public record SyntaxMetrics(
        AstEditDistance.Result ast,
        HalsteadMetrics halsteadBefore,
        HalsteadMetrics halsteadAfter,
        ExceptionHandlingChange exceptions,
        TypeChange types,
        ScopeChange scopes) {

    public static SyntaxMetrics between(List<SourceFile> before, List<SourceFile> after) {
        return new SyntaxMetrics(
                AstEditDistance.compute(before, after),
                HalsteadMetrics.of(before),
                HalsteadMetrics.of(after),
                ExceptionHandlingChange.between(before, after),
                TypeChange.between(before, after),
                ScopeChange.between(before, after));
    }

    public double volumeDelta() {
        return halsteadAfter.volume() - halsteadBefore.volume();
    }

    public double difficultyDelta() {
        return halsteadAfter.difficulty() - halsteadBefore.difficulty();
    }

    public double effortDelta() {
        return halsteadAfter.effort() - halsteadBefore.effort();
    }
}
