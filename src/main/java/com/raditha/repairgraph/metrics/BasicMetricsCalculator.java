package com.raditha.repairgraph.metrics;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.raditha.repairgraph.extraction.AnalysisUnit;
import com.raditha.repairgraph.extraction.CallableCollector;
import com.raditha.repairgraph.extraction.FilePair;
import com.raditha.repairgraph.extraction.SourceFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes {@link BasicMetrics} for a changed file.
 */
public class BasicMetricsCalculator {

    private final TokenEditDistance tokenDistance = new TokenEditDistance();

    /**
     * @param pair   the file texts, for the line diff
     * @param before the parsed file before the change, or null when it did not parse
     * @param after  the parsed file after the change, or null when it did not parse
     * @return line counts always; token and complexity values only for the sides that parsed
     */
    public BasicMetrics compute(FilePair pair, SourceFile before, SourceFile after) {
        Patch<String> patch = DiffUtils.diff(lines(pair.before()), lines(pair.after()));
        int added = 0;
        int deleted = 0;
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            deleted += delta.getSource().size();
            added += delta.getTarget().size();
        }

        List<String> tokensBefore = before != null ? tokens(before.unit()) : null;
        List<String> tokensAfter = after != null ? tokens(after.unit()) : null;
        int distance = tokensBefore != null && tokensAfter != null
                ? tokenDistance.distance(tokensBefore, tokensAfter)
                : BasicMetrics.UNAVAILABLE;
        return new BasicMetrics(added, deleted, distance,
                tokensBefore != null ? tokensBefore.size() : BasicMetrics.UNAVAILABLE,
                tokensAfter != null ? tokensAfter.size() : BasicMetrics.UNAVAILABLE,
                before != null ? complexity(before) : BasicMetrics.UNAVAILABLE,
                after != null ? complexity(after) : BasicMetrics.UNAVAILABLE);
    }

    /**
     * McCabe complexity summed over callables: one per callable plus one per decision point
     * (conditional branch, loop, non-default case, catch, ternary and short-circuit operator).
     */
    public static int complexity(SourceFile file) {
        CompilationUnit unit = file.unit();
        int callables = CallableCollector.callables(new AnalysisUnit(file.path(), List.of(file))).size();
        int decisions = unit.findAll(IfStmt.class).size()
                + unit.findAll(WhileStmt.class).size()
                + unit.findAll(DoStmt.class).size()
                + unit.findAll(ForStmt.class).size()
                + unit.findAll(ForEachStmt.class).size()
                + unit.findAll(CatchClause.class).size()
                + unit.findAll(ConditionalExpr.class).size()
                + (int) unit.findAll(SwitchEntry.class).stream().filter(e -> !e.getLabels().isEmpty()).count()
                + (int) unit.findAll(BinaryExpr.class).stream()
                        .filter(b -> b.getOperator() == BinaryExpr.Operator.AND
                                || b.getOperator() == BinaryExpr.Operator.OR)
                        .count();
        return callables + decisions;
    }

    /**
     * Significant tokens of the file; whitespace and comments are skipped.
     */
    static List<String> tokens(CompilationUnit unit) {
        List<String> tokens = new ArrayList<>();
        unit.getTokenRange().ifPresent(range -> {
            for (JavaToken token : range) {
                if (!token.getCategory().isWhitespaceOrComment()) {
                    tokens.add(token.getText());
                }
            }
        });
        return tokens;
    }

    private static List<String> lines(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        return List.of(text.split("\r?\n", -1));
    }
}
