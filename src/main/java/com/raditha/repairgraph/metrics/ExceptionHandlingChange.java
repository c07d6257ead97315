package com.raditha.repairgraph.metrics;

import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.UnionType;
import com.raditha.repairgraph.extraction.SourceFile;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * How a change alters exception handling.
 *
 * @param tryBlocksDelta        try statements after minus before
 * @param catchClausesDelta     catch clauses after minus before
 * @param newCaughtTypes        exception types caught only after the change, sorted
 * @param removedCaughtTypes    exception types caught only before the change, sorted
 * @param genericCatchesDelta   change in catches of {@code Exception} or {@code Throwable};
 *                              negative when handling became more specific
 * @param finallyBlocksDelta    finally blocks after minus before
 * @param throwStatementsDelta  throw statements after minus before
 */
public record ExceptionHandlingChange(
        int tryBlocksDelta,
        int catchClausesDelta,
        List<String> newCaughtTypes,
        List<String> removedCaughtTypes,
        int genericCatchesDelta,
        int finallyBlocksDelta,
        int throwStatementsDelta) {

    private static final Set<String> GENERIC = Set.of("Exception", "Throwable",
            "java.lang.Exception", "java.lang.Throwable");

    public ExceptionHandlingChange {
        newCaughtTypes = List.copyOf(newCaughtTypes);
        removedCaughtTypes = List.copyOf(removedCaughtTypes);
    }

    /**
     * Changed try and catch counts plus caught types gained or lost.
     */
    public int totalChanges() {
        return Math.abs(tryBlocksDelta) + Math.abs(catchClausesDelta)
                + newCaughtTypes.size() + removedCaughtTypes.size();
    }

    public static ExceptionHandlingChange between(List<SourceFile> before, List<SourceFile> after) {
        Summary a = Summary.of(before);
        Summary b = Summary.of(after);
        Set<String> added = new TreeSet<>(b.caughtTypes);
        added.removeAll(a.caughtTypes);
        Set<String> removed = new TreeSet<>(a.caughtTypes);
        removed.removeAll(b.caughtTypes);
        return new ExceptionHandlingChange(
                b.tryBlocks - a.tryBlocks,
                b.catchClauses - a.catchClauses,
                List.copyOf(added),
                List.copyOf(removed),
                b.genericCatches - a.genericCatches,
                b.finallyBlocks - a.finallyBlocks,
                b.throwStatements - a.throwStatements);
    }

    private static final class Summary {
        int tryBlocks;
        int catchClauses;
        int genericCatches;
        int finallyBlocks;
        int throwStatements;
        final Set<String> caughtTypes = new TreeSet<>();

        static Summary of(List<SourceFile> files) {
            Summary summary = new Summary();
            for (SourceFile file : files) {
                for (TryStmt tryStmt : file.unit().findAll(TryStmt.class)) {
                    summary.tryBlocks++;
                    if (tryStmt.getFinallyBlock().isPresent()) {
                        summary.finallyBlocks++;
                    }
                    for (CatchClause clause : tryStmt.getCatchClauses()) {
                        summary.catchClauses++;
                        summary.addCaught(clause.getParameter().getType());
                    }
                }
                summary.throwStatements += file.unit().findAll(ThrowStmt.class).size();
            }
            return summary;
        }

        private void addCaught(Type type) {
            if (type instanceof UnionType union) {
                union.getElements().forEach(this::addCaught);
                return;
            }
            String name = type.asString();
            caughtTypes.add(name);
            if (GENERIC.contains(name)) {
                genericCatches++;
            }
        }
    }
}
