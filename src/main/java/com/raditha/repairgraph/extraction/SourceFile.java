package com.raditha.repairgraph.extraction;

import com.github.javaparser.ast.CompilationUnit;

import java.util.Objects;

/**
 * One parsed file of an analysis unit.
 *
 * @param path      name used in statement keys and reports
 * @param unit      the parsed compilation unit
 * @param synthetic true when the text was a fragment wrapped in a holder class
 */
public record SourceFile(String path, CompilationUnit unit, boolean synthetic) {

    public SourceFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(unit, "unit");
    }
}
