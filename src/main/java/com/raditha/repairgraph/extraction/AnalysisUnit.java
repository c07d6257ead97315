package com.raditha.repairgraph.extraction;

import java.util.List;

/**
 * The set of files analysed together as one version of a program fragment.
 * A single snippet is a unit with one file; module scope analysis uses several.
 *
 * @param name  display name of the unit
 * @param files parsed files in a fixed order
 */
public record AnalysisUnit(String name, List<SourceFile> files) {

    public AnalysisUnit {
        files = List.copyOf(files);
    }

    public static AnalysisUnit of(SourceFile file) {
        return new AnalysisUnit(file.path(), List.of(file));
    }
}
