package com.raditha.repairgraph.analyzer;

import com.raditha.repairgraph.extraction.FilePair;

import java.util.List;

/**
 * A bug fix to measure: the files it touched, before and after the fix.
 *
 * @param id    identifier used in reports
 * @param files changed files
 */
public record BugInstance(String id, List<FilePair> files) {

    public BugInstance {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Bug instance id cannot be empty");
        }
        files = files == null ? List.of() : List.copyOf(files);
    }
}
