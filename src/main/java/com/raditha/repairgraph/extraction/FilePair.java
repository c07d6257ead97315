package com.raditha.repairgraph.extraction;

/**
 * One file before and after a change. A file that does not exist on one side has empty text there.
 *
 * @param path   path of the file, used in statement keys and reports
 * @param before source text before the change
 * @param after  source text after the change
 */
public record FilePair(String path, String before, String after) {

    public FilePair {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be empty");
        }
        before = before == null ? "" : before;
        after = after == null ? "" : after;
    }

    public boolean isUnchanged() {
        return before.equals(after);
    }
}
