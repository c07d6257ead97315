package com.raditha.repairgraph.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.repairgraph.analyzer.BugInstance;
import com.raditha.repairgraph.extraction.FilePair;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a batch manifest: a JSON array of bug instances, each with the files it changed.
 * File contents are given inline ({@code before}/{@code after}) or as paths
 * ({@code beforeFile}/{@code afterFile}) relative to the manifest.
 * <pre>
 * [ { "id": "lang-1", "files": [ { "path": "Foo.java", "beforeFile": "b/Foo.java", "afterFile": "a/Foo.java" } ] } ]
 * </pre>
 */
final class BatchInput {

    private static final ObjectMapper mapper = new ObjectMapper();

    private BatchInput() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Entry(String id, List<FileEntry> files) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FileEntry(String path, String before, String after, String beforeFile, String afterFile) {
    }

    static List<BugInstance> read(Path manifest) throws IOException {
        List<Entry> entries = mapper.readValue(manifest.toFile(), new TypeReference<List<Entry>>() {
        });
        Path base = manifest.toAbsolutePath().getParent();
        List<BugInstance> instances = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.files() == null || entry.files().isEmpty()) {
                throw new IllegalArgumentException("Bug instance " + entry.id() + " lists no files");
            }
            List<FilePair> pairs = new ArrayList<>();
            for (FileEntry file : entry.files()) {
                pairs.add(new FilePair(file.path(),
                        text(base, file.before(), file.beforeFile()),
                        text(base, file.after(), file.afterFile())));
            }
            instances.add(new BugInstance(entry.id(), pairs));
        }
        return instances;
    }

    private static String text(Path base, String inline, String file) throws IOException {
        if (inline != null) {
            return inline;
        }
        if (file == null) {
            return "";
        }
        return Files.readString(base.resolve(file));
    }
}
