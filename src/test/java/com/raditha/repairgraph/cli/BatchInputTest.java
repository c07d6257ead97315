package com.raditha.repairgraph.cli;

import com.raditha.repairgraph.analyzer.BugInstance;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchInputTest {

    @TempDir
    Path tempDir;

    @Test
    void testInlineAndFileContents() throws IOException {
        Files.createDirectories(tempDir.resolve("before"));
        Files.writeString(tempDir.resolve("before/A.java"), "class A { }");
        Path manifest = tempDir.resolve("instances.json");
        Files.writeString(manifest, """
                [
                  {"id": "bug-1", "project": "ignored", "files": [
                    {"path": "A.java", "beforeFile": "before/A.java", "after": "class A { void a() { } }"}
                  ]},
                  {"id": "bug-2", "files": [
                    {"path": "B.java", "before": "class B { }"}
                  ]}
                ]
                """);

        List<BugInstance> instances = BatchInput.read(manifest);

        assertEquals(2, instances.size());
        assertEquals("bug-1", instances.get(0).id());
        assertEquals("class A { }", instances.get(0).files().get(0).before());
        assertEquals("class A { void a() { } }", instances.get(0).files().get(0).after());
        assertEquals("", instances.get(1).files().get(0).after(), "A deleted file has empty text after");
    }

    @Test
    void testInstanceWithoutFilesIsRejected() throws IOException {
        Path manifest = tempDir.resolve("instances.json");
        Files.writeString(manifest, "[{\"id\": \"bug-1\", \"files\": []}]");

        assertThrows(IllegalArgumentException.class, () -> BatchInput.read(manifest));
    }

    @Test
    void testMissingReferencedFileFails() throws IOException {
        Path manifest = tempDir.resolve("instances.json");
        Files.writeString(manifest, "[{\"id\": \"bug-1\", \"files\": [{\"path\": \"A.java\", \"beforeFile\": \"nope.java\"}]}]");

        assertThrows(IOException.class, () -> BatchInput.read(manifest));
    }
}
