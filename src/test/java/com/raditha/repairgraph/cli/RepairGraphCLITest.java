package com.raditha.repairgraph.cli;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RepairGraphCLITest {

    @TempDir
    Path tempDir;

    private Path before;
    private Path after;

    @BeforeEach
    void setUp() throws IOException {
        before = tempDir.resolve("Before.java");
        after = tempDir.resolve("After.java");
        Files.writeString(before, "class A { int f(int x) { return x + 1; } }");
        Files.writeString(after, "class A { int f(int x) { if (x < 0) { return 0; } return x + 1; } }");
    }

    private int run(String... args) {
        return RepairGraphCLI.commandLine().execute(args);
    }

    @Test
    void testPairRunsSuccessfully() {
        assertEquals(0, run("--before", before.toString(), "--after", after.toString(), "--kinds", "cfg,dfg"));
    }

    @Test
    void testJsonOutput() {
        assertEquals(0, run("--before", before.toString(), "--after", after.toString(), "--json",
                "--preset", "fast"));
    }

    @Test
    void testExportWritesBothFormats() throws IOException {
        Path out = tempDir.resolve("out");

        int exitCode = run("--before", before.toString(), "--after", after.toString(),
                "--export", "both", "--output", out.toString());

        assertEquals(0, exitCode);
        Path csv = out.resolve("repair-metrics.csv");
        assertTrue(Files.exists(csv));
        assertTrue(Files.exists(out.resolve("repair-metrics.json")));
        List<String> lines = Files.readAllLines(csv);
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("After.java,cfg,measured,7.0,")), String.join("\n", lines));
    }

    @Test
    void testBatchRun() throws IOException {
        Path manifest = tempDir.resolve("instances.json");
        Files.writeString(manifest, """
                [
                  {"id": "bug-1", "files": [{"path": "A.java", "beforeFile": "Before.java", "afterFile": "After.java"}]},
                  {"id": "bug-2", "files": [{"path": "S.java", "before": "return 1;", "after": "return 2;"}]}
                ]
                """);
        Path out = tempDir.resolve("batch");

        int exitCode = run("--batch", manifest.toString(), "--export", "csv", "--output", out.toString());

        assertEquals(0, exitCode);
        List<String> lines = Files.readAllLines(out.resolve("repair-metrics.csv"));
        assertTrue(lines.get(2).endsWith(",instances.json,2,2,0"), lines.get(2));
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("bug-2,dfg,measured,")));
    }

    @Test
    void testNothingToAnalyze() {
        assertEquals(2, run());
    }

    @Test
    void testPairAndBatchTogether() {
        assertEquals(2, run("--before", before.toString(), "--after", after.toString(), "--batch", "x.json"));
    }

    @Test
    void testBeforeWithoutAfter() {
        assertEquals(2, run("--before", before.toString()));
    }

    @Test
    void testInvalidExportFormat() {
        assertEquals(2, run("--before", before.toString(), "--after", after.toString(), "--export", "xml"));
    }

    @Test
    void testUnknownKind() {
        assertEquals(2, run("--before", before.toString(), "--after", after.toString(), "--kinds", "ast"));
    }

    @Test
    void testMissingConfigFile() {
        assertEquals(2, run("--before", before.toString(), "--after", after.toString(),
                "--config-file", tempDir.resolve("missing.yml").toString()));
    }

    @Test
    void testMissingSourceFileIsAnIoError() {
        assertEquals(3, run("--before", tempDir.resolve("Gone.java").toString(), "--after", after.toString()));
    }

    @Test
    void testUnknownOptionAndBadNumber() {
        assertEquals(2, run("--no-such-option"));
        assertEquals(2, run("--beam-width", "wide"));
    }

    @Test
    void testHelpAndVersion() {
        assertEquals(0, run("--help"));
        assertEquals(0, run("--version"));
    }

    @Property(tries = 30)
    void validOptionsParse(@ForAll @IntRange(min = 0, max = 500) int beamWidth,
                           @ForAll @IntRange(min = 0, max = 3600) int timeout,
                           @ForAll boolean json,
                           @ForAll("exportFormats") String export,
                           @ForAll("kindLists") String kinds) {
        List<String> args = new ArrayList<>(List.of("--before", "B.java", "--after", "A.java",
                "--beam-width", String.valueOf(beamWidth), "--timeout", String.valueOf(timeout),
                "--export", export, "--kinds", kinds));
        if (json) {
            args.add("--json");
        }

        CommandLine commandLine = new CommandLine(new RepairGraphCLI());
        CommandLine.ParseResult result = commandLine.parseArgs(args.toArray(new String[0]));

        assertEquals(beamWidth, (int) result.matchedOptionValue("--beam-width", -1));
        assertEquals(kinds, result.matchedOptionValue("--kinds", ""));
    }

    @Provide
    Arbitrary<String> exportFormats() {
        return Arbitraries.of("csv", "json", "both", "CSV");
    }

    @Provide
    Arbitrary<String> kindLists() {
        return Arbitraries.of("cfg", "dfg", "callgraph", "pdg,cpg", "cfg,dfg,callgraph,pdg,cpg");
    }
}
