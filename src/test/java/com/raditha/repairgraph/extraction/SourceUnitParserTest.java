package com.raditha.repairgraph.extraction;

import com.raditha.repairgraph.model.GraphBuildException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceUnitParserTest {

    private SourceUnitParser parser;

    @BeforeEach
    void setUp() {
        parser = new SourceUnitParser();
    }

    @Test
    void testCompleteCompilationUnit() throws GraphBuildException {
        AnalysisUnit unit = parser.parse("A.java", "package p; class A { int f() { return 1; } }");

        assertEquals(1, unit.files().size());
        assertFalse(unit.files().get(0).synthetic(), "A whole compilation unit needs no holder");
        assertEquals(List.of("A.f/0"), CallableCollector.callables(unit).stream().map(Callable::signature).toList());
    }

    @Test
    void testClassBodyFragmentIsWrapped() throws GraphBuildException {
        AnalysisUnit unit = parser.parse("snippet", "int f(int x) {\n  return x + 1;\n}");

        SourceFile file = unit.files().get(0);
        assertTrue(file.synthetic());
        List<Callable> callables = CallableCollector.callables(unit);
        assertEquals(1, callables.size());
        assertEquals(SourceUnitParser.HOLDER_CLASS + ".f/1", callables.get(0).signature());
        assertEquals(1, callables.get(0).position().startLine(), "Wrapping must keep line numbers");
    }

    @Test
    void testStatementFragmentIsWrappedInHolderMethod() throws GraphBuildException {
        AnalysisUnit unit = parser.parse("snippet", "int y = 2;\ny++;");

        List<Callable> callables = CallableCollector.callables(unit);
        assertEquals(1, callables.size());
        assertEquals(SourceUnitParser.HOLDER_METHOD, callables.get(0).name());
        assertEquals(2, callables.get(0).body().getStatements().size());
    }

    @Test
    void testUnparsableTextFails() {
        GraphBuildException e = assertThrows(GraphBuildException.class,
                () -> parser.parse("broken", "class { int = ; }"));
        assertTrue(e.getMessage().contains("broken"), "Message should name the input: " + e.getMessage());
    }

    @Test
    void testParseAllKeepsFileOrder() throws GraphBuildException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("B.java", "class B { void b() { } }");
        files.put("A.java", "class A { void a() { } }");

        AnalysisUnit unit = parser.parseAll("module", files);

        assertEquals("module", unit.name());
        assertEquals(List.of("B.java", "A.java"), unit.files().stream().map(SourceFile::path).toList());
        assertEquals(List.of("B.b/0", "A.a/0"),
                CallableCollector.callables(unit).stream().map(Callable::signature).toList());
    }

    @Test
    void testStatementKeysDifferByPosition() throws GraphBuildException {
        AnalysisUnit unit = parser.parse("k", "void f() {\n a();\n a();\n}");
        Callable f = CallableCollector.callables(unit).get(0);

        String first = StatementKeys.of("k", f.body().getStatement(0));
        String second = StatementKeys.of("k", f.body().getStatement(1));
        assertNotEquals(first, second);
        assertTrue(first.startsWith("k:"));
    }
}
