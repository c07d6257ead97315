package com.raditha.repairgraph.callgraph;

import com.raditha.repairgraph.extraction.SourceUnitParser;
import com.raditha.repairgraph.model.EdgeKind;
import com.raditha.repairgraph.model.GraphBuildException;
import com.raditha.repairgraph.model.GraphKind;
import com.raditha.repairgraph.model.NodeKind;
import com.raditha.repairgraph.model.ProgramEdge;
import com.raditha.repairgraph.model.ProgramGraph;
import com.raditha.repairgraph.model.ProgramNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CallGraphBuilderTest {

    private SourceUnitParser parser;
    private CallGraphBuilder builder;

    @BeforeEach
    void setUp() {
        parser = new SourceUnitParser();
        builder = new CallGraphBuilder();
    }

    private ProgramNode single(ProgramGraph graph, String label) {
        List<ProgramNode> nodes = graph.nodes().stream().filter(n -> n.label().equals(label)).toList();
        assertEquals(1, nodes.size(), "Expected exactly one node labelled " + label + " in " + graph.nodes());
        return nodes.get(0);
    }

    private String callee(ProgramGraph graph, ProgramNode site) {
        List<ProgramEdge> calls = graph.outEdges(site.id()).stream()
                .filter(e -> e.kind() == EdgeKind.CALL).toList();
        assertEquals(1, calls.size(), "A call site has exactly one callee");
        return graph.node(calls.get(0).target()).label();
    }

    @Test
    void testCallResolvesByNameAndArity() throws GraphBuildException {
        ProgramGraph graph = builder.build(parser.parse("A.java", """
                class A {
                    int f(int x) { return g(x) + g(x, 1); }
                    int g(int x) { return x; }
                    int g(int x, int y) { return x + y; }
                }
                """));

        assertEquals(GraphKind.CALL_GRAPH, graph.kind());
        assertEquals("A.g/1", callee(graph, single(graph, "call g/1")));
        assertEquals("A.g/2", callee(graph, single(graph, "call g/2")));
        ProgramNode caller = single(graph, "A.f/1");
        assertEquals(NodeKind.DECLARATION, caller.kind());
        assertEquals(2, graph.outEdges(caller.id()).stream().filter(e -> e.kind() == EdgeKind.CONTAINS).count());
    }

    @Test
    void testCallerTypeIsPreferred() throws GraphBuildException {
        ProgramGraph graph = builder.build(parser.parse("AB.java", """
                class A { void run() { go(); } void go() { } }
                class B { void go() { } }
                """));

        assertEquals("A.go/0", callee(graph, single(graph, "call go/0")));
    }

    @Test
    void testScopeNamingADeclaredTypeWins() throws GraphBuildException {
        ProgramGraph graph = builder.build(parser.parse("AB.java", """
                class A { void run() { B.go(); } static void go() { } }
                class B { static void go() { } }
                """));

        assertEquals("B.go/0", callee(graph, single(graph, "call go/0")));
    }

    @Test
    void testUndeclaredCalleeGoesToExternalSink() throws GraphBuildException {
        ProgramGraph graph = builder.build(parser.parse("test", "int f(int x) { return Math.abs(x) + Math.abs(-x); }"));

        ProgramNode external = single(graph, "external abs");
        assertEquals(NodeKind.EXTERNAL, external.kind());
        assertEquals(2, graph.inEdges(external.id()).size(), "One sink per callee name");
    }

    @Test
    void testConstructorWithoutDeclarationResolvesToType() throws GraphBuildException {
        ProgramGraph graph = builder.build(parser.parse("AB.java", """
                class A { Object make() { return new B(); } }
                class B { }
                """));

        assertEquals("class B", callee(graph, single(graph, "call B/0")));
    }

    @Test
    void testDeclaredConstructorIsResolved() throws GraphBuildException {
        ProgramGraph graph = builder.build(parser.parse("AB.java", """
                class A { Object make() { return new B(1); } }
                class B { B(int v) { } }
                """));

        assertEquals("B.B/1", callee(graph, single(graph, "call B/1")));
    }

    @Test
    void testNestedTypesAreDeclaredByOuter() throws GraphBuildException {
        ProgramGraph graph = builder.build(parser.parse("Outer.java", "class Outer { static class Inner { void m() { } } }"));

        ProgramNode outer = single(graph, "class Outer");
        ProgramNode inner = single(graph, "class Outer.Inner");
        assertTrue(graph.hasEdge(outer.id(), inner.id(), EdgeKind.DECLARES));
        assertTrue(graph.hasEdge(inner.id(), single(graph, "Outer.Inner.m/0").id(), EdgeKind.DECLARES));
    }

    @Test
    void testCallsResolveAcrossFiles() throws GraphBuildException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A.java", "class A { void run() { new Helper().assist(); } }");
        files.put("Helper.java", "class Helper { void assist() { } }");
        ProgramGraph graph = builder.build(parser.parseAll("pair", files));

        assertEquals("Helper.assist/0", callee(graph, single(graph, "call assist/0")));
    }

    @Test
    void testCallSiteCarriesStatementKeyOfEnclosingStatement() throws GraphBuildException {
        ProgramGraph graph = builder.build(parser.parse("test", "void f() { log(compute()); }"));

        ProgramNode outer = single(graph, "call log/1");
        ProgramNode inner = single(graph, "call compute/0");
        assertEquals(1, outer.statementKeys().size());
        assertEquals(outer.statementKeys(), inner.statementKeys(), "Both calls are evaluated by the same statement");
    }
}
