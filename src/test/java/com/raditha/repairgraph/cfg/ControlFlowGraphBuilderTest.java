package com.raditha.repairgraph.cfg;

import com.raditha.repairgraph.extraction.SourceUnitParser;
import com.raditha.repairgraph.model.EdgeKind;
import com.raditha.repairgraph.model.GraphBuildException;
import com.raditha.repairgraph.model.NodeKind;
import com.raditha.repairgraph.model.ProgramEdge;
import com.raditha.repairgraph.model.ProgramGraph;
import com.raditha.repairgraph.model.ProgramNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlFlowGraphBuilderTest {

    private SourceUnitParser parser;

    @BeforeEach
    void setUp() {
        parser = new SourceUnitParser();
    }

    private ProgramGraph cfg(String source) throws GraphBuildException {
        return new ControlFlowGraphBuilder().build(parser.parse("test", source));
    }

    private ProgramNode nodeLabelled(ProgramGraph graph, String label) {
        return graph.nodes().stream()
                .filter(n -> n.label().equals(label))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No node labelled " + label + " in " + graph.nodes()));
    }

    @Test
    void testStraightLineMethod() throws GraphBuildException {
        ProgramGraph graph = cfg("int f(int x) { return x + 1; }");

        // unit entry, method entry, return, exit
        assertEquals(4, graph.nodeCount());
        assertEquals(3, graph.edgeCount());
        ProgramNode unit = graph.node(graph.entry().getAsInt());
        assertEquals(ControlFlowGraphBuilder.UNIT_ENTRY_LABEL, unit.label());

        ProgramNode entry = nodeLabelled(graph, "Fragment.f/1");
        ProgramNode ret = nodeLabelled(graph, "return x + 1;");
        ProgramNode exit = nodeLabelled(graph, ControlFlowGraphBuilder.EXIT_LABEL);
        assertEquals(NodeKind.FUNCTION_ENTRY, entry.kind());
        assertTrue(graph.hasEdge(entry.id(), ret.id(), EdgeKind.CONTROL_FLOW));
        assertTrue(graph.hasEdge(ret.id(), exit.id(), EdgeKind.CONTROL_FLOW));
    }

    @Test
    void testGuardAddsBranchWithTrueAndFalseEdges() throws GraphBuildException {
        ProgramGraph graph = cfg("int f(int x) { if (x < 0) { return 0; } return x + 1; }");

        assertEquals(6, graph.nodeCount());
        assertEquals(6, graph.edgeCount());
        ProgramNode branch = nodeLabelled(graph, "if (x < 0)");
        assertEquals(NodeKind.BRANCH, branch.kind());
        assertTrue(graph.hasEdge(branch.id(), nodeLabelled(graph, "return 0;").id(), EdgeKind.CONTROL_FLOW_TRUE));
        assertTrue(graph.hasEdge(branch.id(), nodeLabelled(graph, "return x + 1;").id(), EdgeKind.CONTROL_FLOW_FALSE));
    }

    @Test
    void testWhileLoopHasBackEdgeAndExit() throws GraphBuildException {
        ProgramGraph graph = cfg("int f(int n) { int i = 0; while (i < n) { i++; } return i; }");

        ProgramNode header = nodeLabelled(graph, "while (i < n)");
        ProgramNode body = nodeLabelled(graph, "i++;");
        assertEquals(NodeKind.LOOP_HEADER, header.kind());
        assertTrue(graph.hasEdge(header.id(), body.id(), EdgeKind.CONTROL_FLOW_TRUE));
        assertTrue(graph.hasEdge(body.id(), header.id(), EdgeKind.CONTROL_FLOW_LOOPBACK));
        assertTrue(graph.hasEdge(header.id(), nodeLabelled(graph, "return i;").id(), EdgeKind.CONTROL_FLOW_FALSE));
    }

    @Test
    void testBreakAndContinue() throws GraphBuildException {
        ProgramGraph graph = cfg("""
                void f(int[] a) {
                    for (int v : a) {
                        if (v < 0) continue;
                        if (v > 9) break;
                        use(v);
                    }
                    done();
                }
                """);

        ProgramNode header = nodeLabelled(graph, "for (int v : a)");
        ProgramNode cont = nodeLabelled(graph, "continue;");
        ProgramNode brk = nodeLabelled(graph, "break;");
        ProgramNode done = nodeLabelled(graph, "done();");
        assertTrue(graph.hasEdge(cont.id(), header.id(), EdgeKind.CONTROL_FLOW_LOOPBACK));
        assertTrue(graph.hasEdge(brk.id(), done.id(), EdgeKind.CONTROL_FLOW));
        assertTrue(graph.hasEdge(header.id(), done.id(), EdgeKind.CONTROL_FLOW_FALSE));
    }

    @Test
    void testDoWhileConditionLoopsBackToBody() throws GraphBuildException {
        ProgramGraph graph = cfg("void f() { do { step(); } while (more()); end(); }");

        ProgramNode condition = nodeLabelled(graph, "do-while (more())");
        ProgramNode step = nodeLabelled(graph, "step();");
        assertTrue(graph.hasEdge(step.id(), condition.id(), EdgeKind.CONTROL_FLOW));
        assertTrue(graph.hasEdge(condition.id(), step.id(), EdgeKind.CONTROL_FLOW_LOOPBACK));
        assertTrue(graph.hasEdge(condition.id(), nodeLabelled(graph, "end();").id(), EdgeKind.CONTROL_FLOW_FALSE));
    }

    @Test
    void testRaisingStatementGetsExceptionEdgeToHandler() throws GraphBuildException {
        ProgramGraph graph = cfg("void f() { try { risky(); } catch (RuntimeException e) { recover(); } }");

        ProgramNode risky = nodeLabelled(graph, "risky();");
        ProgramNode handler = nodeLabelled(graph, "catch (RuntimeException e)");
        assertTrue(graph.hasEdge(risky.id(), handler.id(), EdgeKind.CONTROL_FLOW_EXCEPTION));
        assertTrue(graph.hasEdge(handler.id(), nodeLabelled(graph, "recover();").id(), EdgeKind.CONTROL_FLOW));
    }

    @Test
    void testReturnInTryRunsFinallyBeforeExit() throws GraphBuildException {
        ProgramGraph graph = cfg("""
                int f(int x) {
                    try {
                        if (x > 0) { return 1; }
                        work();
                    } finally {
                        cleanup();
                    }
                    return 0;
                }
                """);

        ProgramNode early = nodeLabelled(graph, "return 1;");
        ProgramNode cleanup = nodeLabelled(graph, "cleanup();");
        ProgramNode exit = nodeLabelled(graph, ControlFlowGraphBuilder.EXIT_LABEL);
        assertTrue(graph.hasEdge(early.id(), cleanup.id(), EdgeKind.CONTROL_FLOW));
        assertFalse(graph.hasEdge(early.id(), exit.id(), EdgeKind.CONTROL_FLOW));
        assertTrue(graph.hasEdge(nodeLabelled(graph, "work();").id(), cleanup.id(), EdgeKind.CONTROL_FLOW));
        assertTrue(graph.hasEdge(cleanup.id(), exit.id(), EdgeKind.CONTROL_FLOW), "the early return resumes");
        assertTrue(graph.hasEdge(cleanup.id(), nodeLabelled(graph, "return 0;").id(), EdgeKind.CONTROL_FLOW));
    }

    @Test
    void testBreakLeavingTryRunsFinally() throws GraphBuildException {
        ProgramGraph graph = cfg("""
                void f(int[] a) {
                    for (int v : a) {
                        try {
                            if (v < 0) { break; }
                            if (v == 0) { continue; }
                            use(v);
                        } finally {
                            release();
                        }
                    }
                    done();
                }
                """);

        ProgramNode header = nodeLabelled(graph, "for (int v : a)");
        ProgramNode release = nodeLabelled(graph, "release();");
        ProgramNode brk = nodeLabelled(graph, "break;");
        ProgramNode cont = nodeLabelled(graph, "continue;");
        assertTrue(graph.hasEdge(brk.id(), release.id(), EdgeKind.CONTROL_FLOW));
        assertTrue(graph.hasEdge(cont.id(), release.id(), EdgeKind.CONTROL_FLOW));
        assertFalse(graph.hasEdge(cont.id(), header.id(), EdgeKind.CONTROL_FLOW_LOOPBACK));
        assertTrue(graph.hasEdge(release.id(), header.id(), EdgeKind.CONTROL_FLOW_LOOPBACK));
        assertTrue(graph.hasEdge(release.id(), nodeLabelled(graph, "done();").id(), EdgeKind.CONTROL_FLOW));
    }

    @Test
    void testJumpInsideTryStaysInsideWithoutFinally() throws GraphBuildException {
        ProgramGraph graph = cfg("""
                void f(int[] a) {
                    try {
                        for (int v : a) {
                            if (v < 0) { break; }
                        }
                        after();
                    } finally {
                        release();
                    }
                }
                """);

        ProgramNode brk = nodeLabelled(graph, "break;");
        assertTrue(graph.hasEdge(brk.id(), nodeLabelled(graph, "after();").id(), EdgeKind.CONTROL_FLOW));
        assertFalse(graph.hasEdge(brk.id(), nodeLabelled(graph, "release();").id(), EdgeKind.CONTROL_FLOW));
    }

    @Test
    void testEmptyFinallyLeavesReturnOnExit() throws GraphBuildException {
        ProgramGraph graph = cfg("int f() { try { return 1; } finally { } }");

        ProgramNode ret = nodeLabelled(graph, "return 1;");
        assertTrue(graph.hasEdge(ret.id(), nodeLabelled(graph, ControlFlowGraphBuilder.EXIT_LABEL).id(),
                EdgeKind.CONTROL_FLOW));
    }

    @Test
    void testSwitchWithoutDefaultCanSkipAllCases() throws GraphBuildException {
        ProgramGraph graph = cfg("""
                void f(int k) {
                    switch (k) {
                        case 1: one();
                        case 2: two(); break;
                    }
                    after();
                }
                """);

        ProgramNode selector = nodeLabelled(graph, "switch (k)");
        ProgramNode one = nodeLabelled(graph, "one();");
        ProgramNode two = nodeLabelled(graph, "two();");
        ProgramNode after = nodeLabelled(graph, "after();");
        assertEquals(NodeKind.BRANCH, selector.kind());
        assertTrue(graph.hasEdge(one.id(), two.id(), EdgeKind.CONTROL_FLOW), "case 1 falls through");
        assertTrue(graph.hasEdge(selector.id(), after.id(), EdgeKind.CONTROL_FLOW), "no default");
        assertTrue(graph.hasEdge(nodeLabelled(graph, "break;").id(), after.id(), EdgeKind.CONTROL_FLOW));
    }

    @Test
    void testCodeAfterReturnIsFlaggedUnreachable() throws GraphBuildException {
        ProgramGraph graph = cfg("int f() { return 1; dead(); }");

        assertTrue(nodeLabelled(graph, "dead();").isUnreachable());
        assertFalse(nodeLabelled(graph, "return 1;").isUnreachable());
    }

    @Test
    void testEveryCallableIsLinkedFromTheUnitEntry() throws GraphBuildException {
        ProgramGraph graph = cfg("class A { A() { } void a() { } static { init(); } }");

        int unit = graph.entry().getAsInt();
        List<String> entries = graph.successors(unit).stream().map(id -> graph.node(id).label()).toList();
        assertEquals(List.of("A.A/0", "A.a/0", "A.<clinit>/0"), entries);
    }

    @Test
    void testBasicBlocksCoalesceStraightRuns() throws GraphBuildException {
        String source = "void f() { a(); b(); c(); }";
        ProgramGraph statements = cfg(source);
        ProgramGraph blocks = new ControlFlowGraphBuilder(BlockPolicy.BASIC_BLOCK)
                .build(parser.parse("test", source));

        assertEquals(6, statements.nodeCount());
        assertEquals(4, blocks.nodeCount());
        ProgramNode block = nodeLabelled(blocks, "a(); b(); c();");
        assertEquals(3, block.statementKeys().size(), "A block stands for all of its statements");
    }

    @Test
    void testYieldOutsideSwitchExpressionFails() {
        assertThrows(GraphBuildException.class, () -> cfg("void f() { yield 1; }"));
    }

    @Test
    void testBuildIsDeterministic() throws GraphBuildException {
        String source = "int f(int n) { int s = 0; for (int i = 0; i < n; i++) { if (i % 2 == 0) s += i; } return s; }";
        ProgramGraph first = cfg(source);
        ProgramGraph second = cfg(source);

        assertEquals(first.nodes().stream().map(ProgramNode::label).toList(),
                second.nodes().stream().map(ProgramNode::label).toList());
        assertEquals(first.edges(), second.edges());
        for (ProgramEdge edge : first.edges()) {
            assertTrue(second.hasEdge(edge.source(), edge.target(), edge.kind()));
        }
    }
}
