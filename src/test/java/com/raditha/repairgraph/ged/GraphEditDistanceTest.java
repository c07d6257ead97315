package com.raditha.repairgraph.ged;

import com.raditha.repairgraph.cfg.ControlFlowGraphBuilder;
import com.raditha.repairgraph.dfg.DataFlowGraphBuilder;
import com.raditha.repairgraph.extraction.AnalysisUnit;
import com.raditha.repairgraph.extraction.SourceUnitParser;
import com.raditha.repairgraph.merge.GraphMerger;
import com.raditha.repairgraph.model.EdgeKind;
import com.raditha.repairgraph.model.GraphBuildException;
import com.raditha.repairgraph.model.GraphKind;
import com.raditha.repairgraph.model.NodeKind;
import com.raditha.repairgraph.model.ProgramGraph;
import com.raditha.repairgraph.model.SourcePosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GraphEditDistanceTest {

    private static final String PLUS_ONE = "int f(int x) { return x + 1; }";
    private static final String TIMES_TWO = "int f(int x) { return x * 2; }";
    private static final String GUARDED = "int f(int x) { if (x < 0) { return 0; } return x + 1; }";

    private GraphEditDistance ged;
    private SourceUnitParser parser;

    @BeforeEach
    void setUp() {
        ged = new GraphEditDistance();
        parser = new SourceUnitParser();
    }

    private AnalysisUnit unit(String source) throws GraphBuildException {
        return parser.parse("snippet.java", source);
    }

    private ProgramGraph cfg(String source) throws GraphBuildException {
        return new ControlFlowGraphBuilder().build(unit(source));
    }

    private ProgramGraph dfg(String source) throws GraphBuildException {
        return new DataFlowGraphBuilder().build(unit(source));
    }

    private ProgramGraph pdg(String source) throws GraphBuildException {
        return GraphMerger.programDependenceGraph(cfg(source), dfg(source));
    }

    /**
     * A chain of statement nodes with the given labels, linked in order by the given edge kind.
     */
    private static ProgramGraph chain(EdgeKind edgeKind, String... labels) {
        ProgramGraph.Builder builder = ProgramGraph.builder(GraphKind.CFG, "chain");
        for (int i = 0; i < labels.length; i++) {
            builder.addNode(NodeKind.STATEMENT, labels[i], SourcePosition.UNKNOWN);
            if (i > 0) {
                builder.addEdge(i - 1, i, edgeKind);
            }
        }
        return builder.build();
    }

    @Test
    void testIdenticalGraphsHaveZeroDistance() throws GraphBuildException {
        ProgramGraph graph = pdg(GUARDED);
        GedResult result = ged.compute(graph, pdg(GUARDED));

        assertEquals(0.0, result.ged());
        assertEquals(0.0, result.normalized());
        assertFalse(result.timedOut());
    }

    @Test
    void testChangedOperatorCostsOneRelabelInDataFlow() throws GraphBuildException {
        GedResult result = ged.compute(dfg(PLUS_ONE), dfg(TIMES_TWO));

        assertEquals(1.0, result.ged(), "Only the statement label differs");
        assertEquals(GedResult.EXACT, result.method());
        assertEquals(3, result.nodesBefore());
        assertEquals(2, result.edgesAfter());
    }

    @Test
    void testInsertedGuardInEveryView() throws GraphBuildException {
        GedResult control = ged.compute(cfg(PLUS_ONE), cfg(GUARDED));
        GedResult data = ged.compute(dfg(PLUS_ONE), dfg(GUARDED));
        GedResult dependence = ged.compute(pdg(PLUS_ONE), pdg(GUARDED));

        assertEquals(7.0, control.ged(), "2 nodes and 4 edges inserted, 1 edge deleted");
        assertEquals(4.0, data.ged(), "use x and the guard statement, with their 2 edges");
        assertEquals(10.0, dependence.ged());
        assertNotEquals(control.ged() + data.ged(), dependence.ged(),
                "Shared statement nodes are counted once in the merged view");
        assertEquals(GedResult.EXACT, dependence.method());
    }

    @Test
    void testChangedEdgeKindCostsDeleteAndInsert() {
        GedResult result = ged.compute(chain(EdgeKind.CONTROL_FLOW, "a", "b"),
                chain(EdgeKind.CONTROL_FLOW_TRUE, "a", "b"));

        assertEquals(2.0, result.ged());
    }

    @Test
    void testDistanceToEmptyGraphIsItsSize() {
        ProgramGraph empty = chain(EdgeKind.CONTROL_FLOW);
        ProgramGraph graph = chain(EdgeKind.CONTROL_FLOW, "a", "b", "c");

        GedResult result = ged.compute(empty, graph);
        assertEquals(5.0, result.ged());
        assertEquals(1.0, result.normalized());
        assertEquals(5.0, ged.compute(graph, empty).ged());
    }

    @Test
    void testBothEmpty() {
        GedResult result = ged.compute(chain(EdgeKind.CONTROL_FLOW), chain(EdgeKind.CONTROL_FLOW));

        assertEquals(0.0, result.ged());
        assertEquals(0.0, result.normalized());
        assertEquals(GedResult.EXACT, result.method());
    }

    @Test
    void testNormalizedDistanceCanExceedOne() {
        GedResult result = ged.compute(chain(EdgeKind.CONTROL_FLOW, "a", "b"),
                chain(EdgeKind.DATA_FLOW, "c", "d"));

        // 2 relabels, 1 edge deleted, 1 edge inserted over a size of 3
        assertEquals(4.0, result.ged());
        assertEquals(4.0 / 3.0, result.normalized(), 1e-9);
        assertTrue(result.normalized() <= 2.0);
    }

    @Test
    void testKindMismatchIsRejected() throws GraphBuildException {
        ProgramGraph control = cfg(PLUS_ONE);
        ProgramGraph data = dfg(PLUS_ONE);

        assertThrows(IllegalArgumentException.class, () -> ged.compute(control, data));
    }

    @Test
    void testWidthBelowOneIsRejected() throws GraphBuildException {
        ProgramGraph graph = cfg(PLUS_ONE);

        assertThrows(IllegalArgumentException.class, () -> ged.compute(graph, graph, 0));
    }

    @Test
    void testPolicyPicksWidthFromLargerGraph() throws GraphBuildException {
        GraphEditDistance narrow = new GraphEditDistance(BeamWidthPolicy.parse("5:3,*:2"), null, 8);
        GedResult result = narrow.compute(cfg(PLUS_ONE), cfg(GUARDED));

        assertEquals(2, result.requestedBeamWidth(), "The guarded CFG has 6 nodes");
    }

    @Test
    void testZeroBudgetTimesOutWithWidthOne() throws GraphBuildException {
        GraphEditDistance hurried = new GraphEditDistance(BeamWidthPolicy.defaults(), Duration.ZERO, 8);
        ProgramGraph before = pdg(PLUS_ONE);
        ProgramGraph after = pdg(GUARDED);

        GedResult result = hurried.compute(before, after, 50);

        assertTrue(result.timedOut());
        assertEquals(1, result.beamWidth());
        assertEquals(50, result.requestedBeamWidth());
        assertTrue(result.isReduced());
        assertEquals(GedResult.BEAM_SEARCH, result.method());
        assertTrue(result.ged() >= 10.0, "A greedy completion is never below the exact distance");
    }

    /**
     * Sparse random graph: each node gets one forward edge and, sometimes, a back edge.
     */
    private static ProgramGraph synthetic(long seed, int nodes) {
        Random random = new Random(seed);
        ProgramGraph.Builder builder = ProgramGraph.builder(GraphKind.PDG, "synthetic-" + seed);
        for (int i = 0; i < nodes; i++) {
            builder.addNode(NodeKind.STATEMENT, "s" + random.nextInt(6), SourcePosition.UNKNOWN);
        }
        for (int i = 1; i < nodes; i++) {
            builder.addEdge(random.nextInt(i), i, EdgeKind.CONTROL_FLOW);
            if (random.nextInt(4) == 0) {
                builder.addEdge(i, random.nextInt(i), EdgeKind.DATA_FLOW);
            }
        }
        return builder.build();
    }

    @Test
    void testLargePairUnderTinyBudgetFallsBackToNarrowerWidth() {
        GraphEditDistance hurried = new GraphEditDistance(BeamWidthPolicy.defaults(), Duration.ZERO, 8);
        ProgramGraph before = synthetic(11, 120);
        ProgramGraph after = synthetic(12, 130);

        GedResult result = hurried.compute(before, after);

        assertEquals(10, result.requestedBeamWidth(), "Adaptive width for 130 nodes");
        assertTrue(result.timedOut());
        assertTrue(result.isReduced());
        assertEquals(1, result.beamWidth());
        assertTrue(Double.isFinite(result.ged()));
        assertTrue(result.ged() >= 0.0);
        assertTrue(result.ged() <= before.nodeCount() + before.edgeCount() + after.nodeCount() + after.edgeCount());
    }

    @Test
    void testMidSizedPairUnderShortBudgetStaysFinite() {
        GraphEditDistance hurried = new GraphEditDistance(BeamWidthPolicy.defaults(), Duration.ofMillis(1), 8);
        ProgramGraph before = synthetic(21, 25);
        ProgramGraph after = synthetic(22, 30);

        GedResult result = hurried.compute(before, after);

        assertEquals(50, result.requestedBeamWidth());
        assertTrue(result.beamWidth() >= 1 && result.beamWidth() <= 50);
        assertEquals(result.timedOut(), result.isReduced());
        assertTrue(Double.isFinite(result.ged()));
        assertTrue(result.ged() >= Math.abs(before.nodeCount() - after.nodeCount()));
    }

    @Test
    void testPairAboveLargestStepStartsAtWidthOne() {
        GraphEditDistance hurried = new GraphEditDistance(BeamWidthPolicy.defaults(), Duration.ZERO, 8);
        ProgramGraph before = synthetic(31, 210);
        ProgramGraph after = synthetic(32, 220);

        GedResult result = hurried.compute(before, after);

        assertTrue(result.timedOut());
        assertEquals(1, result.requestedBeamWidth());
        assertEquals(1, result.beamWidth());
        assertFalse(result.isReduced(), "Nothing narrower than width one to fall back to");
        assertTrue(result.ged() >= 0.0);
    }

    @Test
    void testInterruptedThreadStopsSearch() throws GraphBuildException {
        ProgramGraph before = pdg(PLUS_ONE);
        ProgramGraph after = pdg(GUARDED);

        Thread.currentThread().interrupt();
        try {
            GedResult result = ged.compute(before, after, 50);
            assertTrue(result.timedOut());
        } finally {
            Thread.interrupted();
        }
    }
}
