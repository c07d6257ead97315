package com.raditha.repairgraph.ged;

import com.raditha.repairgraph.model.EdgeKind;
import com.raditha.repairgraph.model.GraphKind;
import com.raditha.repairgraph.model.NodeKind;
import com.raditha.repairgraph.model.ProgramEdge;
import com.raditha.repairgraph.model.ProgramGraph;
import com.raditha.repairgraph.model.ProgramNode;
import com.raditha.repairgraph.model.SourcePosition;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property-based tests for the edit distance search on small random graphs.
 */
class GraphEditDistancePropertiesTest {

    private static final String[] LABELS = {"a", "b", "c"};
    private static final EdgeKind[] KINDS = {EdgeKind.CONTROL_FLOW, EdgeKind.DATA_FLOW};

    private final GraphEditDistance ged = new GraphEditDistance(BeamWidthPolicy.defaults(), null, 8);

    /**
     * Random graph without self loops. Same seed, same graph.
     */
    static ProgramGraph randomGraph(long seed, int maxNodes) {
        return randomGraph(seed, 0, maxNodes);
    }

    static ProgramGraph randomGraph(long seed, int minNodes, int maxNodes) {
        Random random = new Random(seed);
        int n = minNodes + random.nextInt(maxNodes - minNodes + 1);
        ProgramGraph.Builder builder = ProgramGraph.builder(GraphKind.CFG, "random-" + seed);
        for (int i = 0; i < n; i++) {
            builder.addNode(NodeKind.STATEMENT, LABELS[random.nextInt(LABELS.length)], SourcePosition.UNKNOWN);
        }
        for (int from = 0; from < n; from++) {
            for (int to = 0; to < n; to++) {
                if (from != to && random.nextInt(3) == 0) {
                    builder.addEdge(from, to, KINDS[random.nextInt(KINDS.length)]);
                }
            }
        }
        return builder.build();
    }

    @Property(tries = 50)
    void distanceToItselfIsZero(@ForAll @IntRange(min = 0, max = 100_000) int seed) {
        ProgramGraph graph = randomGraph(seed, 8);
        assertEquals(0.0, ged.compute(graph, graph).ged(), "Self distance of " + graph);
    }

    @Property(tries = 40)
    void widerBeamNeverReportsMore(@ForAll @IntRange(min = 0, max = 100_000) int seedA,
                                   @ForAll @IntRange(min = 0, max = 100_000) int seedB) {
        ProgramGraph a = randomGraph(seedA, 10);
        ProgramGraph b = randomGraph(seedB, 10);

        double previous = Double.MAX_VALUE;
        for (int width = 1; width <= 6; width++) {
            double distance = ged.compute(a, b, width).ged();
            assertTrue(distance <= previous, "Width " + width + " gave " + distance + " after " + previous);
            previous = distance;
        }
    }

    @Property(tries = 40)
    void distanceStaysWithinTrivialBounds(@ForAll @IntRange(min = 0, max = 100_000) int seedA,
                                          @ForAll @IntRange(min = 0, max = 100_000) int seedB) {
        ProgramGraph a = randomGraph(seedA, 10);
        ProgramGraph b = randomGraph(seedB, 10);

        GedResult result = ged.compute(a, b, 3);
        int deleteAllInsertAll = a.nodeCount() + a.edgeCount() + b.nodeCount() + b.edgeCount();
        assertTrue(result.ged() <= deleteAllInsertAll);
        assertTrue(result.ged() >= Math.abs(a.nodeCount() - b.nodeCount()));
        assertTrue(result.normalized() >= 0.0 && result.normalized() <= 2.0);
    }

    @Property(tries = 60)
    void exactModeMatchesBruteForce(@ForAll @IntRange(min = 0, max = 100_000) int seedA,
                                    @ForAll @IntRange(min = 0, max = 100_000) int seedB) {
        ProgramGraph a = randomGraph(seedA, 4);
        ProgramGraph b = randomGraph(seedB, 4);

        GedResult result = ged.compute(a, b, 16);
        assertEquals(GedResult.EXACT, result.method());
        assertEquals(bruteForce(a, b), (int) result.ged(), "Distance between " + a + " and " + b);
    }

    @Property(tries = 12)
    void exactModeMatchesBruteForceOnLargerGraphs(@ForAll @IntRange(min = 0, max = 100_000) int seedA,
                                                  @ForAll @IntRange(min = 0, max = 100_000) int seedB) {
        ProgramGraph a = randomGraph(seedA, 5, 8);
        ProgramGraph b = randomGraph(seedB, 5, 8);

        GedResult result = ged.compute(a, b, 64);
        assertEquals(GedResult.EXACT, result.method());
        assertEquals(bruteForce(a, b), (int) result.ged(), "Distance between " + a + " and " + b);
    }

    @Property(tries = 30)
    void exactDistanceIsSymmetric(@ForAll @IntRange(min = 0, max = 100_000) int seedA,
                                  @ForAll @IntRange(min = 0, max = 100_000) int seedB) {
        ProgramGraph a = randomGraph(seedA, 4);
        ProgramGraph b = randomGraph(seedB, 4);

        assertEquals(ged.compute(a, b, 16).ged(), ged.compute(b, a, 16).ged());
    }

    /**
     * Minimum cost over every injective partial mapping of a's nodes into b's nodes.
     */
    private static int bruteForce(ProgramGraph a, ProgramGraph b) {
        List<ProgramNode> nodesA = new ArrayList<>(a.nodes());
        List<ProgramNode> nodesB = new ArrayList<>(b.nodes());
        Reference reference = new Reference(a, b, nodesA, nodesB);
        return reference.search(new int[nodesA.size()], 0, new boolean[nodesB.size()]);
    }

    /**
     * Both graphs as index arrays so each complete mapping is priced without lookups by id.
     */
    private static final class Reference {
        private final String[] labelsA;
        private final String[] labelsB;
        private final int[][] edgesA;
        private final Set<List<Integer>> edgesB = new HashSet<>();

        Reference(ProgramGraph a, ProgramGraph b, List<ProgramNode> nodesA, List<ProgramNode> nodesB) {
            labelsA = nodesA.stream().map(ProgramNode::label).toArray(String[]::new);
            labelsB = nodesB.stream().map(ProgramNode::label).toArray(String[]::new);
            List<ProgramEdge> listA = new ArrayList<>(a.edges());
            edgesA = new int[listA.size()][];
            for (int i = 0; i < listA.size(); i++) {
                ProgramEdge edge = listA.get(i);
                edgesA[i] = new int[] {indexOf(nodesA, edge.source()), indexOf(nodesA, edge.target()),
                        edge.kind().ordinal()};
            }
            for (ProgramEdge edge : b.edges()) {
                edgesB.add(List.of(indexOf(nodesB, edge.source()), indexOf(nodesB, edge.target()), edge.kind().ordinal()));
            }
        }

        int search(int[] mapping, int index, boolean[] used) {
            if (index == mapping.length) {
                return cost(mapping);
            }
            mapping[index] = -1;
            int best = search(mapping, index + 1, used);
            for (int j = 0; j < used.length; j++) {
                if (!used[j]) {
                    used[j] = true;
                    mapping[index] = j;
                    best = Math.min(best, search(mapping, index + 1, used));
                    used[j] = false;
                }
            }
            return best;
        }

        private int cost(int[] mapping) {
            int cost = 0;
            int matched = 0;
            for (int i = 0; i < mapping.length; i++) {
                if (mapping[i] < 0) {
                    cost++;
                } else {
                    matched++;
                    if (!labelsA[i].equals(labelsB[mapping[i]])) {
                        cost++;
                    }
                }
            }
            cost += labelsB.length - matched;

            int kept = 0;
            for (int[] edge : edgesA) {
                int from = mapping[edge[0]];
                int to = mapping[edge[1]];
                if (from >= 0 && to >= 0 && edgesB.contains(List.of(from, to, edge[2]))) {
                    kept++;
                }
            }
            return cost + edgesA.length - kept + edgesB.size() - kept;
        }
    }

    private static int indexOf(List<ProgramNode> nodes, int id) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id() == id) {
                return i;
            }
        }
        throw new IllegalArgumentException("No node " + id);
    }
}
