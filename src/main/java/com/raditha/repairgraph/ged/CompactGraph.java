package com.raditha.repairgraph.ged;

import com.raditha.repairgraph.model.EdgeKind;
import com.raditha.repairgraph.model.ProgramEdge;
import com.raditha.repairgraph.model.ProgramGraph;
import com.raditha.repairgraph.model.ProgramNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Index-based view of a graph for the mapping search.
 * <p>
 * Nodes are renumbered 0..n-1 in ascending id order, labels are interned to small ints through a
 * table shared by both sides of a comparison, and the edges between an ordered pair of nodes are
 * held as a bitmask of their kinds, so the cost of a pair under a mapping is a popcount.
 */
final class CompactGraph {

    static final int KINDS = EdgeKind.values().length;

    final int size;
    final int edgeCount;
    final int[] labels;
    final int[] degree;

    /** Distinct nodes adjacent in either direction, self excluded */
    final int[][] neighbors;

    private final Map<Long, Integer> kinds;

    private CompactGraph(int size, int edgeCount, int[] labels, int[] degree, int[][] neighbors,
            Map<Long, Integer> kinds) {
        this.size = size;
        this.edgeCount = edgeCount;
        this.labels = labels;
        this.degree = degree;
        this.neighbors = neighbors;
        this.kinds = kinds;
    }

    /**
     * @param graph     graph to index
     * @param labelIds  label interning table, shared between the graphs being compared
     */
    static CompactGraph of(ProgramGraph graph, Map<String, Integer> labelIds) {
        List<ProgramNode> nodes = new ArrayList<>(graph.nodes());
        nodes.sort((x, y) -> Integer.compare(x.id(), y.id()));
        int n = nodes.size();
        Map<Integer, Integer> index = new HashMap<>();
        int[] labels = new int[n];
        for (int i = 0; i < n; i++) {
            ProgramNode node = nodes.get(i);
            index.put(node.id(), i);
            labels[i] = labelIds.computeIfAbsent(node.label(), l -> labelIds.size());
        }

        int[] degree = new int[n];
        Map<Long, Integer> kinds = new HashMap<>();
        List<Set<Integer>> adjacency = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            adjacency.add(new LinkedHashSet<>());
        }
        for (ProgramEdge edge : graph.edges()) {
            int s = index.get(edge.source());
            int t = index.get(edge.target());
            kinds.merge(pair(s, t, n), 1 << edge.kind().ordinal(), (a, b) -> a | b);
            degree[s]++;
            degree[t]++;
            if (s != t) {
                adjacency.get(s).add(t);
                adjacency.get(t).add(s);
            }
        }

        int[][] neighbors = new int[n][];
        for (int i = 0; i < n; i++) {
            neighbors[i] = adjacency.get(i).stream().mapToInt(Integer::intValue).sorted().toArray();
        }
        return new CompactGraph(n, graph.edgeCount(), labels, degree, neighbors, kinds);
    }

    /**
     * Bitmask of the kinds of the edges from one node to another.
     */
    int kinds(int from, int to) {
        Integer mask = kinds.get(pair(from, to, size));
        return mask == null ? 0 : mask;
    }

    /**
     * Number of edges from one node to another, over all kinds.
     */
    int edges(int from, int to) {
        return Integer.bitCount(kinds(from, to));
    }

    private static long pair(int from, int to, int n) {
        return (long) from * n + to;
    }
}
