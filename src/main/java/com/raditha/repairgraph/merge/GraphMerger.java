package com.raditha.repairgraph.merge;

import com.raditha.repairgraph.model.GraphKind;
import com.raditha.repairgraph.model.ProgramEdge;
import com.raditha.repairgraph.model.ProgramGraph;
import com.raditha.repairgraph.model.ProgramNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural graph algebra.
 * <p>
 * A structural merge is keyed by statement identity: a node of the right graph that shares a
 * statement key with a node of the left graph is the same statement seen from another view,
 * so it is coalesced into the left node instead of being copied. All other right nodes are
 * copied under fresh ids. Edges of both sides are re-pointed through the id mapping and
 * unioned.
 * <p>
 * Distances of merged kinds must be computed on graphs produced here; adding up the distances
 * of the component graphs double counts shared statements and misses edge-only changes.
 */
public final class GraphMerger {
    private static final Logger logger = LoggerFactory.getLogger(GraphMerger.class);

    private GraphMerger() {
    }

    /**
     * PDG: control flow and data flow sharing statement nodes.
     */
    public static ProgramGraph programDependenceGraph(ProgramGraph cfg, ProgramGraph dfg) {
        requireKind(cfg, GraphKind.CFG);
        requireKind(dfg, GraphKind.DFG);
        return structuralMerge(cfg, dfg, GraphKind.PDG);
    }

    /**
     * CPG: a PDG extended with the call graph. Callable declarations coalesce with function
     * entries and call sites with the statements that contain them.
     */
    public static ProgramGraph codePropertyGraph(ProgramGraph pdg, ProgramGraph callGraph) {
        requireKind(pdg, GraphKind.PDG);
        requireKind(callGraph, GraphKind.CALL_GRAPH);
        return structuralMerge(pdg, callGraph, GraphKind.CPG);
    }

    /**
     * Merge two graphs, coalescing right nodes into left nodes that share a statement key.
     * The left node keeps its kind and label and gains the right node's keys.
     *
     * @throws IllegalStateException if either graph has an edge whose endpoint is missing
     */
    public static ProgramGraph structuralMerge(ProgramGraph left, ProgramGraph right, GraphKind kind) {
        return merge(left, right, kind, true);
    }

    /**
     * Place two graphs side by side without coalescing anything.
     */
    public static ProgramGraph disjointUnion(ProgramGraph left, ProgramGraph right, GraphKind kind) {
        return merge(left, right, kind, false);
    }

    private static ProgramGraph merge(ProgramGraph left, ProgramGraph right, GraphKind kind, boolean coalesce) {
        ProgramGraph.Builder merged = ProgramGraph.builder(kind, left.name());
        Map<String, Integer> byKey = new HashMap<>();
        int nextId = 0;
        for (ProgramNode node : left.nodes()) {
            merged.addNode(node);
            node.statementKeys().forEach(key -> byKey.putIfAbsent(key, node.id()));
            nextId = Math.max(nextId, node.id() + 1);
        }
        left.entry().ifPresent(merged::setEntry);

        Map<Integer, Integer> rightIds = new HashMap<>();
        int coalesced = 0;
        for (ProgramNode node : right.nodes()) {
            Integer target = coalesce ? findShared(node, byKey) : null;
            if (target != null) {
                rightIds.put(node.id(), target);
                ProgramNode survivor = merged.node(target);
                if (!survivor.statementKeys().containsAll(node.statementKeys())) {
                    Set<String> keys = new LinkedHashSet<>(survivor.statementKeys());
                    keys.addAll(node.statementKeys());
                    merged.replaceNode(new ProgramNode(survivor.id(), survivor.kind(), survivor.label(),
                            survivor.position(), keys, survivor.attributes()));
                }
                coalesced++;
            } else {
                int id = nextId++;
                merged.addNode(node.withId(id));
                rightIds.put(node.id(), id);
            }
        }

        for (ProgramEdge edge : left.edges()) {
            merged.addEdge(edge);
        }
        for (ProgramEdge edge : right.edges()) {
            merged.addEdge(edge.remap(mapped(rightIds, edge.source()), mapped(rightIds, edge.target())));
        }
        if (left.entry().isEmpty()) {
            right.entry().ifPresent(e -> merged.setEntry(rightIds.get(e)));
        }

        ProgramGraph result = merged.build();
        logger.debug("Merged {} + {} into {} ({} nodes coalesced)", left.kind(), right.kind(), result, coalesced);
        return result;
    }

    /**
     * The left node sharing a key with this node. Keys are tried in sorted order so the
     * choice is deterministic when a node's keys map to several left nodes.
     */
    private static Integer findShared(ProgramNode node, Map<String, Integer> byKey) {
        for (String key : new TreeSet<>(node.statementKeys())) {
            Integer id = byKey.get(key);
            if (id != null) {
                return id;
            }
        }
        return null;
    }

    private static int mapped(Map<Integer, Integer> ids, int id) {
        Integer target = ids.get(id);
        if (target == null) {
            throw new IllegalStateException("Edge endpoint " + id + " is not a node of the merged graph");
        }
        return target;
    }

    private static void requireKind(ProgramGraph graph, GraphKind expected) {
        if (graph.kind() != expected) {
            throw new IllegalArgumentException("Expected a " + expected + " graph but got " + graph.kind());
        }
    }
}
