package com.raditha.repairgraph.cfg;

import com.raditha.repairgraph.model.EdgeKind;
import com.raditha.repairgraph.model.NodeKind;
import com.raditha.repairgraph.model.ProgramEdge;
import com.raditha.repairgraph.model.ProgramGraph;
import com.raditha.repairgraph.model.ProgramNode;
import com.raditha.repairgraph.model.SourcePosition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collapses straight-line runs of plain statement nodes into basic blocks.
 * <p>
 * A link u -> v is straight when both are {@link NodeKind#STATEMENT} nodes, u has exactly one
 * outgoing edge (plain control flow to v) and v has exactly one incoming edge. Maximal chains
 * of straight links become a single node that keeps the statement keys of all its members,
 * so structural merging still finds every statement.
 */
final class BasicBlockCoalescer {

    private BasicBlockCoalescer() {
    }

    static void coalesce(ProgramGraph.Builder graph) {
        Map<Integer, List<ProgramEdge>> out = new HashMap<>();
        Map<Integer, List<ProgramEdge>> in = new HashMap<>();
        for (ProgramEdge edge : graph.edges()) {
            out.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
        }

        List<List<Integer>> chains = new ArrayList<>();
        Set<Integer> claimed = new HashSet<>();
        for (ProgramNode node : graph.nodes()) {
            if (node.kind() != NodeKind.STATEMENT || claimed.contains(node.id())
                    || hasStraightPredecessor(graph, node.id(), out, in)) {
                continue;
            }
            List<Integer> chain = new ArrayList<>();
            chain.add(node.id());
            claimed.add(node.id());
            Integer next = straightSuccessor(graph, node.id(), out, in);
            while (next != null && claimed.add(next)) {
                chain.add(next);
                next = straightSuccessor(graph, next, out, in);
            }
            if (chain.size() > 1) {
                chains.add(chain);
            }
        }

        for (List<Integer> chain : chains) {
            collapse(graph, chain);
        }
    }

    private static boolean hasStraightPredecessor(ProgramGraph.Builder graph, int id,
            Map<Integer, List<ProgramEdge>> out, Map<Integer, List<ProgramEdge>> in) {
        List<ProgramEdge> incoming = in.getOrDefault(id, List.of());
        if (incoming.size() != 1) {
            return false;
        }
        Integer successor = straightSuccessor(graph, incoming.get(0).source(), out, in);
        return successor != null && successor == id;
    }

    private static Integer straightSuccessor(ProgramGraph.Builder graph, int id,
            Map<Integer, List<ProgramEdge>> out, Map<Integer, List<ProgramEdge>> in) {
        ProgramNode node = graph.node(id);
        if (node.kind() != NodeKind.STATEMENT) {
            return null;
        }
        List<ProgramEdge> outgoing = out.getOrDefault(id, List.of());
        if (outgoing.size() != 1 || outgoing.get(0).kind() != EdgeKind.CONTROL_FLOW) {
            return null;
        }
        int target = outgoing.get(0).target();
        ProgramNode next = graph.node(target);
        if (target == id || next.kind() != NodeKind.STATEMENT
                || in.getOrDefault(target, List.of()).size() != 1
                || next.isUnreachable() != node.isUnreachable()) {
            return null;
        }
        return target;
    }

    private static void collapse(ProgramGraph.Builder graph, List<Integer> chain) {
        List<ProgramNode> members = chain.stream().map(graph::node).toList();
        ProgramNode head = members.get(0);
        ProgramNode tail = members.get(members.size() - 1);

        Set<String> keys = new LinkedHashSet<>();
        members.forEach(m -> keys.addAll(m.statementKeys()));
        String label = members.stream().map(ProgramNode::label).collect(Collectors.joining(" "));
        SourcePosition position = new SourcePosition(head.position().startLine(), tail.position().endLine(),
                head.position().startColumn(), tail.position().endColumn());

        for (int i = 0; i + 1 < chain.size(); i++) {
            graph.removeEdge(new ProgramEdge(chain.get(i), chain.get(i + 1), EdgeKind.CONTROL_FLOW));
        }
        for (int i = 1; i < chain.size(); i++) {
            graph.redirectAndRemove(chain.get(i), head.id());
        }
        graph.replaceNode(new ProgramNode(head.id(), NodeKind.STATEMENT, label, position, keys, head.attributes()));
    }
}
