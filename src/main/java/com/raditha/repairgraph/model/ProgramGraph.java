package com.raditha.repairgraph.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Arena-style program graph: a node table addressed by integer id plus a set of typed edges.
 * Instances are immutable; build them with {@link Builder}.
 * <p>
 * Nodes never reference each other directly, so cycles (loops, recursion) need no special
 * handling and merging two graphs is a union of tables with an id remapping.
 */
public final class ProgramGraph {

    private final GraphKind kind;
    private final String name;
    private final Map<Integer, ProgramNode> nodes;
    private final Set<ProgramEdge> edges;
    private final Integer entryId;
    private final Map<Integer, List<ProgramEdge>> outgoing;
    private final Map<Integer, List<ProgramEdge>> incoming;

    private ProgramGraph(Builder builder) {
        this.kind = builder.kind;
        this.name = builder.name;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        this.edges = Collections.unmodifiableSet(new LinkedHashSet<>(builder.edges));
        this.entryId = builder.entryId;

        Map<Integer, List<ProgramEdge>> out = new HashMap<>();
        Map<Integer, List<ProgramEdge>> in = new HashMap<>();
        for (ProgramEdge edge : edges) {
            out.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
        }
        this.outgoing = out;
        this.incoming = in;
    }

    public static Builder builder(GraphKind kind, String name) {
        return new Builder(kind, name);
    }

    public GraphKind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Collection<ProgramNode> nodes() {
        return nodes.values();
    }

    public Set<ProgramEdge> edges() {
        return edges;
    }

    public ProgramNode node(int id) {
        ProgramNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("No node " + id + " in " + name);
        }
        return node;
    }

    public boolean containsNode(int id) {
        return nodes.containsKey(id);
    }

    public OptionalInt entry() {
        return entryId == null ? OptionalInt.empty() : OptionalInt.of(entryId);
    }

    public List<ProgramEdge> outEdges(int id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<ProgramEdge> inEdges(int id) {
        return incoming.getOrDefault(id, List.of());
    }

    public List<Integer> successors(int id) {
        return outEdges(id).stream().map(ProgramEdge::target).toList();
    }

    public List<Integer> predecessors(int id) {
        return inEdges(id).stream().map(ProgramEdge::source).toList();
    }

    public int degree(int id) {
        return outEdges(id).size() + inEdges(id).size();
    }

    public List<ProgramNode> nodesOfKind(NodeKind nodeKind) {
        return nodes.values().stream().filter(n -> n.kind() == nodeKind).toList();
    }

    public List<ProgramEdge> edgesOfKind(EdgeKind edgeKind) {
        return edges.stream().filter(e -> e.kind() == edgeKind).toList();
    }

    public boolean hasEdge(int source, int target, EdgeKind edgeKind) {
        return edges.contains(new ProgramEdge(source, target, edgeKind));
    }

    /**
     * A builder preloaded with this graph's content, for derived graphs.
     */
    public Builder toBuilder(GraphKind newKind, String newName) {
        Builder builder = new Builder(newKind, newName);
        nodes.values().forEach(builder::addNode);
        edges.forEach(builder::addEdge);
        builder.entryId = entryId;
        return builder;
    }

    @Override
    public String toString() {
        return "ProgramGraph(" + kind + " " + name + ", " + nodes.size() + " nodes, " + edges.size() + " edges)";
    }

    /**
     * Mutable staging area for a {@link ProgramGraph}. Not thread safe; one builder per build.
     */
    public static final class Builder {
        private final GraphKind kind;
        private final String name;
        private final Map<Integer, ProgramNode> nodes = new LinkedHashMap<>();
        private Set<ProgramEdge> edges = new LinkedHashSet<>();
        private Integer entryId;
        private int nextId;

        private Builder(GraphKind kind, String name) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.name = name == null ? kind.key() : name;
        }

        /**
         * Add a node under a fresh id.
         *
         * @return the id of the new node
         */
        public int addNode(NodeKind nodeKind, String label, SourcePosition position,
                Set<String> statementKeys, Map<String, String> attributes) {
            int id = nextId;
            addNode(new ProgramNode(id, nodeKind, label, position, statementKeys, attributes));
            return id;
        }

        public int addNode(NodeKind nodeKind, String label, SourcePosition position) {
            return addNode(nodeKind, label, position, Set.of(), Map.of());
        }

        /**
         * Add a node with an explicit id.
         *
         * @throws IllegalStateException if the id is taken
         */
        public Builder addNode(ProgramNode node) {
            if (nodes.containsKey(node.id())) {
                throw new IllegalStateException("Duplicate node id " + node.id() + " in " + name);
            }
            nodes.put(node.id(), node);
            nextId = Math.max(nextId, node.id() + 1);
            return this;
        }

        /**
         * Replace a node with an updated copy carrying the same id.
         */
        public Builder replaceNode(ProgramNode node) {
            if (!nodes.containsKey(node.id())) {
                throw new IllegalStateException("No node " + node.id() + " to replace in " + name);
            }
            nodes.put(node.id(), node);
            return this;
        }

        /**
         * Add an edge. Adding an edge equal to an existing one (same endpoints and kind) is a no-op.
         *
         * @return true if the edge was new
         * @throws IllegalStateException if an endpoint is missing
         */
        public boolean addEdge(ProgramEdge edge) {
            if (!nodes.containsKey(edge.source()) || !nodes.containsKey(edge.target())) {
                throw new IllegalStateException("Edge nodes must exist: " + edge + " in " + name);
            }
            return edges.add(edge);
        }

        public boolean addEdge(int source, int target, EdgeKind edgeKind) {
            return addEdge(new ProgramEdge(source, target, edgeKind));
        }

        public boolean addEdge(int source, int target, EdgeKind edgeKind, String label) {
            return addEdge(new ProgramEdge(source, target, edgeKind, label));
        }

        public boolean removeEdge(ProgramEdge edge) {
            return edges.remove(edge);
        }

        /**
         * Drop a node together with every edge touching it.
         */
        public Builder removeNode(int id) {
            edges.removeIf(e -> e.source() == id || e.target() == id);
            nodes.remove(id);
            if (entryId != null && entryId == id) {
                entryId = null;
            }
            return this;
        }

        /**
         * Point every edge touching {@code from} at {@code to} instead, then drop {@code from}.
         * Edges that would become duplicates collapse into one.
         */
        public Builder redirectAndRemove(int from, int to) {
            Set<ProgramEdge> rewritten = new LinkedHashSet<>();
            for (ProgramEdge edge : edges) {
                int source = edge.source() == from ? to : edge.source();
                int target = edge.target() == from ? to : edge.target();
                rewritten.add(edge.remap(source, target));
            }
            edges = rewritten;
            nodes.remove(from);
            if (entryId != null && entryId == from) {
                entryId = to;
            }
            return this;
        }

        public Builder setEntry(int id) {
            if (!nodes.containsKey(id)) {
                throw new IllegalStateException("Entry node " + id + " does not exist in " + name);
            }
            this.entryId = id;
            return this;
        }

        public ProgramNode node(int id) {
            return nodes.get(id);
        }

        public boolean containsNode(int id) {
            return nodes.containsKey(id);
        }

        public Collection<ProgramNode> nodes() {
            return nodes.values();
        }

        public Set<ProgramEdge> edges() {
            return Collections.unmodifiableSet(edges);
        }

        public int nodeCount() {
            return nodes.size();
        }

        /**
         * Ids reachable from {@code start} over edges accepted by the filter (breadth first).
         */
        public Set<Integer> reachableFrom(int start, java.util.function.Predicate<ProgramEdge> filter) {
            Map<Integer, List<Integer>> adjacency = new HashMap<>();
            for (ProgramEdge edge : edges) {
                if (filter.test(edge)) {
                    adjacency.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
                }
            }
            Set<Integer> seen = new HashSet<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            seen.add(start);
            while (!queue.isEmpty()) {
                int current = queue.poll();
                for (int next : adjacency.getOrDefault(current, List.of())) {
                    if (seen.add(next)) {
                        queue.add(next);
                    }
                }
            }
            return seen;
        }

        public ProgramGraph build() {
            return new ProgramGraph(this);
        }
    }
}
