package com.raditha.repairgraph.ged;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * The search problem for one pair of graphs: the order in which nodes of the first graph are
 * placed, the per-level data the lower bound needs, and the cost of extending a partial mapping.
 * <p>
 * A partial mapping at level t has decided the image (a node of the second graph, or deletion)
 * of the first t nodes in placement order. Its cost g counts every node operation decided so far
 * and every edge whose endpoints are both decided, on either side. Its bound h never exceeds the
 * cost still to come, and is exact once every node is placed, so f = g + h of a complete mapping
 * is its total edit cost.
 */
final class SearchSpace {

    static final int DELETE = -1;

    final CompactGraph a;
    final CompactGraph b;
    private final int maxCandidates;

    /** Nodes of the first graph in placement order, and the inverse */
    final int[] order;
    private final int[] levelOf;

    /** [level][kind] first-graph edges with an endpoint at that position or later */
    private final int[][] openA;

    /** For each label, the sorted placement positions of first-graph nodes carrying it */
    private final int[][] positionsByLabel;

    private final int[][] bByLabel;
    private final int[] bByDegree;
    private final int labelCount;

    SearchSpace(CompactGraph a, CompactGraph b, int labelCount, int maxCandidates) {
        this.a = a;
        this.b = b;
        this.labelCount = labelCount;
        this.maxCandidates = maxCandidates;
        this.order = placementOrder(a);
        this.levelOf = new int[a.size];
        for (int p = 0; p < order.length; p++) {
            levelOf[order[p]] = p;
        }
        this.openA = openEdgesByLevel();
        this.positionsByLabel = positionsByLabel();
        this.bByLabel = groupByLabel(b, labelCount);
        this.bByDegree = sortedByDegree(b);
    }

    int levels() {
        return order.length;
    }

    State root() {
        int[] remainingB = new int[labelCount];
        for (int label : b.labels) {
            remainingB[label]++;
        }
        int[] openB = new int[CompactGraph.KINDS];
        for (int x = 0; x < b.size; x++) {
            addKinds(openB, b.kinds(x, x), 1);
            for (int y : b.neighbors[x]) {
                addKinds(openB, b.kinds(x, y), 1);
            }
        }
        int common = 0;
        for (int label = 0; label < labelCount; label++) {
            common += Math.min(positionsByLabel[label].length, remainingB[label]);
        }
        int[] mapping = new int[a.size];
        Arrays.fill(mapping, DELETE);
        int[] preimage = new int[b.size];
        Arrays.fill(preimage, DELETE);
        return new State(0, mapping, preimage, remainingB, openB, common, 0, 0, bound(0, 0, common, openB));
    }

    /**
     * Score placing the next node of the state onto candidate v (or {@link #DELETE}).
     */
    Child score(State state, int parentIndex, int v) {
        int t = state.level;
        int u = order[t];
        int cost = v == DELETE ? 1 : (a.labels[u] == b.labels[v] ? 0 : 1);

        cost += Integer.bitCount(v == DELETE ? a.kinds(u, u) : a.kinds(u, u) ^ b.kinds(v, v));
        for (int w : a.neighbors[u]) {
            int p = levelOf[w];
            if (p >= t) {
                continue;
            }
            int out = a.kinds(u, w);
            int in = a.kinds(w, u);
            int x = state.mapping[p];
            if (v == DELETE || x == DELETE) {
                cost += Integer.bitCount(out) + Integer.bitCount(in);
            } else {
                cost += Integer.bitCount(out ^ b.kinds(v, x)) + Integer.bitCount(in ^ b.kinds(x, v));
            }
        }

        int common = state.common;
        int labelU = a.labels[u];
        if (countFrom(labelU, t) <= state.remainingB[labelU]) {
            common--;
        }
        int[] openB = state.openB;
        int used = state.used;
        if (v != DELETE) {
            for (int x : b.neighbors[v]) {
                int p = state.preimage[x];
                if (p == DELETE) {
                    continue;
                }
                int w = order[p];
                if (a.kinds(u, w) == 0 && a.kinds(w, u) == 0) {
                    cost += b.edges(v, x) + b.edges(x, v);
                }
            }
            int labelV = b.labels[v];
            if (state.remainingB[labelV] <= countFrom(labelV, t + 1)) {
                common--;
            }
            openB = closeEdges(state, v);
            used++;
        }
        int g = state.g + cost;
        return new Child(parentIndex, v, g, bound(t + 1, used, common, openB));
    }

    /**
     * The state a scored child stands for.
     */
    State extend(State parent, Child child) {
        int t = parent.level;
        int u = order[t];
        int v = child.candidate();
        int[] mapping = parent.mapping.clone();
        mapping[t] = v;
        int[] preimage = parent.preimage;
        int[] remainingB = parent.remainingB;
        int[] openB = parent.openB;
        int used = parent.used;
        int common = parent.common;
        int labelU = a.labels[u];
        if (countFrom(labelU, t) <= remainingB[labelU]) {
            common--;
        }
        if (v != DELETE) {
            openB = closeEdges(parent, v);
            preimage = preimage.clone();
            preimage[v] = t;
            int labelV = b.labels[v];
            if (remainingB[labelV] <= countFrom(labelV, t + 1)) {
                common--;
            }
            remainingB = remainingB.clone();
            remainingB[labelV]--;
            used++;
        }
        return new State(t + 1, mapping, preimage, remainingB, openB, common, used, child.g(), child.h());
    }

    /**
     * Candidates for the next node of the state, deletion last. With a prefilter, only unused
     * nodes with the same label plus a few others nearest in degree are offered.
     */
    int[] candidates(State state, boolean exhaustive) {
        int u = order[state.level];
        List<Integer> result = new ArrayList<>();
        if (exhaustive) {
            for (int v = 0; v < b.size; v++) {
                if (state.preimage[v] == DELETE) {
                    result.add(v);
                }
            }
        } else {
            int label = a.labels[u];
            if (label < bByLabel.length) {
                for (int v : bByLabel[label]) {
                    if (state.preimage[v] == DELETE) {
                        result.add(v);
                    }
                }
            }
            addNearestByDegree(state, u, label, result);
        }
        int[] candidates = new int[result.size() + 1];
        for (int i = 0; i < result.size(); i++) {
            candidates[i] = result.get(i);
        }
        candidates[result.size()] = DELETE;
        return candidates;
    }

    private void addNearestByDegree(State state, int u, int label, List<Integer> result) {
        int degree = a.degree[u];
        int hi = lowerBound(degree);
        int lo = hi - 1;
        int added = 0;
        while (added < maxCandidates && (lo >= 0 || hi < bByDegree.length)) {
            int pick;
            if (lo < 0) {
                pick = bByDegree[hi++];
            } else if (hi >= bByDegree.length) {
                pick = bByDegree[lo--];
            } else {
                int below = degree - b.degree[bByDegree[lo]];
                int above = b.degree[bByDegree[hi]] - degree;
                if (above < below || above == below && bByDegree[hi] < bByDegree[lo]) {
                    pick = bByDegree[hi++];
                } else {
                    pick = bByDegree[lo--];
                }
            }
            if (state.preimage[pick] == DELETE && b.labels[pick] != label) {
                result.add(pick);
                added++;
            }
        }
    }

    private int lowerBound(int degree) {
        int lo = 0;
        int hi = bByDegree.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (b.degree[bByDegree[mid]] < degree) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private int bound(int level, int used, int common, int[] openB) {
        int remainingA = a.size - level;
        int remainingB = b.size - used;
        int h = Math.max(remainingA, remainingB) - common;
        int[] open = openA[level];
        for (int k = 0; k < CompactGraph.KINDS; k++) {
            h += Math.abs(open[k] - openB[k]);
        }
        return h;
    }

    /**
     * Open second-graph edge counts after v becomes used: edges from v to used nodes, and v's
     * self loops, are closed.
     */
    private int[] closeEdges(State state, int v) {
        int[] openB = state.openB.clone();
        addKinds(openB, b.kinds(v, v), -1);
        for (int x : b.neighbors[v]) {
            if (state.preimage[x] != DELETE) {
                addKinds(openB, b.kinds(v, x), -1);
                addKinds(openB, b.kinds(x, v), -1);
            }
        }
        return openB;
    }

    /**
     * First-graph nodes with this label at placement position {@code from} or later.
     */
    private int countFrom(int label, int from) {
        if (label >= positionsByLabel.length) {
            return 0;
        }
        int[] positions = positionsByLabel[label];
        int lo = 0;
        int hi = positions.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (positions[mid] < from) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return positions.length - lo;
    }

    private int[][] openEdgesByLevel() {
        int[][] open = new int[a.size + 1][CompactGraph.KINDS];
        for (int x = 0; x < a.size; x++) {
            countClosing(open, levelOf[x], a.kinds(x, x));
            for (int y : a.neighbors[x]) {
                countClosing(open, Math.max(levelOf[x], levelOf[y]), a.kinds(x, y));
            }
        }
        for (int level = a.size - 1; level >= 0; level--) {
            for (int k = 0; k < CompactGraph.KINDS; k++) {
                open[level][k] += open[level + 1][k];
            }
        }
        return open;
    }

    private static void countClosing(int[][] open, int lastLevel, int mask) {
        for (int k = 0; k < CompactGraph.KINDS; k++) {
            if ((mask & (1 << k)) != 0) {
                open[lastLevel][k]++;
            }
        }
    }

    private int[][] positionsByLabel() {
        int[] counts = new int[labelCount];
        for (int label : a.labels) {
            counts[label]++;
        }
        int[][] positions = new int[labelCount][];
        for (int label = 0; label < labelCount; label++) {
            positions[label] = new int[counts[label]];
        }
        int[] filled = new int[labelCount];
        for (int p = 0; p < order.length; p++) {
            int label = a.labels[order[p]];
            positions[label][filled[label]++] = p;
        }
        return positions;
    }

    private static int[][] groupByLabel(CompactGraph graph, int labelCount) {
        int[] counts = new int[labelCount];
        for (int label : graph.labels) {
            counts[label]++;
        }
        int[][] groups = new int[labelCount][];
        for (int label = 0; label < labelCount; label++) {
            groups[label] = new int[counts[label]];
        }
        int[] filled = new int[labelCount];
        for (int v = 0; v < graph.size; v++) {
            int label = graph.labels[v];
            groups[label][filled[label]++] = v;
        }
        return groups;
    }

    private static int[] sortedByDegree(CompactGraph graph) {
        Integer[] nodes = new Integer[graph.size];
        for (int v = 0; v < graph.size; v++) {
            nodes[v] = v;
        }
        Arrays.sort(nodes, Comparator.<Integer>comparingInt(v -> graph.degree[v]).thenComparingInt(v -> v));
        return Arrays.stream(nodes).mapToInt(Integer::intValue).toArray();
    }

    /**
     * Highest degree first, then repeatedly the node with the most edges into the nodes already
     * ordered, so that edge costs are decided as early as possible. Ties go to higher degree,
     * then lower index.
     */
    static int[] placementOrder(CompactGraph graph) {
        int n = graph.size;
        int[] order = new int[n];
        boolean[] placed = new boolean[n];
        int[] links = new int[n];
        for (int p = 0; p < n; p++) {
            int best = -1;
            for (int v = 0; v < n; v++) {
                if (placed[v]) {
                    continue;
                }
                if (best < 0 || links[v] > links[best]
                        || links[v] == links[best] && graph.degree[v] > graph.degree[best]) {
                    best = v;
                }
            }
            order[p] = best;
            placed[best] = true;
            for (int w : graph.neighbors[best]) {
                if (!placed[w]) {
                    links[w] += graph.edges(best, w) + graph.edges(w, best);
                }
            }
        }
        return order;
    }

    private static void addKinds(int[] counts, int mask, int delta) {
        while (mask != 0) {
            int k = Integer.numberOfTrailingZeros(mask);
            counts[k] += delta;
            mask &= mask - 1;
        }
    }

    /**
     * A scored extension of a beam state, cheap to rank before any state is materialized.
     * Deletion sorts after every real candidate.
     */
    record Child(int parent, int candidate, int g, int h) {

        static final Comparator<Child> RANKING = Comparator.comparingInt(Child::f)
                .thenComparingInt(Child::h)
                .thenComparingInt(Child::parent)
                .thenComparingInt(c -> c.candidate() == DELETE ? Integer.MAX_VALUE : c.candidate());

        int f() {
            return g + h;
        }
    }

    /**
     * A partial mapping. Arrays are never modified after construction; children copy what they change.
     */
    static final class State {
        final int level;
        final int[] mapping;
        final int[] preimage;
        final int[] remainingB;
        final int[] openB;
        final int common;
        final int used;
        final int g;
        final int h;

        State(int level, int[] mapping, int[] preimage, int[] remainingB, int[] openB, int common, int used,
                int g, int h) {
            this.level = level;
            this.mapping = mapping;
            this.preimage = preimage;
            this.remainingB = remainingB;
            this.openB = openB;
            this.common = common;
            this.used = used;
            this.g = g;
            this.h = h;
        }

        int f() {
            return g + h;
        }
    }
}
