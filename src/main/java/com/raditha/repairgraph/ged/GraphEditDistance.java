package com.raditha.repairgraph.ged;

import com.raditha.repairgraph.ged.SearchSpace.State;
import com.raditha.repairgraph.model.ProgramGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Approximate graph edit distance between two graphs of the same kind.
 * <p>
 * Unit costs: inserting or deleting a node or an edge costs 1, substituting a node costs 0 when
 * the labels are equal and 1 otherwise. Edges are identified by (source, target, kind), so a
 * changed edge kind costs a deletion and an insertion.
 * <p>
 * The search maps nodes of the first graph, in a connectivity-first order, onto nodes of the
 * second graph or onto deletion. Beam widths 1, 2, ... up to the requested width are run in turn,
 * each seeded with the best total so far as a pruning bound, so a wider request never reports a
 * larger distance than a narrower one. When the requested width covers every node pairing, a
 * complete branch and bound finishes the job and the result is exact.
 * <p>
 * If the time budget runs out, the best partial mapping is completed greedily and the result
 * reports the largest width that finished.
 */
public class GraphEditDistance {
    private static final Logger logger = LoggerFactory.getLogger(GraphEditDistance.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);
    public static final int DEFAULT_MAX_CANDIDATES = 8;

    /** Widths tried by beam search before the exact search takes over */
    private static final int EXACT_SEED_WIDTH = 8;

    private final BeamWidthPolicy policy;
    private final Duration timeout;
    private final int maxCandidates;

    public GraphEditDistance() {
        this(BeamWidthPolicy.defaults(), DEFAULT_TIMEOUT, DEFAULT_MAX_CANDIDATES);
    }

    /**
     * @param policy         width to use when none is requested
     * @param timeout        wall-clock budget per computation; null for none
     * @param maxCandidates  differently labelled nodes offered per level, besides same-label ones
     */
    public GraphEditDistance(BeamWidthPolicy policy, Duration timeout, int maxCandidates) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.timeout = timeout;
        if (maxCandidates < 0) {
            throw new IllegalArgumentException("maxCandidates must not be negative");
        }
        this.maxCandidates = maxCandidates;
    }

    /**
     * Distance with the width the policy picks for the larger graph.
     */
    public GedResult compute(ProgramGraph before, ProgramGraph after) {
        return compute(before, after, policy.widthFor(Math.max(before.nodeCount(), after.nodeCount())));
    }

    public GedResult compute(ProgramGraph before, ProgramGraph after, int beamWidth) {
        if (before.kind() != after.kind()) {
            throw new IllegalArgumentException(
                    "Cannot compare a " + before.kind() + " graph with a " + after.kind() + " graph");
        }
        if (beamWidth < 1) {
            throw new IllegalArgumentException("Beam width must be at least 1: " + beamWidth);
        }
        long started = System.nanoTime();
        Deadline deadline = Deadline.after(timeout);

        Map<String, Integer> labels = new HashMap<>();
        CompactGraph a = CompactGraph.of(before, labels);
        CompactGraph b = CompactGraph.of(after, labels);
        SearchSpace space = new SearchSpace(a, b, labels.size(), maxCandidates);
        State root = space.root();

        boolean exhaustive = (long) a.size * b.size <= beamWidth;
        int ladderTop = exhaustive ? Math.min(beamWidth, EXACT_SEED_WIDTH) : beamWidth;
        int incumbent = Integer.MAX_VALUE;
        int completed = 0;
        boolean timedOut = false;
        boolean optimal = false;

        for (int width = 1; width <= ladderTop; width++) {
            BeamSearch.Run run = BeamSearch.run(space, root, width, incumbent, deadline);
            if (run.interrupted()) {
                timedOut = true;
                incumbent = Math.min(incumbent, BeamSearch.complete(space, run.frontier()).f());
                break;
            }
            if (run.best() != null) {
                incumbent = Math.min(incumbent, run.best().f());
            }
            completed = width;
            if (incumbent == root.f()) {
                optimal = true;
                completed = beamWidth;
                break;
            }
        }

        if (exhaustive && !timedOut && !optimal) {
            ExactSearch.Outcome outcome = ExactSearch.run(space, incumbent, deadline);
            incumbent = Math.min(incumbent, outcome.cost());
            if (outcome.complete()) {
                optimal = true;
                completed = beamWidth;
            } else {
                timedOut = true;
            }
        }

        String method = exhaustive && optimal ? GedResult.EXACT : GedResult.BEAM_SEARCH;
        GedResult result = new GedResult(incumbent, normalize(incumbent, before, after),
                before.nodeCount(), after.nodeCount(), before.edgeCount(), after.edgeCount(),
                method, Math.max(1, completed), beamWidth, timedOut);

        long elapsed = (System.nanoTime() - started) / 1_000_000;
        if (timedOut) {
            logger.info("GED on {} graphs ({} vs {} nodes) timed out after {} ms; reporting width {} of {}",
                    before.kind(), a.size, b.size, elapsed, result.beamWidth(), beamWidth);
        } else {
            logger.debug("GED on {} graphs ({} vs {} nodes) = {} by {} in {} ms",
                    before.kind(), a.size, b.size, incumbent, method, elapsed);
        }
        return result;
    }

    /**
     * Distance divided by the size of the larger graph, counting nodes and edges. Lies in [0, 2]
     * under unit costs, since relabelling every node and rewriting every edge of both graphs is
     * always possible.
     */
    static double normalize(double ged, ProgramGraph before, ProgramGraph after) {
        int size = Math.max(before.nodeCount() + before.edgeCount(), after.nodeCount() + after.edgeCount());
        return size == 0 ? 0.0 : ged / size;
    }

    public BeamWidthPolicy policy() {
        return policy;
    }

    public Duration timeout() {
        return timeout;
    }
}
