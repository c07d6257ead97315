package com.raditha.repairgraph.ged;

/**
 * Outcome of one edit distance computation, with the parameters that produced it and the sizes
 * of both inputs so the number can be re-examined without rebuilding the graphs.
 *
 * @param ged                 total edit cost of the best mapping found (an upper bound on the true distance)
 * @param normalized          ged divided by the larger of |V|+|E| over both graphs, 0 when both are empty
 * @param nodesBefore         node count of the first graph
 * @param nodesAfter          node count of the second graph
 * @param edgesBefore         edge count of the first graph
 * @param edgesAfter          edge count of the second graph
 * @param method              {@link #BEAM_SEARCH} or {@link #EXACT}
 * @param beamWidth           largest width whose search ran to completion (at least 1)
 * @param requestedBeamWidth  width asked for, before any time-out
 * @param timedOut            true when the wall-clock budget cut the search short
 */
public record GedResult(
        double ged,
        double normalized,
        int nodesBefore,
        int nodesAfter,
        int edgesBefore,
        int edgesAfter,
        String method,
        int beamWidth,
        int requestedBeamWidth,
        boolean timedOut) {

    public static final String BEAM_SEARCH = "beam_search";
    public static final String EXACT = "exact";

    public GedResult {
        if (ged < 0 || Double.isNaN(ged) || Double.isInfinite(ged)) {
            throw new IllegalArgumentException("ged must be finite and non-negative: " + ged);
        }
        if (beamWidth < 1) {
            throw new IllegalArgumentException("beamWidth must be at least 1");
        }
    }

    /**
     * Check if the reported width is narrower than the one requested.
     */
    public boolean isReduced() {
        return beamWidth < requestedBeamWidth;
    }
}
