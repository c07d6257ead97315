package com.raditha.repairgraph.config;

import com.raditha.repairgraph.cfg.BlockPolicy;
import com.raditha.repairgraph.ged.BeamWidthPolicy;
import com.raditha.repairgraph.ged.GraphEditDistance;
import com.raditha.repairgraph.model.GraphKind;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Configuration for graph building, distance computation and batch runs.
 *
 * @param gedTimeout       wall-clock budget for one distance computation
 * @param beamWidthPolicy  graph size to beam width table
 * @param beamWidth        forced beam width; 0 lets the policy choose
 * @param blockPolicy      statement or basic-block granularity of control-flow nodes
 * @param maxCandidates    differently labelled candidates offered per search level
 * @param threads          batch worker threads
 * @param instanceTimeout  budget for one bug instance in a batch
 * @param maxScopeFiles    largest number of file pairs analysed as one unit
 * @param cacheEnabled     reuse graphs built for identical source text
 * @param kinds            graph kinds to measure
 */
public record AnalysisConfig(
        Duration gedTimeout,
        BeamWidthPolicy beamWidthPolicy,
        int beamWidth,
        BlockPolicy blockPolicy,
        int maxCandidates,
        int threads,
        Duration instanceTimeout,
        int maxScopeFiles,
        boolean cacheEnabled,
        Set<GraphKind> kinds) {

    public AnalysisConfig {
        if (gedTimeout == null || gedTimeout.isNegative() || gedTimeout.isZero()) {
            throw new IllegalArgumentException("gedTimeout must be positive");
        }
        if (beamWidthPolicy == null) {
            throw new IllegalArgumentException("beamWidthPolicy cannot be null");
        }
        if (beamWidth < 0) {
            throw new IllegalArgumentException("beamWidth must be >= 0");
        }
        if (blockPolicy == null) {
            blockPolicy = BlockPolicy.STATEMENT;
        }
        if (maxCandidates < 0) {
            throw new IllegalArgumentException("maxCandidates must be >= 0");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }
        if (instanceTimeout == null || instanceTimeout.isNegative() || instanceTimeout.isZero()) {
            throw new IllegalArgumentException("instanceTimeout must be positive");
        }
        if (maxScopeFiles < 1) {
            throw new IllegalArgumentException("maxScopeFiles must be >= 1");
        }
        if (kinds == null || kinds.isEmpty()) {
            kinds = EnumSet.allOf(GraphKind.class);
        }
        kinds = Set.copyOf(kinds);
    }

    /**
     * Default preset: the adaptive width table and a two minute budget per distance.
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(
                GraphEditDistance.DEFAULT_TIMEOUT,
                BeamWidthPolicy.defaults(),
                0, // adaptive
                BlockPolicy.STATEMENT,
                GraphEditDistance.DEFAULT_MAX_CANDIDATES,
                defaultThreads(),
                Duration.ofMinutes(10),
                20,
                true,
                EnumSet.allOf(GraphKind.class));
    }

    /**
     * Fast preset: narrow beams and short budgets, for large batches.
     */
    public static AnalysisConfig fast() {
        return new AnalysisConfig(
                Duration.ofSeconds(10),
                BeamWidthPolicy.parse("20:10,50:5,100:2,*:1"),
                0,
                BlockPolicy.STATEMENT,
                4,
                defaultThreads(),
                Duration.ofMinutes(2),
                10,
                true,
                EnumSet.allOf(GraphKind.class));
    }

    /**
     * Thorough preset: wide beams and a generous budget.
     */
    public static AnalysisConfig thorough() {
        return new AnalysisConfig(
                Duration.ofMinutes(10),
                BeamWidthPolicy.parse("20:200,50:100,100:50,201:20,*:5"),
                0,
                BlockPolicy.STATEMENT,
                16,
                defaultThreads(),
                Duration.ofMinutes(30),
                50,
                true,
                EnumSet.allOf(GraphKind.class));
    }

    public static AnalysisConfig preset(String name) {
        return switch (name.toLowerCase()) {
            case "fast" -> fast();
            case "thorough" -> thorough();
            case "default", "defaults" -> defaults();
            default -> throw new IllegalArgumentException("Unknown preset: " + name);
        };
    }

    /**
     * A distance engine configured from this record.
     */
    public GraphEditDistance gedEngine() {
        return new GraphEditDistance(beamWidthPolicy, gedTimeout, maxCandidates);
    }

    public boolean isAdaptiveWidth() {
        return beamWidth == 0;
    }

    public AnalysisConfig withKinds(Set<GraphKind> newKinds) {
        return new AnalysisConfig(gedTimeout, beamWidthPolicy, beamWidth, blockPolicy, maxCandidates, threads,
                instanceTimeout, maxScopeFiles, cacheEnabled, newKinds);
    }

    public AnalysisConfig withBeamWidth(int newBeamWidth) {
        return new AnalysisConfig(gedTimeout, beamWidthPolicy, newBeamWidth, blockPolicy, maxCandidates, threads,
                instanceTimeout, maxScopeFiles, cacheEnabled, kinds);
    }

    public AnalysisConfig withGedTimeout(Duration newTimeout) {
        return new AnalysisConfig(newTimeout, beamWidthPolicy, beamWidth, blockPolicy, maxCandidates, threads,
                instanceTimeout, maxScopeFiles, cacheEnabled, kinds);
    }

    private static int defaultThreads() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
