package com.raditha.repairgraph.metrics;

import com.raditha.repairgraph.model.GraphKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Distances for every requested graph kind between two versions of the same code.
 *
 * @param name          display name of the compared unit
 * @param metrics       one entry per requested kind, in kind order
 * @param basic         text-level measures of the change
 * @param filesAnalysed file pairs that were analysed
 * @param filesDropped  file pairs left out because of the scope limit
 * @param syntax        syntax-level measures, or null when a side did not parse
 * @param defUseBefore  def-use chains before the change, or {@link BasicMetrics#UNAVAILABLE}
 * @param defUseAfter   def-use chains after the change, or {@link BasicMetrics#UNAVAILABLE}
 */
public record GraphMetricsReport(
        String name,
        Map<GraphKind, GraphMetric> metrics,
        BasicMetrics basic,
        int filesAnalysed,
        int filesDropped,
        SyntaxMetrics syntax,
        int defUseBefore,
        int defUseAfter) {

    public GraphMetricsReport {
        metrics = metrics.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(metrics));
    }

    public GraphMetricsReport(String name, Map<GraphKind, GraphMetric> metrics, BasicMetrics basic,
                              int filesAnalysed, int filesDropped) {
        this(name, metrics, basic, filesAnalysed, filesDropped, null,
                BasicMetrics.UNAVAILABLE, BasicMetrics.UNAVAILABLE);
    }

    public Optional<SyntaxMetrics> syntaxMetrics() {
        return Optional.ofNullable(syntax);
    }

    public boolean hasDefUseChains() {
        return defUseBefore != BasicMetrics.UNAVAILABLE && defUseAfter != BasicMetrics.UNAVAILABLE;
    }

    /**
     * Change in def-use chains, or {@link BasicMetrics#UNAVAILABLE} when either side is unknown.
     */
    public int defUseDelta() {
        return hasDefUseChains() ? defUseAfter - defUseBefore : BasicMetrics.UNAVAILABLE;
    }

    public Optional<GraphMetric> metric(GraphKind kind) {
        return Optional.ofNullable(metrics.get(kind));
    }

    /**
     * Metrics in kind order.
     */
    public List<GraphMetric> all() {
        return List.copyOf(metrics.values());
    }

    public boolean hasUnavailable() {
        return metrics.values().stream().anyMatch(m -> !m.isAvailable());
    }
}
