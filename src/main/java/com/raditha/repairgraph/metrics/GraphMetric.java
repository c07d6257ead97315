package com.raditha.repairgraph.metrics;

import com.raditha.repairgraph.ged.GedResult;
import com.raditha.repairgraph.model.GraphKind;

import java.util.Optional;

/**
 * The distance for one graph kind, or the reason it could not be measured. An unavailable
 * metric is never reported as a zero distance.
 */
public record GraphMetric(GraphKind kind, GedResult result, String unavailableReason) {

    public GraphMetric {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if ((result == null) == (unavailableReason == null)) {
            throw new IllegalArgumentException("Exactly one of result and unavailableReason must be set");
        }
    }

    public static GraphMetric measured(GraphKind kind, GedResult result) {
        return new GraphMetric(kind, result, null);
    }

    public static GraphMetric unavailable(GraphKind kind, String reason) {
        return new GraphMetric(kind, null, reason);
    }

    public boolean isAvailable() {
        return result != null;
    }

    public Optional<GedResult> ged() {
        return Optional.ofNullable(result);
    }
}
