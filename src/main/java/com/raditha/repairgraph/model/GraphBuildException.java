package com.raditha.repairgraph.model;

import java.util.Optional;

/**
 * Source text could not be turned into the requested graph: a syntax error or a construct the
 * builders cannot decompose. Callers report the metric as unavailable, never as zero.
 */
public class GraphBuildException extends Exception {

    private final GraphKind graphKind;
    private final SourcePosition position;

    public GraphBuildException(String message, GraphKind graphKind, SourcePosition position) {
        super(message);
        this.graphKind = graphKind;
        this.position = position == null ? SourcePosition.UNKNOWN : position;
    }

    public GraphBuildException(String message, Throwable cause) {
        super(message, cause);
        this.graphKind = null;
        this.position = SourcePosition.UNKNOWN;
    }

    /**
     * The graph being built, empty when the failure happened while parsing.
     */
    public Optional<GraphKind> graphKind() {
        return Optional.ofNullable(graphKind);
    }

    public SourcePosition position() {
        return position;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (graphKind != null) {
            sb.append(" [").append(graphKind.key()).append(']');
        }
        if (position.isKnown()) {
            sb.append(" at ").append(position.toDisplayString());
        }
        return sb.toString();
    }
}
