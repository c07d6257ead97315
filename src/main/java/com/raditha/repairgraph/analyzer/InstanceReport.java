package com.raditha.repairgraph.analyzer;

import com.raditha.repairgraph.metrics.GraphMetricsReport;

import java.util.Optional;

/**
 * Outcome of one bug instance in a batch.
 *
 * @param instanceId    the instance
 * @param status        how the run ended
 * @param metrics       the distances, present only when the status is {@link Status#OK}
 * @param message       failure description, empty when the status is {@link Status#OK}
 * @param elapsedMillis wall-clock time spent on the instance
 */
public record InstanceReport(
        String instanceId,
        Status status,
        GraphMetricsReport metrics,
        String message,
        long elapsedMillis) {

    public enum Status {
        OK,
        FAILED,
        TIMED_OUT
    }

    public InstanceReport {
        if (status == Status.OK && metrics == null) {
            throw new IllegalArgumentException("A successful report needs metrics");
        }
        message = message == null ? "" : message;
    }

    public static InstanceReport succeeded(String instanceId, GraphMetricsReport metrics, long elapsedMillis) {
        return new InstanceReport(instanceId, Status.OK, metrics, "", elapsedMillis);
    }

    public static InstanceReport failed(String instanceId, String message, long elapsedMillis) {
        return new InstanceReport(instanceId, Status.FAILED, null, message, elapsedMillis);
    }

    public static InstanceReport timedOut(String instanceId, long elapsedMillis) {
        return new InstanceReport(instanceId, Status.TIMED_OUT, null,
                "Timed out after " + elapsedMillis + " ms", elapsedMillis);
    }

    public boolean isSuccess() {
        return status == Status.OK;
    }

    public Optional<GraphMetricsReport> report() {
        return Optional.ofNullable(metrics);
    }
}
