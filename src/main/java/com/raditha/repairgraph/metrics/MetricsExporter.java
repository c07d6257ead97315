package com.raditha.repairgraph.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.repairgraph.analyzer.InstanceReport;
import com.raditha.repairgraph.ged.GedResult;
import com.raditha.repairgraph.model.GraphKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Exports per-instance, per-kind distances to CSV and JSON for downstream statistics.
 */
public class MetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    public static final String STATUS_MEASURED = "measured";
    public static final String STATUS_UNAVAILABLE = "unavailable";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_TIMED_OUT = "timed_out";

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new Jdk8Module())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Batch-level summary with one row per instance and graph kind.
     */
    public record BatchMetrics(
            String batchName,
            LocalDateTime timestamp,
            int totalInstances,
            int succeeded,
            int failed,
            List<KindRecord> records,
            List<ChangeRecord> changes) {
    }

    /**
     * One exported row. Distance columns are null unless the status is {@link #STATUS_MEASURED}.
     */
    public record KindRecord(
            String instance,
            String kind,
            String status,
            Double ged,
            Double normalized,
            Integer nodesBefore,
            Integer nodesAfter,
            Integer edgesBefore,
            Integer edgesAfter,
            String method,
            Integer beamWidth,
            Boolean timedOut,
            String reason) {
    }

    /**
     * Per-instance measures of the change itself. Values that could not be computed are null.
     */
    public record ChangeRecord(
            String instance,
            int linesAdded,
            int linesDeleted,
            Integer tokenDistance,
            Integer complexityBefore,
            Integer complexityAfter,
            Integer astDistance,
            Double astNormalized,
            Double halsteadVolumeBefore,
            Double halsteadVolumeAfter,
            Double halsteadEffortDelta,
            Integer exceptionChanges,
            Integer typeChanges,
            Integer scopeChanges,
            Integer defUseBefore,
            Integer defUseAfter) {
    }

    /**
     * Build exportable metrics from batch reports.
     */
    public BatchMetrics buildMetrics(List<InstanceReport> reports, String batchName) {
        List<KindRecord> records = new ArrayList<>();
        List<ChangeRecord> changes = new ArrayList<>();
        for (InstanceReport report : reports) {
            records.addAll(buildRecords(report));
            if (report.isSuccess()) {
                changes.add(toChange(report.instanceId(), report.metrics()));
            }
        }
        int succeeded = (int) reports.stream().filter(InstanceReport::isSuccess).count();
        return new BatchMetrics(batchName, LocalDateTime.now(), reports.size(), succeeded,
                reports.size() - succeeded, records, changes);
    }

    private List<KindRecord> buildRecords(InstanceReport report) {
        if (!report.isSuccess()) {
            String status = report.status() == InstanceReport.Status.TIMED_OUT ? STATUS_TIMED_OUT : STATUS_FAILED;
            return List.of(new KindRecord(report.instanceId(), null, status,
                    null, null, null, null, null, null, null, null, null, report.message()));
        }
        List<KindRecord> records = new ArrayList<>();
        for (GraphMetric metric : report.metrics().all()) {
            records.add(toRecord(report.instanceId(), metric));
        }
        return records;
    }

    static KindRecord toRecord(String instance, GraphMetric metric) {
        GraphKind kind = metric.kind();
        if (!metric.isAvailable()) {
            return new KindRecord(instance, kind.key(), STATUS_UNAVAILABLE,
                    null, null, null, null, null, null, null, null, null, metric.unavailableReason());
        }
        GedResult r = metric.result();
        return new KindRecord(instance, kind.key(), STATUS_MEASURED,
                r.ged(), r.normalized(), r.nodesBefore(), r.nodesAfter(), r.edgesBefore(), r.edgesAfter(),
                r.method(), r.beamWidth(), r.timedOut(), null);
    }

    static ChangeRecord toChange(String instance, GraphMetricsReport report) {
        BasicMetrics basic = report.basic();
        SyntaxMetrics syntax = report.syntax();
        return new ChangeRecord(instance,
                basic.linesAdded(),
                basic.linesDeleted(),
                known(basic.tokenDistance()),
                known(basic.complexityBefore()),
                known(basic.complexityAfter()),
                syntax == null ? null : syntax.ast().distance(),
                syntax == null ? null : syntax.ast().normalized(),
                syntax == null ? null : syntax.halsteadBefore().volume(),
                syntax == null ? null : syntax.halsteadAfter().volume(),
                syntax == null ? null : syntax.effortDelta(),
                syntax == null ? null : syntax.exceptions().totalChanges(),
                syntax == null ? null : syntax.types().totalChanges(),
                syntax == null ? null : syntax.scopes().totalChanges(),
                known(report.defUseBefore()),
                known(report.defUseAfter()));
    }

    private static Integer known(int value) {
        return value == BasicMetrics.UNAVAILABLE ? null : value;
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(BatchMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Batch Summary\n");
        csv.append("timestamp,batch,total_instances,succeeded,failed\n");
        csv.append(String.format(Locale.ROOT, "%s,%s,%d,%d,%d%n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                escape(metrics.batchName()),
                metrics.totalInstances(),
                metrics.succeeded(),
                metrics.failed()));

        csv.append("\n");

        csv.append("# Per-Kind Distances\n");
        csv.append("instance,kind,status,ged,normalized,nodes_before,nodes_after,edges_before,edges_after,"
                + "method,beam_width,timed_out,reason\n");
        for (KindRecord r : metrics.records()) {
            csv.append(String.join(",",
                    escape(r.instance()),
                    cell(r.kind()),
                    r.status(),
                    r.ged() == null ? "" : String.format(Locale.ROOT, "%.1f", r.ged()),
                    r.normalized() == null ? "" : String.format(Locale.ROOT, "%.4f", r.normalized()),
                    cell(r.nodesBefore()),
                    cell(r.nodesAfter()),
                    cell(r.edgesBefore()),
                    cell(r.edgesAfter()),
                    cell(r.method()),
                    cell(r.beamWidth()),
                    cell(r.timedOut()),
                    escape(r.reason() == null ? "" : r.reason())));
            csv.append('\n');
        }

        csv.append("\n");

        csv.append("# Change Measures\n");
        csv.append("instance,lines_added,lines_deleted,token_distance,complexity_before,complexity_after,"
                + "ast_distance,ast_normalized,halstead_volume_before,halstead_volume_after,halstead_effort_delta,"
                + "exception_changes,type_changes,scope_changes,def_use_before,def_use_after\n");
        for (ChangeRecord c : metrics.changes()) {
            csv.append(String.join(",",
                    escape(c.instance()),
                    String.valueOf(c.linesAdded()),
                    String.valueOf(c.linesDeleted()),
                    cell(c.tokenDistance()),
                    cell(c.complexityBefore()),
                    cell(c.complexityAfter()),
                    cell(c.astDistance()),
                    decimal(c.astNormalized(), "%.4f"),
                    decimal(c.halsteadVolumeBefore(), "%.2f"),
                    decimal(c.halsteadVolumeAfter(), "%.2f"),
                    decimal(c.halsteadEffortDelta(), "%.2f"),
                    cell(c.exceptionChanges()),
                    cell(c.typeChanges()),
                    cell(c.scopeChanges()),
                    cell(c.defUseBefore()),
                    cell(c.defUseAfter())));
            csv.append('\n');
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(BatchMetrics metrics, Path outputPath) throws IOException {
        mapper.writeValue(outputPath.toFile(), metrics);
    }

    /**
     * Render metrics as a JSON string, for printing.
     */
    public String toJson(Object value) throws IOException {
        return mapper.writeValueAsString(value);
    }

    private static String cell(Object value) {
        return value == null ? "" : value.toString();
    }

    private static String decimal(Double value, String format) {
        return value == null ? "" : String.format(Locale.ROOT, format, value);
    }

    private static String escape(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
