package upgrade;

import datamigrator.engine.PhaseResult;
import datamigrator.engine.RunReport;
import datamigrator.history.RunHistoryEntry;
import datamigrator.transfer.RowError;
import datamigrator.validation.ValidationFailure;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders run reports as JSON for tooling that drives the upgrade CLI.
 *
 * <p>Only maps, collections, strings, numbers, booleans and null are written;
 * any other value is written as its string form.
 */
public final class ReportJson {

    private ReportJson() {}

    public static String toJson(RunReport report) {
        return write(toMap(report));
    }

    public static String toJson(List<RunHistoryEntry> history) {
        List<Map<String, Object>> items = new ArrayList<>();
        for (RunHistoryEntry entry : history) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("run", entry.runId());
            item.put("timestamp", entry.timestamp().toString());
            item.put("scope", entry.scope());
            item.put("success", entry.success());
            items.add(item);
        }
        return write(items);
    }

    static Map<String, Object> toMap(RunReport report) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("run", report.runId());
        map.put("scope", report.scope().key());
        map.put("success", report.overallSuccess());
        map.put("duration_ms", report.durationMs());
        map.put("rows_transferred", report.rowsTransferred());
        map.put("cancelled", report.cancelled());
        map.put("restore_failed", report.restoreFailed());
        map.put("error", report.errorMessage());

        List<Map<String, Object>> phases = new ArrayList<>();
        for (PhaseResult phase : report.phasesRun()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", phase.phaseId());
            item.put("status", phase.status().name());
            item.put("rows", phase.rowsTransferred());
            item.put("duration_ms", phase.durationMs());
            if (!phase.rowErrors().isEmpty()) {
                List<Map<String, Object>> errors = new ArrayList<>();
                for (RowError error : phase.rowErrors()) {
                    Map<String, Object> e = new LinkedHashMap<>();
                    e.put("key", error.sourceKey() != null ? error.sourceKey().toString() : null);
                    e.put("message", error.message());
                    errors.add(e);
                }
                item.put("row_errors", errors);
            }
            if (!phase.validationFailures().isEmpty()) {
                List<Map<String, Object>> failures = new ArrayList<>();
                for (ValidationFailure failure : phase.validationFailures()) {
                    Map<String, Object> f = new LinkedHashMap<>();
                    f.put("rule", failure.rule());
                    f.put("stage", failure.stage().name());
                    f.put("severity", failure.severity().name());
                    f.put("message", failure.message());
                    failures.add(f);
                }
                item.put("validation", failures);
            }
            if (phase.errorMessage() != null) {
                item.put("error", phase.errorMessage());
            }
            phases.add(item);
        }
        map.put("phases", phases);

        if (report.metrics() != null) {
            map.put("metrics", report.metrics().toMap());
        }
        return map;
    }

    static String write(Object value) {
        StringBuilder sb = new StringBuilder();
        writeValue(sb, value);
        return sb.toString();
    }

    private static void writeValue(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            writeString(sb, s);
        } else if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
        } else if (value instanceof Map<?, ?> map) {
            writeMap(sb, map);
        } else if (value instanceof Collection<?> col) {
            writeCollection(sb, col);
        } else {
            writeString(sb, value.toString());
        }
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 32) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    private static void writeMap(StringBuilder sb, Map<?, ?> map) {
        sb.append('{');
        Iterator<? extends Map.Entry<?, ?>> it = map.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<?, ?> entry = it.next();
            writeString(sb, String.valueOf(entry.getKey()));
            sb.append(':');
            writeValue(sb, entry.getValue());
            if (it.hasNext()) {
                sb.append(',');
            }
        }
        sb.append('}');
    }

    private static void writeCollection(StringBuilder sb, Collection<?> col) {
        sb.append('[');
        Iterator<?> it = col.iterator();
        while (it.hasNext()) {
            writeValue(sb, it.next());
            if (it.hasNext()) {
                sb.append(',');
            }
        }
        sb.append(']');
    }
}
