package io.tongchi.observability;

import io.tongchi.runtime.TongchiRuntime;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(TongchiRuntime.StatsOutcome stats) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "tongchi_trees", "Registered resource trees", null, null, stats.trees());
        appendMapGauge(sb, "tongchi_nodes_total", "Tree nodes grouped by status", "status", stats.nodesByStatus());
        appendGauge(sb, "tongchi_nodes_stale", "Loaded nodes past their TTL", null, null, stats.staleNodes());
        appendGauge(sb, "tongchi_lister_calls_total", "Lister invocations", null, null, stats.listerCalls());
        appendGauge(sb, "tongchi_lister_failures_total", "Lister invocations that failed or timed out", null, null, stats.listerFailures());
        appendGauge(sb, "tongchi_cache_hits_total", "Expands answered from cache", null, null, stats.cacheHits());
        appendGauge(sb, "tongchi_coalesced_waits_total", "Expands that joined an in-flight load", null, null, stats.coalescedWaits());
        for (Map.Entry<String, Long> e : stats.listerCallsByTree().entrySet()) {
            appendGauge(sb, "tongchi_tree_lister_calls_total", "Lister invocations per tree", "tree", e.getKey(), e.getValue());
        }
        appendGauge(sb, "tongchi_scheduled_tasks", "Scheduled tasks grouped by enabled flag", "enabled", "true", stats.enabledTasks());
        appendGauge(sb, "tongchi_scheduled_tasks", "Scheduled tasks grouped by enabled flag", "enabled", "false",
                stats.scheduledTasks() - stats.enabledTasks());
        appendGauge(sb, "tongchi_task_runs_total", "Scheduled task executions", null, null, stats.taskRuns());
        appendGauge(sb, "tongchi_task_failures_total", "Scheduled task executions that failed", null, null, stats.taskFailures());
        appendGauge(sb, "tongchi_alerts_raised_total", "Alerts raised by change detection", null, null, stats.alertsRaised());
        appendMapGauge(sb, "tongchi_processes_total", "Processes grouped by status", "status", stats.processesByStatus());
        appendGauge(sb, "tongchi_tracked_leases", "Leases tracked for renewal", null, null, stats.trackedLeases());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
