package io.coordhub.observability;

import io.coordhub.runtime.CoordHubRuntime;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(CoordHubRuntime.StatsOutcome stats) {
        return format(stats, null);
    }

    public static String format(CoordHubRuntime.StatsOutcome stats, String namespace) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "coordhub_uptime_ms", "Milliseconds since the runtime started", null, null, stats.uptimeMs());
        appendGauge(sb, "coordhub_instances", "Registered instances", null, null, stats.instances());
        appendMapGauge(sb, "coordhub_instances_by_status", "Registered instances grouped by status", "status", stats.instancesByStatus());
        appendGauge(sb, "coordhub_tasks", "Tasks in the ledger", null, null, stats.tasks());
        appendMapGauge(sb, "coordhub_tasks_by_status", "Tasks grouped by status", "status", stats.tasksByStatus());
        appendGauge(sb, "coordhub_resource_claims", "Resource claims currently held, expired ones included until swept", null, null, stats.resources());
        appendGauge(sb, "coordhub_memory_entities", "Knowledge graph entities", null, null, stats.entities());
        appendGauge(sb, "coordhub_memory_relations", "Knowledge graph relations", null, null, stats.relations());
        appendGauge(sb, "coordhub_re_register_total", "Registrations that overwrote an existing instance", null, null, stats.reRegisterTotal());
        appendGauge(sb, "coordhub_claim_conflict_total", "Claims refused because another instance holds the resource", null, null, stats.claimConflictTotal());
        appendGauge(sb, "coordhub_claims_expired_total", "Claims removed by the expiry sweep", null, null, stats.claimsExpiredTotal());
        appendGauge(sb, "coordhub_claims_cascaded_total", "Claims released because their holder unregistered", null, null, stats.claimsCascadedTotal());
        appendGauge(sb, "coordhub_no_capacity_total", "Developer requests with no available instance", null, null, stats.noCapacityTotal());
        appendGauge(sb, "coordhub_rejected_total", "Calls rejected with a typed error", null, null, stats.rejectedTotal());
        String base = sb.toString();
        String normalizedNamespace = namespace == null ? "" : namespace.trim();
        if (normalizedNamespace.isBlank()) {
            return base;
        }
        String escapedNs = escapeLabel(normalizedNamespace);
        StringBuilder withNamespace = new StringBuilder(base.length() + 128);
        for (String line : base.split("\\r?\\n")) {
            if (line.isBlank()) {
                continue;
            }
            if (line.startsWith("#")) {
                withNamespace.append(line).append('\n');
                continue;
            }
            int sep = line.lastIndexOf(' ');
            String sample = line.substring(0, sep);
            String value = line.substring(sep + 1);
            int brace = sample.indexOf('{');
            if (brace >= 0 && sample.endsWith("}")) {
                sample = sample.substring(0, brace + 1)
                        + "namespace=\"" + escapedNs + "\","
                        + sample.substring(brace + 1);
            } else {
                sample = sample + "{namespace=\"" + escapedNs + "\"}";
            }
            withNamespace.append(sample).append(' ').append(value).append('\n');
        }
        return withNamespace.toString();
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
        if (!sb.toString().contains("# HELP " + metric + " ")) {
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
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
