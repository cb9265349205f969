package com.example.healthrag;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders a {@link RetrievalContext} as the markdown block handed to the text generator.
 * Section order is fixed: protocols, memory, insights, then one block per category.
 */
@Component
public class ContextRenderer {

    static final String NO_DATA_MARKER = "No relevant health data found for this query.";

    public String render(RetrievalContext ctx, boolean includeDebug) {
        StringBuilder out = new StringBuilder();
        out.append("# User Context\n\n");

        if (ctx.hasProtocols()) {
            out.append("## Active Protocols\n\n");
            for (ProtocolSnapshot p : ctx.getProtocols()) {
                out.append("### ").append(p.getName() == null ? "Unnamed Protocol" : p.getName()).append("\n");
                if (notBlank(p.getDescription())) out.append("Description: ").append(p.getDescription()).append("\n");
                if (p.getTargetMetrics() != null && !p.getTargetMetrics().isEmpty()) {
                    out.append("Target Metrics: ").append(String.join(", ", p.getTargetMetrics())).append("\n");
                }
                if (notBlank(p.getStartDate())) out.append("Started: ").append(p.getStartDate()).append("\n");
                if (notBlank(p.getDurationType()) && p.getDurationDays() != null) {
                    out.append("Duration: ").append(p.getDurationDays()).append(" days (").append(p.getDurationType()).append(")\n");
                }
                out.append("\n");
            }
        }

        if (ctx.hasMemory()) {
            out.append("## AI Memory\n\n");
            MemoryDocument recent = ctx.getRecentMemory();
            if (recent != null && !recent.getEntries().isEmpty()) {
                List<MemoryEntry> entries = recent.getEntries();
                out.append("### Recent Memory\n");
                out.append(entries.get(entries.size() - 1).render()).append("\n\n");
            }
            if (!ctx.getMemoryRecall().isEmpty()) {
                out.append("### Relevant Past Interactions\n");
                for (MemoryRecall r : ctx.getMemoryRecall()) {
                    out.append("- (").append(score(r.getSimilarity())).append(") ").append(r.getText()).append("\n");
                }
                out.append("\n");
            }
        }

        if (!ctx.getInsights().isEmpty()) {
            out.append("## Key User Insights\n\n");
            for (MemoryEntry e : ctx.getInsights()) {
                out.append("- ").append(e.render()).append("\n");
            }
            out.append("\n");
        }

        if (ctx.hasHealthData()) {
            out.append("## Relevant Health Data\n\n");
            for (Map.Entry<String, List<RankedMetric>> e : ctx.getMetricsByCategory().entrySet()) {
                out.append("### ").append(title(e.getKey())).append(" Data\n");
                for (RankedMetric m : e.getValue()) {
                    HealthMetricView v = m.getMetric();
                    out.append("- Date: ").append(v.getDate()).append("\n");
                    out.append("  Source: ").append(v.getSource()).append("\n");
                    out.append("  Relevance: ").append(score(m.getSimilarity())).append("\n");
                    if (v.getFields() != null) {
                        for (Map.Entry<String, Object> f : new TreeMap<>(v.getFields()).entrySet()) {
                            out.append("  ").append(f.getKey()).append(": ")
                                    .append(CanonicalRecordText.valueText(f.getValue())).append("\n");
                        }
                    }
                }
                out.append("\n");
            }
        } else {
            out.append("## Health Data\n\n").append(NO_DATA_MARKER).append("\n\n");
        }

        if (includeDebug && !ctx.getDebug().isEmpty()) {
            out.append("## Debug Information\n\n");
            for (Map.Entry<String, Object> e : ctx.getDebug().entrySet()) {
                out.append("- ").append(e.getKey()).append(": ").append(e.getValue()).append("\n");
            }
            out.append("\n");
        }
        return out.toString().trim();
    }

    // heart_rate -> Heart Rate
    static String title(String category) {
        StringBuilder sb = new StringBuilder();
        for (String part : category.split("_")) {
            if (part.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private static String score(double similarity) {
        return String.format(Locale.ROOT, "%.2f", similarity);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
