package com.example.healthrag;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class InsightPromptBuilder {

    static final String SYSTEM_PROMPT = "You are a health assistant that provides personalized health insights.\n"
            + "Present objective, research-backed observations without being prescriptive.\n"
            + "Respect user autonomy: provide information, not commands.\n"
            + "Focus on patterns and correlations in the health data.\n"
            + "Keep responses brief: 3-5 sentences, no general health advice unless asked.\n";

    /**
     * Picks the no-data, protocol-focused or general wording depending on what the context holds.
     */
    public String buildInsightPrompt(RetrievalContext ctx) {
        String period = ctx.getTimeFrame().describe();
        StringBuilder prompt = new StringBuilder(SYSTEM_PROMPT).append("\n");
        if (!ctx.hasHealthData()) {
            prompt.append("The user has requested health insights for the ").append(period)
                    .append(", but there is no health data available.\n\n");
            appendPreviousContext(prompt, ctx);
            prompt.append("Provide a brief, 2-3 sentence response acknowledging the lack of data and suggesting ")
                    .append("what types of health data would be most valuable to track. Be direct and concise.\n");
            return prompt.toString().trim();
        }

        prompt.append(ctx.getRendered()).append("\n\n");
        prompt.append("Question: ").append(ctx.getQuery()).append("\n\n");
        if (ctx.hasProtocols()) {
            prompt.append("Based on the health data from the ").append(period)
                    .append(" and the active protocols above, generate a concise health insight. ")
                    .append("Limit your response to 3-5 sentences that highlight the most significant patterns ")
                    .append("related to the user's active protocols.\n\n")
                    .append("Focus on:\n")
                    .append("1. How the user's health metrics relate to their protocol goals\n")
                    .append("2. Progress or challenges observed in the target metrics\n")
                    .append("3. Specific metrics that stand out, positively or negatively\n")
                    .append("4. Correlations between metrics that matter for their protocols\n");
        } else {
            prompt.append("Based on the health data from the ").append(period)
                    .append(", generate a concise health insight. Limit your response to 3-5 sentences that ")
                    .append("highlight the most significant patterns or trends. Only state what the data shows.\n")
                    .append("If specific metrics stand out, briefly mention them. Note clear correlations concisely.\n");
        }
        return prompt.toString().trim();
    }

    public String buildTrendPrompt(RetrievalContext ctx, String category) {
        String period = ctx.getTimeFrame().describe();
        StringBuilder prompt = new StringBuilder(SYSTEM_PROMPT).append("\n");
        prompt.append(ctx.getRendered()).append("\n\n");
        if (ctx.getMetricsByCategory().containsKey(category)) {
            prompt.append("Provide a brief analysis of the trends in the user's ").append(category)
                    .append(" data over the ").append(period)
                    .append(". Limit your response to 3-5 sentences that highlight the most significant ")
                    .append("patterns or changes. Focus only on what is directly observable in the data.\n");
        } else {
            prompt.append("The user doesn't have any ").append(category).append(" data for the ").append(period)
                    .append(". In 1-2 sentences, acknowledge this and suggest what types of ").append(category)
                    .append(" data would be helpful to collect.\n");
        }
        return prompt.toString().trim();
    }

    /** Summary appended to memory after an answer; the answer is cut to 200 chars. */
    public String memorySummary(String request, List<String> categories, String answer) {
        String scope = categories == null || categories.isEmpty() ? "all metrics" : String.join(", ", categories);
        String cut = answer.length() > 200 ? answer.substring(0, 200) + "..." : answer;
        return "User requested: " + request + " for " + scope + "\nKey insight provided: " + cut;
    }

    private static void appendPreviousContext(StringBuilder prompt, RetrievalContext ctx) {
        MemoryDocument recent = ctx.getRecentMemory();
        if (recent == null || recent.getEntries().isEmpty()) return;
        List<MemoryEntry> entries = recent.getEntries();
        prompt.append("Previous Context: ").append(entries.get(entries.size() - 1).render()).append("\n\n");
    }
}
