package io.agentkernel.admission;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local keyword classifier. Short conversational queries are MEDIUM, batch-style chores are LOW and
 * anything else is assumed to need real reasoning (HIGH).
 */
public final class HeuristicIntentClassifier implements IntentClassifier {
    private static final List<Pattern> SIMPLE_QUERY = List.of(
            Pattern.compile("^what\\s+(is|are)"),
            Pattern.compile("^tell\\s+me"),
            Pattern.compile("^list\\s+"),
            Pattern.compile("^status"),
            Pattern.compile("^hello"),
            Pattern.compile("^hi\\s*$"),
            Pattern.compile("^bye"),
            Pattern.compile("^thanks")
    );
    private static final Pattern BATCH_WORK = Pattern.compile("\\b(schedule|batch|report|export|log|archive)\\s+");

    @Override
    public Classification classify(String rawInput) {
        String input = rawInput == null ? "" : rawInput.trim().toLowerCase(Locale.ROOT);
        for (Pattern pattern : SIMPLE_QUERY) {
            if (pattern.matcher(input).find()) {
                return new Classification(RoutingTier.MEDIUM, List.of("simple_query"),
                        "simple query, answerable without deep reasoning");
            }
        }
        Matcher batch = BATCH_WORK.matcher(input);
        if (batch.find()) {
            List<String> concepts = new ArrayList<>();
            concepts.add("batch_processing");
            do {
                String keyword = batch.group(1);
                if (!concepts.contains(keyword)) {
                    concepts.add(keyword);
                }
            } while (batch.find());
            return new Classification(RoutingTier.LOW, concepts, "low-priority batch job, deferred to the lazy queue");
        }
        return new Classification(RoutingTier.HIGH, List.of("complex_reasoning"),
                "complex request that needs full processing");
    }
}
