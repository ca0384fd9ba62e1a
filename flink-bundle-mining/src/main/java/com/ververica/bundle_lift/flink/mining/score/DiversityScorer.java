package com.ververica.bundle_lift.flink.mining.score;

import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Penalizes items that dominate a context's rule set.
 *
 * <pre>
 * diversity(r) = 1 - mean over items i of r ( |other same-context rules containing i| / |same-context rules| )
 * </pre>
 * Only rules sharing r's context are counted, so an item recurring across
 * contexts is never penalized. The result is clamped to [0,1]; a rule with
 * no same-context peers scores 1.0.
 */
public class DiversityScorer implements Serializable {

    private static final long serialVersionUID = 1L;

    public double diversity(ContextualRule rule, List<ContextualRule> rules) {
        List<ContextualRule> sameContext = sameContext(rule.getContext(), rules);
        if (sameContext.size() <= 1) {
            return 1.0;
        }
        return diversity(rule, itemCounts(sameContext), sameContext.size());
    }

    /**
     * Scores every rule of one context in a single pass.
     */
    public Map<ContextualRule, Double> scoreAll(List<ContextualRule> contextRules) {
        Map<ContextualRule, Double> scores = new LinkedHashMap<>();
        Map<Context, List<ContextualRule>> groups = group(contextRules);
        for (List<ContextualRule> group : groups.values()) {
            Map<String, Integer> counts = itemCounts(group);
            for (ContextualRule rule : group) {
                scores.put(rule, group.size() <= 1 ? 1.0 : diversity(rule, counts, group.size()));
            }
        }
        return scores;
    }

    private static double diversity(ContextualRule rule, Map<String, Integer> counts, int total) {
        Set<String> items = rule.items();
        double frequencySum = 0.0;
        for (String item : items) {
            // the rule itself is not a competitor
            int others = counts.getOrDefault(item, 0) - 1;
            frequencySum += Math.max(0, others) / (double) total;
        }
        double diversity = 1.0 - frequencySum / items.size();
        return Math.max(0.0, Math.min(1.0, diversity));
    }

    private static Map<String, Integer> itemCounts(List<ContextualRule> rules) {
        Map<String, Integer> counts = new HashMap<>();
        for (ContextualRule rule : rules) {
            for (String item : rule.items()) {
                counts.merge(item, 1, Integer::sum);
            }
        }
        return counts;
    }

    private static List<ContextualRule> sameContext(Context context, List<ContextualRule> rules) {
        List<ContextualRule> same = new ArrayList<>();
        for (ContextualRule candidate : rules) {
            if (Objects.equals(context, candidate.getContext())) {
                same.add(candidate);
            }
        }
        return same;
    }

    private static Map<Context, List<ContextualRule>> group(List<ContextualRule> rules) {
        Map<Context, List<ContextualRule>> groups = new LinkedHashMap<>();
        for (ContextualRule rule : rules) {
            groups.computeIfAbsent(rule.getContext(), k -> new ArrayList<>()).add(rule);
        }
        return groups;
    }

    /**
     * Diversity summary per context, computed over whatever contexts the rules carry.
     */
    public Map<Context, DiversityStats> contextStats(List<ContextualRule> rules) {
        Map<Context, DiversityStats> stats = new LinkedHashMap<>();
        Map<ContextualRule, Double> scores = scoreAll(rules);
        for (Map.Entry<Context, List<ContextualRule>> entry : group(rules).entrySet()) {
            double sum = 0.0;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (ContextualRule rule : entry.getValue()) {
                double score = scores.get(rule);
                sum += score;
                min = Math.min(min, score);
                max = Math.max(max, score);
            }
            int count = entry.getValue().size();
            stats.put(entry.getKey(), new DiversityStats(sum / count, min, max, count));
        }
        return stats;
    }

    public static class DiversityStats implements Serializable {

        private static final long serialVersionUID = 1L;

        public final double avgDiversity;
        public final double minDiversity;
        public final double maxDiversity;
        public final int rulesCount;

        public DiversityStats(double avgDiversity, double minDiversity, double maxDiversity, int rulesCount) {
            this.avgDiversity = avgDiversity;
            this.minDiversity = minDiversity;
            this.maxDiversity = maxDiversity;
            this.rulesCount = rulesCount;
        }

        @Override
        public String toString() {
            return String.format("DiversityStats{avg=%.3f, min=%.3f, max=%.3f, rules=%d}",
                avgDiversity, minDiversity, maxDiversity, rulesCount);
        }
    }
}
