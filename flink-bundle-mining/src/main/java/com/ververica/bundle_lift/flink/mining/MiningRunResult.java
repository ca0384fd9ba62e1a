package com.ververica.bundle_lift.flink.mining;

import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextRuleSet;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.SegmentStats;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one mining run produced. Immutable once built.
 */
public class MiningRunResult {

    private final long runSeed;
    private final int transactionCount;
    private final List<ContextRuleSet> ruleSets;
    private final List<ContextualRule> rankedRules;
    private final List<SegmentStats> segmentStats;
    private final List<Context> skippedContexts;
    private final Map<Context, List<Transaction>> buckets;

    public MiningRunResult(long runSeed,
                           int transactionCount,
                           List<ContextRuleSet> ruleSets,
                           List<ContextualRule> rankedRules,
                           List<SegmentStats> segmentStats,
                           List<Context> skippedContexts,
                           Map<Context, List<Transaction>> buckets) {
        this.runSeed = runSeed;
        this.transactionCount = transactionCount;
        this.ruleSets = Collections.unmodifiableList(new ArrayList<>(ruleSets));
        this.rankedRules = Collections.unmodifiableList(new ArrayList<>(rankedRules));
        this.segmentStats = Collections.unmodifiableList(new ArrayList<>(segmentStats));
        this.skippedContexts = Collections.unmodifiableList(new ArrayList<>(skippedContexts));
        this.buckets = Collections.unmodifiableMap(new LinkedHashMap<>(buckets));
    }

    public long getRunSeed() {
        return runSeed;
    }

    public int getTransactionCount() {
        return transactionCount;
    }

    /** Per-context rule sets in segment emission order. */
    public List<ContextRuleSet> getRuleSets() {
        return ruleSets;
    }

    /** All rules, overall score descending. */
    public List<ContextualRule> getRankedRules() {
        return rankedRules;
    }

    public List<ContextualRule> topRules(int n) {
        return rankedRules.subList(0, Math.min(n, rankedRules.size()));
    }

    public List<SegmentStats> getSegmentStats() {
        return segmentStats;
    }

    public List<Context> getSkippedContexts() {
        return skippedContexts;
    }

    /** Transactions of each emitted context. */
    public Map<Context, List<Transaction>> getBuckets() {
        return buckets;
    }

    public List<Context> getContexts() {
        return new ArrayList<>(buckets.keySet());
    }

    public boolean isEmpty() {
        return rankedRules.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("MiningRunResult{transactions=%d, contexts=%d, skipped=%d, rules=%d}",
            transactionCount, buckets.size(), skippedContexts.size(), rankedRules.size());
    }
}
