package com.ververica.bundle_lift.flink.mining.segment;

import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.SegmentStats;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one segmentation pass: the emitted buckets in emission order,
 * plus the identities of the combinations that backed off.
 */
public class SegmentationResult {

    private final LinkedHashMap<Context, List<Transaction>> buckets;
    private final List<Context> skipped;

    public SegmentationResult(LinkedHashMap<Context, List<Transaction>> buckets, List<Context> skipped) {
        this.buckets = buckets;
        this.skipped = skipped;
    }

    /**
     * Emitted contexts and their transactions, iteration order = emission order.
     */
    public Map<Context, List<Transaction>> getBuckets() {
        return Collections.unmodifiableMap(buckets);
    }

    public List<Context> getContexts() {
        return new ArrayList<>(buckets.keySet());
    }

    public List<Context> getSkipped() {
        return Collections.unmodifiableList(skipped);
    }

    public List<SegmentStats> stats() {
        List<SegmentStats> stats = new ArrayList<>();
        for (Map.Entry<Context, List<Transaction>> entry : buckets.entrySet()) {
            stats.add(ContextSegmenter.statsFor(entry.getKey(), entry.getValue()));
        }
        return stats;
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }
}
