package com.ververica.bundle_lift.flink.mining.causal;

import com.ververica.bundle_lift.flink.mining.shared.exception.MiningRunException;
import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import com.ververica.bundle_lift.flink.mining.shared.model.UpliftResult;
import com.ververica.bundle_lift.flink.mining.shared.model.UpliftStatus;
import com.ververica.bundle_lift.flink.mining.store.RuleStore;
import com.ververica.bundle_lift.flink.mining.store.RuleStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs causal estimation for the top-K ranked rules and stores every result.
 *
 * FLOW:
 * 1. Take the first topK rules of the global ranking
 * 2. Mark each ESTIMATING in the store
 * 3. Estimate in parallel, each rule against its own context's transactions
 * 4. Store the final result, insufficient and non-actionable ones included
 *
 * If any estimate fails, every other estimate is still awaited and stored.
 * Rules whose estimate failed get their previous result back, or return to
 * not estimated if they had none; no rule is left ESTIMATING. The first
 * failure is then rethrown.
 */
public class UpliftService {

    private static final Logger LOG = LoggerFactory.getLogger(UpliftService.class);

    private final CausalUpliftEstimator estimator;
    private final RuleStore store;
    private final int topK;
    private final int parallelism;

    public UpliftService(CausalUpliftEstimator estimator, RuleStore store, int topK, int parallelism) {
        this.estimator = estimator;
        this.store = store;
        this.topK = topK;
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * @param ranked  rules in global ranking order
     * @param buckets transactions per context of the run that produced the rules
     * @param runSeed seed of that run
     */
    public UpliftSummary estimateTopK(List<ContextualRule> ranked,
                                      Map<Context, List<Transaction>> buckets,
                                      long runSeed) {
        List<ContextualRule> selected = new ArrayList<>(ranked.subList(0, Math.min(topK, ranked.size())));
        if (selected.isEmpty()) {
            LOG.info("No rules to estimate uplift for");
            return new UpliftSummary(Collections.emptyList());
        }

        Map<String, UpliftResult> previous = new HashMap<>();
        for (ContextualRule rule : selected) {
            store.uplift(rule.getRuleId()).ifPresent(r -> previous.put(r.getRuleId(), r));
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, selected.size()));
        RuntimeException failure = null;
        List<UpliftResult> results = new ArrayList<>();
        try {
            for (ContextualRule rule : selected) {
                UpliftResult pending = new UpliftResult();
                pending.setRuleId(rule.getRuleId());
                pending.setStatus(UpliftStatus.ESTIMATING);
                store.putUplift(pending);
            }

            List<Future<UpliftResult>> futures = new ArrayList<>();
            for (ContextualRule rule : selected) {
                List<Transaction> transactions = buckets.getOrDefault(rule.getContext(), Collections.emptyList());
                futures.add(pool.submit(() -> estimator.estimate(rule, transactions, runSeed)));
            }

            for (int i = 0; i < futures.size(); i++) {
                try {
                    UpliftResult result = await(futures.get(i));
                    store.putUplift(result);
                    results.add(result);
                } catch (RuntimeException e) {
                    LOG.error("Uplift estimation failed for rule {}: {}", selected.get(i).getRuleId(), e.getMessage());
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
        } finally {
            pool.shutdownNow();
            settlePending(selected, previous);
        }

        if (failure != null) {
            throw failure;
        }
        UpliftSummary summary = new UpliftSummary(results);
        LOG.info("Uplift estimation finished: {}", summary);
        return summary;
    }

    /**
     * Puts back the earlier result of every rule still ESTIMATING, or clears
     * the placeholder when there was none.
     */
    private void settlePending(List<ContextualRule> selected, Map<String, UpliftResult> previous) {
        for (ContextualRule rule : selected) {
            String ruleId = rule.getRuleId();
            boolean pending = store.uplift(ruleId)
                .map(r -> r.getStatus() == UpliftStatus.ESTIMATING)
                .orElse(false);
            if (!pending) {
                continue;
            }
            UpliftResult earlier = previous.get(ruleId);
            if (earlier != null && earlier.getStatus() != UpliftStatus.ESTIMATING) {
                store.putUplift(earlier);
                LOG.warn("Restored previous uplift result of rule {}", ruleId);
            } else {
                store.cancelEstimation(ruleId);
                LOG.warn("Rule {} returned to not estimated", ruleId);
            }
        }
    }

    private static UpliftResult await(Future<UpliftResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MiningRunException("Interrupted while estimating uplift", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuleStoreException) {
                throw (RuleStoreException) cause;
            }
            throw new MiningRunException("Uplift estimation failed", cause);
        }
    }

    /**
     * Counts per outcome of one uplift batch.
     */
    public static class UpliftSummary {

        private final List<UpliftResult> results;

        public UpliftSummary(List<UpliftResult> results) {
            this.results = new ArrayList<>(results);
        }

        public List<UpliftResult> getResults() {
            return Collections.unmodifiableList(results);
        }

        public long getEstimated() {
            return results.stream().filter(r -> r.getStatus() == UpliftStatus.ESTIMATED).count();
        }

        public long getInsufficientData() {
            return results.stream().filter(r -> r.getStatus() == UpliftStatus.INSUFFICIENT_DATA).count();
        }

        public long getActionable() {
            return results.stream().filter(UpliftResult::isActionable).count();
        }

        @Override
        public String toString() {
            return String.format("UpliftSummary{rules=%d, estimated=%d, insufficient=%d, actionable=%d}",
                results.size(), getEstimated(), getInsufficientData(), getActionable());
        }
    }
}
