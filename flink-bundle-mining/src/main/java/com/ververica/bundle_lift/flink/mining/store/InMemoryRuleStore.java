package com.ververica.bundle_lift.flink.mining.store;

import com.ververica.bundle_lift.flink.mining.score.MultiObjectiveScorer;
import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.UpliftResult;
import com.ververica.bundle_lift.flink.mining.shared.model.UpliftStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rule store held in memory.
 *
 * Every replace swaps in a fresh list for the context; readers get copies.
 * All access is serialized on the store instance.
 */
public class InMemoryRuleStore implements RuleStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryRuleStore.class);

    private final Map<Context, List<ContextualRule>> rulesByContext = new LinkedHashMap<>();
    private final Map<String, ContextualRule> rulesById = new LinkedHashMap<>();
    private final Map<String, UpliftResult> uplifts = new LinkedHashMap<>();
    private final Map<String, UpliftResult> orphaned = new LinkedHashMap<>();

    @Override
    public synchronized void replaceContext(Context context, List<ContextualRule> rules) {
        Objects.requireNonNull(context, "context");
        List<ContextualRule> previous = rulesByContext.get(context);
        if (previous != null) {
            for (ContextualRule rule : previous) {
                rulesById.remove(rule.getRuleId());
            }
        }

        Map<String, ContextualRule> merged = new LinkedHashMap<>();
        for (ContextualRule rule : rules) {
            if (!context.equals(rule.getContext())) {
                throw new IllegalArgumentException(
                    "Rule " + rule.getRuleId() + " does not belong to context " + context.key());
            }
            merged.put(rule.getRuleId(), rule);
        }
        rulesByContext.put(context, Collections.unmodifiableList(new ArrayList<>(merged.values())));
        rulesById.putAll(merged);

        archiveOrphans();
        LOG.debug("Replaced context [{}] with {} rules", context.key(), merged.size());
    }

    @Override
    public synchronized void replaceAll(Map<Context, List<ContextualRule>> rulesByContext) {
        Set<Context> vanished = new HashSet<>(this.rulesByContext.keySet());
        vanished.removeAll(rulesByContext.keySet());
        for (Context context : vanished) {
            for (ContextualRule rule : this.rulesByContext.remove(context)) {
                rulesById.remove(rule.getRuleId());
            }
            LOG.info("Removed context [{}], not produced by this run", context.key());
        }
        for (Map.Entry<Context, List<ContextualRule>> entry : rulesByContext.entrySet()) {
            replaceContext(entry.getKey(), entry.getValue());
        }
        archiveOrphans();
    }

    /**
     * Moves uplift results whose rule is gone to the orphaned archive.
     */
    private void archiveOrphans() {
        List<String> gone = new ArrayList<>();
        for (String ruleId : uplifts.keySet()) {
            if (!rulesById.containsKey(ruleId)) {
                gone.add(ruleId);
            }
        }
        for (String ruleId : gone) {
            orphaned.put(ruleId, uplifts.remove(ruleId));
            LOG.info("Archived uplift result of vanished rule {}", ruleId);
        }
    }

    @Override
    public synchronized List<Context> contexts() {
        return new ArrayList<>(rulesByContext.keySet());
    }

    @Override
    public synchronized List<ContextualRule> allRules() {
        List<ContextualRule> all = new ArrayList<>();
        for (List<ContextualRule> rules : rulesByContext.values()) {
            all.addAll(rules);
        }
        return all;
    }

    @Override
    public synchronized List<ContextualRule> query(RuleQuery query) {
        List<ContextualRule> matching = new ArrayList<>();
        for (List<ContextualRule> rules : rulesByContext.values()) {
            for (ContextualRule rule : rules) {
                if (query.matches(rule)) {
                    matching.add(rule);
                }
            }
        }
        matching.sort(MultiObjectiveScorer.RANKING);
        if (query.getLimit() > 0 && matching.size() > query.getLimit()) {
            return new ArrayList<>(matching.subList(0, query.getLimit()));
        }
        return matching;
    }

    @Override
    public synchronized Optional<ContextualRule> findRule(String ruleId) {
        return Optional.ofNullable(rulesById.get(ruleId));
    }

    @Override
    public synchronized void putUplift(UpliftResult result) {
        Objects.requireNonNull(result.getRuleId(), "ruleId");
        if (!rulesById.containsKey(result.getRuleId())) {
            throw new IllegalArgumentException("Unknown rule " + result.getRuleId());
        }
        uplifts.put(result.getRuleId(), result);
    }

    @Override
    public synchronized boolean cancelEstimation(String ruleId) {
        UpliftResult current = uplifts.get(ruleId);
        if (current == null || current.getStatus() != UpliftStatus.ESTIMATING) {
            return false;
        }
        uplifts.remove(ruleId);
        return true;
    }

    @Override
    public synchronized Optional<UpliftResult> uplift(String ruleId) {
        return Optional.ofNullable(uplifts.get(ruleId));
    }

    @Override
    public synchronized Map<String, UpliftResult> uplifts() {
        return new LinkedHashMap<>(uplifts);
    }

    @Override
    public synchronized Map<String, UpliftResult> orphanedUplifts() {
        return new LinkedHashMap<>(orphaned);
    }

    @Override
    public synchronized void clear() {
        rulesByContext.clear();
        rulesById.clear();
        uplifts.clear();
        orphaned.clear();
    }

    synchronized StoreSnapshot snapshot() {
        StoreSnapshot snapshot = new StoreSnapshot();
        snapshot.savedAt = System.currentTimeMillis();
        for (Map.Entry<Context, List<ContextualRule>> entry : rulesByContext.entrySet()) {
            snapshot.contexts.add(new StoreSnapshot.ContextEntry(entry.getKey(), entry.getValue()));
        }
        snapshot.uplifts.putAll(uplifts);
        snapshot.orphanedUplifts.putAll(orphaned);
        return snapshot;
    }

    synchronized void restore(StoreSnapshot snapshot) {
        clear();
        for (StoreSnapshot.ContextEntry entry : snapshot.contexts) {
            replaceContext(entry.context, entry.rules);
        }
        orphaned.putAll(snapshot.orphanedUplifts);
        for (UpliftResult result : snapshot.uplifts.values()) {
            if (rulesById.containsKey(result.getRuleId())) {
                uplifts.put(result.getRuleId(), result);
            } else {
                orphaned.put(result.getRuleId(), result);
            }
        }
    }
}
