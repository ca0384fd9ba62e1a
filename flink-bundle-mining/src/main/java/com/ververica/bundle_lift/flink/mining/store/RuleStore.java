package com.ververica.bundle_lift.flink.mining.store;

import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.UpliftResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mined rules and their uplift results, as read by the API layer.
 *
 * Rules are replaced per context as a whole, never edited in place. An
 * uplift result is never dropped: when its rule disappears it moves to
 * {@link #orphanedUplifts()}.
 *
 * Implementations throw {@link RuleStoreException} on persistence failures.
 */
public interface RuleStore {

    /**
     * Replaces the rules of one context. Rules with the same rule id are merged.
     */
    void replaceContext(Context context, List<ContextualRule> rules);

    /**
     * Replaces the whole rule set with the output of one run. Contexts absent
     * from the run are removed.
     */
    void replaceAll(Map<Context, List<ContextualRule>> rulesByContext);

    List<Context> contexts();

    List<ContextualRule> allRules();

    /**
     * Matching rules, overall score descending.
     */
    List<ContextualRule> query(RuleQuery query);

    Optional<ContextualRule> findRule(String ruleId);

    void putUplift(UpliftResult result);

    /**
     * Drops the uplift entry of a rule only while it is an {@code ESTIMATING}
     * placeholder, returning the rule to not estimated.
     *
     * @return true if a placeholder was removed
     */
    boolean cancelEstimation(String ruleId);

    Optional<UpliftResult> uplift(String ruleId);

    Map<String, UpliftResult> uplifts();

    Map<String, UpliftResult> orphanedUplifts();

    void clear();
}
