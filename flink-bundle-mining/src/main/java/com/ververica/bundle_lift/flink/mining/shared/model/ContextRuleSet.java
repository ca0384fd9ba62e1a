package com.ververica.bundle_lift.flink.mining.shared.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Scored rules of one context, produced by a single run of the mining stage.
 * Replaces the previous rule set of the same context as a whole.
 */
public class ContextRuleSet implements Serializable {

    private static final long serialVersionUID = 1L;

    public Context context;
    public List<ContextualRule> rules = new ArrayList<>();
    public int transactionCount;

    public ContextRuleSet() {}

    public ContextRuleSet(Context context, List<ContextualRule> rules, int transactionCount) {
        this.context = context;
        this.rules = new ArrayList<>(rules);
        this.transactionCount = transactionCount;
    }

    @Override
    public String toString() {
        return String.format("ContextRuleSet{context=%s, rules=%d, transactions=%d}",
            context, rules.size(), transactionCount);
    }
}
