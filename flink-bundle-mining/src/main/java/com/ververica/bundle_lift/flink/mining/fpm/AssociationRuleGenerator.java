package com.ververica.bundle_lift.flink.mining.fpm;

import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives association rules from frequent itemsets.
 *
 * Every itemset with two or more items is split into all non-empty
 * antecedent/consequent partitions:
 * <pre>
 * support(X→Y)    = count(X ∪ Y) / baskets
 * confidence(X→Y) = count(X ∪ Y) / count(X)
 * lift(X→Y)       = confidence(X→Y) / support(Y)
 * </pre>
 * A partition is kept when confidence ≥ minConfidence and lift ≥ minLift.
 * Output order follows the itemset order, then the partition bitmask, and
 * a rule is emitted at most once per (antecedent, consequent, context).
 */
public class AssociationRuleGenerator implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(AssociationRuleGenerator.class);

    private final double minConfidence;
    private final double minLift;

    public AssociationRuleGenerator(double minConfidence, double minLift) {
        this.minConfidence = minConfidence;
        this.minLift = minLift;
    }

    public List<ContextualRule> generate(FrequentItemsets itemsets, Context context) {
        Map<String, ContextualRule> rules = new LinkedHashMap<>();
        int baskets = itemsets.getBasketCount();
        if (baskets == 0) {
            return new ArrayList<>();
        }

        for (List<String> itemset : itemsets.itemsets()) {
            int n = itemset.size();
            if (n < 2) {
                continue;
            }
            int unionCount = itemsets.count(itemset);

            // masks 1 .. 2^n - 2: every non-empty proper subset as antecedent
            for (int mask = 1; mask < (1 << n) - 1; mask++) {
                List<String> antecedent = new ArrayList<>();
                List<String> consequent = new ArrayList<>();
                for (int i = 0; i < n; i++) {
                    if ((mask & (1 << i)) != 0) {
                        antecedent.add(itemset.get(i));
                    } else {
                        consequent.add(itemset.get(i));
                    }
                }

                int antecedentCount = itemsets.count(antecedent);
                if (antecedentCount == 0) {
                    LOG.debug("Antecedent {} has no count, skipping", antecedent);
                    continue;
                }
                double confidence = Math.min(1.0, (double) unionCount / antecedentCount);
                if (confidence < minConfidence) {
                    continue;
                }

                double consequentSupport = itemsets.support(consequent);
                double lift = consequentSupport > 0.0 ? confidence / consequentSupport : 0.0;
                if (lift < minLift) {
                    continue;
                }

                double support = (double) unionCount / baskets;
                ContextualRule rule = new ContextualRule(antecedent, consequent, support, confidence, lift, context);
                rules.putIfAbsent(rule.getRuleId(), rule);
            }
        }

        LOG.debug("Generated {} rules for context [{}] from {} itemsets",
            rules.size(), context.key(), itemsets.size());
        return new ArrayList<>(rules.values());
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public double getMinLift() {
        return minLift;
    }
}
