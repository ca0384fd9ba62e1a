package com.ververica.bundle_lift.flink.mining.fpm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs a second miner on the same baskets and compares supports.
 * Divergences are logged as defect signals and returned for tests; they are
 * never propagated into mining results.
 */
public class MinerCrossCheck {

    private static final Logger LOG = LoggerFactory.getLogger(MinerCrossCheck.class);

    private final FrequentPatternMiner validationMiner;
    private final double tolerance;

    public MinerCrossCheck(FrequentPatternMiner validationMiner, double tolerance) {
        this.validationMiner = validationMiner;
        this.tolerance = tolerance;
    }

    public List<String> check(String contextKey, List<Set<String>> baskets, double minSupport,
                              FrequentItemsets primary) {
        FrequentItemsets validation = validationMiner.mine(baskets, minSupport);
        List<String> divergences = compare(primary, validation, tolerance);
        for (String divergence : divergences) {
            LOG.warn("Miner divergence in context [{}] ({}): {}", contextKey, validationMiner.name(), divergence);
        }
        if (divergences.isEmpty()) {
            LOG.debug("Cross-check passed for context [{}]: {} itemsets", contextKey, primary.size());
        }
        return divergences;
    }

    static List<String> compare(FrequentItemsets primary, FrequentItemsets validation, double tolerance) {
        Set<List<String>> all = new TreeSet<>(FrequentItemsets.ITEMSET_ORDER);
        all.addAll(primary.asMap().keySet());
        all.addAll(validation.asMap().keySet());

        List<String> divergences = new ArrayList<>();
        for (List<String> itemset : all) {
            if (!primary.contains(itemset)) {
                divergences.add("missing from primary: " + itemset);
            } else if (!validation.contains(itemset)) {
                divergences.add("missing from validation: " + itemset);
            } else {
                double a = primary.support(itemset);
                double b = validation.support(itemset);
                if (Math.abs(a - b) > tolerance) {
                    divergences.add(String.format("%s support %.6f vs %.6f", itemset, a, b));
                }
            }
        }
        return divergences;
    }
}
