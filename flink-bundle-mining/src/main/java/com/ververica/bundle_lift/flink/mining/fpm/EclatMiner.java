package com.ververica.bundle_lift.flink.mining.fpm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Eclat miner over vertical tid-lists.
 *
 * Each item maps to the BitSet of basket positions containing it; an
 * itemset's count is the cardinality of the intersection of its items'
 * tid-lists. Depth-first over equivalence classes sharing a prefix.
 *
 * Used as the validation miner for FP-Growth.
 */
public class EclatMiner implements FrequentPatternMiner, Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(EclatMiner.class);

    @Override
    public FrequentItemsets mine(List<Set<String>> baskets, double minSupport) {
        if (baskets.isEmpty()) {
            return FrequentItemsets.empty();
        }
        int minCount = FrequentItemsets.minCount(minSupport, baskets.size());
        FrequentItemsets result = new FrequentItemsets(baskets.size());

        Map<String, BitSet> tidLists = new TreeMap<>();
        for (int tid = 0; tid < baskets.size(); tid++) {
            for (String item : baskets.get(tid)) {
                tidLists.computeIfAbsent(item, k -> new BitSet(baskets.size())).set(tid);
            }
        }

        List<Candidate> frequent = new ArrayList<>();
        for (Map.Entry<String, BitSet> entry : tidLists.entrySet()) {
            if (entry.getValue().cardinality() >= minCount) {
                List<String> items = new ArrayList<>();
                items.add(entry.getKey());
                frequent.add(new Candidate(items, entry.getValue()));
            }
        }

        extend(frequent, minCount, result);

        LOG.debug("Eclat found {} frequent itemsets in {} baskets (minCount={})",
            result.size(), baskets.size(), minCount);
        return result;
    }

    @Override
    public String name() {
        return "eclat";
    }

    private void extend(List<Candidate> prefixClass, int minCount, FrequentItemsets result) {
        for (int i = 0; i < prefixClass.size(); i++) {
            Candidate left = prefixClass.get(i);
            result.add(left.items, left.tids.cardinality());

            List<Candidate> next = new ArrayList<>();
            for (int j = i + 1; j < prefixClass.size(); j++) {
                Candidate right = prefixClass.get(j);
                BitSet tids = (BitSet) left.tids.clone();
                tids.and(right.tids);
                if (tids.cardinality() >= minCount) {
                    List<String> items = new ArrayList<>(left.items);
                    items.add(right.items.get(right.items.size() - 1));
                    next.add(new Candidate(items, tids));
                }
            }
            if (!next.isEmpty()) {
                extend(next, minCount, result);
            }
        }
    }

    private static class Candidate {
        final List<String> items;
        final BitSet tids;

        Candidate(List<String> items, BitSet tids) {
            this.items = items;
            this.tids = tids;
        }
    }
}
