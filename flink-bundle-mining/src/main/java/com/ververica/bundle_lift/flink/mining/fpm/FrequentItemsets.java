package com.ververica.bundle_lift.flink.mining.fpm;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Frequent itemsets of one basket list with their absolute counts.
 * Keys are sorted item lists.
 */
public class FrequentItemsets implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Size first, then lexicographic on the sorted items. */
    public static final Comparator<List<String>> ITEMSET_ORDER = (a, b) -> {
        if (a.size() != b.size()) {
            return Integer.compare(a.size(), b.size());
        }
        for (int i = 0; i < a.size(); i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    };

    private final Map<List<String>, Integer> counts = new HashMap<>();
    private final int basketCount;

    public FrequentItemsets(int basketCount) {
        this.basketCount = basketCount;
    }

    public static FrequentItemsets empty() {
        return new FrequentItemsets(0);
    }

    void add(Collection<String> itemset, int count) {
        counts.put(key(itemset), count);
    }

    public static List<String> key(Collection<String> itemset) {
        return new ArrayList<>(new TreeSet<>(itemset));
    }

    public int getBasketCount() {
        return basketCount;
    }

    /**
     * Absolute count, or 0 if the itemset is not frequent.
     */
    public int count(Collection<String> itemset) {
        Integer count = counts.get(key(itemset));
        return count == null ? 0 : count;
    }

    public double support(Collection<String> itemset) {
        return basketCount == 0 ? 0.0 : (double) count(itemset) / basketCount;
    }

    public boolean contains(Collection<String> itemset) {
        return counts.containsKey(key(itemset));
    }

    /**
     * All frequent itemsets in {@link #ITEMSET_ORDER}.
     */
    public List<List<String>> itemsets() {
        List<List<String>> sorted = new ArrayList<>(counts.keySet());
        sorted.sort(ITEMSET_ORDER);
        return sorted;
    }

    public Map<List<String>, Integer> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * Smallest absolute count that reaches the support fraction.
     */
    static int minCount(double minSupport, int basketCount) {
        return Math.max(1, (int) Math.ceil(minSupport * basketCount - 1e-9));
    }

    @Override
    public String toString() {
        return String.format("FrequentItemsets{baskets=%d, itemsets=%d}", basketCount, counts.size());
    }
}
