package com.ververica.bundle_lift.flink.mining.fpm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * FP-Growth frequent itemset miner.
 *
 * ALGORITHM:
 * 1. Count single items, drop those below the minimum count
 * 2. Insert every basket into a prefix tree, items ordered by descending
 *    frequency (ties by item id) so common prefixes share nodes
 * 3. For each item, collect its conditional pattern base (the prefix paths
 *    ending at that item), build a conditional tree, and recurse
 *
 * No candidate generation and two passes over the baskets.
 */
public class FpGrowthMiner implements FrequentPatternMiner, Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(FpGrowthMiner.class);

    @Override
    public FrequentItemsets mine(List<Set<String>> baskets, double minSupport) {
        if (baskets.isEmpty()) {
            return FrequentItemsets.empty();
        }
        int minCount = FrequentItemsets.minCount(minSupport, baskets.size());
        FrequentItemsets result = new FrequentItemsets(baskets.size());

        List<WeightedPath> paths = new ArrayList<>(baskets.size());
        for (Set<String> basket : baskets) {
            if (!basket.isEmpty()) {
                paths.add(new WeightedPath(new ArrayList<>(basket), 1));
            }
        }

        FpTree tree = FpTree.build(paths, minCount);
        grow(tree, new LinkedList<>(), minCount, result);

        LOG.debug("FP-Growth found {} frequent itemsets in {} baskets (minCount={})",
            result.size(), baskets.size(), minCount);
        return result;
    }

    @Override
    public String name() {
        return "fp-growth";
    }

    private void grow(FpTree tree, LinkedList<String> suffix, int minCount, FrequentItemsets result) {
        // least frequent first
        List<String> items = new ArrayList<>(tree.order);
        Collections.reverse(items);

        for (String item : items) {
            suffix.addFirst(item);
            result.add(suffix, tree.itemCounts.get(item));

            List<WeightedPath> base = new ArrayList<>();
            for (FpNode node = tree.heads.get(item); node != null; node = node.next) {
                List<String> prefix = new ArrayList<>();
                for (FpNode p = node.parent; p != null && p.item != null; p = p.parent) {
                    prefix.add(p.item);
                }
                if (!prefix.isEmpty()) {
                    base.add(new WeightedPath(prefix, node.count));
                }
            }

            FpTree conditional = FpTree.build(base, minCount);
            if (!conditional.order.isEmpty()) {
                grow(conditional, suffix, minCount, result);
            }
            suffix.removeFirst();
        }
    }

    private static class WeightedPath {
        final List<String> items;
        final int count;

        WeightedPath(List<String> items, int count) {
            this.items = items;
            this.count = count;
        }
    }

    private static class FpNode {
        final String item;
        final FpNode parent;
        final Map<String, FpNode> children = new HashMap<>();
        int count;
        FpNode next;   // next node carrying the same item

        FpNode(String item, FpNode parent) {
            this.item = item;
            this.parent = parent;
        }
    }

    private static class FpTree {
        final FpNode root = new FpNode(null, null);
        final Map<String, Integer> itemCounts = new HashMap<>();
        final Map<String, FpNode> heads = new HashMap<>();
        final Map<String, FpNode> tails = new HashMap<>();
        List<String> order = new ArrayList<>();

        static FpTree build(List<WeightedPath> paths, int minCount) {
            FpTree tree = new FpTree();

            Map<String, Integer> counts = new HashMap<>();
            for (WeightedPath path : paths) {
                for (String item : path.items) {
                    counts.merge(item, path.count, Integer::sum);
                }
            }
            for (Map.Entry<String, Integer> entry : counts.entrySet()) {
                if (entry.getValue() >= minCount) {
                    tree.itemCounts.put(entry.getKey(), entry.getValue());
                }
            }

            List<String> order = new ArrayList<>(tree.itemCounts.keySet());
            order.sort(Comparator.<String>comparingInt(tree.itemCounts::get).reversed()
                .thenComparing(Comparator.naturalOrder()));
            tree.order = order;

            Map<String, Integer> rank = new HashMap<>();
            for (int i = 0; i < order.size(); i++) {
                rank.put(order.get(i), i);
            }

            for (WeightedPath path : paths) {
                List<String> kept = new ArrayList<>();
                for (String item : path.items) {
                    if (rank.containsKey(item)) {
                        kept.add(item);
                    }
                }
                kept.sort(Comparator.comparingInt(rank::get));
                tree.insert(kept, path.count);
            }
            return tree;
        }

        void insert(List<String> items, int count) {
            FpNode current = root;
            for (String item : items) {
                FpNode child = current.children.get(item);
                if (child == null) {
                    child = new FpNode(item, current);
                    current.children.put(item, child);
                    FpNode tail = tails.get(item);
                    if (tail == null) {
                        heads.put(item, child);
                    } else {
                        tail.next = child;
                    }
                    tails.put(item, child);
                }
                child.count += count;
                current = child;
            }
        }
    }
}
