package com.ververica.bundle_lift.flink.mining.fpm;

import java.util.List;
import java.util.Set;

/**
 * Finds all itemsets whose support reaches minSupport.
 * An empty basket list yields an empty result.
 */
public interface FrequentPatternMiner {

    FrequentItemsets mine(List<Set<String>> baskets, double minSupport);

    String name();
}
