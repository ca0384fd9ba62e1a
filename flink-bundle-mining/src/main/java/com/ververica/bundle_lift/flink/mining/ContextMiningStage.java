package com.ververica.bundle_lift.flink.mining;

import com.ververica.bundle_lift.flink.mining.fpm.AssociationRuleGenerator;
import com.ververica.bundle_lift.flink.mining.fpm.EclatMiner;
import com.ververica.bundle_lift.flink.mining.fpm.FpGrowthMiner;
import com.ververica.bundle_lift.flink.mining.fpm.FrequentItemsets;
import com.ververica.bundle_lift.flink.mining.fpm.FrequentPatternMiner;
import com.ververica.bundle_lift.flink.mining.fpm.MinerCrossCheck;
import com.ververica.bundle_lift.flink.mining.score.DiversityScorer;
import com.ververica.bundle_lift.flink.mining.score.MarginResolver;
import com.ververica.bundle_lift.flink.mining.score.MultiObjectiveScorer;
import com.ververica.bundle_lift.flink.mining.score.ProfitCalculator;
import com.ververica.bundle_lift.flink.mining.shared.config.BundleMiningConfig;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextBucket;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextRuleSet;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Mines and scores one context bucket.
 *
 * <pre>
 * ContextBucket → baskets → FP-Growth → rules → profit + diversity → overall score → ContextRuleSet
 * </pre>
 *
 * Holds no state between buckets, so any number of buckets can be processed
 * concurrently by one instance.
 */
public class ContextMiningStage {

    private static final Logger LOG = LoggerFactory.getLogger(ContextMiningStage.class);

    private final double minSupport;
    private final FrequentPatternMiner miner;
    private final AssociationRuleGenerator ruleGenerator;
    private final MultiObjectiveScorer scorer;
    private final MinerCrossCheck crossCheck;   // null when validation is off

    public ContextMiningStage(double minSupport,
                              FrequentPatternMiner miner,
                              AssociationRuleGenerator ruleGenerator,
                              MultiObjectiveScorer scorer,
                              MinerCrossCheck crossCheck) {
        this.minSupport = minSupport;
        this.miner = miner;
        this.ruleGenerator = ruleGenerator;
        this.scorer = scorer;
        this.crossCheck = crossCheck;
    }

    public static ContextMiningStage fromConfig(BundleMiningConfig config) {
        MarginResolver margins = new MarginResolver(config.getDefaultMarginPct(), config.getCategoryMargins());
        MultiObjectiveScorer scorer = new MultiObjectiveScorer(
            config.getWeights(), new ProfitCalculator(margins), new DiversityScorer());
        MinerCrossCheck crossCheck = config.isValidationMinerEnabled()
            ? new MinerCrossCheck(new EclatMiner(), config.getValidationTolerance())
            : null;
        return new ContextMiningStage(
            config.getMinSupport(),
            new FpGrowthMiner(),
            new AssociationRuleGenerator(config.getMinConfidence(), config.getMinLift()),
            scorer,
            crossCheck);
    }

    public ContextRuleSet process(ContextBucket bucket) {
        List<Set<String>> baskets = baskets(bucket.transactions);

        FrequentItemsets itemsets = miner.mine(baskets, minSupport);
        if (crossCheck != null) {
            crossCheck.check(bucket.context.key(), baskets, minSupport, itemsets);
        }

        List<ContextualRule> rules = ruleGenerator.generate(itemsets, bucket.context);
        List<ContextualRule> scored = scorer.scoreContext(rules, bucket.transactions);

        LOG.debug("Context [{}]: {} baskets, {} itemsets, {} rules",
            bucket.context.key(), baskets.size(), itemsets.size(), scored.size());
        return new ContextRuleSet(bucket.context, scored, bucket.transactions.size());
    }

    /**
     * Distinct item ids per transaction; empty baskets are left out.
     */
    static List<Set<String>> baskets(List<Transaction> transactions) {
        List<Set<String>> baskets = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            Set<String> basket = tx.basket();
            if (!basket.isEmpty()) {
                baskets.add(basket);
            }
        }
        return baskets;
    }
}
