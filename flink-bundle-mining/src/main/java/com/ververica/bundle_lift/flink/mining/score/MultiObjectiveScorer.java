package com.ververica.bundle_lift.flink.mining.score;

import com.ververica.bundle_lift.flink.mining.shared.config.ScoringWeights;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextRuleSet;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Combines lift, profit, diversity and confidence into one ranking score.
 *
 * FORMULA:
 * <pre>
 * overall = w_lift × norm(lift) + w_profit × norm(profit)
 *         + w_diversity × diversity + w_confidence × confidence
 *
 * norm(x) = (x - min) / (max - min)     min/max taken within the context
 * </pre>
 *
 * Normalization never crosses contexts: a context whose rules have low
 * absolute lift still spreads over [0,1]. When every rule of a context
 * shares one lift (or profit) value the range is replaced by {@link #EPSILON}
 * and the normalized term is 0 for all of them.
 *
 * The global ranking compares scores that were each computed relative to
 * their own context. A context with a wide spread can therefore fill the
 * top of the global list; this is kept as is.
 */
public class MultiObjectiveScorer implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(MultiObjectiveScorer.class);

    public static final double EPSILON = 1e-9;

    /** overall score descending, rule id ascending on ties */
    public static final Comparator<ContextualRule> RANKING =
        Comparator.comparing((ContextualRule r) -> r.getOverallScore() == null ? Double.NEGATIVE_INFINITY : r.getOverallScore())
            .reversed()
            .thenComparing(ContextualRule::getRuleId);

    private final ScoringWeights weights;
    private final ProfitCalculator profitCalculator;
    private final DiversityScorer diversityScorer;

    public MultiObjectiveScorer(ScoringWeights weights, ProfitCalculator profitCalculator,
                                DiversityScorer diversityScorer) {
        this.weights = weights;
        this.profitCalculator = profitCalculator;
        this.diversityScorer = diversityScorer;
    }

    /**
     * Fills profit, diversity and overall scores of one context's rules and
     * returns them ranked.
     *
     * @param rules        rules that all belong to one context
     * @param transactions the context's transactions, source of prices and margins
     */
    public List<ContextualRule> scoreContext(List<ContextualRule> rules, Collection<Transaction> transactions) {
        if (rules.isEmpty()) {
            return new ArrayList<>();
        }

        for (ContextualRule rule : rules) {
            rule.setProfitScore(profitCalculator.profit(rule, transactions));
        }
        Map<ContextualRule, Double> diversity = diversityScorer.scoreAll(rules);
        for (ContextualRule rule : rules) {
            rule.setDiversityScore(diversity.get(rule));
        }

        applyWeights(rules);

        List<ContextualRule> ranked = new ArrayList<>(rules);
        ranked.sort(RANKING);
        LOG.debug("Scored {} rules in context [{}]", ranked.size(), ranked.get(0).getContext().key());
        return ranked;
    }

    /**
     * Computes overall scores from already populated profit and diversity scores.
     */
    void applyWeights(List<ContextualRule> rules) {
        double liftMin = Double.POSITIVE_INFINITY;
        double liftMax = Double.NEGATIVE_INFINITY;
        double profitMin = Double.POSITIVE_INFINITY;
        double profitMax = Double.NEGATIVE_INFINITY;
        for (ContextualRule rule : rules) {
            liftMin = Math.min(liftMin, rule.getLift());
            liftMax = Math.max(liftMax, rule.getLift());
            profitMin = Math.min(profitMin, rule.getProfitScore());
            profitMax = Math.max(profitMax, rule.getProfitScore());
        }
        double liftRange = range(liftMin, liftMax);
        double profitRange = range(profitMin, profitMax);

        for (ContextualRule rule : rules) {
            double normLift = (rule.getLift() - liftMin) / liftRange;
            double normProfit = (rule.getProfitScore() - profitMin) / profitRange;
            double overall = weights.getLift() * normLift
                + weights.getProfit() * normProfit
                + weights.getDiversity() * rule.getDiversityScore()
                + weights.getConfidence() * rule.getConfidence();
            rule.setOverallScore(overall);
        }
    }

    private static double range(double min, double max) {
        double range = max - min;
        return range > 0.0 ? range : EPSILON;
    }

    /**
     * Merges per-context results into one list ordered by {@link #RANKING}.
     */
    public static List<ContextualRule> rankGlobally(Collection<ContextRuleSet> ruleSets) {
        List<ContextualRule> all = new ArrayList<>();
        for (ContextRuleSet ruleSet : ruleSets) {
            all.addAll(ruleSet.rules);
        }
        all.sort(RANKING);
        return all;
    }

    public ScoringWeights getWeights() {
        return weights;
    }
}
