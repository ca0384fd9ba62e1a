package com.ververica.bundle_lift.flink.mining.causal;

import com.ververica.bundle_lift.flink.mining.ml.LogisticRegressionEstimator;
import com.ververica.bundle_lift.flink.mining.ml.OutcomeEstimator;
import com.ververica.bundle_lift.flink.mining.score.ItemEconomics;
import com.ververica.bundle_lift.flink.mining.score.MarginResolver;
import com.ververica.bundle_lift.flink.mining.shared.config.BundleMiningConfig;
import com.ververica.bundle_lift.flink.mining.shared.exception.InsufficientDataException;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import com.ververica.bundle_lift.flink.mining.shared.model.UpliftResult;
import com.ververica.bundle_lift.flink.mining.shared.model.UpliftStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Two-model (T-Learner) uplift estimate for one rule.
 *
 * PROCEDURE:
 * <pre>
 * antecedent baskets ──split──▶ control   ──fit──▶ estimator C
 *                          └──▶ treatment ──fit──▶ estimator T
 *
 * outcome(basket)          = 1 if it also holds the full consequent
 * incremental attach rate  = mean over antecedent baskets of T.p(x) - C.p(x)
 * control / treatment rate = empirical outcome mean of each group
 * incremental revenue      = attach rate × mean consequent price
 * incremental margin       = revenue × mean consequent margin
 * </pre>
 *
 * Each arm gets a fresh estimator from the supplier, so no parameters are
 * shared. If either group is below minGroupSize nothing is trained and the
 * result is INSUFFICIENT_DATA.
 *
 * A seeded bootstrap of the empirical rate difference gives a 95% interval.
 * The same rule, transactions and run seed always give identical numbers.
 */
public class CausalUpliftEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(CausalUpliftEstimator.class);

    private static final double CONFIDENCE_LEVEL = 0.95;
    private static final long BOOTSTRAP_SALT = 0x5DEECE66DL;

    private final Supplier<OutcomeEstimator> estimatorFactory;
    private final TreatmentSimulator simulator;
    private final MarginResolver margins;
    private final int minGroupSize;
    private final double minIncrementalAttachRate;
    private final int bootstrapIterations;

    public CausalUpliftEstimator(Supplier<OutcomeEstimator> estimatorFactory,
                                 MarginResolver margins,
                                 int minGroupSize,
                                 double minIncrementalAttachRate,
                                 int bootstrapIterations) {
        this.estimatorFactory = estimatorFactory;
        this.simulator = new TreatmentSimulator();
        this.margins = margins;
        this.minGroupSize = minGroupSize;
        this.minIncrementalAttachRate = minIncrementalAttachRate;
        this.bootstrapIterations = bootstrapIterations;
    }

    public static CausalUpliftEstimator fromConfig(BundleMiningConfig config) {
        return new CausalUpliftEstimator(
            LogisticRegressionEstimator::new,
            new MarginResolver(config.getDefaultMarginPct(), config.getCategoryMargins()),
            config.getMinUpliftGroupSize(),
            config.getMinIncrementalAttachRate(),
            config.getBootstrapIterations());
    }

    /**
     * Estimates uplift, recording an INSUFFICIENT_DATA result instead of
     * failing when the groups are too small.
     */
    public UpliftResult estimate(ContextualRule rule, Collection<Transaction> transactions, long runSeed) {
        TreatmentSplit split = simulator.split(rule, transactions, runSeed);
        try {
            return estimate(rule, split, transactions, runSeed);
        } catch (InsufficientDataException e) {
            LOG.warn("Uplift for rule {} not estimated: {}", rule.getRuleId(), e.getMessage());
            return UpliftResult.insufficientData(rule.getRuleId(), split.getControl().size(), split.getTreatment().size());
        }
    }

    UpliftResult estimate(ContextualRule rule, TreatmentSplit split,
                          Collection<Transaction> transactions, long runSeed) throws InsufficientDataException {
        if (split.smallerGroupSize() < minGroupSize) {
            throw new InsufficientDataException(rule.getRuleId(), split.smallerGroupSize(), minGroupSize);
        }

        BasketFeatureExtractor extractor = TransactionFeatureExtractor.forTransactions(transactions);
        List<String> consequent = rule.getConsequent();

        double[][] controlX = features(split.getControl(), extractor);
        int[] controlY = outcomes(split.getControl(), consequent);
        double[][] treatmentX = features(split.getTreatment(), extractor);
        int[] treatmentY = outcomes(split.getTreatment(), consequent);

        OutcomeEstimator controlModel = estimatorFactory.get();
        OutcomeEstimator treatmentModel = estimatorFactory.get();
        if (controlModel == treatmentModel) {
            throw new IllegalStateException("Estimator supplier must return a new instance per call");
        }
        controlModel.fit(controlX, controlY);
        treatmentModel.fit(treatmentX, treatmentY);

        double upliftSum = 0.0;
        for (Transaction tx : split.getEligible()) {
            double[] x = extractor.extract(tx);
            upliftSum += treatmentModel.predictProbability(x) - controlModel.predictProbability(x);
        }
        double attachRate = upliftSum / split.getEligible().size();

        double controlRate = mean(controlY);
        double treatmentRate = mean(treatmentY);

        ItemEconomics economics = ItemEconomics.of(consequent, transactions, margins);
        double revenue = attachRate * economics.getMeanPrice();
        double margin = revenue * (economics.isEmpty() ? margins.getDefaultMarginPct() : economics.getMeanMargin());

        double[] interval = bootstrapInterval(controlY, treatmentY,
            TreatmentSimulator.splitSeed(runSeed, rule.getRuleId()) ^ BOOTSTRAP_SALT);

        UpliftResult result = new UpliftResult();
        result.setRuleId(rule.getRuleId());
        result.setStatus(UpliftStatus.ESTIMATED);
        result.setIncrementalAttachRate(attachRate);
        result.setIncrementalRevenue(revenue);
        result.setIncrementalMargin(margin);
        result.setControlRate(controlRate);
        result.setTreatmentRate(treatmentRate);
        result.setControlSize(controlY.length);
        result.setTreatmentSize(treatmentY.length);
        result.setCiLower(interval[0]);
        result.setCiUpper(interval[1]);
        result.setActionable(attachRate >= minIncrementalAttachRate);

        if (!result.isActionable()) {
            LOG.debug("Rule {} uplift {} below actionable threshold {}",
                rule.getRuleId(), attachRate, minIncrementalAttachRate);
        }
        return result;
    }

    private static double[][] features(List<Transaction> group, BasketFeatureExtractor extractor) {
        double[][] x = new double[group.size()][];
        for (int i = 0; i < group.size(); i++) {
            x[i] = extractor.extract(group.get(i));
        }
        return x;
    }

    private static int[] outcomes(List<Transaction> group, List<String> consequent) {
        int[] y = new int[group.size()];
        for (int i = 0; i < group.size(); i++) {
            y[i] = group.get(i).containsAll(consequent) ? 1 : 0;
        }
        return y;
    }

    private static double mean(int[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        long sum = 0;
        for (int v : values) {
            sum += v;
        }
        return (double) sum / values.length;
    }

    /**
     * Percentile interval of treatment-minus-control rate over resampled groups.
     */
    double[] bootstrapInterval(int[] control, int[] treatment, long seed) {
        if (bootstrapIterations < 1) {
            double diff = mean(treatment) - mean(control);
            return new double[] {diff, diff};
        }
        Random random = new Random(seed);
        double[] diffs = new double[bootstrapIterations];
        for (int b = 0; b < bootstrapIterations; b++) {
            diffs[b] = resampledMean(treatment, random) - resampledMean(control, random);
        }
        Arrays.sort(diffs);
        double alpha = 1.0 - CONFIDENCE_LEVEL;
        return new double[] {percentile(diffs, alpha / 2), percentile(diffs, 1 - alpha / 2)};
    }

    private static double resampledMean(int[] values, Random random) {
        long sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[random.nextInt(values.length)];
        }
        return (double) sum / values.length;
    }

    /**
     * Linear interpolation between closest ranks, q in [0,1], input sorted.
     */
    static double percentile(double[] sorted, double q) {
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
