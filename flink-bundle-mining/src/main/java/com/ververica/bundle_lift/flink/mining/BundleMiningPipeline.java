package com.ververica.bundle_lift.flink.mining;

import com.ververica.bundle_lift.flink.mining.causal.CausalUpliftEstimator;
import com.ververica.bundle_lift.flink.mining.causal.UpliftService;
import com.ververica.bundle_lift.flink.mining.segment.ContextSegmenter;
import com.ververica.bundle_lift.flink.mining.segment.SegmentationResult;
import com.ververica.bundle_lift.flink.mining.score.MultiObjectiveScorer;
import com.ververica.bundle_lift.flink.mining.shared.config.BundleMiningConfig;
import com.ververica.bundle_lift.flink.mining.shared.exception.MiningRunException;
import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextBucket;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextRuleSet;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import com.ververica.bundle_lift.flink.mining.shared.model.TransactionRow;
import com.ververica.bundle_lift.flink.mining.shared.processor.ContextEnricher;
import com.ververica.bundle_lift.flink.mining.shared.processor.TransactionAssembler;
import com.ververica.bundle_lift.flink.mining.store.RuleStore;
import com.ververica.bundle_lift.flink.mining.store.RuleStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One batch run from transactions to stored, ranked rules.
 *
 * DATA FLOW:
 * <pre>
 * transactions → ContextEnricher → ContextSegmenter → buckets
 *                                                        │
 *                        ContextStageExecutor (per context, isolated, retried)
 *                                                        │
 *                     merge after all contexts ◀─────────┘
 *                              │
 *                     RuleStore.replaceAll → MiningRunResult
 * </pre>
 *
 * Causal uplift is a separate step, {@link #estimateUplift(MiningRunResult)},
 * run on demand for the top-K rules of a finished run.
 *
 * FAILURES:
 * - A context that keeps failing aborts the run with MiningRunException, before
 *   anything is stored
 * - A store failure propagates as RuleStoreException
 * - Too-small contexts are skipped and reported, never fatal
 */
public class BundleMiningPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(BundleMiningPipeline.class);

    private final BundleMiningConfig config;
    private final ContextStageExecutor executor;
    private final RuleStore store;
    private final ContextEnricher enricher;
    private final ContextSegmenter segmenter;

    public BundleMiningPipeline(BundleMiningConfig config, ContextStageExecutor executor,
                                RuleStore store, ContextEnricher enricher) {
        this.config = config;
        this.executor = executor;
        this.store = store;
        this.enricher = enricher;
        this.segmenter = new ContextSegmenter(config.getMinContextTransactions(), config.getMaxContextDepth());
    }

    /**
     * Pipeline running contexts on a local thread pool.
     */
    public static BundleMiningPipeline local(BundleMiningConfig config, RuleStore store) {
        return new BundleMiningPipeline(config,
            new LocalContextStageExecutor(ContextMiningStage.fromConfig(config),
                config.getParallelism(), config.getContextRetries()),
            store,
            ContextEnricher.withDefaultCalendar());
    }

    /**
     * Pipeline running contexts as a Flink job.
     */
    public static BundleMiningPipeline onFlink(BundleMiningConfig config, RuleStore store) {
        return new BundleMiningPipeline(config, new FlinkContextStageExecutor(config),
            store, ContextEnricher.withDefaultCalendar());
    }

    public MiningRunResult runRows(List<TransactionRow> rows) {
        return run(new TransactionAssembler().assemble(rows));
    }

    public MiningRunResult run(List<Transaction> transactions) {
        LOG.info("Starting mining run over {} transactions (seed={})", transactions.size(), config.getRunSeed());

        for (Transaction tx : transactions) {
            enricher.enrich(tx);
        }

        SegmentationResult segmentation = segmenter.segment(transactions);
        List<ContextBucket> buckets = new ArrayList<>();
        for (Map.Entry<Context, List<Transaction>> entry : segmentation.getBuckets().entrySet()) {
            buckets.add(new ContextBucket(entry.getKey(), entry.getValue()));
        }

        List<ContextRuleSet> ruleSets = executor.execute(buckets);
        if (ruleSets.size() != buckets.size()) {
            throw new MiningRunException(String.format(
                "Executor returned %d rule sets for %d contexts", ruleSets.size(), buckets.size()));
        }

        Map<Context, List<ContextualRule>> merged = new LinkedHashMap<>();
        for (ContextRuleSet ruleSet : ruleSets) {
            merged.put(ruleSet.context, ruleSet.rules);
        }

        try {
            store.replaceAll(merged);
        } catch (RuleStoreException e) {
            LOG.error("Failed to persist rules of this run: {}", e.getMessage());
            throw e;
        }

        List<ContextualRule> ranked = MultiObjectiveScorer.rankGlobally(ruleSets);
        MiningRunResult result = new MiningRunResult(
            config.getRunSeed(),
            transactions.size(),
            ruleSets,
            ranked,
            segmentation.stats(),
            segmentation.getSkipped(),
            segmentation.getBuckets());

        if (result.isEmpty()) {
            LOG.info("No rules/bundles found for this run");
        } else {
            LOG.info("Mining run finished: {}", result);
        }
        return result;
    }

    /**
     * Estimates and stores uplift for the top-K rules of a finished run.
     */
    public UpliftService.UpliftSummary estimateUplift(MiningRunResult result) {
        UpliftService service = new UpliftService(
            CausalUpliftEstimator.fromConfig(config), store, config.getUpliftTopK(), config.getParallelism());
        return service.estimateTopK(result.getRankedRules(), result.getBuckets(), result.getRunSeed());
    }

    public RuleStore getStore() {
        return store;
    }

    public BundleMiningConfig getConfig() {
        return config;
    }
}
