package com.ververica.bundle_lift.flink.mining;

import com.ververica.bundle_lift.flink.mining.causal.UpliftService;
import com.ververica.bundle_lift.flink.mining.shared.config.BundleMiningConfig;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.SegmentStats;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import com.ververica.bundle_lift.flink.mining.shared.model.TransactionRow;
import com.ververica.bundle_lift.flink.mining.shared.processor.TransactionAssembler;
import com.ververica.bundle_lift.flink.mining.source.TransactionFileReader;
import com.ververica.bundle_lift.flink.mining.store.JsonFileRuleStore;
import com.ververica.bundle_lift.flink.mining.store.RuleStore;
import org.apache.flink.api.java.utils.ParameterTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.List;

/**
 * BUNDLE MINING JOB - batch entry point
 *
 * Mines context-aware bundle rules, ranks them, estimates causal uplift for
 * the best ones and writes everything to the JSON rule store.
 *
 * ARCHITECTURE:
 * <pre>
 * JSONL rows / synthetic ──▶ TransactionAssembler ──▶ BundleMiningPipeline
 *                                                         │
 *                                  Flink: ContextMinerFunction per context
 *                                                         │
 *                                           JsonFileRuleStore (rules)
 *                                                         │
 *                                   UpliftService (top-K) ──▶ JsonFileRuleStore (uplift)
 * </pre>
 *
 * RUN THIS JOB:
 * <pre>
 * # synthetic data
 * java -cp flink-bundle-mining.jar com.ververica.bundle_lift.flink.mining.BundleMiningJob --synthetic 5000
 *
 * # exported transaction rows
 * java -cp ... BundleMiningJob --input /data/transactions.jsonl --store-path /tmp/bundle-lift/store.json
 *
 * # with a properties file, arguments win
 * java -cp ... BundleMiningJob --config mining.properties --min-support 0.02
 * </pre>
 */
public class BundleMiningJob {

    private static final Logger LOG = LoggerFactory.getLogger(BundleMiningJob.class);

    private static final int DEFAULT_SYNTHETIC_TRANSACTIONS = 5000;

    public static void main(String[] args) throws Exception {

        // ========================================
        // STEP 1: Configuration
        // ========================================

        ParameterTool params = BundleMiningConfig.mergedParameters(args);
        BundleMiningConfig config = BundleMiningConfig.fromParameters(params);

        LOG.info("🛒 Starting {}", config.getJobName());
        LOG.info("📊 {}", config);

        // ========================================
        // STEP 2: Load transactions
        // ========================================

        List<Transaction> transactions;
        if (params.has("input")) {
            List<TransactionRow> rows = new TransactionFileReader().readRows(Paths.get(params.get("input")));
            transactions = new TransactionAssembler().assemble(rows);
        } else {
            int count = params.getInt("synthetic", DEFAULT_SYNTHETIC_TRANSACTIONS);
            LOG.info("No --input given, generating {} synthetic transactions", count);
            transactions = new SyntheticTransactionGenerator(config.getRunSeed()).generate(count);
        }
        LOG.info("✓ Loaded {} transactions", transactions.size());

        // ========================================
        // STEP 3: Mine, score and store rules
        // ========================================

        RuleStore store = JsonFileRuleStore.open(Paths.get(config.getStorePath()));
        BundleMiningPipeline pipeline = BundleMiningPipeline.onFlink(config, store);
        MiningRunResult result = pipeline.run(transactions);

        for (SegmentStats stats : result.getSegmentStats()) {
            LOG.info("   {}", stats);
        }
        if (result.isEmpty()) {
            LOG.info("No rules/bundles found, nothing to estimate");
            return;
        }

        // ========================================
        // STEP 4: Causal uplift for the top-K
        // ========================================

        UpliftService.UpliftSummary summary = pipeline.estimateUplift(result);

        LOG.info("✅ Done: {} rules in {} contexts, {}",
            result.getRankedRules().size(), result.getContexts().size(), summary);
        for (ContextualRule rule : result.topRules(10)) {
            LOG.info("   {}", rule);
        }
        LOG.info("💾 Rule store written to {}", config.getStorePath());
    }
}
