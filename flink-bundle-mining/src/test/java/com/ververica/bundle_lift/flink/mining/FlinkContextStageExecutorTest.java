package com.ververica.bundle_lift.flink.mining;

import com.ververica.bundle_lift.flink.mining.segment.ContextSegmenter;
import com.ververica.bundle_lift.flink.mining.segment.SegmentationResult;
import com.ververica.bundle_lift.flink.mining.shared.config.BundleMiningConfig;
import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextBucket;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextRuleSet;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import com.ververica.bundle_lift.flink.mining.shared.processor.ContextEnricher;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class FlinkContextStageExecutorTest {

    @Test
    public void flinkMatchesLocalExecutionTest() {
        BundleMiningConfig config = BundleMiningConfig.builder()
            .withMinSupport(0.05)
            .withMinContextTransactions(150)
            .withMaxContextDepth(1)
            .withParallelism(2)
            .withJobName("Bundle Mining Test")
            .build();

        ContextEnricher enricher = ContextEnricher.withDefaultCalendar();
        List<Transaction> transactions = new SyntheticTransactionGenerator(11L).generate(800);
        for (Transaction tx : transactions) {
            enricher.enrich(tx);
        }
        SegmentationResult segmentation = new ContextSegmenter(150, 1).segment(transactions);
        List<ContextBucket> buckets = new ArrayList<>();
        for (Map.Entry<Context, List<Transaction>> entry : segmentation.getBuckets().entrySet()) {
            buckets.add(new ContextBucket(entry.getKey(), entry.getValue()));
        }

        List<ContextRuleSet> onFlink = new FlinkContextStageExecutor(config).execute(buckets);
        List<ContextRuleSet> local = new LocalContextStageExecutor(
            ContextMiningStage.fromConfig(config), 2, 0).execute(buckets);

        assertEquals(local.size(), onFlink.size());
        for (int i = 0; i < local.size(); i++) {
            assertEquals(local.get(i).context, onFlink.get(i).context);
            assertEquals(local.get(i).transactionCount, onFlink.get(i).transactionCount);
            List<ContextualRule> expected = local.get(i).rules;
            List<ContextualRule> actual = onFlink.get(i).rules;
            assertEquals(expected, actual);
            for (int r = 0; r < expected.size(); r++) {
                assertEquals(expected.get(r).getOverallScore(), actual.get(r).getOverallScore(), 1e-12);
            }
        }
    }
}
