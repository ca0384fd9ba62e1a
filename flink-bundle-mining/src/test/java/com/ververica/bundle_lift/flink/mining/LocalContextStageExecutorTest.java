package com.ververica.bundle_lift.flink.mining;

import com.ververica.bundle_lift.flink.mining.shared.exception.MiningRunException;
import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextBucket;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextRuleSet;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.ververica.bundle_lift.flink.mining.TestData.tx;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LocalContextStageExecutorTest {

    private static List<Transaction> breakfast() {
        List<Transaction> transactions = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            transactions.add(i % 2 == 0 ? tx("T" + i, "bread", "butter") : tx("T" + i, "bread", "milk"));
        }
        return transactions;
    }

    @Test
    public void resultsFollowBucketOrderTest() {
        Context s1 = Context.overall().withStoreId("S1");
        Context s2 = Context.overall().withStoreId("S2");
        List<ContextBucket> buckets = Arrays.asList(
            new ContextBucket(Context.overall(), breakfast()),
            new ContextBucket(s1, breakfast()),
            new ContextBucket(s2, breakfast()));

        List<ContextRuleSet> results = new LocalContextStageExecutor(new StageFixtures.FlakyStage(0), 3, 0)
            .execute(buckets);

        assertEquals(3, results.size());
        assertEquals(Context.overall(), results.get(0).context);
        assertEquals(s1, results.get(1).context);
        assertEquals(s2, results.get(2).context);
        assertFalse(results.get(1).rules.isEmpty());
        assertEquals(s1, results.get(1).rules.get(0).getContext());
    }

    @Test
    public void transientFailureRetriedTest() {
        StageFixtures.FlakyStage stage = new StageFixtures.FlakyStage(1);
        List<ContextRuleSet> results = new LocalContextStageExecutor(stage, 1, 1)
            .execute(Arrays.asList(new ContextBucket(Context.overall(), breakfast())));

        assertEquals(1, results.size());
        assertEquals(2, stage.getCalls());
        assertFalse(results.get(0).rules.isEmpty());
    }

    @Test
    public void persistentFailureAbortsTest() {
        StageFixtures.FlakyStage stage = new StageFixtures.FlakyStage(Integer.MAX_VALUE);
        LocalContextStageExecutor executor = new LocalContextStageExecutor(stage, 1, 2);

        MiningRunException e = assertThrows(MiningRunException.class,
            () -> executor.execute(Arrays.asList(new ContextBucket(Context.overall(), breakfast()))));

        assertEquals(3, stage.getCalls());
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    public void noBucketsTest() {
        assertTrue(new LocalContextStageExecutor(new StageFixtures.FlakyStage(0), 2, 0)
            .execute(new ArrayList<>()).isEmpty());
    }
}
