package com.ververica.bundle_lift.flink.mining;

import com.ververica.bundle_lift.flink.mining.fpm.AssociationRuleGenerator;
import com.ververica.bundle_lift.flink.mining.fpm.FpGrowthMiner;
import com.ververica.bundle_lift.flink.mining.score.DiversityScorer;
import com.ververica.bundle_lift.flink.mining.score.MarginResolver;
import com.ververica.bundle_lift.flink.mining.score.MultiObjectiveScorer;
import com.ververica.bundle_lift.flink.mining.score.ProfitCalculator;
import com.ververica.bundle_lift.flink.mining.shared.config.ScoringWeights;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextBucket;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextRuleSet;

import java.util.HashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mining stages with injected failures.
 */
final class StageFixtures {

    private StageFixtures() {}

    /**
     * Fails the first {@code failures} calls, then mines normally.
     */
    static class FlakyStage extends ContextMiningStage {

        private final AtomicInteger remainingFailures;
        private final AtomicInteger calls = new AtomicInteger();

        FlakyStage(int failures) {
            super(0.05,
                new FpGrowthMiner(),
                new AssociationRuleGenerator(0.3, 0.0),
                new MultiObjectiveScorer(ScoringWeights.DEFAULT,
                    new ProfitCalculator(new MarginResolver(0.25, new HashMap<>())),
                    new DiversityScorer()),
                null);
            this.remainingFailures = new AtomicInteger(failures);
        }

        @Override
        public ContextRuleSet process(ContextBucket bucket) {
            calls.incrementAndGet();
            if (remainingFailures.getAndDecrement() > 0) {
                throw new IllegalStateException("worker lost while mining " + bucket.context.key());
            }
            return super.process(bucket);
        }

        int getCalls() {
            return calls.get();
        }
    }
}
