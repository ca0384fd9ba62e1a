package com.ververica.bundle_lift.flink.mining;

import com.ververica.bundle_lift.flink.mining.shared.config.BundleMiningConfig;
import com.ververica.bundle_lift.flink.mining.shared.exception.MiningRunException;
import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextBucket;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextRuleSet;
import com.ververica.bundle_lift.flink.mining.shared.processor.ContextMinerFunction;
import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.configuration.RestartStrategyOptions;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.CloseableIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the per-context stage as a bounded Flink job.
 *
 * ARCHITECTURE:
 * <pre>
 * fromCollection(buckets) ──▶ ContextMinerFunction (parallel) ──▶ executeAndCollect
 *                                                                      │
 *                                                 reorder by bucket ◀──┘
 * </pre>
 *
 * The job runs in BATCH mode with a fixed-delay restart strategy of
 * contextRetries attempts; a failing subtask recomputes its buckets from the
 * source. Results are only handed back after the job has finished.
 */
public class FlinkContextStageExecutor implements ContextStageExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(FlinkContextStageExecutor.class);

    private final BundleMiningConfig config;

    public FlinkContextStageExecutor(BundleMiningConfig config) {
        this.config = config;
    }

    StreamExecutionEnvironment createEnvironment() {
        Configuration flinkConfig = new Configuration();
        flinkConfig.set(RestartStrategyOptions.RESTART_STRATEGY, "fixed-delay");
        flinkConfig.set(RestartStrategyOptions.RESTART_STRATEGY_FIXED_DELAY_ATTEMPTS, config.getContextRetries());
        flinkConfig.set(RestartStrategyOptions.RESTART_STRATEGY_FIXED_DELAY_DELAY, Duration.ZERO);

        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment(flinkConfig);
        env.setRuntimeMode(RuntimeExecutionMode.BATCH);
        env.setParallelism(config.getParallelism());
        return env;
    }

    @Override
    public List<ContextRuleSet> execute(List<ContextBucket> buckets) {
        if (buckets.isEmpty()) {
            return new ArrayList<>();
        }

        StreamExecutionEnvironment env = createEnvironment();
        DataStream<ContextRuleSet> ruleSets = env
            .fromCollection(buckets, TypeInformation.of(ContextBucket.class))
            .name("Context Buckets")
            .map(new ContextMinerFunction(config))
            .name("Mine & Score Context")
            .returns(ContextRuleSet.class);

        Map<Context, ContextRuleSet> byContext = new HashMap<>();
        try (CloseableIterator<ContextRuleSet> results = ruleSets.executeAndCollect(config.getJobName())) {
            while (results.hasNext()) {
                ContextRuleSet ruleSet = results.next();
                byContext.put(ruleSet.context, ruleSet);
            }
        } catch (Exception e) {
            throw new MiningRunException("Flink mining job '" + config.getJobName() + "' failed", e);
        }

        List<ContextRuleSet> ordered = new ArrayList<>(buckets.size());
        for (ContextBucket bucket : buckets) {
            ContextRuleSet ruleSet = byContext.get(bucket.context);
            if (ruleSet == null) {
                throw new MiningRunException("No result for context [" + bucket.context.key() + "]");
            }
            ordered.add(ruleSet);
        }
        LOG.info("Flink job '{}' mined {} contexts", config.getJobName(), ordered.size());
        return ordered;
    }
}
