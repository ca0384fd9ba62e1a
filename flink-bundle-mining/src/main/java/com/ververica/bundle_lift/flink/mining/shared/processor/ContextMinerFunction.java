package com.ververica.bundle_lift.flink.mining.shared.processor;

import com.ververica.bundle_lift.flink.mining.ContextMiningStage;
import com.ververica.bundle_lift.flink.mining.shared.config.BundleMiningConfig;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextBucket;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextRuleSet;
import org.apache.flink.api.common.functions.RichMapFunction;
import org.apache.flink.configuration.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mines and scores one context bucket per record.
 *
 * PATTERN: Stateless Map
 * Each record carries a whole context, so contexts are spread over the
 * parallel subtasks and never share state. A failed subtask is restarted and
 * recomputes its buckets from the source.
 *
 * The stage is built in open() from the serialized config, once per subtask.
 */
public class ContextMinerFunction extends RichMapFunction<ContextBucket, ContextRuleSet> {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(ContextMinerFunction.class);

    private final BundleMiningConfig config;
    private transient ContextMiningStage stage;

    public ContextMinerFunction(BundleMiningConfig config) {
        this.config = config;
    }

    @Override
    public void open(Configuration parameters) throws Exception {
        super.open(parameters);
        stage = ContextMiningStage.fromConfig(config);
        LOG.info("Context miner ready on subtask {}", getRuntimeContext().getIndexOfThisSubtask());
    }

    @Override
    public ContextRuleSet map(ContextBucket bucket) {
        ContextRuleSet result = stage.process(bucket);
        LOG.info("Mined context [{}]: {} transactions → {} rules",
            bucket.context.key(), bucket.transactions.size(), result.rules.size());
        return result;
    }
}
