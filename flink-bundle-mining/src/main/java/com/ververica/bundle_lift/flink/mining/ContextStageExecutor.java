package com.ververica.bundle_lift.flink.mining;

import com.ververica.bundle_lift.flink.mining.shared.exception.MiningRunException;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextBucket;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextRuleSet;

import java.util.List;

/**
 * Runs the mining stage over all buckets of a run.
 *
 * Buckets are processed independently. The returned rule sets are in bucket
 * order and only returned once every bucket has finished.
 */
public interface ContextStageExecutor {

    /**
     * @throws MiningRunException if a bucket still fails after its retries
     */
    List<ContextRuleSet> execute(List<ContextBucket> buckets);
}
