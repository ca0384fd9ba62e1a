package com.ververica.bundle_lift.flink.mining;

import com.ververica.bundle_lift.flink.mining.shared.exception.MiningRunException;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextBucket;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextRuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs buckets on a fixed thread pool inside the current JVM.
 *
 * A failing bucket is recomputed from scratch up to {@code retries} more
 * times; its partial output is discarded on every failure.
 */
public class LocalContextStageExecutor implements ContextStageExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(LocalContextStageExecutor.class);

    private final ContextMiningStage stage;
    private final int parallelism;
    private final int retries;

    public LocalContextStageExecutor(ContextMiningStage stage, int parallelism, int retries) {
        this.stage = stage;
        this.parallelism = Math.max(1, parallelism);
        this.retries = Math.max(0, retries);
    }

    @Override
    public List<ContextRuleSet> execute(List<ContextBucket> buckets) {
        if (buckets.isEmpty()) {
            return new ArrayList<>();
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, buckets.size()));
        try {
            List<Future<ContextRuleSet>> futures = new ArrayList<>();
            for (ContextBucket bucket : buckets) {
                futures.add(pool.submit(() -> processWithRetry(bucket)));
            }
            List<ContextRuleSet> results = new ArrayList<>(buckets.size());
            for (Future<ContextRuleSet> future : futures) {
                results.add(await(future));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    ContextRuleSet processWithRetry(ContextBucket bucket) {
        RuntimeException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return stage.process(bucket);
            } catch (RuntimeException e) {
                last = e;
                LOG.warn("Context [{}] failed on attempt {} of {}: {}",
                    bucket.context.key(), attempt + 1, retries + 1, e.toString());
            }
        }
        throw new MiningRunException(
            "Context [" + bucket.context.key() + "] failed after " + (retries + 1) + " attempts", last);
    }

    private static ContextRuleSet await(Future<ContextRuleSet> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MiningRunException("Interrupted while mining contexts", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof MiningRunException) {
                throw (MiningRunException) e.getCause();
            }
            throw new MiningRunException("Context mining failed", e.getCause());
        }
    }
}
