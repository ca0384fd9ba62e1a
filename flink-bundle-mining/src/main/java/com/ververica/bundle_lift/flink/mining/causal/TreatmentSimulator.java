package com.ververica.bundle_lift.flink.mining.causal;

import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Simulates a randomized experiment over historical baskets.
 *
 * STEPS:
 * 1. Keep the baskets that contain the rule's full antecedent
 * 2. Sort them by transaction id so input order does not matter
 * 3. Shuffle with a Random seeded from (run seed, rule id)
 * 4. First half is control, second half treatment; an odd basket out is dropped
 */
public class TreatmentSimulator {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    public TreatmentSplit split(ContextualRule rule, Collection<Transaction> transactions, long runSeed) {
        List<Transaction> eligible = new ArrayList<>();
        for (Transaction tx : transactions) {
            if (tx.containsAll(rule.getAntecedent())) {
                eligible.add(tx);
            }
        }
        eligible.sort(Comparator.comparing((Transaction tx) -> tx.transactionId,
            Comparator.nullsFirst(Comparator.naturalOrder())));

        List<Transaction> shuffled = new ArrayList<>(eligible);
        Collections.shuffle(shuffled, new Random(splitSeed(runSeed, rule.getRuleId())));

        int half = shuffled.size() / 2;
        List<Transaction> control = new ArrayList<>(shuffled.subList(0, half));
        List<Transaction> treatment = new ArrayList<>(shuffled.subList(half, 2 * half));
        return new TreatmentSplit(eligible, control, treatment);
    }

    /**
     * Seed for one (run, rule) pair: FNV-1a over the rule id's UTF-8 bytes,
     * mixed with the run seed.
     */
    public static long splitSeed(long runSeed, String ruleId) {
        long hash = FNV_OFFSET;
        for (byte b : ruleId.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return runSeed * 31 + hash;
    }
}
