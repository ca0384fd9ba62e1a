package com.ververica.bundle_lift.flink.mining.fpm;

import com.ververica.bundle_lift.flink.mining.SyntheticTransactionGenerator;
import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.ververica.bundle_lift.flink.mining.TestData.basket;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AssociationRuleGeneratorTest {

    private static final FpGrowthMiner MINER = new FpGrowthMiner();

    private static Optional<ContextualRule> find(List<ContextualRule> rules, String antecedent, String consequent) {
        return rules.stream()
            .filter(r -> r.getAntecedent().equals(Collections.singletonList(antecedent))
                && r.getConsequent().equals(Collections.singletonList(consequent)))
            .findFirst();
    }

    @Test
    public void confidenceAndLiftTest() {
        List<Set<String>> baskets = Arrays.asList(basket("a", "b"), basket("a", "b"), basket("a", "c"));
        List<ContextualRule> rules = new AssociationRuleGenerator(0.3, 0.0)
            .generate(MINER.mine(baskets, 0.3), Context.overall());

        ContextualRule aToB = find(rules, "a", "b").orElseThrow();
        assertEquals(2.0 / 3.0, aToB.getSupport(), 1e-12);
        assertEquals(2.0 / 3.0, aToB.getConfidence(), 1e-12);
        assertEquals(1.0, aToB.getLift(), 1e-12);

        ContextualRule bToA = find(rules, "b", "a").orElseThrow();
        assertEquals(1.0, bToA.getConfidence(), 1e-12);
        assertEquals(1.0, bToA.getLift(), 1e-12);
    }

    @Test
    public void liftAboveOneTest() {
        // b is in 2 of 3 baskets and always together with a
        List<Set<String>> baskets = Arrays.asList(basket("a", "b"), basket("a", "b"), basket("c"));
        List<ContextualRule> rules = new AssociationRuleGenerator(0.3, 0.0)
            .generate(MINER.mine(baskets, 0.3), Context.overall());

        ContextualRule aToB = find(rules, "a", "b").orElseThrow();
        assertEquals(2.0 / 3.0, aToB.getSupport(), 1e-12);
        assertEquals(1.0, aToB.getConfidence(), 1e-12);
        assertEquals(1.5, aToB.getLift(), 1e-12);
    }

    @Test
    public void thresholdsTest() {
        List<Set<String>> baskets = Arrays.asList(basket("a", "b"), basket("a", "b"), basket("a", "c"));
        FrequentItemsets itemsets = MINER.mine(baskets, 0.3);

        List<ContextualRule> confident = new AssociationRuleGenerator(0.9, 0.0).generate(itemsets, Context.overall());
        assertTrue(find(confident, "b", "a").isPresent());
        assertFalse(find(confident, "a", "b").isPresent());

        List<ContextualRule> lifted = new AssociationRuleGenerator(0.1, 1.1).generate(itemsets, Context.overall());
        assertTrue(find(lifted, "c", "a").isEmpty());
    }

    @Test
    public void emptyItemsetsTest() {
        List<ContextualRule> rules = new AssociationRuleGenerator(0.3, 0.0)
            .generate(FrequentItemsets.empty(), Context.overall());

        assertTrue(rules.isEmpty());
    }

    @Test
    public void ruleInvariantsTest() {
        List<Transaction> transactions = new SyntheticTransactionGenerator(11).generate(1000);
        List<Set<String>> baskets = new ArrayList<>();
        for (Transaction tx : transactions) {
            baskets.add(tx.basket());
        }
        Context context = Context.overall().withStoreId("S1");

        List<ContextualRule> rules = new AssociationRuleGenerator(0.1, 0.0)
            .generate(MINER.mine(baskets, 0.02), context);

        assertFalse(rules.isEmpty());
        Set<String> ids = new HashSet<>();
        for (ContextualRule rule : rules) {
            assertFalse(rule.getAntecedent().isEmpty());
            assertFalse(rule.getConsequent().isEmpty());
            assertTrue(Collections.disjoint(rule.getAntecedent(), rule.getConsequent()));
            assertTrue(rule.getSupport() >= 0.0 && rule.getSupport() <= 1.0);
            assertTrue(rule.getConfidence() >= 0.1 && rule.getConfidence() <= 1.0);
            assertTrue(rule.getLift() >= 0.0);
            assertEquals(context, rule.getContext());
            assertTrue(ids.add(rule.getRuleId()), "duplicate rule " + rule.getRuleId());
        }
    }
}
