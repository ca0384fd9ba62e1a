package com.ververica.bundle_lift.flink.mining.score;

import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.ververica.bundle_lift.flink.mining.TestData.rule;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DiversityScorerTest {

    private static final DiversityScorer SCORER = new DiversityScorer();
    private static final Context MORNING = Context.overall().withTimeBin("morning");
    private static final Context EVENING = Context.overall().withTimeBin("evening");

    @Test
    public void uniqueItemsTest() {
        ContextualRule unique = rule("tea", "biscuits", MORNING);
        List<ContextualRule> rules = Arrays.asList(
            unique,
            rule("bread", "butter", MORNING),
            rule("bread", "milk", MORNING));

        assertEquals(1.0, SCORER.diversity(unique, rules), 1e-12);
    }

    @Test
    public void sharedItemsPenalizedTest() {
        ContextualRule breadButter = rule("bread", "butter", MORNING);
        List<ContextualRule> rules = Arrays.asList(
            breadButter,
            rule("bread", "milk", MORNING),
            rule("bread", "jam", MORNING),
            rule("tea", "biscuits", MORNING));

        // bread: 2 other rules of 4, butter: none → 1 - (0.5 + 0) / 2
        assertEquals(0.75, SCORER.diversity(breadButter, rules), 1e-12);
    }

    @Test
    public void otherContextsIgnoredTest() {
        ContextualRule morning = rule("bread", "butter", MORNING);
        List<ContextualRule> rules = Arrays.asList(
            morning,
            rule("tea", "biscuits", MORNING),
            rule("bread", "butter", EVENING),
            rule("bread", "milk", EVENING));

        assertEquals(1.0, SCORER.diversity(morning, rules), 1e-12);
    }

    @Test
    public void loneRuleTest() {
        ContextualRule lone = rule("bread", "butter", MORNING);

        assertEquals(1.0, SCORER.diversity(lone, Collections.singletonList(lone)), 1e-12);
    }

    @Test
    public void scoreAllMatchesSingleTest() {
        List<ContextualRule> rules = Arrays.asList(
            rule("bread", "butter", MORNING),
            rule("bread", "milk", MORNING),
            rule("milk", "butter", MORNING));

        Map<ContextualRule, Double> scores = SCORER.scoreAll(rules);

        for (ContextualRule rule : rules) {
            double score = scores.get(rule);
            assertEquals(SCORER.diversity(rule, rules), score, 1e-12);
            assertTrue(score >= 0.0 && score <= 1.0);
        }
    }

    @Test
    public void contextStatsTest() {
        List<ContextualRule> rules = Arrays.asList(
            rule("bread", "butter", MORNING),
            rule("bread", "milk", MORNING),
            rule("chips", "soda", EVENING));

        Map<Context, DiversityScorer.DiversityStats> stats = SCORER.contextStats(rules);

        assertEquals(2, stats.get(MORNING).rulesCount);
        assertEquals(0.75, stats.get(MORNING).avgDiversity, 1e-12);
        assertEquals(1, stats.get(EVENING).rulesCount);
        assertEquals(1.0, stats.get(EVENING).minDiversity, 1e-12);
    }
}
