package com.ververica.bundle_lift.flink.mining.fpm;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static com.ververica.bundle_lift.flink.mining.TestData.basket;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MinerCrossCheckTest {

    private static final List<Set<String>> BASKETS =
        Arrays.asList(basket("a", "b"), basket("a", "b"), basket("a", "c"), basket("b", "c"));

    @Test
    public void agreeingMinersTest() {
        MinerCrossCheck check = new MinerCrossCheck(new EclatMiner(), 1e-9);
        FrequentItemsets primary = new FpGrowthMiner().mine(BASKETS, 0.25);

        assertTrue(check.check("overall", BASKETS, 0.25, primary).isEmpty());
    }

    @Test
    public void divergenceReportedTest() {
        FrequentItemsets validation = new EclatMiner().mine(BASKETS, 0.25);
        FrequentItemsets primary = new FrequentItemsets(BASKETS.size());
        primary.add(Collections.singletonList("a"), 3);
        primary.add(Collections.singletonList("b"), 2);   // really 3

        List<String> divergences = MinerCrossCheck.compare(primary, validation, 1e-9);

        // b differs, c / ab / ac / bc missing from primary
        assertEquals(5, divergences.size());
        assertTrue(divergences.get(0).startsWith("[b] support"));
    }
}
