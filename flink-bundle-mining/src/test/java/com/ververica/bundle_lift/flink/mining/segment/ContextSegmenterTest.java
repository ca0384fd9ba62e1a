package com.ververica.bundle_lift.flink.mining.segment;

import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.SegmentStats;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import com.ververica.bundle_lift.flink.mining.shared.processor.ContextEnricher;
import com.ververica.bundle_lift.flink.mining.shared.processor.FestivalCalendar;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.ververica.bundle_lift.flink.mining.TestData.WEDNESDAY_MORNING;
import static com.ververica.bundle_lift.flink.mining.TestData.tx;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ContextSegmenterTest {

    private static final LocalDateTime WEDNESDAY_EVENING = LocalDateTime.of(2024, 5, 15, 19, 0);

    /** 150 morning baskets in S1, 60 evening baskets in S2, all on a weekday in Q2. */
    private static List<Transaction> transactions() {
        ContextEnricher enricher = new ContextEnricher(FestivalCalendar.empty());
        List<Transaction> transactions = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            transactions.add(enricher.enrich(tx("M" + i, "S1", WEDNESDAY_MORNING, "bread", "butter")));
        }
        for (int i = 0; i < 60; i++) {
            transactions.add(enricher.enrich(tx("E" + i, "S2", WEDNESDAY_EVENING, "chips", "soda")));
        }
        return transactions;
    }

    @Test
    public void emissionOrderTest() {
        SegmentationResult result = new ContextSegmenter(100, 2).segment(transactions());

        Context overall = Context.overall();
        List<Context> expected = Arrays.asList(
            overall,
            overall.withStoreId("S1"),
            overall.withTimeBin("morning"),
            overall.withWeekdayWeekend("weekday"),
            overall.withQuarter(2),
            overall.withStoreId("S1").withTimeBin("morning"),
            overall.withWeekdayWeekend("weekday").withTimeBin("morning"),
            overall.withStoreId("S1").withQuarter(2));

        assertEquals(expected, result.getContexts());
    }

    @Test
    public void backoffTest() {
        List<Transaction> transactions = transactions();
        SegmentationResult result = new ContextSegmenter(100, 2).segment(transactions);

        Context s2 = Context.overall().withStoreId("S2");
        assertFalse(result.getBuckets().containsKey(s2));
        assertFalse(result.getBuckets().containsKey(Context.overall().withTimeBin("evening")));
        assertTrue(result.getSkipped().contains(s2));

        // the S2 baskets are still mined, in the broader contexts
        List<Transaction> overall = result.getBuckets().get(Context.overall());
        assertEquals(210, overall.size());
        assertEquals(210, result.getBuckets().get(Context.overall().withWeekdayWeekend("weekday")).size());
        for (Transaction tx : result.getBuckets().get(Context.overall().withStoreId("S1"))) {
            assertEquals("S1", tx.storeId);
        }
    }

    @Test
    public void everyEmittedContextMeetsMinimumTest() {
        SegmentationResult result = new ContextSegmenter(100, 2).segment(transactions());

        for (SegmentStats stats : result.stats()) {
            if (!stats.context.isOverall()) {
                assertTrue(stats.transactionCount >= 100, stats.toString());
            }
        }
    }

    @Test
    public void overallAlwaysEmittedTest() {
        SegmentationResult result = new ContextSegmenter(1000, 2).segment(transactions());

        assertEquals(Collections.singletonList(Context.overall()), result.getContexts());

        SegmentationResult empty = new ContextSegmenter(100, 2).segment(new ArrayList<>());
        assertEquals(Collections.singletonList(Context.overall()), empty.getContexts());
        assertTrue(empty.getBuckets().get(Context.overall()).isEmpty());
    }

    @Test
    public void depthLimitTest() {
        assertEquals(1, new ContextSegmenter(100, 0).segment(transactions()).getContexts().size());

        for (Context context : new ContextSegmenter(100, 1).segment(transactions()).getContexts()) {
            assertTrue(context.dimensionCount() <= 1);
        }
    }

    @Test
    public void deterministicTest() {
        List<Transaction> transactions = transactions();
        List<Transaction> reversed = new ArrayList<>(transactions);
        Collections.reverse(reversed);

        SegmentationResult first = new ContextSegmenter(50, 2).segment(transactions);
        SegmentationResult second = new ContextSegmenter(50, 2).segment(transactions);
        SegmentationResult third = new ContextSegmenter(50, 2).segment(reversed);

        assertEquals(first.getContexts(), second.getContexts());
        assertEquals(first.getContexts(), third.getContexts());
        assertEquals(first.getSkipped(), second.getSkipped());
    }

    @Test
    public void statsTest() {
        SegmentStats stats = ContextSegmenter.statsFor(Context.overall(), transactions());

        assertEquals(210, stats.transactionCount);
        assertEquals(2, stats.uniqueStores);
        assertEquals(2.0, stats.avgBasketSize, 1e-12);
        assertFalse(stats.isFestival());
    }

    @Test
    public void invalidArgumentsTest() {
        assertThrows(IllegalArgumentException.class, () -> new ContextSegmenter(0, 2));
        assertThrows(IllegalArgumentException.class, () -> new ContextSegmenter(100, 3));
    }
}
