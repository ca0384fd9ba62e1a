package com.ververica.bundle_lift.flink.mining.score;

import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.LineItem;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.ververica.bundle_lift.flink.mining.TestData.rule;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class ProfitCalculatorTest {

    private static final Map<String, Double> CATEGORY_MARGINS = new HashMap<>();

    static {
        CATEGORY_MARGINS.put("dairy", 0.20);
    }

    private static final MarginResolver MARGINS = new MarginResolver(0.25, CATEGORY_MARGINS);

    private static Transaction tx(LineItem... items) {
        return new Transaction("T", 0L, "S1", Arrays.asList(items));
    }

    @Test
    public void marginResolutionOrderTest() {
        assertEquals(0.40, MARGINS.resolve(new LineItem("x", 1, 10.0, 0.40, "dairy")), 1e-12);
        assertEquals(0.20, MARGINS.resolve(new LineItem("x", 1, 10.0, null, "dairy")), 1e-12);
        assertEquals(0.25, MARGINS.resolve(new LineItem("x", 1, 10.0, null, "toys")), 1e-12);
        assertEquals(0.25, MARGINS.resolve(LineItem.of("x", 10.0)), 1e-12);
    }

    @Test
    public void expectedProfitTest() {
        List<Transaction> transactions = Arrays.asList(
            tx(LineItem.of("bread", 40.0), new LineItem("butter", 1, 50.0, 0.30, "dairy")),
            tx(LineItem.of("bread", 40.0), new LineItem("butter", 1, 70.0, null, "dairy")));
        ContextualRule rule = rule(Collections.singletonList("bread"), Collections.singletonList("butter"),
            0.8, 1.5, Context.overall());

        double profit = new ProfitCalculator(MARGINS).profit(rule, transactions);

        // mean price 60, mean margin (0.30 + 0.20) / 2, confidence 0.8
        assertEquals(60.0 * 0.25 * 0.8, profit, 1e-9);
    }

    @Test
    public void absentConsequentTest() {
        List<Transaction> transactions = Collections.singletonList(tx(LineItem.of("bread", 40.0)));
        ContextualRule rule = rule("bread", "caviar", Context.overall());

        assertEquals(0.0, new ProfitCalculator(MARGINS).profit(rule, transactions));
    }
}
