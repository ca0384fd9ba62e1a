package com.ververica.bundle_lift.flink.mining.shared.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ContextualRuleTest {

    @Test
    public void ruleIdIsOrderIndependentTest() {
        ContextualRule a = new ContextualRule(Arrays.asList("milk", "bread"), Arrays.asList("butter"),
            0.1, 0.5, 1.2, Context.overall().withStoreId("S1"));
        ContextualRule b = new ContextualRule(Arrays.asList("bread", "milk"), Arrays.asList("butter"),
            0.1, 0.5, 1.2, Context.overall().withStoreId("S1"));

        assertEquals("bread,milk=>butter@store=S1", a.getRuleId());
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    public void itemsTest() {
        ContextualRule rule = new ContextualRule(Arrays.asList("milk"), Arrays.asList("bread"),
            0.1, 0.5, 1.2, Context.overall());

        assertEquals(Arrays.asList("bread", "milk"), Arrays.asList(rule.items().toArray()));
    }

    @Test
    public void invalidRulesRejectedTest() {
        Context overall = Context.overall();
        assertThrows(IllegalArgumentException.class,
            () -> new ContextualRule(Collections.emptyList(), Arrays.asList("b"), 0.1, 0.5, 1.0, overall));
        assertThrows(IllegalArgumentException.class,
            () -> new ContextualRule(Arrays.asList("a"), Arrays.asList("a"), 0.1, 0.5, 1.0, overall));
        assertThrows(IllegalArgumentException.class,
            () -> new ContextualRule(Arrays.asList("a"), Arrays.asList("b"), 0.1, 1.5, 1.0, overall));
        assertThrows(IllegalArgumentException.class,
            () -> new ContextualRule(Arrays.asList("a"), Arrays.asList("b"), -0.1, 0.5, 1.0, overall));
        assertThrows(IllegalArgumentException.class,
            () -> new ContextualRule(Arrays.asList("a"), Arrays.asList("b"), 0.1, 0.5, -1.0, overall));
    }

    @Test
    public void nullItemListsRejectedByValidateTest() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        ContextualRule valid = new ContextualRule(Arrays.asList("milk"), Arrays.asList("bread"),
            0.1, 0.5, 1.2, Context.overall());
        ObjectNode json = mapper.valueToTree(valid);
        json.putNull("antecedent");

        ContextualRule read = mapper.treeToValue(json, ContextualRule.class);
        assertTrue(read.getAntecedent().isEmpty());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, read::validate);
        assertEquals("Antecedent must not be empty", e.getMessage());

        ContextualRule rule = new ContextualRule(Arrays.asList("milk"), Arrays.asList("bread"),
            0.1, 0.5, 1.2, Context.overall());
        rule.setConsequent(null);
        e = assertThrows(IllegalArgumentException.class, rule::validate);
        assertEquals("Consequent must not be empty", e.getMessage());
    }
}
