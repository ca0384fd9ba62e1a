package com.ververica.bundle_lift.flink.mining.score;

import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Collection;

/**
 * Expected incremental margin per basket of a rule:
 * <pre>
 * profit = mean unit price(consequent) × mean margin(consequent) × confidence
 * </pre>
 * Consequent items that never appear in the supplied transactions give 0.
 */
public class ProfitCalculator implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(ProfitCalculator.class);

    private final MarginResolver margins;

    public ProfitCalculator(MarginResolver margins) {
        this.margins = margins;
    }

    public double profit(ContextualRule rule, Collection<Transaction> transactions) {
        ItemEconomics economics = ItemEconomics.of(rule.getConsequent(), transactions, margins);
        if (economics.isEmpty()) {
            LOG.debug("No price data for consequent {} of rule {}", rule.getConsequent(), rule.getRuleId());
            return 0.0;
        }
        double profit = economics.getMeanPrice() * economics.getMeanMargin() * rule.getConfidence();
        return Math.max(0.0, profit);
    }

    public MarginResolver getMargins() {
        return margins;
    }
}
