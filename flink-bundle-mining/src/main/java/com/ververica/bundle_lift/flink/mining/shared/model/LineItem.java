package com.ververica.bundle_lift.flink.mining.shared.model;

import java.io.Serializable;

/**
 * One purchased item line of a transaction.
 *
 * Used by:
 * - ProfitCalculator for consequent unit price and margin
 * - CausalUpliftEstimator for incremental revenue
 */
public class LineItem implements Serializable {

    private static final long serialVersionUID = 1L;

    public String itemId;
    public int quantity = 1;
    public double price;
    public Double marginPct;   // optional, fraction in [0,1]
    public String category;    // optional

    public LineItem() {}

    public LineItem(String itemId, int quantity, double price, Double marginPct, String category) {
        this.itemId = itemId;
        this.quantity = quantity;
        this.price = price;
        this.marginPct = marginPct;
        this.category = category;
    }

    public static LineItem of(String itemId, double price) {
        return new LineItem(itemId, 1, price, null, null);
    }

    @Override
    public String toString() {
        return String.format("LineItem{id=%s, qty=%d, price=%.2f, margin=%s, category=%s}",
            itemId, quantity, price, marginPct, category);
    }
}
