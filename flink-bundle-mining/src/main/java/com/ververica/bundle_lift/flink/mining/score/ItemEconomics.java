package com.ververica.bundle_lift.flink.mining.score;

import com.ververica.bundle_lift.flink.mining.shared.model.LineItem;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Mean unit price and mean resolved margin of a set of items, taken over
 * every line carrying one of them.
 */
public final class ItemEconomics {

    private static final ItemEconomics NONE = new ItemEconomics(0.0, 0.0, 0);

    private final double meanPrice;
    private final double meanMargin;
    private final int observations;

    private ItemEconomics(double meanPrice, double meanMargin, int observations) {
        this.meanPrice = meanPrice;
        this.meanMargin = meanMargin;
        this.observations = observations;
    }

    public static ItemEconomics of(Collection<String> itemIds, Collection<Transaction> transactions,
                                   MarginResolver margins) {
        Set<String> wanted = new HashSet<>(itemIds);
        double priceSum = 0.0;
        double marginSum = 0.0;
        int lines = 0;
        for (Transaction tx : transactions) {
            for (LineItem item : tx.items) {
                if (wanted.contains(item.itemId)) {
                    priceSum += item.price;
                    marginSum += margins.resolve(item);
                    lines++;
                }
            }
        }
        if (lines == 0) {
            return NONE;
        }
        return new ItemEconomics(priceSum / lines, marginSum / lines, lines);
    }

    public double getMeanPrice() {
        return meanPrice;
    }

    public double getMeanMargin() {
        return meanMargin;
    }

    public int getObservations() {
        return observations;
    }

    public boolean isEmpty() {
        return observations == 0;
    }
}
