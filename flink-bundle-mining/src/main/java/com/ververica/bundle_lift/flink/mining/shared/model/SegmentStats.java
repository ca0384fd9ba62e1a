package com.ververica.bundle_lift.flink.mining.shared.model;

import java.io.Serializable;

/**
 * Size profile of one emitted context segment.
 */
public class SegmentStats implements Serializable {

    private static final long serialVersionUID = 1L;

    public Context context;
    public int transactionCount;
    public int uniqueStores;
    public int uniqueCustomers;
    public double avgBasketSize;

    public SegmentStats() {}

    public boolean isFestival() {
        return context != null && context.getFestivalPeriod() != null;
    }

    @Override
    public String toString() {
        return String.format("SegmentStats{context=%s, transactions=%d, stores=%d, customers=%d, avgBasket=%.2f}",
            context, transactionCount, uniqueStores, uniqueCustomers, avgBasketSize);
    }
}
