package com.ververica.bundle_lift.flink.mining.shared.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A completed, validated purchase with its derived context fields.
 *
 * Produced by TransactionAssembler from item-level rows and enriched by
 * ContextEnricher. The mining core only reads it.
 *
 * PATTERN FLOW:
 * TransactionRow → TransactionAssembler → Transaction → ContextEnricher → ContextSegmenter
 */
public class Transaction implements Serializable {

    private static final long serialVersionUID = 1L;

    public String transactionId;
    public long timestamp;              // epoch millis, UTC
    public String storeId;
    public String customerHash;         // optional
    public boolean discountFlag;
    public List<LineItem> items = new ArrayList<>();

    // Derived context fields
    public String timeBin;
    public String weekdayWeekend;
    public Integer quarter;
    public String festivalPeriod;

    public Transaction() {}

    public Transaction(String transactionId, long timestamp, String storeId, List<LineItem> items) {
        this.transactionId = transactionId;
        this.timestamp = timestamp;
        this.storeId = storeId;
        this.items = new ArrayList<>(items);
    }

    /**
     * Distinct item ids of this transaction, sorted.
     */
    public Set<String> basket() {
        Set<String> basket = new TreeSet<>();
        for (LineItem item : items) {
            if (item.itemId != null) {
                basket.add(item.itemId);
            }
        }
        return basket;
    }

    public boolean containsAll(Iterable<String> itemIds) {
        Set<String> basket = basket();
        for (String itemId : itemIds) {
            if (!basket.contains(itemId)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("Transaction{id=%s, store=%s, items=%d, time=%d, context=[%s,%s,Q%s,%s]}",
            transactionId, storeId, items.size(), timestamp, timeBin, weekdayWeekend, quarter, festivalPeriod);
    }
}
