package com.ververica.bundle_lift.flink.mining.causal;

import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Default basket features:
 * <pre>
 * [0] hour of day (UTC)
 * [1] day of week, 1 = Monday .. 7 = Sunday
 * [2] weekend flag
 * [3] store ordinal (position in the sorted store ids, -1 if unknown)
 * [4] basket size (distinct items)
 * </pre>
 */
public class TransactionFeatureExtractor implements BasketFeatureExtractor {

    public static final int WIDTH = 5;

    private final Map<String, Integer> storeOrdinals = new HashMap<>();

    public TransactionFeatureExtractor(Collection<String> storeIds) {
        List<String> sorted = new ArrayList<>(new TreeSet<>(storeIds));
        for (int i = 0; i < sorted.size(); i++) {
            storeOrdinals.put(sorted.get(i), i);
        }
    }

    public static TransactionFeatureExtractor forTransactions(Collection<Transaction> transactions) {
        List<String> stores = new ArrayList<>();
        for (Transaction tx : transactions) {
            if (tx.storeId != null) {
                stores.add(tx.storeId);
            }
        }
        return new TransactionFeatureExtractor(stores);
    }

    @Override
    public double[] extract(Transaction transaction) {
        ZonedDateTime time = Instant.ofEpochMilli(transaction.timestamp).atZone(ZoneOffset.UTC);
        DayOfWeek day = time.getDayOfWeek();
        boolean weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
        return new double[] {
            time.getHour(),
            day.getValue(),
            weekend ? 1.0 : 0.0,
            storeOrdinals.getOrDefault(transaction.storeId, -1),
            transaction.basket().size()
        };
    }
}
