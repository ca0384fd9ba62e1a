package com.ververica.bundle_lift.flink.mining.segment;

import com.ververica.bundle_lift.flink.mining.shared.exception.InsufficientDataException;
import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.SegmentStats;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Partitions enriched transactions into context buckets.
 *
 * EMISSION ORDER:
 * <pre>
 * depth 0: overall (always emitted, even when small)
 * depth 1: store, time bin, weekday/weekend, quarter, festival
 * depth 2: store × time bin, weekday/weekend × time bin,
 *          festival × time bin, store × quarter
 * </pre>
 * Values inside a dimension are visited in sorted order, so identical input
 * yields identical contexts in identical order.
 *
 * BACKOFF:
 * A combination with fewer than minTransactions matches is not emitted.
 * Its transactions stay covered by the overall bucket and by any emitted
 * broader context.
 */
public class ContextSegmenter {

    private static final Logger LOG = LoggerFactory.getLogger(ContextSegmenter.class);

    private final int minTransactions;
    private final int maxDepth;

    public ContextSegmenter(int minTransactions, int maxDepth) {
        if (minTransactions < 1) {
            throw new IllegalArgumentException("minTransactions must be >= 1: " + minTransactions);
        }
        if (maxDepth < 0 || maxDepth > 2) {
            throw new IllegalArgumentException("maxDepth must be 0, 1 or 2: " + maxDepth);
        }
        this.minTransactions = minTransactions;
        this.maxDepth = maxDepth;
    }

    public SegmentationResult segment(List<Transaction> transactions) {
        LinkedHashMap<Context, List<Transaction>> buckets = new LinkedHashMap<>();
        List<Context> skipped = new ArrayList<>();

        buckets.put(Context.overall(), new ArrayList<>(transactions));
        if (transactions.isEmpty()) {
            LOG.info("No transactions to segment, emitting overall context only");
            return new SegmentationResult(buckets, skipped);
        }

        if (maxDepth >= 1) {
            for (Dimension dimension : Dimension.values()) {
                for (String value : distinct(transactions, dimension)) {
                    consider(dimension.constrain(Context.overall(), value), transactions, buckets, skipped);
                }
            }
        }

        if (maxDepth >= 2) {
            pair(Dimension.STORE, Dimension.TIME_BIN, transactions, buckets, skipped);
            pair(Dimension.WEEKDAY_WEEKEND, Dimension.TIME_BIN, transactions, buckets, skipped);
            pair(Dimension.FESTIVAL, Dimension.TIME_BIN, transactions, buckets, skipped);
            pair(Dimension.STORE, Dimension.QUARTER, transactions, buckets, skipped);
        }

        LOG.info("Segmented {} transactions into {} contexts ({} below minimum of {})",
            transactions.size(), buckets.size(), skipped.size(), minTransactions);
        return new SegmentationResult(buckets, skipped);
    }

    private void pair(Dimension first, Dimension second, List<Transaction> transactions,
                      LinkedHashMap<Context, List<Transaction>> buckets, List<Context> skipped) {
        Set<String> secondValues = distinct(transactions, second);
        for (String a : distinct(transactions, first)) {
            Context partial = first.constrain(Context.overall(), a);
            for (String b : secondValues) {
                consider(second.constrain(partial, b), transactions, buckets, skipped);
            }
        }
    }

    private void consider(Context context, List<Transaction> transactions,
                          LinkedHashMap<Context, List<Transaction>> buckets, List<Context> skipped) {
        try {
            buckets.put(context, select(context, transactions));
        } catch (InsufficientDataException e) {
            LOG.warn("Skipping context [{}]: {}", context.key(), e.getMessage());
            skipped.add(context);
        }
    }

    private List<Transaction> select(Context context, List<Transaction> transactions)
            throws InsufficientDataException {
        List<Transaction> matching = new ArrayList<>();
        for (Transaction tx : transactions) {
            if (context.matches(tx)) {
                matching.add(tx);
            }
        }
        if (matching.size() < minTransactions) {
            throw new InsufficientDataException(context.key(), matching.size(), minTransactions);
        }
        return matching;
    }

    private static Set<String> distinct(List<Transaction> transactions, Dimension dimension) {
        Set<String> values = new TreeSet<>();
        for (Transaction tx : transactions) {
            String value = dimension.extract(tx);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * Size profile of a bucket.
     */
    public static SegmentStats statsFor(Context context, List<Transaction> transactions) {
        SegmentStats stats = new SegmentStats();
        stats.context = context;
        stats.transactionCount = transactions.size();

        Set<String> stores = new HashSet<>();
        Set<String> customers = new HashSet<>();
        long items = 0;
        for (Transaction tx : transactions) {
            if (tx.storeId != null) stores.add(tx.storeId);
            if (tx.customerHash != null) customers.add(tx.customerHash);
            items += tx.basket().size();
        }
        stats.uniqueStores = stores.size();
        stats.uniqueCustomers = customers.size();
        stats.avgBasketSize = transactions.isEmpty() ? 0.0 : (double) items / transactions.size();
        return stats;
    }

    /**
     * The segmentable context dimensions. Quarters are visited in numeric order
     * because they are single digits.
     */
    enum Dimension {
        STORE(tx -> tx.storeId),
        TIME_BIN(tx -> tx.timeBin),
        WEEKDAY_WEEKEND(tx -> tx.weekdayWeekend),
        QUARTER(tx -> tx.quarter == null ? null : String.valueOf(tx.quarter)),
        FESTIVAL(tx -> tx.festivalPeriod);

        private final Function<Transaction, String> extractor;

        Dimension(Function<Transaction, String> extractor) {
            this.extractor = extractor;
        }

        String extract(Transaction tx) {
            return extractor.apply(tx);
        }

        Context constrain(Context base, String value) {
            switch (this) {
                case STORE:
                    return base.withStoreId(value);
                case TIME_BIN:
                    return base.withTimeBin(value);
                case WEEKDAY_WEEKEND:
                    return base.withWeekdayWeekend(value);
                case QUARTER:
                    return base.withQuarter(Integer.valueOf(value));
                case FESTIVAL:
                    return base.withFestivalPeriod(value);
                default:
                    throw new IllegalStateException("Unknown dimension " + this);
            }
        }
    }
}
