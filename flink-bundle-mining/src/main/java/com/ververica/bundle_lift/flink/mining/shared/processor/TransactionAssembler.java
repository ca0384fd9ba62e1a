package com.ververica.bundle_lift.flink.mining.shared.processor;

import com.ververica.bundle_lift.flink.mining.shared.model.LineItem;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import com.ververica.bundle_lift.flink.mining.shared.model.TransactionRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Groups item-level rows into transactions.
 *
 * Header fields (timestamp, store, customer, context columns) come from the
 * first row seen for a transaction id. A transaction is flagged discounted if
 * any of its rows is. Rows missing a required field are skipped with a warning.
 *
 * USAGE:
 * <pre>
 * List<TransactionRow> rows = reader.readRows(path);
 * List<Transaction> transactions = new TransactionAssembler().assemble(rows);
 * </pre>
 */
public class TransactionAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionAssembler.class);

    private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d+");

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
        Instant::parse,
        s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
        s -> LocalDateTime.parse(s, DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")).toInstant(ZoneOffset.UTC));

    public List<Transaction> assemble(List<TransactionRow> rows) {
        Map<String, Transaction> byId = new LinkedHashMap<>();
        int skipped = 0;

        for (TransactionRow row : rows) {
            if (!isValid(row)) {
                skipped++;
                continue;
            }

            Transaction transaction = byId.get(row.transactionId);
            if (transaction == null) {
                Long timestamp = parseTimestamp(row.timestamp);
                if (timestamp == null) {
                    LOG.warn("Unparseable timestamp '{}' for transaction {}, skipping row", row.timestamp, row.transactionId);
                    skipped++;
                    continue;
                }
                transaction = new Transaction(row.transactionId, timestamp, row.storeId, new ArrayList<>());
                transaction.customerHash = row.customerIdHash;
                transaction.timeBin = row.timeBin;
                transaction.weekdayWeekend = row.weekdayWeekend;
                transaction.quarter = row.quarter;
                transaction.festivalPeriod = emptyToNull(row.festival);
                byId.put(row.transactionId, transaction);
            }

            if (Boolean.TRUE.equals(row.discountFlag)) {
                transaction.discountFlag = true;
            }
            transaction.items.add(new LineItem(
                row.itemId,
                row.quantity != null ? row.quantity : 1,
                row.price,
                row.marginPct,
                row.category));
        }

        if (skipped > 0) {
            LOG.warn("Skipped {} invalid transaction rows", skipped);
        }
        LOG.info("Assembled {} transactions from {} rows", byId.size(), rows.size());
        return new ArrayList<>(byId.values());
    }

    private boolean isValid(TransactionRow row) {
        if (row == null) {
            return false;
        }
        if (isBlank(row.transactionId) || isBlank(row.storeId) || isBlank(row.timestamp)) {
            LOG.warn("Row missing transaction_id/store_id/timestamp, skipping: {}", row);
            return false;
        }
        if (isBlank(row.itemId)) {
            LOG.warn("Row of transaction {} missing item_id, skipping", row.transactionId);
            return false;
        }
        if (row.price == null || row.price < 0) {
            LOG.warn("Row {}/{} has missing or negative price, skipping", row.transactionId, row.itemId);
            return false;
        }
        return true;
    }

    /**
     * Epoch millis, ISO instant, ISO local date-time or "yyyy-MM-dd HH:mm:ss" (UTC).
     */
    static Long parseTimestamp(String value) {
        String trimmed = value.trim();
        if (EPOCH_MILLIS.matcher(trimmed).matches()) {
            return Long.parseLong(trimmed);
        }
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(trimmed).toEpochMilli();
            } catch (DateTimeParseException e) {
                LOG.trace("Timestamp '{}' not in this format: {}", trimmed, e.getMessage());
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String emptyToNull(String value) {
        return isBlank(value) ? null : value;
    }
}
