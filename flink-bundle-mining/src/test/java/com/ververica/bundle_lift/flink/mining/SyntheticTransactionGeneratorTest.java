package com.ververica.bundle_lift.flink.mining;

import com.ververica.bundle_lift.flink.mining.shared.model.LineItem;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SyntheticTransactionGeneratorTest {

    @Test
    public void sameSeedSameTransactionsTest() {
        List<Transaction> first = new SyntheticTransactionGenerator(3L).generate(50);
        List<Transaction> second = new SyntheticTransactionGenerator(3L).generate(50);

        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).transactionId, second.get(i).transactionId);
            assertEquals(first.get(i).timestamp, second.get(i).timestamp);
            assertEquals(first.get(i).basket(), second.get(i).basket());
        }
    }

    @Test
    public void transactionsAreWellFormedTest() {
        List<Transaction> transactions = new SyntheticTransactionGenerator(3L).generate(200);

        assertEquals(200, transactions.size());
        assertEquals("T000000", transactions.get(0).transactionId);
        for (Transaction tx : transactions) {
            assertFalse(tx.items.isEmpty());
            assertTrue(tx.storeId.startsWith("S"));
            for (LineItem item : tx.items) {
                assertTrue(item.price > 0);
                assertTrue(item.marginPct >= 0 && item.marginPct <= 1);
            }
        }
    }
}
