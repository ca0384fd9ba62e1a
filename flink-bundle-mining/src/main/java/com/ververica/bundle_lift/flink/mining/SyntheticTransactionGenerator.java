package com.ververica.bundle_lift.flink.mining;

import com.ververica.bundle_lift.flink.mining.shared.model.LineItem;
import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates realistic retail transactions for demos and tests.
 *
 * BUNDLE TEMPLATES:
 * - Breakfast (mornings): bread → butter, milk; coffee → biscuits
 * - Snacks (evenings): chips → soda; noodles → sauce
 * - Household (weekends): detergent → softener
 * - Festive (Q4): sweets → dry fruits, diyas
 *
 * Each basket draws one template with a time-of-day or calendar bias, adds
 * the consequent items with the template's attach probability, then pads
 * with random filler items.
 *
 * Same seed, same transactions.
 */
public class SyntheticTransactionGenerator {

    private static final String[] STORES = {"S1", "S2", "S3"};

    private static final Map<String, Product> CATALOG = new LinkedHashMap<>();

    static {
        add("bread", 40.0, 0.18, "bakery");
        add("butter", 55.0, 0.22, "dairy");
        add("milk", 30.0, 0.12, "dairy");
        add("coffee", 180.0, 0.35, "beverages");
        add("biscuits", 25.0, 0.30, "snacks");
        add("chips", 20.0, 0.40, "snacks");
        add("soda", 35.0, 0.38, "beverages");
        add("noodles", 15.0, 0.28, "staples");
        add("sauce", 60.0, 0.33, "staples");
        add("detergent", 210.0, 0.20, "household");
        add("softener", 150.0, 0.24, "household");
        add("sweets", 300.0, 0.45, "festive");
        add("dry_fruits", 650.0, 0.30, "festive");
        add("diyas", 120.0, 0.50, "festive");
        add("rice", 90.0, 0.10, "staples");
        add("eggs", 70.0, 0.15, "dairy");
        add("tea", 110.0, 0.32, "beverages");
        add("soap", 45.0, 0.27, "household");
    }

    private static final List<String> FILLERS = Arrays.asList("rice", "eggs", "tea", "soap", "milk", "chips");

    private final Random random;
    private final LocalDate start;
    private final int days;

    public SyntheticTransactionGenerator(long seed) {
        this(seed, LocalDate.of(2024, 1, 1), 366);
    }

    public SyntheticTransactionGenerator(long seed, LocalDate start, int days) {
        this.random = new Random(seed);
        this.start = start;
        this.days = days;
    }

    public List<Transaction> generate(int count) {
        List<Transaction> transactions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            transactions.add(next(String.format("T%06d", i)));
        }
        return transactions;
    }

    private Transaction next(String id) {
        LocalDate date = start.plusDays(random.nextInt(days));
        int hour = 7 + random.nextInt(16);   // 07:00 .. 22:59
        int minute = random.nextInt(60);
        long timestamp = date.atTime(hour, minute).toInstant(ZoneOffset.UTC).toEpochMilli();

        List<String> items = new ArrayList<>();
        boolean weekend = date.getDayOfWeek().getValue() >= 6;
        boolean q4 = date.getMonthValue() >= 10;

        if (hour < 11 && random.nextDouble() < 0.7) {
            items.add("bread");
            maybe(items, "butter", 0.65);
            maybe(items, "milk", 0.45);
            maybe(items, "coffee", 0.25);
        } else if (hour >= 18 && random.nextDouble() < 0.6) {
            items.add("chips");
            maybe(items, "soda", 0.7);
            maybe(items, "noodles", 0.3);
        } else if (weekend && random.nextDouble() < 0.5) {
            items.add("detergent");
            maybe(items, "softener", 0.6);
        } else if (q4 && random.nextDouble() < 0.5) {
            items.add("sweets");
            maybe(items, "dry_fruits", 0.55);
            maybe(items, "diyas", 0.4);
        } else {
            items.add("noodles");
            maybe(items, "sauce", 0.5);
            maybe(items, "coffee", 0.2);
            if (items.contains("coffee")) {
                maybe(items, "biscuits", 0.6);
            }
        }

        int fillers = random.nextInt(3);
        for (int f = 0; f < fillers; f++) {
            String filler = FILLERS.get(random.nextInt(FILLERS.size()));
            if (!items.contains(filler)) {
                items.add(filler);
            }
        }

        List<LineItem> lines = new ArrayList<>();
        for (String itemId : items) {
            Product product = CATALOG.get(itemId);
            // ±10% price noise
            double price = Math.round(product.price * (0.9 + random.nextDouble() * 0.2) * 100.0) / 100.0;
            lines.add(new LineItem(itemId, 1 + random.nextInt(2), price, product.margin, product.category));
        }

        Transaction tx = new Transaction(id, timestamp, STORES[random.nextInt(STORES.length)], lines);
        tx.customerHash = "c" + random.nextInt(500);
        tx.discountFlag = random.nextDouble() < 0.1;
        return tx;
    }

    private void maybe(List<String> items, String item, double probability) {
        if (random.nextDouble() < probability) {
            items.add(item);
        }
    }

    private static void add(String id, double price, double margin, String category) {
        CATALOG.put(id, new Product(price, margin, category));
    }

    private static class Product {
        final double price;
        final double margin;
        final String category;

        Product(double price, double margin, String category) {
            this.price = price;
            this.margin = margin;
            this.category = category;
        }
    }
}
