package com.ververica.bundle_lift.flink.mining.shared.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * The transactions matching one emitted Context. Input element of the
 * per-context mining stage.
 */
public class ContextBucket implements Serializable {

    private static final long serialVersionUID = 1L;

    public Context context;
    public List<Transaction> transactions = new ArrayList<>();

    public ContextBucket() {}

    public ContextBucket(Context context, List<Transaction> transactions) {
        this.context = context;
        this.transactions = new ArrayList<>(transactions);
    }

    @Override
    public String toString() {
        return String.format("ContextBucket{context=%s, transactions=%d}",
            context, transactions.size());
    }
}
