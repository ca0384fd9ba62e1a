package com.ververica.bundle_lift.flink.mining.causal;

import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;

import java.util.Collections;
import java.util.List;

/**
 * Disjoint control and treatment groups of equal size, drawn from the
 * baskets that contain a rule's antecedent.
 */
public class TreatmentSplit {

    private final List<Transaction> eligible;
    private final List<Transaction> control;
    private final List<Transaction> treatment;

    public TreatmentSplit(List<Transaction> eligible, List<Transaction> control, List<Transaction> treatment) {
        this.eligible = eligible;
        this.control = control;
        this.treatment = treatment;
    }

    /** Every basket containing the antecedent, including one left out of an odd split. */
    public List<Transaction> getEligible() {
        return Collections.unmodifiableList(eligible);
    }

    public List<Transaction> getControl() {
        return Collections.unmodifiableList(control);
    }

    public List<Transaction> getTreatment() {
        return Collections.unmodifiableList(treatment);
    }

    public int smallerGroupSize() {
        return Math.min(control.size(), treatment.size());
    }
}
