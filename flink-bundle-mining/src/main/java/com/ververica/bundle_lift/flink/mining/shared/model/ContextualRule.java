package com.ververica.bundle_lift.flink.mining.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Association rule mined within one context.
 * Format: {antecedent} => {consequent} @ context
 * Example: {bread, butter} => {milk} @ Store S1 + Morning, confidence 0.8
 *
 * Identity is (antecedent, consequent, context). Item lists are kept sorted
 * so the identity and the rule id are independent of mining order.
 *
 * profitScore, diversityScore and overallScore stay null until the context's
 * rule set has been scored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContextualRule implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<String> antecedent;   // IF
    private List<String> consequent;   // THEN
    private double support;            // P(antecedent AND consequent)
    private double confidence;         // P(consequent | antecedent)
    private double lift;               // confidence / P(consequent)
    private Context context;

    private Double profitScore;
    private Double diversityScore;
    private Double overallScore;

    public ContextualRule() {
        this.antecedent = new ArrayList<>();
        this.consequent = new ArrayList<>();
        this.context = Context.overall();
    }

    public ContextualRule(Collection<String> antecedent, Collection<String> consequent,
                          double support, double confidence, double lift, Context context) {
        this.antecedent = sorted(antecedent);
        this.consequent = sorted(consequent);
        this.support = support;
        this.confidence = confidence;
        this.lift = lift;
        this.context = Objects.requireNonNull(context, "context");
        validate();
    }

    /**
     * Checks the rule invariants.
     *
     * @throws IllegalArgumentException if a side is empty, the sides overlap,
     *         or a metric is out of range
     */
    public void validate() {
        if (antecedent == null || antecedent.isEmpty()) {
            throw new IllegalArgumentException("Antecedent must not be empty");
        }
        if (consequent == null || consequent.isEmpty()) {
            throw new IllegalArgumentException("Consequent must not be empty");
        }
        if (!Collections.disjoint(antecedent, consequent)) {
            throw new IllegalArgumentException(
                "Antecedent and consequent overlap: " + antecedent + " / " + consequent);
        }
        if (support < 0.0 || support > 1.0 || Double.isNaN(support)) {
            throw new IllegalArgumentException("Support out of [0,1]: " + support);
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence out of [0,1]: " + confidence);
        }
        if (lift < 0.0 || Double.isNaN(lift)) {
            throw new IllegalArgumentException("Lift must be >= 0: " + lift);
        }
    }

    // null reads as empty so validate() reports it
    private static List<String> sorted(Collection<String> items) {
        TreeSet<String> unique = new TreeSet<>();
        if (items != null) {
            items.stream().filter(Objects::nonNull).forEach(unique::add);
        }
        return new ArrayList<>(unique);
    }

    /**
     * Stable identifier: "a,b=>c@store=S1|time=morning".
     */
    @JsonIgnore
    public String getRuleId() {
        return String.join(",", antecedent) + "=>" + String.join(",", consequent) + "@" + context.key();
    }

    /**
     * Antecedent ∪ consequent.
     */
    public Set<String> items() {
        Set<String> items = new TreeSet<>(antecedent);
        items.addAll(consequent);
        return items;
    }

    // Getters and setters
    public List<String> getAntecedent() {
        return antecedent;
    }

    public void setAntecedent(List<String> antecedent) {
        this.antecedent = sorted(antecedent);
    }

    public List<String> getConsequent() {
        return consequent;
    }

    public void setConsequent(List<String> consequent) {
        this.consequent = sorted(consequent);
    }

    public double getSupport() {
        return support;
    }

    public void setSupport(double support) {
        this.support = support;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public double getLift() {
        return lift;
    }

    public void setLift(double lift) {
        this.lift = lift;
    }

    public Context getContext() {
        return context;
    }

    public void setContext(Context context) {
        this.context = context;
    }

    public Double getProfitScore() {
        return profitScore;
    }

    public void setProfitScore(Double profitScore) {
        this.profitScore = profitScore;
    }

    public Double getDiversityScore() {
        return diversityScore;
    }

    public void setDiversityScore(Double diversityScore) {
        this.diversityScore = diversityScore;
    }

    public Double getOverallScore() {
        return overallScore;
    }

    public void setOverallScore(Double overallScore) {
        this.overallScore = overallScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContextualRule that = (ContextualRule) o;
        return Objects.equals(antecedent, that.antecedent) &&
               Objects.equals(consequent, that.consequent) &&
               Objects.equals(context, that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(antecedent, consequent, context);
    }

    @Override
    public String toString() {
        return String.format("%s => %s [%s] (sup=%.3f, conf=%.3f, lift=%.3f, score=%s)",
            antecedent, consequent, context.label(), support, confidence, lift, overallScore);
    }
}
