package com.ververica.bundle_lift.flink.mining.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

/**
 * Causal uplift estimate for one ContextualRule, keyed by its rule id.
 *
 * controlRate and treatmentRate are the empirical outcome means of the two
 * simulated groups. incrementalAttachRate is the mean difference of the two
 * outcome models' predicted probabilities.
 *
 * Results flagged non-actionable (or with INSUFFICIENT_DATA) are still
 * stored for auditability.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpliftResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private String ruleId;
    private UpliftStatus status = UpliftStatus.NOT_ESTIMATED;
    private double incrementalAttachRate;
    private double incrementalRevenue;
    private double incrementalMargin;
    private double controlRate;
    private double treatmentRate;
    private int controlSize;
    private int treatmentSize;
    private double ciLower;
    private double ciUpper;
    private boolean actionable;

    public UpliftResult() {}

    /**
     * Result for a rule whose groups were too small to train on.
     */
    public static UpliftResult insufficientData(String ruleId, int controlSize, int treatmentSize) {
        UpliftResult result = new UpliftResult();
        result.ruleId = ruleId;
        result.status = UpliftStatus.INSUFFICIENT_DATA;
        result.controlSize = controlSize;
        result.treatmentSize = treatmentSize;
        result.actionable = false;
        return result;
    }

    public int getSampleSize() {
        return controlSize + treatmentSize;
    }

    // Getters and setters
    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public UpliftStatus getStatus() {
        return status;
    }

    public void setStatus(UpliftStatus status) {
        this.status = status;
    }

    public double getIncrementalAttachRate() {
        return incrementalAttachRate;
    }

    public void setIncrementalAttachRate(double incrementalAttachRate) {
        this.incrementalAttachRate = incrementalAttachRate;
    }

    public double getIncrementalRevenue() {
        return incrementalRevenue;
    }

    public void setIncrementalRevenue(double incrementalRevenue) {
        this.incrementalRevenue = incrementalRevenue;
    }

    public double getIncrementalMargin() {
        return incrementalMargin;
    }

    public void setIncrementalMargin(double incrementalMargin) {
        this.incrementalMargin = incrementalMargin;
    }

    public double getControlRate() {
        return controlRate;
    }

    public void setControlRate(double controlRate) {
        this.controlRate = controlRate;
    }

    public double getTreatmentRate() {
        return treatmentRate;
    }

    public void setTreatmentRate(double treatmentRate) {
        this.treatmentRate = treatmentRate;
    }

    public int getControlSize() {
        return controlSize;
    }

    public void setControlSize(int controlSize) {
        this.controlSize = controlSize;
    }

    public int getTreatmentSize() {
        return treatmentSize;
    }

    public void setTreatmentSize(int treatmentSize) {
        this.treatmentSize = treatmentSize;
    }

    public double getCiLower() {
        return ciLower;
    }

    public void setCiLower(double ciLower) {
        this.ciLower = ciLower;
    }

    public double getCiUpper() {
        return ciUpper;
    }

    public void setCiUpper(double ciUpper) {
        this.ciUpper = ciUpper;
    }

    public boolean isActionable() {
        return actionable;
    }

    public void setActionable(boolean actionable) {
        this.actionable = actionable;
    }

    @Override
    public String toString() {
        return String.format("UpliftResult{rule=%s, status=%s, uplift=%.4f, control=%.3f, treatment=%.3f, n=%d, actionable=%s}",
            ruleId, status, incrementalAttachRate, controlRate, treatmentRate, getSampleSize(), actionable);
    }
}
