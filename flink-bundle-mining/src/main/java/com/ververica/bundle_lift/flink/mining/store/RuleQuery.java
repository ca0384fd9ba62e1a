package com.ververica.bundle_lift.flink.mining.store;

import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;

/**
 * Filter over stored rules. Unset fields do not filter.
 *
 * Example:
 * <pre>{@code
 * RuleQuery.builder().storeId("S1").timeBin("morning").minOverallScore(0.5).limit(10).build()
 * }</pre>
 */
public final class RuleQuery {

    private static final RuleQuery ALL = new RuleQuery(new Builder());

    private final String storeId;
    private final String timeBin;
    private final Double minOverallScore;
    private final Double minLift;
    private final int limit;

    private RuleQuery(Builder builder) {
        this.storeId = builder.storeId;
        this.timeBin = builder.timeBin;
        this.minOverallScore = builder.minOverallScore;
        this.minLift = builder.minLift;
        this.limit = builder.limit;
    }

    public static RuleQuery all() {
        return ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(ContextualRule rule) {
        if (storeId != null && !storeId.equals(rule.getContext().getStoreId())) {
            return false;
        }
        if (timeBin != null && !timeBin.equals(rule.getContext().getTimeBin())) {
            return false;
        }
        if (minOverallScore != null
                && (rule.getOverallScore() == null || rule.getOverallScore() < minOverallScore)) {
            return false;
        }
        return minLift == null || rule.getLift() >= minLift;
    }

    public String getStoreId() {
        return storeId;
    }

    public String getTimeBin() {
        return timeBin;
    }

    public Double getMinOverallScore() {
        return minOverallScore;
    }

    public Double getMinLift() {
        return minLift;
    }

    /** Maximum number of results, 0 for no limit. */
    public int getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        return String.format("RuleQuery{store=%s, timeBin=%s, minScore=%s, minLift=%s, limit=%d}",
            storeId, timeBin, minOverallScore, minLift, limit);
    }

    public static class Builder {
        private String storeId;
        private String timeBin;
        private Double minOverallScore;
        private Double minLift;
        private int limit;

        public Builder storeId(String storeId) {
            this.storeId = storeId;
            return this;
        }

        public Builder timeBin(String timeBin) {
            this.timeBin = timeBin;
            return this;
        }

        public Builder minOverallScore(double minOverallScore) {
            this.minOverallScore = minOverallScore;
            return this;
        }

        public Builder minLift(double minLift) {
            this.minLift = minLift;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must be >= 0: " + limit);
            }
            this.limit = limit;
            return this;
        }

        public RuleQuery build() {
            return new RuleQuery(this);
        }
    }
}
