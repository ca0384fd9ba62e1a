package com.ververica.bundle_lift.flink.mining.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Constraint tuple used to partition transactions before mining.
 *
 * A null field means "unconstrained". Instances are immutable and compare
 * structurally, so they are safe map keys across a run.
 *
 * Example:
 * <pre>{@code
 * Context.overall()                                  // "Overall"
 * Context.overall().withStoreId("S1")                // "Store S1"
 * Context.overall().withStoreId("S1").withTimeBin("morning")  // "Store S1 + Morning"
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Context implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Context OVERALL = new Context(null, null, null, null, null);

    private final String storeId;
    private final String timeBin;
    private final String weekdayWeekend;
    private final Integer quarter;
    private final String festivalPeriod;

    @JsonCreator
    public Context(
            @JsonProperty("storeId") String storeId,
            @JsonProperty("timeBin") String timeBin,
            @JsonProperty("weekdayWeekend") String weekdayWeekend,
            @JsonProperty("quarter") Integer quarter,
            @JsonProperty("festivalPeriod") String festivalPeriod) {
        this.storeId = storeId;
        this.timeBin = timeBin;
        this.weekdayWeekend = weekdayWeekend;
        this.quarter = quarter;
        this.festivalPeriod = festivalPeriod;
    }

    public static Context overall() {
        return OVERALL;
    }

    public Context withStoreId(String storeId) {
        return new Context(storeId, timeBin, weekdayWeekend, quarter, festivalPeriod);
    }

    public Context withTimeBin(String timeBin) {
        return new Context(storeId, timeBin, weekdayWeekend, quarter, festivalPeriod);
    }

    public Context withWeekdayWeekend(String weekdayWeekend) {
        return new Context(storeId, timeBin, weekdayWeekend, quarter, festivalPeriod);
    }

    public Context withQuarter(Integer quarter) {
        return new Context(storeId, timeBin, weekdayWeekend, quarter, festivalPeriod);
    }

    public Context withFestivalPeriod(String festivalPeriod) {
        return new Context(storeId, timeBin, weekdayWeekend, quarter, festivalPeriod);
    }

    public String getStoreId() {
        return storeId;
    }

    public String getTimeBin() {
        return timeBin;
    }

    public String getWeekdayWeekend() {
        return weekdayWeekend;
    }

    public Integer getQuarter() {
        return quarter;
    }

    public String getFestivalPeriod() {
        return festivalPeriod;
    }

    /**
     * True when no field is constrained.
     */
    @JsonIgnore
    public boolean isOverall() {
        return dimensionCount() == 0;
    }

    public int dimensionCount() {
        int count = 0;
        if (storeId != null) count++;
        if (timeBin != null) count++;
        if (weekdayWeekend != null) count++;
        if (quarter != null) count++;
        if (festivalPeriod != null) count++;
        return count;
    }

    /**
     * Whether the transaction satisfies every constrained field.
     */
    public boolean matches(Transaction transaction) {
        return (storeId == null || storeId.equals(transaction.storeId))
            && (timeBin == null || timeBin.equals(transaction.timeBin))
            && (weekdayWeekend == null || weekdayWeekend.equals(transaction.weekdayWeekend))
            && (quarter == null || quarter.equals(transaction.quarter))
            && (festivalPeriod == null || festivalPeriod.equals(transaction.festivalPeriod));
    }

    /**
     * Stable machine key, used inside rule ids.
     */
    public String key() {
        if (isOverall()) {
            return "overall";
        }
        List<String> parts = new ArrayList<>();
        if (storeId != null) parts.add("store=" + storeId);
        if (timeBin != null) parts.add("time=" + timeBin);
        if (weekdayWeekend != null) parts.add("day=" + weekdayWeekend);
        if (quarter != null) parts.add("quarter=" + quarter);
        if (festivalPeriod != null) parts.add("festival=" + festivalPeriod);
        return String.join("|", parts);
    }

    /**
     * Human-readable label. The festival replaces the quarter when both are set.
     */
    public String label() {
        List<String> parts = new ArrayList<>();
        if (storeId != null) parts.add("Store " + storeId);
        if (festivalPeriod != null) parts.add(title(festivalPeriod));
        if (timeBin != null) parts.add(title(timeBin));
        if (weekdayWeekend != null) parts.add(title(weekdayWeekend));
        if (quarter != null && festivalPeriod == null) parts.add("Q" + quarter);
        return parts.isEmpty() ? "Overall" : String.join(" + ", parts);
    }

    private static String title(String value) {
        String[] words = value.replace('_', ' ').split(" ");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
              .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Context that = (Context) o;
        return Objects.equals(storeId, that.storeId) &&
               Objects.equals(timeBin, that.timeBin) &&
               Objects.equals(weekdayWeekend, that.weekdayWeekend) &&
               Objects.equals(quarter, that.quarter) &&
               Objects.equals(festivalPeriod, that.festivalPeriod);
    }

    @Override
    public int hashCode() {
        return Objects.hash(storeId, timeBin, weekdayWeekend, quarter, festivalPeriod);
    }

    @Override
    public String toString() {
        return label();
    }
}
