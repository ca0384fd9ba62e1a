package com.ververica.bundle_lift.flink.mining.shared.processor;

import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;

import java.io.Serializable;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Derives the context fields of a transaction from its timestamp.
 *
 * PATTERN: Enrichment
 * Ingestion normally delivers these columns pre-computed; this only fills
 * the ones that are missing and never overwrites a supplied value.
 *
 * <pre>
 * time_bin:        morning [06,11) | midday [11,14) | afternoon [14,18) | evening [18,22) | night
 * weekday_weekend: weekend on Saturday/Sunday, weekday otherwise
 * quarter:         calendar quarter 1..4
 * festival:        major festival window from the FestivalCalendar, if any
 * </pre>
 *
 * All derivations use UTC.
 */
public class ContextEnricher implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String WEEKDAY = "weekday";
    public static final String WEEKEND = "weekend";

    private final FestivalCalendar calendar;

    public ContextEnricher(FestivalCalendar calendar) {
        this.calendar = calendar;
    }

    public static ContextEnricher withDefaultCalendar() {
        return new ContextEnricher(FestivalCalendar.loadDefault());
    }

    public Transaction enrich(Transaction transaction) {
        ZonedDateTime time = Instant.ofEpochMilli(transaction.timestamp).atZone(ZoneOffset.UTC);

        if (transaction.timeBin == null) {
            transaction.timeBin = timeBin(time.getHour());
        }
        if (transaction.weekdayWeekend == null) {
            transaction.weekdayWeekend = isWeekend(time.getDayOfWeek()) ? WEEKEND : WEEKDAY;
        }
        if (transaction.quarter == null) {
            transaction.quarter = (time.getMonthValue() - 1) / 3 + 1;
        }
        if (transaction.festivalPeriod == null) {
            transaction.festivalPeriod = calendar.majorFestivalOn(time.toLocalDate()).orElse(null);
        }
        return transaction;
    }

    public static String timeBin(int hour) {
        if (hour >= 6 && hour < 11) {
            return "morning";
        } else if (hour >= 11 && hour < 14) {
            return "midday";
        } else if (hour >= 14 && hour < 18) {
            return "afternoon";
        } else if (hour >= 18 && hour < 22) {
            return "evening";
        }
        return "night";
    }

    static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
