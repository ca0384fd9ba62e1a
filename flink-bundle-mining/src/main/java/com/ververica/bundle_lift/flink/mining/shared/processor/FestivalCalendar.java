package com.ververica.bundle_lift.flink.mining.shared.processor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Annual festival windows (month/day ranges) used to tag transactions with a
 * festival period. Only festivals flagged as major produce a context.
 *
 * The default calendar is the {@code festival-windows.json} classpath resource.
 * Dates are approximate; lunar festivals shift every year.
 */
public class FestivalCalendar implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_RESOURCE = "/festival-windows.json";

    private final List<Festival> festivals;

    public FestivalCalendar(List<Festival> festivals) {
        this.festivals = new ArrayList<>(festivals);
    }

    public static FestivalCalendar empty() {
        return new FestivalCalendar(new ArrayList<>());
    }

    public static FestivalCalendar loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    public static FestivalCalendar load(String resource) {
        try (InputStream in = FestivalCalendar.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Festival calendar resource not found: " + resource);
            }
            Festival[] festivals = new ObjectMapper().readValue(in, Festival[].class);
            return new FestivalCalendar(Arrays.asList(festivals));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read festival calendar " + resource, e);
        }
    }

    /**
     * The major festival whose window contains the date. The first festival
     * in calendar order wins; a non-major first match yields empty.
     */
    public Optional<String> majorFestivalOn(LocalDate date) {
        for (Festival festival : festivals) {
            if (festival.contains(date)) {
                return festival.major ? Optional.of(festival.name) : Optional.empty();
            }
        }
        return Optional.empty();
    }

    public List<Festival> getFestivals() {
        return new ArrayList<>(festivals);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Festival implements Serializable {

        private static final long serialVersionUID = 1L;

        public String name;
        public boolean major;
        public List<Window> windows = new ArrayList<>();

        public Festival() {}

        public Festival(String name, boolean major, List<Window> windows) {
            this.name = name;
            this.major = major;
            this.windows = new ArrayList<>(windows);
        }

        boolean contains(LocalDate date) {
            for (Window window : windows) {
                if (window.contains(date)) {
                    return true;
                }
            }
            return false;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Window implements Serializable {

        private static final long serialVersionUID = 1L;

        public int month;
        public int startDay;
        public int endDay;

        public Window() {}

        public Window(int month, int startDay, int endDay) {
            this.month = month;
            this.startDay = startDay;
            this.endDay = endDay;
        }

        boolean contains(LocalDate date) {
            return date.getMonthValue() == month
                && date.getDayOfMonth() >= startDay
                && date.getDayOfMonth() <= endDay;
        }
    }
}
