package com.ververica.bundle_lift.flink.mining.score;

import com.ververica.bundle_lift.flink.mining.shared.model.LineItem;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves the margin fraction of an item line.
 * Order: the line's own margin, then its category default, then the global default.
 */
public class MarginResolver implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double defaultMarginPct;
    private final HashMap<String, Double> categoryMargins;

    public MarginResolver(double defaultMarginPct, Map<String, Double> categoryMargins) {
        this.defaultMarginPct = defaultMarginPct;
        this.categoryMargins = new HashMap<>(categoryMargins);
    }

    public double resolve(LineItem item) {
        if (item.marginPct != null) {
            return item.marginPct;
        }
        if (item.category != null) {
            Double categoryMargin = categoryMargins.get(item.category);
            if (categoryMargin != null) {
                return categoryMargin;
            }
        }
        return defaultMarginPct;
    }

    public double getDefaultMarginPct() {
        return defaultMarginPct;
    }
}
