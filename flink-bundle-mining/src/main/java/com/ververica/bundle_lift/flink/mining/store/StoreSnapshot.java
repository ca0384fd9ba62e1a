package com.ververica.bundle_lift.flink.mining.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ververica.bundle_lift.flink.mining.shared.model.Context;
import com.ververica.bundle_lift.flink.mining.shared.model.ContextualRule;
import com.ververica.bundle_lift.flink.mining.shared.model.UpliftResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized form of a rule store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoreSnapshot {

    public long savedAt;
    public List<ContextEntry> contexts = new ArrayList<>();
    public Map<String, UpliftResult> uplifts = new LinkedHashMap<>();
    public Map<String, UpliftResult> orphanedUplifts = new LinkedHashMap<>();

    public StoreSnapshot() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContextEntry {
        public Context context;
        public List<ContextualRule> rules = new ArrayList<>();

        public ContextEntry() {}

        public ContextEntry(Context context, List<ContextualRule> rules) {
            this.context = context;
            this.rules = new ArrayList<>(rules);
        }
    }
}
