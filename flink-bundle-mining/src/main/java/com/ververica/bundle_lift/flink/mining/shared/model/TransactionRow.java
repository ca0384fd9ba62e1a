package com.ververica.bundle_lift.flink.mining.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One item-level row of the transaction table handed over by ingestion.
 *
 * Required: transaction_id, timestamp, store_id, item_id, price.
 * Optional: quantity, margin_pct, category, discount_flag, customer_id_hash
 * and the pre-computed context columns.
 *
 * The timestamp is either epoch millis or an ISO-8601 date-time string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransactionRow implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonProperty("transaction_id")
    public String transactionId;

    @JsonProperty("timestamp")
    public String timestamp;

    @JsonProperty("store_id")
    public String storeId;

    @JsonProperty("item_id")
    public String itemId;

    @JsonProperty("price")
    public Double price;

    @JsonProperty("quantity")
    public Integer quantity;

    @JsonProperty("margin_pct")
    public Double marginPct;

    @JsonProperty("category")
    public String category;

    @JsonProperty("discount_flag")
    public Boolean discountFlag;

    @JsonProperty("customer_id_hash")
    public String customerIdHash;

    @JsonProperty("context_time_bin")
    public String timeBin;

    @JsonProperty("context_weekday_weekend")
    public String weekdayWeekend;

    @JsonProperty("context_quarter")
    public Integer quarter;

    @JsonProperty("context_festival")
    public String festival;

    public TransactionRow() {}

    @Override
    public String toString() {
        return String.format("TransactionRow{tx=%s, store=%s, item=%s, price=%s}",
            transactionId, storeId, itemId, price);
    }
}
