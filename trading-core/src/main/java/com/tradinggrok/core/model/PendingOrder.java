package com.tradinggrok.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Objects;

/**
 * A submitted order awaiting resolution. The handle is null when the submission outcome is unknown
 * (the call timed out), in which case reconciliation resolves it from broker positions and open orders.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PendingOrder(OrderIntent intent, OrderHandle handle, Instant submittedAt) {
    public PendingOrder {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(submittedAt, "submittedAt");
    }

    @JsonIgnore
    public boolean isAcknowledged() {
        return handle != null;
    }

    @JsonIgnore
    public String symbol() {
        return intent.symbol();
    }
}
