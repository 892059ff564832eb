package com.tradinggrok.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Order as returned by the {@code /v2/orders} endpoints. Quantities arrive as decimal strings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlpacaOrder(
    @JsonProperty("id") String id,
    @JsonProperty("client_order_id") String clientOrderId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("side") String side,
    @JsonProperty("type") String type,
    @JsonProperty("qty") BigDecimal quantity,
    @JsonProperty("filled_qty") BigDecimal filledQuantity,
    @JsonProperty("filled_avg_price") BigDecimal filledAvgPrice,
    @JsonProperty("status") String status,
    @JsonProperty("submitted_at") Instant submittedAt,
    @JsonProperty("filled_at") Instant filledAt
) {}
