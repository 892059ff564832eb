package com.tradinggrok.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Open position as returned by {@code GET /v2/positions}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlpacaPosition(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("qty") BigDecimal quantity,
    @JsonProperty("side") String side,
    @JsonProperty("avg_entry_price") BigDecimal avgEntryPrice,
    @JsonProperty("current_price") BigDecimal currentPrice,
    @JsonProperty("market_value") BigDecimal marketValue,
    @JsonProperty("unrealized_pl") BigDecimal unrealizedPL
) {}
