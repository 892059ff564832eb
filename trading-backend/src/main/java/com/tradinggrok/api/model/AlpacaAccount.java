package com.tradinggrok.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Subset of {@code GET /v2/account} the engine needs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlpacaAccount(
    @JsonProperty("status") String status,
    @JsonProperty("equity") BigDecimal equity,
    @JsonProperty("buying_power") BigDecimal buyingPower,
    @JsonProperty("cash") BigDecimal cash,
    @JsonProperty("trading_blocked") boolean tradingBlocked,
    @JsonProperty("pattern_day_trader") boolean patternDayTrader
) {}
