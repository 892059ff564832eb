package com.tradinggrok.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * One entry of {@code GET /v2/calendar}: a regular session in New York time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlpacaCalendarDay(
    @JsonProperty("date") LocalDate date,
    @JsonProperty("open") LocalTime open,
    @JsonProperty("close") LocalTime close
) {}
