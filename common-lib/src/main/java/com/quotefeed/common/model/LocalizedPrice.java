package com.quotefeed.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Presentation-only restatement of a quote in a local unit and currency
 * (e.g. USD per troy ounce → INR per 10 grams). Never replaces the canonical price.
 */
public record LocalizedPrice(
    @JsonProperty("price")       BigDecimal price,
    @JsonProperty("currency")    String     currency,
    @JsonProperty("unit")        String     unit,
    @JsonProperty("displayName") String     displayName,
    @JsonProperty("formatted")   String     formatted
) {}
