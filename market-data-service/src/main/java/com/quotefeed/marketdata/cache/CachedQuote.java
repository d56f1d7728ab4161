package com.quotefeed.marketdata.cache;

import com.quotefeed.common.model.CanonicalQuote;

import java.time.Instant;

/**
 * Last live quote for a symbol together with the time it was captured.
 */
public record CachedQuote(
    CanonicalQuote quote,
    Instant capturedAt
) {}
