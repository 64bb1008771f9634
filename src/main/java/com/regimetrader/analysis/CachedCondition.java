package com.regimetrader.analysis;

import com.regimetrader.domain.model.MarketCondition;
import java.time.Duration;
import java.time.Instant;

/**
 * Cache slot for a classification. Staleness is a pure function of the clock reading passed in;
 * nothing expires entries in the background.
 */
public record CachedCondition(MarketCondition value, Instant computedAt, Duration ttl) {

    public boolean isStale(Instant now) {
        return !now.isBefore(computedAt.plus(ttl));
    }
}
