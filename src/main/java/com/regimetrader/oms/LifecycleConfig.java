package com.regimetrader.oms;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Position lifecycle timing, bound from {@code regimetrader.lifecycle.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "regimetrader.lifecycle")
public class LifecycleConfig {

    /** Upper bound on a single open or close request. */
    private Duration orderTimeout = Duration.ofSeconds(10);

    /** Attempts per execution request, the first one included. */
    private int retryAttempts = 3;

    /** Delay before the first retry; doubles with every further attempt. */
    private Duration retryDelay = Duration.ofSeconds(1);

    /** Open positions older than this are closed with reason AGED. */
    private Duration positionAging = Duration.ofHours(2);

    private Duration reEvaluationInterval = Duration.ofMinutes(30);

    /** Move the stop to the entry price once the first partial target fills. */
    private boolean breakevenAfterFirstTarget = true;

    /** Closed positions kept in memory for the status feed. */
    private int recentClosedLimit = 100;

    public void validate() {
        if (retryAttempts < 1) {
            throw new IllegalStateException("regimetrader.lifecycle.retry-attempts must be at least 1");
        }
        if (orderTimeout.isZero() || orderTimeout.isNegative()) {
            throw new IllegalStateException("regimetrader.lifecycle.order-timeout must be positive");
        }
        if (retryDelay.isNegative()) {
            throw new IllegalStateException("regimetrader.lifecycle.retry-delay must not be negative");
        }
    }
}
