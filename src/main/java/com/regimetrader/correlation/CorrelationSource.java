package com.regimetrader.correlation;

/**
 * Where a correlation value came from.
 */
public enum CorrelationSource {
    /** Computed from return history. */
    MEASURED,
    /** No usable history; both instruments share a predefined group. */
    GROUP_ESTIMATE,
    /** Same instrument. */
    IDENTITY,
    /** No history and no shared group; treated as uncorrelated. */
    NONE
}
