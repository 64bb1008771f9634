package com.regimetrader.broker;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

/**
 * Order execution. Both operations are asynchronous; a future may also never complete, so every
 * caller composes it with a timeout.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@code SimulatorBrokerGateway}: in-memory fills at the current quote</li>
 * </ul>
 */
public interface ExecutionGateway {

    CompletableFuture<ExecutionResult> openPosition(OpenPositionRequest request);

    /**
     * Closes {@code size} lots of the position at market. Closing less than the open size is a
     * partial close.
     */
    CompletableFuture<ExecutionResult> closePosition(String positionId, BigDecimal size);
}
