package com.regimetrader.domain.model;

import com.regimetrader.domain.enums.CloseReason;
import com.regimetrader.domain.enums.PositionStatus;
import com.regimetrader.domain.enums.TradeDirection;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A position managed by the trade lifecycle manager.
 *
 * <p>Instances are mutable and owned exclusively by the lifecycle manager, which serializes
 * updates per position. Everything handed out to other components is a {@link #copy()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String instrument;
    private String strategyName;
    private TradeDirection direction;

    /** Planned entry before the fill, actual fill price afterwards. */
    private BigDecimal entryPrice;

    private BigDecimal size;
    private BigDecimal originalSize;
    private BigDecimal stopLoss;

    @Builder.Default
    private List<TakeProfitLevel> takeProfits = new ArrayList<>();

    private boolean trailingEnabled;
    private BigDecimal trailingActivationPrice;

    /** Trailing distance in price units. */
    private BigDecimal trailingDistance;

    /** Money lost if the stop is hit at the current size. */
    private BigDecimal riskAmount;

    private BigDecimal pipSize;
    private BigDecimal pipValuePerLot;

    private PositionStatus status;
    private Instant createdAt;
    private Instant openedAt;
    private Instant closedAt;
    private Instant ageingDeadline;
    private Instant reEvaluationDeadline;
    private boolean needsReEvaluation;

    private CloseReason closeReason;
    private BigDecimal exitPrice;

    /** Realized P&L accumulated across partial and final closes. */
    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    private boolean executionFatal;
    private String lastError;

    /** A close request (partial or full) is awaiting confirmation. */
    private boolean closeInFlight;

    public boolean isTerminal() {
        return status == PositionStatus.CLOSED;
    }

    /** Deep copy safe to hand out of the lifecycle manager. */
    public Position copy() {
        List<TakeProfitLevel> levels = new ArrayList<>();
        for (TakeProfitLevel level : takeProfits) {
            levels.add(level.toBuilder().build());
        }
        return toBuilder().takeProfits(levels).build();
    }
}
