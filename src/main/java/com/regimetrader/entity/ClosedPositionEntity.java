package com.regimetrader.entity;

import com.regimetrader.domain.enums.CloseReason;
import com.regimetrader.domain.enums.TradeDirection;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the closed_positions table.
 * One row per position that reached CLOSED after a fill; the source for performance figures.
 */
@Entity
@Table(
        name = "closed_positions",
        indexes = {
            @Index(name = "idx_closed_positions_strategy", columnList = "strategy_name"),
            @Index(name = "idx_closed_positions_closed_at", columnList = "closed_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClosedPositionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 30, nullable = false)
    private String instrument;

    @Column(name = "strategy_name", length = 60)
    private String strategyName;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeDirection direction;

    @Column(name = "entry_price", precision = 20, scale = 8)
    private BigDecimal entryPrice;

    @Column(name = "exit_price", precision = 20, scale = 8)
    private BigDecimal exitPrice;

    /** Original size; partial closes are folded into realized P&L. */
    @Column(precision = 12, scale = 4)
    private BigDecimal size;

    @Column(name = "realized_pnl", precision = 15, scale = 2)
    private BigDecimal realizedPnl;

    @Column(name = "risk_amount", precision = 15, scale = 2)
    private BigDecimal riskAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "close_reason", columnDefinition = "varchar(20)")
    private CloseReason closeReason;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "closed_at")
    private Instant closedAt;
}
