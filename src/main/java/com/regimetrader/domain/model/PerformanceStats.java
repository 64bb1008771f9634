package com.regimetrader.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Aggregate results over a set of closed trades.
 *
 * <p>{@code profitFactor} is gross profit / gross loss; null when there are no losing trades.
 */
@Value
@Builder
public class PerformanceStats {

    int totalTrades;
    int winningTrades;
    int losingTrades;

    /** Percentage of trades with positive P&L. */
    BigDecimal winRate;

    BigDecimal totalPnl;
    BigDecimal averagePnl;
    BigDecimal grossProfit;
    BigDecimal grossLoss;
    BigDecimal profitFactor;
    BigDecimal largestWin;
    BigDecimal largestLoss;

    public static PerformanceStats of(List<ClosedTrade> trades) {
        int wins = 0;
        int losses = 0;
        BigDecimal grossProfit = BigDecimal.ZERO;
        BigDecimal grossLoss = BigDecimal.ZERO;
        BigDecimal largestWin = BigDecimal.ZERO;
        BigDecimal largestLoss = BigDecimal.ZERO;
        for (ClosedTrade trade : trades) {
            BigDecimal pnl = trade.getRealizedPnl() != null ? trade.getRealizedPnl() : BigDecimal.ZERO;
            if (pnl.signum() > 0) {
                wins++;
                grossProfit = grossProfit.add(pnl);
                largestWin = largestWin.max(pnl);
            } else if (pnl.signum() < 0) {
                losses++;
                grossLoss = grossLoss.add(pnl.negate());
                largestLoss = largestLoss.min(pnl);
            }
        }
        int total = trades.size();
        BigDecimal totalPnl = grossProfit.subtract(grossLoss);
        return PerformanceStats.builder()
                .totalTrades(total)
                .winningTrades(wins)
                .losingTrades(losses)
                .winRate(total == 0
                        ? BigDecimal.ZERO
                        : BigDecimal.valueOf(wins * 100L).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP))
                .totalPnl(totalPnl)
                .averagePnl(total == 0
                        ? BigDecimal.ZERO
                        : totalPnl.divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP))
                .grossProfit(grossProfit)
                .grossLoss(grossLoss)
                .profitFactor(grossLoss.signum() == 0 ? null : grossProfit.divide(grossLoss, 2, RoundingMode.HALF_UP))
                .largestWin(largestWin)
                .largestLoss(largestLoss)
                .build();
    }
}
