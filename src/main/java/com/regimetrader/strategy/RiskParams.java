package com.regimetrader.strategy;

/**
 * Per-strategy risk parameters.
 *
 * @param riskRewardRatio minimum reward multiple the strategy is configured for
 * @param maxSpreadPips   entries are refused when the current spread is wider than this
 */
public record RiskParams(StopLossSpec stopLoss, TakeProfitSpec takeProfit, double riskRewardRatio, double maxSpreadPips) {}
