package com.regimetrader.sizing;

import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.AccountTier;
import com.regimetrader.domain.model.Instrument;
import com.regimetrader.domain.model.TakeProfitLevel;
import com.regimetrader.strategy.StopLossSpec;
import com.regimetrader.strategy.TakeProfitSpec;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sizes entries by the maximum acceptable loss per trade.
 *
 * <p>Formula: lots = (equity * tier risk% * appetite multiplier) / (stopLossPips * pipValuePerLot).
 * For example, with 1000 equity on the mini tier (1.5%), a 15 pip stop and a pip value of 1,
 * the raw size is 1.0 lot, clamped to the tier's 0.05 maximum.
 *
 * <p>The size is clamped to [0, tier max lot] and rounded down to the instrument's lot step.
 * Anything below the minimum lot is untradeable. Spread gates run before sizing.
 */
@Service
public class PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(PositionSizer.class);

    private static final MathContext MC = MathContext.DECIMAL64;

    private final PositionSizingConfig positionSizingConfig;

    public PositionSizer(PositionSizingConfig positionSizingConfig) {
        this.positionSizingConfig = positionSizingConfig;
    }

    public SizingDecision size(SizingRequest request) {
        Instrument instrument = request.getInstrument();
        AccountTier tier = request.getTier();

        String spreadRejection = checkSpread(request);
        if (spreadRejection != null) {
            log.info("Sizing rejected for {}: {}", instrument.getSymbol(), spreadRejection);
            return SizingDecision.rejected(spreadRejection, tier);
        }

        double stopLossPips = stopLossPips(request);
        if (!Double.isFinite(stopLossPips) || stopLossPips <= 0) {
            return SizingDecision.rejected("UNTRADEABLE: invalid stop distance " + stopLossPips, tier);
        }
        if (request.getEquity() == null || request.getEquity().signum() <= 0) {
            return SizingDecision.rejected("UNTRADEABLE: no equity", tier);
        }

        BigDecimal stopPips = BigDecimal.valueOf(stopLossPips);
        BigDecimal riskBudget = request.getEquity()
                .multiply(tier.getRiskPercentPerTrade())
                .multiply(request.getRiskAppetite().getMultiplier());
        BigDecimal riskPerLot = stopPips.multiply(instrument.getPipValuePerLot());
        if (riskPerLot.signum() <= 0) {
            return SizingDecision.rejected("UNTRADEABLE: zero pip value", tier);
        }

        BigDecimal rawSize = riskBudget.divide(riskPerLot, MC);
        BigDecimal size = roundDownToStep(rawSize.min(tier.getMaxLotSize()).max(BigDecimal.ZERO), instrument.getLotStep());

        log.debug(
                "Sizing {}: budget {} / ({} pips * {}) = {} lots, clamped to {} ({} tier)",
                instrument.getSymbol(),
                riskBudget,
                stopPips,
                instrument.getPipValuePerLot(),
                rawSize,
                size,
                tier.getLabel());

        if (size.signum() <= 0 || size.compareTo(instrument.getMinLot()) < 0) {
            return SizingDecision.rejected("UNTRADEABLE: size " + size + " below minimum lot", tier);
        }

        BigDecimal entry = request.getEntryPrice();
        TradeDirection direction = request.getDirection();
        BigDecimal stopDistance = stopPips.multiply(instrument.getPipSize(), MC);
        BigDecimal stopLossPrice = offset(entry, direction, stopDistance.negate());

        SizingDecision.SizingDecisionBuilder decision = SizingDecision.builder()
                .tradeable(true)
                .size(size)
                .stopLossPips(stopLossPips)
                .stopLossPrice(stopLossPrice)
                .riskAmount(size.multiply(riskPerLot, MC))
                .tier(tier);

        TakeProfitSpec takeProfit = request.getRiskParams().takeProfit();
        if (takeProfit instanceof TakeProfitSpec.FixedRiskReward fixed) {
            decision.takeProfits(List.of(level(entry, direction, stopDistance, fixed.ratio(), BigDecimal.ONE)));
        } else if (takeProfit instanceof TakeProfitSpec.MultipleTargets targets) {
            BigDecimal tp1Fraction = BigDecimal.valueOf(targets.tp1Fraction());
            List<TakeProfitLevel> levels = new ArrayList<>();
            levels.add(level(entry, direction, stopDistance, targets.tp1Ratio(), tp1Fraction));
            levels.add(level(entry, direction, stopDistance, targets.tp2Ratio(), BigDecimal.ONE.subtract(tp1Fraction)));
            decision.takeProfits(levels);
        } else if (takeProfit instanceof TakeProfitSpec.Trailing trailing) {
            decision.takeProfits(List.of())
                    .trailing(true)
                    .trailingActivationPrice(offset(
                            entry, direction, stopDistance.multiply(BigDecimal.valueOf(trailing.activationRatio()))))
                    .trailingDistance(BigDecimal.valueOf(trailing.trailPips()).multiply(instrument.getPipSize()));
        }
        return decision.build();
    }

    // ========================
    // STOP DISTANCE
    // ========================

    double stopLossPips(SizingRequest request) {
        StopLossSpec spec = request.getRiskParams().stopLoss();
        double pipSize = request.getInstrument().getPipSize().doubleValue();
        if (spec instanceof StopLossSpec.FixedPips fixed) {
            return fixed.pips();
        }
        if (spec instanceof StopLossSpec.AtrMultiple atrMultiple) {
            double atr = request.getAtr();
            if (!(atr > 0) || !Double.isFinite(atr)) {
                return fallback(request, "ATR unavailable");
            }
            return atr * atrMultiple.multiplier() / pipSize;
        }
        if (spec instanceof StopLossSpec.StructureBuffer structure) {
            Double level = request.getStructureLevel();
            if (level == null || !Double.isFinite(level)) {
                return fallback(request, "no structure level");
            }
            double entry = request.getEntryPrice().doubleValue();
            double distance = request.getDirection() == TradeDirection.LONG ? entry - level : level - entry;
            if (distance <= 0) {
                return fallback(request, "structure level " + level + " on the wrong side of entry " + entry);
            }
            return distance / pipSize + structure.bufferPips();
        }
        return fallback(request, "unsupported stop type");
    }

    private double fallback(SizingRequest request, String reason) {
        double pips = positionSizingConfig.getDefaultStopLossPips();
        log.warn(
                "Stop-loss input missing for {} ({}), falling back to fixed {} pips",
                request.getInstrument().getSymbol(),
                reason,
                pips);
        return pips;
    }

    // ========================
    // SPREAD GATES
    // ========================

    private String checkSpread(SizingRequest request) {
        BigDecimal spread = request.getCurrentSpread();
        if (spread == null) {
            return null;
        }
        BigDecimal spreadPips = spread.divide(request.getInstrument().getPipSize(), MC);
        if (spreadPips.compareTo(BigDecimal.valueOf(request.getRiskParams().maxSpreadPips())) > 0) {
            return "SPREAD_TOO_WIDE: " + spreadPips.stripTrailingZeros().toPlainString() + " pips > "
                    + request.getRiskParams().maxSpreadPips();
        }
        BigDecimal average = request.getAverageSpread();
        if (average != null && average.signum() > 0) {
            BigDecimal limit = average.multiply(positionSizingConfig.getMaxSpreadMultiplier());
            if (spread.compareTo(limit) > 0) {
                return "SPREAD_TOO_WIDE: " + spread.toPlainString() + " > " + limit.round(MC).toPlainString()
                        + " (average x " + positionSizingConfig.getMaxSpreadMultiplier() + ")";
            }
        }
        return null;
    }

    // ========================
    // HELPERS
    // ========================

    private static BigDecimal roundDownToStep(BigDecimal size, BigDecimal step) {
        BigDecimal steps = size.divide(step, 0, RoundingMode.DOWN);
        return steps.multiply(step).setScale(step.scale(), RoundingMode.DOWN);
    }

    private static TakeProfitLevel level(
            BigDecimal entry, TradeDirection direction, BigDecimal stopDistance, double ratio, BigDecimal fraction) {
        return TakeProfitLevel.builder()
                .price(offset(entry, direction, stopDistance.multiply(BigDecimal.valueOf(ratio))))
                .fraction(fraction)
                .hit(false)
                .build();
    }

    /** Moves {@code distance} from entry in the direction's favour (negative moves against it). */
    private static BigDecimal offset(BigDecimal entry, TradeDirection direction, BigDecimal distance) {
        return entry.add(distance.multiply(BigDecimal.valueOf(direction.sign())), MC);
    }
}
