package com.regimetrader.analysis;

import com.regimetrader.domain.enums.InstrumentClass;
import com.regimetrader.domain.enums.LiquidityLevel;
import com.regimetrader.domain.enums.TrendState;
import com.regimetrader.domain.enums.VolatilityLevel;
import com.regimetrader.domain.model.Bar;
import com.regimetrader.domain.model.Instrument;
import com.regimetrader.domain.model.MarketCondition;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.adx.ADXIndicator;
import org.ta4j.core.indicators.adx.MinusDIIndicator;
import org.ta4j.core.indicators.adx.PlusDIIndicator;

/**
 * Classifies the regime of one instrument from a window of recent bars.
 *
 * <p>Trend comes from ADX and the directional indicators; below the strength threshold the
 * Choppiness Index separates choppy from ranging markets. Volatility is ATR relative to price.
 * Liquidity compares recent volume and spread against the whole window. The four sub-scores
 * (trend, volatility, liquidity, price action) are combined with the configured weights into a
 * confidence in [0, 100]; below {@code minTradingConfidence} the trend is reported as UNKNOWN.
 *
 * <p>Classification never throws. Short, null or malformed windows, and any indicator failure,
 * produce a degraded UNKNOWN condition with zero confidence which is not cached.
 */
@Service
public class MarketConditionClassifier {

    private static final Logger log = LoggerFactory.getLogger(MarketConditionClassifier.class);

    private final ClassifierConfig config;
    private final Clock clock;
    private final Map<String, CachedCondition> cache = new ConcurrentHashMap<>();

    public MarketConditionClassifier(ClassifierConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @PostConstruct
    void validateConfig() {
        config.validate();
    }

    /**
     * Returns the cached condition for the instrument while fresh, otherwise classifies the
     * given window and caches the result.
     */
    public MarketCondition classify(Instrument instrument, List<Bar> bars) {
        Instant now = clock.instant();
        CachedCondition cached = cache.get(instrument.getSymbol());
        if (cached != null && !cached.isStale(now)) {
            return cached.value();
        }

        MarketCondition condition = evaluate(instrument, bars, now);
        if (condition.isDegraded()) {
            log.warn(
                    "Classification degraded for {}: {}",
                    instrument.getSymbol(),
                    condition.getDegradationReason());
        } else {
            cache.put(instrument.getSymbol(), new CachedCondition(condition, now, config.getCacheExpiry()));
        }
        return condition;
    }

    /** Latest cached classification regardless of staleness, for status reporting. */
    public Optional<MarketCondition> getLatest(String symbol) {
        CachedCondition cached = cache.get(symbol);
        return cached != null ? Optional.of(cached.value()) : Optional.empty();
    }

    public void invalidate(String symbol) {
        cache.remove(symbol);
    }

    /** Classifies without touching the cache. */
    public MarketCondition evaluate(Instrument instrument, List<Bar> bars, Instant now) {
        String symbol = instrument.getSymbol();
        String problem = validateWindow(bars);
        if (problem != null) {
            return MarketCondition.unknown(symbol, now, problem);
        }
        try {
            return compute(instrument, bars.subList(bars.size() - config.getTrendLookback(), bars.size()), now);
        } catch (RuntimeException e) {
            log.error("Indicator computation failed for {}", symbol, e);
            return MarketCondition.unknown(symbol, now, "indicator failure: " + e.getMessage());
        }
    }

    private String validateWindow(List<Bar> bars) {
        if (bars == null) {
            return "no bars";
        }
        if (bars.size() < config.getTrendLookback()) {
            return String.format("insufficient data: %d of %d bars", bars.size(), config.getTrendLookback());
        }
        Instant previous = null;
        for (int i = bars.size() - config.getTrendLookback(); i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null || !bar.isWellFormed()) {
                return "malformed bar at index " + i;
            }
            if (bar.getOpenTime() == null || (previous != null && !bar.getOpenTime().isAfter(previous))) {
                return "bar times not strictly increasing at index " + i;
            }
            previous = bar.getOpenTime();
        }
        return null;
    }

    private MarketCondition compute(Instrument instrument, List<Bar> window, Instant now) {
        List<Bar> recent = window.subList(window.size() - config.getVolatilityWindow(), window.size());
        BarSeries series = BarSeriesFactory.toSeries(instrument.getSymbol(), window);
        int end = series.getEndIndex();

        // Trend
        double trendStrength = finiteOrZero(new ADXIndicator(series, config.getAdxPeriod()).getValue(end).doubleValue())
                / 100.0;
        double plusDi = finiteOrZero(new PlusDIIndicator(series, config.getAdxPeriod()).getValue(end).doubleValue());
        double minusDi = finiteOrZero(new MinusDIIndicator(series, config.getAdxPeriod()).getValue(end).doubleValue());
        TrendState trend;
        if (trendStrength >= config.getTrendStrengthThreshold()) {
            trend = plusDi > minusDi ? TrendState.BULLISH : TrendState.BEARISH;
        } else {
            trend = choppiness(recent) > config.getChoppinessThreshold() ? TrendState.CHOPPY : TrendState.RANGING;
        }

        // Volatility
        double meanClose = recent.stream().mapToDouble(Bar::getClose).average().orElse(0.0);
        double atr = finiteOrZero(new ATRIndicator(series, config.getVolatilityWindow()).getValue(end).doubleValue());
        double atrPercent = meanClose > 0 ? atr / meanClose : 0.0;
        VolatilityLevel volatility = classifyVolatility(atrPercent, instrument.getInstrumentClass());

        // Liquidity
        double liquidityScore = liquidityScore(window, recent, instrument.getSymbol());
        LiquidityLevel liquidity = liquidityScore < config.getLiquidityThreshold()
                ? LiquidityLevel.LOW
                : liquidityScore < 1.0 ? LiquidityLevel.MEDIUM : LiquidityLevel.HIGH;

        double priceAction = priceActionScore(window, trend);

        ClassifierConfig.ConditionWeighting weights = config.getConditionWeighting();
        double confidence = 100.0
                * (weights.getTrend() * trendScore(trend, trendStrength)
                        + weights.getVolatility() * volatilityLevelScore(volatility)
                        + weights.getLiquidity() * liquidityLevelScore(liquidity)
                        + weights.getPriceAction() * priceAction);
        confidence = Double.isFinite(confidence) ? Math.max(0.0, Math.min(100.0, confidence)) : 0.0;

        TrendState reported = confidence < config.getMinTradingConfidence() ? TrendState.UNKNOWN : trend;
        log.debug(
                "Classified {}: trend={} (raw {}), adx={}, volatility={} ({}), liquidity={} ({}), confidence={}",
                instrument.getSymbol(),
                reported,
                trend,
                String.format("%.3f", trendStrength),
                volatility,
                String.format("%.5f", atrPercent),
                liquidity,
                String.format("%.2f", liquidityScore),
                String.format("%.1f", confidence));

        return MarketCondition.builder()
                .instrument(instrument.getSymbol())
                .trend(reported)
                .volatility(volatility)
                .liquidity(liquidity)
                .confidence(confidence)
                .computedAt(now)
                .trendStrength(trendStrength)
                .atrPercent(atrPercent)
                .atr(atr)
                .liquidityScore(liquidityScore)
                .degraded(false)
                .build();
    }

    // ========================
    // SUB-MEASURES
    // ========================

    /**
     * Choppiness Index over the bars: 100 * log10(sum of true ranges / overall range) / log10(n).
     * A flat window (zero overall range) counts as fully choppy.
     */
    static double choppiness(List<Bar> bars) {
        double trueRangeSum = 0.0;
        double highest = Double.NEGATIVE_INFINITY;
        double lowest = Double.POSITIVE_INFINITY;
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            double trueRange = bar.range();
            if (i > 0) {
                double prevClose = bars.get(i - 1).getClose();
                trueRange = Math.max(trueRange,
                        Math.max(Math.abs(bar.getHigh() - prevClose), Math.abs(bar.getLow() - prevClose)));
            }
            trueRangeSum += trueRange;
            highest = Math.max(highest, bar.getHigh());
            lowest = Math.min(lowest, bar.getLow());
        }
        double range = highest - lowest;
        if (range <= 0 || trueRangeSum <= 0 || bars.size() < 2) {
            return 100.0;
        }
        return 100.0 * Math.log10(trueRangeSum / range) / Math.log10(bars.size());
    }

    private VolatilityLevel classifyVolatility(double atrPercent, InstrumentClass instrumentClass) {
        double scale = instrumentClass != null && instrumentClass.isSynthetic()
                ? config.getSyntheticVolatilityMultiplier()
                : 1.0;
        if (atrPercent < config.getVolatilityLow() * scale) {
            return VolatilityLevel.LOW;
        }
        if (atrPercent < config.getVolatilityMedium() * scale) {
            return VolatilityLevel.MEDIUM;
        }
        return VolatilityLevel.HIGH;
    }

    /**
     * Mean of the recent-vs-baseline volume ratio and the baseline-vs-recent spread ratio, using
     * whichever the feed provides. Without either, liquidity is assumed average.
     */
    private double liquidityScore(List<Bar> window, List<Bar> recent, String symbol) {
        double baselineVolume = window.stream().mapToDouble(Bar::getVolume).average().orElse(0.0);
        double recentVolume = recent.stream().mapToDouble(Bar::getVolume).average().orElse(0.0);
        double baselineSpread = window.stream().mapToDouble(Bar::getSpread).average().orElse(0.0);
        double recentSpread = recent.stream().mapToDouble(Bar::getSpread).average().orElse(0.0);

        double total = 0.0;
        int parts = 0;
        if (baselineVolume > 0) {
            total += recentVolume / baselineVolume;
            parts++;
        }
        if (baselineSpread > 0 && recentSpread > 0) {
            total += baselineSpread / recentSpread;
            parts++;
        }
        if (parts == 0) {
            log.debug("No volume or spread data for {}, assuming medium liquidity", symbol);
            return config.getLiquidityThreshold() + (1.0 - config.getLiquidityThreshold()) / 2.0;
        }
        return total / parts;
    }

    /**
     * Candle strength is body / range in [-1, 1]. In a trend, strong candles in the trend's direction
     * support the call; in a range, indecisive candles do.
     */
    private double priceActionScore(List<Bar> window, TrendState trend) {
        List<Bar> last = window.subList(window.size() - config.getPriceActionBars(), window.size());
        double sum = 0.0;
        for (Bar bar : last) {
            double strength = bar.range() > 0 ? (bar.getClose() - bar.getOpen()) / bar.range() : 0.0;
            switch (trend) {
                case BULLISH -> sum += Math.max(0.0, strength);
                case BEARISH -> sum += Math.max(0.0, -strength);
                default -> sum += 1.0 - Math.abs(strength);
            }
        }
        return sum / last.size();
    }

    private static double trendScore(TrendState trend, double trendStrength) {
        return switch (trend) {
            case BULLISH, BEARISH -> Math.min(1.0, 0.6 + trendStrength);
            case RANGING -> 0.6;
            case CHOPPY -> 0.2;
            case UNKNOWN -> 0.0;
        };
    }

    private static double volatilityLevelScore(VolatilityLevel volatility) {
        return switch (volatility) {
            case MEDIUM -> 1.0;
            case LOW -> 0.7;
            case HIGH -> 0.5;
            case UNKNOWN -> 0.0;
        };
    }

    private static double liquidityLevelScore(LiquidityLevel liquidity) {
        return switch (liquidity) {
            case HIGH -> 1.0;
            case MEDIUM -> 0.7;
            case LOW -> 0.3;
            case UNKNOWN -> 0.0;
        };
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
