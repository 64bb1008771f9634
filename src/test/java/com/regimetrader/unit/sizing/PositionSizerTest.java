package com.regimetrader.unit.sizing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.regimetrader.domain.enums.RiskAppetite;
import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.AccountTier;
import com.regimetrader.domain.model.Instrument;
import com.regimetrader.domain.model.TakeProfitLevel;
import com.regimetrader.sizing.AccountTierTable;
import com.regimetrader.sizing.PositionSizer;
import com.regimetrader.sizing.PositionSizingConfig;
import com.regimetrader.sizing.SizingDecision;
import com.regimetrader.sizing.SizingRequest;
import com.regimetrader.strategy.RiskParams;
import com.regimetrader.strategy.StopLossSpec;
import com.regimetrader.strategy.TakeProfitSpec;
import com.regimetrader.unit.TestBars;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PositionSizerTest {

    private static final AccountTierTable TIERS = AccountTierTable.defaults();

    private PositionSizer positionSizer;

    @BeforeEach
    void setUp() {
        positionSizer = new PositionSizer(new PositionSizingConfig());
    }

    private static RiskParams fixedStop(double pips) {
        return new RiskParams(new StopLossSpec.FixedPips(pips), new TakeProfitSpec.FixedRiskReward(2.0), 2.0, 5.0);
    }

    private static SizingRequest.SizingRequestBuilder request(String equity, RiskParams params) {
        BigDecimal balance = new BigDecimal(equity);
        return SizingRequest.builder()
                .instrument(TestBars.eurusd())
                .equity(balance)
                .tier(TIERS.tierFor(balance))
                .riskParams(params)
                .direction(TradeDirection.LONG)
                .entryPrice(new BigDecimal("1.1000"));
    }

    @Nested
    @DisplayName("Lot size")
    class LotSize {

        @Test
        @DisplayName("mini tier clamps to its 0.05 lot maximum")
        void miniTierClamped() {
            Instrument onePipValue = Instrument.builder()
                    .symbol("EURUSD")
                    .pipSize(new BigDecimal("0.0001"))
                    .pipValuePerLot(BigDecimal.ONE)
                    .build();

            SizingDecision decision = positionSizer.size(request("1000", fixedStop(15))
                    .instrument(onePipValue)
                    .build());

            assertThat(decision.isTradeable()).isTrue();
            assertThat(decision.getTier().getLabel()).isEqualTo("mini");
            assertThat(decision.getSize()).isEqualByComparingTo("0.05");
        }

        @Test
        @DisplayName("standard tier risks 1% of equity")
        void standardTierUnclamped() {
            SizingDecision decision = positionSizer.size(request("5000", fixedStop(50)).build());

            assertThat(decision.getSize()).isEqualByComparingTo("0.10");
            assertThat(decision.getRiskAmount()).isEqualByComparingTo("50");
            assertThat(decision.getStopLossPrice()).isEqualByComparingTo("1.0950");
        }

        @Test
        @DisplayName("risk appetite scales the budget")
        void appetiteScales() {
            SizingDecision high = positionSizer.size(request("5000", fixedStop(50))
                    .riskAppetite(RiskAppetite.HIGH)
                    .build());
            SizingDecision low = positionSizer.size(request("5000", fixedStop(50))
                    .riskAppetite(RiskAppetite.LOW)
                    .build());

            assertThat(high.getSize()).isEqualByComparingTo("0.15");
            assertThat(low.getSize()).isEqualByComparingTo("0.05");
        }

        @Test
        @DisplayName("synthetic index rounds down to its 0.001 lot step")
        void syntheticLotStep() {
            SizingDecision decision = positionSizer.size(request("5000", fixedStop(700))
                    .instrument(TestBars.synthetic("Volatility 75 Index"))
                    .entryPrice(new BigDecimal("350000.00"))
                    .build());

            // 50 / (700 * 1) = 0.0714...
            assertThat(decision.getSize()).isEqualByComparingTo("0.071");
        }

        @Test
        @DisplayName("a huge stop gives an untradeable zero size rather than NaN")
        void hugeStopUntradeable() {
            SizingDecision decision = positionSizer.size(request("1000", fixedStop(1e12)).build());

            assertThat(decision.isTradeable()).isFalse();
            assertThat(decision.getSize()).isEqualByComparingTo("0");
            assertThat(decision.getRejectionReason()).startsWith("UNTRADEABLE");
        }

        @Test
        @DisplayName("no equity is untradeable")
        void noEquity() {
            SizingDecision decision = positionSizer.size(request("0", fixedStop(15)).build());

            assertThat(decision.isTradeable()).isFalse();
            assertThat(decision.getRejectionReason()).contains("no equity");
        }
    }

    @Nested
    @DisplayName("Stop distance")
    class StopDistance {

        @Test
        @DisplayName("ATR multiple converts price distance to pips")
        void atrMultiple() {
            RiskParams params = new RiskParams(
                    new StopLossSpec.AtrMultiple(1.5), new TakeProfitSpec.FixedRiskReward(2.0), 2.0, 5.0);

            SizingDecision decision =
                    positionSizer.size(request("5000", params).atr(0.0020).build());

            assertThat(decision.getStopLossPips()).isCloseTo(30.0, within(1e-9));
        }

        @Test
        @DisplayName("missing ATR falls back to the default stop")
        void atrFallback() {
            RiskParams params = new RiskParams(
                    new StopLossSpec.AtrMultiple(1.5), new TakeProfitSpec.FixedRiskReward(2.0), 2.0, 5.0);

            SizingDecision decision = positionSizer.size(request("5000", params).atr(0).build());

            assertThat(decision.isTradeable()).isTrue();
            assertThat(decision.getStopLossPips()).isEqualTo(15.0);
        }

        @Test
        @DisplayName("structure stop adds the buffer beyond the level")
        void structureBuffer() {
            RiskParams params = new RiskParams(
                    new StopLossSpec.StructureBuffer(2), new TakeProfitSpec.FixedRiskReward(2.0), 2.0, 5.0);

            SizingDecision decision =
                    positionSizer.size(request("5000", params).structureLevel(1.0980).build());

            assertThat(decision.getStopLossPips()).isCloseTo(22.0, within(1e-6));
        }

        @Test
        @DisplayName("structure level on the wrong side falls back to the default stop")
        void structureWrongSide() {
            RiskParams params = new RiskParams(
                    new StopLossSpec.StructureBuffer(2), new TakeProfitSpec.FixedRiskReward(2.0), 2.0, 5.0);

            SizingDecision decision =
                    positionSizer.size(request("5000", params).structureLevel(1.1050).build());

            assertThat(decision.getStopLossPips()).isEqualTo(15.0);
        }
    }

    @Nested
    @DisplayName("Spread gates")
    class SpreadGates {

        @Test
        @DisplayName("spread wider than the strategy maximum is rejected")
        void absoluteSpread() {
            SizingDecision decision = positionSizer.size(request("5000", fixedStop(50))
                    .currentSpread(new BigDecimal("0.0008"))
                    .build());

            assertThat(decision.isTradeable()).isFalse();
            assertThat(decision.getRejectionReason()).startsWith("SPREAD_TOO_WIDE");
        }

        @Test
        @DisplayName("spread above 1.5x the average is rejected")
        void relativeSpread() {
            SizingDecision decision = positionSizer.size(request("5000", fixedStop(50))
                    .currentSpread(new BigDecimal("0.0002"))
                    .averageSpread(new BigDecimal("0.0001"))
                    .build());

            assertThat(decision.isTradeable()).isFalse();
            assertThat(decision.getRejectionReason()).contains("average x 1.5");
        }

        @Test
        @DisplayName("normal spread passes")
        void normalSpread() {
            SizingDecision decision = positionSizer.size(request("5000", fixedStop(50))
                    .currentSpread(new BigDecimal("0.0001"))
                    .averageSpread(new BigDecimal("0.0001"))
                    .build());

            assertThat(decision.isTradeable()).isTrue();
        }
    }

    @Nested
    @DisplayName("Take profit")
    class TakeProfit {

        @Test
        @DisplayName("fixed risk reward sets one full-size target")
        void fixedTarget() {
            SizingDecision decision = positionSizer.size(request("5000", fixedStop(20)).build());

            assertThat(decision.getTakeProfits()).hasSize(1);
            TakeProfitLevel level = decision.getTakeProfits().get(0);
            assertThat(level.getPrice()).isEqualByComparingTo("1.1040");
            assertThat(level.getFraction()).isEqualByComparingTo("1");
            assertThat(decision.getStopLossPrice()).isEqualByComparingTo("1.0980");
        }

        @Test
        @DisplayName("multiple targets split the size below entry for a short")
        void multipleTargetsShort() {
            RiskParams params = new RiskParams(
                    new StopLossSpec.FixedPips(20), new TakeProfitSpec.MultipleTargets(1.0, 2.0, 0.5), 2.0, 5.0);

            SizingDecision decision = positionSizer.size(request("5000", params)
                    .direction(TradeDirection.SHORT)
                    .build());

            List<TakeProfitLevel> levels = decision.getTakeProfits();
            assertThat(levels).hasSize(2);
            assertThat(levels.get(0).getPrice()).isEqualByComparingTo("1.0980");
            assertThat(levels.get(1).getPrice()).isEqualByComparingTo("1.0960");
            assertThat(levels.get(0).getFraction()).isEqualByComparingTo("0.5");
            assertThat(levels.get(1).getFraction()).isEqualByComparingTo("0.5");
            assertThat(decision.getStopLossPrice()).isEqualByComparingTo("1.1020");
        }

        @Test
        @DisplayName("trailing sets activation and distance without fixed targets")
        void trailing() {
            RiskParams params = new RiskParams(
                    new StopLossSpec.FixedPips(20), new TakeProfitSpec.Trailing(1.0, 10), 2.0, 5.0);

            SizingDecision decision = positionSizer.size(request("5000", params).build());

            assertThat(decision.getTakeProfits()).isEmpty();
            assertThat(decision.isTrailing()).isTrue();
            assertThat(decision.getTrailingActivationPrice()).isEqualByComparingTo("1.1020");
            assertThat(decision.getTrailingDistance()).isEqualByComparingTo("0.0010");
        }
    }

    @Test
    @DisplayName("tier lookup uses the equity")
    void tierFromEquity() {
        AccountTier tier = TIERS.tierFor(new BigDecimal("20000"));

        assertThat(tier.getLabel()).isEqualTo("professional");
    }
}
