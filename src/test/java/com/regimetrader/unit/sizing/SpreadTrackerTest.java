package com.regimetrader.unit.sizing;

import static org.assertj.core.api.Assertions.assertThat;

import com.regimetrader.sizing.PositionSizingConfig;
import com.regimetrader.sizing.SpreadTracker;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class SpreadTrackerTest {

    @Test
    void firstObservationSeedsAverage() {
        SpreadTracker tracker = new SpreadTracker(new PositionSizingConfig());

        assertThat(tracker.averageSpread("EURUSD")).isEmpty();
        tracker.update("EURUSD", new BigDecimal("0.0002"));

        assertThat(tracker.averageSpread("EURUSD")).hasValueSatisfying(
                avg -> assertThat(avg).isEqualByComparingTo("0.0002"));
    }

    @Test
    void laterObservationsMoveAverageByWeight() {
        SpreadTracker tracker = new SpreadTracker(new PositionSizingConfig());
        tracker.update("EURUSD", new BigDecimal("0.0002"));

        BigDecimal average = tracker.update("EURUSD", new BigDecimal("0.0004"));

        // 0.0002 * 0.95 + 0.0004 * 0.05
        assertThat(average).isEqualByComparingTo("0.00021");
        assertThat(tracker.averageSpread("GBPUSD")).isEmpty();
    }
}
