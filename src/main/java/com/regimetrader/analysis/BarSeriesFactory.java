package com.regimetrader.analysis;

import com.regimetrader.domain.model.Bar;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;

/**
 * Builds ta4j series from feed bars.
 *
 * <p>ta4j keys bars by end time, so each bar ends where the next one opens; the last bar reuses
 * the preceding interval. Callers must pass bars with strictly increasing open times.
 */
public final class BarSeriesFactory {

    private static final Duration DEFAULT_PERIOD = Duration.ofMinutes(1);

    private BarSeriesFactory() {}

    public static BarSeries toSeries(String name, List<Bar> bars) {
        BarSeries series = new BaseBarSeriesBuilder().withName(name).build();
        Duration period = DEFAULT_PERIOD;
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (i + 1 < bars.size()) {
                period = Duration.between(bar.getOpenTime(), bars.get(i + 1).getOpenTime());
            }
            ZonedDateTime endTime = bar.getOpenTime().plus(period).atZone(ZoneOffset.UTC);
            series.addBar(period, endTime, bar.getOpen(), bar.getHigh(), bar.getLow(), bar.getClose(), bar.getVolume());
        }
        return series;
    }
}
