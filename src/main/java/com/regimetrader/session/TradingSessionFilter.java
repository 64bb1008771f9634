package com.regimetrader.session;

import com.regimetrader.domain.model.Instrument;
import jakarta.annotation.PostConstruct;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Decides whether new entries are allowed at a given instant. Synthetic instruments trade
 * around the clock; forex only inside its enabled sessions and never over the weekend.
 */
@Component
public class TradingSessionFilter {

    private static final LocalTime WEEKLY_BOUNDARY = LocalTime.of(22, 0);

    private final TradingSessionConfig config;

    public TradingSessionFilter(TradingSessionConfig config) {
        this.config = config;
    }

    @PostConstruct
    void validateConfig() {
        for (Map.Entry<String, TradingSessionConfig.SessionWindow> entry : config.getWindows().entrySet()) {
            if (entry.getValue().getStart() == null || entry.getValue().getEnd() == null) {
                throw new IllegalStateException("Session " + entry.getKey() + " needs a start and an end");
            }
        }
        for (String session : config.getForexSessions()) {
            if (!config.getWindows().containsKey(session)) {
                throw new IllegalStateException("Unknown session in forex-sessions: " + session);
            }
        }
    }

    public boolean isTradingAllowed(Instrument instrument, Instant now) {
        if (instrument.getInstrumentClass().isSynthetic()) {
            return true;
        }
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        if (config.isWeekendClosed() && isWeekend(utc)) {
            return false;
        }
        List<String> enabled = config.getForexSessions();
        LocalTime time = utc.toLocalTime();
        for (Map.Entry<String, TradingSessionConfig.SessionWindow> entry : config.getWindows().entrySet()) {
            if ((enabled.isEmpty() || enabled.contains(entry.getKey())) && entry.getValue().contains(time)) {
                return true;
            }
        }
        return false;
    }

    /** Names of the sessions open at {@code now}. */
    public List<String> activeSessions(Instant now) {
        LocalTime time = now.atZone(ZoneOffset.UTC).toLocalTime();
        List<String> active = new ArrayList<>();
        config.getWindows().forEach((name, window) -> {
            if (window.contains(time)) {
                active.add(name);
            }
        });
        return active;
    }

    private static boolean isWeekend(ZonedDateTime utc) {
        DayOfWeek day = utc.getDayOfWeek();
        LocalTime time = utc.toLocalTime();
        return day == DayOfWeek.SATURDAY
                || (day == DayOfWeek.FRIDAY && !time.isBefore(WEEKLY_BOUNDARY))
                || (day == DayOfWeek.SUNDAY && time.isBefore(WEEKLY_BOUNDARY));
    }
}
