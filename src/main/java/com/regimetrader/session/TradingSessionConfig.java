package com.regimetrader.session;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Market sessions in UTC, bound from {@code regimetrader.sessions.*}. A window whose end is
 * before its start wraps past midnight.
 */
@Data
@Component
@ConfigurationProperties(prefix = "regimetrader.sessions")
public class TradingSessionConfig {

    private Map<String, SessionWindow> windows = defaultWindows();

    /** Sessions in which forex entries are allowed; empty allows all configured windows. */
    private List<String> forexSessions = new ArrayList<>();

    /** Forex is closed from Friday 22:00 to Sunday 22:00 UTC. */
    private boolean weekendClosed = true;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SessionWindow {
        private LocalTime start;
        private LocalTime end;

        public boolean contains(LocalTime time) {
            if (start.equals(end)) {
                return true;
            }
            if (start.isBefore(end)) {
                return !time.isBefore(start) && time.isBefore(end);
            }
            return !time.isBefore(start) || time.isBefore(end);
        }
    }

    private static Map<String, SessionWindow> defaultWindows() {
        Map<String, SessionWindow> windows = new LinkedHashMap<>();
        windows.put("sydney", new SessionWindow(LocalTime.of(22, 0), LocalTime.of(7, 0)));
        windows.put("tokyo", new SessionWindow(LocalTime.of(0, 0), LocalTime.of(9, 0)));
        windows.put("london", new SessionWindow(LocalTime.of(8, 0), LocalTime.of(17, 0)));
        windows.put("newyork", new SessionWindow(LocalTime.of(13, 0), LocalTime.of(22, 0)));
        return windows;
    }
}
