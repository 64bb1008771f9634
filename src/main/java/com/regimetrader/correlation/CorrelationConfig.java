package com.regimetrader.correlation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Correlation settings bound from {@code regimetrader.correlation.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "regimetrader.correlation")
public class CorrelationConfig {

    private double highCorrelationThreshold = 0.7;
    private double mediumCorrelationThreshold = 0.5;

    /** Maximum open positions in one correlated cluster, the new one included. */
    private int maxCorrelatedExposure = 2;

    /** Maximum positions pointing the same effective direction, the new one included. */
    private int maxSameDirectionExposure = 4;

    private Duration updateInterval = Duration.ofHours(12);

    /** Number of most recent returns used per instrument. */
    private int lookbackPoints = 100;

    /** Pairs with fewer overlapping returns are not measured. */
    private int minHistoryPoints = 30;

    /** Directory for the persisted matrix; blank disables persistence. */
    private String dataDir = "";

    private Map<String, List<String>> predefinedGroups = new LinkedHashMap<>();

    public List<String> groupMembers(String group) {
        return predefinedGroups.getOrDefault(group, new ArrayList<>());
    }
}
