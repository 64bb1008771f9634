package com.regimetrader.correlation;

import com.regimetrader.domain.enums.PositionStatus;
import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.Position;
import com.regimetrader.risk.AdmissionDecision;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Maintains instrument correlations and answers "may this instrument be opened alongside the
 * current exposure".
 *
 * <p>Measured correlations are Pearson coefficients of recent returns, recomputed on the configured
 * interval (or sooner when new instruments gain enough history) and published as an immutable
 * {@link CorrelationMatrix}. Pairs without a measurement fall back to predefined group membership:
 * members of a shared group are assumed to correlate at the high threshold. Every lookup reports
 * its {@link CorrelationSource} and the first fallback per pair is logged, so estimated values
 * are never mistaken for measured ones.
 */
@Service
public class CorrelationManager {

    private static final Logger log = LoggerFactory.getLogger(CorrelationManager.class);

    private final CorrelationConfig config;
    private final CorrelationMatrixStore store;
    private final Clock clock;

    private final Map<String, double[]> priceHistory = new ConcurrentHashMap<>();
    private final Set<String> loggedFallbacks = ConcurrentHashMap.newKeySet();
    private final Map<String, String> groupByInstrument;

    private volatile CorrelationMatrix matrix = CorrelationMatrix.empty();
    private volatile Instant lastRefresh;
    private volatile Set<String> measuredInstruments = Set.of();

    public CorrelationManager(CorrelationConfig config, CorrelationMatrixStore store, Clock clock) {
        this.config = config;
        this.store = store;
        this.clock = clock;
        this.groupByInstrument = indexGroups(config.getPredefinedGroups());
    }

    @PostConstruct
    void restore() {
        store.load().ifPresent(entries -> matrix = CorrelationMatrix.of(entries, clock.instant()));
    }

    // ========================
    // HISTORY AND REFRESH
    // ========================

    /** Replaces the close history of an instrument, keeping the most recent lookback window. */
    public void updatePriceHistory(String symbol, List<Double> closes) {
        int keep = Math.min(closes.size(), config.getLookbackPoints() + 1);
        double[] prices = new double[keep];
        int offset = closes.size() - keep;
        for (int i = 0; i < keep; i++) {
            prices[i] = closes.get(offset + i);
        }
        priceHistory.put(symbol, prices);
    }

    /**
     * Refreshes when the update interval elapsed or instruments gained enough history since the
     * last refresh.
     */
    @Scheduled(fixedDelayString = "${regimetrader.correlation.refresh-check-ms:60000}")
    public void refreshIfDue() {
        Instant now = clock.instant();
        boolean intervalElapsed = lastRefresh == null || !now.isBefore(lastRefresh.plus(config.getUpdateInterval()));
        if (intervalElapsed || !measurableInstruments().equals(measuredInstruments)) {
            refresh();
        }
    }

    public CorrelationMatrix refresh() {
        Instant now = clock.instant();
        Set<String> measurable = measurableInstruments();
        List<String> symbols = new ArrayList<>(measurable);
        Map<String, double[]> returns = new LinkedHashMap<>();
        for (String symbol : symbols) {
            returns.put(symbol, PearsonCorrelation.returns(priceHistory.get(symbol)));
        }

        List<CorrelationEntry> entries = new ArrayList<>();
        for (int i = 0; i < symbols.size(); i++) {
            for (int j = i + 1; j < symbols.size(); j++) {
                String a = symbols.get(i);
                String b = symbols.get(j);
                OptionalDouble r = PearsonCorrelation.correlate(
                        returns.get(a), returns.get(b), config.getMinHistoryPoints());
                if (r.isPresent()) {
                    entries.add(new CorrelationEntry(a, b, r.getAsDouble(), now));
                }
            }
        }

        CorrelationMatrix refreshed = CorrelationMatrix.of(entries, now);
        matrix = refreshed;
        measuredInstruments = measurable;
        lastRefresh = now;
        store.save(refreshed);
        log.info("Correlation matrix refreshed: {} pairs across {} instruments", refreshed.size(), symbols.size());
        return refreshed;
    }

    private Set<String> measurableInstruments() {
        Set<String> measurable = new TreeSet<>();
        priceHistory.forEach((symbol, prices) -> {
            if (prices.length - 1 >= config.getMinHistoryPoints()) {
                measurable.add(symbol);
            }
        });
        return measurable;
    }

    // ========================
    // LOOKUP
    // ========================

    public CorrelationLookup correlation(String a, String b) {
        if (a.equals(b)) {
            return new CorrelationLookup(1.0, CorrelationSource.IDENTITY);
        }
        Optional<CorrelationEntry> measured = matrix.get(a, b);
        if (measured.isPresent()) {
            return new CorrelationLookup(measured.get().coefficient(), CorrelationSource.MEASURED);
        }
        String groupA = groupByInstrument.get(a);
        if (groupA != null && groupA.equals(groupByInstrument.get(b))) {
            if (loggedFallbacks.add(CorrelationEntry.key(a, b))) {
                log.info(
                        "No measured correlation for {}/{}; using group '{}' estimate {}",
                        a,
                        b,
                        groupA,
                        config.getHighCorrelationThreshold());
            }
            return new CorrelationLookup(config.getHighCorrelationThreshold(), CorrelationSource.GROUP_ESTIMATE);
        }
        return new CorrelationLookup(0.0, CorrelationSource.NONE);
    }

    public double coefficient(String a, String b) {
        return correlation(a, b).coefficient();
    }

    // ========================
    // ADMISSION
    // ========================

    /**
     * Checks a prospective entry against the open positions. Rejects a duplicate same-direction
     * position on the instrument, a correlated cluster that would exceed
     * {@code maxCorrelatedExposure}, and same-direction exposure that would exceed
     * {@code maxSameDirectionExposure}. A position negatively correlated with the instrument and
     * held in the opposite direction counts as same-direction exposure.
     */
    public AdmissionDecision canOpen(String instrument, TradeDirection direction, Collection<Position> openPositions) {
        int correlated = 0;
        int sameDirection = 0;
        List<String> correlatedWith = new ArrayList<>();

        for (Position position : openPositions) {
            if (position.getStatus() == PositionStatus.CLOSED) {
                continue;
            }
            if (position.getInstrument().equals(instrument) && position.getDirection() == direction) {
                return AdmissionDecision.reject(String.format(
                        "Already holding %s %s (position %s)", direction, instrument, position.getId()));
            }
            CorrelationLookup lookup = correlation(instrument, position.getInstrument());
            TradeDirection effective = position.getDirection();
            if (Math.abs(lookup.coefficient()) >= config.getHighCorrelationThreshold()) {
                correlated++;
                correlatedWith.add(String.format(
                        "%s(%.2f %s)", position.getInstrument(), lookup.coefficient(), lookup.source()));
                if (lookup.coefficient() < 0) {
                    effective = effective.opposite();
                }
            }
            if (effective == direction) {
                sameDirection++;
            }
        }

        if (correlated + 1 > config.getMaxCorrelatedExposure()) {
            return AdmissionDecision.reject(String.format(
                    "Correlated exposure %d would exceed max %d: %s",
                    correlated + 1,
                    config.getMaxCorrelatedExposure(),
                    correlatedWith));
        }
        if (sameDirection + 1 > config.getMaxSameDirectionExposure()) {
            return AdmissionDecision.reject(String.format(
                    "Same-direction exposure %d would exceed max %d",
                    sameDirection + 1,
                    config.getMaxSameDirectionExposure()));
        }
        return AdmissionDecision.admit();
    }

    // ========================
    // GROUPS AND REPORTING
    // ========================

    public Optional<String> groupOf(String instrument) {
        return Optional.ofNullable(groupByInstrument.get(instrument));
    }

    /** Group used to aggregate open risk: the predefined group, or the instrument itself. */
    public String riskGroupOf(String instrument) {
        return groupByInstrument.getOrDefault(instrument, instrument);
    }

    public Map<String, List<String>> getGroups() {
        return config.getPredefinedGroups();
    }

    public List<CorrelationEntry> snapshot() {
        List<CorrelationEntry> entries = new ArrayList<>(matrix.entries());
        entries.sort(Comparator.comparing(CorrelationEntry::instrumentA).thenComparing(CorrelationEntry::instrumentB));
        return entries;
    }

    public CorrelationMatrix getMatrix() {
        return matrix;
    }

    private static Map<String, String> indexGroups(Map<String, List<String>> groups) {
        Map<String, String> index = new LinkedHashMap<>();
        Set<String> duplicated = new HashSet<>();
        groups.forEach((group, members) -> {
            for (String member : members) {
                String previous = index.putIfAbsent(member, group);
                if (previous != null) {
                    duplicated.add(member);
                }
            }
        });
        if (!duplicated.isEmpty()) {
            log.warn("Instruments listed in more than one correlation group, first group wins: {}", duplicated);
        }
        return index;
    }
}
