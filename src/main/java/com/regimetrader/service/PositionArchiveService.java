package com.regimetrader.service;

import com.regimetrader.domain.model.ClosedTrade;
import com.regimetrader.domain.model.PerformanceStats;
import com.regimetrader.domain.model.PerformanceSummary;
import com.regimetrader.domain.model.Position;
import com.regimetrader.mapper.ClosedPositionMapper;
import com.regimetrader.repository.jpa.ClosedPositionJpaRepository;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Persists closed positions and computes performance from the archive.
 *
 * <p>Archiving never fails the close itself: the position is already CLOSED and booked in the
 * risk ledger by the time it gets here, so a storage error is logged and the close stands.
 */
@Service
public class PositionArchiveService {

    private static final Logger log = LoggerFactory.getLogger(PositionArchiveService.class);

    private final ClosedPositionJpaRepository closedPositionJpaRepository;
    private final ClosedPositionMapper closedPositionMapper;

    public PositionArchiveService(
            ClosedPositionJpaRepository closedPositionJpaRepository, ClosedPositionMapper closedPositionMapper) {
        this.closedPositionJpaRepository = closedPositionJpaRepository;
        this.closedPositionMapper = closedPositionMapper;
    }

    public void archive(Position position) {
        try {
            closedPositionJpaRepository.save(closedPositionMapper.toEntity(position));
            log.debug("Archived position {} ({} {})", position.getId(), position.getCloseReason(), position.getRealizedPnl());
        } catch (DataAccessException e) {
            log.error("Failed to archive closed position {}", position.getId(), e);
        }
    }

    /** Closed trades, most recent first. */
    public List<ClosedTrade> getClosedTrades() {
        return closedPositionMapper.toDomainList(closedPositionJpaRepository.findAllByOrderByClosedAtDesc());
    }

    public PerformanceSummary getPerformance() {
        List<ClosedTrade> trades = getClosedTrades();
        return PerformanceSummary.builder()
                .overall(PerformanceStats.of(trades))
                .byStrategy(groupStats(trades, ClosedTrade::getStrategyName))
                .byInstrument(groupStats(trades, ClosedTrade::getInstrument))
                .build();
    }

    private static Map<String, PerformanceStats> groupStats(
            List<ClosedTrade> trades, Function<ClosedTrade, String> key) {
        Map<String, List<ClosedTrade>> grouped = trades.stream()
                .collect(Collectors.groupingBy(t -> key.apply(t) != null ? key.apply(t) : "unknown", TreeMap::new,
                        Collectors.toList()));
        Map<String, PerformanceStats> stats = new TreeMap<>();
        grouped.forEach((name, group) -> stats.put(name, PerformanceStats.of(group)));
        return stats;
    }
}
