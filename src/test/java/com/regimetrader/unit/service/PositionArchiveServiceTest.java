package com.regimetrader.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.regimetrader.domain.enums.CloseReason;
import com.regimetrader.domain.enums.PositionStatus;
import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.PerformanceStats;
import com.regimetrader.domain.model.PerformanceSummary;
import com.regimetrader.domain.model.Position;
import com.regimetrader.entity.ClosedPositionEntity;
import com.regimetrader.mapper.ClosedPositionMapper;
import com.regimetrader.repository.jpa.ClosedPositionJpaRepository;
import com.regimetrader.service.PositionArchiveService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class PositionArchiveServiceTest {

    @Mock
    private ClosedPositionJpaRepository closedPositionJpaRepository;

    private final ClosedPositionMapper closedPositionMapper = Mappers.getMapper(ClosedPositionMapper.class);

    private PositionArchiveService positionArchiveService;

    @BeforeEach
    void setUp() {
        positionArchiveService = new PositionArchiveService(closedPositionJpaRepository, closedPositionMapper);
    }

    private static ClosedPositionEntity trade(String id, String strategy, String instrument, String pnl) {
        return ClosedPositionEntity.builder()
                .id(id)
                .strategyName(strategy)
                .instrument(instrument)
                .direction(TradeDirection.LONG)
                .realizedPnl(new BigDecimal(pnl))
                .closeReason(CloseReason.TAKE_PROFIT)
                .closedAt(Instant.parse("2024-03-04T12:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("archive stores the original size of the closed position")
    void archiveMapsPosition() {
        Position position = Position.builder()
                .id("p1")
                .instrument("EURUSD")
                .strategyName("ma_rsi_combo")
                .direction(TradeDirection.SHORT)
                .size(BigDecimal.ZERO)
                .originalSize(new BigDecimal("0.10"))
                .realizedPnl(new BigDecimal("12.50"))
                .status(PositionStatus.CLOSED)
                .closeReason(CloseReason.TAKE_PROFIT)
                .build();

        positionArchiveService.archive(position);

        ArgumentCaptor<ClosedPositionEntity> saved = ArgumentCaptor.forClass(ClosedPositionEntity.class);
        verify(closedPositionJpaRepository).save(saved.capture());
        assertThat(saved.getValue().getId()).isEqualTo("p1");
        assertThat(saved.getValue().getSize()).isEqualByComparingTo("0.10");
        assertThat(saved.getValue().getRealizedPnl()).isEqualByComparingTo("12.50");
        assertThat(saved.getValue().getCloseReason()).isEqualTo(CloseReason.TAKE_PROFIT);
    }

    @Test
    @DisplayName("a storage failure does not propagate to the close")
    void archiveFailureLogged() {
        when(closedPositionJpaRepository.save(any())).thenThrow(new DataIntegrityViolationException("duplicate"));

        assertThatCode(() -> positionArchiveService.archive(Position.builder().id("p1").build()))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("performance aggregates overall, per strategy and per instrument")
    void performance() {
        when(closedPositionJpaRepository.findAllByOrderByClosedAtDesc()).thenReturn(List.of(
                trade("t1", "ma_rsi_combo", "EURUSD", "30"),
                trade("t2", "ma_rsi_combo", "GBPUSD", "-10"),
                trade("t3", "jhook_pattern", "EURUSD", "20")));

        PerformanceSummary summary = positionArchiveService.getPerformance();

        PerformanceStats overall = summary.getOverall();
        assertThat(overall.getTotalTrades()).isEqualTo(3);
        assertThat(overall.getWinningTrades()).isEqualTo(2);
        assertThat(overall.getWinRate()).isEqualByComparingTo("66.67");
        assertThat(overall.getTotalPnl()).isEqualByComparingTo("40");
        assertThat(overall.getAveragePnl()).isEqualByComparingTo("13.33");
        assertThat(overall.getProfitFactor()).isEqualByComparingTo("5.00");
        assertThat(overall.getLargestLoss()).isEqualByComparingTo("-10");

        assertThat(summary.getByStrategy()).containsOnlyKeys("jhook_pattern", "ma_rsi_combo");
        assertThat(summary.getByStrategy().get("ma_rsi_combo").getTotalPnl()).isEqualByComparingTo("20");
        assertThat(summary.getByInstrument().get("EURUSD").getProfitFactor()).isNull();
    }

    @Test
    @DisplayName("an empty archive gives zeroed statistics")
    void emptyArchive() {
        when(closedPositionJpaRepository.findAllByOrderByClosedAtDesc()).thenReturn(List.of());

        PerformanceStats overall = positionArchiveService.getPerformance().getOverall();

        assertThat(overall.getTotalTrades()).isZero();
        assertThat(overall.getWinRate()).isEqualByComparingTo("0");
        assertThat(overall.getProfitFactor()).isNull();
    }
}
