package com.regimetrader.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.regimetrader.domain.enums.PositionStatus;
import com.regimetrader.domain.model.Position;
import com.regimetrader.oms.PositionStateMachine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

class PositionStateMachineTest {

    @ParameterizedTest
    @CsvSource({
        "PENDING_ENTRY, OPEN, true",
        "PENDING_ENTRY, CLOSED, true",
        "PENDING_ENTRY, CLOSING, false",
        "OPEN, CLOSING, true",
        "OPEN, CLOSED, false",
        "OPEN, PENDING_ENTRY, false",
        "CLOSING, CLOSED, true",
        "CLOSING, OPEN, false"
    })
    void allowedTransitions(PositionStatus from, PositionStatus to, boolean allowed) {
        assertThat(PositionStateMachine.canTransition(from, to)).isEqualTo(allowed);
    }

    @ParameterizedTest
    @EnumSource(PositionStatus.class)
    @DisplayName("CLOSED is terminal")
    void closedIsTerminal(PositionStatus to) {
        Position position = Position.builder().id("p1").status(PositionStatus.CLOSED).build();

        assertThatThrownBy(() -> PositionStateMachine.transition(position, to))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("p1");
        assertThat(position.getStatus()).isEqualTo(PositionStatus.CLOSED);
    }

    @Test
    void transitionUpdatesStatus() {
        Position position = Position.builder().id("p1").status(PositionStatus.PENDING_ENTRY).build();

        PositionStateMachine.transition(position, PositionStatus.OPEN);

        assertThat(position.getStatus()).isEqualTo(PositionStatus.OPEN);
    }
}
