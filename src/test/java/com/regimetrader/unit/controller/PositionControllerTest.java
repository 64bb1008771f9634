package com.regimetrader.unit.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.regimetrader.api.controller.PositionController;
import com.regimetrader.config.ApiResponseAdvice;
import com.regimetrader.domain.enums.PositionStatus;
import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.Position;
import com.regimetrader.exception.BusinessException;
import com.regimetrader.exception.ErrorCode;
import com.regimetrader.exception.GlobalExceptionHandler;
import com.regimetrader.exception.ResourceNotFoundException;
import com.regimetrader.oms.TradeLifecycleManager;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class PositionControllerTest {

    private MockMvc mockMvc;

    @Mock
    private TradeLifecycleManager tradeLifecycleManager;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PositionController(tradeLifecycleManager))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    private static Position position(String id, PositionStatus status) {
        return Position.builder()
                .id(id)
                .instrument("EURUSD")
                .strategyName("ma_rsi_combo")
                .direction(TradeDirection.LONG)
                .entryPrice(new BigDecimal("1.1002"))
                .size(new BigDecimal("0.10"))
                .status(status)
                .build();
    }

    @Test
    @DisplayName("GET /api/positions lists the active positions")
    void listPositions() throws Exception {
        when(tradeLifecycleManager.getActivePositions())
                .thenReturn(List.of(position("p1", PositionStatus.OPEN), position("p2", PositionStatus.PENDING_ENTRY)));

        mockMvc.perform(get("/api/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].id").value("p1"))
                .andExpect(jsonPath("$.data[0].instrument").value("EURUSD"))
                .andExpect(jsonPath("$.data[0].size").value(0.1))
                .andExpect(jsonPath("$.data[1].status").value("PENDING_ENTRY"));
    }

    @Test
    @DisplayName("POST /api/positions/{id}/close returns the position in CLOSING")
    void closePosition() throws Exception {
        when(tradeLifecycleManager.closeManually("p1")).thenReturn(position("p1", PositionStatus.CLOSING));

        mockMvc.perform(post("/api/positions/p1/close"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value("p1"))
                .andExpect(jsonPath("$.data.status").value("CLOSING"));

        verify(tradeLifecycleManager).closeManually("p1");
    }

    @Test
    @DisplayName("closing an unknown position gives 404")
    void closeUnknown() throws Exception {
        when(tradeLifecycleManager.closeManually("nope")).thenThrow(new ResourceNotFoundException("Position", "nope"));

        mockMvc.perform(post("/api/positions/nope/close"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.path").value("/api/positions/nope/close"));
    }

    @Test
    @DisplayName("closing a position that is not OPEN gives 409")
    void closeNotOpen() throws Exception {
        when(tradeLifecycleManager.closeManually("p1"))
                .thenThrow(new BusinessException(ErrorCode.CONFLICT, "Position p1 is PENDING_ENTRY, not OPEN"));

        mockMvc.perform(post("/api/positions/p1/close"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("CONFLICT"))
                .andExpect(jsonPath("$.error.message").value("Position p1 is PENDING_ENTRY, not OPEN"));
    }
}
