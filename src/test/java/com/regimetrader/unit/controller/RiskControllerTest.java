package com.regimetrader.unit.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.regimetrader.api.controller.RiskController;
import com.regimetrader.config.ApiResponseAdvice;
import com.regimetrader.domain.enums.CircuitBreakerState;
import com.regimetrader.risk.RiskLedger;
import com.regimetrader.risk.RiskLedgerSnapshot;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the RiskController.
 */
@ExtendWith(MockitoExtension.class)
class RiskControllerTest {

    private MockMvc mockMvc;

    @Mock
    private RiskLedger riskLedger;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RiskController(riskLedger))
                .setControllerAdvice(new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("GET /api/risk returns the ledger snapshot")
    void getRisk() throws Exception {
        when(riskLedger.snapshot())
                .thenReturn(RiskLedgerSnapshot.builder()
                        .equity(new BigDecimal("8500.00"))
                        .highWaterMark(new BigDecimal("10000.00"))
                        .drawdownPercent(new BigDecimal("15.00"))
                        .openRisk(BigDecimal.ZERO)
                        .openPositionCount(0)
                        .circuitBreakerState(CircuitBreakerState.DRAWDOWN_TRIPPED)
                        .drawdownTripped(true)
                        .accountTier("standard")
                        .build());

        mockMvc.perform(get("/api/risk"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.equity").value(8500.00))
                .andExpect(jsonPath("$.data.drawdownPercent").value(15.00))
                .andExpect(jsonPath("$.data.circuitBreakerState").value("DRAWDOWN_TRIPPED"))
                .andExpect(jsonPath("$.data.drawdownTripped").value(true))
                .andExpect(jsonPath("$.data.accountTier").value("standard"));
    }

    @Test
    @DisplayName("POST /api/risk/circuit-breaker/reset resets on behalf of the API")
    void resetCircuitBreaker() throws Exception {
        when(riskLedger.resetCircuitBreaker("API"))
                .thenReturn(RiskLedgerSnapshot.builder()
                        .highWaterMark(new BigDecimal("8500.00"))
                        .circuitBreakerState(CircuitBreakerState.ARMED)
                        .build());

        mockMvc.perform(post("/api/risk/circuit-breaker/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.circuitBreakerState").value("ARMED"))
                .andExpect(jsonPath("$.data.highWaterMark").value(8500.00));

        verify(riskLedger).resetCircuitBreaker("API");
    }
}
