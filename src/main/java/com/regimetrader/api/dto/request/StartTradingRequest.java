package com.regimetrader.api.dto.request;

import com.regimetrader.domain.enums.RiskAppetite;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of POST /api/trading/start. Both fields are optional: no instruments keeps the current
 * active set, no risk level keeps the current appetite.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartTradingRequest {

    private List<String> instruments;

    private RiskAppetite riskLevel;
}
