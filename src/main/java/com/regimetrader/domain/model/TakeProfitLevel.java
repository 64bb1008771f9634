package com.regimetrader.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One take-profit target. {@code fraction} is the share of the original size closed at this
 * level; the last level always closes whatever remains.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TakeProfitLevel {

    private BigDecimal price;
    private BigDecimal fraction;
    private boolean hit;
}
