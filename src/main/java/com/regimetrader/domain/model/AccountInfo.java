package com.regimetrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AccountInfo {

    BigDecimal balance;
    BigDecimal equity;
    String currency;
}
