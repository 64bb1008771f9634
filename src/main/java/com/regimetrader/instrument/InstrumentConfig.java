package com.regimetrader.instrument;

import com.regimetrader.domain.enums.InstrumentClass;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tradable instruments, bound from {@code regimetrader.market.instruments}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "regimetrader.market")
public class InstrumentConfig {

    private List<InstrumentProperties> instruments = new ArrayList<>();

    @Data
    public static class InstrumentProperties {
        private String symbol;
        private InstrumentClass instrumentClass = InstrumentClass.FOREX;
        private BigDecimal pipSize = new BigDecimal("0.0001");
        private BigDecimal pipValuePerLot = BigDecimal.TEN;
        private BigDecimal lotStep = new BigDecimal("0.01");
        private BigDecimal minLot = new BigDecimal("0.01");

        /** Initial activation; operators flip it at runtime. */
        private boolean active = true;
    }
}
