package com.regimetrader.unit.instrument;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.regimetrader.domain.enums.InstrumentClass;
import com.regimetrader.domain.model.Instrument;
import com.regimetrader.exception.ResourceNotFoundException;
import com.regimetrader.instrument.InstrumentConfig;
import com.regimetrader.instrument.InstrumentRegistry;
import com.regimetrader.unit.TestBars;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InstrumentRegistryTest {

    private static InstrumentConfig.InstrumentProperties properties(String symbol, boolean active) {
        InstrumentConfig.InstrumentProperties properties = new InstrumentConfig.InstrumentProperties();
        properties.setSymbol(symbol);
        properties.setActive(active);
        return properties;
    }

    @Test
    @DisplayName("configuration builds instruments in declaration order with their activation")
    void fromConfig() {
        InstrumentConfig config = new InstrumentConfig();
        InstrumentConfig.InstrumentProperties v75 = properties("Volatility 75 Index", true);
        v75.setInstrumentClass(InstrumentClass.SYNTHETIC_VOLATILITY);
        v75.setPipSize(new BigDecimal("0.01"));
        v75.setPipValuePerLot(BigDecimal.ONE);
        config.setInstruments(List.of(properties("EURUSD", true), properties("GBPUSD", false), v75));

        InstrumentRegistry registry = new InstrumentRegistry(config);

        assertThat(registry.getInstruments())
                .extracting(Instrument::getSymbol)
                .containsExactly("EURUSD", "GBPUSD", "Volatility 75 Index");
        assertThat(registry.isActive("EURUSD")).isTrue();
        assertThat(registry.isActive("GBPUSD")).isFalse();
        assertThat(registry.require("Volatility 75 Index").getInstrumentClass())
                .isEqualTo(InstrumentClass.SYNTHETIC_VOLATILITY);
    }

    @Test
    @DisplayName("an instrument without a pip size is rejected")
    void invalidPipSize() {
        InstrumentConfig config = new InstrumentConfig();
        InstrumentConfig.InstrumentProperties broken = properties("EURUSD", true);
        broken.setPipSize(BigDecimal.ZERO);
        config.setInstruments(List.of(broken));

        assertThatThrownBy(() -> new InstrumentRegistry(config)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("duplicate symbols are rejected")
    void duplicates() {
        assertThatThrownBy(() -> new InstrumentRegistry(List.of(TestBars.eurusd(), TestBars.eurusd()), List.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("EURUSD");
    }

    @Test
    @DisplayName("activation can be toggled and replaced")
    void activation() {
        InstrumentRegistry registry = new InstrumentRegistry(
                List.of(TestBars.eurusd(), TestBars.forex("GBPUSD"), TestBars.forex("AUDUSD")), List.of("EURUSD"));

        registry.setActive("GBPUSD", true);
        assertThat(registry.isActive("GBPUSD")).isTrue();

        registry.activateOnly(List.of("AUDUSD"));
        assertThat(registry.isActive("AUDUSD")).isTrue();
        assertThat(registry.isActive("EURUSD")).isFalse();
        assertThat(registry.isActive("GBPUSD")).isFalse();
    }

    @Test
    @DisplayName("unknown symbols raise not found")
    void unknownSymbol() {
        InstrumentRegistry registry = new InstrumentRegistry(List.of(TestBars.eurusd()), List.of());

        assertThat(registry.find("XAUUSD")).isEmpty();
        assertThatThrownBy(() -> registry.setActive("XAUUSD", true)).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> registry.activateOnly(List.of("XAUUSD"))).isInstanceOf(ResourceNotFoundException.class);
    }
}
