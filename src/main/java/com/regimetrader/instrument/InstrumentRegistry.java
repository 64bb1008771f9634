package com.regimetrader.instrument;

import com.regimetrader.domain.model.Instrument;
import com.regimetrader.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Configured instruments in declaration order, plus their runtime activation flags.
 *
 * <p>The instrument specs are immutable after startup; only the active set changes, through
 * {@link #setActive}.
 */
@Component
public class InstrumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstrumentRegistry.class);

    private final Map<String, Instrument> instruments;
    private final Set<String> active = ConcurrentHashMap.newKeySet();

    @Autowired
    public InstrumentRegistry(InstrumentConfig config) {
        this(toInstruments(config), activeSymbols(config));
    }

    public InstrumentRegistry(List<Instrument> instruments, List<String> activeSymbols) {
        Map<String, Instrument> bySymbol = new LinkedHashMap<>();
        for (Instrument instrument : instruments) {
            if (bySymbol.put(instrument.getSymbol(), instrument) != null) {
                throw new IllegalStateException("Duplicate instrument: " + instrument.getSymbol());
            }
        }
        this.instruments = Collections.unmodifiableMap(bySymbol);
        for (String symbol : activeSymbols) {
            require(symbol);
            active.add(symbol);
        }
        log.info("Instrument registry: {} configured, active {}", bySymbol.keySet(), active);
    }

    public List<Instrument> getInstruments() {
        return new ArrayList<>(instruments.values());
    }

    public Optional<Instrument> find(String symbol) {
        return Optional.ofNullable(instruments.get(symbol));
    }

    public Instrument require(String symbol) {
        Instrument instrument = instruments.get(symbol);
        if (instrument == null) {
            throw new ResourceNotFoundException("Instrument", symbol);
        }
        return instrument;
    }

    public boolean isActive(String symbol) {
        return active.contains(symbol);
    }

    public void setActive(String symbol, boolean isActive) {
        require(symbol);
        if (isActive) {
            active.add(symbol);
        } else {
            active.remove(symbol);
        }
        log.info("Instrument {} {}", symbol, isActive ? "activated" : "deactivated");
    }

    /** Makes exactly the given symbols active. */
    public void activateOnly(List<String> symbols) {
        symbols.forEach(this::require);
        active.retainAll(symbols);
        active.addAll(symbols);
        log.info("Active instruments set to {}", symbols);
    }

    private static List<Instrument> toInstruments(InstrumentConfig config) {
        List<Instrument> result = new ArrayList<>();
        for (InstrumentConfig.InstrumentProperties properties : config.getInstruments()) {
            if (properties.getSymbol() == null || properties.getSymbol().isBlank()) {
                throw new IllegalStateException("Instrument without a symbol in regimetrader.market.instruments");
            }
            if (properties.getPipSize() == null || properties.getPipSize().signum() <= 0) {
                throw new IllegalStateException("Instrument " + properties.getSymbol() + " needs a positive pip size");
            }
            if (properties.getPipValuePerLot() == null || properties.getPipValuePerLot().signum() <= 0) {
                throw new IllegalStateException(
                        "Instrument " + properties.getSymbol() + " needs a positive pip value per lot");
            }
            if (properties.getLotStep().signum() <= 0 || properties.getMinLot().signum() <= 0) {
                throw new IllegalStateException("Instrument " + properties.getSymbol() + " needs positive lot sizes");
            }
            result.add(Instrument.builder()
                    .symbol(properties.getSymbol())
                    .instrumentClass(properties.getInstrumentClass())
                    .pipSize(properties.getPipSize())
                    .pipValuePerLot(properties.getPipValuePerLot())
                    .lotStep(properties.getLotStep())
                    .minLot(properties.getMinLot())
                    .build());
        }
        return result;
    }

    private static List<String> activeSymbols(InstrumentConfig config) {
        return config.getInstruments().stream()
                .filter(InstrumentConfig.InstrumentProperties::isActive)
                .map(InstrumentConfig.InstrumentProperties::getSymbol)
                .toList();
    }
}
