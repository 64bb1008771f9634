package com.regimetrader.correlation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Persists the correlation matrix as JSON so a restart does not begin with an empty matrix.
 * Disabled when no data directory is configured. I/O failures are logged; the in-memory matrix
 * stays authoritative.
 */
@Component
public class CorrelationMatrixStore {

    private static final Logger log = LoggerFactory.getLogger(CorrelationMatrixStore.class);
    static final String FILE_NAME = "correlation-matrix.json";

    private final ObjectMapper objectMapper;
    private final CorrelationConfig config;

    public CorrelationMatrixStore(ObjectMapper objectMapper, CorrelationConfig config) {
        this.objectMapper = objectMapper;
        this.config = config;
    }

    public boolean isEnabled() {
        return config.getDataDir() != null && !config.getDataDir().isBlank();
    }

    public void save(CorrelationMatrix matrix) {
        if (!isEnabled()) {
            return;
        }
        Path file = Path.of(config.getDataDir(), FILE_NAME);
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(file.toFile(), new ArrayList<>(matrix.entries()));
            log.debug("Saved {} correlation entries to {}", matrix.size(), file);
        } catch (IOException e) {
            log.warn("Failed to save correlation matrix to {}: {}", file, e.getMessage());
        }
    }

    public Optional<List<CorrelationEntry>> load() {
        if (!isEnabled()) {
            return Optional.empty();
        }
        Path file = Path.of(config.getDataDir(), FILE_NAME);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            List<CorrelationEntry> entries = objectMapper.readValue(file.toFile(), new TypeReference<List<CorrelationEntry>>() {});
            log.info("Restored {} correlation entries from {}", entries.size(), file);
            return Optional.of(entries);
        } catch (IOException e) {
            log.warn("Failed to read correlation matrix from {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
