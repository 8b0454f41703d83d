package com.purchasingpower.wiregraph.exclusion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.wiregraph.core.ConnectionKey;
import com.purchasingpower.wiregraph.core.PinRef;
import com.purchasingpower.wiregraph.exception.ExclusionConfigException;
import com.purchasingpower.wiregraph.reconcile.ExclusionFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads per-diagram exclusion files (JSON).
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExclusionConfigLoader {

    private final ObjectMapper objectMapper;

    /**
     * Load the file, or no exclusions when the path is null or the file does not exist.
     */
    public ExclusionFilter loadIfPresent(Path file) {
        if (file == null || !Files.exists(file)) {
            return ExclusionFilter.none();
        }
        return load(file);
    }

    public ExclusionFilter load(Path file) {
        try {
            ExclusionConfig config = objectMapper.readValue(file.toFile(), ExclusionConfig.class);
            ExclusionFilter filter = toFilter(config);
            log.info("Loaded {} excluded pins and {} excluded connections from {}",
                filter.excludedPins().size(), filter.excludedConnections().size(), file);
            return filter;
        } catch (IOException e) {
            throw new ExclusionConfigException("Cannot read exclusions: " + e.getMessage(), file.toString(), e);
        }
    }

    public ExclusionFilter toFilter(ExclusionConfig config) {
        if (config == null) {
            return ExclusionFilter.none();
        }
        Set<PinRef> pins = new LinkedHashSet<>();
        for (ExclusionConfig.PinEntry entry : config.getExcludedPins()) {
            if (entry.getConnectorId() == null || entry.getConnectorId().isBlank()) {
                throw new ExclusionConfigException("Excluded pin without connectorId", "inline", null);
            }
            pins.add(new PinRef(entry.getConnectorId(), nullToEmpty(entry.getPin())));
        }
        Set<ConnectionKey> connections = new LinkedHashSet<>();
        for (ExclusionConfig.ConnectionEntry entry : config.getExcludedConnections()) {
            if (entry.getFromId() == null || entry.getToId() == null) {
                throw new ExclusionConfigException("Excluded connection without fromId/toId", "inline", null);
            }
            connections.add(new ConnectionKey(entry.getFromId(), nullToEmpty(entry.getFromPin()),
                entry.getToId(), nullToEmpty(entry.getToPin())));
        }
        return new ExclusionFilter(pins, connections);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
