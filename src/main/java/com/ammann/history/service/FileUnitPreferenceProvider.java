/* (C)2026 */
package com.ammann.history.service;

import com.ammann.history.dto.UnitPreferenceDTO;
import com.ammann.history.exception.ConversionProviderException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Reads unit preferences from a JSON document of the form
 * {@code {"<path>": {"baseUnit": "m/s", "category": "speed", "targetUnit": "kn",
 * "conversions": {"kn": {"formula": "value * 1.94384", "inverseFormula": "value * 0.514444",
 * "symbol": "kn"}}}}}.
 */
@ApplicationScoped
public class FileUnitPreferenceProvider implements UnitPreferenceProvider {

    private static final Logger LOG = Logger.getLogger(FileUnitPreferenceProvider.class);
    private static final TypeReference<LinkedHashMap<String, UnitPreferenceDTO>> PREFERENCES =
            new TypeReference<>() {};

    @ConfigProperty(name = "history.units.preferences-file")
    Optional<String> preferencesFile;

    @Inject ObjectMapper objectMapper;

    @Override
    public Map<String, UnitPreferenceDTO> allConversions() {
        if (preferencesFile == null || preferencesFile.isEmpty() || preferencesFile.get().isBlank()) {
            throw new ConversionProviderException("No unit preferences file configured");
        }
        Path file = Paths.get(preferencesFile.get());
        if (!Files.isReadable(file)) {
            throw new ConversionProviderException("Unit preferences file not readable: " + file);
        }
        try {
            Map<String, UnitPreferenceDTO> preferences = objectMapper.readValue(file.toFile(), PREFERENCES);
            LOG.debugf("Loaded %d unit preferences from %s", preferences.size(), file);
            return preferences;
        } catch (IOException e) {
            throw new ConversionProviderException(
                    "Cannot read unit preferences from " + file + ": " + e.getMessage(), e);
        }
    }
}
