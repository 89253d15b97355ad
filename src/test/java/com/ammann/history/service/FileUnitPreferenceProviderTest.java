/* (C)2026 */
package com.ammann.history.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.history.dto.UnitPreferenceDTO;
import com.ammann.history.exception.ConversionProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileUnitPreferenceProviderTest {

    private static final Path PREFERENCES = Paths.get("src/test/resources/units/preferences.json");

    @TempDir Path tempDir;

    private FileUnitPreferenceProvider provider;

    @BeforeEach
    void setUp() {
        provider = new FileUnitPreferenceProvider();
        provider.objectMapper = new ObjectMapper();
    }

    @Test
    void readsPreferencesInDocumentOrder() throws IOException {
        Path file = tempDir.resolve("preferences.json");
        Files.copy(PREFERENCES, file);
        provider.preferencesFile = Optional.of(file.toString());

        Map<String, UnitPreferenceDTO> preferences = provider.allConversions();

        assertThat(preferences).containsOnlyKeys("navigation.speedOverGround", "environment.outside.temperature");
        UnitPreferenceDTO speed = preferences.get("navigation.speedOverGround");
        assertThat(speed.targetUnit()).isEqualTo("kn");
        assertThat(speed.conversions()).containsOnlyKeys("km/h", "kn");
        assertThat(speed.conversions().get("kn").displayFormat()).isEqualTo("0.0");
        assertThat(preferences.get("environment.outside.temperature").displayFormat()).isEqualTo("0");
    }

    @Test
    void missingConfigurationIsReportedAsUnavailable() {
        provider.preferencesFile = Optional.empty();

        assertThatThrownBy(() -> provider.allConversions())
                .isInstanceOf(ConversionProviderException.class)
                .hasMessageContaining("No unit preferences file");
    }

    @Test
    void missingFileIsReportedAsUnavailable() {
        provider.preferencesFile = Optional.of(tempDir.resolve("absent.json").toString());

        assertThatThrownBy(() -> provider.allConversions())
                .isInstanceOf(ConversionProviderException.class)
                .hasMessageContaining("not readable");
    }

    @Test
    void malformedDocumentIsReportedAsUnavailable() throws IOException {
        Path file = Files.writeString(tempDir.resolve("broken.json"), "{ \"a\": [");
        provider.preferencesFile = Optional.of(file.toString());

        assertThatThrownBy(() -> provider.allConversions())
                .isInstanceOf(ConversionProviderException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
