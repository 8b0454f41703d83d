package com.purchasingpower.wiregraph.exclusion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.wiregraph.core.ConnectionKey;
import com.purchasingpower.wiregraph.core.PinRef;
import com.purchasingpower.wiregraph.exception.ExclusionConfigException;
import com.purchasingpower.wiregraph.reconcile.ExclusionFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Exclusion file loading")
class ExclusionConfigLoaderTest {

    @TempDir
    Path dir;

    private ExclusionConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ExclusionConfigLoader(new ObjectMapper());
    }

    @Test
    @DisplayName("Should read excluded pins and connections")
    void load_validFile() throws IOException {
        // Given
        Path file = dir.resolve("exclusions.json");
        Files.writeString(file, """
            {
              "excludedPins": [ { "connectorId": "ECU100", "pin": "7" }, { "connectorId": "SP12" } ],
              "excludedConnections": [
                { "fromId": "BCM200", "fromPin": "2", "toId": "LMP300", "toPin": "3" }
              ],
              "comment": "checked against the printed harness"
            }
            """);

        // When
        ExclusionFilter filter = loader.load(file);

        // Then
        assertThat(filter.excludedPins()).containsExactlyInAnyOrder(new PinRef("ECU100", "7"), new PinRef("SP12", ""));
        assertThat(filter.excludedConnections()).containsExactly(new ConnectionKey("BCM200", "2", "LMP300", "3"));
    }

    @Test
    @DisplayName("Should treat a missing file as no exclusions")
    void loadIfPresent_missingFile() {
        assertThat(loader.loadIfPresent(dir.resolve("absent.json")).isEmpty()).isTrue();
        assertThat(loader.loadIfPresent(null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should reject malformed files with their location")
    void load_malformedFile() throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{ \"excludedPins\": [ ");

        assertThatThrownBy(() -> loader.load(file))
            .isInstanceOf(ExclusionConfigException.class)
            .extracting("location").isEqualTo(file.toString());
    }

    @Test
    @DisplayName("Should reject pin entries without a connector")
    void toFilter_missingConnector() {
        ExclusionConfig config = ExclusionConfig.builder()
            .excludedPins(List.of(new ExclusionConfig.PinEntry(null, "3")))
            .build();

        assertThatThrownBy(() -> loader.toFilter(config)).isInstanceOf(ExclusionConfigException.class);
    }

    @Test
    @DisplayName("Should treat an absent inline config as no exclusions")
    void toFilter_null() {
        assertThat(loader.toFilter(null).isEmpty()).isTrue();
    }
}
