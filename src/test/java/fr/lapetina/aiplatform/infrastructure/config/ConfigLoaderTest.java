package fr.lapetina.aiplatform.infrastructure.config;

import fr.lapetina.aiplatform.domain.model.Feature;
import fr.lapetina.aiplatform.domain.model.ProviderType;
import fr.lapetina.aiplatform.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load configuration from the classpath")
    void shouldLoadFromClasspath() {
        try (ConfigLoader loader = new ConfigLoader("test-config.yaml")) {
            ControlPlaneConfig config = loader.load();

            assertThat(config.getServer().getWorkerThreads()).isEqualTo(4);
            assertThat(config.getRateLimit().getOverrides()).hasSize(1);
            assertThat(config.toKeys()).hasSize(1);

            List<Feature> features = config.toFeatures();
            assertThat(features).extracting(Feature::id).containsExactly("text_to_image", "text_generation");
            assertThat(features.get(0).providers().get(0).type()).isEqualTo(ProviderType.SELF_HOSTED);
            assertThat(features.get(1).routing().strategy()).isEqualTo("cost_based");
            assertThat(loader.getCurrentConfig()).isSameAs(config);
        }
    }

    @Test
    @DisplayName("should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        try (ConfigLoader loader = new ConfigLoader("unused.yaml")) {
            ControlPlaneConfig config = loader.loadFromStream(yaml(""));

            assertThat(config.getServer().getPort()).isEqualTo(8080);
            assertThat(config.getFeatures()).isEmpty();
            // No budget listed: the built-in ones are seeded
            assertThat(config.getBudget().toSettings().defaultBudgets()).isNotEmpty();
        }
    }

    @Test
    @DisplayName("should fail when the file is missing")
    void shouldFailOnMissingFile() {
        try (ConfigLoader loader = new ConfigLoader(tempDir.resolve("absent.yaml").toString())) {
            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("not found");
        }
    }

    @Test
    @DisplayName("should reject malformed YAML")
    void shouldRejectMalformedYaml() {
        try (ConfigLoader loader = new ConfigLoader("unused.yaml")) {
            assertThatThrownBy(() -> loader.loadFromStream(yaml("server: [unclosed")))
                    .isInstanceOf(ConfigurationException.class);
            assertThat(loader.getCurrentConfig()).isNull();
        }
    }

    @Test
    @DisplayName("should reject duplicate feature ids")
    void shouldRejectDuplicateFeatures() {
        String text = """
                features:
                  - id: text_to_image
                  - id: text_to_image
                """;
        try (ConfigLoader loader = new ConfigLoader("unused.yaml")) {
            assertThatThrownBy(() -> loader.loadFromStream(yaml(text)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Duplicate feature id");
        }
    }

    @Test
    @DisplayName("should reject values the components cannot build from")
    void shouldRejectInvalidValues() {
        String badProvider = """
                features:
                  - id: text_to_image
                    providers:
                      - id: sd_local
                        type: on_premise
                """;
        String badPort = """
                server:
                  port: 70000
                """;
        String badAlgorithm = """
                rateLimit:
                  algorithm: fixed-window
                """;
        try (ConfigLoader loader = new ConfigLoader("unused.yaml")) {
            assertThatThrownBy(() -> loader.loadFromStream(yaml(badProvider)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("on_premise");
            assertThatThrownBy(() -> loader.loadFromStream(yaml(badPort)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("port");
            assertThatThrownBy(() -> loader.loadFromStream(yaml(badAlgorithm)))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Test
    @DisplayName("should notify listeners with the previous and new configuration")
    void shouldNotifyListeners() {
        List<ControlPlaneConfig[]> changes = new ArrayList<>();
        try (ConfigLoader loader = new ConfigLoader("unused.yaml")) {
            loader.addListener((oldConfig, newConfig) -> {
                throw new IllegalStateException("listener failure");
            });
            loader.addListener((oldConfig, newConfig) -> changes.add(new ControlPlaneConfig[]{oldConfig, newConfig}));

            ControlPlaneConfig first = loader.loadFromStream(yaml("server:\n  port: 9000\n"));
            ControlPlaneConfig second = loader.loadFromStream(yaml("server:\n  port: 9001\n"));

            // The failing listener does not stop the others
            assertThat(changes).hasSize(2);
            assertThat(changes.get(0)[0]).isNull();
            assertThat(changes.get(0)[1]).isSameAs(first);
            assertThat(changes.get(1)[0]).isSameAs(first);
            assertThat(changes.get(1)[1]).isSameAs(second);
        }
    }

    @Test
    @DisplayName("should keep the current configuration when a reload fails")
    void shouldKeepCurrentOnFailedReload() throws IOException {
        Path file = tempDir.resolve("control-plane.yaml");
        Files.writeString(file, "server:\n  port: 9000\n");

        try (ConfigLoader loader = new ConfigLoader(file.toString())) {
            ControlPlaneConfig loaded = loader.load();

            Files.writeString(file, "server:\n  workerThreads: 0\n");
            ControlPlaneConfig afterReload = loader.reload();

            assertThat(afterReload).isSameAs(loaded);
            assertThat(loader.getCurrentConfig().getServer().getPort()).isEqualTo(9000);

            Files.writeString(file, "server:\n  port: 9100\n");
            assertThat(loader.reload().getServer().getPort()).isEqualTo(9100);
        }
    }
}
