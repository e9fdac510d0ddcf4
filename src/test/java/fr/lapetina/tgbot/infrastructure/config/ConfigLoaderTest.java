package fr.lapetina.tgbot.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should load configuration from the classpath")
    void shouldLoadFromClasspath() {
        BotConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getTelegram().getToken()).isEqualTo("123456:test-token");
        assertThat(config.getDispatcher().getWorkerNum()).isEqualTo(2);
        assertThat(config.getDispatcher().getAllowedUpdates()).containsExactly("message", "callback_query");
        assertThat(config.getDispatcher().getWaitStrategy()).isEqualTo("sleeping");
        assertThat(config.getAdmin().getPort()).isZero();
        assertThat(config.getMetrics().getPrefix()).isEqualTo("tgbot_test");
    }

    @Test
    @DisplayName("should prefer a file on disk and keep defaults for missing keys")
    void shouldLoadFromFile() throws Exception {
        Path file = tempDir.resolve("bot.yaml");
        Files.writeString(file, """
                telegram:
                  token: "42:file-token"
                dispatcher:
                  limit: 5
                """);

        BotConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getTelegram().getToken()).isEqualTo("42:file-token");
        assertThat(config.getTelegram().getApiUrl()).isEqualTo("https://api.telegram.org");
        assertThat(config.getDispatcher().getLimit()).isEqualTo(5);
        assertThat(config.getDispatcher().getPollTimeoutSeconds()).isEqualTo(50);
        assertThat(config.getAdmin().isEnabled()).isTrue();
    }

    @Test
    @DisplayName("should take the token from the environment when the file has none")
    void shouldFallBackToEnvironmentToken() {
        Map<String, String> env = Map.of(ConfigLoader.TOKEN_ENV, " 99:env-token ");
        ConfigLoader loader = new ConfigLoader("unused.yaml", env::get);

        BotConfig config = loader.loadFromStream(stream("dispatcher:\n  workerNum: 1\n"));

        assertThat(config.getTelegram().getToken()).isEqualTo("99:env-token");
    }

    @Test
    @DisplayName("should keep the file token over the environment")
    void shouldKeepFileToken() {
        Map<String, String> env = Map.of(ConfigLoader.TOKEN_ENV, "99:env-token");
        ConfigLoader loader = new ConfigLoader("unused.yaml", env::get);

        BotConfig config = loader.loadFromStream(stream("telegram:\n  token: \"1:file\"\n"));

        assertThat(config.getTelegram().getToken()).isEqualTo("1:file");
    }

    @Test
    @DisplayName("should return defaults for an empty document")
    void shouldReturnDefaultsForEmptyDocument() {
        BotConfig config = new ConfigLoader("unused.yaml", name -> null).loadFromStream(stream(""));

        assertThat(config.getDispatcher().getLimit()).isEqualTo(100);
        assertThat(config.getTelegram().getToken()).isEmpty();
    }

    @Test
    @DisplayName("should fail when the file is missing")
    void shouldFailWhenMissing() {
        ConfigLoader loader = new ConfigLoader(tempDir.resolve("missing.yaml").toString());

        assertThatThrownBy(loader::load)
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should fail on unknown keys")
    void shouldFailOnInvalidYaml() {
        ConfigLoader loader = new ConfigLoader("unused.yaml", name -> null);

        assertThatThrownBy(() -> loader.loadFromStream(stream("dispatcher:\n  workers: 3\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class);
    }

    private static ByteArrayInputStream stream(String yaml) {
        return new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
    }
}
