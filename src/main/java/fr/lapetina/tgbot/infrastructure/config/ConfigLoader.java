package fr.lapetina.tgbot.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.UnaryOperator;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from the file system, then the classpath
 * - Bot token from the {@code TELEGRAM_BOT_TOKEN} environment variable when the file
 *   leaves it blank
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String TOKEN_ENV = "TELEGRAM_BOT_TOKEN";

    private final Path configPath;
    private final Yaml yaml;
    private final UnaryOperator<String> environment;

    public ConfigLoader(String configPath) {
        this(configPath, System::getenv);
    }

    /**
     * @param environment environment variable lookup, replaceable in tests
     */
    public ConfigLoader(String configPath, UnaryOperator<String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = environment;
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(BotConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails
     */
    public BotConfig load() {
        return resolveToken(loadFromPath());
    }

    private BotConfig loadFromPath() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    /**
     * Loads configuration from an input stream.
     */
    public BotConfig loadFromStream(InputStream inputStream) {
        return resolveToken(parse(inputStream, "stream"));
    }

    private BotConfig parse(InputStream is, String source) {
        try {
            BotConfig config = yaml.load(is);
            // an empty document yields null
            return config != null ? config : new BotConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private BotConfig resolveToken(BotConfig config) {
        String token = config.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            String fromEnv = environment.apply(TOKEN_ENV);
            if (fromEnv != null && !fromEnv.isBlank()) {
                log.info("Bot token taken from environment variable {}", TOKEN_ENV);
                config.getTelegram().setToken(fromEnv.trim());
            }
        }
        return config;
    }

    /**
     * Creates a default configuration.
     */
    public static BotConfig createDefault() {
        return new BotConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
