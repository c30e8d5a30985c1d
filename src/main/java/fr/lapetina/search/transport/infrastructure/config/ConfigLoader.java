package fr.lapetina.search.transport.infrastructure.config;

import fr.lapetina.search.transport.domain.strategy.StrategyFactory;
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
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Loading from an input stream
 * - Validation of the loaded values
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(TransportConfig.class, loaderOptions));
    }

    /**
     * Loads and validates configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public TransportConfig load() {
        return validate(loadFromPath());
    }

    private TransportConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString().replace('\\', '/');
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

    private TransportConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public TransportConfig loadFromStream(InputStream inputStream) {
        return validate(parse(inputStream, "stream"));
    }

    private TransportConfig parse(InputStream inputStream, String source) {
        TransportConfig config;
        try {
            config = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
        // An empty document yields null
        return config != null ? config : createDefault();
    }

    /**
     * Checks a configuration and returns it unchanged.
     *
     * @throws ConfigurationException listing every problem found
     */
    public static TransportConfig validate(TransportConfig config) {
        List<String> problems = new ArrayList<>();

        if (config.getNodes() == null || config.getNodes().isEmpty()) {
            problems.add("nodes: at least one node URL is required");
        } else if (config.getNodes().stream().anyMatch(url -> url == null || url.isBlank())) {
            problems.add("nodes: node URLs must not be blank");
        }
        // a section key with nothing under it binds to null
        if (config.getTimeouts() == null) {
            problems.add("timeouts: section is empty");
        } else {
            if (config.getTimeouts().getRequestTimeoutMs() <= 0) {
                problems.add("timeouts.requestTimeoutMs must be positive");
            }
            if (config.getTimeouts().getConnectTimeoutMs() <= 0) {
                problems.add("timeouts.connectTimeoutMs must be positive");
            }
        }
        if (config.getRetry() == null) {
            problems.add("retry: section is empty");
        } else if (config.getRetry().getMaxRetries() < 0) {
            problems.add("retry.maxRetries must not be negative");
        }
        if (config.getPool() == null) {
            problems.add("pool: section is empty");
        } else {
            if (config.getPool().getRevivalDelayMs() < 0) {
                problems.add("pool.revivalDelayMs must not be negative");
            }
            String strategy = config.getPool().getStrategy();
            if (strategy != null && StrategyFactory.create(strategy).isEmpty()) {
                problems.add("pool.strategy: unknown strategy '" + strategy
                        + "', expected one of " + StrategyFactory.getRegisteredNames());
            }
        }
        if (config.getAuth() == null) {
            problems.add("auth: section is empty");
        } else if (config.getAuth().getUsername() == null && config.getAuth().getPassword() != null) {
            problems.add("auth.password is set without auth.username");
        }
        if (config.getMetrics() == null) {
            problems.add("metrics: section is empty");
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", problems));
        }
        return config;
    }

    /**
     * Creates a default configuration. It has no nodes, so it does not
     * validate until some are added.
     */
    public static TransportConfig createDefault() {
        return new TransportConfig();
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
