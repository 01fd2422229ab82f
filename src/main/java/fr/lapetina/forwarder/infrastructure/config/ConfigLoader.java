package fr.lapetina.forwarder.infrastructure.config;

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

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from file system, falling back to the classpath
 * - Validation of the loaded values
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG = "forwarder.yaml";

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ForwarderConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public ForwarderConfig load() {
        return validate(loadFromPath());
    }

    private ForwarderConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
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

    private ForwarderConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public ForwarderConfig loadFromStream(InputStream inputStream) {
        return validate(parse(inputStream, "stream"));
    }

    private ForwarderConfig parse(InputStream is, String source) {
        try {
            ForwarderConfig config = yaml.load(is);
            // An empty document yields null; fall back to defaults
            return config != null ? config : new ForwarderConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    static ForwarderConfig validate(ForwarderConfig config) {
        if (config.getCache().getCapacity() <= 0) {
            throw new ConfigurationException("cache.capacity must be > 0");
        }
        if (config.getWorker().getChannelSize() <= 0) {
            throw new ConfigurationException("worker.channelSize must be > 0");
        }
        if (config.getWorker().getMaxConsecutiveFailures() <= 0) {
            throw new ConfigurationException("worker.maxConsecutiveFailures must be > 0");
        }
        int ringBufferSize = config.getDispatch().getRingBufferSize();
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("dispatch.ringBufferSize must be a power of 2");
        }
        if (config.getDispatch().getShutdownTimeoutMs() <= 0) {
            throw new ConfigurationException("dispatch.shutdownTimeoutMs must be > 0");
        }
        return config;
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
