package org.faculty.config;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.faculty.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads YAML configuration into an Apache Commons Configuration instance.
 * <p>
 * Location formats: "classpath:some/path.yaml" or a filesystem path.
 * A missing classpath resource yields an empty configuration so defaults apply;
 * a missing file is an error.
 */
public final class ConfigurationProvider {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationProvider.class);

    public static final String CLASSPATH_PREFIX = "classpath:";
    public static final String DEFAULT_LOCATION = CLASSPATH_PREFIX + "faculty-analytics.yaml";

    private final Configuration configuration;

    public ConfigurationProvider(String location) {
        if (location == null || location.isBlank()) {
            throw new ConfigException("Configuration location must be non-empty");
        }
        this.configuration = location.startsWith(CLASSPATH_PREFIX)
                ? loadFromClasspath(location.substring(CLASSPATH_PREFIX.length()))
                : loadFromFile(Path.of(location));
    }

    public Configuration config() {
        return configuration;
    }

    private static Configuration loadFromClasspath(String resourceName) {
        InputStream input = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resourceName);
        if (input == null) {
            log.debug("Configuration resource {} not found, using defaults", resourceName);
            return new YAMLConfiguration();
        }
        log.debug("Loading configuration from classpath resource: {}", resourceName);
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException | ConfigurationException e) {
            throw new ConfigException("Failed to read YAML from classpath resource: " + resourceName, e);
        }
    }

    private static Configuration loadFromFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigException("Configuration file does not exist: " + file.toAbsolutePath());
        }
        log.debug("Loading configuration from file: {}", file);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException | ConfigurationException e) {
            throw new ConfigException("Failed to read YAML from file: " + file, e);
        }
    }

    private static Configuration read(Reader reader) throws ConfigurationException {
        YAMLConfiguration config = new YAMLConfiguration();
        config.read(reader);
        return config;
    }
}
