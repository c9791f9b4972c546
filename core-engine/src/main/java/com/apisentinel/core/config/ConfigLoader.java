package com.apisentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.introspector.BeanAccess;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Reads the sentinel YAML into a validated {@link SentinelConfig}.
 *
 * <p>
 * {@link #load()} reads the file named by {@value #ENV_CONFIG_PATH} when the
 * variable is set, and the bundled {@value #DEFAULT_RESOURCE} otherwise. A
 * variable naming a missing file is an error, not a reason to fall back.
 * </p>
 *
 * <p>
 * YAML keys are the field names of the configuration classes
 * ({@code zThreshold}, {@code minStdDev}, ...); fields, not setters, are
 * bound. Omitted keys keep their defaults and an empty document is the
 * default configuration. Duplicate keys and malformed YAML are rejected with
 * the name of the source. Every result has passed
 * {@link SentinelConfig#validate()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ENV_CONFIG_PATH = "SENTINEL_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "sentinel.yml";

    private ConfigLoader() {
        // utility class, not instantiable
    }

    /**
     * @return configuration from {@value #ENV_CONFIG_PATH} or the bundled default
     * @throws IllegalArgumentException if the variable names a missing file
     * @throws IllegalStateException    if the YAML is malformed or invalid
     */
    public static SentinelConfig load() {
        return load(System::getenv);
    }

    static SentinelConfig load(UnaryOperator<String> env) {
        String path = env.apply(ENV_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            LOG.info("No {} set, using bundled {}", ENV_CONFIG_PATH, DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        if (!Files.isRegularFile(Path.of(path))) {
            throw new IllegalArgumentException(ENV_CONFIG_PATH + " names a missing file: " + path);
        }
        return fromFile(path);
    }

    /**
     * @param path YAML file
     * @return validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file is unreadable, malformed or invalid
     */
    public static SentinelConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream in = new FileInputStream(path)) {
            return validated(parse(path, yaml -> yaml.load(in)));
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if the resource is unreadable, malformed or invalid
     */
    public static SentinelConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (in) {
            return validated(parse("classpath:" + resource, yaml -> yaml.load(in)));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * @param yamlText YAML document
     * @return validated configuration
     * @throws IllegalStateException if the text is malformed or invalid
     */
    public static SentinelConfig fromString(String yamlText) {
        Objects.requireNonNull(yamlText, "YAML text must not be null");
        return validated(parse("inline YAML", yaml -> yaml.load(yamlText)));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static SentinelConfig parse(String source, Function<Yaml, SentinelConfig> reader) {
        try {
            SentinelConfig config = reader.apply(newYaml());
            if (config == null) {
                LOG.warn("{} is empty, using built-in defaults", source);
                return new SentinelConfig();
            }
            LOG.info("Read sentinel configuration from {}", source);
            return config;
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed sentinel configuration in " + source + ": "
                    + e.getMessage(), e);
        }
    }

    private static SentinelConfig validated(SentinelConfig config) {
        config.validate();
        LOG.info("Sentinel configuration: {}", config);
        return config;
    }

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(SentinelConfig.class, options));
        yaml.setBeanAccess(BeanAccess.FIELD);
        return yaml;
    }
}
