package irmigrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads migration configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code migration.properties} on the classpath</li>
 *   <li>{@code migration.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file-based values, using the same keys
 * (e.g. {@code -Dmigration.validate.references=false}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code migration.version.key} - envelope attribute holding the version</li>
 *   <li>{@code migration.validate.references} - true or false</li>
 *   <li>{@code migration.output.pretty} - true or false</li>
 *   <li>{@code migration.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see MigrationConfig
 */
public final class MigrationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigrationConfigLoader.class);

    private MigrationConfigLoader() {}

    /**
     * Load from classpath (migration.properties or migration.yml).
     * @throws MigrationConfigException if no config file found
     */
    public static MigrationConfig load() {
        InputStream is = getResource("migration.properties");
        if (is != null) {
            return loadProperties(is, "migration.properties");
        }

        is = getResource("migration.yml");
        if (is != null) {
            return loadYaml(is, "migration.yml");
        }

        throw new MigrationConfigException(
                "Config file required: migration.properties or migration.yml");
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     */
    public static MigrationConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return MigrationConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigrationConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
    }

    private static MigrationConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        } catch (RuntimeException e) {
            throw new MigrationConfigException("Invalid YAML in " + source, e);
        }
        if (root == null) {
            return MigrationConfig.DEFAULTS;
        }
        Properties props = new Properties();
        flatten("", root, props);
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    private static MigrationConfig parse(Properties props) {
        MigrationConfig.Builder b = MigrationConfig.builder();

        getString(props, "migration.version.key").ifPresent(v -> {
            if (v.isEmpty()) {
                log.warn("Empty version.key, using default");
            } else {
                b.versionKey(v);
            }
        });

        getBoolean(props, "migration.validate.references").ifPresent(b::validateReferences);
        getBoolean(props, "migration.output.pretty").ifPresent(b::prettyPrint);

        getString(props, "migration.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Boolean> getBoolean(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            if (v.equalsIgnoreCase("true")) return Optional.of(true);
            if (v.equalsIgnoreCase("false")) return Optional.of(false);
            log.warn("Invalid boolean for {}: {}", key, v);
            return Optional.empty();
        });
    }
}
