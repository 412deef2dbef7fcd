package de.bsommerfeld.finance.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Reads and writes configuration POJOs as YAML.
 *
 * <p>
 * A missing file is created from the POJO's field defaults, so the user
 * always finds a complete, editable {@code config.yaml} after the first
 * start. Keys absent from an existing file keep their defaults; unknown keys
 * are ignored.
 *
 * <pre>
 * GlobalConfig config = ConfigurationLoader.from(path).load(GlobalConfig::new);
 * </pre>
 */
public final class ConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLoader.class);

    private final Path path;
    private final ObjectMapper mapper;

    private ConfigurationLoader(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES))
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static ConfigurationLoader from(Path path) {
        return new ConfigurationLoader(path);
    }

    /**
     * Loads the configuration, writing the defaults first if the file does not
     * exist yet.
     *
     * @param defaults factory for a POJO carrying the default values
     * @throws IOException if the file exists but cannot be read or parsed, or
     *                     the defaults cannot be written
     */
    public <T> T load(Supplier<T> defaults) throws IOException {
        T config = defaults.get();
        if (!Files.exists(path)) {
            LOG.info("No configuration at {}, writing defaults.", path);
            save(config);
            return config;
        }
        if (Files.size(path) == 0) {
            return config;
        }
        return mapper.readerForUpdating(config).readValue(path.toFile());
    }

    /**
     * Persists the given configuration, creating parent directories as needed.
     */
    public void save(Object config) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(path.toFile(), config);
    }

    public Path getPath() {
        return path;
    }
}
