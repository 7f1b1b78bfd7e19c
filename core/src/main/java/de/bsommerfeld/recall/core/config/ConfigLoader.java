package de.bsommerfeld.recall.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import de.bsommerfeld.recall.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link MemoryConfig} from a TOML file. A missing file is created with
 * the defaults so users have something to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE = "config.toml";

    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {
    }

    /** Loads {@code config.toml} from the default application data directory. */
    public static MemoryConfig loadDefault() {
        return load(StorageUtils.getAppDataDir(MemoryConfig.APP_NAME).resolve(CONFIG_FILE));
    }

    public static MemoryConfig load(Path configFile) {
        try {
            if (Files.exists(configFile)) {
                MemoryConfig config = MAPPER.readValue(configFile.toFile(), MemoryConfig.class);
                LOG.info("Loaded configuration from {}", configFile);
                return config;
            }

            MemoryConfig defaults = new MemoryConfig();
            Path parent = configFile.toAbsolutePath().getParent();
            if (parent != null) {
                StorageUtils.ensureDirectory(parent);
            }
            MAPPER.writeValue(configFile.toFile(), defaults);
            LOG.info("Wrote default configuration to {}", configFile);
            return defaults;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + configFile, e);
        }
    }

    public static void save(MemoryConfig config, Path configFile) {
        try {
            MAPPER.writeValue(configFile.toFile(), config);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save configuration to " + configFile, e);
        }
    }
}
