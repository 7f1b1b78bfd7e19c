package de.bsommerfeld.recall.db;

import com.google.inject.AbstractModule;
import de.bsommerfeld.recall.core.config.ConfigLoader;
import de.bsommerfeld.recall.core.config.MemoryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Guice wiring for the memory engine: configuration, the wall clock and the
 * SQLite store.
 */
public class MemoryModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryModule.class);

    private final MemoryConfig config;
    private final Clock clock;

    /** Loads {@code config.toml} from the platform data directory. */
    public MemoryModule() {
        this(ConfigLoader.loadDefault(), Clock.systemUTC());
    }

    public MemoryModule(MemoryConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    protected void configure() {
        LOG.info("Memory data directory: {}", config.getDataDir());

        bind(MemoryConfig.class).toInstance(config);
        bind(Clock.class).toInstance(clock);

        bind(MemoryStore.class).to(SqlMemoryStore.class);
        bind(GraphSource.class).to(SqlMemoryStore.class);
    }
}
