package de.bsommerfeld.finance.ui.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.finance.core.concurrent.BackgroundTaskRunner;
import de.bsommerfeld.finance.core.config.ApplicationMode;
import de.bsommerfeld.finance.core.config.ConfigurationLoader;
import de.bsommerfeld.finance.core.config.DatabaseConfig;
import de.bsommerfeld.finance.core.config.GlobalConfig;
import de.bsommerfeld.finance.core.config.UserConfig;
import de.bsommerfeld.finance.core.util.StorageUtils;
import de.bsommerfeld.finance.db.InMemoryTransactionStore;
import de.bsommerfeld.finance.db.SqlTransactionStore;
import de.bsommerfeld.finance.db.TransactionStore;
import javafx.application.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice Module for UI and Application wiring.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path configPath;
    private final ApplicationMode mode;

    public AppModule() {
        this(StorageUtils.getConfigFile(StorageUtils.APP_NAME), ApplicationMode.get());
    }

    AppModule(Path configPath, ApplicationMode mode) {
        this.configPath = configPath;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        try {
            LOG.info("Loading Configuration from: {}", configPath);
            ConfigurationLoader loader = ConfigurationLoader.from(configPath);
            GlobalConfig config = loader.load(GlobalConfig::new);

            bind(ConfigurationLoader.class).toInstance(loader);
            bind(GlobalConfig.class).toInstance(config);
            bind(DatabaseConfig.class).toInstance(config.getDatabase());
            bind(UserConfig.class).toInstance(config.getUser());
        } catch (Exception e) {
            throw new RuntimeException("Failed to load Application Configuration", e);
        }

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode == ApplicationMode.TEST) {
            bind(TransactionStore.class).to(InMemoryTransactionStore.class);
        } else {
            bind(TransactionStore.class).to(SqlTransactionStore.class);
        }
    }

    @Provides
    @Singleton
    SqlTransactionStore provideSqlStore(DatabaseConfig databaseConfig) {
        Path dbFile = databaseConfig.resolveDatabaseFile(StorageUtils.APP_NAME);
        LOG.info("Using database file: {}", dbFile);
        return new SqlTransactionStore(dbFile);
    }

    @Provides
    @Singleton
    BackgroundTaskRunner provideTaskRunner() {
        return new BackgroundTaskRunner(Platform::runLater);
    }
}
