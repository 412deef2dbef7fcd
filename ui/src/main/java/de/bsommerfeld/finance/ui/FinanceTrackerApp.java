package de.bsommerfeld.finance.ui;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.finance.core.concurrent.BackgroundTaskRunner;
import de.bsommerfeld.finance.core.util.StorageUtils;
import de.bsommerfeld.finance.db.StoreException;
import de.bsommerfeld.finance.db.TransactionStore;
import de.bsommerfeld.finance.ui.config.AppModule;
import de.bsommerfeld.finance.ui.view.MainWindow;
import javafx.application.Application;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class FinanceTrackerApp extends Application {

    static {
        // LOG_DIR must be set before Logback reads logback.xml
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (IOException e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(FinanceTrackerApp.class);
    private Injector injector;

    @Override
    public void init() {
        LOG.info("Initializing...");
        this.injector = Guice.createInjector(new AppModule());

        try {
            injector.getInstance(TransactionStore.class).ensureDatabase();
        } catch (StoreException e) {
            LOG.error("Cannot open the transaction store, aborting startup", e);
            throw e;
        }
    }

    @Override
    public void start(Stage primaryStage) {
        LOG.info("Starting UI...");
        injector.getInstance(MainWindow.class).show(primaryStage);
    }

    @Override
    public void stop() throws Exception {
        LOG.info("Stopping...");
        if (injector != null) {
            injector.getInstance(BackgroundTaskRunner.class).shutdown();
        }
        super.stop();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
