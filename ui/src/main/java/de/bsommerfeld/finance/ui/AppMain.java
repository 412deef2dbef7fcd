package de.bsommerfeld.finance.ui;

/**
 * Non-Application entry point for classpath-mode launches.
 *
 * <p>
 * JavaFX's launcher refuses to start an {@code Application} subclass as the
 * main class when the JavaFX modules are on the classpath. This wrapper
 * delegates to {@link FinanceTrackerApp#main} from a plain class.
 */
public final class AppMain {

    public static void main(String[] args) {
        FinanceTrackerApp.main(args);
    }
}
