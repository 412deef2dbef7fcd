package de.bsommerfeld.finance.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationModeTest {

    private String original;

    @BeforeEach
    void rememberProperty() {
        original = System.getProperty("app.mode");
    }

    @AfterEach
    void restoreProperty() {
        if (original != null)
            System.setProperty("app.mode", original);
        else
            System.clearProperty("app.mode");
    }

    @Test
    void get_shouldResolveTestFromSystemProperty() {
        System.setProperty("app.mode", "TEST");
        assertEquals(ApplicationMode.TEST, ApplicationMode.get());
    }

    @Test
    void get_shouldBeCaseInsensitive() {
        System.setProperty("app.mode", "test");
        assertEquals(ApplicationMode.TEST, ApplicationMode.get());
    }

    @Test
    void get_shouldDefaultToProdForUnknownValue() {
        System.setProperty("app.mode", "STAGING");
        assertEquals(ApplicationMode.PROD, ApplicationMode.get());
    }

    @Test
    void get_withoutPropertyFallsBackToEnvironment() {
        System.clearProperty("app.mode");
        String env = System.getenv("APP_MODE");
        ApplicationMode expected = env != null && env.equalsIgnoreCase("TEST")
                ? ApplicationMode.TEST
                : ApplicationMode.PROD;
        assertEquals(expected, ApplicationMode.get());
    }

    @Test
    void isTest_shouldOnlyBeTrueForTest() {
        assertTrue(ApplicationMode.TEST.isTest());
        assertFalse(ApplicationMode.PROD.isTest());
    }
}
