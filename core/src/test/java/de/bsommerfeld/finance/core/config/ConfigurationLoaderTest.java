package de.bsommerfeld.finance.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_missingFile_shouldWriteDefaults() throws IOException {
        Path file = tempDir.resolve("nested").resolve("config.yaml");

        GlobalConfig config = ConfigurationLoader.from(file).load(GlobalConfig::new);

        assertTrue(Files.exists(file));
        assertEquals("finance.db", config.getDatabase().getFileName());
        assertEquals("EUR", config.getUser().getCurrency());
        String yaml = Files.readString(file);
        assertTrue(yaml.contains("file-name: finance.db"), yaml);
        assertTrue(yaml.contains("default-categories"), yaml);
        assertEquals(Set.of("database", "user"), Set.copyOf(topLevelKeys(yaml)));
    }

    @Test
    void load_fileWithRetiredKey_shouldIgnoreIt() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, "debug-mode: true\nuser:\n  currency: CHF\n");

        GlobalConfig config = ConfigurationLoader.from(file).load(GlobalConfig::new);

        assertEquals("CHF", config.getUser().getCurrency());
    }

    @Test
    void load_partialFile_shouldKeepDefaultsForMissingKeys() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, "database:\n  default-limit: 50\nuser:\n  currency: USD\nunknown-key: 1\n");

        GlobalConfig config = ConfigurationLoader.from(file).load(GlobalConfig::new);

        assertEquals(50, config.getDatabase().getDefaultLimit());
        assertEquals("finance.db", config.getDatabase().getFileName());
        assertEquals("USD", config.getUser().getCurrency());
        assertEquals(7, config.getUser().getDefaultCategories().size());
    }

    @Test
    void load_emptyFile_shouldReturnDefaults() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.createFile(file);

        GlobalConfig config = ConfigurationLoader.from(file).load(GlobalConfig::new);

        assertEquals("EUR", config.getUser().getCurrency());
        assertEquals(0, config.getDatabase().getDefaultLimit());
    }

    @Test
    void save_shouldRoundTripChangedValues() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        ConfigurationLoader loader = ConfigurationLoader.from(file);
        GlobalConfig config = loader.load(GlobalConfig::new);
        config.getUser().setDefaultCategories(List.of("Groceries", "Travel"));
        config.getDatabase().setDirectory(tempDir.toString());
        loader.save(config);

        GlobalConfig reloaded = ConfigurationLoader.from(file).load(GlobalConfig::new);

        assertEquals(List.of("Groceries", "Travel"), reloaded.getUser().getDefaultCategories());
        assertEquals(tempDir.resolve("finance.db").toAbsolutePath(),
                reloaded.getDatabase().resolveDatabaseFile("finance-tracker"));
    }

    @Test
    void load_malformedFile_shouldThrow() throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, "database: [unclosed\n");

        assertThrows(IOException.class, () -> ConfigurationLoader.from(file).load(GlobalConfig::new));
    }

    private static List<String> topLevelKeys(String yaml) {
        return yaml.lines()
                .filter(line -> !line.isBlank() && !Character.isWhitespace(line.charAt(0)) && !line.startsWith("-"))
                .map(line -> line.substring(0, line.indexOf(':')))
                .toList();
    }

    @Test
    void resolveDatabaseFile_blankDirectory_shouldUseAppDataDir() {
        DatabaseConfig db = new DatabaseConfig();
        Path resolved = db.resolveDatabaseFile("test-app");

        assertTrue(resolved.isAbsolute());
        assertEquals("finance.db", resolved.getFileName().toString());
        assertEquals("test-app", resolved.getParent().getFileName().toString());
    }
}
