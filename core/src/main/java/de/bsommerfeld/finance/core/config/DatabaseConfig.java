package de.bsommerfeld.finance.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.finance.core.util.StorageUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Location of the SQLite store and list defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseConfig {

    @JsonProperty("file-name")
    private String fileName = "finance.db";

    /** Directory holding the store file. Blank means the app data directory. */
    @JsonProperty("directory")
    private String directory = "";

    /** Row cap for the main transaction list, 0 for no limit. */
    @JsonProperty("default-limit")
    private int defaultLimit = 0;

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    /**
     * Resolves the absolute path of the store file. The file and its parent
     * directory are not created here.
     *
     * @param appName application identifier used for the default directory
     */
    public Path resolveDatabaseFile(String appName) {
        Path dir = (directory == null || directory.isBlank())
                ? StorageUtils.getAppDataDir(appName)
                : Paths.get(directory);
        return dir.resolve(fileName).toAbsolutePath();
    }
}
