package de.bsommerfeld.finance.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Finance Tracker - Global Configuration. Persisted as {@code config.yaml} in
 * the application data directory via {@link ConfigurationLoader}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("user")
    private UserConfig user = new UserConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public UserConfig getUser() {
        return user;
    }
}
