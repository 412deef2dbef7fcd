package de.bsommerfeld.finance.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * User-facing preferences: display currency and the categories offered in
 * the transaction form before any have been stored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserConfig {

    @JsonProperty("currency")
    private String currency = "EUR";

    @JsonProperty("default-categories")
    private List<String> defaultCategories = new ArrayList<>(List.of(
            "Salary", "Rent", "Food", "Transport", "Entertainment", "Utilities", "Other"));

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public List<String> getDefaultCategories() {
        return defaultCategories;
    }

    public void setDefaultCategories(List<String> defaultCategories) {
        this.defaultCategories = defaultCategories;
    }
}
