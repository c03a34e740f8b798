package com.github.dimitryivaniuta.money;

/**
 * Formatting options could not be resolved: an unrecognised option key, a value of the wrong type,
 * or a currency code that is not in the catalog.
 */
public class ConfigurationException extends MoneyFormatException {

    /** Option key that caused the failure; null when the failure is not tied to a single key. */
    private final String optionKey;

    public ConfigurationException(String message, String optionKey) {
        super(message);
        this.optionKey = optionKey;
    }

    public String getOptionKey() {
        return optionKey;
    }
}
