package com.github.dimitryivaniuta.money.format;

import com.github.dimitryivaniuta.money.ConfigurationException;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Display options for {@link MoneyFormatter}. Every option has a default, so
 * {@code MoneyFormatOptions.defaults()} is a complete configuration.
 *
 * <pre>
 * currency                 "usd"
 * with_cents               true
 * with_currency            false
 * with_symbol              true
 * with_symbol_space        false
 * with_thousands_separator true
 * </pre>
 *
 * Loosely typed option maps (keys as above) are accepted through {@link #override(Map)}, which
 * validates key names and value types once and fails with {@link ConfigurationException}.
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class MoneyFormatOptions {

    public static final String CURRENCY = "currency";
    public static final String WITH_CENTS = "with_cents";
    public static final String WITH_CURRENCY = "with_currency";
    public static final String WITH_SYMBOL = "with_symbol";
    public static final String WITH_SYMBOL_SPACE = "with_symbol_space";
    public static final String WITH_THOUSANDS_SEPARATOR = "with_thousands_separator";

    public static final List<String> KEYS = List.of(
            CURRENCY, WITH_CENTS, WITH_CURRENCY, WITH_SYMBOL, WITH_SYMBOL_SPACE, WITH_THOUSANDS_SEPARATOR);

    /** Currency table key, e.g. "usd", "eur". */
    @NonNull
    @Builder.Default
    String currency = "usd";

    /** Append the decimal mark and two fractional digits (ignored for zero-decimal currencies). */
    @Builder.Default
    boolean withCents = true;

    /** Append a space and the ISO code, e.g. "$10.00 USD". */
    @Builder.Default
    boolean withCurrency = false;

    @Builder.Default
    boolean withSymbol = true;

    /** Single space between symbol and amount, on whichever side the symbol goes. */
    @Builder.Default
    boolean withSymbolSpace = false;

    @Builder.Default
    boolean withThousandsSeparator = true;

    private static final MoneyFormatOptions DEFAULTS = MoneyFormatOptions.builder().build();

    public static MoneyFormatOptions defaults() {
        return DEFAULTS;
    }

    /** Defaults overridden by the supplied map. */
    public static MoneyFormatOptions fromMap(Map<String, ?> options) {
        return DEFAULTS.override(options);
    }

    /**
     * Copy of these options with each supplied key replacing the current value; keys not present
     * keep their current value.
     *
     * @throws ConfigurationException for an unrecognised key or a value of the wrong type
     */
    public MoneyFormatOptions override(Map<String, ?> options) {
        Objects.requireNonNull(options, "options");
        if (options.isEmpty()) return this;

        MoneyFormatOptionsBuilder builder = toBuilder();
        for (Map.Entry<String, ?> entry : options.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (key == null) {
                throw reject(new ConfigurationException("Option key must not be null", null));
            }
            switch (key) {
                case CURRENCY -> builder.currency(stringValue(key, value));
                case WITH_CENTS -> builder.withCents(booleanValue(key, value));
                case WITH_CURRENCY -> builder.withCurrency(booleanValue(key, value));
                case WITH_SYMBOL -> builder.withSymbol(booleanValue(key, value));
                case WITH_SYMBOL_SPACE -> builder.withSymbolSpace(booleanValue(key, value));
                case WITH_THOUSANDS_SEPARATOR -> builder.withThousandsSeparator(booleanValue(key, value));
                default -> throw reject(new ConfigurationException(
                        "Unrecognized option '" + key + "'; expected one of " + KEYS, key));
            }
        }
        return builder.build();
    }

    private static boolean booleanValue(String key, Object value) {
        if (value instanceof Boolean b) return b;
        throw reject(mismatch(key, "a boolean", value));
    }

    private static String stringValue(String key, Object value) {
        if (value instanceof String s) return s;
        throw reject(mismatch(key, "a string", value));
    }

    private static ConfigurationException mismatch(String key, String expected, Object value) {
        String actual = value == null ? "null" : value.getClass().getSimpleName() + " (" + value + ")";
        return new ConfigurationException("Option '" + key + "' expects " + expected + " but got " + actual, key);
    }

    private static ConfigurationException reject(ConfigurationException e) {
        log.debug("Rejected money format options: {}", e.getMessage());
        return e;
    }
}
