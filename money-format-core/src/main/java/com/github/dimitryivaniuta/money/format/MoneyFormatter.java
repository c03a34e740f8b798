package com.github.dimitryivaniuta.money.format;

import com.github.dimitryivaniuta.money.currency.CurrencyCatalog;
import com.github.dimitryivaniuta.money.currency.CurrencyRecord;
import com.github.dimitryivaniuta.money.currency.EmbeddedCurrencyCatalog;

import java.util.Map;
import java.util.Objects;

/**
 * Formats a monetary value according to the rules of its currency.
 *
 * <pre>
 * format(10)                                                   // "$10.00"
 * format(10, Map.of("currency", "eur"))                        // "€10.00"
 * format(10, Map.of("with_cents", false))                      // "$10"
 * format(10, Map.of("with_currency", true))                    // "$10.00 USD"
 * format(10, Map.of("with_symbol", false))                     // "10.00"
 * format(10, Map.of("with_symbol_space", true))                // "$ 10.00"
 * format(1000)                                                 // "$1,000.00"
 * format(1000, Map.of("with_thousands_separator", false))      // "$1000.00"
 * format(-1234.5)                                              // "-$1,234.50"
 * </pre>
 *
 * Instances are immutable and safe to share between threads.
 */
public final class MoneyFormatter {

    private final CurrencyCatalog catalog;
    private final MoneyFormatOptions defaults;

    /**
     * @throws com.github.dimitryivaniuta.money.currency.UnknownCurrencyException if the default
     *         currency is not in {@code catalog}
     */
    public MoneyFormatter(CurrencyCatalog catalog, MoneyFormatOptions defaults) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        catalog.require(defaults.getCurrency());
    }

    /** Embedded currency table and {@link MoneyFormatOptions#defaults()}. */
    public static MoneyFormatter standard() {
        return Standard.INSTANCE;
    }

    public MoneyFormatOptions defaults() {
        return defaults;
    }

    public CurrencyCatalog catalog() {
        return catalog;
    }

    public String format(double value) {
        return format(value, defaults);
    }

    /** Map keys override this formatter's defaults one by one. */
    public String format(double value, Map<String, ?> options) {
        return format(value, defaults.override(options));
    }

    public String format(double value, MoneyFormatOptions options) {
        Objects.requireNonNull(options, "options");
        CurrencyRecord currency = catalog.require(options.getCurrency());
        AmountParts parts = AmountParts.split(value);

        String result = options.isWithThousandsSeparator()
                ? DigitGrouping.group(parts.integerDigits(), currency.thousandsSeparator())
                : parts.integerDigits();

        boolean cents = options.isWithCents() && currency.hasSubunit();
        if (cents) {
            result = result + currency.decimalMark() + parts.fractionalDigits();
        }

        if (options.isWithSymbol()) {
            result = addSymbol(result, currency, options.isWithSymbolSpace());
        }

        // no sign when everything shown is zero, e.g. -0.4 without cents
        if (parts.negative() && (cents || !parts.isWholeZero())) {
            result = "-" + result;
        }

        if (options.isWithCurrency()) {
            result = result + " " + currency.isoCode();
        }
        return result;
    }

    private static String addSymbol(String amount, CurrencyRecord currency, boolean withSpace) {
        String space = withSpace ? " " : "";
        return currency.symbolFirst()
                ? currency.symbol() + space + amount
                : amount + space + currency.symbol();
    }

    private static final class Standard {
        static final MoneyFormatter INSTANCE =
                new MoneyFormatter(EmbeddedCurrencyCatalog.defaultCatalog(), MoneyFormatOptions.defaults());
    }
}
