package com.github.dimitryivaniuta.money.currency;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable currency table keyed by lower-case ISO code.
 *
 * The default table is read from {@value #DEFAULT_RESOURCE} on first use and shared for the
 * lifetime of the class loader. Instances never change after construction, so concurrent reads
 * need no locking.
 */
@Slf4j
public final class EmbeddedCurrencyCatalog implements CurrencyCatalog {

    public static final String DEFAULT_RESOURCE = "money/currencies.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, CurrencyRecord>> TABLE_TYPE = new TypeReference<>() {};

    private final Map<String, CurrencyRecord> currencies;
    private final Set<String> codes;

    public EmbeddedCurrencyCatalog(Map<String, CurrencyRecord> currencies) {
        Objects.requireNonNull(currencies, "currencies");
        currencies.forEach(EmbeddedCurrencyCatalog::validate);
        this.currencies = Map.copyOf(currencies);
        this.codes = Collections.unmodifiableSet(new TreeSet<>(this.currencies.keySet()));
    }

    /** The table shipped with this library. */
    public static EmbeddedCurrencyCatalog defaultCatalog() {
        return Holder.INSTANCE;
    }

    /** Reads a table from a classpath resource; fails with {@link IllegalStateException} if it is missing or malformed. */
    public static EmbeddedCurrencyCatalog load(String resource) {
        Objects.requireNonNull(resource, "resource");
        ClassLoader loader = EmbeddedCurrencyCatalog.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Currency table not found on classpath: " + resource);
            }
            EmbeddedCurrencyCatalog catalog = read(in);
            log.info("Loaded {} currencies from {}", catalog.size(), resource);
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read currency table " + resource, e);
        }
    }

    /** Parses a JSON object of {@code code -> record}. */
    public static EmbeddedCurrencyCatalog read(InputStream json) throws IOException {
        return new EmbeddedCurrencyCatalog(MAPPER.readValue(json, TABLE_TYPE));
    }

    @Override
    public Optional<CurrencyRecord> find(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(currencies.get(normalize(code)));
    }

    @Override
    public Set<String> codes() {
        return codes;
    }

    static String normalize(String code) {
        return code.trim().toLowerCase(Locale.ROOT);
    }

    private static void validate(String key, CurrencyRecord currency) {
        if (currency == null) {
            throw new IllegalStateException("Currency '" + key + "' has no attributes");
        }
        if (isBlank(currency.isoCode()) || !key.equals(normalize(currency.isoCode()))) {
            throw new IllegalStateException("Currency '" + key + "' has mismatched iso_code '" + currency.isoCode() + "'");
        }
        if (isBlank(currency.symbol())) {
            throw new IllegalStateException("Currency '" + key + "' has no symbol");
        }
        // separators may legitimately be a single space
        if (currency.thousandsSeparator() == null || currency.thousandsSeparator().isEmpty()) {
            throw new IllegalStateException("Currency '" + key + "' has no thousands_separator");
        }
        if (currency.decimalMark() == null || currency.decimalMark().isEmpty()) {
            throw new IllegalStateException("Currency '" + key + "' has no decimal_mark");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static final class Holder {
        static final EmbeddedCurrencyCatalog INSTANCE = load(DEFAULT_RESOURCE);
    }
}
