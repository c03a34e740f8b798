package com.github.dimitryivaniuta.money.currency;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddedCurrencyCatalogTest {

    private final EmbeddedCurrencyCatalog catalog = EmbeddedCurrencyCatalog.defaultCatalog();

    @Test
    void defaultCatalogIsLoadedOnce() {
        assertThat(EmbeddedCurrencyCatalog.defaultCatalog()).isSameAs(catalog);
    }

    @Test
    void usDollar() {
        CurrencyRecord usd = catalog.require("usd");

        assertThat(usd.isoCode()).isEqualTo("USD");
        assertThat(usd.symbol()).isEqualTo("$");
        assertThat(usd.symbolFirst()).isTrue();
        assertThat(usd.thousandsSeparator()).isEqualTo(",");
        assertThat(usd.decimalMark()).isEqualTo(".");
        assertThat(usd.hasSubunit()).isTrue();
    }

    @Test
    void lookupNormalizesCode() {
        assertThat(catalog.find("EUR")).contains(catalog.require("eur"));
        assertThat(catalog.find(" eur ")).isPresent();
        assertThat(catalog.find(null)).isEmpty();
        assertThat(catalog.supports("xyz")).isFalse();
    }

    @Test
    void requireFailsForUnknownCode() {
        assertThatThrownBy(() -> catalog.require("xyz"))
                .isInstanceOf(UnknownCurrencyException.class)
                .satisfies(e -> {
                    UnknownCurrencyException unknown = (UnknownCurrencyException) e;
                    assertThat(unknown.getCurrencyCode()).isEqualTo("xyz");
                    assertThat(unknown.getOptionKey()).isEqualTo("currency");
                });
    }

    @Test
    void codesAreSortedAndReadOnly() {
        assertThat(catalog.codes()).startsWith("aud").contains("usd", "eur", "jpy", "sek");
        assertThat(catalog.size()).isEqualTo(catalog.codes().size());
        assertThatThrownBy(() -> catalog.codes().add("xxx"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void everyRowIsKeyedByItsIsoCode() {
        for (String code : catalog.codes()) {
            assertThat(catalog.require(code).isoCode()).isEqualToIgnoringCase(code);
        }
    }

    @Test
    void zeroDecimalCurrenciesHaveNoSubunit() {
        assertThat(catalog.require("jpy").hasSubunit()).isFalse();
        assertThat(catalog.require("krw").hasSubunit()).isFalse();
        assertThat(catalog.require("vnd").hasSubunit()).isFalse();
    }

    @Test
    void readsCustomTable() throws Exception {
        EmbeddedCurrencyCatalog custom = EmbeddedCurrencyCatalog.read(json("""
                { "xts": { "iso_code": "XTS", "name": "Testing", "symbol": "T", "subunit": null,
                           "symbol_first": false, "thousands_separator": " ", "decimal_mark": "," } }
                """));

        assertThat(custom.codes()).containsExactly("xts");
        assertThat(custom.require("XTS").thousandsSeparator()).isEqualTo(" ");
    }

    @Test
    void rejectsMismatchedIsoCode() {
        assertThatThrownBy(() -> EmbeddedCurrencyCatalog.read(json("""
                { "usd": { "iso_code": "EUR", "symbol": "$", "subunit": "Cent",
                           "symbol_first": true, "thousands_separator": ",", "decimal_mark": "." } }
                """)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("iso_code");
    }

    @Test
    void rejectsMissingSeparator() {
        assertThatThrownBy(() -> EmbeddedCurrencyCatalog.read(json("""
                { "usd": { "iso_code": "USD", "symbol": "$", "subunit": "Cent",
                           "symbol_first": true, "decimal_mark": "." } }
                """)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("thousands_separator");
    }

    @Test
    void rejectsUnknownAttributes() {
        assertThatThrownBy(() -> EmbeddedCurrencyCatalog.read(json("""
                { "usd": { "iso_code": "USD", "symbol": "$", "colour": "green" } }
                """)))
                .isInstanceOf(UnrecognizedPropertyException.class);
    }

    @Test
    void missingResource() {
        assertThatThrownBy(() -> EmbeddedCurrencyCatalog.load("money/missing.json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("money/missing.json");
    }

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
