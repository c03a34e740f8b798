package com.github.dimitryivaniuta.money.currency;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Display attributes of one currency, as stored in the embedded currency table.
 *
 * @param isoCode            upper-case ISO 4217 code, e.g. "USD"
 * @param name               display name, informational only
 * @param symbol             currency symbol, e.g. "$" or "kr"
 * @param subunit            name of the fractional unit, e.g. "Cent"; null for zero-decimal currencies
 * @param symbolFirst        true when the symbol precedes the amount
 * @param thousandsSeparator string inserted between groups of three integer digits
 * @param decimalMark        string between integer and fractional digits
 */
public record CurrencyRecord(
        @JsonProperty("iso_code") String isoCode,
        @JsonProperty("name") String name,
        @JsonProperty("symbol") String symbol,
        @JsonProperty("subunit") String subunit,
        @JsonProperty("symbol_first") boolean symbolFirst,
        @JsonProperty("thousands_separator") String thousandsSeparator,
        @JsonProperty("decimal_mark") String decimalMark
) {
    public boolean hasSubunit() {
        return subunit != null;
    }
}
