package com.github.dimitryivaniuta.money.currency;

import java.util.Optional;
import java.util.Set;

/** Read-only lookup of currency display attributes by ISO code. */
public interface CurrencyCatalog {

    /** Case-insensitive lookup, e.g. "usd" or "USD". Empty for null or unknown codes. */
    Optional<CurrencyRecord> find(String code);

    /** Supported codes, lower-case and sorted. */
    Set<String> codes();

    default CurrencyRecord require(String code) {
        return find(code).orElseThrow(() -> new UnknownCurrencyException(code));
    }

    default boolean supports(String code) {
        return find(code).isPresent();
    }

    default int size() {
        return codes().size();
    }
}
