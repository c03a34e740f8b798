package com.github.dimitryivaniuta.money.currency;

import com.github.dimitryivaniuta.money.ConfigurationException;
import com.github.dimitryivaniuta.money.format.MoneyFormatOptions;

/** Requested currency code has no row in the currency table. */
public class UnknownCurrencyException extends ConfigurationException {

    private final String currencyCode;

    public UnknownCurrencyException(String currencyCode) {
        super("Unknown currency code: '" + currencyCode + "'", MoneyFormatOptions.CURRENCY);
        this.currencyCode = currencyCode;
    }

    public String getCurrencyCode() {
        return currencyCode;
    }
}
