package com.github.dimitryivaniuta.money;

/** Base type for every failure reported by the money formatter. */
public class MoneyFormatException extends RuntimeException {

    public MoneyFormatException(String message) {
        super(message);
    }
}
