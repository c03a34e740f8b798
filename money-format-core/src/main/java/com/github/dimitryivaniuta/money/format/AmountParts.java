package com.github.dimitryivaniuta.money.format;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A value rounded to two decimal places and split for display.
 *
 * @param negative         true when the rounded value is below zero
 * @param integerDigits    unsigned integer digits, no leading zeros beyond a single "0"
 * @param fractionalDigits exactly two digits
 */
public record AmountParts(boolean negative, String integerDigits, String fractionalDigits) {

    static final int SCALE = 2;

    /**
     * Rounds the exact binary value half-even to {@value #SCALE} places, then splits it. Rounding the
     * whole value means a fraction such as .999 carries into the integer digits.
     */
    public static AmountParts split(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("value must be finite: " + value);
        }
        BigDecimal rounded = new BigDecimal(value).setScale(SCALE, RoundingMode.HALF_EVEN);

        String digits = rounded.unscaledValue().abs().toString();
        if (digits.length() <= SCALE) {
            digits = "0".repeat(SCALE + 1 - digits.length()) + digits;
        }
        int cut = digits.length() - SCALE;
        return new AmountParts(rounded.signum() < 0, digits.substring(0, cut), digits.substring(cut));
    }

    public boolean isWholeZero() {
        return "0".equals(integerDigits);
    }
}
