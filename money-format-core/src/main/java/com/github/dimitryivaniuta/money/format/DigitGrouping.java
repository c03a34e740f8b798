package com.github.dimitryivaniuta.money.format;

import java.util.Objects;

/** Thousands grouping of unsigned integer digit strings. */
public final class DigitGrouping {

    private static final int GROUP_SIZE = 3;

    private DigitGrouping() {}

    /** "1234567" with "," gives "1,234,567"; up to three digits are returned unchanged. */
    public static String group(String digits, String separator) {
        Objects.requireNonNull(digits, "digits");
        Objects.requireNonNull(separator, "separator");

        int length = digits.length();
        if (length <= GROUP_SIZE) return digits;

        int lead = length % GROUP_SIZE;
        StringBuilder sb = new StringBuilder(length + (length / GROUP_SIZE) * separator.length());
        if (lead > 0) sb.append(digits, 0, lead);
        for (int i = lead; i < length; i += GROUP_SIZE) {
            if (i > 0) sb.append(separator);
            sb.append(digits, i, i + GROUP_SIZE);
        }
        return sb.toString();
    }

    /** Removes every occurrence of {@code separator}. */
    public static String ungroup(String grouped, String separator) {
        Objects.requireNonNull(grouped, "grouped");
        Objects.requireNonNull(separator, "separator");
        return separator.isEmpty() ? grouped : grouped.replace(separator, "");
    }
}
