package com.chambua.inventory.util;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Locale-fixed numeric grammar shared by import and export: optional leading minus, digit
 * groups optionally separated by commas, optional single decimal part. Commas are grouping
 * only and are dropped; nothing else (currency symbols, spaces, exponents) is accepted.
 */
public final class NumberGrammar {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(,\\d+)*(\\.\\d+)?");

    private NumberGrammar() {}

    public static Optional<BigDecimal> parse(String raw) {
        if (raw == null) return Optional.empty();
        String t = raw.trim();
        if (!NUMBER.matcher(t).matches()) return Optional.empty();
        return Optional.of(new BigDecimal(t.replace(",", "")));
    }

    /** Plain rendering without grouping or exponent, trailing zeros removed. */
    public static String format(BigDecimal value) {
        if (value == null) return "";
        if (value.signum() == 0) return "0";
        return value.stripTrailingZeros().toPlainString();
    }
}
