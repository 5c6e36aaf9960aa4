package com.example.clubadmin.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * USD amounts as entered in admin forms ("45", "$1,200.50", " 12.3 ").
 */
public final class MoneyParser {

    private MoneyParser() {
    }

    /**
     * @throws IllegalArgumentException "invalid amount format" when the text is not a number
     */
    public static BigDecimal parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("invalid amount format");
        }
        String cleaned = raw.trim().replace(",", "");
        if (cleaned.startsWith("$")) {
            cleaned = cleaned.substring(1).trim();
        } else if (cleaned.startsWith("-$")) {
            cleaned = "-" + cleaned.substring(2).trim();
        }
        if (cleaned.isEmpty() || !cleaned.matches("-?\\d+(\\.\\d{1,2})?|-?\\.\\d{1,2}")) {
            throw new IllegalArgumentException("invalid amount format");
        }
        return new BigDecimal(cleaned).setScale(2, RoundingMode.UNNECESSARY);
    }

    /**
     * Parses and requires a value above zero.
     *
     * @throws IllegalArgumentException "invalid amount format" or "must be positive"
     */
    public static BigDecimal parsePositive(String raw) {
        BigDecimal amount = parse(raw);
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("must be positive");
        }
        return amount;
    }

    public static String format(BigDecimal amount) {
        NumberFormat fmt = NumberFormat.getCurrencyInstance(Locale.US);
        return fmt.format(amount == null ? BigDecimal.ZERO : amount);
    }
}
