package lab.guardian.adapter.store;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Value comparison for rows held as plain JSON values (strings, numbers, booleans, lists).
 * Timestamps are stored as ISO-8601 text and compared as instants, numbers as decimals.
 */
final class StoreValues {

    private StoreValues() {
    }

    static boolean sameValue(Object actual, String text) {
        if (actual instanceof Number number) {
            BigDecimal expected = toDecimal(text);
            return expected != null && new BigDecimal(number.toString()).compareTo(expected) == 0;
        }
        return String.valueOf(actual).equals(text);
    }

    static int compare(Object left, Object right) {
        if (left == null && right == null) {
            return 0;
        }
        if (left == null) {
            return 1;
        }
        if (right == null) {
            return -1;
        }
        String leftText = String.valueOf(left);
        String rightText = String.valueOf(right);
        if (left instanceof Number || right instanceof Number) {
            BigDecimal l = toDecimal(leftText);
            BigDecimal r = toDecimal(rightText);
            if (l != null && r != null) {
                return l.compareTo(r);
            }
        }
        Instant leftInstant = toInstant(leftText);
        Instant rightInstant = toInstant(rightText);
        if (leftInstant != null && rightInstant != null) {
            return leftInstant.compareTo(rightInstant);
        }
        return leftText.compareTo(rightText);
    }

    private static BigDecimal toDecimal(String text) {
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Instant toInstant(String text) {
        if (text.length() < 20 || text.charAt(4) != '-') {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
