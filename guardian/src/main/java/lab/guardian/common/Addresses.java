package lab.guardian.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of account addresses: lower case, no leading zeros after {@code 0x}.
 * Two spellings of the same felt ({@code 0x00AbC} and {@code 0xabc}) must compare equal in filters.
 */
public final class Addresses {

    /** Normalized form of the all-zero address, used as "no ward" in ward configs. */
    public static final String ZERO = "0x0";

    private static final Pattern HEX = Pattern.compile("^0x[0-9a-fA-F]+$");

    private Addresses() {
    }

    public static String normalize(String address) {
        if (address == null) {
            return null;
        }
        String lower = address.trim().toLowerCase(Locale.ROOT);
        if (!lower.startsWith("0x")) {
            return lower;
        }
        String stripped = lower.substring(2).replaceFirst("^0+", "");
        return "0x" + (stripped.isEmpty() ? "0" : stripped);
    }

    public static boolean isHex(String value) {
        return value != null && HEX.matcher(value).matches();
    }
}
