package lab.guardian.orchestration;

import lab.guardian.common.Addresses;

/**
 * Field checks shared by the request bodies. Messages use the wire field names.
 */
public final class RequestChecks {

    private RequestChecks() {
    }

    public static String requireHex(String field, String value) {
        if (!Addresses.isHex(value)) {
            throw new InvalidRequestException(field + ": Must be a hex string starting with 0x");
        }
        return value;
    }

    public static String optionalHex(String field, String value) {
        return value == null ? null : requireHex(field, value);
    }

    public static String requireNonEmpty(String field, String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidRequestException(field + ": Must not be empty");
        }
        return value;
    }

    public static boolean requireFlag(String field, Boolean value) {
        if (value == null) {
            throw new InvalidRequestException(field + ": Required");
        }
        return value;
    }

    // Mirrors the lenient parsing of list endpoints: anything unusable falls back to the default.
    public static int limit(String raw, int defaultLimit, int maxLimit) {
        Double parsed = parseNumber(raw);
        if (parsed == null || parsed <= 0) {
            return defaultLimit;
        }
        return (int) Math.min(Math.floor(parsed), maxLimit);
    }

    public static int offset(String raw) {
        Double parsed = parseNumber(raw);
        if (parsed == null || parsed < 0) {
            return 0;
        }
        return (int) Math.min(Math.floor(parsed), Integer.MAX_VALUE);
    }

    private static Double parseNumber(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
