package lab.guardian.domain.outbox;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery state of an outbox event. Only {@code pending} is written here; the other states belong
 * to the external dispatcher.
 */
public enum OutboxStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    RETRY("retry"),
    SENT("sent"),
    DEAD_LETTER("dead_letter");

    private final String wireName;

    OutboxStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static OutboxStatus fromWire(String value) {
        for (OutboxStatus status : values()) {
            if (status.wireName.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown outbox status: " + value);
    }
}
