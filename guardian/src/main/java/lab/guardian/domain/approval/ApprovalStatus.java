package lab.guardian.domain.approval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a single-party (2FA) approval: {@code pending} to any of the terminal statuses.
 */
public enum ApprovalStatus {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected"),
    FAILED("failed"),
    EXPIRED("expired");

    private final String wireName;

    ApprovalStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(ApprovalStatus next) {
        return this == PENDING && next.isTerminal();
    }

    @JsonCreator
    public static ApprovalStatus fromWire(String value) {
        for (ApprovalStatus status : values()) {
            if (status.wireName.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown approval status: " + value);
    }
}
