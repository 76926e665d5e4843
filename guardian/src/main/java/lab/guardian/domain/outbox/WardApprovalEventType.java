package lab.guardian.domain.outbox;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum WardApprovalEventType {
    CREATED("ward_approval.created"),
    STATUS_CHANGED("ward_approval.status_changed");

    private final String wireName;

    WardApprovalEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static WardApprovalEventType fromWire(String value) {
        for (WardApprovalEventType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown ward approval event type: " + value);
    }
}
