package lab.guardian.domain.ward;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum WardConfigStatus {
    ACTIVE("active"),
    FROZEN("frozen"),
    REMOVED("removed");

    private final String wireName;

    WardConfigStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static WardConfigStatus fromWire(String value) {
        for (WardConfigStatus status : values()) {
            if (status.wireName.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown ward status: " + value);
    }
}
