package lab.guardian.orchestration.activity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivitySource {
    TRANSACTION("transaction"),
    WARD_REQUEST("ward_request");

    private final String wireName;

    ActivitySource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
