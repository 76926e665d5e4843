package lab.guardian.domain.outbox;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Push payload stored with each outbox event. {@code data} carries enough of the approval for the
 * dispatcher to pick target devices without reading the approval row again.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationEnvelope(
        String title,
        String body,
        Data data
) {
    public static final int SCHEMA_VERSION = 1;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(
            @JsonProperty("schema_version") int schemaVersion,
            @JsonProperty("event_id") UUID eventId,
            @JsonProperty("approval_id") UUID approvalId,
            @JsonProperty("event_type") WardApprovalEventType eventType,
            @JsonProperty("event_version") int eventVersion,
            @JsonProperty("status") String status,
            @JsonProperty("previous_status") String previousStatus,
            @JsonProperty("ward_address") String wardAddress,
            @JsonProperty("guardian_address") String guardianAddress,
            @JsonProperty("action") String action,
            @JsonProperty("token") String token,
            @JsonProperty("amount") String amount
    ) {
    }
}
