package lab.guardian.domain.outbox;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Row of {@code ward_approval_events_outbox}, unique on {@code (approval_id, event_version, event_type)}.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WardApprovalEvent {

    public static final String TABLE = "ward_approval_events_outbox";
    public static final List<String> CONFLICT_KEY = List.of("approval_id", "event_version", "event_type");

    private UUID id;
    private UUID approvalId;
    private int eventVersion;
    private WardApprovalEventType eventType;
    private List<String> targetWallets;
    private NotificationEnvelope payload;
    private OutboxStatus status;
    private int attempts;
    private Instant nextAttemptAt;
    private Instant processingUntil;
    private UUID leaseToken;
    private String lastError;
    private Instant createdAt;
    private Instant updatedAt;
}
