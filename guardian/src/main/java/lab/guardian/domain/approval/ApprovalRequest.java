package lab.guardian.domain.approval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Row of {@code approval_requests}: a transaction signed by the primary key that waits for the
 * second device. There is no version column, so updates are last-write-wins.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApprovalRequest {

    public static final String TABLE = "approval_requests";

    private UUID id;
    private String walletAddress;
    private String action;
    private String token;
    private String amount;
    private String recipient;
    private String callsJson;
    private String sig1Json;
    private String nonce;
    private String resourceBoundsJson;
    private String txHash;
    private ApprovalStatus status;
    private String finalTxHash;
    private String errorMessage;
    private Instant createdAt;
    private Instant respondedAt;
}
