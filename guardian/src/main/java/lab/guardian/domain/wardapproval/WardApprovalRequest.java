package lab.guardian.domain.wardapproval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
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
 * Row of {@code ward_approval_requests}. The three {@code needs*} flags are fixed at creation and decide
 * which hops (ward 2FA, guardian, guardian 2FA) the request has to pass.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WardApprovalRequest {

    public static final String TABLE = "ward_approval_requests";

    private UUID id;
    private String wardAddress;
    private String guardianAddress;
    private String action;
    private String token;
    private String amount;
    private AmountUnit amountUnit;
    private String recipient;
    private String callsJson;
    private String nonce;
    private String resourceBoundsJson;
    private String txHash;
    private String wardSigJson;

    @JsonProperty("ward_2fa_sig_json")
    private String ward2faSigJson;

    private String guardianSigJson;

    @JsonProperty("guardian_2fa_sig_json")
    private String guardian2faSigJson;

    @JsonProperty("needs_ward_2fa")
    private boolean needsWard2fa;

    private boolean needsGuardian;

    @JsonProperty("needs_guardian_2fa")
    private boolean needsGuardian2fa;

    private WardApprovalStatus status;
    private int eventVersion;
    private String finalTxHash;
    private String errorMessage;
    private Instant createdAt;
    private Instant respondedAt;
    private Instant updatedAt;

    /** Hash of the on-chain transaction this request stands for: the final one once known. */
    public String effectiveTxHash() {
        if (finalTxHash != null && !finalTxHash.isBlank()) {
            return finalTxHash;
        }
        return txHash;
    }
}
