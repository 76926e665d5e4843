package lab.guardian.orchestration.activity;

import com.fasterxml.jackson.annotation.JsonValue;
import lab.guardian.domain.wardapproval.WardApprovalStatus;

/**
 * Status shown in the unified feed. Transactions and ward approvals are projected onto it; the native
 * status of a ward approval is kept next to it as {@code status_detail}.
 */
public enum ActivityStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    FAILED("failed"),
    REJECTED("rejected"),
    GAS_ERROR("gas_error"),
    EXPIRED("expired");

    private final String wireName;

    ActivityStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static ActivityStatus fromTransaction(String status) {
        if ("confirmed".equals(status)) {
            return CONFIRMED;
        }
        if ("failed".equals(status)) {
            return FAILED;
        }
        return PENDING;
    }

    public static ActivityStatus fromWardApproval(WardApprovalStatus status) {
        if (status == null) {
            return PENDING;
        }
        return switch (status) {
            case APPROVED -> CONFIRMED;
            case REJECTED -> REJECTED;
            case GAS_ERROR -> GAS_ERROR;
            case FAILED -> FAILED;
            case EXPIRED -> EXPIRED;
            case PENDING_WARD_SIG, PENDING_GUARDIAN -> PENDING;
        };
    }
}
