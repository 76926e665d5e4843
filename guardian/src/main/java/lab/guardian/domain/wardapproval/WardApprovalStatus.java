package lab.guardian.domain.wardapproval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a ward approval request.
 *
 * <pre>
 * pending_ward_sig --> pending_guardian --> approved | rejected | failed | gas_error | expired
 *        |
 *        +--> approved | rejected | expired
 * </pre>
 *
 * Terminal statuses have no outgoing transitions.
 */
public enum WardApprovalStatus {
    PENDING_WARD_SIG("pending_ward_sig"),
    PENDING_GUARDIAN("pending_guardian"),
    APPROVED("approved"),
    REJECTED("rejected"),
    FAILED("failed"),
    GAS_ERROR("gas_error"),
    EXPIRED("expired");

    private static final Map<WardApprovalStatus, Set<WardApprovalStatus>> ALLOWED_TRANSITIONS =
            new EnumMap<>(WardApprovalStatus.class);

    static {
        ALLOWED_TRANSITIONS.put(PENDING_WARD_SIG, EnumSet.of(PENDING_GUARDIAN, APPROVED, REJECTED, EXPIRED));
        ALLOWED_TRANSITIONS.put(PENDING_GUARDIAN, EnumSet.of(APPROVED, REJECTED, FAILED, GAS_ERROR, EXPIRED));
    }

    private final String wireName;

    WardApprovalStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return !ALLOWED_TRANSITIONS.containsKey(this);
    }

    /** Only the two pending statuses may be used when a request is created. */
    public boolean isInitial() {
        return this == PENDING_WARD_SIG || this == PENDING_GUARDIAN;
    }

    public boolean canTransitionTo(WardApprovalStatus next) {
        Set<WardApprovalStatus> targets = ALLOWED_TRANSITIONS.get(this);
        return targets != null && targets.contains(next);
    }

    @JsonCreator
    public static WardApprovalStatus fromWire(String value) {
        for (WardApprovalStatus status : values()) {
            if (status.wireName.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown ward approval status: " + value);
    }
}
