package lab.guardian.orchestration.outbox;

import lab.guardian.domain.outbox.WardApprovalEventType;
import lab.guardian.domain.wardapproval.WardApprovalStatus;

record NotificationText(String title, String body) {

    static NotificationText of(WardApprovalEventType eventType, WardApprovalStatus status) {
        if (eventType == WardApprovalEventType.CREATED) {
            return new NotificationText(
                    "Ward approval required",
                    "A new ward approval request is waiting for action.");
        }
        if (status == null) {
            return updated();
        }
        return switch (status) {
            case PENDING_GUARDIAN -> new NotificationText(
                    "Guardian approval required",
                    "Ward signature received. Guardian approval is now needed.");
            case APPROVED -> new NotificationText(
                    "Ward approval completed",
                    "The ward approval request has been approved.");
            case REJECTED -> new NotificationText(
                    "Ward approval rejected",
                    "The ward approval request was rejected.");
            case EXPIRED -> new NotificationText(
                    "Ward approval expired",
                    "The ward approval request expired before completion.");
            case FAILED, GAS_ERROR -> new NotificationText(
                    "Ward approval failed",
                    "The ward approval request failed and requires attention.");
            default -> updated();
        };
    }

    private static NotificationText updated() {
        return new NotificationText(
                "Ward approval updated",
                "The ward approval request status has changed.");
    }
}
