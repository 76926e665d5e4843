package lab.guardian.orchestration.outbox;

import lab.guardian.adapter.store.StoreAdapter;
import lab.guardian.common.Addresses;
import lab.guardian.domain.outbox.NotificationEnvelope;
import lab.guardian.domain.outbox.OutboxStatus;
import lab.guardian.domain.outbox.WardApprovalEvent;
import lab.guardian.domain.outbox.WardApprovalEventType;
import lab.guardian.domain.wardapproval.WardApprovalRequest;
import lab.guardian.domain.wardapproval.WardApprovalStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Producer side of the ward approval notification outbox.
 * <p>
 * Events are written after the approval row has been committed. The two writes are not atomic: an
 * enqueue failure is logged and dropped here and left to {@link OutboxReconciler} to repair.
 * Upserting on {@code (approval_id, event_version, event_type)} makes a repeated enqueue of the same
 * transition collapse into one event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WardApprovalOutbox {

    private final StoreAdapter store;

    public void enqueueCreated(WardApprovalRequest approval) {
        enqueueQuietly(approval, WardApprovalEventType.CREATED, null);
    }

    public void enqueueStatusChanged(WardApprovalRequest approval, WardApprovalStatus previousStatus) {
        enqueueQuietly(approval, WardApprovalEventType.STATUS_CHANGED, previousStatus);
    }

    // Throws on store failure; callers on the request path go through enqueueQuietly.
    public WardApprovalEvent enqueue(WardApprovalRequest approval, WardApprovalEventType eventType, WardApprovalStatus previousStatus) {
        Instant now = Instant.now();
        UUID eventId = UUID.randomUUID();
        int eventVersion = Math.max(1, approval.getEventVersion());

        WardApprovalEvent event = WardApprovalEvent.builder()
                .id(eventId)
                .approvalId(approval.getId())
                .eventVersion(eventVersion)
                .eventType(eventType)
                .targetWallets(targetWallets(approval))
                .payload(envelope(eventId, eventType, approval, previousStatus))
                .status(OutboxStatus.PENDING)
                .attempts(0)
                .nextAttemptAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();

        List<WardApprovalEvent> rows = store.upsert(WardApprovalEvent.TABLE, event, WardApprovalEvent.CONFLICT_KEY, WardApprovalEvent.class);
        log.info(
                "event=ward_outbox.enqueued approvalId={} eventType={} eventVersion={} status={} previousStatus={}",
                approval.getId(),
                eventType.wireName(),
                eventVersion,
                approval.getStatus() == null ? null : approval.getStatus().wireName(),
                previousStatus == null ? null : previousStatus.wireName()
        );
        return rows.isEmpty() ? event : rows.get(0);
    }

    private void enqueueQuietly(WardApprovalRequest approval, WardApprovalEventType eventType, WardApprovalStatus previousStatus) {
        try {
            enqueue(approval, eventType, previousStatus);
        } catch (RuntimeException e) {
            log.warn(
                    "event=ward_outbox.enqueue_failed approvalId={} eventType={} eventVersion={} error={}",
                    approval.getId(),
                    eventType.wireName(),
                    approval.getEventVersion(),
                    e.getMessage()
            );
        }
    }

    static List<String> targetWallets(WardApprovalRequest approval) {
        Set<String> wallets = new LinkedHashSet<>();
        for (String address : new String[]{approval.getWardAddress(), approval.getGuardianAddress()}) {
            if (address != null && !address.isBlank()) {
                wallets.add(Addresses.normalize(address));
            }
        }
        return List.copyOf(wallets);
    }

    static NotificationEnvelope envelope(
            UUID eventId,
            WardApprovalEventType eventType,
            WardApprovalRequest approval,
            WardApprovalStatus previousStatus) {
        NotificationText text = NotificationText.of(eventType, approval.getStatus());
        return new NotificationEnvelope(
                text.title(),
                text.body(),
                new NotificationEnvelope.Data(
                        NotificationEnvelope.SCHEMA_VERSION,
                        eventId,
                        approval.getId(),
                        eventType,
                        Math.max(1, approval.getEventVersion()),
                        approval.getStatus() == null ? null : approval.getStatus().wireName(),
                        previousStatus == null ? null : previousStatus.wireName(),
                        approval.getWardAddress(),
                        approval.getGuardianAddress(),
                        approval.getAction(),
                        approval.getToken(),
                        approval.getAmount()
                )
        );
    }
}
