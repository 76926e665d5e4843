package lab.guardian.orchestration.outbox;

import lab.guardian.adapter.store.Filter;
import lab.guardian.adapter.store.SelectOptions;
import lab.guardian.adapter.store.StoreAdapter;
import lab.guardian.domain.outbox.WardApprovalEvent;
import lab.guardian.domain.outbox.WardApprovalEventType;
import lab.guardian.domain.wardapproval.WardApprovalRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Repairs events lost between an approval write and its outbox enqueue.
 * <p>
 * Every accepted write leaves the row at some {@code event_version}; a row whose current version has no
 * outbox event of the matching type gets one re-derived from persisted state. The previous status of a
 * re-derived {@code status_changed} event is unknown and left empty.
 */
@Component
@Slf4j
public class OutboxReconciler {

    static final int DEFAULT_LIMIT = 200;
    static final int MAX_LIMIT = 1000;

    private final StoreAdapter store;
    private final WardApprovalOutbox outbox;
    private final Duration lookback;

    public OutboxReconciler(
            StoreAdapter store,
            WardApprovalOutbox outbox,
            @Value("${guardian.outbox.reconcile.lookback-minutes:60}") long lookbackMinutes) {
        this.store = store;
        this.outbox = outbox;
        this.lookback = Duration.ofMinutes(lookbackMinutes);
    }

    public ReconcileSummary reconcile(Instant updatedAfter, Integer limit, boolean dryRun) {
        Instant cutoff = updatedAfter != null ? updatedAfter : Instant.now().minus(lookback);
        int pageSize = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);

        List<WardApprovalRequest> approvals = store.select(
                WardApprovalRequest.TABLE,
                Filter.where("updated_at", Filter.Operator.GTE, cutoff),
                SelectOptions.page("updated_at.asc", pageSize, 0),
                WardApprovalRequest.class
        );
        if (approvals.isEmpty()) {
            return new ReconcileSummary(cutoff, 0, 0, 0, 0, dryRun);
        }

        List<UUID> ids = approvals.stream().map(WardApprovalRequest::getId).toList();
        List<WardApprovalEvent> existing = store.select(
                WardApprovalEvent.TABLE,
                Filter.in("approval_id", ids),
                WardApprovalEvent.class
        );
        Set<String> present = new HashSet<>();
        for (WardApprovalEvent event : existing) {
            present.add(key(event.getApprovalId(), event.getEventVersion(), event.getEventType()));
        }

        int missing = 0;
        int enqueued = 0;
        int failed = 0;
        for (WardApprovalRequest approval : approvals) {
            WardApprovalEventType type = expectedType(approval);
            if (present.contains(key(approval.getId(), Math.max(1, approval.getEventVersion()), type))) {
                continue;
            }
            missing++;
            if (dryRun) {
                log.info(
                        "event=ward_outbox.reconcile.missing approvalId={} eventVersion={} eventType={} dryRun=true",
                        approval.getId(),
                        approval.getEventVersion(),
                        type.wireName()
                );
                continue;
            }
            try {
                outbox.enqueue(approval, type, null);
                enqueued++;
            } catch (RuntimeException e) {
                failed++;
                log.warn(
                        "event=ward_outbox.reconcile.enqueue_failed approvalId={} eventVersion={} error={}",
                        approval.getId(),
                        approval.getEventVersion(),
                        e.getMessage()
                );
            }
        }

        ReconcileSummary summary = new ReconcileSummary(cutoff, approvals.size(), missing, enqueued, failed, dryRun);
        log.info(
                "event=ward_outbox.reconcile.done cutoff={} scanned={} missing={} enqueued={} failed={} dryRun={}",
                cutoff,
                summary.scanned(),
                missing,
                enqueued,
                failed,
                dryRun
        );
        return summary;
    }

    static WardApprovalEventType expectedType(WardApprovalRequest approval) {
        return approval.getEventVersion() <= 1 ? WardApprovalEventType.CREATED : WardApprovalEventType.STATUS_CHANGED;
    }

    private static String key(UUID approvalId, int eventVersion, WardApprovalEventType type) {
        return approvalId + "|" + eventVersion + "|" + (type == null ? "" : type.wireName());
    }
}
