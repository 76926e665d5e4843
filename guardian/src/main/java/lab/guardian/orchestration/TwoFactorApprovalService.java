package lab.guardian.orchestration;

import lab.guardian.adapter.store.Filter;
import lab.guardian.adapter.store.SelectOptions;
import lab.guardian.adapter.store.StoreAdapter;
import lab.guardian.common.Addresses;
import lab.guardian.domain.approval.ApprovalRequest;
import lab.guardian.domain.approval.ApprovalStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Single-party approval: the primary key signs, a second device approves or rejects.
 * <p>
 * {@code approval_requests} has no version column. The transition check reads the row and then
 * writes by id, so two devices answering at the same moment both pass the check and the later write wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TwoFactorApprovalService {

    private final StoreAdapter store;

    public ApprovalRequest create(CreateApprovalRequest req) {
        ApprovalRequest row = ApprovalRequest.builder()
                .id(UUID.randomUUID())
                .walletAddress(Addresses.normalize(RequestChecks.requireHex("wallet_address", req.walletAddress())))
                .action(RequestChecks.requireNonEmpty("action", req.action()))
                .token(RequestChecks.requireNonEmpty("token", req.token()))
                .amount(req.amount())
                .recipient(req.recipient())
                .callsJson(RequestChecks.requireNonEmpty("calls_json", req.callsJson()))
                .sig1Json(RequestChecks.requireNonEmpty("sig1_json", req.sig1Json()))
                .nonce(RequestChecks.requireNonEmpty("nonce", req.nonce()))
                .resourceBoundsJson(RequestChecks.requireNonEmpty("resource_bounds_json", req.resourceBoundsJson()))
                .txHash(RequestChecks.requireHex("tx_hash", req.txHash()))
                .status(ApprovalStatus.PENDING)
                .createdAt(Instant.now())
                .build();

        List<ApprovalRequest> rows = store.insert(ApprovalRequest.TABLE, row, ApprovalRequest.class);
        ApprovalRequest created = rows.isEmpty() ? row : rows.get(0);
        log.info("event=two_factor_service.create.persisted approvalId={} wallet={}", created.getId(), created.getWalletAddress());
        return created;
    }

    public List<ApprovalRequest> list(String wallet, String status) {
        if (wallet == null || wallet.isBlank()) {
            throw new InvalidRequestException("Missing required query parameter: wallet");
        }
        Filter filter = Filter.eq("wallet_address", Addresses.normalize(wallet));
        if (status != null && !status.isBlank()) {
            filter = filter.andEq("status", parseStatus(status).wireName());
        }
        return store.select(ApprovalRequest.TABLE, filter, SelectOptions.orderBy("created_at.desc"), ApprovalRequest.class);
    }

    public ApprovalRequest get(UUID id) {
        List<ApprovalRequest> rows = store.select(ApprovalRequest.TABLE, Filter.eq("id", id), SelectOptions.first(), ApprovalRequest.class);
        if (rows.isEmpty()) {
            throw new NotFoundException("Approval request not found");
        }
        return rows.get(0);
    }

    public ApprovalRequest update(UUID id, UpdateApprovalRequest req) {
        if (req.status() == null) {
            throw new InvalidRequestException("status: Required");
        }
        ApprovalStatus target = parseStatus(req.status());
        RequestChecks.optionalHex("final_tx_hash", req.finalTxHash());

        ApprovalRequest current = get(id);
        if (target != current.getStatus() && !current.getStatus().canTransitionTo(target)) {
            log.warn(
                    "event=two_factor_service.update.rejected_transition approvalId={} from={} to={}",
                    id,
                    current.getStatus().wireName(),
                    target.wireName()
            );
            throw new ConflictException("Invalid approval status transition: " + current.getStatus().wireName() + " -> " + target.wireName());
        }

        Map<String, Object> values = new LinkedHashMap<>();
        values.put("status", target);
        if (req.finalTxHash() != null) {
            values.put("final_tx_hash", req.finalTxHash());
        }
        if (req.errorMessage() != null) {
            values.put("error_message", req.errorMessage());
        }
        if (target.isTerminal() && current.getRespondedAt() == null) {
            values.put("responded_at", Instant.now());
        }

        List<ApprovalRequest> rows = store.update(ApprovalRequest.TABLE, Filter.eq("id", id), values, ApprovalRequest.class);
        if (rows.isEmpty()) {
            throw new NotFoundException("Approval request not found");
        }
        log.info(
                "event=two_factor_service.update.persisted approvalId={} from={} to={}",
                id,
                current.getStatus().wireName(),
                target.wireName()
        );
        return rows.get(0);
    }

    private ApprovalStatus parseStatus(String value) {
        try {
            return ApprovalStatus.fromWire(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("status: Invalid enum value '" + value + "'");
        }
    }
}
