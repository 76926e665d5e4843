package lab.guardian.orchestration;

import lab.guardian.adapter.store.Filter;
import lab.guardian.adapter.store.SelectOptions;
import lab.guardian.adapter.store.StoreAdapter;
import lab.guardian.common.Addresses;
import lab.guardian.domain.wardapproval.AmountUnit;
import lab.guardian.domain.wardapproval.WardApprovalRequest;
import lab.guardian.domain.wardapproval.WardApprovalStatus;
import lab.guardian.orchestration.outbox.WardApprovalOutbox;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Multi-party approval of a ward's transaction: ward signature, optional guardian decision, optional
 * second-device confirmation at either hop.
 * <p>
 * Status changes are compare-and-swap writes on {@code (id, event_version)}. When two devices race,
 * the store accepts exactly one write per version; the loser gets the winning row back and decides
 * again from there.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WardApprovalService {

    static final int DEFAULT_LIST_LIMIT = 50;
    static final int MAX_LIST_LIMIT = 200;
    static final List<WardApprovalStatus> PENDING_STATUSES =
            List.of(WardApprovalStatus.PENDING_WARD_SIG, WardApprovalStatus.PENDING_GUARDIAN);

    private static final Set<String> TRUTHY = Set.of("1", "true", "yes");

    private final StoreAdapter store;
    private final WardApprovalOutbox outbox;

    public WardApprovalRequest create(CreateWardApprovalRequest req) {
        WardApprovalStatus initialStatus = parseInitialStatus(req.initialStatus());
        AmountUnit amountUnit = parseAmountUnit(req.amountUnit());
        Instant now = Instant.now();

        WardApprovalRequest row = WardApprovalRequest.builder()
                .id(UUID.randomUUID())
                .wardAddress(Addresses.normalize(RequestChecks.requireHex("ward_address", req.wardAddress())))
                .guardianAddress(Addresses.normalize(RequestChecks.requireHex("guardian_address", req.guardianAddress())))
                .action(RequestChecks.requireNonEmpty("action", req.action()))
                .token(RequestChecks.requireNonEmpty("token", req.token()))
                .amount(req.amount())
                .amountUnit(amountUnit)
                .recipient(req.recipient())
                .callsJson(RequestChecks.requireNonEmpty("calls_json", req.callsJson()))
                .nonce(RequestChecks.requireNonEmpty("nonce", req.nonce()))
                .resourceBoundsJson(RequestChecks.requireNonEmpty("resource_bounds_json", req.resourceBoundsJson()))
                .txHash(RequestChecks.requireHex("tx_hash", req.txHash()))
                .wardSigJson(RequestChecks.requireNonEmpty("ward_sig_json", req.wardSigJson()))
                .needsWard2fa(RequestChecks.requireFlag("needs_ward_2fa", req.needsWard2fa()))
                .needsGuardian(RequestChecks.requireFlag("needs_guardian", req.needsGuardian()))
                .needsGuardian2fa(RequestChecks.requireFlag("needs_guardian_2fa", req.needsGuardian2fa()))
                .status(initialStatus)
                .eventVersion(1)
                .createdAt(now)
                .respondedAt(null)
                .updatedAt(now)
                .build();

        List<WardApprovalRequest> rows = store.insert(WardApprovalRequest.TABLE, row, WardApprovalRequest.class);
        WardApprovalRequest created = rows.isEmpty() ? row : rows.get(0);
        log.info(
                "event=ward_approval_service.create.persisted approvalId={} ward={} guardian={} status={} needsWard2fa={} needsGuardian={} needsGuardian2fa={}",
                created.getId(),
                created.getWardAddress(),
                created.getGuardianAddress(),
                created.getStatus().wireName(),
                created.isNeedsWard2fa(),
                created.isNeedsGuardian(),
                created.isNeedsGuardian2fa()
        );

        outbox.enqueueCreated(created);
        return created;
    }

    public WardApprovalRequest get(UUID id) {
        List<WardApprovalRequest> rows = store.select(
                WardApprovalRequest.TABLE,
                Filter.eq("id", id),
                SelectOptions.first(),
                WardApprovalRequest.class
        );
        if (rows.isEmpty()) {
            throw new NotFoundException("Ward approval request not found");
        }
        return rows.get(0);
    }

    public List<WardApprovalRequest> list(WardApprovalQuery query) {
        String ward = blankToNull(query.ward());
        String guardian = blankToNull(query.guardian());
        List<WardApprovalStatus> statuses = resolveStatuses(query.status(), ward != null || guardian != null, isTruthy(query.includeAll()));
        int limit = RequestChecks.limit(query.limit(), DEFAULT_LIST_LIMIT, MAX_LIST_LIMIT);
        int offset = RequestChecks.offset(query.offset());

        Filter filter = Filter.all();
        if (ward != null) {
            filter = filter.andEq("ward_address", Addresses.normalize(ward));
        }
        if (guardian != null) {
            filter = filter.andEq("guardian_address", Addresses.normalize(guardian));
        }
        if (statuses.size() == 1) {
            filter = filter.andEq("status", statuses.get(0).wireName());
        } else if (statuses.size() > 1) {
            filter = filter.andIn("status", statuses.stream().map(WardApprovalStatus::wireName).toList());
        }
        String updatedAfter = blankToNull(query.updatedAfter());
        if (updatedAfter != null) {
            filter = filter.and("updated_at", Filter.Operator.GTE, parseInstant("updated_after", updatedAfter));
        }

        List<WardApprovalRequest> rows = store.select(
                WardApprovalRequest.TABLE,
                filter,
                SelectOptions.page("updated_at.desc", limit, offset),
                WardApprovalRequest.class
        );
        log.debug("event=ward_approval_service.list filter={} limit={} offset={} count={}", filter, limit, offset, rows.size());
        return rows;
    }

    public List<WardApprovalRequest> history(String ward, String guardian, String limitRaw, String offsetRaw) {
        Filter filter = Filter.all();
        if (blankToNull(ward) != null) {
            filter = filter.andEq("ward_address", Addresses.normalize(ward));
        }
        if (blankToNull(guardian) != null) {
            filter = filter.andEq("guardian_address", Addresses.normalize(guardian));
        }
        int limit = RequestChecks.limit(limitRaw, DEFAULT_LIST_LIMIT, MAX_LIST_LIMIT);
        int offset = RequestChecks.offset(offsetRaw);
        return store.select(
                WardApprovalRequest.TABLE,
                filter,
                SelectOptions.page("created_at.desc", limit, offset),
                WardApprovalRequest.class
        );
    }

    public WardApprovalRequest update(UUID id, WardApprovalPatch patch) {
        WardApprovalRequest current = get(id);
        WardApprovalStatus target = patch.status();
        Instant now = Instant.now();

        Map<String, Object> values = new LinkedHashMap<>(patch.columns());
        values.put("updated_at", now);

        if (target == null || target == current.getStatus()) {
            // Attaching signatures or hashes without a transition: plain write, version untouched.
            List<WardApprovalRequest> rows = store.update(WardApprovalRequest.TABLE, Filter.eq("id", id), values, WardApprovalRequest.class);
            if (rows.isEmpty()) {
                throw new NotFoundException("Ward approval request not found");
            }
            log.info("event=ward_approval_service.update.fields approvalId={} fields={}", id, patch.columns().keySet());
            return rows.get(0);
        }

        WardApprovalStatus previous = current.getStatus();
        if (!previous.canTransitionTo(target)) {
            log.warn(
                    "event=ward_approval_service.update.rejected_transition approvalId={} from={} to={} eventVersion={}",
                    id,
                    previous.wireName(),
                    target.wireName(),
                    current.getEventVersion()
            );
            throw new ConflictException("Invalid ward approval status transition: " + previous.wireName() + " -> " + target.wireName());
        }

        int expectedVersion = current.getEventVersion();
        values.put("status", target);
        values.put("event_version", expectedVersion + 1);
        if (target.isTerminal() && current.getRespondedAt() == null) {
            values.put("responded_at", now);
        }

        List<WardApprovalRequest> rows = store.update(
                WardApprovalRequest.TABLE,
                Filter.eq("id", id).andEq("event_version", expectedVersion),
                values,
                WardApprovalRequest.class
        );

        if (rows.isEmpty()) {
            // Another writer moved the row past expectedVersion; hand back what won.
            WardApprovalRequest winner = get(id);
            log.warn(
                    "event=ward_approval_service.update.cas_miss approvalId={} expectedVersion={} currentVersion={} requestedStatus={} currentStatus={}",
                    id,
                    expectedVersion,
                    winner.getEventVersion(),
                    target.wireName(),
                    winner.getStatus().wireName()
            );
            return winner;
        }

        WardApprovalRequest updated = rows.get(0);
        log.info(
                "event=ward_approval_service.update.transitioned approvalId={} from={} to={} eventVersion={}",
                id,
                previous.wireName(),
                updated.getStatus().wireName(),
                updated.getEventVersion()
        );
        outbox.enqueueStatusChanged(updated, previous);
        return updated;
    }

    private WardApprovalStatus parseInitialStatus(String initialStatus) {
        if (initialStatus == null) {
            return WardApprovalStatus.PENDING_WARD_SIG;
        }
        WardApprovalStatus status;
        try {
            status = WardApprovalStatus.fromWire(initialStatus);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("initial_status: Invalid enum value '" + initialStatus + "'");
        }
        if (!status.isInitial()) {
            throw new InvalidRequestException("initial_status: must be pending_ward_sig or pending_guardian");
        }
        return status;
    }

    private AmountUnit parseAmountUnit(String amountUnit) {
        if (amountUnit == null) {
            return null;
        }
        try {
            return AmountUnit.fromWire(amountUnit);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("amount_unit: Invalid enum value '" + amountUnit + "'");
        }
    }

    private List<WardApprovalStatus> resolveStatuses(List<String> raw, boolean scoped, boolean includeAll) {
        Set<WardApprovalStatus> statuses = new LinkedHashSet<>();
        if (raw != null) {
            raw.stream()
                    .flatMap(value -> Arrays.stream(value.split(",")))
                    .map(String::trim)
                    .filter(value -> !value.isEmpty())
                    .forEach(value -> {
                        try {
                            statuses.add(WardApprovalStatus.fromWire(value));
                        } catch (IllegalArgumentException e) {
                            throw new InvalidRequestException("status: Invalid enum value '" + value + "'");
                        }
                    });
        }
        if (!statuses.isEmpty()) {
            return List.copyOf(statuses);
        }
        return scoped && !includeAll ? PENDING_STATUSES : List.of();
    }

    private static boolean isTruthy(String value) {
        return value != null && TRUTHY.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    static String parseInstant(String field, String value) {
        try {
            return Instant.parse(value).toString();
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toInstant().toString();
            } catch (DateTimeParseException ignored) {
                throw new InvalidRequestException(field + ": Must be an ISO 8601 datetime");
            }
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
