package lab.guardian.orchestration.activity;

import lab.guardian.adapter.store.Filter;
import lab.guardian.adapter.store.SelectOptions;
import lab.guardian.adapter.store.StoreAdapter;
import lab.guardian.common.Addresses;
import lab.guardian.domain.swap.SwapExecution;
import lab.guardian.domain.swap.SwapExecutionStep;
import lab.guardian.domain.transaction.TransactionRecord;
import lab.guardian.domain.ward.WardConfig;
import lab.guardian.domain.wardapproval.AmountUnit;
import lab.guardian.domain.wardapproval.WardApprovalRequest;
import lab.guardian.domain.wardapproval.WardApprovalStatus;
import lab.guardian.orchestration.InvalidRequestException;
import lab.guardian.orchestration.RequestChecks;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Builds the activity feed of one wallet.
 * <p>
 * A wallet sees rows it owns directly, rows where it is the ward, and rows of every ward it guards.
 * Each relation is a separate store read; reads run in parallel and a failed read only removes its
 * rows from the feed. The merged rows are reconciled across kinds (swap data attached to transactions,
 * ward approvals dropped once their hash is already in the feed), sorted newest first and paged.
 */
@Service
@Slf4j
public class ActivityService {

    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 500;

    private static final SelectOptions NEWEST_FIRST = SelectOptions.orderBy("created_at.desc");
    private static final Set<String> DEPLOY_ACTIONS = Set.of("deploy", "deploy_account", "deploy_contract");
    private static final Set<String> CONFIGURE_ACTIONS = Set.of("configure", "configure_limits");

    private final StoreAdapter store;
    private final ExecutorService executor;
    private final String network;

    public ActivityService(
            StoreAdapter store,
            @Qualifier(ActivityConfig.FAN_OUT_EXECUTOR) ExecutorService executor,
            @Value("${guardian.activity.network:sepolia}") String network) {
        this.store = store;
        this.executor = executor;
        this.network = network;
    }

    public ActivityPage feed(String wallet, String limitRaw, String offsetRaw) {
        if (wallet == null || wallet.isBlank()) {
            throw new InvalidRequestException("Missing required query parameter: wallet");
        }
        int limit = RequestChecks.limit(limitRaw, DEFAULT_LIMIT, MAX_LIMIT);
        int offset = RequestChecks.offset(offsetRaw);
        String viewer = Addresses.normalize(wallet);

        List<String> managedWards = managedWards(viewer);
        List<Filter> ownership = ownershipPredicates(viewer, managedWards);

        CompletableFuture<List<TransactionRecord>> txFuture =
                fanOut(TransactionRecord.TABLE, ownership, TransactionRecord.class, TransactionRecord::getTxHash);
        CompletableFuture<List<SwapExecution>> swapFuture =
                fanOut(SwapExecution.TABLE, ownership, SwapExecution.class, SwapExecution::getExecutionId);
        CompletableFuture<List<WardApprovalRequest>> wardFuture = fanOut(
                WardApprovalRequest.TABLE,
                List.of(Filter.eq("guardian_address", viewer), Filter.eq("ward_address", viewer)),
                WardApprovalRequest.class,
                row -> row.getId() == null ? null : row.getId().toString()
        );

        List<TransactionRecord> transactions = txFuture.join();
        List<SwapExecution> swaps = swapFuture.join();
        List<WardApprovalRequest> wardRequests = wardFuture.join();

        Map<String, List<SwapExecutionStep>> stepsByExecution = swapSteps(swaps);
        Map<String, SwapExecution> swapsByTxHash = new HashMap<>();
        for (SwapExecution swap : swaps) {
            for (String hash : swap.touchedTxHashes()) {
                swapsByTxHash.put(hash, swap);
            }
        }

        // Seeded with transaction hashes; each emitted ward request adds its own.
        Set<String> emittedHashes = new HashSet<>();
        List<ActivityRecord> combined = new ArrayList<>();
        for (TransactionRecord tx : transactions) {
            emittedHashes.add(tx.getTxHash());
            SwapExecution swap = swapsByTxHash.get(tx.getTxHash());
            combined.add(fromTransaction(tx, swap, swap == null ? List.of() : stepsByExecution.getOrDefault(swap.getExecutionId(), List.of())));
        }

        int suppressed = 0;
        for (WardApprovalRequest request : wardRequests) {
            String hash = request.effectiveTxHash();
            if (hash != null && !hash.isEmpty() && !emittedHashes.add(hash)) {
                suppressed++;
                continue;
            }
            combined.add(fromWardRequest(request, viewer));
        }

        // List.sort is stable, so rows with equal timestamps keep their merge order.
        combined.sort(Comparator.comparing(ActivityRecord::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder())));

        int total = combined.size();
        List<ActivityRecord> page = offset >= total
                ? List.of()
                : List.copyOf(combined.subList(offset, (int) Math.min(total, (long) offset + limit)));
        log.info(
                "event=activity_service.feed wallet={} managedWards={} transactions={} swaps={} wardRequests={} suppressed={} total={} offset={} limit={}",
                viewer,
                managedWards.size(),
                transactions.size(),
                swaps.size(),
                wardRequests.size(),
                suppressed,
                total,
                offset,
                limit
        );
        return new ActivityPage(page, total, (long) offset + limit < total);
    }

    /**
     * Runs one read per predicate in parallel and merges the results in predicate order, keeping the
     * first row seen for every key. Rows without a key are dropped; a failed read contributes nothing.
     */
    <T> CompletableFuture<List<T>> fanOut(String table, List<Filter> predicates, Class<T> type, Function<T, String> dedupeKey) {
        List<CompletableFuture<List<T>>> reads = new ArrayList<>(predicates.size());
        for (Filter predicate : predicates) {
            reads.add(readQuietly(table, predicate, type));
        }
        return CompletableFuture.allOf(reads.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    Map<String, T> unique = new LinkedHashMap<>();
                    for (CompletableFuture<List<T>> read : reads) {
                        for (T row : read.join()) {
                            String key = dedupeKey.apply(row);
                            if (key != null && !key.isEmpty()) {
                                unique.putIfAbsent(key, row);
                            }
                        }
                    }
                    return List.copyOf(unique.values());
                });
    }

    private <T> CompletableFuture<List<T>> readQuietly(String table, Filter predicate, Class<T> type) {
        Map<String, String> requestContext = MDC.getCopyOfContextMap();
        return CompletableFuture.supplyAsync(() -> {
            if (requestContext != null) {
                MDC.setContextMap(requestContext);
            }
            try {
                return store.select(table, predicate, NEWEST_FIRST, type);
            } catch (RuntimeException e) {
                log.warn("event=activity_service.read_failed table={} filter={} error={}", table, predicate, rootMessage(e));
                return List.<T>of();
            } finally {
                MDC.clear();
            }
        }, executor);
    }

    List<String> managedWards(String guardian) {
        try {
            List<WardConfig> configs = store.select(WardConfig.TABLE, Filter.eq("guardian_address", guardian), WardConfig.class);
            Set<String> wards = new LinkedHashSet<>();
            for (WardConfig config : configs) {
                String ward = Addresses.normalize(config.getWardAddress());
                if (ward != null && !ward.isEmpty() && !Addresses.ZERO.equals(ward)) {
                    wards.add(ward);
                }
            }
            return List.copyOf(wards);
        } catch (RuntimeException e) {
            log.warn("event=activity_service.managed_wards_failed guardian={} error={}", guardian, e.getMessage());
            return List.of();
        }
    }

    private static List<Filter> ownershipPredicates(String viewer, List<String> managedWards) {
        List<Filter> predicates = new ArrayList<>();
        predicates.add(Filter.eq("wallet_address", viewer));
        predicates.add(Filter.eq("ward_address", viewer));
        if (!managedWards.isEmpty()) {
            predicates.add(Filter.in("wallet_address", managedWards));
        }
        return predicates;
    }

    private Map<String, List<SwapExecutionStep>> swapSteps(List<SwapExecution> swaps) {
        Set<String> executionIds = new LinkedHashSet<>();
        swaps.forEach(swap -> executionIds.add(swap.getExecutionId()));
        if (executionIds.isEmpty()) {
            return Map.of();
        }
        List<SwapExecutionStep> steps;
        try {
            steps = store.select(
                    SwapExecutionStep.TABLE,
                    Filter.in("execution_id", executionIds),
                    SelectOptions.orderBy("created_at.asc"),
                    SwapExecutionStep.class
            );
        } catch (RuntimeException e) {
            log.warn("event=activity_service.swap_steps_failed executions={} error={}", executionIds.size(), e.getMessage());
            return Map.of();
        }
        Map<String, List<SwapExecutionStep>> grouped = new HashMap<>();
        for (SwapExecutionStep step : steps) {
            grouped.computeIfAbsent(step.getExecutionId(), id -> new ArrayList<>()).add(step);
        }
        grouped.values().forEach(list -> list.sort(Comparator.comparingInt(SwapExecutionStep::getStepOrder)));
        return grouped;
    }

    private ActivityRecord fromTransaction(TransactionRecord tx, SwapExecution swap, List<SwapExecutionStep> steps) {
        return ActivityRecord.builder()
                .id(tx.getTxHash())
                .source(ActivitySource.TRANSACTION)
                .walletAddress(tx.getWalletAddress())
                .txHash(tx.getTxHash())
                .type(tx.getType())
                .token(tx.getToken())
                .amount(tx.getAmount())
                .amountUnit(tx.getAmountUnit())
                .recipient(tx.getRecipient())
                .recipientName(tx.getRecipientName())
                .note(tx.getNote())
                .status(ActivityStatus.fromTransaction(tx.getStatus()))
                .errorMessage(tx.getErrorMessage())
                .accountType(tx.getAccountType())
                .wardAddress(tx.getWardAddress())
                .fee(tx.getFee())
                .network(tx.getNetwork())
                .platform(tx.getPlatform())
                .createdAt(tx.getCreatedAt())
                .swap(swap == null ? null : swapSummary(swap, steps))
                .build();
    }

    private static ActivityRecord.Swap swapSummary(SwapExecution swap, List<SwapExecutionStep> steps) {
        List<ActivityRecord.Step> projected = steps.stream()
                .map(step -> new ActivityRecord.Step(
                        step.getStepKey(),
                        step.getStepOrder(),
                        step.getStatus(),
                        step.getTxHash(),
                        step.getMessage(),
                        step.getStartedAt(),
                        step.getFinishedAt()
                ))
                .toList();
        return new ActivityRecord.Swap(
                swap.getExecutionId(),
                swap.getProvider(),
                swap.getSellToken(),
                swap.getBuyToken(),
                swap.getSellAmountWei(),
                swap.getEstimatedBuyAmountWei(),
                swap.getMinBuyAmountWei(),
                swap.getBuyActualAmountWei(),
                swap.getTxHashes(),
                swap.getPrimaryTxHash() != null ? swap.getPrimaryTxHash() : swap.getTxHash(),
                swap.getStatus(),
                swap.getFailureStepKey(),
                swap.getFailureReason(),
                projected
        );
    }

    private ActivityRecord fromWardRequest(WardApprovalRequest request, String viewer) {
        String guardian = Addresses.normalize(request.getGuardianAddress());
        String ward = Addresses.normalize(request.getWardAddress());
        String txHash = request.effectiveTxHash();
        return ActivityRecord.builder()
                .id(request.getId().toString())
                .source(ActivitySource.WARD_REQUEST)
                .walletAddress(viewer.equals(guardian) ? guardian : ward)
                .txHash(txHash == null ? "" : txHash)
                .type(normalizeWardAction(request.getAction()))
                .token(request.getToken() == null || request.getToken().isEmpty() ? "STRK" : request.getToken())
                .amount(request.getAmount())
                .amountUnit(inferAmountUnit(request))
                .recipient(request.getRecipient())
                .note(noteFor(request.getStatus()))
                .status(ActivityStatus.fromWardApproval(request.getStatus()))
                .statusDetail(request.getStatus() == null ? null : request.getStatus().wireName())
                .errorMessage(request.getErrorMessage())
                .accountType("guardian")
                .wardAddress(ward)
                .network(network)
                .platform("approval")
                .createdAt(request.getCreatedAt())
                .respondedAt(request.getRespondedAt())
                .build();
    }

    static String normalizeWardAction(String action) {
        String normalized = action == null ? "" : action.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return "transfer";
        }
        if (DEPLOY_ACTIONS.contains(normalized)) {
            return "deploy_ward";
        }
        if ("fund".equals(normalized)) {
            return "fund_ward";
        }
        if (CONFIGURE_ACTIONS.contains(normalized)) {
            return "configure_ward";
        }
        return normalized;
    }

    static String inferAmountUnit(WardApprovalRequest request) {
        AmountUnit unit = request.getAmountUnit();
        if (unit != null) {
            return unit.wireName();
        }
        if ("erc20_transfer".equals(request.getAction())) {
            return AmountUnit.ERC20_DISPLAY.wireName();
        }
        return request.getAmount() == null || request.getAmount().isEmpty() ? null : AmountUnit.TONGO_UNITS.wireName();
    }

    static String noteFor(WardApprovalStatus status) {
        if (status == null) {
            return null;
        }
        return switch (status) {
            case PENDING_WARD_SIG -> "Waiting for ward signature";
            case PENDING_GUARDIAN -> "Waiting for guardian approval";
            case REJECTED -> "Request rejected";
            case GAS_ERROR -> "Gas too low, retry required";
            case EXPIRED -> "Request expired";
            case APPROVED, FAILED -> null;
        };
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
