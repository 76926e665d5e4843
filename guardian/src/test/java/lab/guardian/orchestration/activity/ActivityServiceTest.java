package lab.guardian.orchestration.activity;

import lab.guardian.TestFixtures;
import lab.guardian.adapter.store.Filter;
import lab.guardian.adapter.store.InMemoryStoreAdapter;
import lab.guardian.adapter.store.SelectOptions;
import lab.guardian.adapter.store.StoreAdapter;
import lab.guardian.adapter.store.StoreException;
import lab.guardian.domain.swap.SwapExecution;
import lab.guardian.domain.swap.SwapExecutionStep;
import lab.guardian.domain.transaction.TransactionRecord;
import lab.guardian.domain.ward.WardConfig;
import lab.guardian.domain.ward.WardConfigStatus;
import lab.guardian.domain.wardapproval.AmountUnit;
import lab.guardian.domain.wardapproval.WardApprovalRequest;
import lab.guardian.domain.wardapproval.WardApprovalStatus;
import lab.guardian.orchestration.InvalidRequestException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActivityServiceTest {

    private static final Instant T0 = Instant.parse("2026-05-01T12:00:00Z");

    private InMemoryStoreAdapter store;
    private ExecutorService executor;
    private ActivityService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryStoreAdapter(TestFixtures.objectMapper());
        executor = Executors.newFixedThreadPool(4);
        service = new ActivityService(store, executor, "sepolia");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void wardApprovalIsSuppressedOnceItsTransactionExists() {
        store.insert(TransactionRecord.TABLE, tx("0x123", "0xT1", "confirmed", T0), TransactionRecord.class);
        store.insert(WardApprovalRequest.TABLE, wardRequest("0x123", "0x456", WardApprovalStatus.APPROVED, "0xT0", "0xT1", T0.minusSeconds(5)), WardApprovalRequest.class);

        ActivityPage page = service.feed("0x123", null, null);

        assertThat(page.total()).isEqualTo(1);
        assertThat(page.records()).singleElement().satisfies(record -> {
            assertThat(record.getSource()).isEqualTo(ActivitySource.TRANSACTION);
            assertThat(record.getTxHash()).isEqualTo("0xT1");
            assertThat(record.getStatus()).isEqualTo(ActivityStatus.CONFIRMED);
        });
    }

    @Test
    void feedCoversDirectWardAndManagedWardRelationsOnce() {
        String guardian = "0x9a";
        store.insert(WardConfig.TABLE, List.of(
                wardConfig("0x00B1", guardian),
                wardConfig("0xb1", guardian),
                wardConfig("0x0", guardian)
        ), WardConfig.class);
        // Owned directly and listing the guardian as ward address at the same time: must appear once.
        store.insert(TransactionRecord.TABLE, txWithWard(guardian, "0xd1", guardian, T0), TransactionRecord.class);
        store.insert(TransactionRecord.TABLE, tx("0xb1", "0xm1", "pending", T0.plusSeconds(10)), TransactionRecord.class);
        store.insert(TransactionRecord.TABLE, tx("0xother", "0xx1", "confirmed", T0.plusSeconds(20)), TransactionRecord.class);

        ActivityPage page = service.feed("0x09A", null, null);

        assertThat(page.records()).extracting(ActivityRecord::getTxHash).containsExactly("0xm1", "0xd1");
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void swapIsAttachedThroughAnyOfItsHashesWithOrderedSteps() {
        store.insert(TransactionRecord.TABLE, tx("0xw", "0xs2", "confirmed", T0), TransactionRecord.class);
        store.insert(SwapExecution.TABLE, SwapExecution.builder()
                .executionId("exec-1")
                .walletAddress("0xw")
                .txHash("0xs1")
                .txHashes(List.of("0xs1", "0xs2"))
                .provider("avnu")
                .sellToken("STRK")
                .buyToken("ETH")
                .sellAmountWei("10")
                .estimatedBuyAmountWei("2")
                .minBuyAmountWei("1")
                .status("confirmed")
                .createdAt(T0)
                .build(), SwapExecution.class);
        store.insert(SwapExecutionStep.TABLE, List.of(
                step("exec-1", "swap", 2, T0.plusSeconds(1)),
                step("exec-1", "approve", 1, T0.plusSeconds(2))
        ), SwapExecutionStep.class);

        ActivityRecord record = service.feed("0xw", null, null).records().get(0);

        assertThat(record.getSwap()).isNotNull();
        assertThat(record.getSwap().executionId()).isEqualTo("exec-1");
        assertThat(record.getSwap().primaryTxHash()).isEqualTo("0xs1");
        assertThat(record.getSwap().steps()).extracting(ActivityRecord.Step::stepKey).containsExactly("approve", "swap");
    }

    @Test
    void wardRequestsAreProjectedForTheGuardian() {
        WardApprovalRequest request = wardRequest("0xc1", "0xd1", WardApprovalStatus.GAS_ERROR, "0xg1", null, T0).toBuilder()
                .action("deploy_account")
                .amountUnit(null)
                .build();
        store.insert(WardApprovalRequest.TABLE, request, WardApprovalRequest.class);

        ActivityRecord record = service.feed("0xd1", null, null).records().get(0);

        assertThat(record.getSource()).isEqualTo(ActivitySource.WARD_REQUEST);
        assertThat(record.getWalletAddress()).isEqualTo("0xd1");
        assertThat(record.getWardAddress()).isEqualTo("0xc1");
        assertThat(record.getType()).isEqualTo("deploy_ward");
        assertThat(record.getStatus()).isEqualTo(ActivityStatus.GAS_ERROR);
        assertThat(record.getStatusDetail()).isEqualTo("gas_error");
        assertThat(record.getNote()).isEqualTo("Gas too low, retry required");
        assertThat(record.getAmountUnit()).isEqualTo("tongo_units");
        assertThat(record.getAccountType()).isEqualTo("guardian");
        assertThat(record.getPlatform()).isEqualTo("approval");
        assertThat(record.getNetwork()).isEqualTo("sepolia");

        ActivityRecord asWard = service.feed("0xc1", null, null).records().get(0);
        assertThat(asWard.getWalletAddress()).isEqualTo("0xc1");
    }

    @Test
    void failedSubReadDegradesToPartialFeed() {
        StoreAdapter flaky = new FailingTableStore(store, TransactionRecord.TABLE);
        ActivityService degraded = new ActivityService(flaky, executor, "sepolia");
        store.insert(TransactionRecord.TABLE, tx("0xe1", "0xt", "confirmed", T0), TransactionRecord.class);
        store.insert(WardApprovalRequest.TABLE, wardRequest("0xe1", "0xf1", WardApprovalStatus.PENDING_WARD_SIG, "0xt", null, T0), WardApprovalRequest.class);

        ActivityPage page = degraded.feed("0xe1", null, null);

        // The transaction read failed, so the approval is no longer suppressed by it.
        assertThat(page.records()).singleElement().satisfies(record -> {
            assertThat(record.getSource()).isEqualTo(ActivitySource.WARD_REQUEST);
            assertThat(record.getNote()).isEqualTo("Waiting for ward signature");
        });
    }

    @Test
    void wardRequestsSharingAHashAppearOnce() {
        store.insert(WardApprovalRequest.TABLE, wardRequest("0xa7", "0xa8", WardApprovalStatus.APPROVED, "0xr1", "0xsame", T0), WardApprovalRequest.class);
        store.insert(WardApprovalRequest.TABLE, wardRequest("0xa7", "0xa8", WardApprovalStatus.APPROVED, "0xr2", "0xsame", T0.minusSeconds(1)), WardApprovalRequest.class);
        // A retried create stores the same tx hash twice.
        store.insert(WardApprovalRequest.TABLE, wardRequest("0xa7", "0xa8", WardApprovalStatus.PENDING_GUARDIAN, "0xretry", null, T0.minusSeconds(2)), WardApprovalRequest.class);
        store.insert(WardApprovalRequest.TABLE, wardRequest("0xa7", "0xa8", WardApprovalStatus.PENDING_GUARDIAN, "0xretry", null, T0.minusSeconds(3)), WardApprovalRequest.class);

        ActivityPage page = service.feed("0xa7", null, null);

        assertThat(page.total()).isEqualTo(2);
        assertThat(page.records()).extracting(ActivityRecord::getTxHash)
                .doesNotHaveDuplicates()
                .containsExactly("0xsame", "0xretry");
    }

    @Test
    void offsetNearIntegerLimitHasNoMore() {
        store.insert(TransactionRecord.TABLE, tx("0xo1", "0xh1", "confirmed", T0), TransactionRecord.class);

        ActivityPage page = service.feed("0xo1", "100", String.valueOf(Integer.MAX_VALUE));

        assertThat(page.records()).isEmpty();
        assertThat(page.total()).isEqualTo(1);
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void fanOutReadsCarryTheRequestCorrelationId() throws Exception {
        ExecutorService single = Executors.newSingleThreadExecutor();
        List<String> seen = new CopyOnWriteArrayList<>();
        StoreAdapter recording = new FailingTableStore(store, "none") {
            @Override
            public <T> List<T> select(String table, Filter filter, SelectOptions options, Class<T> type) {
                seen.add(MDC.get("correlationId"));
                return super.select(table, filter, options, type);
            }
        };
        try {
            MDC.put("correlationId", "corr-activity-1");
            new ActivityService(recording, single, "sepolia").feed("0xc0", null, null);
            MDC.remove("correlationId");

            assertThat(seen).isNotEmpty().containsOnly("corr-activity-1");
            assertThat(single.submit(() -> MDC.get("correlationId")).get()).isNull();
        } finally {
            MDC.clear();
            single.shutdownNow();
        }
    }

    @Test
    void pagesNewestFirstWithMissingTimestampsLast() {
        store.insert(TransactionRecord.TABLE, List.of(
                tx("0xp", "0x1", "confirmed", T0),
                tx("0xp", "0x2", "confirmed", null),
                tx("0xp", "0x3", "failed", T0.plusSeconds(60)),
                tx("0xp", "0x4", "pending", T0.plusSeconds(30))
        ), TransactionRecord.class);

        ActivityPage first = service.feed("0xp", "2", "0");
        ActivityPage second = service.feed("0xp", "2", "2");
        ActivityPage beyond = service.feed("0xp", "2", "10");

        assertThat(first.records()).extracting(ActivityRecord::getTxHash).containsExactly("0x3", "0x4");
        assertThat(first.total()).isEqualTo(4);
        assertThat(first.hasMore()).isTrue();
        assertThat(second.records()).extracting(ActivityRecord::getTxHash).containsExactly("0x1", "0x2");
        assertThat(second.hasMore()).isFalse();
        assertThat(beyond.records()).isEmpty();
    }

    @Test
    void fanOutKeepsFirstSeenRowAndDropsKeylessRows() {
        store.insert("rows", List.of(
                Map.of("k", "a", "v", "first", "created_at", "2026-01-02T00:00:00Z"),
                Map.of("k", "", "v", "keyless", "created_at", "2026-01-01T00:00:00Z")
        ), Map.class);
        store.insert("rows", Map.of("k", "a", "v", "second", "created_at", "2026-01-01T00:00:00Z"), Map.class);

        @SuppressWarnings("rawtypes")
        List<Map> merged = service.fanOut(
                "rows",
                List.of(Filter.eq("v", "first"), Filter.eq("v", "second"), Filter.eq("v", "keyless")),
                Map.class,
                row -> (String) row.get("k")
        ).join();

        assertThat(merged).singleElement().satisfies(row -> assertThat(row.get("v")).isEqualTo("first"));
    }

    @Test
    void walletIsRequired() {
        assertThatThrownBy(() -> service.feed(" ", null, null))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("Missing required query parameter: wallet");
    }

    @Test
    void wardActionAndUnitNormalization() {
        assertThat(ActivityService.normalizeWardAction(" Fund ")).isEqualTo("fund_ward");
        assertThat(ActivityService.normalizeWardAction("configure_limits")).isEqualTo("configure_ward");
        assertThat(ActivityService.normalizeWardAction(null)).isEqualTo("transfer");
        assertThat(ActivityService.normalizeWardAction("shield")).isEqualTo("shield");

        WardApprovalRequest erc20 = wardRequest("0x1", "0x2", WardApprovalStatus.APPROVED, "0x3", null, T0).toBuilder()
                .action("erc20_transfer").amountUnit(null).build();
        WardApprovalRequest noAmount = erc20.toBuilder().action("transfer").amount(null).build();
        WardApprovalRequest explicit = erc20.toBuilder().amountUnit(AmountUnit.ERC20_WEI).build();
        assertThat(ActivityService.inferAmountUnit(erc20)).isEqualTo("erc20_display");
        assertThat(ActivityService.inferAmountUnit(noAmount)).isNull();
        assertThat(ActivityService.inferAmountUnit(explicit)).isEqualTo("erc20_wei");
    }

    private static TransactionRecord tx(String wallet, String hash, String status, Instant createdAt) {
        return TransactionRecord.builder()
                .walletAddress(wallet)
                .txHash(hash)
                .type("transfer")
                .token("STRK")
                .amount("1")
                .status(status)
                .accountType("normal")
                .network("sepolia")
                .createdAt(createdAt)
                .build();
    }

    private static TransactionRecord txWithWard(String wallet, String hash, String ward, Instant createdAt) {
        return tx(wallet, hash, "confirmed", createdAt).toBuilder().wardAddress(ward).accountType("ward").build();
    }

    private static WardApprovalRequest wardRequest(String ward, String guardian, WardApprovalStatus status, String txHash, String finalTxHash, Instant createdAt) {
        return WardApprovalRequest.builder()
                .id(UUID.randomUUID())
                .wardAddress(ward)
                .guardianAddress(guardian)
                .action("transfer")
                .token("STRK")
                .amount("7")
                .amountUnit(AmountUnit.TONGO_UNITS)
                .callsJson("[]")
                .nonce("0x1")
                .resourceBoundsJson("{}")
                .txHash(txHash)
                .wardSigJson("[]")
                .status(status)
                .eventVersion(1)
                .finalTxHash(finalTxHash)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build();
    }

    private static WardConfig wardConfig(String ward, String guardian) {
        return WardConfig.builder().wardAddress(ward).guardianAddress(guardian).status(WardConfigStatus.ACTIVE).build();
    }

    private static SwapExecutionStep step(String executionId, String key, int order, Instant createdAt) {
        return SwapExecutionStep.builder()
                .executionId(executionId)
                .stepKey(key)
                .stepOrder(order)
                .status("confirmed")
                .createdAt(createdAt)
                .build();
    }

    private static class FailingTableStore implements StoreAdapter {

        private final StoreAdapter delegate;
        private final String failingTable;

        FailingTableStore(StoreAdapter delegate, String failingTable) {
            this.delegate = delegate;
            this.failingTable = failingTable;
        }

        @Override
        public <T> List<T> insert(String table, Object row, Class<T> type) {
            return delegate.insert(table, row, type);
        }

        @Override
        public <T> List<T> select(String table, Filter filter, SelectOptions options, Class<T> type) {
            if (table.equals(failingTable)) {
                throw new StoreException("Store 503: unavailable", 503);
            }
            return delegate.select(table, filter, options, type);
        }

        @Override
        public <T> List<T> update(String table, Filter filter, Map<String, Object> patch, Class<T> type) {
            return delegate.update(table, filter, patch, type);
        }

        @Override
        public <T> List<T> delete(String table, Filter filter, Class<T> type) {
            return delegate.delete(table, filter, type);
        }

        @Override
        public <T> List<T> upsert(String table, Object row, List<String> onConflict, Class<T> type) {
            return delegate.upsert(table, row, onConflict, type);
        }
    }
}
