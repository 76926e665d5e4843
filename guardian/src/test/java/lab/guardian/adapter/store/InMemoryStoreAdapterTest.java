package lab.guardian.adapter.store;

import lab.guardian.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryStoreAdapterTest {

    @SuppressWarnings("rawtypes")
    private static final Class<Map> ROW = Map.class;

    private InMemoryStoreAdapter store;

    @BeforeEach
    void setUp() {
        store = new InMemoryStoreAdapter(TestFixtures.objectMapper());
        store.insert("items", List.of(
                Map.of("id", "a", "kind", "x", "created_at", "2026-01-01T00:00:00Z"),
                Map.of("id", "b", "kind", "y", "created_at", "2026-01-03T00:00:00Z"),
                Map.of("id", "c", "kind", "x", "created_at", "2026-01-02T00:00:00Z")
        ), ROW);
    }

    @Test
    void selectFiltersOrdersAndPages() {
        List<Map> rows = store.select("items", Filter.eq("kind", "x"), SelectOptions.orderBy("created_at.desc"), ROW);
        assertThat(rows).extracting(row -> row.get("id")).containsExactly("c", "a");

        List<Map> page = store.select("items", Filter.all(), SelectOptions.page("created_at.asc", 1, 1), ROW);
        assertThat(page).extracting(row -> row.get("id")).containsExactly("c");

        assertThat(store.select("items", Filter.all(), SelectOptions.page("created_at.asc", 5, 10), ROW)).isEmpty();
    }

    @Test
    void selectOnUnknownTableIsEmpty() {
        assertThat(store.select("nothing_here", Filter.all(), ROW)).isEmpty();
    }

    @Test
    void updateReturnsOnlyMatchedRows() {
        List<Map> updated = store.update("items", Filter.eq("id", "a").andEq("kind", "y"), Map.of("kind", "z"), ROW);
        assertThat(updated).isEmpty();

        updated = store.update("items", Filter.eq("id", "a"), Map.of("kind", "z"), ROW);
        assertThat(updated).singleElement().satisfies(row -> assertThat(row.get("kind")).isEqualTo("z"));
    }

    @Test
    void upsertMergesOnConflictKey() {
        store.upsert("events", Map.of("approval_id", "p", "event_version", 1, "status", "pending"), List.of("approval_id", "event_version"), ROW);
        store.upsert("events", Map.of("approval_id", "p", "event_version", 1, "status", "sent"), List.of("approval_id", "event_version"), ROW);
        store.upsert("events", Map.of("approval_id", "p", "event_version", 2, "status", "pending"), List.of("approval_id", "event_version"), ROW);

        List<Map> rows = store.select("events", Filter.eq("approval_id", "p"), SelectOptions.orderBy("event_version.asc"), ROW);
        assertThat(rows).extracting(row -> row.get("status")).containsExactly("sent", "pending");
    }

    @Test
    void deleteRemovesMatchedRows() {
        List<Map> removed = store.delete("items", Filter.eq("kind", "x"), ROW);

        assertThat(removed).hasSize(2);
        assertThat(store.select("items", Filter.all(), ROW)).extracting(row -> row.get("id")).containsExactly("b");
    }

    @Test
    void conditionedUpdateAdmitsExactlyOneWriterPerVersion() throws Exception {
        store.insert("versioned", Map.of("id", "v", "version", 1, "owner", "none"), ROW);
        int writers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Map>>> results = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                String owner = "writer-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return store.update("versioned", Filter.eq("id", "v").andEq("version", 1), Map.of("version", 2, "owner", owner), ROW);
                }));
            }
            start.countDown();

            List<Map> winners = Collections.synchronizedList(new ArrayList<>());
            for (Future<List<Map>> result : results) {
                winners.addAll(result.get(5, TimeUnit.SECONDS));
            }
            assertThat(winners).hasSize(1);
            Map stored = store.select("versioned", Filter.eq("id", "v"), ROW).get(0);
            assertThat(stored.get("owner")).isEqualTo(winners.get(0).get("owner"));
        } finally {
            pool.shutdownNow();
        }
    }
}
