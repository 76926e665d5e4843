package lab.guardian.adapter.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local store used for local runs and tests.
 * <p>
 * Rows are kept as JSON-shaped maps so that filters see the same column names and value shapes the
 * REST store returns. Each table has its own lock; an update evaluates its filter and applies its patch
 * while holding it, which gives the same single-statement semantics as a conditioned SQL update.
 */
@Slf4j
public class InMemoryStoreAdapter implements StoreAdapter {

    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, Table> tables = new ConcurrentHashMap<>();

    public InMemoryStoreAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> List<T> insert(String table, Object row, Class<T> type) {
        List<Map<String, Object>> incoming = toRows(row);
        Table t = table(table);
        t.lock.lock();
        try {
            t.rows.addAll(incoming);
        } finally {
            t.lock.unlock();
        }
        log.debug("event=store.memory.insert table={} rows={}", table, incoming.size());
        return convertAll(incoming, type);
    }

    @Override
    public <T> List<T> select(String table, Filter filter, SelectOptions options, Class<T> type) {
        List<Map<String, Object>> matched = new ArrayList<>();
        Table t = table(table);
        t.lock.lock();
        try {
            for (Map<String, Object> row : t.rows) {
                if (filter.matches(row)) {
                    matched.add(new LinkedHashMap<>(row));
                }
            }
        } finally {
            t.lock.unlock();
        }

        String orderColumn = options.orderColumn();
        if (orderColumn != null) {
            Comparator<Map<String, Object>> byColumn =
                    (left, right) -> StoreValues.compare(left.get(orderColumn), right.get(orderColumn));
            matched.sort(options.descending() ? byColumn.reversed() : byColumn);
        }

        int from = options.offset() == null ? 0 : Math.max(0, options.offset());
        if (from >= matched.size()) {
            return List.of();
        }
        int to = options.limit() == null ? matched.size() : Math.min(matched.size(), from + options.limit());
        return convertAll(matched.subList(from, to), type);
    }

    @Override
    public <T> List<T> update(String table, Filter filter, Map<String, Object> patch, Class<T> type) {
        Map<String, Object> values = objectMapper.convertValue(patch, ROW_TYPE);
        List<Map<String, Object>> updated = new ArrayList<>();
        Table t = table(table);
        t.lock.lock();
        try {
            for (Map<String, Object> row : t.rows) {
                if (filter.matches(row)) {
                    row.putAll(values);
                    updated.add(new LinkedHashMap<>(row));
                }
            }
        } finally {
            t.lock.unlock();
        }
        log.debug("event=store.memory.update table={} filter={} rows={}", table, filter, updated.size());
        return convertAll(updated, type);
    }

    @Override
    public <T> List<T> delete(String table, Filter filter, Class<T> type) {
        List<Map<String, Object>> removed = new ArrayList<>();
        Table t = table(table);
        t.lock.lock();
        try {
            Iterator<Map<String, Object>> it = t.rows.iterator();
            while (it.hasNext()) {
                Map<String, Object> row = it.next();
                if (filter.matches(row)) {
                    removed.add(row);
                    it.remove();
                }
            }
        } finally {
            t.lock.unlock();
        }
        return convertAll(removed, type);
    }

    @Override
    public <T> List<T> upsert(String table, Object row, List<String> onConflict, Class<T> type) {
        List<Map<String, Object>> incoming = toRows(row);
        List<Map<String, Object>> result = new ArrayList<>();
        Table t = table(table);
        t.lock.lock();
        try {
            for (Map<String, Object> candidate : incoming) {
                Map<String, Object> existing = findConflicting(t.rows, candidate, onConflict);
                if (existing != null) {
                    existing.putAll(candidate);
                    result.add(new LinkedHashMap<>(existing));
                } else {
                    t.rows.add(candidate);
                    result.add(new LinkedHashMap<>(candidate));
                }
            }
        } finally {
            t.lock.unlock();
        }
        return convertAll(result, type);
    }

    /** Drops every table. */
    public void clear() {
        tables.clear();
    }

    private Map<String, Object> findConflicting(List<Map<String, Object>> rows, Map<String, Object> candidate, List<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return null;
        }
        for (Map<String, Object> row : rows) {
            boolean same = keys.stream().allMatch(key -> {
                Object left = row.get(key);
                Object right = candidate.get(key);
                return left != null && right != null && StoreValues.sameValue(left, String.valueOf(right));
            });
            if (same) {
                return row;
            }
        }
        return null;
    }

    private List<Map<String, Object>> toRows(Object row) {
        List<Map<String, Object>> rows = new ArrayList<>();
        if (row instanceof Collection<?> collection) {
            for (Object item : collection) {
                rows.add(objectMapper.convertValue(item, ROW_TYPE));
            }
        } else {
            rows.add(objectMapper.convertValue(row, ROW_TYPE));
        }
        return rows;
    }

    @SuppressWarnings("unchecked")
    private <T> List<T> convertAll(List<Map<String, Object>> rows, Class<T> type) {
        List<T> converted = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            if (Map.class.isAssignableFrom(type)) {
                converted.add((T) new LinkedHashMap<>(row));
            } else {
                converted.add(objectMapper.convertValue(row, type));
            }
        }
        return converted;
    }

    private Table table(String name) {
        return tables.computeIfAbsent(name, key -> new Table());
    }

    private static final class Table {
        private final ReentrantLock lock = new ReentrantLock();
        private final List<Map<String, Object>> rows = new ArrayList<>();
    }
}
