package lab.guardian.adapter.store;

import java.util.List;
import java.util.Map;

/**
 * Table-oriented access to the backing store.
 * <p>
 * Every operation addresses a named table, narrows rows with a {@link Filter} and returns the rows it
 * touched, converted to {@code type}. {@link #update} must apply its filter and its write as one atomic
 * step: callers rely on a filter such as {@code id=eq.X&event_version=eq.N} to implement compare-and-swap.
 */
public interface StoreAdapter {

    <T> List<T> insert(String table, Object row, Class<T> type);

    <T> List<T> select(String table, Filter filter, SelectOptions options, Class<T> type);

    <T> List<T> update(String table, Filter filter, Map<String, Object> patch, Class<T> type);

    <T> List<T> delete(String table, Filter filter, Class<T> type);

    <T> List<T> upsert(String table, Object row, List<String> onConflict, Class<T> type);

    default <T> List<T> select(String table, Filter filter, Class<T> type) {
        return select(table, filter, SelectOptions.none(), type);
    }
}
