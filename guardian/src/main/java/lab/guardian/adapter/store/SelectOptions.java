package lab.guardian.adapter.store;

import java.util.Locale;

/**
 * Ordering and paging for a select. {@code orderBy} uses the PostgREST form {@code column.asc|desc}.
 */
public record SelectOptions(
        String orderBy,
        Integer limit,
        Integer offset
) {
    public static SelectOptions none() {
        return new SelectOptions(null, null, null);
    }

    public static SelectOptions orderBy(String orderBy) {
        return new SelectOptions(orderBy, null, null);
    }

    public static SelectOptions page(String orderBy, int limit, int offset) {
        return new SelectOptions(orderBy, limit, offset);
    }

    public static SelectOptions first() {
        return new SelectOptions(null, 1, null);
    }

    public String orderColumn() {
        if (orderBy == null || orderBy.isBlank()) {
            return null;
        }
        int dot = orderBy.lastIndexOf('.');
        return dot > 0 ? orderBy.substring(0, dot) : orderBy;
    }

    public boolean descending() {
        return orderBy != null && orderBy.toLowerCase(Locale.ROOT).endsWith(".desc");
    }
}
