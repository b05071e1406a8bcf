package io.github.yok.cdflib.data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * One sort key of a SELECT built by {@link DataRowMapper}.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public final class OrderBy {

    private final String column;
    private final boolean ascending;

    public static OrderBy asc(String column) {
        return new OrderBy(column, true);
    }

    public static OrderBy desc(String column) {
        return new OrderBy(column, false);
    }

    /**
     * Converts a column to ascending-flag map, keeping the map's iteration order.
     *
     * @param order column to {@code true} for ascending
     * @return sort keys
     */
    public static List<OrderBy> of(Map<String, Boolean> order) {
        List<OrderBy> list = new ArrayList<>();
        order.forEach((column, ascending) -> list.add(new OrderBy(column,
                ascending == null || ascending)));
        return list;
    }

    String toSql() {
        return String.format("`%s` %s", column, ascending ? "ASC" : "DESC");
    }
}
