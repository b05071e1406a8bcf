package io.github.yok.cdflib.data;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Filter of a SELECT, UPDATE or DELETE built by {@link DataRowMapper}.
 *
 * <p>
 * Conditions on the same column form a group joined by the {@link #getComparison() comparison}
 * (default {@link WhereComparison#OR}) and wrapped in parentheses when there is more than one;
 * groups of different columns are always joined with {@code and}.
 * </p>
 *
 * <pre>
 * WhereClause.of(Map.of("Colour", List.of("red", "blue")))
 *   -&gt; where (`Colour`=? or `Colour`=?)
 * WhereClause.ofPairs("A", 1, "B", 2)
 *   -&gt; where `A`=? and `B`=?
 * </pre>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class WhereClause {

    /**
     * Map key whose value ({@code !AND} or {@code !OR}) selects the group comparison.
     */
    public static final String CONTROL_KEY = "!CDFWhere";

    private final List<WhereCondition> conditions;
    private final WhereComparison comparison;

    /**
     * Creates a clause.
     *
     * @param comparison operator inside a column group
     * @param conditions conditions, in order
     */
    public WhereClause(WhereComparison comparison, List<WhereCondition> conditions) {
        this.comparison = Preconditions.checkNotNull(comparison, "comparison must not be null");
        this.conditions = ImmutableList.copyOf(conditions);
    }

    /**
     * Builds a clause from a column to value map. A {@link Collection} value stands for several
     * values of the same column.
     *
     * @param where column to value(s), optionally with {@link #CONTROL_KEY}
     * @return clause
     * @throws IllegalArgumentException if the control value is not {@code !AND} or {@code !OR}
     */
    public static WhereClause of(Map<String, ?> where) {
        Builder builder = new Builder();
        where.forEach(builder::add);
        return builder.build();
    }

    /**
     * Builds a clause from alternating column names and values.
     *
     * @param keyValues {@code column1, value1, column2, value2, ...}
     * @return clause
     * @throws IllegalArgumentException if a value is missing or a key is not a string
     */
    public static WhereClause ofPairs(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Missing value for key in where clause");
        }
        Builder builder = new Builder();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (!(keyValues[i] instanceof String)) {
                throw new IllegalArgumentException("Where clause key is not a string: "
                        + keyValues[i]);
            }
            builder.add((String) keyValues[i], keyValues[i + 1]);
        }
        return builder.build();
    }

    /**
     * Returns {@code true} if there is nothing to filter on.
     *
     * @return {@code true} without conditions
     */
    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * Groups the condition values by column, in order of first appearance.
     *
     * @return column to its values
     */
    public Map<String, List<Object>> groupByColumn() {
        Map<String, List<Object>> groups = new LinkedHashMap<>();
        for (WhereCondition c : conditions) {
            groups.computeIfAbsent(c.getColumn(), k -> new ArrayList<>()).add(c.getValue());
        }
        return groups;
    }

    private static final class Builder {

        private final List<WhereCondition> conditions = new ArrayList<>();
        private WhereComparison comparison = WhereComparison.OR;

        void add(String key, Object value) {
            if (CONTROL_KEY.equals(key)) {
                comparison = WhereComparison.fromControlValue(value);
            } else if (value instanceof Collection) {
                for (Object v : (Collection<?>) value) {
                    conditions.add(WhereCondition.eq(key, v));
                }
            } else {
                conditions.add(WhereCondition.eq(key, value));
            }
        }

        WhereClause build() {
            return new WhereClause(comparison, conditions);
        }
    }
}
