package io.github.yok.cdflib.data;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.cdflib.core.DataHelper;
import io.github.yok.cdflib.db.DataConnection;
import io.github.yok.cdflib.db.SqlDataType;
import io.github.yok.cdflib.db.SqlExecutionException;
import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Maps an ordered set of typed columns to one row of a table.
 *
 * <p>
 * The mapper holds the column values, binds them as query parameters, generates
 * INSERT/UPDATE/SELECT/DELETE statements against its table and validates the values against the
 * column constraints. Every identifier is back-ticked, every value goes through a placeholder and
 * the identity column {@code Id} is never written.
 * </p>
 *
 * <p>
 * Unknown column names are ignored by the setters and rejected by the getters.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DataRowMapper {

    private final List<DataColumn<?>> columns = new ArrayList<>();

    @Setter
    private String tableName;

    // Object specific checks run after the column constraints
    @Setter
    private Consumer<DataRowMapper> localValidation;

    // null until the first validation pass
    private List<ValidationError> validationErrors;

    /**
     * Creates an empty mapper.
     *
     * @param tableName table name, may be set later
     */
    public DataRowMapper(String tableName) {
        this.tableName = tableName;
    }

    /**
     * Creates the mapper of an entity: its table, its columns and its local validation.
     *
     * @param entity entity to map
     * @return mapper
     */
    public static DataRowMapper forEntity(DataEntity entity) {
        Preconditions.checkNotNull(entity, "entity must not be null");
        DataRowMapper mapper = new DataRowMapper(entity.getTableName());
        mapper.addColumns(entity.getColumns());
        mapper.setLocalValidation(entity::validateLocally);
        return mapper;
    }

    /**
     * Appends columns; declaration order is the order of generated SQL.
     *
     * @param newColumns columns to append
     */
    public void addColumns(DataColumn<?>... newColumns) {
        addColumns(List.of(newColumns));
    }

    /**
     * Appends columns; declaration order is the order of generated SQL.
     *
     * @param newColumns columns to append
     */
    public void addColumns(List<? extends DataColumn<?>> newColumns) {
        for (DataColumn<?> column : newColumns) {
            columns.add(Preconditions.checkNotNull(column, "column must not be null"));
        }
    }

    /**
     * Returns the declared columns.
     *
     * @return columns in declaration order
     */
    public List<DataColumn<?>> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Returns the configured table name.
     *
     * @return table name
     * @throws IllegalStateException if no table name is set
     */
    public String getTableName() {
        if (StringUtils.isBlank(tableName)) {
            throw new IllegalStateException("Table name not set");
        }
        return tableName;
    }

    /**
     * Finds a column by its exact name.
     *
     * @param key column name
     * @return column or {@code null}
     */
    public DataColumn<?> findColumn(String key) {
        for (DataColumn<?> column : columns) {
            if (column.getName().equals(key)) {
                return column;
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // Setters
    // ---------------------------------------------------------------------

    public void setColumnString(String key, Object value) {
        setColumnString(key, value, true, false);
    }

    /**
     * Sets a string or text column.
     *
     * @param key column name
     * @param value any value readable as text
     * @param stripMarkup {@code true} to remove markup tags
     * @param allowNull {@code true} to store {@code null} as is, otherwise {@code ""}
     */
    public void setColumnString(String key, Object value, boolean stripMarkup,
            boolean allowNull) {
        DataColumn<?> column = findColumn(key);
        if (column != null) {
            column.setValue(allowNull && value == null ? null
                    : DataHelper.asStringSafe(value, stripMarkup));
        }
    }

    public void setColumnInteger(String key, Object value) {
        setColumnInteger(key, value, false);
    }

    /**
     * Sets an integer column.
     *
     * @param key column name
     * @param value any value readable as a number
     * @param allowNull {@code true} to store {@code null} as is, otherwise {@code 0}
     */
    public void setColumnInteger(String key, Object value, boolean allowNull) {
        DataColumn<?> column = findColumn(key);
        if (column != null) {
            column.setValue(allowNull && value == null ? null : DataHelper.asInt(value));
        }
    }

    public void setColumnFloat(String key, Object value) {
        setColumnFloat(key, value, false);
    }

    /**
     * Sets a float column.
     *
     * @param key column name
     * @param value any value readable as a number
     * @param allowNull {@code true} to store {@code null} as is, otherwise {@code 0.0}
     */
    public void setColumnFloat(String key, Object value, boolean allowNull) {
        DataColumn<?> column = findColumn(key);
        if (column != null) {
            column.setValue(allowNull && value == null ? null : DataHelper.asFloat(value));
        }
    }

    public void setColumnBoolean(String key, Object value) {
        setColumnBoolean(key, value, false);
    }

    /**
     * Sets a boolean column.
     *
     * @param key column name
     * @param value any value readable as a flag
     * @param allowNull {@code true} to store {@code null} as is, otherwise {@code false}
     */
    public void setColumnBoolean(String key, Object value, boolean allowNull) {
        DataColumn<?> column = findColumn(key);
        if (column != null) {
            column.setValue(allowNull && value == null ? null : DataHelper.asBool(value));
        }
    }

    public void setColumnDateTime(String key, Object value) {
        setColumnDateTime(key, value, false);
    }

    /**
     * Sets a timestamp column. Other column kinds are left untouched.
     *
     * @param key column name
     * @param value any value readable as a date/time
     * @param allowNull {@code true} to store {@code null} as is, otherwise the epoch
     */
    public void setColumnDateTime(String key, Object value, boolean allowNull) {
        DataColumn<?> column = findColumn(key);
        if (column != null && column.getDataType() == SqlDataType.TIMESTAMP) {
            column.setValue(allowNull && value == null ? null : DataHelper.asDateTime(value));
        }
    }

    public void setColumnData(String key, byte[] value) {
        setColumnData(key, value, false);
    }

    /**
     * Sets a binary column. Other column kinds are left untouched.
     *
     * @param key column name
     * @param value bytes
     * @param allowNull {@code true} to store {@code null} as is, otherwise no bytes
     */
    public void setColumnData(String key, byte[] value, boolean allowNull) {
        DataColumn<?> column = findColumn(key);
        if (column != null && column.getDataType() == SqlDataType.DATA) {
            column.setValue(allowNull || value != null ? value : new byte[0]);
        }
    }

    // ---------------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------------

    /**
     * Returns the raw value of a column.
     *
     * @param key column name
     * @param allowNull {@code false} to get the type's zero value instead of {@code null}
     * @return value
     * @throws ColumnDataException if the column does not exist
     */
    public Object getColumnValue(String key, boolean allowNull) {
        DataColumn<?> column = findColumn(key);
        if (column == null) {
            throw new ColumnDataException(key, "Column does not exist");
        }
        Object value = column.getValue();
        if (value != null || allowNull) {
            return value;
        }
        switch (column.getDataType()) {
            case STRING:
            case TEXT:
                return "";
            case INTEGER:
                return 0L;
            case FLOAT:
                return 0.0;
            case BOOL:
                return Boolean.FALSE;
            case TIMESTAMP:
                return DataHelper.epoch(DataHelper.GMT);
            case DATA:
                return new byte[0];
            default:
                return null;
        }
    }

    public String getColumnString(String key) {
        return getColumnString(key, false);
    }

    public String getColumnString(String key, boolean allowNull) {
        return typed(key, allowNull, String.class, "string");
    }

    public Long getColumnInteger(String key) {
        return getColumnInteger(key, false);
    }

    public Long getColumnInteger(String key, boolean allowNull) {
        return typed(key, allowNull, Long.class, "integer");
    }

    public Double getColumnFloat(String key) {
        return getColumnFloat(key, false);
    }

    public Double getColumnFloat(String key, boolean allowNull) {
        return typed(key, allowNull, Double.class, "float");
    }

    public Boolean getColumnBoolean(String key) {
        return getColumnBoolean(key, false);
    }

    public Boolean getColumnBoolean(String key, boolean allowNull) {
        return typed(key, allowNull, Boolean.class, "boolean");
    }

    public ZonedDateTime getColumnDateTime(String key) {
        return getColumnDateTime(key, false);
    }

    public ZonedDateTime getColumnDateTime(String key, boolean allowNull) {
        return typed(key, allowNull, ZonedDateTime.class, "date/time");
    }

    public byte[] getColumnData(String key) {
        return getColumnData(key, false);
    }

    public byte[] getColumnData(String key, boolean allowNull) {
        return typed(key, allowNull, byte[].class, "binary");
    }

    private <T> T typed(String key, boolean allowNull, Class<T> type, String description) {
        Object value = getColumnValue(key, allowNull);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new ColumnDataException(key, "Column is not " + description);
        }
        return type.cast(value);
    }

    // ---------------------------------------------------------------------
    // Parameters and rows
    // ---------------------------------------------------------------------

    /**
     * Binds every column except the identity column.
     *
     * @param db connection receiving the parameters
     * @return number of parameters bound
     */
    public int addColumnsToParameters(DataConnection db) {
        return addColumnsToParameters(db, null, false);
    }

    /**
     * Binds the column values in declaration order, skipping the identity column.
     *
     * @param db connection receiving the parameters
     * @param keys column names to include or exclude; {@code null} for all
     * @param include {@code true} to bind only {@code keys}, {@code false} to bind all but
     *        {@code keys}
     * @return number of parameters bound
     */
    public int addColumnsToParameters(DataConnection db, Collection<String> keys,
            boolean include) {
        int count = 0;
        for (DataColumn<?> column : writableColumns(keys, include)) {
            db.addParameter(column.getDataType(), column.getValue());
            count++;
        }
        return count;
    }

    /**
     * Copies the values of a result row into the matching columns. Columns missing from the row
     * keep their value.
     *
     * @param row column label to value
     * @return {@code false} if the row is {@code null} or empty
     * @throws ColumnDataException if a value cannot be stored in its column
     */
    public boolean loadColumnValues(Map<String, ?> row) {
        if (row == null || row.isEmpty()) {
            return false;
        }
        for (DataColumn<?> column : columns) {
            if (row.containsKey(column.getName())) {
                load(column, row.get(column.getName()));
            }
        }
        return true;
    }

    private static void load(DataColumn<?> column, Object value) {
        if (value == null) {
            column.setValue(null);
            return;
        }
        switch (column.getDataType()) {
            case STRING:
            case TEXT:
                column.setValue(DataHelper.asString(value));
                break;
            case INTEGER:
                column.setValue(DataHelper.asInt(value));
                break;
            case FLOAT:
                column.setValue(DataHelper.asFloat(value));
                break;
            case BOOL:
                column.setValue(DataHelper.asBool(value));
                break;
            case DATA:
                column.setValue(value instanceof byte[] ? value
                        : DataHelper.asString(value).getBytes(StandardCharsets.UTF_8));
                break;
            default:
                column.setValue(value);
                break;
        }
    }

    // ---------------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------------

    public boolean doValidation() {
        return doValidation(null, false);
    }

    /**
     * Checks the column values against their constraints, then runs the local validation.
     *
     * @param columnFilter names of the columns to check; {@code null} for all
     * @param stopOnFirstError {@code true} to end the column checks at the first failure
     * @return {@code true} if any error was found
     * @throws IllegalStateException if there are no columns
     */
    public boolean doValidation(Collection<String> columnFilter, boolean stopOnFirstError) {
        validationErrors = new ArrayList<>();
        if (columns.isEmpty()) {
            throw new IllegalStateException("No columns to validate");
        }
        for (DataColumn<?> column : columns) {
            if (column.isIdentity()
                    || (columnFilter != null && !columnFilter.contains(column.getName()))) {
                continue;
            }
            if (!validateColumn(column, stopOnFirstError) && stopOnFirstError) {
                break;
            }
        }
        if (localValidation != null) {
            localValidation.accept(this);
        }
        if (!validationErrors.isEmpty()) {
            log.debug("Validation failed. table={}, errors={}", tableName, validationErrors);
        }
        return hasValidationErrors();
    }

    // returns false as soon as a check fails and stopOnFirstError is set
    private boolean validateColumn(DataColumn<?> column, boolean stopOnFirstError) {
        ColumnOptions options = column.getOptions();
        String name = column.getName();
        Object value = column.getValue();
        if (value == null) {
            if (options.isNotNull()) {
                validationErrors.add(
                        new ValidationError(name, ValidationErrorCode.VALUE_CANNOT_BE_NULL));
                return false;
            }
        }
        SqlDataType type = column.getDataType();
        if (options.isRequired() && isNotSet(type, value)
                && fail(name, ValidationErrorCode.VALUE_IS_NOT_SET, stopOnFirstError)) {
            return false;
        }
        if (type.isStringLike()) {
            int length = column.valueLength();
            if (options.getMaxLength() > 0 && length > options.getMaxLength()
                    && fail(name, ValidationErrorCode.VALUE_LENGTH_TOO_LONG, stopOnFirstError)) {
                return false;
            }
            if (options.getMinLength() > 0 && length > 0 && length < options.getMinLength()
                    && fail(name, ValidationErrorCode.VALUE_LENGTH_TOO_SHORT, stopOnFirstError)) {
                return false;
            }
        }
        if (type.isNumeric() || type == SqlDataType.TIMESTAMP) {
            double min = options.getMinRange();
            double max = options.getMaxRange();
            if (min == 0.0 && max == 0.0) {
                return true;
            }
            double n = column.numericValue();
            if (max != 0.0 && n > max
                    && fail(name, ValidationErrorCode.VALUE_RANGE_TOO_HIGH, stopOnFirstError)) {
                return false;
            }
            if (n < min
                    && fail(name, ValidationErrorCode.VALUE_RANGE_TOO_LOW, stopOnFirstError)) {
                return false;
            }
        }
        return true;
    }

    // records the error; true if the pass has to stop
    private boolean fail(String name, ValidationErrorCode code, boolean stopOnFirstError) {
        validationErrors.add(new ValidationError(name, code));
        return stopOnFirstError;
    }

    private static boolean isNotSet(SqlDataType type, Object value) {
        if (type == SqlDataType.STRING || type == SqlDataType.TEXT) {
            return value == null || ((String) value).isEmpty();
        }
        if (type == SqlDataType.TIMESTAMP) {
            return !DataHelper.hasDateTime(value);
        }
        return false;
    }

    /**
     * Adds an error found by object specific checks.
     *
     * @param columnKey column the error belongs to
     * @param message message to show
     * @throws IllegalStateException if no validation pass has been started
     */
    public void addCustomValidationError(String columnKey, String message) {
        if (validationErrors == null) {
            throw new IllegalStateException("Initial validation not performed first");
        }
        validationErrors.add(
                new ValidationError(columnKey, ValidationErrorCode.CUSTOM_ERROR, message));
    }

    public boolean hasValidationErrors() {
        return validationErrors != null && !validationErrors.isEmpty();
    }

    /**
     * Returns the errors of the last validation pass.
     *
     * @return errors; empty before the first pass
     */
    public List<ValidationError> getValidationErrors() {
        return validationErrors == null ? ImmutableList.of()
                : ImmutableList.copyOf(validationErrors);
    }

    // ---------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------

    public int queryInsertInto(DataConnection db) throws SqlExecutionException {
        return queryInsertInto(db, null, null);
    }

    /**
     * Inserts the column values as a new row.
     *
     * <pre>
     * insert into `widgets` (`Name`,`Age`) values (?,?)
     * </pre>
     *
     * @param db connection
     * @param table table name; {@code null} for the configured one
     * @param skipKeys columns to leave out; {@code null} for none
     * @return affected row count
     * @throws SqlExecutionException if the statement fails
     */
    public int queryInsertInto(DataConnection db, String table, Collection<String> skipKeys)
            throws SqlExecutionException {
        String name = resolveTable(table);
        List<DataColumn<?>> written = writableColumns(skipKeys, false);
        String sql = String.format("insert into `%s` (%s) values (%s)", name,
                written.stream().map(c -> tick(c.getName())).collect(Collectors.joining(",")),
                written.stream().map(c -> "?").collect(Collectors.joining(",")));
        db.newQuery();
        addColumnsToParameters(db, skipKeys, false);
        db.query(sql);
        return db.getAffectedRowCount();
    }

    /**
     * Writes the column values to the row whose {@code whereColumn} holds the same value as this
     * mapper.
     *
     * @param db connection
     * @param whereColumn key column, e.g. {@code Id}
     * @return affected row count
     * @throws SqlExecutionException if the statement fails
     */
    public int queryUpdate(DataConnection db, String whereColumn) throws SqlExecutionException {
        return queryUpdate(db, null, null, whereColumn);
    }

    /**
     * Writes the column values with an UPDATE keyed on a column of this mapper. The key column's
     * held value is bound after the column values.
     *
     * <pre>
     * update `widgets` set `Name`=?,`Age`=? where `Id`=?
     * </pre>
     *
     * @param db connection
     * @param table table name; {@code null} for the configured one
     * @param skipKeys columns to leave out; {@code null} for none
     * @param whereColumn key column; {@code null} to update every row
     * @return affected row count
     * @throws IllegalArgumentException if {@code whereColumn} is not a column of this mapper
     * @throws SqlExecutionException if the statement fails
     */
    public int queryUpdate(DataConnection db, String table, Collection<String> skipKeys,
            String whereColumn) throws SqlExecutionException {
        if (StringUtils.isEmpty(whereColumn)) {
            return queryUpdate(db, table, skipKeys, null, null);
        }
        DataColumn<?> key = findColumn(whereColumn);
        if (key == null) {
            throw new IllegalArgumentException("Invalid where key: " + whereColumn);
        }
        return queryUpdate(db, table, skipKeys, key.getName(), key.getValue());
    }

    /**
     * Writes the column values with an UPDATE keyed on an explicit value.
     *
     * @param db connection
     * @param table table name; {@code null} for the configured one
     * @param skipKeys columns to leave out; {@code null} for none
     * @param whereColumn key column; {@code null} to update every row
     * @param whereValue key value, bound after the column values
     * @return affected row count
     * @throws SqlExecutionException if the statement fails
     */
    public int queryUpdate(DataConnection db, String table, Collection<String> skipKeys,
            String whereColumn, Object whereValue) throws SqlExecutionException {
        String name = resolveTable(table);
        StringBuilder sql = new StringBuilder().append("update ").append(tick(name))
                .append(" set ").append(writableColumns(skipKeys, false).stream()
                        .map(c -> tick(c.getName()) + "=?").collect(Collectors.joining(",")));
        db.newQuery();
        addColumnsToParameters(db, skipKeys, false);
        if (StringUtils.isNotEmpty(whereColumn)) {
            sql.append(buildWhere(db, name, WhereClause.ofPairs(whereColumn, whereValue)));
        }
        db.query(sql.toString());
        return db.getAffectedRowCount();
    }

    public List<Map<String, Object>> querySelect(DataConnection db, WhereClause where)
            throws SqlExecutionException {
        return querySelect(db, null, null, where, null);
    }

    /**
     * Reads rows with a SELECT.
     *
     * <pre>
     * select * from `widgets` where `Colour`=? order by `Name` ASC
     * </pre>
     *
     * @param db connection
     * @param table table name; {@code null} for the configured one
     * @param skipKeys columns to leave out of the column list; {@code null} for {@code *}
     * @param where filter; {@code null} for all rows
     * @param order sort keys; {@code null} for none
     * @return rows
     * @throws SqlExecutionException if the statement fails
     */
    public List<Map<String, Object>> querySelect(DataConnection db, String table,
            Collection<String> skipKeys, WhereClause where, List<OrderBy> order)
            throws SqlExecutionException {
        String name = resolveTable(table);
        String list = skipKeys == null ? "*" : getColumnNames(skipKeys, false, true);
        StringBuilder sql = new StringBuilder().append("select ").append(list).append(" from ")
                .append(tick(name));
        db.newQuery();
        sql.append(buildWhere(db, name, where));
        if (order != null && !order.isEmpty()) {
            sql.append(" order by ")
                    .append(order.stream().map(OrderBy::toSql).collect(Collectors.joining(", ")));
        }
        return db.query(sql.toString());
    }

    public int queryDelete(DataConnection db, WhereClause where) throws SqlExecutionException {
        return queryDelete(db, null, where);
    }

    /**
     * Deletes rows.
     *
     * @param db connection
     * @param table table name; {@code null} for the configured one
     * @param where filter; {@code null} deletes every row
     * @return affected row count
     * @throws SqlExecutionException if the statement fails
     */
    public int queryDelete(DataConnection db, String table, WhereClause where)
            throws SqlExecutionException {
        String name = resolveTable(table);
        db.newQuery();
        db.query("delete from " + tick(name) + buildWhere(db, name, where));
        return db.getAffectedRowCount();
    }

    /**
     * Lists all column names, identity column included.
     *
     * @param useTicks {@code true} to back-tick the names
     * @return comma separated names
     */
    public String getAllColumnNames(boolean useTicks) {
        return getColumnNames(null, false, useTicks);
    }

    /**
     * Lists column names.
     *
     * @param skipKeys names to leave out; {@code null} for none
     * @param skipIdentity {@code true} to leave out the identity column
     * @param useTicks {@code true} to back-tick the names
     * @return comma separated names
     */
    public String getColumnNames(Collection<String> skipKeys, boolean skipIdentity,
            boolean useTicks) {
        return columns.stream().filter(c -> !(skipIdentity && c.isIdentity()))
                .filter(c -> skipKeys == null || !skipKeys.contains(c.getName()))
                .map(c -> useTicks ? tick(c.getName()) : c.getName())
                .collect(Collectors.joining(","));
    }

    private String resolveTable(String table) {
        return StringUtils.isNotBlank(table) ? table : getTableName();
    }

    private List<DataColumn<?>> writableColumns(Collection<String> keys, boolean include) {
        List<DataColumn<?>> list = new ArrayList<>();
        for (DataColumn<?> column : columns) {
            if (column.isIdentity()) {
                continue;
            }
            if (keys != null && keys.contains(column.getName()) != include) {
                continue;
            }
            list.add(column);
        }
        return list;
    }

    // renders " where ..." and binds the values in the order they appear
    private String buildWhere(DataConnection db, String table, WhereClause where) {
        if (where == null || where.isEmpty()) {
            return "";
        }
        boolean ownTable = table.equals(tableName);
        List<String> groups = new ArrayList<>();
        for (Map.Entry<String, List<Object>> group : where.groupByColumn().entrySet()) {
            String key = group.getKey();
            DataColumn<?> column = findColumn(key);
            if (column == null && ownTable) {
                throw new IllegalArgumentException("Invalid where key: " + key);
            }
            SqlDataType type = column == null ? SqlDataType.STRING : column.getDataType();
            List<String> terms = new ArrayList<>();
            for (Object value : group.getValue()) {
                if (value == null) {
                    terms.add(tick(key) + " is NULL");
                } else {
                    terms.add(tick(key) + "=?");
                    db.addParameter(type, value);
                }
            }
            String joined = String.join(where.getComparison().getSeparator(), terms);
            groups.add(terms.size() > 1 ? "(" + joined + ")" : joined);
        }
        return " where " + String.join(" and ", groups);
    }

    private static String tick(String identifier) {
        return "`" + identifier + "`";
    }
}
