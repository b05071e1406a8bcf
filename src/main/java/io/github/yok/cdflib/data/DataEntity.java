package io.github.yok.cdflib.data;

import io.github.yok.cdflib.db.DataConnection;
import io.github.yok.cdflib.db.SqlExecutionException;
import java.util.List;

/**
 * A domain object persisted through a {@link DataRowMapper}.
 *
 * <p>
 * Implementations describe their table and columns and keep the mapper built by
 * {@link DataRowMapper#forEntity(DataEntity)}. The persistence operations are optional; by default
 * they are unsupported.
 * </p>
 *
 * <pre>
 * public class Widget implements DataEntity {
 *     private final DataRowMapper row = DataRowMapper.forEntity(this);
 *
 *     public String getTableName() {
 *         return "widgets";
 *     }
 *
 *     public List&lt;DataColumn&lt;?&gt;&gt; getColumns() {
 *         return List.of(new IntegerColumn("Id"), new StringColumn("Name"));
 *     }
 *
 *     public void create(DataConnection db) throws SqlExecutionException {
 *         row.queryInsertInto(db);
 *     }
 * }
 * </pre>
 */
public interface DataEntity {

    /**
     * Returns the table the entity is stored in.
     *
     * @return table name
     */
    String getTableName();

    /**
     * Returns fresh column definitions, including the identity column if the table has one.
     *
     * @return columns
     */
    List<DataColumn<?>> getColumns();

    /**
     * Adds entity specific checks after the column constraints have been checked, using
     * {@link DataRowMapper#addCustomValidationError(String, String)}.
     *
     * @param mapper mapper being validated
     */
    default void validateLocally(DataRowMapper mapper) {
        // no additional checks
    }

    default void create(DataConnection db) throws SqlExecutionException {
        throw new UnsupportedOperationException("Create object not supported");
    }

    default void update(DataConnection db) throws SqlExecutionException {
        throw new UnsupportedOperationException("Update object not supported");
    }

    default void delete(DataConnection db) throws SqlExecutionException {
        throw new UnsupportedOperationException("Delete object not supported");
    }

    default void undelete(DataConnection db) throws SqlExecutionException {
        throw new UnsupportedOperationException("Undelete object not supported");
    }
}
