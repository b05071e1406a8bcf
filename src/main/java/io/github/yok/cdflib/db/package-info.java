/**
 * MySQL client with positional {@code ?} parameters.
 *
 * <p>
 * Parameters are coerced to their declared {@link io.github.yok.cdflib.db.SqlDataType}, rendered as
 * escaped literals and substituted into the statement text before it is sent. Driver failures and
 * placeholder count mismatches are reported as {@link io.github.yok.cdflib.db.SqlExecutionException}
 * carrying the statement.
 * </p>
 */
package io.github.yok.cdflib.db;
