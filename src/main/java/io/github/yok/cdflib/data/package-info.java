/**
 * Typed columns and the row mapper generating INSERT/UPDATE/SELECT/DELETE statements and running
 * declarative validation.
 */
package io.github.yok.cdflib.data;
