/**
 * Value coercion and display formatting.
 *
 * <p>
 * {@link io.github.yok.cdflib.core.DataHelper} converts loosely typed input (request values, result
 * row values) into strings, numbers, flags and GMT date/times. It is used by the query parameter
 * binding in {@code db} and by the column setters in {@code data}.
 * </p>
 */
package io.github.yok.cdflib.core;
