package io.github.yok.cdflib.db;

import io.github.yok.cdflib.core.DataHelper;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.apache.commons.codec.binary.Hex;

/**
 * Renders coerced parameter values as MySQL literals.
 *
 * <ul>
 * <li>{@link SqlDataType#STRING}, {@link SqlDataType#TEXT}: single-quoted, escaped.</li>
 * <li>{@link SqlDataType#DATA}: hexadecimal literal {@code X'..'}.</li>
 * <li>{@link SqlDataType#INTEGER}: decimal literal.</li>
 * <li>{@link SqlDataType#FLOAT}: fixed notation, period as decimal separator. Infinity and NaN
 * are rejected.</li>
 * <li>{@link SqlDataType#BOOL}: {@code 1} or {@code 0}.</li>
 * <li>{@link SqlDataType#TIMESTAMP}: {@code 'yyyy-MM-dd HH:mm:ss'} in GMT; {@code NULL} for the
 * epoch.</li>
 * </ul>
 *
 * <p>
 * {@code null} is {@code NULL} for every type.
 * </p>
 *
 * <p>
 * <strong>Placeholder collisions:</strong> string values may contain the
 * {@link #PLACEHOLDER placeholder} character. It is swapped for {@link #SENTINEL} while the
 * statement is rendered and swapped back by {@link #restorePlaceholders(String)} afterwards, so it
 * can never be taken for an unresolved placeholder. A genuine {@code U+001A} in string data is
 * therefore returned as {@code ?}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SqlValueFormatter {

    /**
     * Placeholder character marking a substitution point in SQL text.
     */
    public static final char PLACEHOLDER = '?';

    /**
     * Private character standing in for {@link #PLACEHOLDER} inside rendered values.
     */
    public static final char SENTINEL = '\u001A';

    private static final String NULL_LITERAL = "NULL";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    /**
     * Formats a value as a SQL literal.
     *
     * @param type declared type
     * @param value coerced value, may be {@code null}
     * @return SQL literal fragment
     * @throws IllegalArgumentException if {@code type} is {@code null}, the value does not hold
     *         the Java type the declared type expects, or a float is not finite
     */
    public String format(SqlDataType type, Object value) {
        if (type == null) {
            throw new IllegalArgumentException("Unknown data type in parameter build");
        }
        if (value == null) {
            return NULL_LITERAL;
        }
        switch (type) {
            case STRING:
            case TEXT:
                return "'" + escape(value.toString().replace(PLACEHOLDER, SENTINEL)) + "'";
            case DATA:
                return "X'" + Hex.encodeHexString(requireType(type, value, byte[].class)) + "'";
            case INTEGER:
                return Long.toString(requireType(type, value, Number.class).longValue());
            case FLOAT:
                double d = requireType(type, value, Number.class).doubleValue();
                if (!Double.isFinite(d)) {
                    throw new IllegalArgumentException("FLOAT parameter is not finite: " + d);
                }
                return String.format(Locale.ROOT, "%f", d);
            case BOOL:
                return requireType(type, value, Boolean.class) ? "1" : "0";
            case TIMESTAMP:
                ZonedDateTime ts = requireType(type, value, ZonedDateTime.class);
                if (!DataHelper.hasDateTime(ts)) {
                    return NULL_LITERAL;
                }
                return "'" + ts.withZoneSameInstant(DataHelper.GMT).format(TIMESTAMP_FORMAT) + "'";
            default:
                throw new IllegalArgumentException("Unknown data type in parameter build: " + type);
        }
    }

    /**
     * Escapes a string for use between single quotes in MySQL.
     *
     * <p>
     * Handles {@code NUL}, line feed, carriage return, backslash and both quote characters.
     * {@link #SENTINEL} is passed through untouched.
     * </p>
     *
     * @param value raw string
     * @return escaped string
     */
    public String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\0':
                    sb.append("\\0");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\'':
                    sb.append("\\'");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                default:
                    sb.append(c);
                    break;
            }
        }
        return sb.toString();
    }

    /**
     * Turns every {@link #SENTINEL} in a rendered statement back into {@link #PLACEHOLDER}.
     *
     * @param sql rendered statement
     * @return statement ready for execution
     */
    public String restorePlaceholders(String sql) {
        return sql.indexOf(SENTINEL) < 0 ? sql : sql.replace(SENTINEL, PLACEHOLDER);
    }

    private static <T> T requireType(SqlDataType type, Object value, Class<T> expected) {
        if (!expected.isInstance(value)) {
            throw new IllegalArgumentException(String.format("%s parameter expects %s but got %s",
                    type, expected.getSimpleName(), value.getClass().getName()));
        }
        return expected.cast(value);
    }
}
