package io.github.yok.cdflib.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Wrappers guaranteeing that a loosely typed value comes out as a given Java type.
 *
 * <p>
 * Every {@code asXxx} method is total for {@code null}, strings, numbers and booleans: garbage input
 * produces a zero value, never an exception. Only objects that have no sensible representation of
 * the requested type are rejected with {@link IllegalArgumentException}.
 * </p>
 *
 * <ul>
 * <li>{@link #asString(Object)}: {@code null} becomes {@code ""}, numbers are grouped
 * ({@code 1,234} / {@code 1,234.5000}), booleans become {@code True}/{@code False}.</li>
 * <li>{@link #asFloat(Object)} / {@link #asInt(Object)}: strings are parsed by their leading
 * numeric prefix ({@code "12abc"} is 12, {@code "abc"} is 0).</li>
 * <li>{@link #asBool(Object)}: only {@code 1}, {@code true}, {@code on}, {@code yes} (any case)
 * are true for strings.</li>
 * <li>{@link #asDateTime(Object, ZoneId)}: anything unparseable is the Unix epoch.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class DataHelper {

    /**
     * Zone used when no zone is supplied.
     */
    public static final ZoneId GMT = ZoneId.of("GMT");

    // Leading numeric prefix, as permissive numeric parsing reads it
    private static final Pattern NUMERIC_PREFIX =
            Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    // Whole-string numeric value (treated as Unix seconds by asDateTime)
    private static final Pattern NUMERIC =
            Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
    // Markup removed by asStringSafe
    private static final Pattern MARKUP = Pattern.compile("<[^>]*>");
    private static final Set<String> TRUE_WORDS = Set.of("1", "true", "on", "yes");

    // yyyy-MM-dd[T| ]HH:mm[:ss][.fraction]
    private static final DateTimeFormatter LOCAL_DATE_TIME_PARSER =
            new DateTimeFormatterBuilder().append(DateTimeFormatter.ISO_LOCAL_DATE)
                    .optionalStart().appendLiteral('T').optionalEnd().optionalStart()
                    .appendLiteral(' ').optionalEnd().appendPattern("HH:mm").optionalStart()
                    .appendPattern(":ss").optionalEnd().optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                    .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter[] DATE_ONLY_FORMATTERS =
            {DateTimeFormatter.ISO_LOCAL_DATE, DateTimeFormatter.ofPattern("yyyy/MM/dd"),
                    DateTimeFormatter.ofPattern("yyyy.MM.dd")};

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private DataHelper() {
        throw new AssertionError("No io.github.yok.cdflib.core.DataHelper instances for you!");
    }

    /**
     * Formats any value as a string.
     *
     * @param value value to convert; may be {@code null}
     * @return string form, never {@code null}
     * @throws IllegalArgumentException if {@code value} is an object without its own
     *         {@code toString()}
     */
    public static String asString(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            return ValueFormat.doubleToString(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal) {
            return ValueFormat.decimalToString((BigDecimal) value);
        }
        if (value instanceof BigInteger) {
            return String.format(Locale.ROOT, "%,d", value);
        }
        if (value instanceof Number) {
            return ValueFormat.integerToString(((Number) value).longValue());
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? "True" : "False";
        }
        if (value instanceof Character) {
            return value.toString();
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        if (value instanceof TemporalAccessor || value instanceof Enum) {
            return value.toString();
        }
        if (!declaresToString(value.getClass())) {
            throw new IllegalArgumentException(
                    "Cannot convert object to string: " + value.getClass().getName());
        }
        return StringUtils.trim(value.toString());
    }

    /**
     * Same as {@link #asStringSafe(Object, boolean)} with markup stripping enabled.
     *
     * @param value value to convert
     * @return trimmed string without markup
     */
    public static String asStringSafe(Object value) {
        return asStringSafe(value, true);
    }

    /**
     * Returns the value as a string; string input is trimmed and optionally stripped of any
     * {@code <...>} markup.
     *
     * @param value value to convert
     * @param stripMarkup {@code true} to remove anything between angle brackets
     * @return safe string, never {@code null}
     */
    public static String asStringSafe(Object value, boolean stripMarkup) {
        if (value == null) {
            return "";
        }
        if (!(value instanceof CharSequence)) {
            return asString(value);
        }
        String s = value.toString();
        if (stripMarkup) {
            s = MARKUP.matcher(s).replaceAll("");
        }
        return StringUtils.trim(s);
    }

    /**
     * Returns the value as a double.
     *
     * @param value value to convert
     * @return numeric value; {@code 0.0} for {@code null} or non-numeric strings
     * @throws IllegalArgumentException if {@code value} is a non-numeric object
     */
    public static double asFloat(Object value) {
        if (value == null) {
            return 0.0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof CharSequence) {
            BigDecimal parsed = parseNumericPrefix(value.toString());
            return parsed == null ? 0.0 : parsed.doubleValue();
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? 1.0 : 0.0;
        }
        throw new IllegalArgumentException(
                "Cannot convert object to float: " + value.getClass().getName());
    }

    /**
     * Returns the value as a 64-bit integer. Fractions are truncated.
     *
     * @param value value to convert
     * @return integer value; {@code 0} for {@code null} or non-numeric strings
     * @throws IllegalArgumentException if {@code value} is a non-numeric object
     */
    public static long asInt(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof CharSequence) {
            BigDecimal parsed = parseNumericPrefix(value.toString());
            return parsed == null ? 0L : parsed.longValue();
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? 1L : 0L;
        }
        throw new IllegalArgumentException(
                "Cannot convert object to integer: " + value.getClass().getName());
    }

    /**
     * Returns the value as a boolean.
     *
     * @param value value to convert
     * @return {@code true} for {@code 1/true/on/yes} strings, non-zero numbers and other non-null
     *         objects
     */
    public static boolean asBool(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof CharSequence) {
            return TRUE_WORDS.contains(StringUtils.trim(value.toString()).toLowerCase(Locale.ROOT));
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        return true;
    }

    /**
     * Same as {@link #asDateTime(Object, ZoneId)} in GMT.
     *
     * @param value value to convert
     * @return date/time in GMT
     */
    public static ZonedDateTime asDateTime(Object value) {
        return asDateTime(value, GMT);
    }

    /**
     * Returns the value as a date/time in the given zone.
     *
     * <p>
     * Numbers and numeric strings are Unix seconds. Typed date/time values keep their instant and
     * are moved to {@code zone}; local values are interpreted in {@code zone}. {@code null}, empty
     * and unparseable input give the epoch.
     * </p>
     *
     * @param value value to convert
     * @param zone target zone
     * @return date/time in {@code zone}, never {@code null}
     */
    public static ZonedDateTime asDateTime(Object value, ZoneId zone) {
        ZoneId target = zone == null ? GMT : zone;
        if (value == null) {
            return epoch(target);
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).withZoneSameInstant(target);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).atZoneSameInstant(target);
        }
        if (value instanceof Instant) {
            return ((Instant) value).atZone(target);
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atZone(target);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay(target);
        }
        if (value instanceof Date) {
            return Instant.ofEpochMilli(((Date) value).getTime()).atZone(target);
        }
        if (value instanceof Number) {
            return fromEpochSeconds(((Number) value).longValue(), target);
        }
        String text = StringUtils.trim(asStringOrEmpty(value));
        if (text.isEmpty()) {
            return epoch(target);
        }
        if (NUMERIC.matcher(text).matches()) {
            return fromEpochSeconds(asInt(text), target);
        }
        ZonedDateTime parsed = parseDateTime(text, target);
        if (parsed == null) {
            log.debug("Unparseable date/time, using epoch. value={}", text);
            return epoch(target);
        }
        return parsed;
    }

    /**
     * Returns {@code true} if the value is a typed date/time strictly after the Unix epoch.
     *
     * @param value value to test
     * @return {@code true} if a real point in time is held
     */
    public static boolean hasDateTime(Object value) {
        Instant instant;
        if (value instanceof ZonedDateTime) {
            instant = ((ZonedDateTime) value).toInstant();
        } else if (value instanceof OffsetDateTime) {
            instant = ((OffsetDateTime) value).toInstant();
        } else if (value instanceof Instant) {
            instant = (Instant) value;
        } else if (value instanceof Date) {
            instant = Instant.ofEpochMilli(((Date) value).getTime());
        } else {
            return false;
        }
        return instant.isAfter(Instant.EPOCH);
    }

    /**
     * Returns the Unix epoch in the given zone.
     *
     * @param zone zone
     * @return epoch instant in {@code zone}
     */
    public static ZonedDateTime epoch(ZoneId zone) {
        return Instant.EPOCH.atZone(zone);
    }

    // Seconds beyond the supported date range fall back to the epoch
    private static ZonedDateTime fromEpochSeconds(long seconds, ZoneId zone) {
        try {
            return Instant.ofEpochSecond(seconds).atZone(zone);
        } catch (DateTimeException e) {
            log.debug("Epoch seconds out of range, using epoch. value={}", seconds);
            return epoch(zone);
        }
    }

    private static String asStringOrEmpty(Object value) {
        try {
            return asString(value);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    private static ZonedDateTime parseDateTime(String text, ZoneId zone) {
        try {
            return ZonedDateTime.parse(text, DateTimeFormatter.ISO_ZONED_DATE_TIME)
                    .withZoneSameInstant(zone);
        } catch (DateTimeParseException e) {
            // next
        }
        try {
            return Instant.parse(text).atZone(zone);
        } catch (DateTimeParseException e) {
            // next
        }
        try {
            return LocalDateTime.parse(text, LOCAL_DATE_TIME_PARSER).atZone(zone);
        } catch (DateTimeParseException e) {
            // next
        }
        for (DateTimeFormatter f : DATE_ONLY_FORMATTERS) {
            try {
                return LocalDate.parse(text, f).atStartOfDay(zone);
            } catch (DateTimeParseException e) {
                // next
            }
        }
        return null;
    }

    private static BigDecimal parseNumericPrefix(String text) {
        Matcher m = NUMERIC_PREFIX.matcher(StringUtils.trim(text));
        if (!m.find()) {
            return null;
        }
        try {
            return new BigDecimal(m.group());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean declaresToString(Class<?> type) {
        try {
            return type.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }
}
