package io.github.yok.cdflib.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import lombok.Generated;

/**
 * Locale-independent formatting of numbers and prices.
 *
 * <p>
 * All output uses {@link Locale#ROOT}: a comma as the thousands separator and a period as the
 * decimal separator.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ValueFormat {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ValueFormat() {
        throw new AssertionError("No io.github.yok.cdflib.core.ValueFormat instances for you!");
    }

    /**
     * Formats a floating point number with four decimals and thousands grouping.
     *
     * @param number number to format
     * @return formatted number, e.g. {@code 1,234.5000}
     */
    public static String doubleToString(double number) {
        return String.format(Locale.ROOT, "%,.4f", number);
    }

    /**
     * Formats a decimal number with four decimals and thousands grouping.
     *
     * @param number number to format
     * @return formatted number
     */
    public static String decimalToString(BigDecimal number) {
        return String.format(Locale.ROOT, "%,.4f", number);
    }

    /**
     * Formats an integer with thousands grouping.
     *
     * @param number number to format
     * @return formatted number, e.g. {@code 1,234}
     */
    public static String integerToString(long number) {
        return String.format(Locale.ROOT, "%,d", number);
    }

    /**
     * Formats a money amount with two decimals, prefixed by the currency symbol.
     *
     * @param amount amount to format (e.g. {@code 1234.5})
     * @param currency currency symbol or code
     * @return formatted amount, e.g. {@code GBP 1,234.50}
     */
    public static String currencyToString(double amount, String currency) {
        return String.format(Locale.ROOT, "%s %,.2f", currency, amount);
    }

    /**
     * Converts a price to a whole number of minor units ({@code "19.99"} becomes {@code 1999}).
     *
     * <p>
     * The value is rounded to two decimals in decimal arithmetic, so results never suffer from
     * binary floating point truncation ({@code (long) (19.99 * 100)} would give {@code 1998}).
     * </p>
     *
     * @param price price as any value accepted by {@link DataHelper#asFloat(Object)}
     * @return price in minor units
     */
    public static long priceToInteger(Object price) {
        BigDecimal decimal = price instanceof BigDecimal ? (BigDecimal) price
                : new BigDecimal(Double.toString(DataHelper.asFloat(price)));
        return decimal.setScale(2, RoundingMode.HALF_UP).movePointRight(2).longValue();
    }
}
