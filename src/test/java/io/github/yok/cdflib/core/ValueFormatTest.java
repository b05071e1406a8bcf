package io.github.yok.cdflib.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class ValueFormatTest {

    @Test
    void doubleToString_正常ケース_小数を指定する_桁区切りと小数4桁で返ること() {
        assertEquals("1,234.5000", ValueFormat.doubleToString(1234.5));
        assertEquals("0.1235", ValueFormat.doubleToString(0.12345));
        assertEquals("-12.0000", ValueFormat.doubleToString(-12));
    }

    @Test
    void decimalToString_正常ケース_BigDecimalを指定する_桁区切りと小数4桁で返ること() {
        assertEquals("1,000,000.1000", ValueFormat.decimalToString(new BigDecimal("1000000.1")));
    }

    @Test
    void integerToString_正常ケース_整数を指定する_桁区切り付きで返ること() {
        assertEquals("999", ValueFormat.integerToString(999));
        assertEquals("-1,000", ValueFormat.integerToString(-1000));
    }

    @Test
    void currencyToString_正常ケース_金額と通貨を指定する_通貨付き小数2桁で返ること() {
        assertEquals("GBP 1,234.50", ValueFormat.currencyToString(1234.5, "GBP"));
    }

    @Test
    void priceToInteger_正常ケース_価格を指定する_最小単位の整数が返ること() {
        assertEquals(1999L, ValueFormat.priceToInteger("19.99"));
        assertEquals(1999L, ValueFormat.priceToInteger(19.99));
        assertEquals(1000L, ValueFormat.priceToInteger(10));
        assertEquals(1235L, ValueFormat.priceToInteger(new BigDecimal("12.345")));
        assertEquals(0L, ValueFormat.priceToInteger("free"));
    }
}
