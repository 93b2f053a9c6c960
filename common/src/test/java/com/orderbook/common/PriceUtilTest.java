package com.orderbook.common;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PriceUtilTest {

    @Test
    void testParseToMicros() {
        assertEquals(100_000_000L, PriceUtil.parse("100"));
        assertEquals(100_250_000L, PriceUtil.parse("100.25"));
        assertEquals(1L,           PriceUtil.parse("0.000001"));
        assertEquals(99_500_000L,  PriceUtil.parse(" 99.5 "));
    }

    @Test
    void testRejectsSubMicroPrecision() {
        assertThrows(IllegalArgumentException.class, () -> PriceUtil.parse("1.0000001"));
        assertThrows(IllegalArgumentException.class, () -> PriceUtil.parse("abc"));
    }

    @Test
    void testFormatAndDecimal() {
        assertEquals("100.25", PriceUtil.format(100_250_000L));
        assertEquals("100.00", PriceUtil.format(PriceUtil.ofUnits(100)));
        assertEquals(0, new BigDecimal("100.5").compareTo(PriceUtil.toDecimal(100_500_000L)));
    }

    @Test
    void testOrderingSurvivesFixedPoint() {
        assertTrue(PriceUtil.parse("100.01") > PriceUtil.parse("100.00"));
        assertTrue(PriceUtil.parse("0.1") + PriceUtil.parse("0.2") == PriceUtil.parse("0.3"),
                "No binary floating-point drift");
    }
}
