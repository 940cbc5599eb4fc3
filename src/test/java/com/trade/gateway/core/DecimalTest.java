package com.trade.gateway.core;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decimal 工具类测试
 */
class DecimalTest {

    @Test
    void testScalePrice() {
        BigDecimal scaled = Decimal.scalePrice(new BigDecimal("123.456789012345"));
        assertEquals(8, scaled.scale());
    }

    @Test
    void testDivide_ByZero() {
        // 除数为 0 时返回 0，不抛异常
        assertEquals(0, BigDecimal.ZERO.compareTo(Decimal.divide(new BigDecimal("100"), BigDecimal.ZERO)));
    }

    @Test
    void testSnapToStep() {
        assertEquals(0, new BigDecimal("43250.5").compareTo(
                Decimal.snapToStep(new BigDecimal("43250.54"), new BigDecimal("0.1"), RoundingMode.HALF_UP)));
        assertEquals(0, new BigDecimal("43250.6").compareTo(
                Decimal.snapToStep(new BigDecimal("43250.55"), new BigDecimal("0.1"), RoundingMode.HALF_UP)));
        assertEquals(0, new BigDecimal("3").compareTo(
                Decimal.snapToStep(new BigDecimal("3.9"), BigDecimal.ONE, RoundingMode.DOWN)));
        // 无步长: 原样返回
        assertEquals(0, new BigDecimal("1.234").compareTo(
                Decimal.snapToStep(new BigDecimal("1.234"), null, RoundingMode.HALF_UP)));
    }

    @Test
    void testPlainHasNoExponent() {
        assertEquals("0.00001", Decimal.plain(new BigDecimal("1E-5")));
        assertEquals("100", Decimal.plain(new BigDecimal("1E+2")));
        assertEquals("0.1", Decimal.plain(new BigDecimal("0.100")));
        assertEquals("0", Decimal.plain(new BigDecimal("0.000")));
    }

    @Test
    void testParse() {
        assertEquals(0, new BigDecimal("1.5").compareTo(Decimal.parse(" 1.5 ", null)));
        assertNull(Decimal.parse("", null));
        assertNull(Decimal.parse("abc", null));
        assertEquals(BigDecimal.ONE, Decimal.parsePositive("-2", BigDecimal.ONE));
        assertEquals(BigDecimal.ONE, Decimal.parsePositive("0", BigDecimal.ONE));
    }

    @Test
    void testFirstPositive() {
        assertEquals(0, new BigDecimal("3").compareTo(
                Decimal.firstPositive(BigDecimal.ZERO, null, new BigDecimal("3"), new BigDecimal("4"))));
        assertEquals(0, BigDecimal.ZERO.compareTo(Decimal.firstPositive(BigDecimal.ZERO)));
    }

    @Test
    void testIsPositive() {
        assertTrue(Decimal.isPositive(new BigDecimal("0.0001")));
        assertFalse(Decimal.isPositive(BigDecimal.ZERO));
        assertFalse(Decimal.isPositive(new BigDecimal("-1")));
        assertFalse(Decimal.isPositive(null));
    }

    @Test
    void testIsZero() {
        assertTrue(Decimal.isZero(new BigDecimal("0.00000000")));
        assertFalse(Decimal.isZero(new BigDecimal("1")));
        assertFalse(Decimal.isZero(null));
    }
}
