package com.duckide.practice.engine;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {
    @Test
    void decodesDriverObjectsIntoVariants() {
        assertSame(Value.Null.INSTANCE, Value.of(null));
        assertInstanceOf(Value.Bool.class, Value.of(true));
        assertInstanceOf(Value.Int64.class, Value.of(42));
        assertInstanceOf(Value.Int64.class, Value.of(42L));
        assertInstanceOf(Value.Int64.class, Value.of(BigInteger.valueOf(7)));
        assertInstanceOf(Value.Other.class, Value.of(BigInteger.ONE.shiftLeft(70)));
        assertInstanceOf(Value.Float64.class, Value.of(2.5d));
        assertInstanceOf(Value.Text.class, Value.of("abc"));
        assertInstanceOf(Value.Other.class, Value.of(new BigDecimal("999.99")));
        assertInstanceOf(Value.Other.class, Value.of(LocalDate.of(2020, 1, 15)));
    }

    @Test
    void wholeNumbersRenderAlikeAcrossVariants() {
        assertEquals("1", Value.of(1).stringValue());
        assertEquals("1", Value.of(1.0d).stringValue());
        assertEquals("1", Value.of("1").stringValue());
        assertEquals("2.5", Value.of(2.5d).stringValue());
        assertEquals("999.99", Value.of(new BigDecimal("999.99")).stringValue());
        assertEquals("1", Value.of(new BigDecimal("1.0")).stringValue());
        assertEquals("75000", Value.of(new BigDecimal("75000.00")).stringValue());
        assertEquals("0", Value.of(new BigDecimal("0.00")).stringValue());
        assertEquals("12.5", Value.of(new BigDecimal("12.50")).stringValue());
        assertEquals("null", Value.of(null).stringValue());
        assertEquals("2020-01-15", Value.of(LocalDate.of(2020, 1, 15)).stringValue());
    }

    @Test
    void nonFiniteDoublesKeepTheirOwnText() {
        assertEquals("NaN", Value.of(Double.NaN).stringValue());
        assertEquals("Infinity", Value.of(Double.POSITIVE_INFINITY).stringValue());
    }
}
