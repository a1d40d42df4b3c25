package com.duckide.practice.engine;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A single result cell, decoded once at the engine boundary. Comparison between results only ever
 * looks at {@link #stringValue()}, so {@code 1}, {@code 1.0} and {@code "1"} are equal. Exact
 * decimals drop their trailing zeros: {@code DECIMAL '75000.00'} renders as {@code 75000}.
 */
public sealed interface Value permits Value.Null, Value.Bool, Value.Int64, Value.Float64, Value.Text, Value.Other {

    String stringValue();

    static Value of(Object raw) {
        if (raw == null) return Null.INSTANCE;
        if (raw instanceof Boolean b) return new Bool(b);
        if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer || raw instanceof Long) {
            return new Int64(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            return big.bitLength() < 64 ? new Int64(big.longValue()) : new Other(big.toString());
        }
        if (raw instanceof Float || raw instanceof Double) return new Float64(((Number) raw).doubleValue());
        if (raw instanceof BigDecimal decimal) return new Other(decimal.stripTrailingZeros().toPlainString());
        if (raw instanceof CharSequence text) return new Text(text.toString());
        return new Other(String.valueOf(raw));
    }

    enum Null implements Value {
        INSTANCE;

        @Override
        public String stringValue() {
            return "null";
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public String stringValue() {
            return Boolean.toString(value);
        }
    }

    record Int64(long value) implements Value {
        @Override
        public String stringValue() {
            return Long.toString(value);
        }
    }

    record Float64(double value) implements Value {
        private static final double EXACT_LONG_LIMIT = 9.007199254740992E15;

        @Override
        public String stringValue() {
            if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < EXACT_LONG_LIMIT) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }
    }

    record Text(String value) implements Value {
        @Override
        public String stringValue() {
            return value;
        }
    }

    /** Anything without a closer variant: decimals, dates, huge integers, nested values. */
    record Other(String raw) implements Value {
        @Override
        public String stringValue() {
            return raw;
        }
    }
}
