package com.carbondna.api.canonical;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Scalar value of a ledger payload field.
 * Only these four shapes can be hashed; everything else is converted to one of
 * them by {@link FieldMap#of(java.util.Map)} or rejected.
 */
public sealed interface FieldValue permits FieldValue.Text, FieldValue.Numeric, FieldValue.Bool, FieldValue.Null {

    /**
     * Plain Java view of the value (String, BigDecimal, Boolean or null).
     */
    Object toJava();

    static FieldValue text(String value) {
        return value == null ? Null.INSTANCE : new Text(value);
    }

    static FieldValue number(BigDecimal value) {
        return value == null ? Null.INSTANCE : new Numeric(value);
    }

    static FieldValue bool(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static FieldValue nullValue() {
        return Null.INSTANCE;
    }

    record Text(String value) implements FieldValue {
        public Text {
            Objects.requireNonNull(value, "Text value cannot be null");
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    /**
     * Decimal number normalized on construction, so that 100, 100.0 and 1E+2
     * are the same value. The plain rendering, sign and decimal point
     * included, may not exceed {@link #MAX_PLAIN_LENGTH} characters; the
     * canonicalizer reads stored payloads back with the same limit.
     */
    record Numeric(BigDecimal value) implements FieldValue {

        public static final int MAX_PLAIN_LENGTH = 512;

        public Numeric {
            Objects.requireNonNull(value, "Numeric value cannot be null");
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
            long length = plainLength(value);
            if (length > MAX_PLAIN_LENGTH) {
                throw new CanonicalizationException("Number needs " + length
                        + " characters in plain notation, the limit is " + MAX_PLAIN_LENGTH);
            }
        }

        // computed from precision and scale, the plain string may be huge
        static long plainLength(BigDecimal value) {
            long precision = value.precision();
            long scale = value.scale();
            long length;
            if (scale <= 0) {
                length = precision - scale;
            } else if (scale >= precision) {
                length = scale + 2;
            } else {
                length = precision + 1;
            }
            return value.signum() < 0 ? length + 1 : length;
        }

        /**
         * Fixed decimal rendering without exponent.
         */
        public String canonical() {
            return value.toPlainString();
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    record Bool(boolean value) implements FieldValue {
        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);

        @Override
        public Object toJava() {
            return value;
        }
    }

    final class Null implements FieldValue {
        static final Null INSTANCE = new Null();

        private Null() {}

        @Override
        public Object toJava() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }
}
