/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.elastic.jwriter.encode;

import com.dslplatform.json.JsonWriter;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats binary floating point numbers with the fewest significant digits that still parse back to the same value
 * of the same width, in the general notation of C's {@code %g}: plain decimal notation when the exponent of the
 * leading digit is in {@code [-4, 6)}, scientific notation with an at least two digit exponent otherwise.
 * <p>
 * Digits are derived from the exact binary value. When several decimals of the shortest length parse back to the
 * value, the one closest to it is written.
 * </p>
 * <p>
 * Examples: {@code 0.1}, {@code 100000}, {@code 1e+06}, {@code 1.5e-05}, {@code -0}.
 * </p>
 */
final class FloatFormatter {

    private static final int MIN_PLAIN_EXPONENT = -4;
    private static final int MAX_PLAIN_EXPONENT = 6;

    private FloatFormatter() {
    }

    static void writeFloat64(double value, JsonWriter jw) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            writeNonFinite(value, jw);
            return;
        }
        if (value == 0) {
            writeZero(Double.doubleToRawLongBits(value) < 0, jw);
            return;
        }
        final BigDecimal exact = new BigDecimal(value);
        for (int precision = 1; ; precision++) {
            final BigDecimal nearest = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (nearest.doubleValue() == value) {
                writeGeneral(nearest, jw);
                return;
            }
            final BigDecimal other = exact.round(new MathContext(precision, awayFrom(nearest, exact)));
            if (other.doubleValue() == value) {
                writeGeneral(other, jw);
                return;
            }
        }
    }

    static void writeFloat32(float value, JsonWriter jw) {
        if (Float.isNaN(value) || Float.isInfinite(value)) {
            writeNonFinite(value, jw);
            return;
        }
        if (value == 0) {
            writeZero(Float.floatToRawIntBits(value) < 0, jw);
            return;
        }
        // every float is exactly representable as a double
        final BigDecimal exact = new BigDecimal((double) value);
        for (int precision = 1; ; precision++) {
            final BigDecimal nearest = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (nearest.floatValue() == value) {
                writeGeneral(nearest, jw);
                return;
            }
            final BigDecimal other = exact.round(new MathContext(precision, awayFrom(nearest, exact)));
            if (other.floatValue() == value) {
                writeGeneral(other, jw);
                return;
            }
        }
    }

    /**
     * The digits of a given length closest to {@code exact} are tried first. If they don't parse back to the same
     * value, the only other candidate of that length is the one on the opposite side of {@code exact}.
     */
    private static RoundingMode awayFrom(BigDecimal nearest, BigDecimal exact) {
        return nearest.compareTo(exact) > 0 ? RoundingMode.FLOOR : RoundingMode.CEILING;
    }

    /**
     * NaN and the infinities have no JSON representation, they are written the way {@code %g} prints them.
     */
    private static void writeNonFinite(double value, JsonWriter jw) {
        if (Double.isNaN(value)) {
            jw.writeAscii("NaN");
        } else if (value > 0) {
            jw.writeAscii("+Inf");
        } else {
            jw.writeAscii("-Inf");
        }
    }

    private static void writeZero(boolean negative, JsonWriter jw) {
        if (negative) {
            jw.writeByte((byte) '-');
        }
        jw.writeByte((byte) '0');
    }

    private static void writeGeneral(BigDecimal value, JsonWriter jw) {
        final BigDecimal stripped = value.stripTrailingZeros();
        final String digits = stripped.unscaledValue().abs().toString();
        final int nd = digits.length();
        // value == 0.d1d2...dn * 10^dp
        final int dp = nd - stripped.scale();
        final int exponent = dp - 1;
        if (stripped.signum() < 0) {
            jw.writeByte((byte) '-');
        }
        if (exponent < MIN_PLAIN_EXPONENT || exponent >= MAX_PLAIN_EXPONENT) {
            writeScientific(digits, exponent, jw);
        } else {
            writePlain(digits, dp, jw);
        }
    }

    private static void writeScientific(String digits, int exponent, JsonWriter jw) {
        jw.writeByte((byte) digits.charAt(0));
        if (digits.length() > 1) {
            jw.writeByte((byte) '.');
            for (int i = 1; i < digits.length(); i++) {
                jw.writeByte((byte) digits.charAt(i));
            }
        }
        jw.writeByte((byte) 'e');
        if (exponent < 0) {
            jw.writeByte((byte) '-');
            exponent = -exponent;
        } else {
            jw.writeByte((byte) '+');
        }
        if (exponent < 10) {
            jw.writeByte((byte) '0');
            jw.writeByte((byte) ('0' + exponent));
        } else if (exponent < 100) {
            jw.writeByte((byte) ('0' + exponent / 10));
            jw.writeByte((byte) ('0' + exponent % 10));
        } else {
            jw.writeByte((byte) ('0' + exponent / 100));
            jw.writeByte((byte) ('0' + exponent / 10 % 10));
            jw.writeByte((byte) ('0' + exponent % 10));
        }
    }

    private static void writePlain(String digits, int dp, JsonWriter jw) {
        final int nd = digits.length();
        if (dp > 0) {
            for (int i = 0; i < dp; i++) {
                jw.writeByte(i < nd ? (byte) digits.charAt(i) : (byte) '0');
            }
        } else {
            jw.writeByte((byte) '0');
        }
        final int fractionDigits = nd - dp;
        if (fractionDigits > 0) {
            jw.writeByte((byte) '.');
            for (int i = 0; i < fractionDigits; i++) {
                final int j = dp + i;
                jw.writeByte(j >= 0 ? (byte) digits.charAt(j) : (byte) '0');
            }
        }
    }
}
