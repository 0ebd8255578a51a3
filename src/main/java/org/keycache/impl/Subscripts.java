/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.keycache.impl;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import org.jspecify.annotations.Nullable;

/**
 * Static-only class that converts the values callers use as subscripts into the bytes stored in a
 * key.
 *
 * <ul>
 *   <li>A byte[] is used as is.
 *   <li>A CharSequence is encoded as UTF-8.
 *   <li>An integral number (Byte, Short, Integer, Long, BigInteger) is written in decimal.
 *   <li>A Float, Double or BigDecimal is written in canonical form: no trailing zeros after the
 *       decimal point, no leading zero before it, and no decimal point at all if the value is an
 *       integer (so {@code 2.50} becomes {@code 2.5}, {@code 0.5} becomes {@code .5}, and {@code
 *       -0.0} becomes {@code 0}).
 * </ul>
 *
 * Anything else, including null and non-finite numbers, is rejected with INVALID_SUBSCRIPT_TYPE.
 */
public final class Subscripts {

  // Statics only
  private Subscripts() {}

  /** Converts each of {@code values} with {@link #toBytes(Object)}. */
  public static byte[][] toSubscripts(@Nullable Object... values) {
    Err.INVALID_SUBSCRIPT_TYPE.when(values == null, "null subscript array");
    byte[][] result = new byte[values.length][];
    for (int i = 0; i < values.length; i++) {
      result[i] = toBytes(values[i]);
    }
    return result;
  }

  /**
   * Returns the subscript bytes for {@code value}.
   *
   * @throws org.keycache.KeyCache.PathException with kind INVALID_SUBSCRIPT_TYPE if {@code value}
   *     can't be used as a subscript
   */
  public static byte[] toBytes(@Nullable Object value) {
    if (value instanceof byte[] bytes) {
      return bytes;
    } else if (value instanceof CharSequence cs) {
      return cs.toString().getBytes(StandardCharsets.UTF_8);
    } else if (value instanceof Integer
        || value instanceof Long
        || value instanceof Short
        || value instanceof Byte
        || value instanceof BigInteger) {
      return ascii(value.toString());
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      Err.INVALID_SUBSCRIPT_TYPE.unless(Double.isFinite(d), "%s is not finite", value);
      // Float.toString gives the shortest decimal that identifies the float, not the double.
      String s = (value instanceof Float) ? value.toString() : Double.toString(d);
      return ascii(canonical(new BigDecimal(s)));
    } else if (value instanceof BigDecimal bd) {
      return ascii(canonical(bd));
    }
    throw Err.INVALID_SUBSCRIPT_TYPE.asException(
        "%s", (value == null) ? "null" : value.getClass().getName());
  }

  /** Returns the canonical decimal form of {@code value}. */
  static String canonical(BigDecimal value) {
    if (value.signum() == 0) {
      return "0";
    }
    BigDecimal stripped = value.stripTrailingZeros();
    if (stripped.scale() <= 0) {
      return stripped.toBigIntegerExact().toString();
    }
    String s = stripped.toPlainString();
    if (s.startsWith("0.")) {
      return s.substring(1);
    } else if (s.startsWith("-0.")) {
      return "-" + s.substring(2);
    }
    return s;
  }

  private static byte[] ascii(String s) {
    return s.getBytes(StandardCharsets.US_ASCII);
  }
}
