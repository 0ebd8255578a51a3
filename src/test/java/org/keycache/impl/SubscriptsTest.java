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

import static com.google.common.truth.Truth.assertThat;
import static org.keycache.impl.PathBufferTest.assertErr;
import static org.keycache.impl.PathBufferTest.str;

import java.math.BigDecimal;
import java.math.BigInteger;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class SubscriptsTest {

  private static Object[] conversions() {
    return new Object[] {
      new Object[] {"abc", "abc"},
      new Object[] {new StringBuilder("xy"), "xy"},
      new Object[] {42, "42"},
      new Object[] {-3L, "-3"},
      new Object[] {(short) 7, "7"},
      new Object[] {(byte) -1, "-1"},
      new Object[] {
        new BigInteger("123456789012345678901234567890"), "123456789012345678901234567890"
      },
      new Object[] {2.50, "2.5"},
      new Object[] {100.0, "100"},
      new Object[] {0.5, ".5"},
      new Object[] {-0.5, "-.5"},
      new Object[] {-0.0, "0"},
      new Object[] {1e20, "100000000000000000000"},
      new Object[] {1e-7, ".0000001"},
      new Object[] {0.1f, ".1"},
      new Object[] {-2.0f, "-2"},
      new Object[] {new BigDecimal("1.2300"), "1.23"},
      new Object[] {new BigDecimal("-0.000"), "0"},
      new Object[] {new BigDecimal("1E+3"), "1000"},
    };
  }

  @Test
  @Parameters(method = "conversions")
  @TestCaseName("toBytes_{1}")
  public void toBytes(Object value, String expected) {
    assertThat(str(Subscripts.toBytes(value))).isEqualTo(expected);
  }

  private static Object[] invalid() {
    return new Object[] {
      new Object[] {Double.NaN},
      new Object[] {Double.POSITIVE_INFINITY},
      new Object[] {Float.NEGATIVE_INFINITY},
      new Object[] {'c'},
      new Object[] {new Object()},
      new Object[] {new int[] {1}},
    };
  }

  @Test
  @Parameters(method = "invalid")
  public void invalidType(Object value) {
    assertErr(Err.INVALID_SUBSCRIPT_TYPE, () -> Subscripts.toBytes(value));
  }

  @Test
  public void nullValue() {
    assertErr(Err.INVALID_SUBSCRIPT_TYPE, () -> Subscripts.toBytes(null));
    assertErr(Err.INVALID_SUBSCRIPT_TYPE, () -> Subscripts.toSubscripts("a", null));
  }

  @Test
  public void bytesAreNotCopied() {
    byte[] bytes = {1, 2, 3};
    assertThat(Subscripts.toBytes(bytes)).isSameInstanceAs(bytes);
  }

  @Test
  public void utf8() {
    assertThat(Subscripts.toBytes("héllo")).hasLength(6);
    byte[][] subs = Subscripts.toSubscripts("é", 1);
    assertThat(subs).hasLength(2);
    assertThat(subs[0]).isEqualTo(new byte[] {(byte) 0xc3, (byte) 0xa9});
    assertThat(str(subs[1])).isEqualTo("1");
  }
}
