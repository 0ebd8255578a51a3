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

package org.keycache.util;

import java.util.Arrays;
import java.util.List;

/** A static-only class that provides some convenience methods for working with arrays. */
public class ArrayUtil {

  private ArrayUtil() {}

  /** An empty byte[], shared by everyone who needs one. */
  public static final byte[] EMPTY_BYTES = new byte[0];

  /** Interprets the byte at the specified offset as a uint8. */
  public static int bytesGetB(byte[] array, int pos) {
    return array[pos] & 255;
  }

  /**
   * Returns true if the bytes of {@code array} starting at {@code pos} are equal to the whole of
   * {@code other}. Returns false if {@code array} has fewer than {@code other.length} bytes after
   * {@code pos}.
   */
  public static boolean regionEquals(byte[] array, int pos, byte[] other) {
    int end = pos + other.length;
    return end <= array.length && Arrays.equals(array, pos, end, other, 0, other.length);
  }

  /**
   * Returns the sum of the lengths of the given arrays, computed as a long so that it cannot
   * overflow.
   */
  public static long totalLength(byte[]... arrays) {
    long result = 0;
    for (byte[] array : arrays) {
      result += array.length;
    }
    return result;
  }


  /**
   * Returns a new array containing the first {@code length} elements of {@code first} followed by
   * all of {@code rest}.
   */
  public static byte[][] concat(List<byte[]> first, int length, byte[]... rest) {
    byte[][] result = new byte[length + rest.length][];
    for (int i = 0; i < length; i++) {
      result[i] = first.get(i);
    }
    System.arraycopy(rest, 0, result, length, rest.length);
    return result;
  }
}
