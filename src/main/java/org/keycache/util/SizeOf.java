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

/**
 * Static-only class with constants and methods useful for estimating the memory used by cached
 * keys.
 */
public class SizeOf {

  // Statics only
  private SizeOf() {}

  /** The number of bytes required for a pointer. */
  public static final int PTR = 4;

  /** The number of bytes required for a byte. */
  public static final int BYTE = 1;

  /** The number of bytes required for a int. */
  public static final int INT = 4;

  /** The number of additional bytes stored with a non-array object. */
  public static final int OBJECT_HEADER = 12;

  /** The number of additional bytes stored with an array object. */
  public static final int ARRAY_HEADER = 16;

  /** Rounds up to the nearest multiple of 8, the minimum unit of Java memory allocation. */
  public static long roundedAllocSize(long size) {
    return (size + 7) & ~7;
  }

  /**
   * Returns the number of bytes required for a java object, given the number of bytes required for
   * its fields.
   */
  public static long object(long fieldsSize) {
    return roundedAllocSize(OBJECT_HEADER + fieldsSize);
  }

  /**
   * Returns the number of bytes required for a Java array, given the number of elements and the
   * size of each element.
   */
  public static long array(long length, long elementSize) {
    // Taken as longs so that the multiplication can't overflow.
    return roundedAllocSize(ARRAY_HEADER + length * elementSize);
  }

  /** Returns true if the argument is a valid size for a Java object. */
  public static boolean isValidSize(long size) {
    // The Java VM currently allocates in units of 8 bytes.
    return size > 0 && (size & 7) == 0;
  }
}
