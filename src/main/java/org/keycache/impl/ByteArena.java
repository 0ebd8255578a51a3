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

import java.nio.ByteBuffer;
import java.util.Arrays;
import org.keycache.util.ArrayUtil;

/**
 * A ByteArena is a fixed-size window onto a byte[]. Heap arenas own their whole array; arenas drawn
 * from a {@link ScratchAllocator} share the allocator's region, each starting at its own {@link
 * #base}.
 *
 * <p>All positions passed to ByteArena methods are relative to the start of the arena.
 */
public final class ByteArena {

  /** The array holding this arena's bytes, and possibly other arenas'. */
  final byte[] bytes;

  /** The index in {@link #bytes} of this arena's first byte. */
  final int base;

  /** The number of bytes in this arena. */
  final int capacity;

  /** True if this arena was drawn from a scratch region rather than the heap. */
  final boolean isTransient;

  ByteArena(byte[] bytes, int base, int capacity, boolean isTransient) {
    assert base >= 0 && capacity >= 0 && base + capacity <= bytes.length;
    this.bytes = bytes;
    this.base = base;
    this.capacity = capacity;
    this.isTransient = isTransient;
  }

  /** Copies {@code src} into this arena, starting at {@code pos}. */
  void put(int pos, byte[] src) {
    assert pos >= 0 && pos + src.length <= capacity;
    System.arraycopy(src, 0, bytes, base + pos, src.length);
  }

  /** Copies {@code length} bytes starting at {@code srcPos} of {@code src} to {@code dstPos}. */
  void copyFrom(ByteArena src, int srcPos, int dstPos, int length) {
    assert srcPos >= 0 && srcPos + length <= src.capacity;
    assert dstPos >= 0 && dstPos + length <= capacity;
    System.arraycopy(src.bytes, src.base + srcPos, bytes, base + dstPos, length);
  }

  /** Returns a copy of the {@code length} bytes starting at {@code pos}. */
  byte[] get(int pos, int length) {
    assert pos >= 0 && pos + length <= capacity;
    return Arrays.copyOfRange(bytes, base + pos, base + pos + length);
  }

  /** Returns the byte at {@code pos} as a uint8. */
  int getB(int pos) {
    return ArrayUtil.bytesGetB(bytes, base + pos);
  }

  /** Returns true if the {@code length} bytes starting at {@code pos} equal {@code other}. */
  boolean regionEquals(int pos, int length, byte[] other) {
    return length == other.length && ArrayUtil.regionEquals(bytes, base + pos, other);
  }

  /** Returns a read-only ByteBuffer over the {@code length} bytes starting at {@code pos}. */
  ByteBuffer slice(int pos, int length) {
    return ByteBuffer.wrap(bytes, base + pos, length).slice().asReadOnlyBuffer();
  }
}
