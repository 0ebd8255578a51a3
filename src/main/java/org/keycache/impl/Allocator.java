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

import com.google.common.base.Preconditions;
import org.keycache.util.ArrayUtil;
import org.keycache.util.SizeOf;

/**
 * An Allocator provides the storage for new PathBuffers: the arenas holding their bytes and the
 * arrays holding their slots. Methods that create PathBuffers take an Allocator and call {@link
 * #recordAlloc} once the new buffer is complete.
 *
 * <p>Each Allocator also determines the {@link Limits} enforced on the buffers it creates, and on
 * any buffers later derived from them.
 */
public interface Allocator {

  /** The limits enforced on buffers created with this Allocator. */
  Limits limits();

  /** Returns a ByteArena with exactly the given capacity. Its contents are unspecified. */
  ByteArena allocArena(int capacity);

  /** Returns a zero-filled slot array with room for {@code depthAlloc} (offset, length) pairs. */
  int[] allocSlots(int depthAlloc);

  /**
   * Records the allocation of a new PathBuffer. {@link SizeOf#isValidSize} should return true for
   * the given size.
   */
  void recordAlloc(PathBuffer obj, long size);

  /**
   * Records a change in memory use of a previously-allocated buffer.
   *
   * <p>{@code sizeDelta} is the change in the number of bytes, positive if {@code obj} is now
   * larger.
   */
  void adjustAlloc(PathBuffer obj, long sizeDelta);

  /**
   * Returns the Allocator that a buffer stored in {@code arena} (which must have come from this
   * Allocator) should use for anything allocated on its behalf later. A buffer whose bytes were
   * given a heap arena must not later be given scratch storage, so an Allocator that mixes the two
   * returns a heap Allocator for heap arenas.
   */
  default Allocator owner(ByteArena arena) {
    return this;
  }

  /** Returns an Allocator that allocates from the heap and enforces the given limits. */
  static Allocator heap(Limits limits) {
    Preconditions.checkNotNull(limits);
    return new Allocator() {
      @Override
      public Limits limits() {
        return limits;
      }

      @Override
      public ByteArena allocArena(int capacity) {
        byte[] bytes = (capacity == 0) ? ArrayUtil.EMPTY_BYTES : new byte[capacity];
        return new ByteArena(bytes, 0, capacity, false);
      }

      @Override
      public int[] allocSlots(int depthAlloc) {
        return (depthAlloc == 0) ? Grower.NO_SLOTS : new int[2 * depthAlloc];
      }

      @Override
      public void recordAlloc(PathBuffer obj, long size) {
        assert SizeOf.isValidSize(size);
      }

      @Override
      public void adjustAlloc(PathBuffer obj, long sizeDelta) {}

      @Override
      public String toString() {
        return "heap(" + limits + ")";
      }
    };
  }

  /** A heap Allocator with the default limits; buffers it creates live as long as they are used. */
  Allocator HEAP = heap(Limits.DEFAULT);
}
