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

/**
 * An AllocationCounter passes every request through to another Allocator, keeping totals of what
 * was allocated. Intended for diagnostics and for verifying when buffers reallocate.
 *
 * <p>AllocationCounters are not thread-safe.
 */
public final class AllocationCounter implements Allocator {

  private final Allocator allocator;

  private int owned;
  private int views;
  private int arenas;
  private long arenaBytes;
  private long liveSize;

  public AllocationCounter(Allocator allocator) {
    this.allocator = Preconditions.checkNotNull(allocator);
  }

  @Override
  public Limits limits() {
    return allocator.limits();
  }

  @Override
  public ByteArena allocArena(int capacity) {
    arenas++;
    arenaBytes += capacity;
    return allocator.allocArena(capacity);
  }

  /**
   * Buffers that the wrapped Allocator moves to a different Allocator (such as a ScratchAllocator's
   * heap fallback) are no longer counted from then on.
   */
  @Override
  public Allocator owner(ByteArena arena) {
    Allocator owner = allocator.owner(arena);
    return (owner == allocator) ? this : owner;
  }

  @Override
  public int[] allocSlots(int depthAlloc) {
    return allocator.allocSlots(depthAlloc);
  }

  @Override
  public void recordAlloc(PathBuffer obj, long size) {
    if (obj instanceof PathView) {
      views++;
    } else {
      owned++;
    }
    liveSize += size;
    allocator.recordAlloc(obj, size);
  }

  @Override
  public void adjustAlloc(PathBuffer obj, long sizeDelta) {
    liveSize += sizeDelta;
    allocator.adjustAlloc(obj, sizeDelta);
  }

  /** The number of buffers with their own storage created so far. */
  public int ownedCount() {
    return owned;
  }

  /** The number of views created so far. */
  public int viewCount() {
    return views;
  }

  /**
   * The number of arenas allocated so far; each construction, copy-on-write, or cursor reallocation
   * allocates one.
   */
  public int arenaCount() {
    return arenas;
  }

  @Override
  public String toString() {
    return String.format(
        "%s owned, %s views, %s arenas (%s bytes), ~%s bytes total",
        owned, views, arenas, arenaBytes, liveSize);
  }
}
