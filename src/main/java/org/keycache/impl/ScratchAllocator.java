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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A ScratchAllocator carves arenas out of a single fixed-size region, for keys that are only needed
 * for the duration of one call. Buffers whose arenas come from the region report {@link
 * PathBuffer#isTransient}; if they must outlive the call they should be copied with {@link
 * PathBuffer#persist}.
 *
 * <p>Calling {@link #reset} makes the whole region available again; it is the caller's
 * responsibility to ensure that no transient buffer drawn from it is still in use. Requests that
 * don't fit in the remaining space are served from the heap instead, and the resulting buffers are
 * not transient.
 *
 * <p>ScratchAllocators are not thread-safe.
 */
public final class ScratchAllocator implements Allocator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScratchAllocator.class);

  /**
   * Room for a varname and {@link Limits#MAX_SUBS} subscripts of typical length, plus the headroom
   * a new buffer reserves.
   */
  public static final int DEFAULT_SIZE =
      Limits.MAX_VARNAME + Limits.TYPICAL_SUBLEN * (Limits.MAX_SUBS + Limits.OVERALLOC_SLOTS);

  private final Allocator heap;
  private final byte[] region;

  /** The number of bytes of {@link #region} handed out since the last reset. */
  private int used;

  /** The number of requests served from the heap since this allocator was created. */
  private int overflows;

  public ScratchAllocator() {
    this(Limits.DEFAULT, DEFAULT_SIZE);
  }

  public ScratchAllocator(Limits limits, int size) {
    Preconditions.checkArgument(size >= 0, "negative scratch size (%s)", size);
    this.heap = Allocator.heap(limits);
    this.region = new byte[size];
  }

  @Override
  public Limits limits() {
    return heap.limits();
  }

  @Override
  public ByteArena allocArena(int capacity) {
    if (capacity <= region.length - used) {
      ByteArena result = new ByteArena(region, used, capacity, true);
      used += capacity;
      return result;
    }
    overflows++;
    LOGGER.debug(
        "scratch region exhausted ({} of {} bytes used), allocating {} bytes from the heap",
        used,
        region.length,
        capacity);
    return heap.allocArena(capacity);
  }

  /** Buffers stored in a heap arena allocate from the heap from then on. */
  @Override
  public Allocator owner(ByteArena arena) {
    return arena.isTransient ? this : heap;
  }

  @Override
  public int[] allocSlots(int depthAlloc) {
    return heap.allocSlots(depthAlloc);
  }

  @Override
  public void recordAlloc(PathBuffer obj, long size) {
    heap.recordAlloc(obj, size);
  }

  @Override
  public void adjustAlloc(PathBuffer obj, long sizeDelta) {
    heap.adjustAlloc(obj, sizeDelta);
  }

  /** Makes the whole region available again, invalidating every transient buffer drawn from it. */
  public void reset() {
    LOGGER.trace("reset scratch region ({} bytes were used)", used);
    used = 0;
  }

  /** The number of region bytes handed out since the last reset. */
  public int used() {
    return used;
  }

  /** The number of region bytes still available. */
  public int remaining() {
    return region.length - used;
  }

  /** The number of arena requests that did not fit in the region and were served by the heap. */
  public int overflows() {
    return overflows;
  }

  @Override
  public String toString() {
    return String.format("scratch(%s/%s used, %s overflows)", used, region.length, overflows);
  }
}
