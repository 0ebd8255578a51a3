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

import org.keycache.util.SizeOf;

/**
 * An OwnedPath holds the bytes of a key in its own arena: the varname at position 0, immediately
 * followed by each populated subscript in order. {@link #slots} records each subscript's (offset,
 * length) within the arena.
 *
 * <p>The arena and slot array may have room beyond what is populated; appends that fit are written
 * there and returned as {@link PathView}s, leaving this key's own {@link #depth} unchanged.
 */
public class OwnedPath extends PathBuffer {

  private static final long OBJ_SIZE = SizeOf.object(4 * SizeOf.PTR + 3 * SizeOf.INT);

  /**
   * The Allocator for any copies made when appending to this key; see {@link Allocator#owner}. Only
   * replaced by {@link MutableCursor#subst}.
   */
  Allocator allocator;

  /** Only replaced by {@link MutableCursor#subst}. */
  ByteArena arena;

  /**
   * Element {@code 2*i} is the arena offset of subscript {@code i}, element {@code 2*i+1} its
   * length. Only replaced by {@link MutableCursor#subst}.
   */
  int[] slots;

  final int varnameLength;

  /** The depth of this key; subscripts beyond it are only visible through views. */
  final int depth;

  /** The number of populated slots; only increased by {@link Grower#writeInPlace}. */
  int depthUsed;

  OwnedPath(Allocator allocator, ByteArena arena, int[] slots, int varnameLength, int depth) {
    assert depth <= slots.length / 2 && varnameLength <= arena.capacity;
    this.allocator = allocator;
    this.arena = arena;
    this.slots = slots;
    this.varnameLength = varnameLength;
    this.depth = depth;
    this.depthUsed = depth;
  }

  @Override
  public final OwnedPath root() {
    return this;
  }

  @Override
  public final int depth() {
    return depth;
  }

  @Override
  public final boolean isView() {
    return false;
  }

  @Override
  public final int depthAlloc() {
    return slots.length / 2;
  }

  @Override
  public final int byteCapacity() {
    return arena.capacity - varnameLength;
  }

  /** Returns the key for the first {@code depth} populated slots: this, or a view onto this. */
  final PathBuffer at(int depth) {
    if (depth == this.depth) {
      return this;
    }
    PathView view = new PathView(this, depth);
    allocator.recordAlloc(view, PathView.OBJ_SIZE);
    return view;
  }

  final int slotOffset(int i) {
    assert i >= 0 && i < depthUsed;
    return slots[2 * i];
  }

  final int slotLength(int i) {
    assert i >= 0 && i < depthUsed;
    return slots[2 * i + 1];
  }

  /** The arena position just past the last populated slot. */
  final int usedEnd() {
    return (depthUsed == 0) ? varnameLength : slotOffset(depthUsed - 1) + slotLength(depthUsed - 1);
  }

  /** The arena position just past the first {@code depth} slots. */
  final int endOf(int depth) {
    return (depth == 0) ? varnameLength : slotOffset(depth - 1) + slotLength(depth - 1);
  }

  final byte[] slotBytes(int i) {
    return arena.get(slotOffset(i), slotLength(i));
  }

  /** Returns true if {@code bytes} equals the varname (if {@code depth} is 0) or that subscript. */
  final boolean regionEquals(int depth, byte[] bytes) {
    return (depth == 0)
        ? arena.regionEquals(0, varnameLength, bytes)
        : arena.regionEquals(slotOffset(depth - 1), slotLength(depth - 1), bytes);
  }

  /** Sets slot {@code i}'s (offset, length). */
  final void setSlot(int i, int offset, int length) {
    slots[2 * i] = offset;
    slots[2 * i + 1] = length;
  }

  /** The estimated memory used by this key and its storage. */
  final long sizeOf() {
    long size = OBJ_SIZE + SizeOf.array(slots.length, SizeOf.INT);
    // Scratch regions are accounted for by whoever supplied them.
    if (!arena.isTransient) {
      size += SizeOf.array(arena.bytes.length, SizeOf.BYTE);
    }
    return size;
  }
}
