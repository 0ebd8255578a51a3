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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A MutableCursor is an OwnedPath whose last subscript can be replaced in place, so that iterating
 * over sibling subscripts does not allocate a new key for each one. Created by {@link
 * PathBuffer#toMutable}.
 *
 * <p>A MutableCursor has no spare slots, so appending to it always copies; keys derived from a
 * cursor are never affected by later substitutions. Views of a cursor's shallower subscripts are
 * also unaffected, since only the last subscript changes.
 */
public final class MutableCursor extends OwnedPath {

  private static final Logger LOGGER = LoggerFactory.getLogger(MutableCursor.class);

  MutableCursor(Allocator allocator, ByteArena arena, int[] slots, int varnameLength, int depth) {
    super(allocator, arena, slots, varnameLength, depth);
    assert depthAlloc() == depth;
  }

  @Override
  public boolean isMutable() {
    return true;
  }

  /**
   * Replaces this cursor's last subscript with {@code sub} and returns the cursor to use from now
   * on.
   *
   * <p>If {@code sub} fits in the arena space following the last subscript's offset it is written
   * in place, without allocating. Otherwise new storage sized to fit is allocated and the varname
   * and other subscripts are copied into it; the new storage replaces the old only once it is
   * complete.
   *
   * <p>Callers should always continue with the returned cursor, and should not keep {@link
   * #asBuffers} results across a substitution.
   *
   * @throws org.keycache.KeyCache.PathException with kind NOT_MUTABLE if the cursor does not expose
   *     all of its populated slots, INVALID_DEPTH if it has no subscripts, or SUBSCRIPT_TOO_LONG or
   *     PATH_TOO_LONG if {@code sub} is too long
   */
  @Override
  public MutableCursor subst(byte[] sub) {
    Err.NOT_MUTABLE.unless(depth == depthUsed, "%s has %s populated slots", this, depthUsed);
    Err.INVALID_DEPTH.when(depth == 0, "%s has no subscript to replace", this);
    int last = depth - 1;
    int offset = slotOffset(last);
    Grower.checkSubscripts(allocator.limits(), offset, sub);
    if (offset + sub.length <= arena.capacity) {
      arena.put(offset, sub);
      setSlot(last, offset, sub.length);
      return this;
    }
    ByteArena newArena = allocator.allocArena(offset + sub.length);
    Allocator newAllocator = allocator.owner(newArena);
    int[] newSlots = newAllocator.allocSlots(depth);
    newArena.copyFrom(arena, 0, 0, varnameLength);
    // Lay the subscripts out again from the start of the new arena.
    int pos = varnameLength;
    for (int i = 0; i < depth; i++) {
      int length;
      if (i == last) {
        length = sub.length;
        newArena.put(pos, sub);
      } else {
        length = slotLength(i);
        newArena.copyFrom(arena, slotOffset(i), pos, length);
      }
      newSlots[2 * i] = pos;
      newSlots[2 * i + 1] = length;
      pos += length;
    }
    long oldSize = sizeOf();
    LOGGER.debug(
        "reallocating cursor {} to fit a {}-byte subscript ({} bytes available)",
        this,
        sub.length,
        arena.capacity - offset);
    arena = newArena;
    slots = newSlots;
    allocator = newAllocator;
    allocator.adjustAlloc(this, sizeOf() - oldSize);
    return this;
  }

  /** Like {@link #subst(byte[])}, but first converts {@code value} with {@link Subscripts}. */
  public MutableCursor substValue(Object value) {
    return subst(Subscripts.toBytes(value));
  }
}
