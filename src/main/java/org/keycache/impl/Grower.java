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

import org.keycache.util.ArrayUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static-only class that decides how much storage new keys get, and whether an append can reuse
 * the storage it already has.
 *
 * <p>New storage gets {@link Limits#overallocSlots} more slots than needed, and {@code
 * overallocSlots * typicalSublen} more subscript bytes, so that a few levels of typical subscripts
 * can later be appended without copying. MutableCursors get no headroom.
 */
final class Grower {

  private static final Logger LOGGER = LoggerFactory.getLogger(Grower.class);

  // Statics only
  private Grower() {}

  static final byte[][] NO_SUBS = new byte[0][];

  static final int[] NO_SLOTS = new int[0];

  /** The largest array most JVMs will allocate. */
  private static final int MAX_ARRAY = Integer.MAX_VALUE - 8;

  /** Checks the varname and subscripts of a new key against {@code limits}. */
  static void checkCreate(Limits limits, byte[] varname, byte[][] subs) {
    Err.INVALID_VARNAME.when(varname == null, "null varname");
    Err.INVALID_SUBSCRIPT_TYPE.when(subs == null, "null subscript array");
    Err.INVALID_VARNAME.unless(
        varname.length > 0 && varname.length <= limits.maxVarnameLength,
        "length %s is not in the range 1..%s",
        varname.length,
        limits.maxVarnameLength);
    Err.TOO_MANY_SUBSCRIPTS.when(
        subs.length > limits.maxSubs,
        "%s subscripts requested, at most %s allowed",
        subs.length,
        limits.maxSubs);
    checkSubscripts(limits, varname.length, subs);
  }

  /**
   * Checks that the first {@code atDepth} subscripts of {@code root} followed by {@code subs} would
   * be a valid key; {@code from} is the key being appended to, used only in messages.
   */
  static void checkAppend(OwnedPath root, int atDepth, byte[][] subs, PathBuffer from) {
    Limits limits = root.allocator.limits();
    Err.INVALID_SUBSCRIPT_TYPE.when(subs == null, "null subscript array");
    Err.TOO_MANY_SUBSCRIPTS.when(
        atDepth + subs.length > limits.maxSubs,
        "appending %s to depth %s of %s exceeds %s",
        subs.length,
        atDepth,
        from,
        limits.maxSubs);
    checkSubscripts(limits, root.endOf(atDepth), subs);
  }

  /**
   * Checks each subscript for null and for length, and checks that {@code prefixLength} bytes
   * followed by all of them would not exceed the maximum path length.
   */
  static void checkSubscripts(Limits limits, long prefixLength, byte[]... subs) {
    long total = prefixLength;
    for (int i = 0; i < subs.length; i++) {
      byte[] sub = subs[i];
      Err.INVALID_SUBSCRIPT_TYPE.when(sub == null, "subscript %s is null", i + 1);
      Err.SUBSCRIPT_TOO_LONG.when(
          sub.length > limits.maxSubscriptLength,
          "subscript %s has %s bytes, at most %s allowed",
          i + 1,
          sub.length,
          limits.maxSubscriptLength);
      total += sub.length;
    }
    Err.PATH_TOO_LONG.when(
        total > limits.maxPathLength,
        "%s bytes, at most %s allowed",
        total,
        limits.maxPathLength);
  }

  /** Returns the arena size for the given number of used bytes, with headroom unless mutable. */
  private static int arenaSize(Limits limits, long used, boolean mutable) {
    long size = mutable ? used : used + limits.byteHeadroom();
    return (int) Math.min(size, MAX_ARRAY);
  }

  /** Returns the number of slots to allocate for the given depth, with headroom unless mutable. */
  private static int slotCount(Limits limits, int depth, boolean mutable) {
    return mutable ? depth : depth + limits.overallocSlots;
  }

  /** Creates a new OwnedPath; all arguments must already have been checked. */
  static OwnedPath create(Allocator allocator, byte[] varname, byte[][] subs) {
    Limits limits = allocator.limits();
    long used = varname.length + ArrayUtil.totalLength(subs);
    ByteArena arena = allocator.allocArena(arenaSize(limits, used, false));
    allocator = allocator.owner(arena);
    int[] slots = allocator.allocSlots(slotCount(limits, subs.length, false));
    arena.put(0, varname);
    int pos = varname.length;
    for (int i = 0; i < subs.length; i++) {
      arena.put(pos, subs[i]);
      slots[2 * i] = pos;
      slots[2 * i + 1] = subs[i].length;
      pos += subs[i].length;
    }
    OwnedPath result = new OwnedPath(allocator, arena, slots, varname.length, subs.length);
    allocator.recordAlloc(result, result.sizeOf());
    return result;
  }

  /**
   * Returns a new OwnedPath (a MutableCursor if {@code mutable} is true) containing the varname and
   * first {@code depth} subscripts of {@code src} followed by {@code subs}. All arguments must
   * already have been checked.
   */
  static OwnedPath copy(
      Allocator allocator, OwnedPath src, int depth, byte[][] subs, boolean mutable) {
    assert depth <= src.depthUsed;
    Limits limits = allocator.limits();
    int newDepth = depth + subs.length;
    int prefixEnd = src.endOf(depth);
    long used = prefixEnd + ArrayUtil.totalLength(subs);
    ByteArena arena = allocator.allocArena(arenaSize(limits, used, mutable));
    allocator = allocator.owner(arena);
    int[] slots = allocator.allocSlots(slotCount(limits, newDepth, mutable));
    // The varname and the prefix are contiguous in src, and stay at the same offsets.
    arena.copyFrom(src.arena, 0, 0, prefixEnd);
    System.arraycopy(src.slots, 0, slots, 0, 2 * depth);
    int pos = prefixEnd;
    for (int i = 0; i < subs.length; i++) {
      arena.put(pos, subs[i]);
      slots[2 * (depth + i)] = pos;
      slots[2 * (depth + i) + 1] = subs[i].length;
      pos += subs[i].length;
    }
    OwnedPath result =
        mutable
            ? new MutableCursor(allocator, arena, slots, src.varnameLength, newDepth)
            : new OwnedPath(allocator, arena, slots, src.varnameLength, newDepth);
    allocator.recordAlloc(result, result.sizeOf());
    if (!mutable && subs.length != 0) {
      LOGGER.debug("copied {} to depth {} to append {} subscripts", src, depth, subs.length);
    }
    return result;
  }

  /**
   * Returns true if {@code subs} can be stored in {@code root} starting at slot {@code atDepth}
   * without changing what any existing key observes: each subscript must either be identical to
   * the populated slot it would occupy, or go into the next unpopulated slot with enough slot and
   * byte capacity remaining.
   *
   * <p>A MutableCursor's last slot may be substituted later, so a key that includes it must never
   * share the cursor's storage; and a cursor has no unpopulated slots.
   */
  static boolean fitsInPlace(OwnedPath root, int atDepth, byte[][] subs) {
    int newDepth = atDepth + subs.length;
    if (root.isMutable() && newDepth >= root.depth) {
      return false;
    }
    int used = root.depthUsed;
    long end = root.usedEnd();
    for (int k = 0; k < subs.length; k++) {
      int i = atDepth + k;
      if (i < used) {
        if (!root.regionEquals(i + 1, subs[k])) {
          return false;
        }
      } else {
        assert i == used;
        end += subs[k].length;
        if (i >= root.depthAlloc() || end > root.arena.capacity) {
          return false;
        }
        used++;
      }
    }
    return true;
  }

  /**
   * Writes {@code subs} into {@code root} starting at slot {@code atDepth}; {@link #fitsInPlace}
   * must have returned true. Slots that already hold identical bytes are left alone.
   */
  static void writeInPlace(OwnedPath root, int atDepth, byte[][] subs) {
    for (int k = 0; k < subs.length; k++) {
      int i = atDepth + k;
      if (i == root.depthUsed) {
        int pos = root.usedEnd();
        root.arena.put(pos, subs[k]);
        root.setSlot(i, pos, subs[k].length);
        root.depthUsed++;
      }
    }
    LOGGER.trace("appended in place to {}, now {} slots used", root, root.depthUsed);
  }
}
