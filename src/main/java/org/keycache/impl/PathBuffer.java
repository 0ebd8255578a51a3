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
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.keycache.KeyCache;
import org.keycache.util.ArrayUtil;

/**
 * A PathBuffer is the cached representation of a key: the varname and subscripts laid out in a
 * single {@link ByteArena}, ready to be handed to the engine without further marshalling.
 *
 * <p>There are two kinds of PathBuffer:
 *
 * <ul>
 *   <li>an {@link OwnedPath} owns an arena and a slot array recording each subscript's (offset,
 *       length). Its arena may have room for more subscripts than it exposes, so that appending a
 *       subscript can often reuse it.
 *   <li>a {@link PathView} owns no storage; it exposes a prefix (or an in-place extension) of an
 *       OwnedPath's subscripts, and keeps that OwnedPath reachable.
 * </ul>
 *
 * <p>PathBuffers are immutable in every way that is observable through the {@link KeyCache.Key}
 * methods, with one exception: a {@link MutableCursor} may have its last subscript replaced by
 * {@link #subst}. Appending never changes the content of an existing key; it writes in place only
 * into slots no existing key can see, or when the bytes written are identical to those already
 * there, and otherwise copies.
 *
 * <p>PathBuffers are not thread-safe.
 */
public abstract class PathBuffer implements KeyCache.Key {

  // Only OwnedPath and PathView.
  PathBuffer() {}

  /** Returns the OwnedPath whose arena holds this key's bytes; returns {@code this} if owned. */
  public abstract OwnedPath root();

  @Override
  public abstract int depth();

  @Override
  public abstract boolean isView();

  @Override
  public boolean isMutable() {
    return false;
  }

  /** True if this key's bytes live in a scratch region that may be reused after this call. */
  public boolean isTransient() {
    return root().arena.isTransient;
  }

  /** The number of populated slots in the underlying storage; at least {@link #depth}. */
  public int depthUsed() {
    return root().depthUsed;
  }

  /** The number of slots in the underlying storage. */
  public int depthAlloc() {
    return root().depthAlloc();
  }

  /** The number of subscript bytes the underlying storage can hold. */
  public int byteCapacity() {
    return root().byteCapacity();
  }

  /** The number of subscript bytes populated in the underlying storage. */
  public int bytesUsed() {
    OwnedPath root = root();
    return root.usedEnd() - root.varnameLength;
  }

  /** The Limits enforced on this key and on keys derived from it. */
  public Limits limits() {
    return root().allocator.limits();
  }

  @Override
  public byte[] varname() {
    OwnedPath root = root();
    return root.arena.get(0, root.varnameLength);
  }

  @Override
  public byte[] subscript(int depth) {
    int d = resolveDepth(depth);
    return (d == 0) ? varname() : root().slotBytes(d - 1);
  }

  /**
   * Converts a depth that may count back from the end into one in {@code 0..depth()}.
   *
   * @throws KeyCache.PathException with kind INVALID_DEPTH if {@code depth} is not in {@code
   *     -depth()..depth()}
   */
  int resolveDepth(int depth) {
    int n = depth();
    Err.INVALID_DEPTH.unless(
        depth >= -n && depth <= n, "%s is not in the range %s..%s of %s", depth, -n, n, this);
    return (depth < 0) ? n + 1 + depth : depth;
  }

  @Override
  public List<ByteBuffer> asBuffers() {
    OwnedPath root = root();
    int depth = depth();
    List<ByteBuffer> result = new ArrayList<>(depth + 1);
    result.add(root.arena.slice(0, root.varnameLength));
    for (int i = 0; i < depth; i++) {
      result.add(root.arena.slice(root.slotOffset(i), root.slotLength(i)));
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Returns true if {@code other} has the same varname and subscripts as this key. Unlike {@link
   * Object#equals}, this is not affected by how either key is stored.
   */
  public boolean contentEquals(KeyCache.Key other) {
    int depth = depth();
    if (other.depth() != depth) {
      return false;
    }
    for (int i = 0; i <= depth; i++) {
      if (!root().regionEquals(i, other.subscript(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns a key for the subscripts of this key followed by {@code subs}. The result shares
   * storage with this key when that can be done without changing what any existing key observes;
   * otherwise it is a new, independent copy.
   */
  public PathBuffer append(byte[]... subs) {
    return append(depth(), subs);
  }

  /**
   * Returns a key for the first {@code atDepth} subscripts of this key followed by {@code subs}.
   *
   * <p>Each subscript is checked against the slot it would occupy in the underlying storage: if
   * that slot is unused and there is room, or already holds identical bytes, no copy is needed. If
   * every subscript can be placed that way the result shares this key's storage (and may be this
   * key, or its root); otherwise everything is copied into new storage with room to grow.
   *
   * <p>If {@code subs} is empty, returns the key for the first {@code atDepth} subscripts, which is
   * {@code this} when {@code atDepth == depth()}.
   */
  public PathBuffer append(int atDepth, byte[]... subs) {
    int depth = depth();
    Err.INVALID_DEPTH.unless(
        atDepth >= 0 && atDepth <= depth, "can't append at %s to %s", atDepth, this);
    OwnedPath root = root();
    Grower.checkAppend(root, atDepth, subs, this);
    if (subs.length == 0) {
      return (atDepth == depth) ? this : root.at(atDepth);
    }
    if (Grower.fitsInPlace(root, atDepth, subs)) {
      Grower.writeInPlace(root, atDepth, subs);
      return root.at(atDepth + subs.length);
    }
    return Grower.copy(root.allocator, root, atDepth, subs, false);
  }

  /** Like {@link #append(byte[]...)}, but first converts each value with {@link Subscripts}. */
  public PathBuffer appendValues(Object... subs) {
    return append(Subscripts.toSubscripts(subs));
  }

  /**
   * Returns a new MutableCursor with the same varname and subscripts as this key. This key is
   * unchanged.
   */
  public MutableCursor toMutable() {
    OwnedPath root = root();
    return (MutableCursor) Grower.copy(root.allocator, root, depth(), Grower.NO_SUBS, true);
  }

  /**
   * Replaces the last subscript of a MutableCursor; see {@link MutableCursor#subst}.
   *
   * @throws KeyCache.PathException with kind NOT_MUTABLE, since this key is not a MutableCursor
   */
  public MutableCursor subst(byte[] sub) {
    throw Err.NOT_MUTABLE.asException("can't substitute into %s", this);
  }

  /**
   * Returns this key if it is not transient, or a heap copy of it if it is. A MutableCursor is
   * copied to a MutableCursor.
   */
  public PathBuffer persist() {
    if (!isTransient()) {
      return this;
    }
    OwnedPath root = root();
    Allocator heap = Allocator.heap(root.allocator.limits());
    return Grower.copy(heap, root, depth(), Grower.NO_SUBS, isMutable());
  }

  /** Renders this key for diagnostics, e.g. {@code ^hello("cowboy",2)}. */
  @Override
  public String toString() {
    return Renderer.render(this);
  }

  /** Returns a new key with the given varname and subscripts. */
  public static PathBuffer create(Allocator allocator, byte[] varname, byte[]... subs) {
    Preconditions.checkNotNull(allocator);
    Grower.checkCreate(allocator.limits(), varname, subs);
    return Grower.create(allocator, varname, subs);
  }

  /** Returns a new key with the given varname followed by {@code subs} and then {@code more}. */
  public static PathBuffer create(
      Allocator allocator, byte[] varname, List<byte[]> subs, byte[]... more) {
    return create(allocator, varname, ArrayUtil.concat(subs, subs.size(), more));
  }

  /**
   * Returns a new key with the given varname and subscripts, converting each subscript with {@link
   * Subscripts}. The varname is encoded as UTF-8.
   */
  public static PathBuffer create(Allocator allocator, String varname, Object... subs) {
    Err.INVALID_VARNAME.when(varname == null, "null varname");
    byte[] varnameBytes = varname.getBytes(StandardCharsets.UTF_8);
    return create(allocator, varnameBytes, Subscripts.toSubscripts(subs));
  }

  /**
   * Returns a new key, independent of {@code base}, with the varname and subscripts of {@code base}
   * followed by {@code subs}.
   */
  public static PathBuffer extend(Allocator allocator, PathBuffer base, byte[]... subs) {
    Preconditions.checkNotNull(allocator);
    OwnedPath root = base.root();
    int depth = base.depth();
    Grower.checkAppend(root, depth, subs, base);
    return Grower.copy(allocator, root, depth, subs, false);
  }
}
