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

import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;
import org.keycache.KeyCache;

/**
 * A SiblingIterator returns the subscripts that follow (or precede) a key's last subscript at the
 * same level, as reported by the engine. It copies the starting key to a {@link MutableCursor} once
 * and then substitutes each subscript into it, so iterating does not allocate a key per step.
 *
 * <p>To iterate over all subscripts at a level, start from a key whose last subscript is empty.
 */
public final class SiblingIterator implements Iterator<byte[]> {

  /** The engine operation that finds the next subscript at a key's level. */
  public interface NextSubscript {
    /**
     * Returns the subscript following (or, if {@code reverse}, preceding) the last subscript of
     * {@code key} among its siblings, or null if there is none.
     */
    byte @Nullable [] next(KeyCache.Key key, boolean reverse);
  }

  private final NextSubscript engine;
  private final boolean reverse;
  private MutableCursor cursor;

  /** The subscript {@link #hasNext} fetched, if {@link #fetched} is true. */
  private byte @Nullable [] pending;

  private boolean fetched;

  /**
   * Creates an iterator over the siblings of {@code start}'s last subscript.
   *
   * @throws KeyCache.PathException with kind INVALID_DEPTH if {@code start} has no subscripts
   */
  public SiblingIterator(PathBuffer start, NextSubscript engine, boolean reverse) {
    Err.INVALID_DEPTH.when(start.depth() == 0, "can't iterate over siblings of %s", start);
    this.engine = engine;
    this.reverse = reverse;
    this.cursor = start.toMutable();
  }

  /**
   * The cursor, positioned at the subscript most recently returned by {@link #next} (or at the
   * starting key, if {@code next} has not been called). Only valid until the next call to {@code
   * next}.
   */
  public MutableCursor cursor() {
    return cursor;
  }

  @Override
  public boolean hasNext() {
    if (!fetched) {
      pending = engine.next(cursor, reverse);
      fetched = true;
    }
    return pending != null;
  }

  @Override
  public byte[] next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    byte[] result = pending;
    cursor = cursor.subst(result);
    pending = null;
    fetched = false;
    return result;
  }
}
