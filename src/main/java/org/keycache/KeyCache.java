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

package org.keycache;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * The KeyCache class is just a namespace for the types seen by code that consumes cached keys: the
 * engine call layer, error formatting, and iteration.
 */
public class KeyCache {

  // Just a namespace for the contained types.
  private KeyCache() {}

  /**
   * A Key is a read-only view of a hierarchical database key: a varname followed by zero or more
   * subscripts, each an arbitrary byte string.
   *
   * <p>Depths are numbered from 1 for the first subscript; depth 0 refers to the varname. Methods
   * that take a depth also accept negative values, which count back from the last subscript ({@code
   * -1} is the last one).
   */
  public interface Key {

    /** Returns the number of subscripts in this key. */
    int depth();

    /** Returns a copy of the varname's bytes. */
    byte[] varname();

    /**
     * Returns a copy of the subscript at the given depth, or of the varname if {@code depth} is
     * zero.
     *
     * @throws PathException with kind INVALID_DEPTH if {@code depth} is out of range
     */
    byte[] subscript(int depth);

    /** True if this key is a cursor that supports in-place substitution of its last subscript. */
    boolean isMutable();

    /** True if this key shares its storage with a deeper key rather than owning it. */
    boolean isView();

    /**
     * Returns read-only buffers over this key's bytes, without copying them: the varname first, and
     * then one buffer for each subscript. This is the form in which keys are handed to the engine.
     *
     * <p>The buffers are only valid until the next substitution on a mutable key.
     */
    List<ByteBuffer> asBuffers();
  }

  /** All errors detected while building or changing a Key throw a PathException. */
  public static class PathException extends RuntimeException {

    /** A short, stable name for the kind of error, e.g. "TOO_MANY_SUBSCRIPTS". */
    public final String kind;

    public PathException(String kind, String message) {
      super(message);
      this.kind = kind;
    }
  }
}
