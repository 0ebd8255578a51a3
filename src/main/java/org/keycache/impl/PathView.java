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
 * A PathView exposes the first {@link #depth()} subscripts of an {@link OwnedPath}, which may be
 * more or fewer than the OwnedPath's own depth. It has no storage of its own; holding a PathView
 * keeps its root reachable, but the root has no reference back to its views.
 */
public final class PathView extends PathBuffer {

  static final long OBJ_SIZE = SizeOf.object(SizeOf.PTR + SizeOf.INT);

  private final OwnedPath root;
  private final int depth;

  PathView(OwnedPath root, int depth) {
    this.root = root;
    this.depth = depth;
  }

  @Override
  public OwnedPath root() {
    return root;
  }

  /**
   * @throws org.keycache.KeyCache.PathException with kind CORRUPT_DEPTH if this view's depth is no
   *     longer backed by populated slots in its root
   */
  @Override
  public int depth() {
    Err.CORRUPT_DEPTH.when(
        depth < 0 || depth > root.depthUsed,
        "view depth %s, root has %s populated slots",
        depth,
        root.depthUsed);
    return depth;
  }

  @Override
  public boolean isView() {
    return true;
  }
}
