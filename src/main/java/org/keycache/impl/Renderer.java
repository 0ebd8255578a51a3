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

import com.google.common.primitives.Longs;
import java.nio.charset.StandardCharsets;

/**
 * Static-only class that renders keys in the form {@code ^varname(sub1,sub2,...)}, for diagnostics
 * and error messages.
 *
 * <p>A subscript that is a canonical integer (one that {@link Long#toString} would produce) is
 * written as is. Anything else is quoted: printable ASCII characters appear between double quotes,
 * with any embedded quote doubled, and runs of other bytes are written as {@code $C(n,...)}, joined
 * to the quoted parts with {@code _}. For example the bytes {@code a"b\0c} render as {@code
 * "a""b"_$C(0)_"c"}.
 */
public final class Renderer {

  // Statics only
  private Renderer() {}

  /** Returns the varname of {@code path}. */
  public static String varname(PathBuffer path) {
    return new String(path.varname(), StandardCharsets.ISO_8859_1);
  }

  /** Returns the comma-separated subscripts of {@code path}, or "" if it has none. */
  public static String subscripts(PathBuffer path) {
    return subscripts(path, path.depth());
  }

  /**
   * Returns the comma-separated first {@code depth} subscripts of {@code path}, or "" if {@code
   * depth} is zero.
   *
   * @throws org.keycache.KeyCache.PathException with kind INVALID_DEPTH if {@code depth} is not in
   *     {@code 0..path.depth()}
   */
  public static String subscripts(PathBuffer path, int depth) {
    checkDepth(path, depth);
    StringBuilder sb = new StringBuilder();
    appendSubscripts(sb, path, depth);
    return sb.toString();
  }

  /** Returns the varname and subscripts of {@code path}. */
  public static String render(PathBuffer path) {
    return render(path, path.depth());
  }

  /**
   * Returns the varname and first {@code depth} subscripts of {@code path}; just the varname if
   * {@code depth} is zero.
   */
  public static String render(PathBuffer path, int depth) {
    checkDepth(path, depth);
    StringBuilder sb = new StringBuilder(varname(path));
    if (depth != 0) {
      sb.append('(');
      appendSubscripts(sb, path, depth);
      sb.append(')');
    }
    return sb.toString();
  }

  private static void checkDepth(PathBuffer path, int depth) {
    int max = path.depth();
    // Don't include the path in this message, since rendering it is what failed.
    Err.INVALID_DEPTH.unless(
        depth >= 0 && depth <= max, "%s is not in the range 0..%s", depth, max);
  }

  private static void appendSubscripts(StringBuilder sb, PathBuffer path, int depth) {
    OwnedPath root = path.root();
    for (int i = 0; i < depth; i++) {
      if (i != 0) {
        sb.append(',');
      }
      appendSubscript(sb, root.arena, root.slotOffset(i), root.slotLength(i));
    }
  }

  /** Appends the rendering of a single subscript. */
  static void appendSubscript(StringBuilder sb, ByteArena arena, int pos, int length) {
    String s = new String(arena.bytes, arena.base + pos, length, StandardCharsets.ISO_8859_1);
    if (isCanonicalInteger(s)) {
      sb.append(s);
    } else {
      appendQuoted(sb, arena, pos, length);
    }
  }

  /** Returns true if {@code s} is exactly what {@link Long#toString} would return for its value. */
  public static boolean isCanonicalInteger(String s) {
    Long value = Longs.tryParse(s);
    return value != null && value.toString().equals(s);
  }

  private static boolean isPrintable(int b) {
    return b >= 0x20 && b < 0x7f;
  }

  private static void appendQuoted(StringBuilder sb, ByteArena arena, int pos, int length) {
    if (length == 0) {
      sb.append("\"\"");
      return;
    }
    // 0 between parts, 1 inside quotes, 2 inside $C(...)
    int state = 0;
    boolean first = true;
    for (int i = 0; i < length; i++) {
      int b = arena.getB(pos + i);
      if (isPrintable(b)) {
        if (state == 2) {
          sb.append(')');
        }
        if (state != 1) {
          if (!first) {
            sb.append('_');
          }
          sb.append('"');
          state = 1;
        }
        sb.append((char) b);
        if (b == '"') {
          sb.append('"');
        }
      } else {
        if (state == 1) {
          sb.append('"');
        }
        if (state == 2) {
          sb.append(',');
        } else {
          if (!first) {
            sb.append('_');
          }
          sb.append("$C(");
          state = 2;
        }
        sb.append(b);
      }
      first = false;
    }
    sb.append(state == 1 ? "\"" : ")");
  }
}
