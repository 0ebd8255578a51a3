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

import com.google.errorprone.annotations.FormatMethod;
import org.keycache.KeyCache.PathException;

/** An Err identifies a kind of error, with a static instance for each error the cache can raise. */
public final class Err {

  /** The name used as {@link PathException#kind}. */
  public final String name;

  /** A short description, used as the prefix of each exception message. */
  public final String msg;

  private Err(String name, String msg) {
    this.name = name;
    this.msg = msg;
  }

  /** Returns true if {@code e} was raised by this Err. */
  public boolean is(PathException e) {
    return name.equals(e.kind);
  }

  /** Returns a PathException corresponding to this Err. */
  public PathException asException() {
    return new PathException(name, msg);
  }

  /** Returns a PathException corresponding to this Err, with the formatted details appended. */
  @FormatMethod
  public PathException asException(String fmt, Object... args) {
    return new PathException(name, msg + ": " + String.format(fmt, args));
  }

  /** Throws {@link #asException} unless {@code check} is true. */
  public void unless(boolean check) {
    if (!check) {
      throw asException();
    }
  }

  /** Throws {@link #asException(String, Object...)} unless {@code check} is true. */
  @FormatMethod
  public void unless(boolean check, String fmt, Object... args) {
    if (!check) {
      throw asException(fmt, args);
    }
  }

  /** Throws {@link #asException} if {@code check} is true. */
  public void when(boolean check) {
    if (check) {
      throw asException();
    }
  }

  /** Throws {@link #asException(String, Object...)} if {@code check} is true. */
  @FormatMethod
  public void when(boolean check, String fmt, Object... args) {
    if (check) {
      throw asException(fmt, args);
    }
  }

  @Override
  public String toString() {
    return name;
  }

  public static final Err TOO_MANY_SUBSCRIPTS =
      new Err("TOO_MANY_SUBSCRIPTS", "Too many subscripts");

  public static final Err INVALID_SUBSCRIPT_TYPE =
      new Err("INVALID_SUBSCRIPT_TYPE", "Subscript must be a byte string or a number");

  public static final Err NOT_MUTABLE =
      new Err("NOT_MUTABLE", "Key is not a fully-populated mutable cursor");

  public static final Err INVALID_DEPTH = new Err("INVALID_DEPTH", "Invalid depth");

  /** Raised when a View's depth is inconsistent with its root; always an internal bug. */
  public static final Err CORRUPT_DEPTH = new Err("CORRUPT_DEPTH", "Corrupt view depth");

  public static final Err INVALID_VARNAME = new Err("INVALID_VARNAME", "Invalid varname");

  public static final Err SUBSCRIPT_TOO_LONG =
      new Err("SUBSCRIPT_TOO_LONG", "Subscript is too long");

  public static final Err PATH_TOO_LONG = new Err("PATH_TOO_LONG", "Key is too long");
}
