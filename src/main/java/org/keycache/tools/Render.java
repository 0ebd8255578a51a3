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

package org.keycache.tools;

import java.util.Arrays;
import org.keycache.KeyCache;
import org.keycache.impl.AllocationCounter;
import org.keycache.impl.Allocator;
import org.keycache.impl.Limits;
import org.keycache.impl.PathBuffer;
import org.keycache.impl.Renderer;

/**
 * A simple command-line tool that builds a key one subscript at a time, the way a node layer would,
 * and prints each intermediate key with the storage it used.
 *
 * <p>Arguments that look like integers are used as numbers; everything else as a string. Limits
 * may be overridden with {@code -Dkeycache.maxSubs=...} etc.; see {@link
 * Limits#fromSystemProperties}.
 */
public class Render {
  private Render() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: render <varname> [ <subscript> ...]");
      System.exit(1);
    }
  }

  private static Object parse(String arg) {
    return Renderer.isCanonicalInteger(arg) ? (Object) Long.valueOf(arg) : arg;
  }

  public static void main(String[] args) {
    checkUsage(args.length != 0);
    Limits limits = Limits.fromSystemProperties();
    AllocationCounter counter = new AllocationCounter(Allocator.heap(limits));
    try {
      PathBuffer key = PathBuffer.create(counter, args[0]);
      describe(key);
      for (String arg : Arrays.asList(args).subList(1, args.length)) {
        key = key.appendValues(parse(arg));
        describe(key);
      }
    } catch (KeyCache.PathException e) {
      System.out.printf("ERROR %s: %s\n", e.kind, e.getMessage());
    }
    System.out.println("---");
    System.out.println(counter);
  }

  private static void describe(PathBuffer key) {
    System.out.printf(
        "%s\n  depth %s of %s used, %s slots, %s/%s subscript bytes%s\n",
        key,
        key.depth(),
        key.depthUsed(),
        key.depthAlloc(),
        key.bytesUsed(),
        key.byteCapacity(),
        key.isView() ? " (view)" : "");
  }
}
