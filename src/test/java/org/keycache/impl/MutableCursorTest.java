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

import static com.google.common.truth.Truth.assertThat;
import static org.keycache.impl.PathBufferTest.assertErr;
import static org.keycache.impl.PathBufferTest.b;
import static org.keycache.impl.PathBufferTest.str;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MutableCursorTest {

  @Test
  public void toMutable() {
    AllocationCounter counter = new AllocationCounter(Allocator.HEAP);
    PathBuffer p = PathBuffer.create(counter, b("^x"), b("a"), b("bb"));
    MutableCursor c = p.toMutable();
    assertThat(c.isMutable()).isTrue();
    assertThat(c.isView()).isFalse();
    assertThat(c.contentEquals(p)).isTrue();
    // Cursors are sized exactly
    assertThat(c.depthAlloc()).isEqualTo(2);
    assertThat(c.byteCapacity()).isEqualTo(3);
    assertThat(counter.arenaCount()).isEqualTo(2);
    // A cursor of a cursor is a separate copy
    MutableCursor c2 = c.toMutable();
    assertThat(c2).isNotSameInstanceAs(c);
    c2.subst(b("zz"));
    assertThat(c.toString()).isEqualTo("^x(\"a\",\"bb\")");
  }

  @Test
  public void substInPlace() {
    AllocationCounter counter = new AllocationCounter(Allocator.HEAP);
    MutableCursor c = PathBuffer.create(counter, b("^x"), b("a"), b("bb")).toMutable();
    int arenas = counter.arenaCount();
    assertThat(c.subst(b("cc"))).isSameInstanceAs(c);
    assertThat(c.toString()).isEqualTo("^x(\"a\",\"cc\")");
    assertThat(c.subst(b("d"))).isSameInstanceAs(c);
    assertThat(c.toString()).isEqualTo("^x(\"a\",\"d\")");
    // Shrinking left room that a longer subscript can use again
    assertThat(c.subst(b("ee"))).isSameInstanceAs(c);
    assertThat(c.subst(b(""))).isSameInstanceAs(c);
    assertThat(c.toString()).isEqualTo("^x(\"a\",\"\")");
    assertThat(counter.arenaCount()).isEqualTo(arenas);
  }

  @Test
  public void substReallocates() {
    AllocationCounter counter = new AllocationCounter(Allocator.HEAP);
    MutableCursor c = PathBuffer.create(counter, b("^x"), b("a"), b("bb")).toMutable();
    int arenas = counter.arenaCount();
    MutableCursor result = c.subst(b("eee"));
    assertThat(counter.arenaCount()).isEqualTo(arenas + 1);
    assertThat(result.toString()).isEqualTo("^x(\"a\",\"eee\")");
    assertThat(result.byteCapacity()).isEqualTo(4);
    assertThat(result.depth()).isEqualTo(2);
    assertThat(str(result.subscript(-1))).isEqualTo("eee");
    assertThat(result.asBuffers().get(2).remaining()).isEqualTo(3);
    // And now it fits again
    result = result.subst(b("fff"));
    assertThat(counter.arenaCount()).isEqualTo(arenas + 1);
    assertThat(result.toString()).isEqualTo("^x(\"a\",\"fff\")");
  }

  @Test
  public void substValue() {
    MutableCursor c = PathBuffer.create(Allocator.HEAP, "^x", "a", "b").toMutable();
    assertThat(c.substValue(5).toString()).isEqualTo("^x(\"a\",5)");
    assertThat(c.substValue(0.25).toString()).isEqualTo("^x(\"a\",\".25\")");
    assertErr(Err.INVALID_SUBSCRIPT_TYPE, () -> c.substValue(new Object()));
    assertThat(c.toString()).isEqualTo("^x(\"a\",\".25\")");
  }

  @Test
  public void notMutable() {
    PathBuffer p = PathBuffer.create(Allocator.HEAP, b("^x"), b("a"));
    assertErr(Err.NOT_MUTABLE, () -> p.subst(b("b")));
    MutableCursor c = p.toMutable();
    PathBuffer prefix = c.append(0);
    assertThat(prefix.isView()).isTrue();
    assertThat(prefix.isMutable()).isFalse();
    assertErr(Err.NOT_MUTABLE, () -> prefix.subst(b("b")));
  }

  @Test
  public void noSubscriptToReplace() {
    MutableCursor c = PathBuffer.create(Allocator.HEAP, b("^x")).toMutable();
    assertErr(Err.INVALID_DEPTH, () -> c.subst(b("a")));
  }

  @Test
  public void substTooLong() {
    Limits limits = new Limits.Builder().maxSubscriptLength(3).build();
    MutableCursor c = PathBuffer.create(Allocator.heap(limits), b("^x"), b("a")).toMutable();
    assertErr(Err.SUBSCRIPT_TOO_LONG, () -> c.subst(b("abcd")));
    assertThat(c.toString()).isEqualTo("^x(\"a\")");
  }

  @Test
  public void appendCopies() {
    MutableCursor c = PathBuffer.create(Allocator.HEAP, b("^x"), b("a")).toMutable();
    PathBuffer child = c.append(b("z"));
    assertThat(child.isView()).isFalse();
    assertThat(child.isMutable()).isFalse();
    // Appending the same last subscript still copies, since the cursor's will change
    PathBuffer same = c.append(0, b("a"));
    assertThat(same.root()).isNotSameInstanceAs(c);
    c.subst(b("q"));
    assertThat(child.toString()).isEqualTo("^x(\"a\",\"z\")");
    assertThat(same.toString()).isEqualTo("^x(\"a\")");
    assertThat(c.toString()).isEqualTo("^x(\"q\")");
  }

  @Test
  public void prefixViewsUnaffected() {
    MutableCursor c = PathBuffer.create(Allocator.HEAP, b("^x"), b("a"), b("b")).toMutable();
    PathBuffer prefix = c.append(1);
    PathBuffer shared = c.append(0, b("a"));
    assertThat(shared.root()).isSameInstanceAs(c);
    c.subst(b("a much longer subscript"));
    assertThat(prefix.toString()).isEqualTo("^x(\"a\")");
    assertThat(shared.toString()).isEqualTo("^x(\"a\")");
    assertThat(c.toString()).isEqualTo("^x(\"a\",\"a much longer subscript\")");
  }
}
