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
import static org.junit.Assert.assertThrows;
import static org.keycache.impl.PathBufferTest.assertErr;
import static org.keycache.impl.PathBufferTest.b;
import static org.keycache.impl.PathBufferTest.str;

import com.google.common.collect.ImmutableList;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.NoSuchElementException;
import java.util.TreeSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.keycache.KeyCache;

@RunWith(JUnit4.class)
public class SiblingIteratorTest {

  /** An engine that knows about a single level of string subscripts. */
  private static class FakeEngine implements SiblingIterator.NextSubscript {
    final NavigableSet<String> subscripts = new TreeSet<>();
    int calls;

    FakeEngine(String... subscripts) {
      this.subscripts.addAll(ImmutableList.copyOf(subscripts));
    }

    @Override
    public byte[] next(KeyCache.Key key, boolean reverse) {
      calls++;
      String last = new String(key.subscript(-1), StandardCharsets.UTF_8);
      String result;
      if (!reverse) {
        result = subscripts.higher(last);
      } else if (last.isEmpty()) {
        result = subscripts.isEmpty() ? null : subscripts.last();
      } else {
        result = subscripts.lower(last);
      }
      return (result == null) ? null : b(result);
    }
  }

  private static List<String> drain(SiblingIterator it) {
    List<String> result = new ArrayList<>();
    while (it.hasNext()) {
      result.add(str(it.next()));
      // The cursor always holds the subscript just returned
      assertThat(str(it.cursor().subscript(-1))).isEqualTo(result.get(result.size() - 1));
    }
    return result;
  }

  @Test
  public void forward() {
    AllocationCounter counter = new AllocationCounter(Allocator.HEAP);
    PathBuffer start = PathBuffer.create(counter, b("^s"), b(""));
    SiblingIterator it = new SiblingIterator(start, new FakeEngine("b", "c", "a"), false);
    assertThat(drain(it)).containsExactly("a", "b", "c").inOrder();
    // One arena for start, one for the cursor, and one when "a" didn't fit in the empty slot
    assertThat(counter.arenaCount()).isEqualTo(3);
    assertThat(start.toString()).isEqualTo("^s(\"\")");
    assertThat(it.cursor().toString()).isEqualTo("^s(\"c\")");
  }

  @Test
  public void reverse() {
    PathBuffer start = PathBuffer.create(Allocator.HEAP, b("^s"), b("x"), b(""));
    SiblingIterator it = new SiblingIterator(start, new FakeEngine("b", "c", "a"), true);
    assertThat(drain(it)).containsExactly("c", "b", "a").inOrder();
    assertThat(it.cursor().toString()).isEqualTo("^s(\"x\",\"a\")");
  }

  @Test
  public void startFromSubscript() {
    PathBuffer start = PathBuffer.create(Allocator.HEAP, b("^s"), b("b"));
    SiblingIterator it = new SiblingIterator(start, new FakeEngine("a", "b", "c", "d"), false);
    assertThat(drain(it)).containsExactly("c", "d").inOrder();
  }

  @Test
  public void hasNextFetchesOnce() {
    FakeEngine engine = new FakeEngine("a");
    SiblingIterator it =
        new SiblingIterator(PathBuffer.create(Allocator.HEAP, b("^s"), b("")), engine, false);
    assertThat(it.hasNext()).isTrue();
    assertThat(it.hasNext()).isTrue();
    assertThat(engine.calls).isEqualTo(1);
    assertThat(str(it.next())).isEqualTo("a");
    assertThat(it.hasNext()).isFalse();
    assertThat(engine.calls).isEqualTo(2);
    assertThrows(NoSuchElementException.class, it::next);
  }

  @Test
  public void empty() {
    PathBuffer start = PathBuffer.create(Allocator.HEAP, b("^s"), b(""));
    SiblingIterator it = new SiblingIterator(start, new FakeEngine(), false);
    assertThat(it.hasNext()).isFalse();
    assertThrows(NoSuchElementException.class, it::next);
  }

  @Test
  public void noSubscripts() {
    PathBuffer start = PathBuffer.create(Allocator.HEAP, b("^s"));
    assertErr(Err.INVALID_DEPTH, () -> new SiblingIterator(start, new FakeEngine("a"), false));
  }
}
