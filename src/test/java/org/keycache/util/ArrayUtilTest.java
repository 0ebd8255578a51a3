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
package org.keycache.util;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ArrayUtilTest {

  @Test
  public void bytesGetB() {
    byte[] bytes = {0, 127, -128, -1};
    assertThat(ArrayUtil.bytesGetB(bytes, 0)).isEqualTo(0);
    assertThat(ArrayUtil.bytesGetB(bytes, 1)).isEqualTo(127);
    assertThat(ArrayUtil.bytesGetB(bytes, 2)).isEqualTo(128);
    assertThat(ArrayUtil.bytesGetB(bytes, 3)).isEqualTo(255);
  }

  @Test
  public void regionEquals() {
    byte[] bytes = {1, 2, 3, 4};
    assertThat(ArrayUtil.regionEquals(bytes, 1, new byte[] {2, 3})).isTrue();
    assertThat(ArrayUtil.regionEquals(bytes, 2, new byte[] {3, 4})).isTrue();
    assertThat(ArrayUtil.regionEquals(bytes, 4, new byte[0])).isTrue();
    assertThat(ArrayUtil.regionEquals(bytes, 1, new byte[] {2, 4})).isFalse();
    // Runs off the end
    assertThat(ArrayUtil.regionEquals(bytes, 3, new byte[] {4, 5})).isFalse();
  }

  @Test
  public void totalLength() {
    assertThat(ArrayUtil.totalLength()).isEqualTo(0L);
    assertThat(ArrayUtil.totalLength(new byte[2], new byte[0], new byte[5])).isEqualTo(7L);
  }

  @Test
  public void concat() {
    byte[] a = {1};
    byte[] b = {2};
    byte[] c = {3};
    byte[][] result = ArrayUtil.concat(List.of(a, b), 1, c);
    assertThat(result).hasLength(2);
    assertThat(result[0]).isSameInstanceAs(a);
    assertThat(result[1]).isSameInstanceAs(c);
    assertThat(ArrayUtil.concat(List.of(), 0)).isEmpty();
  }
}
