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
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The engine's hard limits on key shape, and the constants that control how much headroom a new
 * buffer reserves.
 */
public final class Limits {

  /** The engine's maximum number of subscripts ({@code YDB_MAX_SUBS}). */
  public static final int MAX_SUBS = 31;

  /** The engine's maximum string length ({@code YDB_MAX_STR}). */
  public static final int MAX_STR = 1 << 20;

  /** A 31-character identifier, plus the leading '^' of a global. */
  public static final int MAX_VARNAME = 32;

  /**
   * The number of extra slots allocated beyond those needed. Most uses only descend a few levels
   * below the node they started from; going deeper still works, it just reallocates.
   */
  public static final int OVERALLOC_SLOTS = 5;

  /** Initial guess at the length of each subscript, used to size byte headroom. */
  public static final int TYPICAL_SUBLEN = 10;

  public final int maxSubs;
  public final int maxSubscriptLength;
  public final int maxVarnameLength;
  public final long maxPathLength;
  public final int overallocSlots;
  public final int typicalSublen;

  /** The YottaDB limits. */
  public static final Limits DEFAULT = new Builder().build();

  private Limits(Builder builder) {
    this.maxSubs = builder.maxSubs;
    this.maxSubscriptLength = builder.maxSubscriptLength;
    this.maxVarnameLength = builder.maxVarnameLength;
    this.maxPathLength =
        (builder.maxPathLength > 0)
            ? builder.maxPathLength
            : (builder.maxSubs + 1L) * builder.maxSubscriptLength;
    this.overallocSlots = builder.overallocSlots;
    this.typicalSublen = builder.typicalSublen;
  }

  /** The number of bytes of headroom reserved for subscripts not yet appended. */
  int byteHeadroom() {
    return overallocSlots * typicalSublen;
  }

  /**
   * Returns the default limits, overridden by any of the system properties {@code
   * keycache.maxSubs}, {@code keycache.maxSubscriptLength}, {@code keycache.maxPathLength}, {@code
   * keycache.overallocSlots}, and {@code keycache.typicalSublen}.
   */
  public static Limits fromSystemProperties() {
    return new Builder()
        .maxSubs(Integer.getInteger("keycache.maxSubs", MAX_SUBS))
        .maxSubscriptLength(Integer.getInteger("keycache.maxSubscriptLength", MAX_STR))
        .maxPathLength(Long.getLong("keycache.maxPathLength", 0L))
        .overallocSlots(Integer.getInteger("keycache.overallocSlots", OVERALLOC_SLOTS))
        .typicalSublen(Integer.getInteger("keycache.typicalSublen", TYPICAL_SUBLEN))
        .build();
  }

  @Override
  public String toString() {
    return String.format(
        "maxSubs=%s, maxSubscriptLength=%s, maxPathLength=%s, overalloc=%sx%s",
        maxSubs, maxSubscriptLength, maxPathLength, overallocSlots, typicalSublen);
  }

  /** A Builder for Limits; each field starts at its default. */
  public static final class Builder {
    private int maxSubs = MAX_SUBS;
    private int maxSubscriptLength = MAX_STR;
    private int maxVarnameLength = MAX_VARNAME;
    private long maxPathLength;
    private int overallocSlots = OVERALLOC_SLOTS;
    private int typicalSublen = TYPICAL_SUBLEN;

    @CanIgnoreReturnValue
    public Builder maxSubs(int maxSubs) {
      Preconditions.checkArgument(maxSubs >= 0 && maxSubs <= Short.MAX_VALUE, maxSubs);
      this.maxSubs = maxSubs;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxSubscriptLength(int maxSubscriptLength) {
      Preconditions.checkArgument(maxSubscriptLength >= 0, maxSubscriptLength);
      this.maxSubscriptLength = maxSubscriptLength;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxVarnameLength(int maxVarnameLength) {
      Preconditions.checkArgument(maxVarnameLength > 0, maxVarnameLength);
      this.maxVarnameLength = maxVarnameLength;
      return this;
    }

    /** Zero (the default) means {@code (maxSubs + 1) * maxSubscriptLength}. */
    @CanIgnoreReturnValue
    public Builder maxPathLength(long maxPathLength) {
      Preconditions.checkArgument(maxPathLength >= 0, maxPathLength);
      this.maxPathLength = maxPathLength;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder overallocSlots(int overallocSlots) {
      Preconditions.checkArgument(overallocSlots >= 0, overallocSlots);
      this.overallocSlots = overallocSlots;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder typicalSublen(int typicalSublen) {
      Preconditions.checkArgument(typicalSublen >= 0, typicalSublen);
      this.typicalSublen = typicalSublen;
      return this;
    }

    public Limits build() {
      return new Limits(this);
    }
  }
}
