/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.compiler.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/**
 * An opaque position in a source buffer.
 *
 * <p>Locations are character offsets. The invalid location marks nodes synthesized by the
 * compiler and sorts before every valid location.
 */
@AutoValue
@Immutable
public abstract class SourceLoc implements Comparable<SourceLoc> {

  private static final int INVALID_OFFSET = -1;

  private static final SourceLoc INVALID = new AutoValue_SourceLoc(INVALID_OFFSET);

  public static SourceLoc at(int offset) {
    checkArgument(offset >= 0, "Negative source offset %s", offset);
    return new AutoValue_SourceLoc(offset);
  }

  public static SourceLoc invalid() {
    return INVALID;
  }

  /** The character offset, or -1 for the invalid location. */
  public abstract int getOffset();

  public final boolean isValid() {
    return getOffset() != INVALID_OFFSET;
  }

  public final boolean isInvalid() {
    return !isValid();
  }

  public final boolean isBefore(SourceLoc other) {
    return compareTo(other) < 0;
  }

  /** Returns this location if it is valid, otherwise {@code fallback}. */
  public final SourceLoc or(SourceLoc fallback) {
    return isValid() ? this : fallback;
  }

  @Override
  public final int compareTo(SourceLoc other) {
    return Integer.compare(getOffset(), other.getOffset());
  }

  @Override
  public final String toString() {
    return isValid() ? "@" + getOffset() : "@invalid";
  }
}
