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

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/** A pair of locations. Both ends point at tokens inside the range. */
@AutoValue
@Immutable
public abstract class SourceRange {

  private static final SourceRange INVALID =
      new AutoValue_SourceRange(SourceLoc.invalid(), SourceLoc.invalid());

  public static SourceRange of(SourceLoc start, SourceLoc end) {
    return new AutoValue_SourceRange(start, end);
  }

  /** A range covering the single token at {@code loc}. */
  public static SourceRange of(SourceLoc loc) {
    return new AutoValue_SourceRange(loc, loc);
  }

  public static SourceRange invalid() {
    return INVALID;
  }

  public abstract SourceLoc getStart();

  public abstract SourceLoc getEnd();

  public final boolean isValid() {
    return getStart().isValid();
  }

  @Override
  public final String toString() {
    return "[" + getStart() + ", " + getEnd() + "]";
  }
}
