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

/** The label written before a loop or switch, as in {@code outer: while ...}. */
@AutoValue
@Immutable
public abstract class LabelInfo {

  private static final LabelInfo NONE =
      new AutoValue_LabelInfo(Identifier.empty(), SourceLoc.invalid());

  public static LabelInfo of(Identifier name, SourceLoc loc) {
    return name.isEmpty() ? NONE : new AutoValue_LabelInfo(name, loc);
  }

  /** The label of an unlabeled statement: an empty name at an invalid location. */
  public static LabelInfo none() {
    return NONE;
  }

  public abstract Identifier getName();

  public abstract SourceLoc getLoc();

  public final boolean isPresent() {
    return !getName().isEmpty();
  }

  @Override
  public final String toString() {
    return isPresent() ? getName() + ":" + getLoc() : "<none>";
  }
}
