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


package com.google.compiler.ast.testing;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.compiler.ast.Pattern;
import com.google.compiler.ast.SourceLoc;
import com.google.compiler.ast.SourceRange;

/** A pattern that either binds variables (like {@code let x}) or does not (like {@code 1}). */
public final class FakePattern implements Pattern {
  private final String text;
  private final boolean bindsVariables;
  private final SourceRange range;

  public FakePattern(String text, boolean bindsVariables, SourceRange range) {
    this.text = checkNotNull(text);
    this.bindsVariables = bindsVariables;
    this.range = checkNotNull(range);
  }

  /** A pattern matching a literal value. */
  public static FakePattern literal(String text, int start, int end) {
    return new FakePattern(text, false, SourceRange.of(SourceLoc.at(start), SourceLoc.at(end)));
  }

  /** A pattern introducing a variable. */
  public static FakePattern binding(String name, int start, int end) {
    return new FakePattern(name, true, SourceRange.of(SourceLoc.at(start), SourceLoc.at(end)));
  }

  /** The implicit pattern of a {@code default} label. */
  public static FakePattern any() {
    return new FakePattern("_", false, SourceRange.invalid());
  }

  @Override
  public boolean bindsVariables() {
    return bindsVariables;
  }

  @Override
  public SourceRange getSourceRange() {
    return range;
  }

  @Override
  public String toString() {
    return "Pattern(" + text + ")";
  }
}
