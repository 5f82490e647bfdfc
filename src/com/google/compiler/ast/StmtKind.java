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

/**
 * The closed set of statement kinds.
 *
 * <p>Declaration order is significant: each {@link Range} covers a contiguous run of constants, so
 * category membership is two ordinal comparisons. Keep related kinds together when adding one.
 */
public enum StmtKind {
  BRACE("Brace"),
  RETURN("Return"),
  // Jump statements, which carry a BranchTarget.
  BREAK("Break"),
  CONTINUE("Continue"),
  FALLTHROUGH("Fallthrough"),
  // Conditionals.
  IF("If"),
  IF_CONFIG("IfConfig"),
  // Labeled statements. Loops first, then switch.
  WHILE("While"),
  DO_WHILE("DoWhile"),
  FOR("For"),
  FOR_EACH("ForEach"),
  SWITCH("Switch"),
  CASE("Case");

  /** A contiguous range of kinds that share a category. */
  public enum Range {
    BRANCH(RETURN, FALLTHROUGH),
    JUMP(BREAK, FALLTHROUGH),
    CONDITIONAL(IF, IF_CONFIG),
    LABELED(WHILE, SWITCH),
    LOOP(WHILE, FOR_EACH);

    private final StmtKind first;
    private final StmtKind last;

    Range(StmtKind first, StmtKind last) {
      checkArgument(first.ordinal() <= last.ordinal());
      this.first = first;
      this.last = last;
    }

    public StmtKind getFirst() {
      return first;
    }

    public StmtKind getLast() {
      return last;
    }

    public boolean contains(StmtKind kind) {
      return kind.ordinal() >= first.ordinal() && kind.ordinal() <= last.ordinal();
    }
  }

  private final String kindName;

  StmtKind(String kindName) {
    this.kindName = kindName;
  }

  /**
   * Returns the name of this kind for debugging dumps and other developer aids. Never use it in a
   * diagnostic shown to a user.
   */
  public String getKindName() {
    return kindName;
  }

  public boolean isIn(Range range) {
    return range.contains(this);
  }

  /** Loops and switch: statements that a labeled break can target. */
  public boolean isLabeled() {
    return Range.LABELED.contains(this);
  }

  public boolean isLoop() {
    return Range.LOOP.contains(this);
  }

  /** Return, break, continue and fallthrough. */
  public boolean isBranch() {
    return Range.BRANCH.contains(this);
  }

  /** Statements whose destination is filled in by a later pass. */
  public boolean isJump() {
    return Range.JUMP.contains(this);
  }

  public boolean isConditional() {
    return Range.CONDITIONAL.contains(this);
  }
}
