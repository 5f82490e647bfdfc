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

import static com.google.common.truth.Truth.assertThat;

import java.util.EnumSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link StmtKind}. */
@RunWith(JUnit4.class)
public final class StmtKindTest {

  @Test
  public void testLabeledRange() {
    assertThat(kindsIn(StmtKind.Range.LABELED))
        .containsExactly(
            StmtKind.WHILE, StmtKind.DO_WHILE, StmtKind.FOR, StmtKind.FOR_EACH, StmtKind.SWITCH);
  }

  @Test
  public void testLoopRangeExcludesSwitch() {
    assertThat(kindsIn(StmtKind.Range.LOOP))
        .containsExactly(StmtKind.WHILE, StmtKind.DO_WHILE, StmtKind.FOR, StmtKind.FOR_EACH);
    assertThat(StmtKind.SWITCH.isLoop()).isFalse();
    assertThat(StmtKind.SWITCH.isLabeled()).isTrue();
  }

  @Test
  public void testJumpAndBranchRanges() {
    assertThat(kindsIn(StmtKind.Range.JUMP))
        .containsExactly(StmtKind.BREAK, StmtKind.CONTINUE, StmtKind.FALLTHROUGH);
    assertThat(kindsIn(StmtKind.Range.BRANCH))
        .containsExactly(
            StmtKind.RETURN, StmtKind.BREAK, StmtKind.CONTINUE, StmtKind.FALLTHROUGH);
    assertThat(StmtKind.RETURN.isJump()).isFalse();
  }

  @Test
  public void testConditionalRange() {
    assertThat(kindsIn(StmtKind.Range.CONDITIONAL))
        .containsExactly(StmtKind.IF, StmtKind.IF_CONFIG);
  }

  @Test
  public void testRangesAreContiguous() {
    for (StmtKind.Range range : StmtKind.Range.values()) {
      int first = range.getFirst().ordinal();
      int last = range.getLast().ordinal();
      assertThat(kindsIn(range)).hasSize(last - first + 1);
    }
  }

  @Test
  public void testKindsOutsideEveryCategory() {
    for (StmtKind kind : new StmtKind[] {StmtKind.BRACE, StmtKind.CASE}) {
      for (StmtKind.Range range : StmtKind.Range.values()) {
        assertThat(kind.isIn(range)).isFalse();
      }
    }
  }

  @Test
  public void testKindNames() {
    assertThat(StmtKind.DO_WHILE.getKindName()).isEqualTo("DoWhile");
    assertThat(StmtKind.IF_CONFIG.getKindName()).isEqualTo("IfConfig");
    assertThat(StmtKind.FALLTHROUGH.getKindName()).isEqualTo("Fallthrough");
  }

  private static EnumSet<StmtKind> kindsIn(StmtKind.Range range) {
    EnumSet<StmtKind> kinds = EnumSet.noneOf(StmtKind.class);
    for (StmtKind kind : StmtKind.values()) {
      if (kind.isIn(range)) {
        kinds.add(kind);
      }
    }
    return kinds;
  }
}
