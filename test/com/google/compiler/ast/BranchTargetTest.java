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
import static com.google.compiler.ast.testing.StmtSubject.assertStmt;
import static org.junit.Assert.assertThrows;

import com.google.compiler.ast.testing.AstFixture;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link BranchTarget} and the jump statements that hold one. */
@RunWith(JUnit4.class)
public final class BranchTargetTest {

  private AstFixture ast;

  @Before
  public void setUp() {
    ast = new AstFixture();
  }

  @Test
  public void testUnresolvedTarget() {
    BranchTarget<WhileStmt> target =
        BranchTarget.unresolved(ast.id("outer"), SourceLoc.at(4));

    assertThat(target.isResolved()).isFalse();
    assertThat(target.hasName()).isTrue();
    assertThat(target.getName().str()).isEqualTo("outer");
    assertThat(target.getNameLoc()).isEqualTo(SourceLoc.at(4));
    assertThat(target.getIfResolved()).isNull();
    IllegalStateException e = assertThrows(IllegalStateException.class, target::get);
    assertThat(e).hasMessageThat().contains("outer");
  }

  @Test
  public void testResolveKeepsNameAndReturnsNewState() {
    WhileStmt loop = ast.whileLoop(0, ast.brace(12, 14));
    BranchTarget<WhileStmt> unresolved =
        BranchTarget.unresolved(ast.id("outer"), SourceLoc.at(4));

    BranchTarget<WhileStmt> resolved = unresolved.resolveTo(loop);

    assertThat(resolved.isResolved()).isTrue();
    assertThat(resolved.get()).isSameInstanceAs(loop);
    assertThat(resolved.getIfResolved()).isSameInstanceAs(loop);
    assertThat(resolved.getName()).isSameInstanceAs(unresolved.getName());
    assertThat(resolved.getNameLoc()).isEqualTo(unresolved.getNameLoc());
    assertThat(unresolved.isResolved()).isFalse();
  }

  @Test
  public void testResolveTwiceFails() {
    WhileStmt loop = ast.whileLoop(0, ast.brace(12, 14));
    BranchTarget<WhileStmt> resolved =
        BranchTarget.<WhileStmt>unresolved(Identifier.empty(), SourceLoc.invalid())
            .resolveTo(loop);

    assertThrows(IllegalStateException.class, () -> resolved.resolveTo(loop));
  }

  @Test
  public void testUnlabeledTargetHasNoName() {
    BreakStmt breakStmt = ast.breakStmt(3);
    assertThat(breakStmt.getBranchTarget().hasName()).isFalse();
    assertThat(breakStmt.getTargetName().isEmpty()).isTrue();
    assertThat(breakStmt.getTargetLoc().isValid()).isFalse();
  }

  @Test
  public void testBreakReadBeforeResolutionFails() {
    BreakStmt breakStmt = ast.breakStmt(3);
    assertStmt(breakStmt).isUnresolved();
    assertThrows(IllegalStateException.class, breakStmt::getTarget);
  }

  @Test
  public void testBreakResolvesOnce() {
    BreakStmt breakStmt = ast.breakStmt(13);
    WhileStmt loop = ast.whileLoop(0, ast.brace(12, 20, breakStmt));

    breakStmt.setTarget(loop);

    assertStmt(breakStmt).isResolvedTo(loop);
    assertThat(breakStmt.getTarget()).isSameInstanceAs(loop);
    assertThrows(IllegalStateException.class, () -> breakStmt.setTarget(loop));
    assertThat(breakStmt.getTarget()).isSameInstanceAs(loop);
  }

  @Test
  public void testBreakMayTargetSwitch() {
    BreakStmt breakStmt = ast.breakStmt(30);
    SwitchStmt switchStmt = ast.switchOf(0, ast.caseOf(20, "1", breakStmt));

    breakStmt.setTarget(switchStmt);

    assertStmt(breakStmt).isResolvedTo(switchStmt);
  }

  @Test
  public void testContinueCannotTargetSwitch() {
    ContinueStmt continueStmt = ast.continueStmt(30);
    SwitchStmt switchStmt = ast.switchOf(0, ast.caseOf(20, "1", continueStmt));

    assertThrows(IllegalArgumentException.class, () -> continueStmt.setTarget(switchStmt));
    assertStmt(continueStmt).isUnresolved();
  }

  @Test
  public void testContinueResolvesToLoop() {
    ContinueStmt continueStmt = ast.continueTo(13, "outer");
    WhileStmt loop =
        ast.whileLoop(ast.label("outer", 0), 7, ast.brace(12, 30, continueStmt));

    continueStmt.setTarget(loop);

    assertStmt(continueStmt).isResolvedTo(loop);
    assertThat(continueStmt.getTargetName().str()).isEqualTo("outer");
    assertThrows(IllegalStateException.class, () -> continueStmt.setTarget(loop));
  }

  @Test
  public void testFallthroughResolvesToCase() {
    FallthroughStmt fallthrough = ast.fallthrough(30);
    CaseStmt next = ast.defaultCase(45, ast.brace(53, 55));

    assertThrows(IllegalStateException.class, fallthrough::getFallthroughDest);
    fallthrough.setFallthroughDest(next);

    assertStmt(fallthrough).isResolvedTo(next);
    assertThat(fallthrough.getFallthroughDest()).isSameInstanceAs(next);
    assertThrows(IllegalStateException.class, () -> fallthrough.setFallthroughDest(next));
  }

  @Test
  public void testJumpsHaveNoChildren() {
    BreakStmt breakStmt = ast.breakTo(3, "outer");
    assertStmt(breakStmt).hasNumChildren(0).hasSourceRange(3, 9);
    assertThrows(IndexOutOfBoundsException.class, () -> breakStmt.getChild(0));
  }
}
