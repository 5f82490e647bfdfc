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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.compiler.ast.testing.FakeExpr;
import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AstContext}. */
@RunWith(JUnit4.class)
public final class AstContextTest {

  @Test
  public void testDefaultOptions() {
    AstContext.Options options = new AstContext().getOptions();
    assertThat(options.getInitialTrailingCapacity())
        .isEqualTo(AstContext.Options.DEFAULT_INITIAL_TRAILING_CAPACITY);
    assertThat(options.getInternIdentifiers()).isTrue();
  }

  @Test
  public void testNonPositiveCapacityRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> AstContext.Options.builder().setInitialTrailingCapacity(0).build());
  }

  @Test
  public void testIdentifiersAreInterned() {
    AstContext ctx = new AstContext();
    Identifier a = ctx.getIdentifier("outer");
    assertThat(ctx.getIdentifier("outer")).isSameInstanceAs(a);
    assertThat(ctx.getIdentifier("inner")).isNotSameInstanceAs(a);
    assertThat(ctx.getIdentifier("")).isSameInstanceAs(Identifier.empty());
  }

  @Test
  public void testIdentifiersNotInternedWhenDisabled() {
    AstContext ctx =
        new AstContext(AstContext.Options.builder().setInternIdentifiers(false).build());
    Identifier a = ctx.getIdentifier("outer");
    Identifier b = ctx.getIdentifier("outer");
    assertThat(b).isNotSameInstanceAs(a);
    assertThat(b.matches(a)).isTrue();
  }

  @Test
  public void testStatementCounts() {
    AstContext ctx = new AstContext();
    ReturnStmt ret = ReturnStmt.create(ctx, SourceLoc.at(2), null);
    BraceStmt.create(ctx, SourceLoc.at(0), ImmutableList.of(ret), SourceLoc.at(10));
    ReturnStmt.create(ctx, SourceLoc.invalid(), null);

    assertThat(ctx.getStmtCount()).isEqualTo(3);
    assertThat(ctx.getStmtCount(StmtKind.RETURN)).isEqualTo(2);
    assertThat(ctx.getStmtCount(StmtKind.BRACE)).isEqualTo(1);
    assertThat(ctx.getStmtCount(StmtKind.SWITCH)).isEqualTo(0);
    ctx.logStatistics();
  }

  @Test
  public void testTrailingStorageGrowsPastInitialCapacity() {
    AstContext ctx =
        new AstContext(AstContext.Options.builder().setInitialTrailingCapacity(1).build());
    FakeExpr a = FakeExpr.synthetic("a");
    FakeExpr b = FakeExpr.synthetic("b");
    FakeExpr c = FakeExpr.synthetic("c");

    BraceStmt first = BraceStmt.create(ctx, SourceLoc.at(0), Arrays.asList(a, b), SourceLoc.at(5));
    BraceStmt second = BraceStmt.create(ctx, SourceLoc.at(6), Arrays.asList(c), SourceLoc.at(9));

    assertThat(ctx.getTrailingStorageSize()).isEqualTo(3);
    assertThat(first.getElements()).containsExactly(a, b).inOrder();
    assertThat(second.getElements()).containsExactly(c);
  }

  @Test
  public void testNullElementRejectedWithoutConsumingStorage() {
    AstContext ctx = new AstContext();
    assertThrows(
        NullPointerException.class,
        () ->
            BraceStmt.create(
                ctx,
                SourceLoc.at(0),
                Arrays.asList(FakeExpr.synthetic("a"), null),
                SourceLoc.at(5)));
    assertThat(ctx.getTrailingStorageSize()).isEqualTo(0);
    assertThat(ctx.getStmtCount()).isEqualTo(0);
  }
}
