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
import com.google.compiler.ast.testing.FakeExpr;
import com.google.compiler.ast.testing.FakePattern;
import com.google.compiler.ast.testing.FakePatternBindingDecl;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ForEachStmt}, whose generator fields are filled in after parsing. */
@RunWith(JUnit4.class)
public final class ForEachStmtTest {

  private AstFixture ast;
  private FakePattern pattern;
  private FakeExpr sequence;
  private BraceStmt body;
  private ForEachStmt loop;

  @Before
  public void setUp() {
    ast = new AstFixture();
    pattern = FakePattern.binding("x", 4, 5);
    sequence = FakeExpr.at("xs", 9, 11);
    body = ast.brace(12, 20);
    loop =
        ForEachStmt.create(
            ast.context(),
            LabelInfo.none(),
            SourceLoc.at(0),
            pattern,
            SourceLoc.at(6),
            sequence,
            body);
  }

  @Test
  public void testPartiallyBuilt() {
    assertThat(loop.isComplete()).isFalse();
    assertThat(loop.hasGenerator()).isFalse();
    assertThat(loop.hasGeneratorNext()).isFalse();
    assertThrows(IllegalStateException.class, loop::getGenerator);
    assertThrows(IllegalStateException.class, loop::getGeneratorNext);
    assertStmt(loop).hasKind(StmtKind.FOR_EACH).hasChildrenExactly(pattern, sequence, body);
  }

  @Test
  public void testComplete() {
    FakePatternBindingDecl generator =
        FakePatternBindingDecl.of(FakePattern.binding("$gen", 9, 11));
    FakeExpr next = FakeExpr.synthetic("$gen.next()");

    loop.complete(generator, next);

    assertThat(loop.isComplete()).isTrue();
    assertThat(loop.getGenerator()).isSameInstanceAs(generator);
    assertThat(loop.getGeneratorNext()).isSameInstanceAs(next);
    assertStmt(loop).hasChildrenExactly(pattern, sequence, generator, next, body);
  }

  @Test
  public void testGeneratorOnlyHalfway() {
    FakePatternBindingDecl generator =
        FakePatternBindingDecl.of(FakePattern.binding("$gen", 9, 11));
    loop.setGenerator(generator);

    assertThat(loop.isComplete()).isFalse();
    assertStmt(loop).hasChildrenExactly(pattern, sequence, generator, body);
  }

  @Test
  public void testGeneratorSetOnce() {
    FakePatternBindingDecl generator =
        FakePatternBindingDecl.of(FakePattern.binding("$gen", 9, 11));
    loop.setGenerator(generator);
    assertThrows(IllegalStateException.class, () -> loop.setGenerator(generator));

    FakeExpr next = FakeExpr.synthetic("$gen.next()");
    loop.setGeneratorNext(next);
    assertThrows(IllegalStateException.class, () -> loop.setGeneratorNext(next));
  }

  @Test
  public void testBodyMustBeBrace() {
    assertThrows(IllegalArgumentException.class, () -> loop.setChild(2, ast.breakStmt(13)));
    BraceStmt newBody = ast.brace(12, 25);
    loop.setChild(2, newBody);
    assertThat(loop.getBody()).isSameInstanceAs(newBody);
  }
}
