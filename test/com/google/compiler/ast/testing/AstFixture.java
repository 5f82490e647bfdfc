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

import com.google.common.collect.ImmutableList;
import com.google.compiler.ast.AstContext;
import com.google.compiler.ast.AstNode;
import com.google.compiler.ast.BraceStmt;
import com.google.compiler.ast.BreakStmt;
import com.google.compiler.ast.CaseLabelItem;
import com.google.compiler.ast.CaseStmt;
import com.google.compiler.ast.ContinueStmt;
import com.google.compiler.ast.FallthroughStmt;
import com.google.compiler.ast.Identifier;
import com.google.compiler.ast.LabelInfo;
import com.google.compiler.ast.SourceLoc;
import com.google.compiler.ast.Stmt;
import com.google.compiler.ast.StmtCondition;
import com.google.compiler.ast.SwitchStmt;
import com.google.compiler.ast.WhileStmt;
import java.util.Arrays;

/**
 * Shorthand for building statement trees in tests. Locations are given as plain offsets; the
 * caller is responsible for keeping them in source order.
 */
public final class AstFixture {
  private final AstContext ctx;

  public AstFixture() {
    this(new AstContext());
  }

  public AstFixture(AstContext ctx) {
    this.ctx = checkNotNull(ctx);
  }

  public AstContext context() {
    return ctx;
  }

  public static SourceLoc loc(int offset) {
    return SourceLoc.at(offset);
  }

  public Identifier id(String name) {
    return ctx.getIdentifier(name);
  }

  public LabelInfo label(String name, int offset) {
    return LabelInfo.of(id(name), loc(offset));
  }

  public BraceStmt brace(int lbOffset, int rbOffset, AstNode... elements) {
    return BraceStmt.create(ctx, loc(lbOffset), Arrays.asList(elements), loc(rbOffset));
  }

  /** {@code while cond { body }}, with the condition just after the keyword. */
  public WhileStmt whileLoop(LabelInfo label, int offset, Stmt body) {
    FakeExpr cond = FakeExpr.at("cond", offset + 6, offset + 10);
    return WhileStmt.create(ctx, label, loc(offset), StmtCondition.of(cond), body);
  }

  public WhileStmt whileLoop(int offset, Stmt body) {
    return whileLoop(LabelInfo.none(), offset, body);
  }

  public BreakStmt breakStmt(int offset) {
    return BreakStmt.create(ctx, loc(offset), Identifier.empty(), SourceLoc.invalid());
  }

  public BreakStmt breakTo(int offset, String label) {
    return BreakStmt.create(ctx, loc(offset), id(label), loc(offset + 6));
  }

  public ContinueStmt continueStmt(int offset) {
    return ContinueStmt.create(ctx, loc(offset), Identifier.empty(), SourceLoc.invalid());
  }

  public ContinueStmt continueTo(int offset, String label) {
    return ContinueStmt.create(ctx, loc(offset), id(label), loc(offset + 9));
  }

  public FallthroughStmt fallthrough(int offset) {
    return FallthroughStmt.create(ctx, loc(offset));
  }

  /** {@code case <literal>: body}. */
  public CaseStmt caseOf(int offset, String literal, Stmt body) {
    CaseLabelItem item =
        CaseLabelItem.of(FakePattern.literal(literal, offset + 5, offset + 5 + literal.length()));
    return CaseStmt.create(
        ctx,
        loc(offset),
        ImmutableList.of(item),
        /* hasBoundDecls= */ false,
        loc(offset + 5 + literal.length()),
        body);
  }

  /** {@code case let <name>: body}, which binds a variable visible in the body. */
  public CaseStmt bindingCase(int offset, String name, Stmt body) {
    CaseLabelItem item =
        CaseLabelItem.of(FakePattern.binding(name, offset + 5, offset + 9 + name.length()));
    return CaseStmt.create(
        ctx,
        loc(offset),
        ImmutableList.of(item),
        /* hasBoundDecls= */ true,
        loc(offset + 9 + name.length()),
        body);
  }

  /** {@code default: body}. */
  public CaseStmt defaultCase(int offset, Stmt body) {
    return CaseStmt.create(
        ctx,
        loc(offset),
        ImmutableList.of(CaseLabelItem.defaultItem(FakePattern.any())),
        /* hasBoundDecls= */ false,
        loc(offset + 7),
        body);
  }

  /**
   * {@code switch subject { cases }}. The closing brace is placed just after the last case, or
   * after the opening brace when there are none.
   */
  public SwitchStmt switchOf(LabelInfo label, int offset, CaseStmt... cases) {
    FakeExpr subject = FakeExpr.at("subject", offset + 7, offset + 14);
    SourceLoc lBrace = loc(offset + 15);
    SourceLoc rBrace =
        cases.length == 0
            ? loc(offset + 16)
            : loc(cases[cases.length - 1].getEndLoc().getOffset() + 1);
    return SwitchStmt.create(
        ctx, label, loc(offset), subject, lBrace, Arrays.asList(cases), rBrace);
  }

  public SwitchStmt switchOf(int offset, CaseStmt... cases) {
    return switchOf(LabelInfo.none(), offset, cases);
  }
}
