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
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * A {@code switch} statement. Cases are kept in source order, which is the order {@code
 * fallthrough} follows.
 */
public final class SwitchStmt extends LabeledStmt {

  private final SourceLoc switchLoc;
  private final SourceLoc lBraceLoc;
  private final SourceLoc rBraceLoc;
  private Expr subjectExpr;
  private final TrailingElements<CaseStmt> cases;

  private SwitchStmt(
      LabelInfo labelInfo,
      SourceLoc switchLoc,
      Expr subjectExpr,
      SourceLoc lBraceLoc,
      TrailingElements<CaseStmt> cases,
      SourceLoc rBraceLoc,
      boolean implicit) {
    super(StmtKind.SWITCH, implicit, labelInfo);
    this.switchLoc = checkNotNull(switchLoc);
    this.subjectExpr = checkNotNull(subjectExpr);
    this.lBraceLoc = checkNotNull(lBraceLoc);
    this.cases = cases;
    this.rBraceLoc = checkNotNull(rBraceLoc);
  }

  public static SwitchStmt create(
      AstContext ctx,
      LabelInfo labelInfo,
      SourceLoc switchLoc,
      Expr subjectExpr,
      SourceLoc lBraceLoc,
      List<CaseStmt> cases,
      SourceLoc rBraceLoc) {
    return create(ctx, labelInfo, switchLoc, subjectExpr, lBraceLoc, cases, rBraceLoc, null);
  }

  public static SwitchStmt create(
      AstContext ctx,
      LabelInfo labelInfo,
      SourceLoc switchLoc,
      Expr subjectExpr,
      SourceLoc lBraceLoc,
      List<CaseStmt> cases,
      SourceLoc rBraceLoc,
      @Nullable Boolean implicit) {
    TrailingElements<CaseStmt> storage = TrailingElements.allocate(ctx, CaseStmt.class, cases);
    return ctx.register(
        new SwitchStmt(
            labelInfo,
            switchLoc,
            subjectExpr,
            lBraceLoc,
            storage,
            rBraceLoc,
            defaultImplicitFlag(implicit, switchLoc)));
  }

  /** The location of the {@code switch} keyword. */
  public SourceLoc getSwitchLoc() {
    return switchLoc;
  }

  public SourceLoc getLBraceLoc() {
    return lBraceLoc;
  }

  public SourceLoc getRBraceLoc() {
    return rBraceLoc;
  }

  public Expr getSubjectExpr() {
    return subjectExpr;
  }

  public void setSubjectExpr(Expr subjectExpr) {
    this.subjectExpr = checkNotNull(subjectExpr);
  }

  /** The case clauses in source order. */
  public List<CaseStmt> getCases() {
    return Collections.unmodifiableList(cases);
  }

  public int getNumCases() {
    return cases.size();
  }

  /** Returns the position of {@code caseStmt} among this switch's cases, or -1. */
  public int indexOfCase(CaseStmt caseStmt) {
    for (int i = 0; i < cases.size(); i++) {
      if (cases.get(i) == caseStmt) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Returns the clause that follows {@code caseStmt}, which is where a {@code fallthrough} in it
   * lands. Empty if {@code caseStmt} is the last clause.
   */
  public Optional<CaseStmt> getCaseAfter(CaseStmt caseStmt) {
    int index = indexOfCase(caseStmt);
    checkArgument(index >= 0, "%s is not a case of this switch", caseStmt);
    return index + 1 < cases.size() ? Optional.of(cases.get(index + 1)) : Optional.empty();
  }

  @Override
  public SourceRange getSourceRange() {
    return rangeFrom(getLabelLocOrKeywordLoc(switchLoc), rBraceLoc);
  }

  @Override
  public int getNumChildren() {
    return 1 + cases.size();
  }

  @Override
  public AstNode getChild(int index) {
    return index == 0 ? subjectExpr : cases.get(index - 1);
  }

  @Override
  public void setChild(int index, AstNode child) {
    if (index == 0) {
      setSubjectExpr(asExpr(child));
      return;
    }
    checkArgument(child instanceof CaseStmt, "Expected a case clause, got %s", child);
    cases.set(index - 1, (CaseStmt) child);
  }
}
