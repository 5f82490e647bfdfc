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

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/** A {@code while} loop. The condition may be a boolean expression or a conditional binding. */
public final class WhileStmt extends LabeledStmt {

  private final SourceLoc whileLoc;
  private StmtCondition cond;
  private Stmt body;

  private WhileStmt(
      LabelInfo labelInfo, SourceLoc whileLoc, StmtCondition cond, Stmt body, boolean implicit) {
    super(StmtKind.WHILE, implicit, labelInfo);
    this.whileLoc = checkNotNull(whileLoc);
    this.cond = checkNotNull(cond);
    this.body = checkNotNull(body);
  }

  public static WhileStmt create(
      AstContext ctx, LabelInfo labelInfo, SourceLoc whileLoc, StmtCondition cond, Stmt body) {
    return create(ctx, labelInfo, whileLoc, cond, body, null);
  }

  public static WhileStmt create(
      AstContext ctx,
      LabelInfo labelInfo,
      SourceLoc whileLoc,
      StmtCondition cond,
      Stmt body,
      @Nullable Boolean implicit) {
    return ctx.register(
        new WhileStmt(labelInfo, whileLoc, cond, body, defaultImplicitFlag(implicit, whileLoc)));
  }

  public SourceLoc getWhileLoc() {
    return whileLoc;
  }

  public StmtCondition getCond() {
    return cond;
  }

  public void setCond(StmtCondition cond) {
    this.cond = checkNotNull(cond);
  }

  public Stmt getBody() {
    return body;
  }

  public void setBody(Stmt body) {
    this.body = checkNotNull(body);
  }

  @Override
  public SourceRange getSourceRange() {
    return rangeFrom(
        getLabelLocOrKeywordLoc(whileLoc), body.getEndLoc(), cond.getSourceRange().getEnd());
  }

  @Override
  public int getNumChildren() {
    return 2;
  }

  @Override
  public AstNode getChild(int index) {
    checkElementIndex(index, 2);
    return index == 0 ? cond.getNode() : body;
  }

  @Override
  public void setChild(int index, AstNode child) {
    checkElementIndex(index, 2);
    if (index == 0) {
      setCond(StmtCondition.ofNode(child));
    } else {
      setBody(asStmt(child));
    }
  }
}
