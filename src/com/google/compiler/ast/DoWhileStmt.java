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

/** A {@code do { ... } while cond} loop. The condition is always a boolean expression. */
public final class DoWhileStmt extends LabeledStmt {

  private final SourceLoc doLoc;
  private final SourceLoc whileLoc;
  private Stmt body;
  private Expr cond;

  private DoWhileStmt(
      LabelInfo labelInfo,
      SourceLoc doLoc,
      Expr cond,
      SourceLoc whileLoc,
      Stmt body,
      boolean implicit) {
    super(StmtKind.DO_WHILE, implicit, labelInfo);
    this.doLoc = checkNotNull(doLoc);
    this.whileLoc = checkNotNull(whileLoc);
    this.body = checkNotNull(body);
    this.cond = checkNotNull(cond);
  }

  public static DoWhileStmt create(
      AstContext ctx,
      LabelInfo labelInfo,
      SourceLoc doLoc,
      Expr cond,
      SourceLoc whileLoc,
      Stmt body) {
    return create(ctx, labelInfo, doLoc, cond, whileLoc, body, null);
  }

  public static DoWhileStmt create(
      AstContext ctx,
      LabelInfo labelInfo,
      SourceLoc doLoc,
      Expr cond,
      SourceLoc whileLoc,
      Stmt body,
      @Nullable Boolean implicit) {
    return ctx.register(
        new DoWhileStmt(
            labelInfo, doLoc, cond, whileLoc, body, defaultImplicitFlag(implicit, doLoc)));
  }

  public SourceLoc getDoLoc() {
    return doLoc;
  }

  public SourceLoc getWhileLoc() {
    return whileLoc;
  }

  public Stmt getBody() {
    return body;
  }

  public void setBody(Stmt body) {
    this.body = checkNotNull(body);
  }

  public Expr getCond() {
    return cond;
  }

  public void setCond(Expr cond) {
    this.cond = checkNotNull(cond);
  }

  @Override
  public SourceRange getSourceRange() {
    return rangeFrom(getLabelLocOrKeywordLoc(doLoc), cond.getEndLoc(), whileLoc, body.getEndLoc());
  }

  // Children are in source order: the body comes before the condition.
  @Override
  public int getNumChildren() {
    return 2;
  }

  @Override
  public AstNode getChild(int index) {
    checkElementIndex(index, 2);
    return index == 0 ? body : cond;
  }

  @Override
  public void setChild(int index, AstNode child) {
    checkElementIndex(index, 2);
    if (index == 0) {
      setBody(asStmt(child));
    } else {
      setCond(asExpr(child));
    }
  }
}
