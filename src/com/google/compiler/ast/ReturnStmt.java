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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import org.jspecify.annotations.Nullable;

/**
 * A {@code return} statement. The result is optional; a bare {@code return} returns the empty
 * tuple.
 */
public final class ReturnStmt extends Stmt {

  private final SourceLoc returnLoc;
  private @Nullable Expr result;

  private ReturnStmt(SourceLoc returnLoc, @Nullable Expr result, boolean implicit) {
    super(StmtKind.RETURN, implicit);
    this.returnLoc = checkNotNull(returnLoc);
    this.result = result;
  }

  public static ReturnStmt create(AstContext ctx, SourceLoc returnLoc, @Nullable Expr result) {
    return create(ctx, returnLoc, result, null);
  }

  public static ReturnStmt create(
      AstContext ctx, SourceLoc returnLoc, @Nullable Expr result, @Nullable Boolean implicit) {
    return ctx.register(
        new ReturnStmt(returnLoc, result, defaultImplicitFlag(implicit, returnLoc)));
  }

  public SourceLoc getReturnLoc() {
    return returnLoc;
  }

  public boolean hasResult() {
    return result != null;
  }

  public Expr getResult() {
    checkState(result != null, "ReturnStmt doesn't have a result");
    return result;
  }

  public void setResult(@Nullable Expr result) {
    this.result = result;
  }

  @Override
  public SourceRange getSourceRange() {
    SourceLoc start = returnLoc;
    if (start.isInvalid() && result != null) {
      start = result.getStartLoc();
    }
    SourceLoc end = returnLoc;
    if (result != null && result.getEndLoc().isValid()) {
      end = result.getEndLoc();
    }
    return SourceRange.of(start, end);
  }

  @Override
  public int getNumChildren() {
    return result != null ? 1 : 0;
  }

  @Override
  public AstNode getChild(int index) {
    presentSlot(index, result != null);
    return result;
  }

  @Override
  public void setChild(int index, AstNode child) {
    presentSlot(index, result != null);
    setResult(asExpr(child));
  }
}
