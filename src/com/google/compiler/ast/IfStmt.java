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

import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * An if/then/else statement. Without an {@code else}, the else location is invalid and {@link
 * #getElseStmt()} is empty.
 */
public final class IfStmt extends Stmt {

  private final SourceLoc ifLoc;
  private final SourceLoc elseLoc;
  private StmtCondition cond;
  private Stmt thenStmt;
  private @Nullable Stmt elseStmt;

  private IfStmt(
      SourceLoc ifLoc,
      StmtCondition cond,
      Stmt thenStmt,
      SourceLoc elseLoc,
      @Nullable Stmt elseStmt,
      boolean implicit) {
    super(StmtKind.IF, implicit);
    this.ifLoc = checkNotNull(ifLoc);
    this.cond = checkNotNull(cond);
    this.thenStmt = checkNotNull(thenStmt);
    this.elseLoc = checkNotNull(elseLoc);
    this.elseStmt = elseStmt;
  }

  public static IfStmt create(
      AstContext ctx,
      SourceLoc ifLoc,
      StmtCondition cond,
      Stmt thenStmt,
      SourceLoc elseLoc,
      @Nullable Stmt elseStmt) {
    return create(ctx, ifLoc, cond, thenStmt, elseLoc, elseStmt, null);
  }

  public static IfStmt create(
      AstContext ctx,
      SourceLoc ifLoc,
      StmtCondition cond,
      Stmt thenStmt,
      SourceLoc elseLoc,
      @Nullable Stmt elseStmt,
      @Nullable Boolean implicit) {
    return ctx.register(
        new IfStmt(
            ifLoc, cond, thenStmt, elseLoc, elseStmt, defaultImplicitFlag(implicit, ifLoc)));
  }

  public SourceLoc getIfLoc() {
    return ifLoc;
  }

  public SourceLoc getElseLoc() {
    return elseLoc;
  }

  public StmtCondition getCond() {
    return cond;
  }

  public void setCond(StmtCondition cond) {
    this.cond = checkNotNull(cond);
  }

  public Stmt getThenStmt() {
    return thenStmt;
  }

  public void setThenStmt(Stmt thenStmt) {
    this.thenStmt = checkNotNull(thenStmt);
  }

  public Optional<Stmt> getElseStmt() {
    return Optional.ofNullable(elseStmt);
  }

  public void setElseStmt(@Nullable Stmt elseStmt) {
    this.elseStmt = elseStmt;
  }

  @Override
  public SourceRange getSourceRange() {
    SourceLoc elseEnd = elseStmt != null ? elseStmt.getEndLoc() : SourceLoc.invalid();
    return rangeFrom(ifLoc, elseEnd, thenStmt.getEndLoc(), cond.getSourceRange().getEnd());
  }

  @Override
  public int getNumChildren() {
    return elseStmt != null ? 3 : 2;
  }

  @Override
  public AstNode getChild(int index) {
    return switch (presentSlot(index, true, true, elseStmt != null)) {
      case 0 -> cond.getNode();
      case 1 -> thenStmt;
      default -> elseStmt;
    };
  }

  @Override
  public void setChild(int index, AstNode child) {
    switch (presentSlot(index, true, true, elseStmt != null)) {
      case 0 -> setCond(StmtCondition.ofNode(child));
      case 1 -> setThenStmt(asStmt(child));
      default -> setElseStmt(asStmt(child));
    }
  }
}
