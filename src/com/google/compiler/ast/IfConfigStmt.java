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
 * The statement form of a conditional-compilation block ({@code #if / #else / #endif}).
 *
 * <p>Which branch is active is decided by the parser from the build configuration before the node
 * is created. Both branches stay in the tree so tools can still see the inactive code.
 */
public final class IfConfigStmt extends Stmt {

  private final boolean ifBlockIsActive;
  private final SourceLoc ifLoc;
  private final SourceLoc elseLoc;
  private final SourceLoc endLoc;
  private @Nullable Expr cond;
  private @Nullable Stmt thenStmt;
  private @Nullable Stmt elseStmt;

  private IfConfigStmt(
      boolean ifBlockIsActive,
      SourceLoc ifLoc,
      @Nullable Expr cond,
      @Nullable Stmt thenStmt,
      SourceLoc elseLoc,
      @Nullable Stmt elseStmt,
      SourceLoc endLoc) {
    super(StmtKind.IF_CONFIG, /* implicit= */ false);
    this.ifBlockIsActive = ifBlockIsActive;
    this.ifLoc = checkNotNull(ifLoc);
    this.cond = cond;
    this.thenStmt = thenStmt;
    this.elseLoc = checkNotNull(elseLoc);
    this.elseStmt = elseStmt;
    this.endLoc = checkNotNull(endLoc);
  }

  public static IfConfigStmt create(
      AstContext ctx,
      boolean ifBlockIsActive,
      SourceLoc ifLoc,
      @Nullable Expr cond,
      @Nullable Stmt thenStmt,
      SourceLoc elseLoc,
      @Nullable Stmt elseStmt,
      SourceLoc endLoc) {
    return ctx.register(
        new IfConfigStmt(ifBlockIsActive, ifLoc, cond, thenStmt, elseLoc, elseStmt, endLoc));
  }

  public SourceLoc getIfLoc() {
    return ifLoc;
  }

  public SourceLoc getElseLoc() {
    return elseLoc;
  }

  /** The location of {@code #endif}. */
  public SourceLoc getEndifLoc() {
    return endLoc;
  }

  /** Whether the {@code #if} branch was selected by the build configuration. */
  public boolean isIfBlockActive() {
    return ifBlockIsActive;
  }

  /** Whether an {@code #else} was written. */
  public boolean hasElse() {
    return elseLoc.isValid();
  }

  public Optional<Expr> getCond() {
    return Optional.ofNullable(cond);
  }

  public void setCond(@Nullable Expr cond) {
    this.cond = cond;
  }

  public Optional<Stmt> getThenStmt() {
    return Optional.ofNullable(thenStmt);
  }

  public void setThenStmt(@Nullable Stmt thenStmt) {
    this.thenStmt = thenStmt;
  }

  public Optional<Stmt> getElseStmt() {
    return Optional.ofNullable(elseStmt);
  }

  public void setElseStmt(@Nullable Stmt elseStmt) {
    this.elseStmt = elseStmt;
  }

  /**
   * Returns the branch selected by the build configuration: the {@code #if} body when it is
   * active, otherwise the {@code #else} body, which may be absent.
   */
  public Optional<Stmt> getActiveStmt() {
    return ifBlockIsActive ? getThenStmt() : getElseStmt();
  }

  @Override
  public SourceRange getSourceRange() {
    return rangeFrom(ifLoc, endLoc);
  }

  @Override
  public int getNumChildren() {
    return countPresent(cond != null, thenStmt != null, elseStmt != null);
  }

  @Override
  public AstNode getChild(int index) {
    return switch (presentSlot(index, cond != null, thenStmt != null, elseStmt != null)) {
      case 0 -> cond;
      case 1 -> thenStmt;
      default -> elseStmt;
    };
  }

  @Override
  public void setChild(int index, AstNode child) {
    switch (presentSlot(index, cond != null, thenStmt != null, elseStmt != null)) {
      case 0 -> setCond(asExpr(child));
      case 1 -> setThenStmt(asStmt(child));
      default -> setElseStmt(asStmt(child));
    }
  }
}
