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

import org.jspecify.annotations.Nullable;

/** The {@code break} and {@code break label} statement. */
public final class BreakStmt extends JumpStmt<LabeledStmt> {

  private BreakStmt(SourceLoc loc, Identifier targetName, SourceLoc targetLoc, boolean implicit) {
    super(StmtKind.BREAK, implicit, loc, BranchTarget.unresolved(targetName, targetLoc));
  }

  /**
   * Creates a break. Pass {@link Identifier#empty()} and an invalid location for an unlabeled
   * break.
   */
  public static BreakStmt create(
      AstContext ctx, SourceLoc loc, Identifier targetName, SourceLoc targetLoc) {
    return create(ctx, loc, targetName, targetLoc, null);
  }

  public static BreakStmt create(
      AstContext ctx,
      SourceLoc loc,
      Identifier targetName,
      SourceLoc targetLoc,
      @Nullable Boolean implicit) {
    return ctx.register(
        new BreakStmt(loc, targetName, targetLoc, defaultImplicitFlag(implicit, loc)));
  }

  /** The label written after {@code break}, or the empty identifier. */
  public Identifier getTargetName() {
    return getBranchTarget().getName();
  }

  public SourceLoc getTargetLoc() {
    return getBranchTarget().getNameLoc();
  }

  /** Returns the loop or switch being exited. Only valid after resolution. */
  public LabeledStmt getTarget() {
    return getResolvedTarget();
  }

  /** Records the loop or switch this break exits. May only be called once. */
  public void setTarget(LabeledStmt target) {
    resolveTarget(target);
  }

  @Override
  public SourceRange getSourceRange() {
    return SourceRange.of(getLoc(), getTargetLoc().or(getLoc()));
  }
}
