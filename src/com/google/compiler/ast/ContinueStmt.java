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

import org.jspecify.annotations.Nullable;

/** The {@code continue} and {@code continue label} statement. */
public final class ContinueStmt extends JumpStmt<LabeledStmt> {

  private ContinueStmt(
      SourceLoc loc, Identifier targetName, SourceLoc targetLoc, boolean implicit) {
    super(StmtKind.CONTINUE, implicit, loc, BranchTarget.unresolved(targetName, targetLoc));
  }

  public static ContinueStmt create(
      AstContext ctx, SourceLoc loc, Identifier targetName, SourceLoc targetLoc) {
    return create(ctx, loc, targetName, targetLoc, null);
  }

  public static ContinueStmt create(
      AstContext ctx,
      SourceLoc loc,
      Identifier targetName,
      SourceLoc targetLoc,
      @Nullable Boolean implicit) {
    return ctx.register(
        new ContinueStmt(loc, targetName, targetLoc, defaultImplicitFlag(implicit, loc)));
  }

  public Identifier getTargetName() {
    return getBranchTarget().getName();
  }

  public SourceLoc getTargetLoc() {
    return getBranchTarget().getNameLoc();
  }

  /** Returns the loop being continued. Only valid after resolution. */
  public LabeledStmt getTarget() {
    return getResolvedTarget();
  }

  /** Records the loop this continue repeats. A switch is never a valid target. */
  public void setTarget(LabeledStmt target) {
    checkArgument(target.isLoop(), "continue cannot target %s", target.getKind());
    resolveTarget(target);
  }

  @Override
  public SourceRange getSourceRange() {
    return SourceRange.of(getLoc(), getTargetLoc().or(getLoc()));
  }
}
