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

/**
 * The {@code fallthrough} statement. It transfers control to the case clause that follows the
 * enclosing one in the same switch.
 */
public final class FallthroughStmt extends JumpStmt<CaseStmt> {

  private FallthroughStmt(SourceLoc loc, boolean implicit) {
    super(
        StmtKind.FALLTHROUGH,
        implicit,
        loc,
        BranchTarget.unresolved(Identifier.empty(), SourceLoc.invalid()));
  }

  public static FallthroughStmt create(AstContext ctx, SourceLoc loc) {
    return create(ctx, loc, null);
  }

  public static FallthroughStmt create(
      AstContext ctx, SourceLoc loc, @Nullable Boolean implicit) {
    return ctx.register(new FallthroughStmt(loc, defaultImplicitFlag(implicit, loc)));
  }

  /** Returns the case clause control transfers to. Not set until jump targets are resolved. */
  public CaseStmt getFallthroughDest() {
    return getResolvedTarget();
  }

  public void setFallthroughDest(CaseStmt dest) {
    resolveTarget(dest);
  }

  @Override
  public SourceRange getSourceRange() {
    return SourceRange.of(getLoc());
  }
}
