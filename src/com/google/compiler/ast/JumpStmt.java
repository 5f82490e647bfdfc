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
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A statement that transfers control to another statement chosen by a later pass: {@code break},
 * {@code continue} or {@code fallthrough}. Jumps have no children.
 *
 * @param <T> the kind of statement the jump lands on
 */
public abstract class JumpStmt<T extends Stmt> extends Stmt {

  private final SourceLoc loc;
  private BranchTarget<T> target;

  JumpStmt(StmtKind kind, boolean implicit, SourceLoc loc, BranchTarget<T> target) {
    super(kind, implicit);
    checkArgument(kind.isJump(), "%s is not a jump kind", kind);
    checkArgument(!target.isResolved(), "Jumps are created unresolved");
    this.loc = checkNotNull(loc);
    this.target = target;
  }

  /** The location of the keyword. */
  public final SourceLoc getLoc() {
    return loc;
  }

  /** The current resolution state. Never null; inspect {@link BranchTarget#isResolved()}. */
  public final BranchTarget<T> getBranchTarget() {
    return target;
  }

  public final boolean isTargetResolved() {
    return target.isResolved();
  }

  final T getResolvedTarget() {
    return target.get();
  }

  final void resolveTarget(T newTarget) {
    target = target.resolveTo(checkNotNull(newTarget));
  }

  @Override
  public final int getNumChildren() {
    return 0;
  }

  @Override
  public final AstNode getChild(int index) {
    checkElementIndex(index, 0);
    throw new AssertionError();
  }

  @Override
  public final void setChild(int index, AstNode child) {
    checkElementIndex(index, 0);
    throw new AssertionError();
  }
}
