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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import org.jspecify.annotations.Nullable;

/**
 * The condition of an {@code if} or {@code while}: either a conditional pattern binding such as
 * {@code let x = f()} or a boolean expression. Exactly one of the two is present.
 */
public final class StmtCondition {

  private final @Nullable PatternBindingDecl binding;
  private final @Nullable Expr expr;

  private StmtCondition(@Nullable PatternBindingDecl binding, @Nullable Expr expr) {
    checkArgument((binding == null) != (expr == null));
    this.binding = binding;
    this.expr = expr;
  }

  public static StmtCondition of(Expr expr) {
    return new StmtCondition(null, checkNotNull(expr));
  }

  public static StmtCondition of(PatternBindingDecl binding) {
    return new StmtCondition(checkNotNull(binding), null);
  }

  /** Wraps a node that must be either an expression or a pattern binding. */
  static StmtCondition ofNode(AstNode node) {
    checkNotNull(node);
    if (node instanceof PatternBindingDecl) {
      return of((PatternBindingDecl) node);
    }
    checkArgument(node instanceof Expr, "Not a valid condition: %s", node);
    return of((Expr) node);
  }

  public boolean isBinding() {
    return binding != null;
  }

  public boolean isExpr() {
    return expr != null;
  }

  public PatternBindingDecl getBinding() {
    checkState(binding != null, "Condition is an expression, not a binding");
    return binding;
  }

  public Expr getExpr() {
    checkState(expr != null, "Condition is a binding, not an expression");
    return expr;
  }

  /** Returns whichever alternative is present. */
  public AstNode getNode() {
    return binding != null ? binding : expr;
  }

  public SourceRange getSourceRange() {
    return getNode().getSourceRange();
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof StmtCondition && ((StmtCondition) o).getNode() == getNode();
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(getNode());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("binding", binding)
        .add("expr", expr)
        .toString();
  }
}
