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

import com.google.common.base.MoreObjects;
import org.jspecify.annotations.Nullable;

/**
 * One pattern of a {@code case} label, with its optional {@code where} guard. In {@code case 2
 * where f(), 3:} there are two items.
 */
public final class CaseLabelItem {

  private final boolean isDefault;
  private Pattern pattern;
  private final SourceLoc whereLoc;
  private @Nullable Expr guardExpr;

  public CaseLabelItem(
      boolean isDefault, Pattern pattern, SourceLoc whereLoc, @Nullable Expr guardExpr) {
    this.isDefault = isDefault;
    this.pattern = checkNotNull(pattern);
    this.whereLoc = checkNotNull(whereLoc);
    this.guardExpr = guardExpr;
  }

  /** A plain {@code case pattern} item. */
  public static CaseLabelItem of(Pattern pattern) {
    return new CaseLabelItem(false, pattern, SourceLoc.invalid(), null);
  }

  /** A {@code case pattern where guard} item. */
  public static CaseLabelItem guarded(Pattern pattern, SourceLoc whereLoc, Expr guardExpr) {
    return new CaseLabelItem(false, pattern, whereLoc, checkNotNull(guardExpr));
  }

  /** The single item of a {@code default} label, matching {@code pattern}. */
  public static CaseLabelItem defaultItem(Pattern pattern) {
    return new CaseLabelItem(true, pattern, SourceLoc.invalid(), null);
  }

  /** Whether this is syntactically a {@code default} label. */
  public boolean isDefault() {
    return isDefault;
  }

  public Pattern getPattern() {
    return pattern;
  }

  public void setPattern(Pattern pattern) {
    this.pattern = checkNotNull(pattern);
  }

  public SourceLoc getWhereLoc() {
    return whereLoc;
  }

  public boolean hasGuard() {
    return guardExpr != null;
  }

  /** Returns the guard expression, or null if the item has no guard. */
  public @Nullable Expr getGuardExpr() {
    return guardExpr;
  }

  public void setGuardExpr(@Nullable Expr guardExpr) {
    this.guardExpr = guardExpr;
  }

  public SourceRange getSourceRange() {
    SourceLoc start = pattern.getStartLoc();
    SourceLoc end = guardExpr != null ? guardExpr.getEndLoc() : pattern.getEndLoc();
    return SourceRange.of(start, end);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("default", isDefault)
        .add("pattern", pattern)
        .add("guard", guardExpr)
        .toString();
  }
}
