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

import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A {@code case} or {@code default} clause. Only valid as a case of a {@link SwitchStmt}.
 *
 * <p>A clause begins with one or more {@link CaseLabelItem}s or with a single {@code default}
 * label:
 *
 * <pre>
 *   case 1:
 *   case 2, 3:
 *   case Foo(var x, var y) where x &lt; y:
 *   case 2 where foo(), 3 where bar():
 *   default:
 * </pre>
 */
public final class CaseStmt extends Stmt {

  private final SourceLoc caseLoc;
  private final SourceLoc colonLoc;
  private final TrailingElements<CaseLabelItem> labelItems;
  private final boolean hasBoundDecls;
  private Stmt body;

  private CaseStmt(
      SourceLoc caseLoc,
      TrailingElements<CaseLabelItem> labelItems,
      boolean hasBoundDecls,
      SourceLoc colonLoc,
      Stmt body,
      boolean implicit) {
    super(StmtKind.CASE, implicit);
    this.caseLoc = checkNotNull(caseLoc);
    this.labelItems = labelItems;
    this.hasBoundDecls = hasBoundDecls;
    this.colonLoc = checkNotNull(colonLoc);
    this.body = checkNotNull(body);
  }

  public static CaseStmt create(
      AstContext ctx,
      SourceLoc caseLoc,
      List<CaseLabelItem> labelItems,
      boolean hasBoundDecls,
      SourceLoc colonLoc,
      Stmt body) {
    return create(ctx, caseLoc, labelItems, hasBoundDecls, colonLoc, body, null);
  }

  public static CaseStmt create(
      AstContext ctx,
      SourceLoc caseLoc,
      List<CaseLabelItem> labelItems,
      boolean hasBoundDecls,
      SourceLoc colonLoc,
      Stmt body,
      @Nullable Boolean implicit) {
    checkArgument(!labelItems.isEmpty(), "A case needs at least one label item");
    checkArgument(
        hasBoundDecls == anyPatternBindsVariables(labelItems),
        "hasBoundDecls=%s disagrees with the label patterns %s",
        hasBoundDecls,
        labelItems);
    TrailingElements<CaseLabelItem> storage =
        TrailingElements.allocate(ctx, CaseLabelItem.class, labelItems);
    return ctx.register(
        new CaseStmt(
            caseLoc,
            storage,
            hasBoundDecls,
            colonLoc,
            body,
            defaultImplicitFlag(implicit, caseLoc)));
  }

  private static boolean anyPatternBindsVariables(List<CaseLabelItem> labelItems) {
    for (CaseLabelItem item : labelItems) {
      if (item.getPattern().bindsVariables()) {
        return true;
      }
    }
    return false;
  }

  /** The location of the first {@code case} or {@code default} keyword. */
  public SourceLoc getLoc() {
    return caseLoc;
  }

  public SourceLoc getColonLoc() {
    return colonLoc;
  }

  /** The label items, in source order. Never empty. */
  public List<CaseLabelItem> getCaseLabelItems() {
    return Collections.unmodifiableList(labelItems);
  }

  /** The label items as a fixed-size list that accepts replacement items. */
  public List<CaseLabelItem> getMutableCaseLabelItems() {
    return labelItems;
  }

  public Stmt getBody() {
    return body;
  }

  public void setBody(Stmt body) {
    this.body = checkNotNull(body);
  }

  /** Whether any pattern of this clause declares local variables. */
  public boolean hasBoundDecls() {
    return hasBoundDecls;
  }

  /** Whether this is a {@code default} clause, as decided by its first label item. */
  public boolean isDefault() {
    return labelItems.get(0).isDefault();
  }

  @Override
  public SourceRange getSourceRange() {
    return rangeFrom(caseLoc, body.getEndLoc(), colonLoc);
  }

  // Children: each item's pattern and guard, in source order, then the body.

  @Override
  public int getNumChildren() {
    int count = 1;
    for (CaseLabelItem item : labelItems) {
      count += item.hasGuard() ? 2 : 1;
    }
    return count;
  }

  @Override
  public AstNode getChild(int index) {
    int remaining = index;
    for (CaseLabelItem item : labelItems) {
      if (remaining == 0) {
        return item.getPattern();
      }
      remaining--;
      if (item.hasGuard()) {
        if (remaining == 0) {
          return item.getGuardExpr();
        }
        remaining--;
      }
    }
    if (remaining == 0) {
      return body;
    }
    throw new IndexOutOfBoundsException("Child index " + index + " out of range");
  }

  @Override
  public void setChild(int index, AstNode child) {
    int remaining = index;
    for (CaseLabelItem item : labelItems) {
      if (remaining == 0) {
        item.setPattern(asPattern(child));
        return;
      }
      remaining--;
      if (item.hasGuard()) {
        if (remaining == 0) {
          item.setGuardExpr(asExpr(child));
          return;
        }
        remaining--;
      }
    }
    if (remaining == 0) {
      setBody(asStmt(child));
      return;
    }
    throw new IndexOutOfBoundsException("Child index " + index + " out of range");
  }
}
