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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * A C-style {@code for init; cond; incr} loop.
 *
 * <p>All three clauses are optional. A missing condition always evaluates to true. The
 * declarations introduced by the initializer are kept alongside it and may be empty.
 */
public final class ForStmt extends LabeledStmt {

  private final SourceLoc forLoc;
  private final SourceLoc semi1Loc;
  private final SourceLoc semi2Loc;
  private @Nullable Expr initializer;
  private ImmutableList<Decl> initializerVarDecls;
  private @Nullable Expr cond;
  private @Nullable Expr increment;
  private Stmt body;

  private ForStmt(
      LabelInfo labelInfo,
      SourceLoc forLoc,
      @Nullable Expr initializer,
      List<? extends Decl> initializerVarDecls,
      SourceLoc semi1Loc,
      @Nullable Expr cond,
      SourceLoc semi2Loc,
      @Nullable Expr increment,
      Stmt body,
      boolean implicit) {
    super(StmtKind.FOR, implicit, labelInfo);
    this.forLoc = checkNotNull(forLoc);
    this.initializer = initializer;
    this.initializerVarDecls = ImmutableList.copyOf(initializerVarDecls);
    this.semi1Loc = checkNotNull(semi1Loc);
    this.cond = cond;
    this.semi2Loc = checkNotNull(semi2Loc);
    this.increment = increment;
    this.body = checkNotNull(body);
  }

  public static ForStmt create(
      AstContext ctx,
      LabelInfo labelInfo,
      SourceLoc forLoc,
      @Nullable Expr initializer,
      List<? extends Decl> initializerVarDecls,
      SourceLoc semi1Loc,
      @Nullable Expr cond,
      SourceLoc semi2Loc,
      @Nullable Expr increment,
      Stmt body) {
    return create(
        ctx,
        labelInfo,
        forLoc,
        initializer,
        initializerVarDecls,
        semi1Loc,
        cond,
        semi2Loc,
        increment,
        body,
        null);
  }

  public static ForStmt create(
      AstContext ctx,
      LabelInfo labelInfo,
      SourceLoc forLoc,
      @Nullable Expr initializer,
      List<? extends Decl> initializerVarDecls,
      SourceLoc semi1Loc,
      @Nullable Expr cond,
      SourceLoc semi2Loc,
      @Nullable Expr increment,
      Stmt body,
      @Nullable Boolean implicit) {
    return ctx.register(
        new ForStmt(
            labelInfo,
            forLoc,
            initializer,
            initializerVarDecls,
            semi1Loc,
            cond,
            semi2Loc,
            increment,
            body,
            defaultImplicitFlag(implicit, forLoc)));
  }

  public SourceLoc getForLoc() {
    return forLoc;
  }

  public SourceLoc getFirstSemicolonLoc() {
    return semi1Loc;
  }

  public SourceLoc getSecondSemicolonLoc() {
    return semi2Loc;
  }

  public Optional<Expr> getInitializer() {
    return Optional.ofNullable(initializer);
  }

  public void setInitializer(@Nullable Expr initializer) {
    this.initializer = initializer;
  }

  public ImmutableList<Decl> getInitializerVarDecls() {
    return initializerVarDecls;
  }

  public void setInitializerVarDecls(List<? extends Decl> decls) {
    this.initializerVarDecls = ImmutableList.copyOf(decls);
  }

  /** Returns the loop condition. Empty means the loop runs until exited by a jump. */
  public Optional<Expr> getCond() {
    return Optional.ofNullable(cond);
  }

  public void setCond(@Nullable Expr cond) {
    this.cond = cond;
  }

  public Optional<Expr> getIncrement() {
    return Optional.ofNullable(increment);
  }

  public void setIncrement(@Nullable Expr increment) {
    this.increment = increment;
  }

  public Stmt getBody() {
    return body;
  }

  public void setBody(Stmt body) {
    this.body = checkNotNull(body);
  }

  @Override
  public SourceRange getSourceRange() {
    return rangeFrom(getLabelLocOrKeywordLoc(forLoc), body.getEndLoc(), semi2Loc);
  }

  // Children: the initializer declarations, then the present clauses, then the body.

  @Override
  public int getNumChildren() {
    return initializerVarDecls.size()
        + countPresent(initializer != null, cond != null, increment != null, true);
  }

  @Override
  public AstNode getChild(int index) {
    int numDecls = initializerVarDecls.size();
    if (index >= 0 && index < numDecls) {
      return initializerVarDecls.get(index);
    }
    return switch (presentSlot(
        index - numDecls, initializer != null, cond != null, increment != null, true)) {
      case 0 -> initializer;
      case 1 -> cond;
      case 2 -> increment;
      default -> body;
    };
  }

  @Override
  public void setChild(int index, AstNode child) {
    int numDecls = initializerVarDecls.size();
    if (index >= 0 && index < numDecls) {
      checkArgument(child instanceof Decl, "Expected a declaration, got %s", child);
      ImmutableList.Builder<Decl> decls = ImmutableList.builder();
      for (int i = 0; i < numDecls; i++) {
        decls.add(i == index ? (Decl) child : initializerVarDecls.get(i));
      }
      initializerVarDecls = decls.build();
      return;
    }
    switch (presentSlot(
        index - numDecls, initializer != null, cond != null, increment != null, true)) {
      case 0 -> setInitializer(asExpr(child));
      case 1 -> setCond(asExpr(child));
      case 2 -> setIncrement(asExpr(child));
      default -> setBody(asStmt(child));
    }
  }
}
