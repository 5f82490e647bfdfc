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

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A brace-enclosed sequence of statements, declarations and expressions, as in {@code { var x =
 * 10; print(x) }}.
 *
 * <p>The elements are stored in the context's trailing storage. The list returned by {@link
 * #getElements()} has a fixed size and writes through on {@code set}.
 */
public final class BraceStmt extends Stmt {

  /**
   * Whether a block is the body of a conditional-compilation branch, and if so whether the build
   * configuration selected it.
   */
  public enum ConfigState {
    /** An ordinary block. */
    NONE,
    /** The body of a selected {@code #if} or {@code #else} branch. */
    ACTIVE,
    /** The body of a branch the build configuration did not select. */
    INACTIVE
  }

  private final SourceLoc lbLoc;
  private final SourceLoc rbLoc;
  private final TrailingElements<AstNode> elements;
  private ConfigState configState = ConfigState.NONE;

  private BraceStmt(
      SourceLoc lbLoc, TrailingElements<AstNode> elements, SourceLoc rbLoc, boolean implicit) {
    super(StmtKind.BRACE, implicit);
    this.lbLoc = checkNotNull(lbLoc);
    this.elements = elements;
    this.rbLoc = checkNotNull(rbLoc);
  }

  public static BraceStmt create(
      AstContext ctx, SourceLoc lbLoc, List<? extends AstNode> elements, SourceLoc rbLoc) {
    return create(ctx, lbLoc, elements, rbLoc, null);
  }

  public static BraceStmt create(
      AstContext ctx,
      SourceLoc lbLoc,
      List<? extends AstNode> elements,
      SourceLoc rbLoc,
      @Nullable Boolean implicit) {
    TrailingElements<AstNode> storage = TrailingElements.allocate(ctx, AstNode.class, elements);
    return ctx.register(
        new BraceStmt(lbLoc, storage, rbLoc, defaultImplicitFlag(implicit, lbLoc)));
  }

  public SourceLoc getLBraceLoc() {
    return lbLoc;
  }

  public SourceLoc getRBraceLoc() {
    return rbLoc;
  }

  /** The elements of this block, in source order. Replaceable in place, never resized. */
  public List<AstNode> getElements() {
    return elements;
  }

  public int getNumElements() {
    return elements.size();
  }

  public ConfigState getConfigState() {
    return configState;
  }

  /** Marks this block as the body of an active conditional-compilation branch. */
  public void markAsConfigBlock() {
    if (configState == ConfigState.NONE) {
      configState = ConfigState.ACTIVE;
    }
  }

  /**
   * Marks this block as the body of an inactive conditional-compilation branch. An inactive block
   * is always a config block too.
   */
  public void markAsInactiveConfigBlock() {
    configState = ConfigState.INACTIVE;
  }

  public boolean isConfigBlock() {
    return configState != ConfigState.NONE;
  }

  public boolean isInactiveConfigBlock() {
    return configState == ConfigState.INACTIVE;
  }

  @Override
  public SourceRange getSourceRange() {
    return rangeFrom(lbLoc, rbLoc);
  }

  @Override
  public int getNumChildren() {
    return elements.size();
  }

  @Override
  public AstNode getChild(int index) {
    return elements.get(index);
  }

  @Override
  public void setChild(int index, AstNode child) {
    elements.set(index, child);
  }
}
