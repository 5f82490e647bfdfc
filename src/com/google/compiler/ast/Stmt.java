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

import com.google.common.base.MoreObjects;
import java.util.AbstractList;
import java.util.List;
import java.util.RandomAccess;
import org.jspecify.annotations.Nullable;

/**
 * The root of the statement tree.
 *
 * <p>The set of subclasses is closed and each is identified by its {@link StmtKind}, which never
 * changes. To downcast, test the kind (or a category such as {@link #isLabeled()}) and then cast;
 * casting to a class that does not match the kind is a programming error.
 *
 * <p>Statements are created through the static {@code create} factories on each subclass, always
 * inside an {@link AstContext}. After creation only child references, conditions and the fields
 * written by later passes (jump targets, configuration state, for-each generators) change.
 */
public abstract class Stmt implements AstNode {

  private final StmtKind kind;
  private final boolean implicit;
  private SourceLoc trailingSemiLoc = SourceLoc.invalid();

  Stmt(StmtKind kind, boolean implicit) {
    this.kind = checkNotNull(kind);
    this.implicit = implicit;
  }

  /**
   * Returns {@code implicit} if the caller supplied it, otherwise whether {@code keyLoc} is
   * invalid. Statements built without a keyword location are compiler-synthesized.
   */
  static boolean defaultImplicitFlag(@Nullable Boolean implicit, SourceLoc keyLoc) {
    return implicit != null ? implicit : keyLoc.isInvalid();
  }

  public final StmtKind getKind() {
    return kind;
  }

  /** Whether this statement was generated by the compiler rather than written in source. */
  public final boolean isImplicit() {
    return implicit;
  }

  @Override
  public abstract SourceRange getSourceRange();

  @Override
  public final SourceLoc getStartLoc() {
    return getSourceRange().getStart();
  }

  @Override
  public final SourceLoc getEndLoc() {
    return getSourceRange().getEnd();
  }

  /** The location of a semicolon following this statement, if any. */
  public final SourceLoc getTrailingSemiLoc() {
    return trailingSemiLoc;
  }

  public final void setTrailingSemiLoc(SourceLoc loc) {
    this.trailingSemiLoc = checkNotNull(loc);
  }

  public final boolean isBrace() {
    return kind == StmtKind.BRACE;
  }

  public final boolean isReturn() {
    return kind == StmtKind.RETURN;
  }

  public final boolean isBreak() {
    return kind == StmtKind.BREAK;
  }

  public final boolean isContinue() {
    return kind == StmtKind.CONTINUE;
  }

  public final boolean isFallthrough() {
    return kind == StmtKind.FALLTHROUGH;
  }

  public final boolean isIf() {
    return kind == StmtKind.IF;
  }

  public final boolean isIfConfig() {
    return kind == StmtKind.IF_CONFIG;
  }

  public final boolean isWhile() {
    return kind == StmtKind.WHILE;
  }

  public final boolean isDoWhile() {
    return kind == StmtKind.DO_WHILE;
  }

  public final boolean isFor() {
    return kind == StmtKind.FOR;
  }

  public final boolean isForEach() {
    return kind == StmtKind.FOR_EACH;
  }

  public final boolean isSwitch() {
    return kind == StmtKind.SWITCH;
  }

  public final boolean isCase() {
    return kind == StmtKind.CASE;
  }

  /** Whether this is a {@link LabeledStmt}: a loop or a switch. */
  public final boolean isLabeled() {
    return kind.isLabeled();
  }

  public final boolean isLoop() {
    return kind.isLoop();
  }

  public final boolean isBranch() {
    return kind.isBranch();
  }

  public final boolean isJump() {
    return kind.isJump();
  }

  public final boolean isConditional() {
    return kind.isConditional();
  }

  /** The number of immediate children. Absent optional children are not counted. */
  public abstract int getNumChildren();

  /** Returns the immediate child at {@code index}, in source order. */
  public abstract AstNode getChild(int index);

  /**
   * Replaces the immediate child at {@code index}. The replacement must be of a type the slot
   * accepts.
   */
  public abstract void setChild(int index, AstNode child);

  /**
   * Returns the immediate children in source order as a fixed-size list. {@code set} replaces a
   * child in place; the list cannot grow or shrink.
   */
  public final List<AstNode> children() {
    return new ChildList(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(kind.getKindName())
        .add("range", getSourceRange())
        .add("implicit", implicit)
        .add("children", getNumChildren())
        .toString();
  }

  /**
   * Returns the range from {@code start} to the first valid location in {@code ends}. Children
   * synthesized by the compiler have invalid locations; when every candidate is invalid the range
   * collapses to {@code start}, so the end never precedes a valid start.
   */
  static SourceRange rangeFrom(SourceLoc start, SourceLoc... ends) {
    for (SourceLoc end : ends) {
      if (end.isValid()) {
        return SourceRange.of(start, end);
      }
    }
    return SourceRange.of(start);
  }

  static Stmt asStmt(AstNode node) {
    checkNotNull(node);
    checkArgument(node instanceof Stmt, "Expected a statement, got %s", node);
    return (Stmt) node;
  }

  static Expr asExpr(AstNode node) {
    checkNotNull(node);
    checkArgument(node instanceof Expr, "Expected an expression, got %s", node);
    return (Expr) node;
  }

  static Pattern asPattern(AstNode node) {
    checkNotNull(node);
    checkArgument(node instanceof Pattern, "Expected a pattern, got %s", node);
    return (Pattern) node;
  }

  /** Returns the number of {@code true} entries in {@code present}. */
  static int countPresent(boolean... present) {
    int count = 0;
    for (boolean p : present) {
      if (p) {
        count++;
      }
    }
    return count;
  }

  /**
   * Maps a child index onto a slot number, skipping slots that are not present. For a node with
   * slots (a, b?, c) and b absent, child 1 is slot 2.
   */
  static int presentSlot(int index, boolean... present) {
    int remaining = index;
    for (int slot = 0; slot < present.length; slot++) {
      if (present[slot] && remaining-- == 0) {
        return slot;
      }
    }
    throw new IndexOutOfBoundsException(
        "Child index " + index + " out of range for " + countPresent(present) + " children");
  }

  private static final class ChildList extends AbstractList<AstNode> implements RandomAccess {
    private final Stmt owner;

    ChildList(Stmt owner) {
      this.owner = owner;
    }

    @Override
    public AstNode get(int index) {
      return owner.getChild(index);
    }

    @Override
    public AstNode set(int index, AstNode element) {
      AstNode old = owner.getChild(index);
      owner.setChild(index, element);
      return old;
    }

    @Override
    public int size() {
      return owner.getNumChildren();
    }
  }
}
