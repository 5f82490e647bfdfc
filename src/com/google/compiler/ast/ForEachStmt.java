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

import org.jspecify.annotations.Nullable;

/**
 * A loop over the elements of a sequence, as in {@code for i in 0..10 { ... }}.
 *
 * <p>The parser fills in the pattern, the sequence and the body. Type checking later adds the
 * generator, which is the implicit variable initialized from the sequence, and the expression that
 * advances it. Until then the node is <em>incomplete</em>. It is still a valid tree and can be
 * walked, but the generator accessors may not be called.
 */
public final class ForEachStmt extends LabeledStmt {

  private final SourceLoc forLoc;
  private final SourceLoc inLoc;
  private Pattern pattern;
  private Expr sequence;
  private BraceStmt body;

  private @Nullable PatternBindingDecl generator;
  private @Nullable Expr generatorNext;

  private ForEachStmt(
      LabelInfo labelInfo,
      SourceLoc forLoc,
      Pattern pattern,
      SourceLoc inLoc,
      Expr sequence,
      BraceStmt body,
      boolean implicit) {
    super(StmtKind.FOR_EACH, implicit, labelInfo);
    this.forLoc = checkNotNull(forLoc);
    this.pattern = checkNotNull(pattern);
    this.inLoc = checkNotNull(inLoc);
    this.sequence = checkNotNull(sequence);
    this.body = checkNotNull(body);
  }

  public static ForEachStmt create(
      AstContext ctx,
      LabelInfo labelInfo,
      SourceLoc forLoc,
      Pattern pattern,
      SourceLoc inLoc,
      Expr sequence,
      BraceStmt body) {
    return create(ctx, labelInfo, forLoc, pattern, inLoc, sequence, body, null);
  }

  public static ForEachStmt create(
      AstContext ctx,
      LabelInfo labelInfo,
      SourceLoc forLoc,
      Pattern pattern,
      SourceLoc inLoc,
      Expr sequence,
      BraceStmt body,
      @Nullable Boolean implicit) {
    return ctx.register(
        new ForEachStmt(
            labelInfo,
            forLoc,
            pattern,
            inLoc,
            sequence,
            body,
            defaultImplicitFlag(implicit, forLoc)));
  }

  /** The location of the {@code for} keyword. */
  public SourceLoc getForLoc() {
    return forLoc;
  }

  /** The location of the {@code in} keyword. */
  public SourceLoc getInLoc() {
    return inLoc;
  }

  /** The pattern binding the iteration variables, visible only within the body. */
  public Pattern getPattern() {
    return pattern;
  }

  public void setPattern(Pattern pattern) {
    this.pattern = checkNotNull(pattern);
  }

  /** The sequence as written in source. */
  public Expr getSequence() {
    return sequence;
  }

  public void setSequence(Expr sequence) {
    this.sequence = checkNotNull(sequence);
  }

  public BraceStmt getBody() {
    return body;
  }

  public void setBody(BraceStmt body) {
    this.body = checkNotNull(body);
  }

  public boolean hasGenerator() {
    return generator != null;
  }

  /** The binding of the implicit generator variable. Only valid once set by type checking. */
  public PatternBindingDecl getGenerator() {
    checkState(generator != null, "Generator is not set until type checking");
    return generator;
  }

  public void setGenerator(PatternBindingDecl generator) {
    checkState(this.generator == null, "Generator already set");
    this.generator = checkNotNull(generator);
  }

  public boolean hasGeneratorNext() {
    return generatorNext != null;
  }

  /**
   * The expression that advances the generator and yields an optional holding the next element,
   * or nothing at the end of the sequence. Only valid once set by type checking.
   */
  public Expr getGeneratorNext() {
    checkState(generatorNext != null, "Generator advance is not set until type checking");
    return generatorNext;
  }

  public void setGeneratorNext(Expr generatorNext) {
    checkState(this.generatorNext == null, "Generator advance already set");
    this.generatorNext = checkNotNull(generatorNext);
  }

  /** Sets both analysis-produced fields at once. */
  public void complete(PatternBindingDecl generator, Expr generatorNext) {
    setGenerator(generator);
    setGeneratorNext(generatorNext);
  }

  /** Whether type checking has filled in both the generator and its advance expression. */
  public boolean isComplete() {
    return generator != null && generatorNext != null;
  }

  @Override
  public SourceRange getSourceRange() {
    return rangeFrom(getLabelLocOrKeywordLoc(forLoc), body.getEndLoc(), sequence.getEndLoc());
  }

  // Children: pattern, sequence, then the generator fields when present, then the body.

  @Override
  public int getNumChildren() {
    return countPresent(true, true, generator != null, generatorNext != null, true);
  }

  @Override
  public AstNode getChild(int index) {
    return switch (presentSlot(index, true, true, generator != null, generatorNext != null, true)) {
      case 0 -> pattern;
      case 1 -> sequence;
      case 2 -> generator;
      case 3 -> generatorNext;
      default -> body;
    };
  }

  @Override
  public void setChild(int index, AstNode child) {
    switch (presentSlot(index, true, true, generator != null, generatorNext != null, true)) {
      case 0 -> setPattern(asPattern(child));
      case 1 -> setSequence(asExpr(child));
      case 2 -> {
        checkArgument(child instanceof PatternBindingDecl, "Expected a binding, got %s", child);
        generator = (PatternBindingDecl) child;
      }
      case 3 -> generatorNext = asExpr(child);
      default -> {
        checkArgument(child instanceof BraceStmt, "Expected a brace statement, got %s", child);
        setBody((BraceStmt) child);
      }
    }
  }
}
