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

package com.google.compiler.sema;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.compiler.ast.AstNode;
import com.google.compiler.ast.BraceStmt;
import com.google.compiler.ast.BreakStmt;
import com.google.compiler.ast.CaseStmt;
import com.google.compiler.ast.ContinueStmt;
import com.google.compiler.ast.FallthroughStmt;
import com.google.compiler.ast.Identifier;
import com.google.compiler.ast.IfConfigStmt;
import com.google.compiler.ast.LabeledStmt;
import com.google.compiler.ast.SourceLoc;
import com.google.compiler.ast.Stmt;
import com.google.compiler.ast.SwitchStmt;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Links every {@code break}, {@code continue} and {@code fallthrough} to the statement it
 * transfers control to.
 *
 * <ul>
 *   <li>An unlabeled {@code break} exits the innermost enclosing loop or switch.
 *   <li>An unlabeled {@code continue} repeats the innermost enclosing loop; switches are skipped.
 *   <li>A labeled jump targets the innermost enclosing statement carrying that label.
 *   <li>A {@code fallthrough} lands on the case clause after its own.
 * </ul>
 *
 * <p>When no target exists the jump is left unresolved and a diagnostic is reported. The pass
 * never picks a fallback target.
 *
 * <p>Expressions and declarations are not entered: a jump cannot cross a function boundary.
 * Inactive conditional-compilation code is skipped as well.
 */
public final class JumpTargetResolver implements StmtPass {

  private static final Logger logger = Logger.getLogger(JumpTargetResolver.class.getName());

  static final DiagnosticType BREAK_OUTSIDE_LOOP =
      DiagnosticType.error(
          "JSC_BREAK_OUTSIDE_LOOP", "''break'' is only allowed inside a loop or switch");

  static final DiagnosticType CONTINUE_OUTSIDE_LOOP =
      DiagnosticType.error(
          "JSC_CONTINUE_OUTSIDE_LOOP", "''continue'' is only allowed inside a loop");

  static final DiagnosticType UNRESOLVED_LABEL =
      DiagnosticType.error("JSC_UNRESOLVED_LABEL", "use of unresolved label ''{0}''");

  static final DiagnosticType CONTINUE_NOT_LOOP =
      DiagnosticType.error(
          "JSC_CONTINUE_NOT_LOOP",
          "''continue'' cannot be used with label ''{0}'', which names a switch");

  static final DiagnosticType FALLTHROUGH_OUTSIDE_SWITCH =
      DiagnosticType.error(
          "JSC_FALLTHROUGH_OUTSIDE_SWITCH", "''fallthrough'' is only allowed inside a switch");

  static final DiagnosticType FALLTHROUGH_FROM_LAST_CASE =
      DiagnosticType.error(
          "JSC_FALLTHROUGH_FROM_LAST_CASE",
          "''fallthrough'' without a following ''case'' or ''default'' block");

  static final DiagnosticType FALLTHROUGH_INTO_BOUND_CASE =
      DiagnosticType.error(
          "JSC_FALLTHROUGH_INTO_BOUND_CASE",
          "''fallthrough'' cannot transfer control to a case label that declares variables");

  static final DiagnosticType LABEL_SHADOWED =
      DiagnosticType.warning(
          "JSC_LABEL_SHADOWED", "label ''{0}'' is already in use by an enclosing statement");

  /** Configuration for {@link JumpTargetResolver}. */
  @AutoValue
  public abstract static class Options {
    /** Whether to warn when a loop or switch reuses the label of an enclosing one. */
    public abstract boolean getReportShadowedLabels();

    public static Builder builder() {
      return new AutoValue_JumpTargetResolver_Options.Builder().setReportShadowedLabels(true);
    }

    public static Options defaults() {
      return builder().build();
    }

    /** Builder for {@link Options}. */
    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setReportShadowedLabels(boolean report);

      public abstract Options build();
    }
  }

  private final ErrorHandler errorHandler;
  private final Options options;

  // Innermost first.
  private final Deque<LabeledStmt> enclosingLabeled = new ArrayDeque<>();
  private final Deque<CaseScope> enclosingCases = new ArrayDeque<>();

  private int resolvedCount;
  private int unresolvedCount;

  public JumpTargetResolver(ErrorHandler errorHandler) {
    this(errorHandler, Options.defaults());
  }

  public JumpTargetResolver(ErrorHandler errorHandler, Options options) {
    this.errorHandler = checkNotNull(errorHandler);
    this.options = checkNotNull(options);
  }

  @Override
  public void process(Stmt root) {
    checkNotNull(root);
    enclosingLabeled.clear();
    enclosingCases.clear();
    resolvedCount = 0;
    unresolvedCount = 0;
    traverse(root, null);
    logger.fine(
        "Resolved " + resolvedCount + " jump(s), left " + unresolvedCount + " unresolved");
  }

  /** The number of jumps resolved by the last call to {@link #process}. */
  public int getResolvedCount() {
    return resolvedCount;
  }

  /** The number of jumps the last call to {@link #process} could not resolve. */
  public int getUnresolvedCount() {
    return unresolvedCount;
  }

  private void traverse(AstNode node, @Nullable Stmt parent) {
    if (!(node instanceof Stmt)) {
      return;
    }
    Stmt stmt = (Stmt) node;
    switch (stmt.getKind()) {
      case BREAK -> {
        visitBreak((BreakStmt) stmt);
        return;
      }
      case CONTINUE -> {
        visitContinue((ContinueStmt) stmt);
        return;
      }
      case FALLTHROUGH -> {
        visitFallthrough((FallthroughStmt) stmt);
        return;
      }
      case IF_CONFIG -> {
        Optional<Stmt> active = ((IfConfigStmt) stmt).getActiveStmt();
        if (active.isPresent()) {
          traverse(active.get(), stmt);
        }
        return;
      }
      case BRACE -> {
        if (((BraceStmt) stmt).isInactiveConfigBlock()) {
          return;
        }
      }
      default -> {}
    }

    boolean enteredLabeled = false;
    if (stmt.isLabeled()) {
      LabeledStmt labeled = (LabeledStmt) stmt;
      checkLabelShadowing(labeled);
      enclosingLabeled.push(labeled);
      enteredLabeled = true;
    }
    boolean enteredCase = false;
    if (stmt.isCase() && parent != null && parent.isSwitch()) {
      enclosingCases.push(new CaseScope((SwitchStmt) parent, (CaseStmt) stmt));
      enteredCase = true;
    }

    for (AstNode child : stmt.children()) {
      traverse(child, stmt);
    }

    if (enteredCase) {
      enclosingCases.pop();
    }
    if (enteredLabeled) {
      enclosingLabeled.pop();
    }
  }

  private void checkLabelShadowing(LabeledStmt labeled) {
    if (!options.getReportShadowedLabels() || !labeled.getLabelInfo().isPresent()) {
      return;
    }
    Identifier name = labeled.getLabelInfo().getName();
    if (findLabeled(name) != null) {
      report(
          LABEL_SHADOWED,
          labeled,
          labeled.getLabelInfo().getLoc(),
          name);
    }
  }

  private void visitBreak(BreakStmt breakStmt) {
    if (breakStmt.isTargetResolved()) {
      return;
    }
    Identifier name = breakStmt.getTargetName();
    if (!name.isEmpty()) {
      LabeledStmt target = findLabeled(name);
      if (target == null) {
        reportUnresolved(UNRESOLVED_LABEL, breakStmt, breakStmt.getTargetLoc(), name);
        return;
      }
      breakStmt.setTarget(target);
      resolvedCount++;
      return;
    }
    LabeledStmt target = enclosingLabeled.peek();
    if (target == null) {
      reportUnresolved(BREAK_OUTSIDE_LOOP, breakStmt, breakStmt.getLoc());
      return;
    }
    breakStmt.setTarget(target);
    resolvedCount++;
  }

  private void visitContinue(ContinueStmt continueStmt) {
    if (continueStmt.isTargetResolved()) {
      return;
    }
    Identifier name = continueStmt.getTargetName();
    if (!name.isEmpty()) {
      LabeledStmt target = findLabeled(name);
      if (target == null) {
        reportUnresolved(UNRESOLVED_LABEL, continueStmt, continueStmt.getTargetLoc(), name);
        return;
      }
      if (!target.isLoop()) {
        reportUnresolved(CONTINUE_NOT_LOOP, continueStmt, continueStmt.getTargetLoc(), name);
        return;
      }
      continueStmt.setTarget(target);
      resolvedCount++;
      return;
    }
    for (LabeledStmt candidate : enclosingLabeled) {
      if (candidate.isLoop()) {
        continueStmt.setTarget(candidate);
        resolvedCount++;
        return;
      }
    }
    reportUnresolved(CONTINUE_OUTSIDE_LOOP, continueStmt, continueStmt.getLoc());
  }

  private void visitFallthrough(FallthroughStmt fallthrough) {
    if (fallthrough.isTargetResolved()) {
      return;
    }
    CaseScope scope = enclosingCases.peek();
    if (scope == null) {
      reportUnresolved(FALLTHROUGH_OUTSIDE_SWITCH, fallthrough, fallthrough.getLoc());
      return;
    }
    Optional<CaseStmt> next = scope.switchStmt.getCaseAfter(scope.caseStmt);
    if (next.isEmpty()) {
      reportUnresolved(FALLTHROUGH_FROM_LAST_CASE, fallthrough, fallthrough.getLoc());
      return;
    }
    if (next.get().hasBoundDecls()) {
      reportUnresolved(FALLTHROUGH_INTO_BOUND_CASE, fallthrough, fallthrough.getLoc());
      return;
    }
    fallthrough.setFallthroughDest(next.get());
    resolvedCount++;
  }

  /** Scans outward for the innermost enclosing statement labeled {@code name}. */
  private @Nullable LabeledStmt findLabeled(Identifier name) {
    for (LabeledStmt candidate : enclosingLabeled) {
      if (candidate.getLabelInfo().getName().matches(name)) {
        return candidate;
      }
    }
    return null;
  }

  private void reportUnresolved(
      DiagnosticType type, Stmt stmt, SourceLoc loc, Object... arguments) {
    unresolvedCount++;
    report(type, stmt, loc, arguments);
  }

  private void report(DiagnosticType type, Stmt stmt, SourceLoc loc, Object... arguments) {
    Diagnostic diagnostic = Diagnostic.make(type, stmt, loc.or(stmt.getStartLoc()), arguments);
    errorHandler.report(type.level, diagnostic);
  }

  /** A case clause being visited, with the switch that owns it. */
  private static final class CaseScope {
    final SwitchStmt switchStmt;
    final CaseStmt caseStmt;

    CaseScope(SwitchStmt switchStmt, CaseStmt caseStmt) {
      this.switchStmt = switchStmt;
      this.caseStmt = caseStmt;
    }
  }
}
