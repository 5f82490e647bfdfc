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

import static java.util.Objects.requireNonNull;

import com.google.compiler.ast.SourceLoc;
import com.google.compiler.ast.Stmt;
import org.jspecify.annotations.Nullable;

/**
 * A user-facing problem found by an analysis pass.
 *
 * @param type the type of the diagnostic
 * @param description the formatted message
 * @param loc where to point the user; may be invalid for synthesized code
 * @param stmt the statement the diagnostic is about, if any
 */
public record Diagnostic(
    DiagnosticType type, String description, SourceLoc loc, @Nullable Stmt stmt) {
  public Diagnostic {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(loc, "loc");
  }

  /**
   * Creates a diagnostic about {@code stmt}, reported at {@code loc}.
   *
   * @param arguments arguments to be incorporated into the message
   */
  public static Diagnostic make(
      DiagnosticType type, Stmt stmt, SourceLoc loc, Object... arguments) {
    return new Diagnostic(type, type.format(arguments), loc, stmt);
  }

  /** Creates a diagnostic with no associated statement. */
  public static Diagnostic make(DiagnosticType type, SourceLoc loc, Object... arguments) {
    return new Diagnostic(type, type.format(arguments), loc, null);
  }

  public CheckLevel getDefaultLevel() {
    return type.level;
  }

  /** Formats this diagnostic as a single line, for logs. */
  public String format(CheckLevel level) {
    return level + " - [" + type.key + "] " + description + " at " + loc;
  }
}
