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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * An error handler that keeps every diagnostic reported at {@link CheckLevel#ERROR} or {@link
 * CheckLevel#WARNING}, in report order. Diagnostics reported at {@link CheckLevel#OFF} are
 * dropped.
 */
public class DiagnosticCollector implements ErrorHandler {

  private final List<Diagnostic> errors = new ArrayList<>();
  private final List<Diagnostic> warnings = new ArrayList<>();

  @Override
  public void report(CheckLevel level, Diagnostic diagnostic) {
    checkNotNull(diagnostic);
    switch (level) {
      case ERROR -> errors.add(diagnostic);
      case WARNING -> warnings.add(diagnostic);
      case OFF -> {}
    }
  }

  public ImmutableList<Diagnostic> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  public ImmutableList<Diagnostic> getWarnings() {
    return ImmutableList.copyOf(warnings);
  }

  public int getErrorCount() {
    return errors.size();
  }

  public int getWarningCount() {
    return warnings.size();
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
