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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An error handler that logs errors and warnings using a logger in addition to collecting them in
 * memory. Errors are logged at the SEVERE level and warnings are logged at the WARNING level.
 */
public class LoggerErrorHandler extends DiagnosticCollector {
  private final Logger logger;

  public LoggerErrorHandler(Logger logger) {
    this.logger = checkNotNull(logger);
  }

  @Override
  public void report(CheckLevel level, Diagnostic diagnostic) {
    super.report(level, diagnostic);
    switch (level) {
      case ERROR -> logger.severe(diagnostic.format(level));
      case WARNING -> logger.warning(diagnostic.format(level));
      case OFF -> {}
    }
  }

  /** Logs the number of errors and warnings reported so far. */
  public void printSummary() {
    Level level = (getErrorCount() + getWarningCount() == 0) ? Level.INFO : Level.WARNING;
    logger.log(
        level,
        "{0} error(s), {1} warning(s)",
        new Object[] {getErrorCount(), getWarningCount()});
  }
}
