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

/**
 * Any element that can appear in a {@link BraceStmt}: a statement, a declaration or an expression.
 * Patterns are also AST nodes so that {@link Stmt#children()} can list them.
 */
public interface AstNode {

  SourceRange getSourceRange();

  default SourceLoc getStartLoc() {
    return getSourceRange().getStart();
  }

  default SourceLoc getEndLoc() {
    return getSourceRange().getEnd();
  }
}
