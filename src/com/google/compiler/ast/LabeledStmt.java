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

/**
 * Common base of the statements a {@code break} can leave: the loops and {@code switch}. Each may
 * carry a {@link LabelInfo}.
 */
public abstract class LabeledStmt extends Stmt {

  private LabelInfo labelInfo;

  LabeledStmt(StmtKind kind, boolean implicit, LabelInfo labelInfo) {
    super(kind, implicit);
    checkArgument(kind.isLabeled(), "%s is not a labeled statement kind", kind);
    this.labelInfo = checkNotNull(labelInfo);
  }

  public final LabelInfo getLabelInfo() {
    return labelInfo;
  }

  public final void setLabelInfo(LabelInfo labelInfo) {
    this.labelInfo = checkNotNull(labelInfo);
  }

  /** Where a source range starting at this statement begins: the label if present. */
  final SourceLoc getLabelLocOrKeywordLoc(SourceLoc keywordLoc) {
    return labelInfo.isPresent() ? labelInfo.getLoc() : keywordLoc;
  }
}
