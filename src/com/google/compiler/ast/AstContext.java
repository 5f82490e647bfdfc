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

import com.google.auto.value.AutoValue;
import com.google.common.collect.EnumMultiset;
import com.google.common.collect.Multiset;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Owns every statement built for one compilation and the storage behind them.
 *
 * <p>Nodes are never freed individually; they live exactly as long as the context. Container
 * statements ({@link BraceStmt}, {@link CaseStmt}, {@link SwitchStmt}) do not own a collection.
 * Their children are copied into one contiguous run of the context's trailing storage when the node
 * is created, and the node records only where that run starts and how long it is.
 *
 * <p>A context is not thread-safe. Build and resolve the tree from one thread.
 */
public final class AstContext {

  private static final Logger logger = Logger.getLogger(AstContext.class.getName());

  /** Configuration for an {@link AstContext}. */
  @AutoValue
  public abstract static class Options {

    public static final int DEFAULT_INITIAL_TRAILING_CAPACITY = 64;

    /** Number of reference slots reserved in trailing storage before the first growth. */
    public abstract int getInitialTrailingCapacity();

    /**
     * Whether {@link AstContext#getIdentifier} returns canonical instances. When off, each call
     * creates a new identifier and names must be compared with {@link Identifier#matches}.
     */
    public abstract boolean getInternIdentifiers();

    public static Builder builder() {
      return new AutoValue_AstContext_Options.Builder()
          .setInitialTrailingCapacity(DEFAULT_INITIAL_TRAILING_CAPACITY)
          .setInternIdentifiers(true);
    }

    public static Options defaults() {
      return builder().build();
    }

    public abstract Builder toBuilder();

    /** Builder for {@link Options}. */
    @AutoValue.Builder
    public abstract static class Builder {
      public abstract Builder setInitialTrailingCapacity(int capacity);

      public abstract Builder setInternIdentifiers(boolean intern);

      abstract Options autoBuild();

      public final Options build() {
        Options options = autoBuild();
        checkArgument(
            options.getInitialTrailingCapacity() > 0,
            "Initial trailing capacity must be positive: %s",
            options.getInitialTrailingCapacity());
        return options;
      }
    }
  }

  private final Options options;
  private final Map<String, Identifier> identifierTable = new HashMap<>();
  private final Multiset<StmtKind> allocatedKinds = EnumMultiset.create(StmtKind.class);

  private Object[] trailing;
  private int trailingSize;

  public AstContext() {
    this(Options.defaults());
  }

  public AstContext(Options options) {
    this.options = checkNotNull(options);
    this.trailing = new Object[options.getInitialTrailingCapacity()];
    logger.fine("Created AST context with options " + options);
  }

  public Options getOptions() {
    return options;
  }

  /** Returns the identifier for {@code text}, or {@link Identifier#empty()} for empty text. */
  public Identifier getIdentifier(String text) {
    checkNotNull(text);
    if (text.isEmpty()) {
      return Identifier.empty();
    }
    if (!options.getInternIdentifiers()) {
      return new Identifier(text);
    }
    return identifierTable.computeIfAbsent(text, Identifier::new);
  }

  /** Total number of statements created in this context. */
  public int getStmtCount() {
    return allocatedKinds.size();
  }

  /** Number of statements of the given kind created in this context. */
  public int getStmtCount(StmtKind kind) {
    return allocatedKinds.count(kind);
  }

  /** Number of trailing-storage slots in use by container statements. */
  public int getTrailingStorageSize() {
    return trailingSize;
  }

  /** Logs a one-line summary of what this context has allocated. */
  public void logStatistics() {
    logger.fine(
        "AST context holds "
            + getStmtCount()
            + " statements and "
            + trailingSize
            + " trailing slots: "
            + allocatedKinds);
  }

  @CanIgnoreReturnValue
  <T extends Stmt> T register(T stmt) {
    allocatedKinds.add(stmt.getKind());
    return stmt;
  }

  /**
   * Copies {@code elements} into a fresh contiguous run of trailing storage and returns the index
   * of its first slot. The run is never moved relative to other runs, resized or released.
   */
  int allocateTrailing(List<?> elements) {
    int count = elements.size();
    for (int i = 0; i < count; i++) {
      checkNotNull(elements.get(i), "Null child at index %s", i);
    }
    int start = trailingSize;
    ensureTrailingCapacity(start + count);
    for (Object element : elements) {
      trailing[trailingSize++] = element;
    }
    return start;
  }

  Object getTrailing(int index) {
    checkState(index < trailingSize, "Trailing index %s out of bounds", index);
    return trailing[index];
  }

  void setTrailing(int index, Object value) {
    checkState(index < trailingSize, "Trailing index %s out of bounds", index);
    trailing[index] = checkNotNull(value);
  }

  private void ensureTrailingCapacity(int required) {
    if (required <= trailing.length) {
      return;
    }
    int newCapacity = Math.max(required, trailing.length * 2);
    trailing = Arrays.copyOf(trailing, newCapacity);
  }
}
