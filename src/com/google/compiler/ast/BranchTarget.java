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

import com.google.common.base.MoreObjects;
import org.jspecify.annotations.Nullable;

/**
 * The destination of a jump statement.
 *
 * <p>The parser only knows the name written after {@code break} or {@code continue} (possibly
 * empty) and where it was written. A later pass finds the statement that the jump refers to and
 * replaces the unresolved value with a resolved one. The transition happens exactly once:
 *
 * <ul>
 *   <li>{@link #get()} on an unresolved target throws {@link IllegalStateException};
 *   <li>{@link #resolveTo} on a resolved target throws {@link IllegalStateException}.
 * </ul>
 *
 * <p>Instances are immutable. The owning statement holds the current state and swaps it on
 * resolution.
 *
 * @param <T> the kind of statement this target can refer to
 */
public abstract class BranchTarget<T extends Stmt> {

  private final Identifier name;
  private final SourceLoc nameLoc;

  private BranchTarget(Identifier name, SourceLoc nameLoc) {
    this.name = checkNotNull(name);
    this.nameLoc = checkNotNull(nameLoc);
  }

  public static <T extends Stmt> BranchTarget<T> unresolved(Identifier name, SourceLoc nameLoc) {
    return new Unresolved<>(name, nameLoc);
  }

  /** The name written in source, or the empty identifier for an unlabeled jump. */
  public final Identifier getName() {
    return name;
  }

  public final SourceLoc getNameLoc() {
    return nameLoc;
  }

  public final boolean hasName() {
    return !name.isEmpty();
  }

  public abstract boolean isResolved();

  /** Returns the target statement. Only valid once resolved. */
  public abstract T get();

  /** Returns the target statement, or null if not yet resolved. */
  public abstract @Nullable T getIfResolved();

  /** Returns the resolved state pointing at {@code target}. Only valid while unresolved. */
  public abstract BranchTarget<T> resolveTo(T target);

  private static final class Unresolved<T extends Stmt> extends BranchTarget<T> {
    Unresolved(Identifier name, SourceLoc nameLoc) {
      super(name, nameLoc);
    }

    @Override
    public boolean isResolved() {
      return false;
    }

    @Override
    public T get() {
      throw new IllegalStateException("Jump target '" + getName() + "' is not resolved yet");
    }

    @Override
    public @Nullable T getIfResolved() {
      return null;
    }

    @Override
    public BranchTarget<T> resolveTo(T target) {
      return new Resolved<>(getName(), getNameLoc(), checkNotNull(target));
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper("Unresolved").add("name", getName()).toString();
    }
  }

  private static final class Resolved<T extends Stmt> extends BranchTarget<T> {
    private final T target;

    Resolved(Identifier name, SourceLoc nameLoc, T target) {
      super(name, nameLoc);
      this.target = target;
    }

    @Override
    public boolean isResolved() {
      return true;
    }

    @Override
    public T get() {
      return target;
    }

    @Override
    public T getIfResolved() {
      return target;
    }

    @Override
    public BranchTarget<T> resolveTo(T newTarget) {
      throw new IllegalStateException("Jump target already resolved to " + target);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper("Resolved")
          .add("name", getName())
          .add("target", target.getKind().getKindName())
          .toString();
    }
  }
}
