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

import com.google.errorprone.annotations.Immutable;

/**
 * A name in the program, usually interned by an {@link AstContext}.
 *
 * <p>Identifiers handed out by the same interning context are canonical and may be compared with
 * {@code ==}. {@link #matches} compares by text and works across contexts.
 */
@Immutable
public final class Identifier {

  private static final Identifier EMPTY = new Identifier("");

  private final String str;

  Identifier(String str) {
    this.str = checkNotNull(str);
  }

  /** The identifier with no text, used wherever a name is absent. */
  public static Identifier empty() {
    return EMPTY;
  }

  public String str() {
    return str;
  }

  public boolean isEmpty() {
    return str.isEmpty();
  }

  public boolean matches(Identifier other) {
    return this == other || str.equals(other.str);
  }

  @Override
  public String toString() {
    return str;
  }
}
