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
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.AbstractList;
import java.util.List;
import java.util.RandomAccess;

/**
 * A fixed-size window onto one run of an {@link AstContext}'s trailing storage.
 *
 * <p>Elements may be replaced in place; {@code add} and {@code remove} are unsupported because a
 * container never changes arity after creation.
 */
final class TrailingElements<E> extends AbstractList<E> implements RandomAccess {

  private final AstContext context;
  private final Class<E> elementType;
  private final int start;
  private final int count;

  private TrailingElements(AstContext context, Class<E> elementType, int start, int count) {
    this.context = context;
    this.elementType = elementType;
    this.start = start;
    this.count = count;
  }

  /** Copies {@code elements} into {@code context} and returns a window onto the copy. */
  static <E> TrailingElements<E> allocate(
      AstContext context, Class<E> elementType, List<? extends E> elements) {
    checkNotNull(context);
    for (Object element : elements) {
      checkNotNull(element, "Null element in %s", elements);
      checkArgument(
          elementType.isInstance(element),
          "%s is not a %s",
          element,
          elementType.getSimpleName());
    }
    int start = context.allocateTrailing(elements);
    return new TrailingElements<>(context, elementType, start, elements.size());
  }

  @Override
  public E get(int index) {
    checkElementIndex(index, count);
    return elementType.cast(context.getTrailing(start + index));
  }

  @Override
  public E set(int index, E element) {
    checkElementIndex(index, count);
    checkNotNull(element);
    E old = get(index);
    context.setTrailing(start + index, elementType.cast(element));
    return old;
  }

  @Override
  public int size() {
    return count;
  }
}
