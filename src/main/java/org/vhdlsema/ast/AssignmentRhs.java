/*
 * Copyright 2025 The Retrospect Authors
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

package org.vhdlsema.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The right-hand side of an assignment, where {@code T} is {@link Waveform} for signal assignments
 * and {@link Expression} for variable and force assignments.
 */
public abstract class AssignmentRhs<T> {

  AssignmentRhs() {}

  /** {@code target <= item;} */
  public static final class Simple<T> extends AssignmentRhs<T> {
    public final T item;

    public Simple(T item) {
      this.item = item;
    }
  }

  /** {@code target <= a when c1 else b when c2 else c;} */
  public static final class WhenElse<T> extends AssignmentRhs<T> {
    public final ImmutableList<Conditional<T>> conditionals;
    public final @Nullable T elseItem;

    public WhenElse(List<Conditional<T>> conditionals, @Nullable T elseItem) {
      this.conditionals = ImmutableList.copyOf(conditionals);
      this.elseItem = elseItem;
    }
  }

  /** {@code with selector select target <= a when c1, b when others;} */
  public static final class Select<T> extends AssignmentRhs<T> {
    public final Expression selector;
    public final ImmutableList<Alternative<T>> alternatives;

    public Select(Expression selector, List<Alternative<T>> alternatives) {
      this.selector = selector;
      this.alternatives = ImmutableList.copyOf(alternatives);
    }
  }
}
