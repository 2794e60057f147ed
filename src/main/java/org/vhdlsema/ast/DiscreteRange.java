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

import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * A discrete range: either an explicit range {@code left to right} / {@code left downto right}, or
 * a type mark optionally constrained by an explicit range.
 */
public abstract class DiscreteRange {

  public enum Direction {
    TO,
    DOWNTO
  }

  public final SrcPos pos;

  DiscreteRange(SrcPos pos) {
    this.pos = pos;
  }

  public abstract void forEachReference(Consumer<Reference> action);

  /** {@code left to right} or {@code left downto right}. */
  public static final class Range extends DiscreteRange {
    public final Expression left;
    public final Direction direction;
    public final Expression right;

    public Range(Expression left, Direction direction, Expression right) {
      super(left.pos);
      this.left = left;
      this.direction = direction;
      this.right = right;
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {
      left.forEachReference(action);
      right.forEachReference(action);
    }
  }

  /**
   * A subtype used as a range, e.g. {@code natural} or {@code integer range 0 to 7}. When used as
   * the index of an array type declaration a null constraint means {@code natural range <>}.
   */
  public static final class Subtype extends DiscreteRange {
    public final Name typeMark;
    public final @Nullable Range constraint;

    public Subtype(Name typeMark, @Nullable Range constraint) {
      super(typeMark.pos);
      this.typeMark = typeMark;
      this.constraint = constraint;
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {
      typeMark.forEachReference(action);
      if (constraint != null) {
        constraint.forEachReference(action);
      }
    }
  }
}
