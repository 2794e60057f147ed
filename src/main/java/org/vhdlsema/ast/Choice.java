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

import org.jspecify.annotations.Nullable;

/**
 * A choice in a case statement, case generate, or selected assignment: an expression, a discrete
 * range, or {@code others}. Exactly one of {@link #expression} and {@link #range} is non-null
 * unless the choice is {@code others}.
 */
public final class Choice {
  public final SrcPos pos;
  public final @Nullable Expression expression;
  public final @Nullable DiscreteRange range;

  private Choice(SrcPos pos, @Nullable Expression expression, @Nullable DiscreteRange range) {
    this.pos = pos;
    this.expression = expression;
    this.range = range;
  }

  public static Choice of(Expression expression) {
    return new Choice(expression.pos, expression, null);
  }

  public static Choice of(DiscreteRange range) {
    return new Choice(range.pos, null, range);
  }

  public static Choice others(SrcPos pos) {
    return new Choice(pos, null, null);
  }

  public boolean isOthers() {
    return expression == null && range == null;
  }
}
