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

/**
 * An item guarded by a condition: an {@code if}/{@code elsif} branch, an if-generate branch, or a
 * {@code when ... else} alternative of a conditional assignment.
 */
public final class Conditional<T> {
  public final Expression condition;
  public final T item;

  public Conditional(Expression condition, T item) {
    this.condition = condition;
    this.item = item;
  }
}
