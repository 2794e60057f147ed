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

package org.vhdlsema.analysis;

import org.jspecify.annotations.Nullable;

/**
 * The result of looking up a designator in a scope: either a single non-overloadable declaration
 * or a set of overloaded ones.
 */
public final class NamedEntities {
  private final @Nullable Declaration single;
  private final @Nullable OverloadedName overloaded;

  private NamedEntities(@Nullable Declaration single, @Nullable OverloadedName overloaded) {
    assert (single == null) != (overloaded == null);
    this.single = single;
    this.overloaded = overloaded;
  }

  static NamedEntities single(Declaration declaration) {
    return new NamedEntities(declaration, null);
  }

  static NamedEntities overloaded(OverloadedName overloaded) {
    return new NamedEntities(null, overloaded);
  }

  public boolean isOverloaded() {
    return overloaded != null;
  }

  /** Returns the declaration if this is not an overloaded name, otherwise null. */
  public @Nullable Declaration asSingle() {
    return single;
  }

  /** Returns the overloaded name, or null if this is a single declaration. */
  public @Nullable OverloadedName asOverloaded() {
    return overloaded;
  }

  /** Describes what was found, e.g. {@code signal 'clk'} or {@code overloaded name 'f'}. */
  public String describe() {
    if (overloaded != null) {
      return "overloaded name " + overloaded.designator.quoted();
    }
    return single.describe();
  }
}
