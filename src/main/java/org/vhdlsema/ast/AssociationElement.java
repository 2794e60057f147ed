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
 * An element of an association list (a port map, generic map, or subprogram call argument list):
 * {@code formal => actual} when {@code formal} is non-null, positional otherwise. A null {@code
 * actual} represents the keyword {@code open}.
 */
public final class AssociationElement {
  public final SrcPos pos;
  public final @Nullable Name formal;
  public final @Nullable Expression actual;

  public AssociationElement(SrcPos pos, @Nullable Name formal, @Nullable Expression actual) {
    this.pos = pos;
    this.formal = formal;
    this.actual = actual;
  }

  public static AssociationElement positional(Expression actual) {
    return new AssociationElement(actual.pos, null, actual);
  }

  public static AssociationElement named(Name formal, @Nullable Expression actual) {
    return new AssociationElement(formal.pos, formal, actual);
  }

  public boolean isOpen() {
    return actual == null;
  }

  public void forEachReference(Consumer<Reference> action) {
    if (formal != null) {
      formal.forEachReference(action);
    }
    if (actual != null) {
      actual.forEachReference(action);
    }
  }
}
