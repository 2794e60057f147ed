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

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.ast.Reference;

/**
 * Owns every declaration created during an analysis and hands out their ids. AST references hold
 * ids rather than pointers, so they stay valid and acyclic for as long as the arena lives.
 */
public final class Arena {

  private final List<Declaration> declarations = new ArrayList<>();

  /** Calls {@code factory} with the next free id and records the result under that id. */
  <T extends Declaration> T define(IntFunction<T> factory) {
    int id = declarations.size();
    T declaration = factory.apply(id);
    assert declaration.id == id;
    declarations.add(declaration);
    return declaration;
  }

  public Declaration get(int id) {
    return declarations.get(id);
  }

  /** Returns the declaration the given reference points at, or null if it is unresolved. */
  public @Nullable Declaration get(Reference reference) {
    return reference.isSet() ? declarations.get(reference.get()) : null;
  }

  public int size() {
    return declarations.size();
  }
}
