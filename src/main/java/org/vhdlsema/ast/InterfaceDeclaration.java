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
 * An element of a generic clause, port clause, or subprogram parameter list, e.g. {@code signal
 * clk : in bit} or {@code constant width : natural := 8}. File interface objects have a null mode.
 */
public final class InterfaceDeclaration {
  public final ObjectClass objectClass;
  public final Ident ident;
  public final @Nullable Mode mode;
  public final SubtypeIndication subtype;
  public final @Nullable Expression defaultValue;

  public InterfaceDeclaration(
      ObjectClass objectClass,
      Ident ident,
      @Nullable Mode mode,
      SubtypeIndication subtype,
      @Nullable Expression defaultValue) {
    this.objectClass = objectClass;
    this.ident = ident;
    this.mode = (objectClass == ObjectClass.FILE || mode != null) ? mode : Mode.IN;
    this.subtype = subtype;
    this.defaultValue = defaultValue;
  }
}
