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

/** {@code entity name is generic (...); port (...); declarations [begin statements] end;} */
public final class EntityDeclaration {
  public final Ident ident;
  public final ImmutableList<InterfaceDeclaration> generics;
  public final ImmutableList<InterfaceDeclaration> ports;
  public final ImmutableList<DeclarativeItem> declarations;
  public final ImmutableList<ConcurrentStatement> statements;

  public EntityDeclaration(
      Ident ident,
      List<InterfaceDeclaration> generics,
      List<InterfaceDeclaration> ports,
      List<DeclarativeItem> declarations,
      List<ConcurrentStatement> statements) {
    this.ident = ident;
    this.generics = ImmutableList.copyOf(generics);
    this.ports = ImmutableList.copyOf(ports);
    this.declarations = ImmutableList.copyOf(declarations);
    this.statements = ImmutableList.copyOf(statements);
  }

  public EntityDeclaration(
      Ident ident, List<InterfaceDeclaration> generics, List<InterfaceDeclaration> ports) {
    this(ident, generics, ports, ImmutableList.of(), ImmutableList.of());
  }
}
