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

/** {@code architecture name of entity is declarations begin statements end;} */
public final class ArchitectureBody {
  public final Ident ident;
  public final Name.Simple entityName;
  public final ImmutableList<DeclarativeItem> declarations;
  public final ImmutableList<ConcurrentStatement> statements;

  public ArchitectureBody(
      Ident ident,
      Name.Simple entityName,
      List<DeclarativeItem> declarations,
      List<ConcurrentStatement> statements) {
    this.ident = ident;
    this.entityName = entityName;
    this.declarations = ImmutableList.copyOf(declarations);
    this.statements = ImmutableList.copyOf(statements);
  }
}
