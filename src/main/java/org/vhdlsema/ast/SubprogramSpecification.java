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

/** The specification of a function or procedure; functions have a non-null return type. */
public final class SubprogramSpecification {
  public final SrcPos pos;
  public final Designator designator;
  public final ImmutableList<InterfaceDeclaration> parameters;
  public final @Nullable Name returnType;

  public SubprogramSpecification(
      SrcPos pos,
      Designator designator,
      List<InterfaceDeclaration> parameters,
      @Nullable Name returnType) {
    this.pos = pos;
    this.designator = designator;
    this.parameters = ImmutableList.copyOf(parameters);
    this.returnType = returnType;
  }

  public boolean isFunction() {
    return returnType != null;
  }
}
