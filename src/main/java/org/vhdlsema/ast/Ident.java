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

/** An identifier together with the position at which it was written. */
public final class Ident {
  public final String name;
  public final SrcPos pos;

  public Ident(String name, SrcPos pos) {
    this.name = name;
    this.pos = pos;
  }

  public Designator designator() {
    return Designator.identifier(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
