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
 * {@code configuration name of entity is for architecture end for; end configuration;}. Only the
 * configured entity matters to the analysis of instantiations.
 */
public final class ConfigurationDeclaration {
  public final Ident ident;
  public final Name entityName;

  public ConfigurationDeclaration(Ident ident, Name entityName) {
    this.ident = ident;
    this.entityName = entityName;
  }
}
