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

/**
 * The sink for diagnostics. Analysis only ever appends; a handler must preserve the order in which
 * diagnostics arrive.
 */
public interface DiagnosticHandler {

  void push(Diagnostic diagnostic);

  /** A handler that discards everything; used while trying out overload candidates. */
  DiagnosticHandler NULL = diagnostic -> {};
}
