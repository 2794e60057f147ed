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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** An append-only, ordered DiagnosticHandler. */
public final class DiagnosticList implements DiagnosticHandler {

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  @Override
  public void push(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
  }

  /** Returns a snapshot of the diagnostics pushed so far, in order. */
  public ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  /** Returns the messages of the diagnostics pushed so far, in order. */
  public ImmutableList<String> messages() {
    return diagnostics.stream().map(d -> d.message).collect(ImmutableList.toImmutableList());
  }

  public boolean isEmpty() {
    return diagnostics.isEmpty();
  }

  public int size() {
    return diagnostics.size();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    diagnostics.forEach(d -> sb.append(d).append('\n'));
    return sb.toString();
  }
}
