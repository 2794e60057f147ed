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
import org.vhdlsema.analysis.Declaration.Overloaded;
import org.vhdlsema.ast.Designator;

/** The overloaded declarations visible under one designator, before any filtering. */
public final class OverloadedName {
  public final Designator designator;
  private final ImmutableList<Overloaded> candidates;

  OverloadedName(Designator designator, ImmutableList<Overloaded> candidates) {
    assert !candidates.isEmpty();
    this.designator = designator;
    this.candidates = candidates;
  }

  public ImmutableList<Overloaded> candidates() {
    return candidates;
  }

  public int size() {
    return candidates.size();
  }
}
