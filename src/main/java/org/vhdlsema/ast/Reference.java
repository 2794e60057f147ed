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

import com.google.common.base.Preconditions;

/**
 * A mutable slot on a name node that records the declaration the name was resolved to.
 *
 * <p>Declarations are identified by their index in the analyzer's arena. A Reference starts out
 * unresolved and is set at most once to a single declaration; attempting to point an already-set
 * Reference at a different declaration is a bug in the analysis. Clearing is only done when a
 * speculative analysis pass is rolled back.
 */
public final class Reference {

  public static final int UNRESOLVED = -1;

  private int target = UNRESOLVED;

  public boolean isSet() {
    return target != UNRESOLVED;
  }

  /** Returns the arena index of the referenced declaration, or {@link #UNRESOLVED}. */
  public int get() {
    return target;
  }

  /** Points this reference at the declaration with the given arena index. */
  public void setUnique(int declarationId) {
    Preconditions.checkArgument(declarationId >= 0);
    Preconditions.checkState(
        target == UNRESOLVED || target == declarationId,
        "Reference already resolved to #%s, cannot rebind to #%s",
        target,
        declarationId);
    target = declarationId;
  }

  /** Restores a previous state; only used when undoing a speculative binding. */
  public void reset(int previous) {
    target = previous;
  }

  @Override
  public String toString() {
    return isSet() ? "#" + target : "(unresolved)";
  }
}
