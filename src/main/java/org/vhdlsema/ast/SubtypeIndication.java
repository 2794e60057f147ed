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

/** A type mark with an optional range constraint, e.g. {@code integer range 0 to 15}. */
public final class SubtypeIndication {
  public final Name typeMark;
  public final DiscreteRange.@Nullable Range constraint;

  public SubtypeIndication(Name typeMark, DiscreteRange.@Nullable Range constraint) {
    this.typeMark = typeMark;
    this.constraint = constraint;
  }

  public SubtypeIndication(Name typeMark) {
    this(typeMark, null);
  }
}
