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

/**
 * The right-hand side of a signal assignment: a list of values each with an optional {@code after}
 * delay, or the keyword {@code unaffected} (represented by an empty element list).
 */
public final class Waveform {

  /** {@code value [after delay]}. */
  public static final class Element {
    public final Expression value;
    public final @Nullable Expression after;

    public Element(Expression value, @Nullable Expression after) {
      this.value = value;
      this.after = after;
    }
  }

  public final ImmutableList<Element> elements;

  public Waveform(List<Element> elements) {
    this.elements = ImmutableList.copyOf(elements);
  }

  public static Waveform of(Expression value) {
    return new Waveform(ImmutableList.of(new Element(value, null)));
  }

  public static Waveform unaffected() {
    return new Waveform(ImmutableList.of());
  }

  public boolean isUnaffected() {
    return elements.isEmpty();
  }
}
