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
import java.util.Comparator;

/**
 * A position in a source file. Positions are compared by source name, then line, then column, so
 * that diagnostics and candidate lists can be presented in source order.
 */
public final class SrcPos implements Comparable<SrcPos> {

  private static final Comparator<SrcPos> ORDER =
      Comparator.comparing((SrcPos p) -> p.source)
          .thenComparingInt(p -> p.line)
          .thenComparingInt(p -> p.column);

  public final String source;
  public final int line;
  public final int column;

  public SrcPos(String source, int line, int column) {
    Preconditions.checkArgument(line >= 0 && column >= 0);
    this.source = Preconditions.checkNotNull(source);
    this.line = line;
    this.column = column;
  }

  /** Returns a position in the same source. */
  public SrcPos at(int line, int column) {
    return new SrcPos(source, line, column);
  }

  @Override
  public int compareTo(SrcPos other) {
    return ORDER.compare(this, other);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof SrcPos other
        && line == other.line
        && column == other.column
        && source.equals(other.source);
  }

  @Override
  public int hashCode() {
    return source.hashCode() * 31 * 31 + line * 31 + column;
  }

  @Override
  public String toString() {
    return String.format("%s:%s:%s", source, line, column);
  }
}
