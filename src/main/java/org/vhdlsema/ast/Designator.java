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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;

/**
 * The name by which a declaration is referred to: an identifier, an operator symbol, or a
 * character literal.
 *
 * <p>Identifiers and operator symbols are case-insensitive and are stored in lower case; character
 * literals are case-sensitive.
 */
public final class Designator {

  public enum Kind {
    IDENTIFIER,
    OPERATOR,
    CHARACTER
  }

  public final Kind kind;

  /**
   * The normalized text: the identifier or operator without quotes, or the single character of a
   * character literal.
   */
  public final String text;

  private Designator(Kind kind, String text) {
    this.kind = kind;
    this.text = text;
  }

  public static Designator identifier(String name) {
    Preconditions.checkArgument(!name.isEmpty());
    return new Designator(Kind.IDENTIFIER, Ascii.toLowerCase(name));
  }

  /** Returns the designator for an operator symbol such as {@code "+"} or {@code "and"}. */
  public static Designator operator(String symbol) {
    Preconditions.checkArgument(!symbol.isEmpty());
    return new Designator(Kind.OPERATOR, Ascii.toLowerCase(symbol));
  }

  public static Designator character(char c) {
    return new Designator(Kind.CHARACTER, String.valueOf(c));
  }

  /**
   * Returns this designator quoted the way it is written in diagnostics: {@code 'x'} for
   * identifiers and character literals, {@code "+"} for operators.
   */
  public String quoted() {
    return (kind == Kind.OPERATOR) ? "\"" + text + "\"" : "'" + text + "'";
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Designator other && kind == other.kind && text.equals(other.text);
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + text.hashCode();
  }

  @Override
  public String toString() {
    return switch (kind) {
      case IDENTIFIER -> text;
      case OPERATOR -> "\"" + text + "\"";
      case CHARACTER -> "'" + text + "'";
    };
  }
}
