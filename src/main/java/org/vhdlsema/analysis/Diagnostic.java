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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import org.vhdlsema.ast.SrcPos;

/**
 * A problem found during analysis, with optional related positions (e.g. the candidates considered
 * when resolving an overloaded call).
 */
public final class Diagnostic {

  public enum Severity {
    ERROR,
    WARNING
  }

  /** A secondary position attached to a diagnostic, e.g. "Might be function f[...]". */
  public static final class Related {
    public final SrcPos pos;
    public final String message;

    Related(SrcPos pos, String message) {
      this.pos = pos;
      this.message = message;
    }

    @Override
    public String toString() {
      return pos + ": " + message;
    }
  }

  public final SrcPos pos;
  public final String message;
  public final Severity severity;
  private final List<Related> related = new ArrayList<>();

  public Diagnostic(SrcPos pos, String message, Severity severity) {
    this.pos = pos;
    this.message = message;
    this.severity = severity;
  }

  public static Diagnostic error(SrcPos pos, String message) {
    return new Diagnostic(pos, message, Severity.ERROR);
  }

  @FormatMethod
  public static Diagnostic error(SrcPos pos, String fmt, Object... fmtArgs) {
    return error(pos, String.format(fmt, fmtArgs));
  }

  /** Returns the related positions in the order they were added. */
  public ImmutableList<Related> related() {
    return ImmutableList.copyOf(related);
  }

  @CanIgnoreReturnValue
  public Diagnostic addRelated(SrcPos pos, String message) {
    related.add(new Related(pos, message));
    return this;
  }

  /**
   * Adds one related entry per candidate, in declaration order, each described as {@code prefix}
   * followed by the candidate's description (e.g. "Might be function f[integer return bit]").
   */
  @CanIgnoreReturnValue
  Diagnostic addCandidates(String prefix, Collection<? extends Declaration> candidates) {
    candidates.stream()
        .sorted(Comparator.comparingInt(d -> d.id))
        .forEach(d -> addRelated(d.pos, prefix + " " + d.describe()));
    return this;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(severity == Severity.ERROR ? "error" : "warning")
        .append(": ")
        .append(message)
        .append(" (")
        .append(pos)
        .append(")");
    related.forEach(r -> sb.append("\n  ").append(r));
    return sb.toString();
  }
}
