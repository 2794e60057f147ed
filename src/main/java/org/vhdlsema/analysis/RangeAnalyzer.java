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

import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.analysis.Declaration.TypeDecl;
import org.vhdlsema.ast.Choice;
import org.vhdlsema.ast.DiscreteRange;
import org.vhdlsema.ast.Expression;

/** Analyzes discrete ranges (of loops, generates, and array indices) and case choices. */
final class RangeAnalyzer {

  private final Analyzer analyzer;

  RangeAnalyzer(Analyzer analyzer) {
    this.analyzer = analyzer;
  }

  /**
   * Returns the type of a discrete range, or null if it cannot be determined. A range whose bounds
   * are both of type universal_integer has type integer.
   */
  @Nullable TypeDecl discreteRangeType(
      Scope scope, DiscreteRange range, DiagnosticHandler diagnostics) {
    if (range instanceof DiscreteRange.Subtype subtype) {
      TypeDecl type = analyzer.expressions.typeMark(scope, subtype.typeMark, diagnostics);
      if (subtype.constraint != null) {
        analyzeRangeWithType(scope, subtype.constraint, type, diagnostics);
      }
      return type;
    }
    return rangeType(scope, (DiscreteRange.Range) range, diagnostics);
  }

  /** Determines the type of {@code left to right} from its bounds and checks both against it. */
  @Nullable TypeDecl rangeType(
      Scope scope, DiscreteRange.Range range, DiagnosticHandler diagnostics) {
    ExpressionAnalyzer expressions = analyzer.expressions;
    TypeDecl left = single(expressions.possibleTypes(scope, range.left));
    TypeDecl right = single(expressions.possibleTypes(scope, range.right));
    TypeDecl type;
    if (left == null && right == null) {
      // Each bound reports why it has no type.
      expressions.unambiguousType(scope, range.left, diagnostics);
      expressions.unambiguousType(scope, range.right, diagnostics);
      return null;
    } else if (left == null || right == null) {
      type = (left == null) ? right : left;
    } else if (!TypeDecl.isCompatible(left, right)) {
      diagnostics.push(
          Diagnostic.error(
              range.pos,
              "Range bounds have different types, %s and %s",
              left.describe(),
              right.describe()));
      expressions.analyzeWithTargetType(scope, left, range.left, diagnostics);
      expressions.analyzeWithTargetType(scope, right, range.right, diagnostics);
      return null;
    } else {
      type = left.isUniversal() ? right : left;
    }
    if (type.kind == TypeDecl.Kind.UNIVERSAL_INTEGER) {
      type = analyzer.std.integer;
    }
    analyzeRangeWithType(scope, range, type, diagnostics);
    return type;
  }

  /** Checks both bounds of {@code range} against {@code type}, or just resolves them if null. */
  void analyzeRangeWithType(
      Scope scope,
      DiscreteRange.Range range,
      @Nullable TypeDecl type,
      DiagnosticHandler diagnostics) {
    for (Expression bound : List.of(range.left, range.right)) {
      if (type == null) {
        analyzer.expressions.analyze(scope, bound, diagnostics);
      } else {
        analyzer.expressions.analyzeWithTargetType(scope, type, bound, diagnostics);
      }
    }
  }

  /**
   * Analyzes the choices of one alternative of a case statement, case generate, or selected
   * assignment against the selector's type (null if that is unknown).
   */
  void analyzeChoices(
      Scope scope, @Nullable TypeDecl type, List<Choice> choices, DiagnosticHandler diagnostics) {
    for (Choice choice : choices) {
      if (choice.expression != null) {
        if (type == null) {
          analyzer.expressions.analyze(scope, choice.expression, diagnostics);
        } else {
          analyzer.expressions.analyzeWithTargetType(scope, type, choice.expression, diagnostics);
        }
      } else if (choice.range instanceof DiscreteRange.Range range) {
        analyzeRangeWithType(scope, range, type, diagnostics);
      } else if (choice.range != null) {
        discreteRangeType(scope, choice.range, diagnostics);
      }
    }
  }

  private static @Nullable TypeDecl single(@Nullable ImmutableSet<TypeDecl> types) {
    return (types != null && types.size() == 1) ? types.iterator().next() : null;
  }
}
