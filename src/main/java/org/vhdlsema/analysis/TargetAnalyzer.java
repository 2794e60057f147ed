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

import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.analysis.Declaration.ObjectDecl;
import org.vhdlsema.analysis.Declaration.TypeDecl;
import org.vhdlsema.ast.Alternative;
import org.vhdlsema.ast.AssignmentRhs;
import org.vhdlsema.ast.Conditional;
import org.vhdlsema.ast.Expression;
import org.vhdlsema.ast.Mode;
import org.vhdlsema.ast.Name;
import org.vhdlsema.ast.ObjectClass;
import org.vhdlsema.ast.Waveform;

/** Analyzes the targets and right-hand sides of variable and signal assignments. */
final class TargetAnalyzer {

  enum AssignmentType {
    SIGNAL,
    VARIABLE;

    String describe() {
      return name().toLowerCase();
    }

    boolean accepts(ObjectClass objectClass) {
      return switch (this) {
        case SIGNAL -> objectClass == ObjectClass.SIGNAL;
        case VARIABLE ->
            objectClass == ObjectClass.VARIABLE || objectClass == ObjectClass.SHARED_VARIABLE;
      };
    }
  }

  private final Analyzer analyzer;

  TargetAnalyzer(Analyzer analyzer) {
    this.analyzer = analyzer;
  }

  /**
   * Resolves the target of an assignment and returns its type, or null if it is not a valid target
   * or its type is unknown.
   */
  @Nullable TypeDecl resolveTarget(
      Scope scope, Name target, AssignmentType assignmentType, DiagnosticHandler diagnostics) {
    if (target instanceof Name.Call call) {
      // An indexed target assigns one element.
      TypeDecl arrayType = resolveTarget(scope, call.prefix, assignmentType, diagnostics);
      if (arrayType == null) {
        analyzer.associations.analyze(scope, call.arguments, diagnostics);
        return null;
      } else if (arrayType.kind != TypeDecl.Kind.ARRAY) {
        diagnostics.push(Diagnostic.error(call.pos, "%s cannot be indexed", arrayType.describe()));
        analyzer.associations.analyze(scope, call.arguments, diagnostics);
        return null;
      }
      analyzer.expressions.analyzeIndices(scope, arrayType, call, diagnostics);
      return arrayType.elementType();
    }
    NamedEntities found = analyzer.expressions.resolveName(scope, target, diagnostics);
    if (found == null) {
      return null;
    }
    if (!(found.asSingle() instanceof ObjectDecl object)
        || !assignmentType.accepts(object.objectClass)) {
      diagnostics.push(
          Diagnostic.error(
              target.pos,
              "%s is not a valid target for %s assignment",
              found.describe(),
              assignmentType.describe()));
      return null;
    }
    if (object.mode == Mode.IN) {
      diagnostics.push(
          Diagnostic.error(
              target.pos, "%s may not be the target of an assignment", object.describe()));
      return null;
    }
    return object.typeMark();
  }

  /** Analyzes {@code target <= rhs}, sequential or concurrent. */
  void analyzeWaveformAssignment(
      Scope scope, Name target, AssignmentRhs<Waveform> rhs, DiagnosticHandler diagnostics) {
    TypeDecl type = resolveTarget(scope, target, AssignmentType.SIGNAL, diagnostics);
    analyzeRhs(
        scope, rhs, diagnostics, waveform -> analyzeWaveform(scope, type, waveform, diagnostics));
  }

  /** Analyzes {@code target := rhs} or {@code target <= force rhs}. */
  void analyzeExpressionAssignment(
      Scope scope,
      Name target,
      AssignmentType assignmentType,
      AssignmentRhs<Expression> rhs,
      DiagnosticHandler diagnostics) {
    TypeDecl type = resolveTarget(scope, target, assignmentType, diagnostics);
    analyzeRhs(scope, rhs, diagnostics, value -> analyzeValue(scope, type, value, diagnostics));
  }

  void analyzeWaveform(
      Scope scope, @Nullable TypeDecl type, Waveform waveform, DiagnosticHandler diagnostics) {
    for (Waveform.Element element : waveform.elements) {
      analyzeValue(scope, type, element.value, diagnostics);
      if (element.after != null) {
        analyzer.expressions.analyzeWithTargetType(
            scope, analyzer.std.time, element.after, diagnostics);
      }
    }
  }

  private void analyzeValue(
      Scope scope, @Nullable TypeDecl type, Expression value, DiagnosticHandler diagnostics) {
    if (type == null) {
      analyzer.expressions.analyze(scope, value, diagnostics);
    } else {
      analyzer.expressions.analyzeWithTargetType(scope, type, value, diagnostics);
    }
  }

  private <T> void analyzeRhs(
      Scope scope,
      AssignmentRhs<T> rhs,
      DiagnosticHandler diagnostics,
      Consumer<T> item) {
    if (rhs instanceof AssignmentRhs.Simple<T> simple) {
      item.accept(simple.item);
    } else if (rhs instanceof AssignmentRhs.WhenElse<T> whenElse) {
      for (Conditional<T> conditional : whenElse.conditionals) {
        item.accept(conditional.item);
        analyzer.expressions.booleanExpr(scope, conditional.condition, diagnostics);
      }
      if (whenElse.elseItem != null) {
        item.accept(whenElse.elseItem);
      }
    } else {
      AssignmentRhs.Select<T> select = (AssignmentRhs.Select<T>) rhs;
      TypeDecl selectorType =
          analyzer.expressions.unambiguousType(scope, select.selector, diagnostics);
      for (Alternative<T> alternative : select.alternatives) {
        analyzer.ranges.analyzeChoices(scope, selectorType, alternative.choices, diagnostics);
        item.accept(alternative.item);
      }
    }
  }
}
