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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.analysis.Declaration.Label;
import org.vhdlsema.analysis.Declaration.LoopParameter;
import org.vhdlsema.analysis.Declaration.ObjectDecl;
import org.vhdlsema.analysis.Declaration.TypeDecl;
import org.vhdlsema.analysis.TargetAnalyzer.AssignmentType;
import org.vhdlsema.ast.Alternative;
import org.vhdlsema.ast.Conditional;
import org.vhdlsema.ast.Expression;
import org.vhdlsema.ast.Ident;
import org.vhdlsema.ast.Name;
import org.vhdlsema.ast.ObjectClass;
import org.vhdlsema.ast.SequentialStatement;
import org.vhdlsema.ast.SequentialStatement.Case;
import org.vhdlsema.ast.SequentialStatement.If;
import org.vhdlsema.ast.SequentialStatement.Loop;

/** Analyzes the statements of a process or subprogram body. */
final class SequentialAnalyzer {

  private final Analyzer analyzer;

  SequentialAnalyzer(Analyzer analyzer) {
    this.analyzer = analyzer;
  }

  /**
   * Analyzes a statement part in {@code scope}. All statement labels, including those of nested if,
   * case, and loop statements, are declared first so that {@code exit} and {@code next} can refer
   * to them.
   */
  void analyzeSequentialPart(
      Scope scope,
      SequentialRoot root,
      List<SequentialStatement> statements,
      DiagnosticHandler diagnostics) {
    defineLabels(scope, statements, diagnostics);
    analyzeStatements(scope, root, statements, diagnostics);
  }

  private void defineLabels(
      Scope scope, List<SequentialStatement> statements, DiagnosticHandler diagnostics) {
    for (SequentialStatement statement : statements) {
      Ident label = statement.label();
      if (label != null) {
        scope.add(
            analyzer.arena.define(id -> new Label(id, label.designator(), label.pos)),
            diagnostics);
      }
      if (statement instanceof If ifStatement) {
        for (Conditional<? extends List<SequentialStatement>> branch : ifStatement.conditionals) {
          defineLabels(scope, branch.item, diagnostics);
        }
        if (ifStatement.elseItem != null) {
          defineLabels(scope, ifStatement.elseItem, diagnostics);
        }
      } else if (statement instanceof Case caseStatement) {
        for (Alternative<? extends List<SequentialStatement>> alternative :
            caseStatement.alternatives) {
          defineLabels(scope, alternative.item, diagnostics);
        }
      } else if (statement instanceof Loop loop) {
        defineLabels(scope, loop.statements, diagnostics);
      }
    }
  }

  private void analyzeStatements(
      Scope scope,
      SequentialRoot root,
      List<SequentialStatement> statements,
      DiagnosticHandler diagnostics) {
    StatementVisitor visitor = new StatementVisitor(scope, root, diagnostics);
    for (SequentialStatement statement : statements) {
      statement.accept(visitor);
    }
  }

  /**
   * Checks that every name in a sensitivity list denotes a signal (or an element of one). Shared
   * with process statements.
   */
  void analyzeSensitivityList(Scope scope, List<Name> names, DiagnosticHandler diagnostics) {
    for (Name name : names) {
      Name.Call call = (name instanceof Name.Call c) ? c : null;
      TypeDecl type = signalType(scope, (call != null) ? call.prefix : name, diagnostics);
      if (call == null) {
        continue;
      }
      if (type != null && type.kind == TypeDecl.Kind.ARRAY) {
        analyzer.expressions.analyzeIndices(scope, type, call, diagnostics);
      } else {
        analyzer.associations.analyze(scope, call.arguments, diagnostics);
      }
    }
  }

  /** Resolves a signal name and returns its type; null if it is not a signal or has no type. */
  private @Nullable TypeDecl signalType(Scope scope, Name name, DiagnosticHandler diagnostics) {
    NamedEntities found = analyzer.expressions.resolveName(scope, name, diagnostics);
    if (found == null) {
      return null;
    }
    if (!(found.asSingle() instanceof ObjectDecl object)
        || object.objectClass != ObjectClass.SIGNAL) {
      diagnostics.push(
          Diagnostic.error(
              name.pos,
              "%s is not a signal and cannot be in a sensitivity list",
              found.describe()));
      return null;
    }
    return object.typeMark();
  }

  private final class StatementVisitor implements SequentialStatement.Visitor<Void> {
    final Scope scope;
    final SequentialRoot root;
    final DiagnosticHandler diagnostics;

    StatementVisitor(Scope scope, SequentialRoot root, DiagnosticHandler diagnostics) {
      this.scope = scope;
      this.root = root;
      this.diagnostics = diagnostics;
    }

    private void condition(@Nullable Expression condition) {
      if (condition != null) {
        analyzer.expressions.booleanExpr(scope, condition, diagnostics);
      }
    }

    private void typed(TypeDecl type, @Nullable Expression expr) {
      if (expr != null) {
        analyzer.expressions.analyzeWithTargetType(scope, type, expr, diagnostics);
      }
    }

    @Override
    public Void visitWait(SequentialStatement.Wait stmt) {
      analyzeSensitivityList(scope, stmt.sensitivity, diagnostics);
      condition(stmt.condition);
      typed(analyzer.std.time, stmt.timeout);
      return null;
    }

    @Override
    public Void visitAssert(SequentialStatement.Assert stmt) {
      condition(stmt.condition);
      typed(analyzer.std.string, stmt.report);
      typed(analyzer.std.severityLevel, stmt.severity);
      return null;
    }

    @Override
    public Void visitReport(SequentialStatement.Report stmt) {
      typed(analyzer.std.string, stmt.report);
      typed(analyzer.std.severityLevel, stmt.severity);
      return null;
    }

    @Override
    public Void visitVariableAssignment(SequentialStatement.VariableAssignment stmt) {
      analyzer.targets.analyzeExpressionAssignment(
          scope, stmt.target, AssignmentType.VARIABLE, stmt.rhs, diagnostics);
      return null;
    }

    @Override
    public Void visitSignalAssignment(SequentialStatement.SignalAssignment stmt) {
      analyzer.targets.analyzeWaveformAssignment(scope, stmt.target, stmt.rhs, diagnostics);
      return null;
    }

    @Override
    public Void visitSignalForceAssignment(SequentialStatement.SignalForceAssignment stmt) {
      analyzer.targets.analyzeExpressionAssignment(
          scope, stmt.target, AssignmentType.SIGNAL, stmt.rhs, diagnostics);
      return null;
    }

    @Override
    public Void visitSignalReleaseAssignment(SequentialStatement.SignalReleaseAssignment stmt) {
      analyzer.targets.resolveTarget(scope, stmt.target, AssignmentType.SIGNAL, diagnostics);
      return null;
    }

    @Override
    public Void visitProcedureCall(SequentialStatement.ProcedureCall stmt) {
      analyzer.expressions.analyzeProcedureCall(scope, stmt.call, diagnostics);
      return null;
    }

    @Override
    public Void visitIf(If stmt) {
      for (Conditional<? extends List<SequentialStatement>> branch : stmt.conditionals) {
        condition(branch.condition);
        analyzeStatements(scope, root, branch.item, diagnostics);
      }
      if (stmt.elseItem != null) {
        analyzeStatements(scope, root, stmt.elseItem, diagnostics);
      }
      return null;
    }

    @Override
    public Void visitCase(Case stmt) {
      TypeDecl type = analyzer.expressions.unambiguousType(scope, stmt.expression, diagnostics);
      for (Alternative<? extends List<SequentialStatement>> alternative : stmt.alternatives) {
        analyzer.ranges.analyzeChoices(scope, type, alternative.choices, diagnostics);
        analyzeStatements(scope, root, alternative.item, diagnostics);
      }
      return null;
    }

    @Override
    public Void visitLoop(Loop stmt) {
      Scope region = scope.nested();
      if (stmt.forIndex != null && stmt.forRange != null) {
        TypeDecl type = analyzer.ranges.discreteRangeType(scope, stmt.forRange, diagnostics);
        Ident index = stmt.forIndex;
        region.add(
            analyzer.arena.define(
                id -> new LoopParameter(id, index.designator(), index.pos, type)),
            diagnostics);
      } else {
        condition(stmt.whileCondition);
      }
      analyzeStatements(region, root, stmt.statements, diagnostics);
      return null;
    }

    @Override
    public Void visitNext(SequentialStatement.Next stmt) {
      loopLabel(stmt.loopLabel);
      condition(stmt.condition);
      return null;
    }

    @Override
    public Void visitExit(SequentialStatement.Exit stmt) {
      loopLabel(stmt.loopLabel);
      condition(stmt.condition);
      return null;
    }

    private void loopLabel(Name.@Nullable Simple label) {
      if (label == null) {
        return;
      }
      NamedEntities found = analyzer.expressions.resolveName(scope, label, diagnostics);
      if (found != null && !(found.asSingle() instanceof Label)) {
        diagnostics.push(
            Diagnostic.error(label.pos, "Expected loop label, got %s", found.describe()));
      }
    }

    @Override
    public Void visitReturn(SequentialStatement.Return stmt) {
      switch (root.kind) {
        case PROCESS ->
            diagnostics.push(Diagnostic.error(stmt.pos, "Cannot return from a process"));
        case PROCEDURE -> {
          if (stmt.expression != null) {
            diagnostics.push(Diagnostic.error(stmt.pos, "Procedures cannot return a value"));
          }
        }
        case FUNCTION -> {
          if (stmt.expression == null) {
            diagnostics.push(
                Diagnostic.error(stmt.pos, "Functions cannot return without a value"));
          } else {
            typed(checkNotNull(root.returnType()), stmt.expression);
          }
        }
        case UNKNOWN -> {
          if (stmt.expression != null) {
            analyzer.expressions.analyze(scope, stmt.expression, diagnostics);
          }
        }
      }
      return null;
    }

    @Override
    public Void visitNull(SequentialStatement.Null stmt) {
      return null;
    }
  }
}
