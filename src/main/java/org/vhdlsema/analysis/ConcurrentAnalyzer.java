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

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.analysis.Declaration.DesignUnit;
import org.vhdlsema.analysis.Declaration.Label;
import org.vhdlsema.analysis.Declaration.LoopParameter;
import org.vhdlsema.analysis.Declaration.TypeDecl;
import org.vhdlsema.ast.Alternative;
import org.vhdlsema.ast.ConcurrentStatement;
import org.vhdlsema.ast.ConcurrentStatement.Block;
import org.vhdlsema.ast.ConcurrentStatement.Instance;
import org.vhdlsema.ast.Conditional;
import org.vhdlsema.ast.GenerateBody;
import org.vhdlsema.ast.Ident;

/**
 * Analyzes the statements of an architecture, block, or generate body. Blocks, processes, and
 * generate bodies get a region of their own, nested in the region of the enclosing statement
 * part.
 */
final class ConcurrentAnalyzer {

  private final Analyzer analyzer;

  ConcurrentAnalyzer(Analyzer analyzer) {
    this.analyzer = analyzer;
  }

  /**
   * Analyzes a concurrent statement part in {@code scope}. The labels of all the statements are
   * declared in {@code scope} before any statement is analyzed.
   */
  void analyzeConcurrentPart(
      Scope scope, List<ConcurrentStatement> statements, DiagnosticHandler diagnostics) {
    for (ConcurrentStatement statement : statements) {
      defineLabel(scope, statement.label(), diagnostics);
    }
    StatementVisitor visitor = new StatementVisitor(scope, diagnostics);
    for (ConcurrentStatement statement : statements) {
      statement.accept(visitor);
    }
  }

  private void defineLabel(Scope scope, @Nullable Ident label, DiagnosticHandler diagnostics) {
    if (label != null) {
      scope.add(
          analyzer.arena.define(id -> new Label(id, label.designator(), label.pos)), diagnostics);
    }
  }

  /** Analyzes a generate body in {@code region}, which is already nested in the enclosing scope. */
  private void analyzeGenerateBody(
      Scope region, GenerateBody body, DiagnosticHandler diagnostics) {
    defineLabel(region, body.alternativeLabel, diagnostics);
    analyzer.declarations.analyzeDeclarativePart(region, body.declarations, diagnostics);
    analyzeConcurrentPart(region, body.statements, diagnostics);
  }

  private final class StatementVisitor implements ConcurrentStatement.Visitor<Void> {
    final Scope scope;
    final DiagnosticHandler diagnostics;

    StatementVisitor(Scope scope, DiagnosticHandler diagnostics) {
      this.scope = scope;
      this.diagnostics = diagnostics;
    }

    @Override
    public Void visitBlock(Block stmt) {
      if (stmt.guardCondition != null) {
        analyzer.expressions.booleanExpr(scope, stmt.guardCondition, diagnostics);
      }
      Scope region = scope.nested();
      if (stmt.genericClause != null) {
        FormalRegion generics =
            analyzer.declarations.analyzeInterfaceList(
                region, FormalRegion.Kind.GENERIC, stmt.genericClause, diagnostics);
        if (stmt.genericMap != null) {
          // The actuals come from the enclosing region.
          analyzer.associations.analyzeWithFormalRegion(
              scope, stmt.pos, generics, stmt.genericMap, diagnostics);
        }
      }
      if (stmt.portClause != null) {
        FormalRegion ports =
            analyzer.declarations.analyzeInterfaceList(
                region, FormalRegion.Kind.PORT, stmt.portClause, diagnostics);
        if (stmt.portMap != null) {
          analyzer.associations.analyzeWithFormalRegion(
              scope, stmt.pos, ports, stmt.portMap, diagnostics);
        }
      }
      analyzer.declarations.analyzeDeclarativePart(region, stmt.declarations, diagnostics);
      analyzeConcurrentPart(region, stmt.statements, diagnostics);
      return null;
    }

    @Override
    public Void visitProcess(ConcurrentStatement.Process stmt) {
      if (!stmt.sensitivityAll) {
        analyzer.sequential.analyzeSensitivityList(scope, stmt.sensitivity, diagnostics);
      }
      Scope region = scope.nested();
      analyzer.declarations.analyzeDeclarativePart(region, stmt.declarations, diagnostics);
      analyzer.sequential.analyzeSequentialPart(
          region, SequentialRoot.PROCESS, stmt.statements, diagnostics);
      return null;
    }

    @Override
    public Void visitForGenerate(ConcurrentStatement.ForGenerate stmt) {
      TypeDecl type = analyzer.ranges.discreteRangeType(scope, stmt.range, diagnostics);
      Scope region = scope.nested();
      region.add(
          analyzer.arena.define(
              id -> new LoopParameter(id, stmt.index.designator(), stmt.index.pos, type)),
          diagnostics);
      analyzeGenerateBody(region, stmt.body, diagnostics);
      return null;
    }

    @Override
    public Void visitIfGenerate(ConcurrentStatement.IfGenerate stmt) {
      for (Conditional<GenerateBody> branch : stmt.conditionals) {
        analyzer.expressions.booleanExpr(scope, branch.condition, diagnostics);
        analyzeGenerateBody(scope.nested(), branch.item, diagnostics);
      }
      if (stmt.elseItem != null) {
        analyzeGenerateBody(scope.nested(), stmt.elseItem, diagnostics);
      }
      return null;
    }

    @Override
    public Void visitCaseGenerate(ConcurrentStatement.CaseGenerate stmt) {
      TypeDecl type = analyzer.expressions.unambiguousType(scope, stmt.expression, diagnostics);
      for (Alternative<GenerateBody> alternative : stmt.alternatives) {
        analyzer.ranges.analyzeChoices(scope, type, alternative.choices, diagnostics);
        analyzeGenerateBody(scope.nested(), alternative.item, diagnostics);
      }
      return null;
    }

    @Override
    public Void visitInstance(Instance stmt) {
      DesignUnit unit = instantiatedUnit(stmt);
      FormalRegion generics = (unit == null) ? null : unit.generics();
      FormalRegion ports = (unit == null) ? null : unit.ports();
      if (generics == null || ports == null) {
        analyzer.associations.analyze(scope, stmt.genericMap, diagnostics);
        analyzer.associations.analyze(scope, stmt.portMap, diagnostics);
        return null;
      }
      analyzer.associations.analyzeWithFormalRegion(
          scope, stmt.pos, generics, stmt.genericMap, diagnostics);
      analyzer.associations.analyzeWithFormalRegion(
          scope, stmt.pos, ports, stmt.portMap, diagnostics);
      return null;
    }

    /** Resolves the unit named by an instantiation; reports and returns null if it is not one. */
    private @Nullable DesignUnit instantiatedUnit(Instance stmt) {
      NamedEntities found =
          analyzer.expressions.resolveName(scope, stmt.unitName, diagnostics);
      if (found == null) {
        return null;
      }
      DesignUnit.UnitKind expected = DesignUnit.UnitKind.valueOf(stmt.unitKind.name());
      if (found.asSingle() instanceof DesignUnit unit && unit.unitKind == expected) {
        return unit;
      }
      diagnostics.push(
          Diagnostic.error(
              stmt.unitName.pos, "Expected %s, got %s", expected.describe(), found.describe()));
      return null;
    }

    @Override
    public Void visitSignalAssignment(ConcurrentStatement.SignalAssignment stmt) {
      analyzer.targets.analyzeWaveformAssignment(scope, stmt.target, stmt.rhs, diagnostics);
      return null;
    }

    @Override
    public Void visitProcedureCall(ConcurrentStatement.ProcedureCall stmt) {
      analyzer.expressions.analyzeProcedureCall(scope, stmt.call, diagnostics);
      return null;
    }

    @Override
    public Void visitAssert(ConcurrentStatement.Assert stmt) {
      analyzer.expressions.booleanExpr(scope, stmt.condition, diagnostics);
      if (stmt.report != null) {
        analyzer.expressions.analyzeWithTargetType(
            scope, analyzer.std.string, stmt.report, diagnostics);
      }
      if (stmt.severity != null) {
        analyzer.expressions.analyzeWithTargetType(
            scope, analyzer.std.severityLevel, stmt.severity, diagnostics);
      }
      return null;
    }
  }
}
