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

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.analysis.Declaration.Overloaded;
import org.vhdlsema.analysis.Declaration.TypeDecl;
import org.vhdlsema.ast.Designator;
import org.vhdlsema.ast.Expression;
import org.vhdlsema.ast.Reference;
import org.vhdlsema.ast.SrcPos;

/**
 * Chooses among the overloaded declarations visible at a call site (a function or procedure call,
 * an operator application, or an enumeration literal).
 *
 * <p>Each candidate that could apply is tried in turn: its return type is compared with the target
 * type and the actual parameters are analyzed against its formals, with diagnostics discarded and
 * every reference binding undone afterwards. The call is then resolved from how many candidates
 * were OK, NOT_OK, or UNKNOWN, and the actuals are analyzed once more for real.
 */
final class OverloadResolver {

  private final Analyzer analyzer;

  OverloadResolver(Analyzer analyzer) {
    this.analyzer = analyzer;
  }

  /**
   * Resolves {@code overloaded} at a call site. {@code target} is the type the call must produce,
   * or null for a procedure call. If exactly one candidate applies (or exactly one was considered)
   * {@code reference} is bound to it.
   */
  TypeCheck resolveWithTargetType(
      Scope scope,
      OverloadedName overloaded,
      @Nullable TypeDecl target,
      SrcPos pos,
      Designator designator,
      Reference reference,
      Parameters parameters,
      DiagnosticHandler diagnostics) {
    List<Overloaded> good = new ArrayList<>();
    List<Overloaded> bad = new ArrayList<>();
    boolean uncertain = false;
    for (Overloaded candidate : overloaded.candidates()) {
      // Procedures never produce a value, and functions must.
      if (candidate.isFunction() != (target != null)) {
        continue;
      }
      // Keep unary and binary operators apart.
      int arity = parameters.operatorArity();
      if (arity >= 0 && candidate.formals().size() != arity) {
        continue;
      }
      TypeCheck check;
      if (candidate.isFunction() && candidate.signature.returnType() == null) {
        check = TypeCheck.UNKNOWN;
      } else if (candidate.signature.matchesReturnType(target)) {
        check = trial(scope, pos, candidate.formals(), parameters);
      } else {
        check = TypeCheck.NOT_OK;
      }
      switch (check) {
        case OK -> good.add(candidate);
        case NOT_OK -> bad.add(candidate);
        case UNKNOWN -> uncertain = true;
      }
    }

    if (good.size() > 1) {
      diagnostics.push(
          Diagnostic.error(pos, "Ambiguous use of %s", designator.quoted())
              .addCandidates("Might be", good));
      analyzeParameters(scope, parameters, diagnostics);
      return TypeCheck.UNKNOWN;
    } else if (uncertain) {
      analyzeParameters(scope, parameters, diagnostics);
      return TypeCheck.UNKNOWN;
    } else if (good.size() == 1) {
      Overloaded match = good.get(0);
      analyzer.bind(reference, match);
      analyzeParametersWithFormalRegion(scope, pos, match.formals(), parameters, diagnostics);
      return TypeCheck.OK;
    } else if (bad.size() == 1) {
      Overloaded mismatch = bad.get(0);
      analyzer.bind(reference, mismatch);
      if (parameters.isEmpty() && mismatch.formals().isEmpty()) {
        // Typically an enumeration literal; a candidate list would not help.
        if (target != null) {
          diagnostics.push(
              Diagnostic.error(
                  pos, "%s does not match %s", designator.quoted(), target.describe()));
        } else {
          diagnostics.push(
              Diagnostic.error(pos, "Could not resolve %s", designator.quoted())
                  .addCandidates("Does not match", bad));
        }
      } else {
        // Analyzing against its formals reports the specific mismatch.
        analyzeParametersWithFormalRegion(scope, pos, mismatch.formals(), parameters, diagnostics);
      }
      return TypeCheck.NOT_OK;
    }
    diagnostics.push(
        Diagnostic.error(pos, "Could not resolve %s", designator.quoted())
            .addCandidates("Does not match", bad));
    analyzeParameters(scope, parameters, diagnostics);
    return TypeCheck.NOT_OK;
  }

  /**
   * Checks the actuals against one candidate's formals without reporting anything and without
   * leaving any reference bound.
   */
  private TypeCheck trial(Scope scope, SrcPos pos, FormalRegion formals, Parameters parameters) {
    analyzer.journal.begin();
    try {
      return analyzeParametersWithFormalRegion(
          scope, pos, formals, parameters, DiagnosticHandler.NULL);
    } finally {
      analyzer.journal.rollback();
    }
  }

  /**
   * Analyzes the actual parameters against {@code formals}; {@code pos} is the call site, where a
   * missing association is reported.
   */
  TypeCheck analyzeParametersWithFormalRegion(
      Scope scope,
      SrcPos pos,
      FormalRegion formals,
      Parameters parameters,
      DiagnosticHandler diagnostics) {
    if (parameters instanceof Parameters.AssociationList list) {
      return analyzer.associations.analyzeWithFormalRegion(
          scope, pos, formals, list.elements, diagnostics);
    } else if (parameters instanceof Parameters.Binary binary) {
      return operand(scope, formals.nth(0), binary.left, diagnostics)
          .combine(operand(scope, formals.nth(1), binary.right, diagnostics));
    }
    Parameters.Unary unary = (Parameters.Unary) parameters;
    return operand(scope, formals.nth(0), unary.operand, diagnostics);
  }

  private TypeCheck operand(
      Scope scope,
      @Nullable Declaration formal,
      Expression actual,
      DiagnosticHandler diagnostics) {
    if (formal == null) {
      analyzer.expressions.analyze(scope, actual, diagnostics);
      return TypeCheck.NOT_OK;
    }
    TypeDecl type = formal.typeMark();
    if (type == null) {
      analyzer.expressions.analyze(scope, actual, diagnostics);
      return TypeCheck.UNKNOWN;
    }
    return analyzer.expressions.analyzeWithTargetType(scope, type, actual, diagnostics);
  }

  /** Analyzes the actual parameters without any formals, e.g. when no candidate was chosen. */
  void analyzeParameters(Scope scope, Parameters parameters, DiagnosticHandler diagnostics) {
    if (parameters instanceof Parameters.AssociationList list) {
      analyzer.associations.analyze(scope, list.elements, diagnostics);
    } else if (parameters instanceof Parameters.Binary binary) {
      analyzer.expressions.analyze(scope, binary.left, diagnostics);
      analyzer.expressions.analyze(scope, binary.right, diagnostics);
    } else {
      analyzer.expressions.analyze(scope, ((Parameters.Unary) parameters).operand, diagnostics);
    }
  }
}
