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

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.analysis.Declaration.ObjectDecl;
import org.vhdlsema.analysis.Declaration.TypeDecl;
import org.vhdlsema.ast.AssociationElement;
import org.vhdlsema.ast.Mode;
import org.vhdlsema.ast.Name;
import org.vhdlsema.ast.SrcPos;

/**
 * Associates the actuals of an association list (subprogram arguments, a generic map, or a port
 * map) with the formals of a FormalRegion, by position or by name.
 */
final class AssociationAnalyzer {

  private final Analyzer analyzer;

  AssociationAnalyzer(Analyzer analyzer) {
    this.analyzer = analyzer;
  }

  /**
   * Associates {@code elements} with {@code formals} and checks each actual against its formal's
   * type. Actuals are analyzed in {@code scope}; a formal left without an association is reported
   * at {@code pos}, the call or instantiation.
   *
   * @throws FatalError if a formal part is neither a simple name nor a conversion, index or
   *     slice of one
   */
  TypeCheck analyzeWithFormalRegion(
      Scope scope,
      SrcPos pos,
      FormalRegion formals,
      List<AssociationElement> elements,
      DiagnosticHandler diagnostics) {
    TypeCheck result = TypeCheck.OK;
    Set<Declaration> associated = new HashSet<>();
    boolean named = false;
    for (int i = 0; i < elements.size(); i++) {
      AssociationElement element = elements.get(i);
      Declaration formal;
      // An index or slice of the formal, or a conversion function applied to it.
      boolean partial = false;
      boolean converted = false;
      if (element.formal == null) {
        if (named) {
          diagnostics.push(
              Diagnostic.error(element.pos, "Positional association after named association"));
          analyzeActual(scope, element, diagnostics);
          result = TypeCheck.NOT_OK;
          continue;
        }
        formal = formals.nth(i);
        if (formal == null) {
          diagnostics.push(Diagnostic.error(element.pos, "Unexpected extra argument"));
          analyzeActual(scope, element, diagnostics);
          result = TypeCheck.NOT_OK;
          continue;
        }
      } else {
        named = true;
        Name.Simple formalName = formalDesignator(formals, element.formal);
        if (element.formal instanceof Name.Call call) {
          if (call.prefix == formalName) {
            partial = true;
            analyze(scope, call.arguments, diagnostics);
          } else {
            converted = true;
            // The function or type mark is visible where the actuals are.
            analyzer.expressions.resolveName(scope, call.prefix, diagnostics);
          }
        }
        formal = formals.lookup(formalName.designator);
        if (formal == null) {
          diagnostics.push(formals.notFound(formalName.pos, formalName.designator));
          analyzeActual(scope, element, diagnostics);
          result = TypeCheck.NOT_OK;
          continue;
        }
        analyzer.bind(formalName.reference, formal);
      }

      if (!associated.add(formal) && !partial) {
        diagnostics.push(
            Diagnostic.error(element.pos, "%s has already been associated", formal.describe()));
        result = TypeCheck.NOT_OK;
      }
      if (element.actual == null) {
        if (!mayBeOpen(formals.kind, formal)) {
          diagnostics.push(
              Diagnostic.error(element.pos, "%s cannot be left open", formal.describe()));
          result = TypeCheck.NOT_OK;
        }
        continue;
      }
      TypeDecl type = formal.typeMark();
      if (type == null || partial || converted) {
        analyzer.expressions.analyze(scope, element.actual, diagnostics);
        if (type == null) {
          result = result.combine(TypeCheck.UNKNOWN);
        }
      } else {
        result =
            result.combine(
                analyzer.expressions.analyzeWithTargetType(
                    scope, type, element.actual, diagnostics));
      }
    }

    for (Declaration formal : formals) {
      if (!associated.contains(formal) && !mayBeOpen(formals.kind, formal)) {
        diagnostics.push(Diagnostic.error(pos, "No association of %s", formal.describe()));
        result = TypeCheck.NOT_OK;
      }
    }
    return result;
  }

  /** Analyzes the actuals of an association list for which no formals are known. */
  void analyze(Scope scope, List<AssociationElement> elements, DiagnosticHandler diagnostics) {
    for (AssociationElement element : elements) {
      analyzeActual(scope, element, diagnostics);
    }
  }

  private void analyzeActual(
      Scope scope, AssociationElement element, DiagnosticHandler diagnostics) {
    if (element.actual != null) {
      analyzer.expressions.analyze(scope, element.actual, diagnostics);
    }
  }

  /**
   * Returns the simple name that designates the formal in a named association. That is the formal
   * part itself, the prefix of {@code formal(index)}, or the argument of {@code conv(formal)}. A
   * call whose prefix is one of {@code formals} is an index or slice; otherwise a call with a
   * single positional simple name is a conversion.
   */
  private static Name.Simple formalDesignator(FormalRegion formals, Name formal) {
    if (formal instanceof Name.Simple simple) {
      return simple;
    } else if (formal instanceof Name.Call call) {
      Name.Simple prefix = (call.prefix instanceof Name.Simple simple) ? simple : null;
      if (prefix != null && formals.lookup(prefix.designator) != null) {
        return prefix;
      }
      if (call.arguments.size() == 1
          && call.arguments.get(0).formal == null
          && call.arguments.get(0).actual instanceof Name.Simple argument) {
        return argument;
      }
      if (prefix != null) {
        // Not a formal; reported by the caller.
        return prefix;
      }
    }
    throw FatalError.of(formal.pos, "Invalid formal part %s", formal);
  }

  /**
   * True if {@code formal} may be omitted or associated with {@code open}: it has a default value,
   * or it is a port of a mode other than {@code in}.
   */
  private static boolean mayBeOpen(FormalRegion.Kind kind, @Nullable Declaration formal) {
    if (!(formal instanceof ObjectDecl object)) {
      return false;
    } else if (object.hasDefault) {
      return true;
    }
    return kind == FormalRegion.Kind.PORT && object.mode != Mode.IN;
  }
}
