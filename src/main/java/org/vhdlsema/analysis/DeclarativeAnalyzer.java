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
import org.vhdlsema.analysis.Declaration.InterfaceFile;
import org.vhdlsema.analysis.Declaration.ObjectDecl;
import org.vhdlsema.analysis.Declaration.Overloaded;
import org.vhdlsema.analysis.Declaration.Overloaded.OverloadKind;
import org.vhdlsema.analysis.Declaration.TypeDecl;
import org.vhdlsema.ast.DeclarativeItem;
import org.vhdlsema.ast.DeclarativeItem.ArrayTypeDeclaration;
import org.vhdlsema.ast.DeclarativeItem.ComponentDeclaration;
import org.vhdlsema.ast.DeclarativeItem.EnumerationTypeDeclaration;
import org.vhdlsema.ast.DeclarativeItem.IntegerTypeDeclaration;
import org.vhdlsema.ast.DeclarativeItem.ObjectDeclaration;
import org.vhdlsema.ast.DeclarativeItem.SubprogramBody;
import org.vhdlsema.ast.DeclarativeItem.SubprogramDeclaration;
import org.vhdlsema.ast.DeclarativeItem.SubtypeDeclaration;
import org.vhdlsema.ast.DeclarativeItem.UseClause;
import org.vhdlsema.ast.Expression;
import org.vhdlsema.ast.Ident;
import org.vhdlsema.ast.InterfaceDeclaration;
import org.vhdlsema.ast.ObjectClass;
import org.vhdlsema.ast.SubprogramSpecification;
import org.vhdlsema.ast.SubtypeIndication;

/**
 * Populates a scope from a declarative part, and builds the formal regions of interface lists.
 */
final class DeclarativeAnalyzer {

  private final Analyzer analyzer;

  DeclarativeAnalyzer(Analyzer analyzer) {
    this.analyzer = analyzer;
  }

  void analyzeDeclarativePart(
      Scope scope, List<DeclarativeItem> items, DiagnosticHandler diagnostics) {
    ItemVisitor visitor = new ItemVisitor(scope, diagnostics);
    for (DeclarativeItem item : items) {
      item.accept(visitor);
    }
  }

  /**
   * Declares the elements of an interface list in {@code scope} and returns them as a FormalRegion.
   * Elements whose designator is already declared in {@code scope} are reported and left out.
   */
  FormalRegion analyzeInterfaceList(
      Scope scope,
      FormalRegion.Kind kind,
      List<InterfaceDeclaration> interfaces,
      DiagnosticHandler diagnostics) {
    FormalRegion.Builder builder = new FormalRegion.Builder(kind);
    for (InterfaceDeclaration decl : interfaces) {
      TypeDecl type = subtypeIndication(scope, decl.subtype, diagnostics);
      if (decl.defaultValue != null) {
        analyzeValue(scope, type, decl.defaultValue, diagnostics);
      }
      Declaration element;
      if (decl.objectClass == ObjectClass.FILE) {
        element =
            analyzer.arena.define(
                id -> new InterfaceFile(id, decl.ident.designator(), decl.ident.pos, type));
      } else {
        element =
            analyzer.arena.define(
                id ->
                    new ObjectDecl(
                        id,
                        decl.ident.designator(),
                        decl.ident.pos,
                        decl.objectClass,
                        decl.mode,
                        type,
                        decl.defaultValue != null));
      }
      if (scope.add(element, diagnostics)) {
        builder.add(element);
      }
    }
    return builder.build();
  }

  /** Resolves a subtype indication and checks its range constraint, if any. */
  @Nullable TypeDecl subtypeIndication(
      Scope scope, SubtypeIndication subtype, DiagnosticHandler diagnostics) {
    TypeDecl type = analyzer.expressions.typeMark(scope, subtype.typeMark, diagnostics);
    if (subtype.constraint != null) {
      analyzer.ranges.analyzeRangeWithType(scope, subtype.constraint, type, diagnostics);
    }
    return type;
  }

  /**
   * Builds the signature of a subprogram, declaring its parameters in {@code parameterScope}, which
   * should be a new region nested in the one declaring the subprogram.
   */
  private Overloaded subprogram(
      Scope parameterScope, SubprogramSpecification spec, DiagnosticHandler diagnostics) {
    FormalRegion formals =
        analyzeInterfaceList(
            parameterScope, FormalRegion.Kind.PARAMETER, spec.parameters, diagnostics);
    TypeDecl returnType = null;
    if (spec.returnType != null) {
      // Null if unresolved; calls of the function then check as UNKNOWN.
      returnType = analyzer.expressions.typeMark(parameterScope, spec.returnType, diagnostics);
    }
    Signature signature = new Signature(formals, returnType);
    OverloadKind kind = spec.isFunction() ? OverloadKind.FUNCTION : OverloadKind.PROCEDURE;
    return analyzer.arena.define(
        id -> new Overloaded(id, spec.designator, spec.pos, kind, signature));
  }

  private void analyzeValue(
      Scope scope, @Nullable TypeDecl type, Expression value, DiagnosticHandler diagnostics) {
    if (type == null) {
      analyzer.expressions.analyze(scope, value, diagnostics);
    } else {
      analyzer.expressions.analyzeWithTargetType(scope, type, value, diagnostics);
    }
  }

  private void declareType(Scope scope, TypeDecl type, DiagnosticHandler diagnostics) {
    scope.add(type, diagnostics);
    for (Overloaded operator : analyzer.std.implicitOperators(type)) {
      scope.add(operator, diagnostics);
    }
  }

  private final class ItemVisitor implements DeclarativeItem.Visitor<Void> {
    final Scope scope;
    final DiagnosticHandler diagnostics;

    ItemVisitor(Scope scope, DiagnosticHandler diagnostics) {
      this.scope = scope;
      this.diagnostics = diagnostics;
    }

    @Override
    public Void visitObjectDeclaration(ObjectDeclaration decl) {
      TypeDecl type = subtypeIndication(scope, decl.subtype, diagnostics);
      if (decl.defaultValue != null) {
        analyzeValue(scope, type, decl.defaultValue, diagnostics);
      }
      if (decl.objectClass == ObjectClass.FILE) {
        diagnostics.push(
            Diagnostic.error(
                decl.pos, "File declarations are only supported as interface objects"));
        return null;
      }
      for (Ident ident : decl.idents) {
        scope.add(
            analyzer.arena.define(
                id ->
                    new ObjectDecl(
                        id,
                        ident.designator(),
                        ident.pos,
                        decl.objectClass,
                        null,
                        type,
                        decl.defaultValue != null)),
            diagnostics);
      }
      return null;
    }

    @Override
    public Void visitSubtypeDeclaration(SubtypeDeclaration decl) {
      TypeDecl parent = subtypeIndication(scope, decl.subtype, diagnostics);
      if (parent != null) {
        scope.add(
            analyzer.arena.define(
                id -> TypeDecl.subtype(id, decl.ident.designator(), decl.ident.pos, parent)),
            diagnostics);
      }
      return null;
    }

    @Override
    public Void visitEnumerationTypeDeclaration(EnumerationTypeDeclaration decl) {
      TypeDecl type =
          analyzer.arena.define(
              id ->
                  TypeDecl.enumeration(id, decl.ident.designator(), decl.ident.pos, decl.literals));
      declareType(scope, type, diagnostics);
      for (Overloaded literal : analyzer.std.enumerationLiterals(type, decl.ident.pos)) {
        scope.add(literal, diagnostics);
      }
      return null;
    }

    @Override
    public Void visitIntegerTypeDeclaration(IntegerTypeDeclaration decl) {
      TypeDecl rangeType = analyzer.ranges.rangeType(scope, decl.range, diagnostics);
      if (rangeType != null && rangeType.baseType().kind != TypeDecl.Kind.INTEGER) {
        diagnostics.push(
            Diagnostic.error(
                decl.range.pos,
                "Expected an integer range, got a range of %s",
                rangeType.describe()));
      }
      TypeDecl type =
          analyzer.arena.define(
              id ->
                  TypeDecl.scalar(
                      id, decl.ident.designator(), decl.ident.pos, TypeDecl.Kind.INTEGER));
      declareType(scope, type, diagnostics);
      return null;
    }

    @Override
    public Void visitArrayTypeDeclaration(ArrayTypeDeclaration decl) {
      TypeDecl index = analyzer.ranges.discreteRangeType(scope, decl.index, diagnostics);
      TypeDecl element = subtypeIndication(scope, decl.element, diagnostics);
      TypeDecl type =
          analyzer.arena.define(
              id -> TypeDecl.array(id, decl.ident.designator(), decl.ident.pos, index, element));
      declareType(scope, type, diagnostics);
      return null;
    }

    @Override
    public Void visitComponentDeclaration(ComponentDeclaration decl) {
      // Ports may refer to generics, so both share one region.
      Scope region = scope.nested();
      FormalRegion generics =
          analyzeInterfaceList(region, FormalRegion.Kind.GENERIC, decl.generics, diagnostics);
      FormalRegion ports =
          analyzeInterfaceList(region, FormalRegion.Kind.PORT, decl.ports, diagnostics);
      scope.add(
          analyzer.arena.define(
              id ->
                  DesignUnit.entityOrComponent(
                      id,
                      decl.ident.designator(),
                      decl.ident.pos,
                      DesignUnit.UnitKind.COMPONENT,
                      generics,
                      ports)),
          diagnostics);
      return null;
    }

    @Override
    public Void visitSubprogramDeclaration(SubprogramDeclaration decl) {
      scope.add(subprogram(scope.nested(), decl.specification, diagnostics), diagnostics);
      return null;
    }

    @Override
    public Void visitSubprogramBody(SubprogramBody body) {
      Scope region = scope.nested();
      Overloaded subprogram = subprogram(region, body.specification, diagnostics);
      // A body completes an earlier declaration with the same profile.
      if (scope.localHomograph(subprogram.designator, subprogram.signature) == null) {
        scope.add(subprogram, diagnostics);
      }
      analyzeDeclarativePart(region, body.declarations, diagnostics);
      TypeDecl returnType = subprogram.signature.returnType();
      SequentialRoot root;
      if (!subprogram.isFunction()) {
        root = SequentialRoot.PROCEDURE;
      } else if (returnType == null) {
        // The return type mark has already been reported.
        root = SequentialRoot.UNKNOWN;
      } else {
        root = SequentialRoot.function(returnType);
      }
      analyzer.sequential.analyzeSequentialPart(region, root, body.statements, diagnostics);
      return null;
    }

    @Override
    public Void visitUseClause(UseClause use) {
      if (use.all) {
        NamedEntities found = analyzer.expressions.resolveName(scope, use.name, diagnostics);
        Declaration single = (found == null) ? null : found.asSingle();
        if (single instanceof Declaration.Package pkg) {
          scope.useAll(pkg.region);
        } else if (single instanceof Declaration.Library library) {
          scope.useAll(library.region);
        } else if (found != null) {
          diagnostics.push(
              Diagnostic.error(
                  use.name.pos, "Expected library or package, got %s", found.describe()));
        }
        return null;
      }
      NamedEntities found = analyzer.expressions.resolveName(scope, use.name, diagnostics);
      if (found == null) {
        return null;
      }
      Declaration single = found.asSingle();
      if (single != null) {
        scope.use(single);
      } else {
        found.asOverloaded().candidates().forEach(scope::use);
      }
      return null;
    }
  }
}
