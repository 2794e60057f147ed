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
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.analysis.Declaration.InterfaceFile;
import org.vhdlsema.analysis.Declaration.Library;
import org.vhdlsema.analysis.Declaration.LoopParameter;
import org.vhdlsema.analysis.Declaration.ObjectDecl;
import org.vhdlsema.analysis.Declaration.Overloaded;
import org.vhdlsema.analysis.Declaration.PhysicalUnit;
import org.vhdlsema.analysis.Declaration.TypeDecl;
import org.vhdlsema.ast.AssociationElement;
import org.vhdlsema.ast.Designator;
import org.vhdlsema.ast.Expression;
import org.vhdlsema.ast.Name;
import org.vhdlsema.ast.SrcPos;

/**
 * Resolves the names in expressions and checks expressions against an expected type.
 *
 * <p>There are three entry points, depending on what the context knows about the expression's
 * type: {@link #analyzeWithTargetType} when the type is given, {@link #unambiguousType} when the
 * expression must determine its own type, and {@link #analyze} when nothing is expected of it.
 */
final class ExpressionAnalyzer {

  private final Analyzer analyzer;

  ExpressionAnalyzer(Analyzer analyzer) {
    this.analyzer = analyzer;
  }

  /**
   * Checks {@code expr} against {@code target}, binding the names in it. Returns UNKNOWN if some
   * part of the expression could not be resolved.
   */
  TypeCheck analyzeWithTargetType(
      Scope scope, TypeDecl target, Expression expr, DiagnosticHandler diagnostics) {
    return expr.accept(new TargetTypeVisitor(scope, target, diagnostics));
  }

  /** Checks that {@code expr} is a condition. */
  TypeCheck booleanExpr(Scope scope, Expression expr, DiagnosticHandler diagnostics) {
    return analyzeWithTargetType(scope, analyzer.std.booleanType, expr, diagnostics);
  }

  /**
   * Analyzes an expression whose type is not constrained by its context. If the expression can
   * only have one type it is checked against that type; otherwise its names are resolved as far as
   * they can be without one.
   */
  void analyze(Scope scope, Expression expr, DiagnosticHandler diagnostics) {
    ImmutableSet<TypeDecl> types = possibleTypes(scope, expr);
    if (types != null && types.size() == 1) {
      analyzeWithTargetType(scope, types.iterator().next(), expr, diagnostics);
    } else {
      expr.accept(new UntypedVisitor(scope, diagnostics));
    }
  }

  /**
   * Determines the type of an expression from the expression alone (e.g. a case selector or a range
   * bound) and checks it against that type. Returns null, after reporting why, if there is no
   * single such type.
   */
  @Nullable TypeDecl unambiguousType(Scope scope, Expression expr, DiagnosticHandler diagnostics) {
    ImmutableSet<TypeDecl> types = possibleTypes(scope, expr);
    if (types == null || types.isEmpty()) {
      analyze(scope, expr, diagnostics);
      return null;
    } else if (types.size() > 1) {
      Diagnostic diagnostic = Diagnostic.error(expr.pos, "Ambiguous expression");
      types.stream()
          .sorted(Comparator.comparingInt(t -> t.id))
          .forEach(t -> diagnostic.addRelated(t.pos, "Might be " + t.describe()));
      diagnostics.push(diagnostic);
      expr.accept(new UntypedVisitor(scope, diagnostics));
      return null;
    }
    TypeDecl type = types.iterator().next();
    analyzeWithTargetType(scope, type, expr, diagnostics);
    return type;
  }

  /**
   * Resolves a simple or selected name, reporting it if nothing is visible under that name. If the
   * name denotes a single declaration its reference is bound; overloaded names are left for
   * overload resolution.
   */
  @Nullable NamedEntities resolveName(Scope scope, Name name, DiagnosticHandler diagnostics) {
    if (name instanceof Name.Simple simple) {
      NamedEntities found = scope.lookup(simple.designator);
      if (found == null) {
        diagnostics.push(Scope.notDeclared(simple.pos, simple.designator));
      } else {
        bindSingle(simple, found);
      }
      return found;
    } else if (name instanceof Name.Selected selected) {
      NamedEntities prefix = resolveName(scope, selected.prefix, diagnostics);
      if (prefix == null) {
        return null;
      }
      Scope region = regionOf(prefix);
      if (region == null) {
        diagnostics.push(
            Diagnostic.error(
                selected.prefix.pos,
                "%s may not be the prefix of a selected name",
                prefix.describe()));
        return null;
      }
      NamedEntities found = region.lookupLocal(selected.suffix.designator);
      if (found == null) {
        diagnostics.push(
            Diagnostic.error(
                selected.suffix.pos,
                "No declaration of %s within %s",
                selected.suffix.designator.quoted(),
                prefix.describe()));
      } else {
        bindSingle(selected.suffix, found);
      }
      return found;
    }
    diagnostics.push(
        Diagnostic.error(name.pos, "Expected a simple or selected name, got %s", name));
    return null;
  }

  /** Analyzes a procedure call statement, {@code name} or {@code name(arguments)}. */
  void analyzeProcedureCall(Scope scope, Name call, DiagnosticHandler diagnostics) {
    Name prefix = call;
    List<AssociationElement> arguments = ImmutableList.of();
    if (call instanceof Name.Call withArguments) {
      prefix = withArguments.prefix;
      arguments = withArguments.arguments;
    }
    Name.Simple name = designatorOf(prefix);
    NamedEntities found = (name == null) ? null : resolveName(scope, prefix, diagnostics);
    OverloadedName overloaded = (found == null) ? null : found.asOverloaded();
    if (overloaded == null) {
      if (found != null || name == null) {
        String what = (found == null) ? prefix.toString() : found.describe();
        diagnostics.push(Diagnostic.error(prefix.pos, "%s is not a procedure", what));
      }
      analyzer.associations.analyze(scope, arguments, diagnostics);
      return;
    }
    analyzer.overloads.resolveWithTargetType(
        scope,
        overloaded,
        null,
        call.pos,
        name.designator,
        name.reference,
        Parameters.associations(arguments),
        diagnostics);
  }

  /** Resolves a type mark, reporting anything that is not a type or subtype. */
  @Nullable TypeDecl typeMark(Scope scope, Name name, DiagnosticHandler diagnostics) {
    NamedEntities found = resolveName(scope, name, diagnostics);
    if (found == null) {
      return null;
    } else if (found.asSingle() instanceof TypeDecl type) {
      return type;
    }
    diagnostics.push(Diagnostic.error(name.pos, "Expected type mark, got %s", found.describe()));
    return null;
  }

  /**
   * Checks the indices of an indexed name whose prefix has the given array type, and returns the
   * check. Only one-dimensional arrays are modelled, so exactly one positional index is expected.
   */
  TypeCheck analyzeIndices(
      Scope scope, TypeDecl arrayType, Name.Call call, DiagnosticHandler diagnostics) {
    TypeCheck result = TypeCheck.OK;
    TypeDecl indexType = arrayType.indexType();
    for (int i = 0; i < call.arguments.size(); i++) {
      AssociationElement element = call.arguments.get(i);
      if (element.actual == null || element.formal != null || i > 0) {
        diagnostics.push(Diagnostic.error(element.pos, "Invalid index of %s", call.prefix));
        if (element.actual != null) {
          analyze(scope, element.actual, diagnostics);
        }
        result = TypeCheck.NOT_OK;
      } else if (indexType == null) {
        analyze(scope, element.actual, diagnostics);
        result = result.combine(TypeCheck.UNKNOWN);
      } else {
        result =
            result.combine(analyzeWithTargetType(scope, indexType, element.actual, diagnostics));
      }
    }
    if (call.arguments.isEmpty()) {
      diagnostics.push(Diagnostic.error(call.pos, "Missing index of %s", call.prefix));
      result = TypeCheck.NOT_OK;
    }
    return result;
  }

  /** Returns the simple name that carries the reference of a simple or selected name, or null. */
  static Name.@Nullable Simple designatorOf(Name name) {
    if (name instanceof Name.Simple simple) {
      return simple;
    } else if (name instanceof Name.Selected selected) {
      return selected.suffix;
    }
    return null;
  }

  /** True for declarations that denote a value: objects, loop parameters, and physical units. */
  static boolean isValue(Declaration declaration) {
    return declaration instanceof ObjectDecl
        || declaration instanceof InterfaceFile
        || declaration instanceof LoopParameter
        || declaration instanceof PhysicalUnit;
  }

  private void bindSingle(Name.Simple name, NamedEntities found) {
    Declaration single = found.asSingle();
    if (single != null) {
      analyzer.bind(name.reference, single);
    }
  }

  private static @Nullable Scope regionOf(@Nullable NamedEntities found) {
    Declaration single = (found == null) ? null : found.asSingle();
    if (single instanceof Library library) {
      return library.region;
    } else if (single instanceof Declaration.Package pkg) {
      return pkg.region;
    }
    return null;
  }

  /** Like {@link #resolveName}, but neither reports nor binds anything. */
  private @Nullable NamedEntities lookupQuietly(Scope scope, Name name) {
    if (name instanceof Name.Simple simple) {
      return scope.lookup(simple.designator);
    } else if (name instanceof Name.Selected selected) {
      Scope region = regionOf(lookupQuietly(scope, selected.prefix));
      return (region == null) ? null : region.lookupLocal(selected.suffix.designator);
    }
    return null;
  }

  /**
   * Returns the base types {@code expr} could have, judging from the expression alone; null if the
   * expression does not constrain its type (e.g. a string literal or an unresolved name). Nothing
   * is bound or reported.
   */
  @Nullable ImmutableSet<TypeDecl> possibleTypes(Scope scope, Expression expr) {
    return expr.accept(new TypeSetVisitor(scope));
  }

  private static boolean fits(@Nullable Set<TypeDecl> actual, @Nullable TypeDecl formal) {
    return actual == null
        || formal == null
        || actual.stream().anyMatch(t -> TypeDecl.isCompatible(t, formal));
  }

  private static boolean callableWithoutArguments(Overloaded candidate) {
    for (Declaration formal : candidate.formals()) {
      if (!(formal instanceof ObjectDecl object && object.hasDefault)) {
        return false;
      }
    }
    return true;
  }

  /** Computes {@link #possibleTypes}. */
  private final class TypeSetVisitor
      implements Expression.Visitor<@Nullable ImmutableSet<TypeDecl>> {
    final Scope scope;

    TypeSetVisitor(Scope scope) {
      this.scope = scope;
    }

    @Override
    public @Nullable ImmutableSet<TypeDecl> visitSimpleName(Name.Simple name) {
      return ofNamed(lookupQuietly(scope, name), 0);
    }

    @Override
    public @Nullable ImmutableSet<TypeDecl> visitSelectedName(Name.Selected name) {
      return ofNamed(lookupQuietly(scope, name), 0);
    }

    @Override
    public @Nullable ImmutableSet<TypeDecl> visitCallName(Name.Call name) {
      NamedEntities found = lookupQuietly(scope, name.prefix);
      if (found == null) {
        return null;
      }
      Declaration single = found.asSingle();
      if (single == null) {
        return ofNamed(found, name.arguments.size());
      } else if (single instanceof TypeDecl type) {
        return ImmutableSet.of(type.baseType());
      }
      TypeDecl type = single.typeMark();
      if (isValue(single) && type != null && type.kind == TypeDecl.Kind.ARRAY) {
        TypeDecl element = type.elementType();
        return (element == null) ? null : ImmutableSet.of(element.baseType());
      }
      return ImmutableSet.of();
    }

    /**
     * The types of a name used with {@code arguments} arguments: an object's type, or the return
     * types of the functions that accept that many arguments.
     */
    private @Nullable ImmutableSet<TypeDecl> ofNamed(@Nullable NamedEntities found, int arguments) {
      if (found == null) {
        return null;
      }
      Declaration single = found.asSingle();
      if (single != null) {
        if (!isValue(single)) {
          return ImmutableSet.of();
        }
        TypeDecl type = single.typeMark();
        return (type == null) ? null : ImmutableSet.of(type.baseType());
      }
      Set<TypeDecl> result = new LinkedHashSet<>();
      for (Overloaded candidate : found.asOverloaded().candidates()) {
        TypeDecl returnType = candidate.signature.returnType();
        if (returnType == null || candidate.formals().size() < arguments) {
          continue;
        }
        if (arguments > 0 || callableWithoutArguments(candidate)) {
          result.add(returnType.baseType());
        }
      }
      return ImmutableSet.copyOf(result);
    }

    @Override
    public @Nullable ImmutableSet<TypeDecl> visitIntegerLiteral(Expression.IntegerLiteral literal) {
      return ImmutableSet.of(analyzer.std.universalInteger);
    }

    @Override
    public @Nullable ImmutableSet<TypeDecl> visitRealLiteral(Expression.RealLiteral literal) {
      return ImmutableSet.of(analyzer.std.universalReal);
    }

    @Override
    public @Nullable ImmutableSet<TypeDecl> visitStringLiteral(Expression.StringLiteral literal) {
      return null;
    }

    @Override
    public @Nullable ImmutableSet<TypeDecl> visitNullLiteral(Expression.NullLiteral literal) {
      return null;
    }

    @Override
    public @Nullable ImmutableSet<TypeDecl> visitPhysicalLiteral(
        Expression.PhysicalLiteral literal) {
      NamedEntities found = lookupQuietly(scope, literal.unit);
      if (found != null && found.asSingle() instanceof PhysicalUnit unit) {
        return ImmutableSet.of(unit.typeMark().baseType());
      }
      return null;
    }

    @Override
    public @Nullable ImmutableSet<TypeDecl> visitBinary(Expression.Binary binary) {
      return ofOperator(
          binary.operator,
          2,
          possibleTypes(scope, binary.left),
          possibleTypes(scope, binary.right));
    }

    @Override
    public @Nullable ImmutableSet<TypeDecl> visitUnary(Expression.Unary unary) {
      return ofOperator(unary.operator, 1, possibleTypes(scope, unary.operand), null);
    }

    /** The return types of the operators with {@code arity} formals that accept the operands. */
    private @Nullable ImmutableSet<TypeDecl> ofOperator(
        Name.Simple operator,
        int arity,
        @Nullable Set<TypeDecl> left,
        @Nullable Set<TypeDecl> right) {
      NamedEntities found = scope.lookup(operator.designator);
      if (found == null || !found.isOverloaded()) {
        return null;
      }
      Set<TypeDecl> result = new LinkedHashSet<>();
      for (Overloaded candidate : found.asOverloaded().candidates()) {
        FormalRegion formals = candidate.formals();
        TypeDecl returnType = candidate.signature.returnType();
        if (returnType == null
            || formals.size() != arity
            || !fits(left, typeOf(formals.nth(0)))
            || (arity == 2 && !fits(right, typeOf(formals.nth(1))))) {
          continue;
        }
        result.add(returnType.baseType());
      }
      return ImmutableSet.copyOf(result);
    }

    @Override
    public @Nullable ImmutableSet<TypeDecl> visitQualified(Expression.Qualified qualified) {
      NamedEntities found = lookupQuietly(scope, qualified.typeMark);
      if (found != null && found.asSingle() instanceof TypeDecl type) {
        return ImmutableSet.of(type.baseType());
      }
      return null;
    }

    @Override
    public @Nullable ImmutableSet<TypeDecl> visitAggregate(Expression.Aggregate aggregate) {
      return null;
    }
  }

  private static @Nullable TypeDecl typeOf(@Nullable Declaration formal) {
    return (formal == null) ? null : formal.typeMark();
  }

  /** Implements {@link #analyzeWithTargetType}. */
  private final class TargetTypeVisitor implements Expression.Visitor<TypeCheck> {
    final Scope scope;
    final TypeDecl target;
    final DiagnosticHandler diagnostics;

    TargetTypeVisitor(Scope scope, TypeDecl target, DiagnosticHandler diagnostics) {
      this.scope = scope;
      this.target = target;
      this.diagnostics = diagnostics;
    }

    @Override
    public TypeCheck visitSimpleName(Name.Simple name) {
      NamedEntities found = resolveName(scope, name, diagnostics);
      return (found == null) ? TypeCheck.UNKNOWN : checkNamed(name, found);
    }

    @Override
    public TypeCheck visitSelectedName(Name.Selected name) {
      NamedEntities found = resolveName(scope, name, diagnostics);
      return (found == null) ? TypeCheck.UNKNOWN : checkNamed(name.suffix, found);
    }

    private TypeCheck checkNamed(Name.Simple name, NamedEntities found) {
      OverloadedName overloaded = found.asOverloaded();
      if (overloaded != null) {
        return analyzer.overloads.resolveWithTargetType(
            scope,
            overloaded,
            target,
            name.pos,
            name.designator,
            name.reference,
            Parameters.none(),
            diagnostics);
      }
      Declaration declaration = found.asSingle();
      if (!isValue(declaration)) {
        diagnostics.push(
            Diagnostic.error(
                name.pos, "%s cannot be used in an expression", declaration.describe()));
        return TypeCheck.NOT_OK;
      }
      TypeDecl type = declaration.typeMark();
      return (type == null) ? TypeCheck.UNKNOWN : matches(name.pos, declaration.describe(), type);
    }

    private TypeCheck matches(SrcPos pos, String what, TypeDecl type) {
      if (TypeDecl.isCompatible(type, target)) {
        return TypeCheck.OK;
      }
      diagnostics.push(Diagnostic.error(pos, "%s does not match %s", what, target.describe()));
      return TypeCheck.NOT_OK;
    }

    private TypeCheck literalOf(SrcPos pos, String what, TypeDecl.Kind... kinds) {
      TypeDecl.Kind kind = target.baseType().kind;
      for (TypeDecl.Kind k : kinds) {
        if (kind == k) {
          return TypeCheck.OK;
        }
      }
      diagnostics.push(Diagnostic.error(pos, "%s does not match %s", what, target.describe()));
      return TypeCheck.NOT_OK;
    }

    @Override
    public TypeCheck visitCallName(Name.Call call) {
      Name.Simple name = designatorOf(call.prefix);
      NamedEntities found = (name == null) ? null : resolveName(scope, call.prefix, diagnostics);
      if (found == null) {
        if (name == null) {
          diagnostics.push(Diagnostic.error(call.prefix.pos, "%s cannot be called", call.prefix));
          analyze(scope, call.prefix, diagnostics);
        }
        analyzer.associations.analyze(scope, call.arguments, diagnostics);
        return TypeCheck.UNKNOWN;
      }
      OverloadedName overloaded = found.asOverloaded();
      if (overloaded != null) {
        return analyzer.overloads.resolveWithTargetType(
            scope,
            overloaded,
            target,
            call.pos,
            name.designator,
            name.reference,
            Parameters.associations(call.arguments),
            diagnostics);
      }
      Declaration declaration = found.asSingle();
      if (declaration instanceof TypeDecl type) {
        if (call.arguments.size() != 1
            || call.arguments.get(0).formal != null
            || call.arguments.get(0).actual == null) {
          diagnostics.push(
              Diagnostic.error(
                  call.pos, "Type conversion to %s needs one operand", type.describe()));
          analyzer.associations.analyze(scope, call.arguments, diagnostics);
          return TypeCheck.NOT_OK;
        }
        analyze(scope, call.arguments.get(0).actual, diagnostics);
        return matches(call.pos, "conversion to " + type.describe(), type);
      }
      TypeDecl type = declaration.typeMark();
      if (isValue(declaration) && type != null && type.kind == TypeDecl.Kind.ARRAY) {
        TypeCheck indices = analyzeIndices(scope, type, call, diagnostics);
        TypeDecl element = type.elementType();
        if (element == null) {
          return indices.combine(TypeCheck.UNKNOWN);
        }
        return indices.combine(
            matches(call.pos, "element of " + declaration.describe(), element));
      }
      diagnostics.push(
          Diagnostic.error(call.pos, "%s cannot be called or indexed", declaration.describe()));
      analyzer.associations.analyze(scope, call.arguments, diagnostics);
      return TypeCheck.NOT_OK;
    }

    @Override
    public TypeCheck visitIntegerLiteral(Expression.IntegerLiteral literal) {
      return literalOf(
          literal.pos, "integer literal", TypeDecl.Kind.INTEGER, TypeDecl.Kind.UNIVERSAL_INTEGER);
    }

    @Override
    public TypeCheck visitRealLiteral(Expression.RealLiteral literal) {
      return literalOf(
          literal.pos, "real literal", TypeDecl.Kind.REAL, TypeDecl.Kind.UNIVERSAL_REAL);
    }

    @Override
    public TypeCheck visitStringLiteral(Expression.StringLiteral literal) {
      if (target.kind != TypeDecl.Kind.ARRAY) {
        return literalOf(literal.pos, "string literal");
      }
      TypeDecl element = target.elementType();
      if (element == null) {
        return TypeCheck.UNKNOWN;
      }
      for (char c : literal.value.toCharArray()) {
        if (!element.literals().contains(Designator.character(c))) {
          diagnostics.push(
              Diagnostic.error(
                  literal.pos, "'%s' is not a literal of %s", c, element.describe()));
          return TypeCheck.NOT_OK;
        }
      }
      return TypeCheck.OK;
    }

    @Override
    public TypeCheck visitNullLiteral(Expression.NullLiteral literal) {
      return literalOf(literal.pos, "null literal", TypeDecl.Kind.ACCESS);
    }

    @Override
    public TypeCheck visitPhysicalLiteral(Expression.PhysicalLiteral literal) {
      NamedEntities found = resolveName(scope, literal.unit, diagnostics);
      if (found == null) {
        return TypeCheck.UNKNOWN;
      } else if (found.asSingle() instanceof PhysicalUnit unit) {
        return matches(literal.pos, "physical literal", unit.typeMark());
      }
      diagnostics.push(
          Diagnostic.error(
              literal.unit.pos, "Expected physical unit, got %s", found.describe()));
      return TypeCheck.NOT_OK;
    }

    @Override
    public TypeCheck visitBinary(Expression.Binary binary) {
      return operator(binary.pos, binary.operator, Parameters.binary(binary.left, binary.right));
    }

    @Override
    public TypeCheck visitUnary(Expression.Unary unary) {
      return operator(unary.pos, unary.operator, Parameters.unary(unary.operand));
    }

    private TypeCheck operator(SrcPos pos, Name.Simple operator, Parameters parameters) {
      NamedEntities found = scope.lookup(operator.designator);
      if (found == null || !found.isOverloaded()) {
        diagnostics.push(Scope.notDeclared(operator.pos, operator.designator));
        analyzer.overloads.analyzeParameters(scope, parameters, diagnostics);
        return TypeCheck.UNKNOWN;
      }
      return analyzer.overloads.resolveWithTargetType(
          scope,
          found.asOverloaded(),
          target,
          pos,
          operator.designator,
          operator.reference,
          parameters,
          diagnostics);
    }

    @Override
    public TypeCheck visitQualified(Expression.Qualified qualified) {
      TypeDecl type = typeMark(scope, qualified.typeMark, diagnostics);
      if (type == null) {
        analyze(scope, qualified.operand, diagnostics);
        return TypeCheck.UNKNOWN;
      }
      TypeCheck operand = analyzeWithTargetType(scope, type, qualified.operand, diagnostics);
      return operand.combine(matches(qualified.pos, type.describe(), type));
    }

    @Override
    public TypeCheck visitAggregate(Expression.Aggregate aggregate) {
      TypeDecl element = (target.kind == TypeDecl.Kind.ARRAY) ? target.elementType() : null;
      if (element == null) {
        UntypedVisitor untyped = new UntypedVisitor(scope, diagnostics);
        untyped.visitAggregate(aggregate);
        if (target.kind == TypeDecl.Kind.ARRAY) {
          return TypeCheck.UNKNOWN;
        }
        diagnostics.push(
            Diagnostic.error(aggregate.pos, "aggregate does not match %s", target.describe()));
        return TypeCheck.NOT_OK;
      }
      TypeCheck result = TypeCheck.OK;
      for (Expression e : aggregate.positional) {
        result = result.combine(analyzeWithTargetType(scope, element, e, diagnostics));
      }
      if (aggregate.others != null) {
        result =
            result.combine(analyzeWithTargetType(scope, element, aggregate.others, diagnostics));
      }
      return result;
    }
  }

  /**
   * Resolves the names of an expression that has no single type, reporting names that are not
   * declared and operators with no matching overload.
   */
  private final class UntypedVisitor implements Expression.Visitor<Void> {
    final Scope scope;
    final DiagnosticHandler diagnostics;

    UntypedVisitor(Scope scope, DiagnosticHandler diagnostics) {
      this.scope = scope;
      this.diagnostics = diagnostics;
    }

    @Override
    public Void visitSimpleName(Name.Simple name) {
      resolveName(scope, name, diagnostics);
      return null;
    }

    @Override
    public Void visitSelectedName(Name.Selected name) {
      resolveName(scope, name, diagnostics);
      return null;
    }

    @Override
    public Void visitCallName(Name.Call call) {
      if (designatorOf(call.prefix) != null) {
        NamedEntities found = resolveName(scope, call.prefix, diagnostics);
        Declaration single = (found == null) ? null : found.asSingle();
        TypeDecl type = (single != null && isValue(single)) ? single.typeMark() : null;
        if (type != null && type.kind == TypeDecl.Kind.ARRAY) {
          analyzeIndices(scope, type, call, diagnostics);
          return null;
        }
      } else {
        analyze(scope, call.prefix, diagnostics);
      }
      analyzer.associations.analyze(scope, call.arguments, diagnostics);
      return null;
    }

    @Override
    public Void visitIntegerLiteral(Expression.IntegerLiteral literal) {
      return null;
    }

    @Override
    public Void visitRealLiteral(Expression.RealLiteral literal) {
      return null;
    }

    @Override
    public Void visitStringLiteral(Expression.StringLiteral literal) {
      return null;
    }

    @Override
    public Void visitNullLiteral(Expression.NullLiteral literal) {
      return null;
    }

    @Override
    public Void visitPhysicalLiteral(Expression.PhysicalLiteral literal) {
      resolveName(scope, literal.unit, diagnostics);
      return null;
    }

    @Override
    public Void visitBinary(Expression.Binary binary) {
      operator(binary, binary.operator, 2);
      analyze(scope, binary.left, diagnostics);
      analyze(scope, binary.right, diagnostics);
      return null;
    }

    @Override
    public Void visitUnary(Expression.Unary unary) {
      operator(unary, unary.operator, 1);
      analyze(scope, unary.operand, diagnostics);
      return null;
    }

    /** Reports an operator that is not declared, or that no overload of can apply. */
    private void operator(Expression expr, Name.Simple operator, int arity) {
      NamedEntities found = scope.lookup(operator.designator);
      if (found == null || !found.isOverloaded()) {
        diagnostics.push(Scope.notDeclared(operator.pos, operator.designator));
        return;
      }
      ImmutableSet<TypeDecl> types = possibleTypes(scope, expr);
      if (types != null && types.isEmpty()) {
        diagnostics.push(
            Diagnostic.error(expr.pos, "Could not resolve %s", operator.designator.quoted())
                .addCandidates(
                    "Does not match",
                    found.asOverloaded().candidates().stream()
                        .filter(c -> c.formals().size() == arity)
                        .collect(ImmutableSet.toImmutableSet())));
      }
    }

    @Override
    public Void visitQualified(Expression.Qualified qualified) {
      typeMark(scope, qualified.typeMark, diagnostics);
      analyze(scope, qualified.operand, diagnostics);
      return null;
    }

    @Override
    public Void visitAggregate(Expression.Aggregate aggregate) {
      aggregate.positional.forEach(e -> analyze(scope, e, diagnostics));
      if (aggregate.others != null) {
        analyze(scope, aggregate.others, diagnostics);
      }
      return null;
    }
  }
}
