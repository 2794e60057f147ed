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
import java.util.Arrays;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.ast.AssociationElement;
import org.vhdlsema.ast.DeclarativeItem;
import org.vhdlsema.ast.Designator;
import org.vhdlsema.ast.DiscreteRange;
import org.vhdlsema.ast.Expression;
import org.vhdlsema.ast.Ident;
import org.vhdlsema.ast.InterfaceDeclaration;
import org.vhdlsema.ast.Mode;
import org.vhdlsema.ast.Name;
import org.vhdlsema.ast.ObjectClass;
import org.vhdlsema.ast.SrcPos;
import org.vhdlsema.ast.SubprogramSpecification;
import org.vhdlsema.ast.SubtypeIndication;

/**
 * Builds AST fragments for tests, standing in for a parser. Every node gets its own line in the
 * source {@code test.vhd}, so diagnostics can be told apart by position.
 */
final class Vhdl {

  static final String SOURCE = "test.vhd";

  private int line;

  SrcPos pos() {
    return new SrcPos(SOURCE, ++line, 1);
  }

  Ident ident(String name) {
    return new Ident(name, pos());
  }

  Name.Simple name(String id) {
    return new Name.Simple(pos(), Designator.identifier(id));
  }

  Name.Simple op(String symbol) {
    return new Name.Simple(pos(), Designator.operator(symbol));
  }

  Name.Simple character(char c) {
    return new Name.Simple(pos(), Designator.character(c));
  }

  /** {@code first.second...}; each part is an identifier. */
  Name.Selected selected(String first, String... rest) {
    Name result = name(first);
    for (String part : rest) {
      result = new Name.Selected(result, name(part));
    }
    return (Name.Selected) result;
  }

  /** {@code prefix(args)}, with positional arguments. */
  Name.Call call(String prefix, Expression... args) {
    return call(name(prefix), args);
  }

  Name.Call call(Name prefix, Expression... args) {
    return new Name.Call(
        prefix,
        Arrays.stream(args)
            .map(AssociationElement::positional)
            .collect(ImmutableList.toImmutableList()));
  }

  Name.Call callWith(String prefix, AssociationElement... args) {
    return new Name.Call(name(prefix), Arrays.asList(args));
  }

  AssociationElement positional(Expression actual) {
    return AssociationElement.positional(actual);
  }

  AssociationElement named(String formal, Expression actual) {
    return AssociationElement.named(name(formal), actual);
  }

  AssociationElement named(Name formal, Expression actual) {
    return AssociationElement.named(formal, actual);
  }

  AssociationElement open(String formal) {
    return AssociationElement.named(name(formal), null);
  }

  Expression.IntegerLiteral integer(long value) {
    return new Expression.IntegerLiteral(pos(), value);
  }

  Expression.RealLiteral real(double value) {
    return new Expression.RealLiteral(pos(), value);
  }

  Expression.StringLiteral string(String value) {
    return new Expression.StringLiteral(pos(), value);
  }

  Expression.PhysicalLiteral physical(double value, String unit) {
    return new Expression.PhysicalLiteral(pos(), value, name(unit));
  }

  Expression.Binary binary(Expression left, String operator, Expression right) {
    return new Expression.Binary(op(operator), left, right);
  }

  Expression.Unary unary(String operator, Expression operand) {
    return new Expression.Unary(op(operator), operand);
  }

  Expression.Qualified qualified(String typeMark, Expression operand) {
    return new Expression.Qualified(name(typeMark), operand);
  }

  DiscreteRange.Range range(Expression left, Expression right) {
    return new DiscreteRange.Range(left, DiscreteRange.Direction.TO, right);
  }

  DiscreteRange.Range range(long left, long right) {
    return range(integer(left), integer(right));
  }

  SubtypeIndication subtype(String typeMark) {
    return new SubtypeIndication(name(typeMark));
  }

  // Interface declarations

  InterfaceDeclaration port(String name, Mode mode, String type) {
    return new InterfaceDeclaration(ObjectClass.SIGNAL, ident(name), mode, subtype(type), null);
  }

  InterfaceDeclaration port(String name, Mode mode, String type, Expression defaultValue) {
    return new InterfaceDeclaration(
        ObjectClass.SIGNAL, ident(name), mode, subtype(type), defaultValue);
  }

  InterfaceDeclaration generic(String name, String type) {
    return constantIn(name, type, null);
  }

  InterfaceDeclaration generic(String name, String type, Expression defaultValue) {
    return constantIn(name, type, defaultValue);
  }

  InterfaceDeclaration parameter(String name, String type) {
    return constantIn(name, type, null);
  }

  InterfaceDeclaration parameter(String name, String type, Expression defaultValue) {
    return constantIn(name, type, defaultValue);
  }

  InterfaceDeclaration variableParameter(String name, Mode mode, String type) {
    return new InterfaceDeclaration(ObjectClass.VARIABLE, ident(name), mode, subtype(type), null);
  }

  private InterfaceDeclaration constantIn(
      String name, String type, @Nullable Expression defaultValue) {
    return new InterfaceDeclaration(
        ObjectClass.CONSTANT, ident(name), Mode.IN, subtype(type), defaultValue);
  }

  // Declarative items

  DeclarativeItem.ObjectDeclaration signal(String name, String type) {
    return object(ObjectClass.SIGNAL, name, type, null);
  }

  DeclarativeItem.ObjectDeclaration variable(String name, String type) {
    return object(ObjectClass.VARIABLE, name, type, null);
  }

  DeclarativeItem.ObjectDeclaration constant(String name, String type, Expression value) {
    return object(ObjectClass.CONSTANT, name, type, value);
  }

  DeclarativeItem.ObjectDeclaration object(
      ObjectClass objectClass, String name, String type, @Nullable Expression value) {
    return new DeclarativeItem.ObjectDeclaration(
        objectClass, ImmutableList.of(ident(name)), subtype(type), value);
  }

  DeclarativeItem.EnumerationTypeDeclaration enumType(String name, String... literals) {
    return new DeclarativeItem.EnumerationTypeDeclaration(
        ident(name),
        Arrays.stream(literals)
            .map(Designator::identifier)
            .collect(ImmutableList.toImmutableList()));
  }

  DeclarativeItem.IntegerTypeDeclaration integerType(String name, long left, long right) {
    return new DeclarativeItem.IntegerTypeDeclaration(ident(name), range(left, right));
  }

  DeclarativeItem.ArrayTypeDeclaration arrayType(String name, String index, String element) {
    return new DeclarativeItem.ArrayTypeDeclaration(
        ident(name), new DiscreteRange.Subtype(name(index), null), subtype(element));
  }

  SubprogramSpecification functionSpec(
      String name, String returnType, InterfaceDeclaration... parameters) {
    return new SubprogramSpecification(
        pos(), Designator.identifier(name), Arrays.asList(parameters), name(returnType));
  }

  SubprogramSpecification procedureSpec(String name, InterfaceDeclaration... parameters) {
    return new SubprogramSpecification(
        pos(), Designator.identifier(name), Arrays.asList(parameters), null);
  }

  DeclarativeItem.SubprogramDeclaration function(
      String name, String returnType, InterfaceDeclaration... parameters) {
    return new DeclarativeItem.SubprogramDeclaration(functionSpec(name, returnType, parameters));
  }

  DeclarativeItem.SubprogramDeclaration procedure(String name, InterfaceDeclaration... parameters) {
    return new DeclarativeItem.SubprogramDeclaration(procedureSpec(name, parameters));
  }
}
