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
import java.util.ArrayList;
import java.util.List;
import org.vhdlsema.analysis.Declaration.ObjectDecl;
import org.vhdlsema.analysis.Declaration.Overloaded;
import org.vhdlsema.analysis.Declaration.Overloaded.OverloadKind;
import org.vhdlsema.analysis.Declaration.PhysicalUnit;
import org.vhdlsema.analysis.Declaration.TypeDecl;
import org.vhdlsema.ast.Designator;
import org.vhdlsema.ast.Mode;
import org.vhdlsema.ast.ObjectClass;
import org.vhdlsema.ast.SrcPos;

/**
 * The predefined package {@code std.standard}: the standard types, their literals and units, and
 * the operators implicitly declared for them. Also creates the implicit operators of user-declared
 * types.
 */
public final class StandardPackage {

  /** The position given to every predefined declaration. */
  public static final SrcPos POS = new SrcPos("std.standard", 0, 0);

  private static final ImmutableList<String> RELATIONAL =
      ImmutableList.of("=", "/=", "<", "<=", ">", ">=");
  private static final ImmutableList<String> LOGICAL =
      ImmutableList.of("and", "or", "nand", "nor", "xor", "xnor");

  private final Arena arena;
  private final Scope region = Scope.root();

  public final Declaration.Package pkg;

  public final TypeDecl booleanType;
  public final TypeDecl bit;
  public final TypeDecl character;
  public final TypeDecl severityLevel;
  public final TypeDecl integer;
  public final TypeDecl natural;
  public final TypeDecl positive;
  public final TypeDecl real;
  public final TypeDecl time;
  public final TypeDecl delayLength;
  public final TypeDecl string;
  public final TypeDecl bitVector;

  /** The types of abstract literals; they have no name that can be written in VHDL. */
  public final TypeDecl universalInteger;

  public final TypeDecl universalReal;

  StandardPackage(Arena arena) {
    this.arena = arena;
    pkg = arena.define(id -> new Declaration.Package(id, identifier("standard"), POS, region));
    universalInteger =
        arena.define(
            id ->
                TypeDecl.scalar(
                    id, identifier("universal_integer"), POS, TypeDecl.Kind.UNIVERSAL_INTEGER));
    universalReal =
        arena.define(
            id ->
                TypeDecl.scalar(
                    id, identifier("universal_real"), POS, TypeDecl.Kind.UNIVERSAL_REAL));

    booleanType =
        enumeration(
            "boolean", ImmutableList.of(identifier("false"), identifier("true")));
    bit =
        enumeration(
            "bit", ImmutableList.of(Designator.character('0'), Designator.character('1')));
    List<Designator> chars = new ArrayList<>();
    for (char c = ' '; c <= '~'; c++) {
      chars.add(Designator.character(c));
    }
    character = enumeration("character", chars);
    severityLevel =
        enumeration(
            "severity_level",
            ImmutableList.of(
                identifier("note"),
                identifier("warning"),
                identifier("error"),
                identifier("failure")));
    integer = scalar("integer", TypeDecl.Kind.INTEGER);
    real = scalar("real", TypeDecl.Kind.REAL);
    time = scalar("time", TypeDecl.Kind.PHYSICAL);
    for (String unit : ImmutableList.of("fs", "ps", "ns", "us", "ms", "sec", "min", "hr")) {
      add(arena.define(id -> new PhysicalUnit(id, identifier(unit), POS, time)));
    }
    natural = subtype("natural", integer);
    positive = subtype("positive", integer);
    delayLength = subtype("delay_length", time);
    string = array("string", positive, character);
    bitVector = array("bit_vector", natural, bit);

    for (TypeDecl type :
        ImmutableList.of(
            booleanType, bit, character, severityLevel, integer, real, time, string, bitVector)) {
      implicitOperators(type).forEach(this::add);
    }
    for (TypeDecl type : ImmutableList.of(booleanType, bit, bitVector)) {
      for (String op : LOGICAL) {
        add(function(Designator.operator(op), type, type, type));
      }
      add(function(Designator.operator("not"), type, type));
    }
    add(function(identifier("now"), delayLength));
  }

  /** The region holding the declarations of {@code std.standard}. */
  public Scope region() {
    return region;
  }

  /**
   * Returns the operators implicitly declared along with {@code type}: relational operators for
   * every type, arithmetic for numeric and physical types, and concatenation for array types.
   */
  ImmutableList<Overloaded> implicitOperators(TypeDecl type) {
    ImmutableList.Builder<Overloaded> result = ImmutableList.builder();
    switch (type.kind) {
      case FILE:
        return ImmutableList.of();
      case ACCESS:
        result.add(function(Designator.operator("="), booleanType, type, type));
        result.add(function(Designator.operator("/="), booleanType, type, type));
        return result.build();
      default:
        break;
    }
    for (String op : RELATIONAL) {
      result.add(function(Designator.operator(op), booleanType, type, type));
    }
    switch (type.kind) {
      case INTEGER, REAL -> {
        for (String op : ImmutableList.of("+", "-", "*", "/")) {
          result.add(function(Designator.operator(op), type, type, type));
        }
        if (type.kind == TypeDecl.Kind.INTEGER) {
          result.add(function(Designator.operator("mod"), type, type, type));
          result.add(function(Designator.operator("rem"), type, type, type));
        }
        result.add(function(Designator.operator("**"), type, type, integer));
        addSignOperators(result, type);
      }
      case PHYSICAL -> {
        result.add(function(Designator.operator("+"), type, type, type));
        result.add(function(Designator.operator("-"), type, type, type));
        for (TypeDecl factor : ImmutableList.of(integer, real)) {
          result.add(function(Designator.operator("*"), type, type, factor));
          result.add(function(Designator.operator("*"), type, factor, type));
          result.add(function(Designator.operator("/"), type, type, factor));
        }
        result.add(function(Designator.operator("/"), universalInteger, type, type));
        addSignOperators(result, type);
      }
      case ARRAY -> {
        TypeDecl element = type.elementType();
        result.add(function(Designator.operator("&"), type, type, type));
        if (element != null) {
          result.add(function(Designator.operator("&"), type, type, element));
          result.add(function(Designator.operator("&"), type, element, type));
          result.add(function(Designator.operator("&"), type, element, element));
        }
      }
      default -> {}
    }
    return result.build();
  }

  private void addSignOperators(ImmutableList.Builder<Overloaded> result, TypeDecl type) {
    for (String op : ImmutableList.of("+", "-", "abs")) {
      result.add(function(Designator.operator(op), type, type));
    }
  }

  /** Creates (but does not declare) a function with anonymous constant parameters. */
  Overloaded function(Designator designator, TypeDecl returnType, TypeDecl... parameterTypes) {
    FormalRegion.Builder formals = new FormalRegion.Builder(FormalRegion.Kind.PARAMETER);
    for (int i = 0; i < parameterTypes.length; i++) {
      Designator name = identifier(parameterTypes.length == 1 ? "r" : (i == 0 ? "l" : "r"));
      TypeDecl type = parameterTypes[i];
      formals.add(
          arena.define(
              id -> new ObjectDecl(id, name, POS, ObjectClass.CONSTANT, Mode.IN, type, false)));
    }
    Signature signature = new Signature(formals.build(), returnType);
    return arena.define(
        id -> new Overloaded(id, designator, POS, OverloadKind.FUNCTION, signature));
  }

  /** Creates the enumeration literals of {@code type}. */
  ImmutableList<Overloaded> enumerationLiterals(TypeDecl type, SrcPos pos) {
    Signature signature = new Signature(FormalRegion.empty(FormalRegion.Kind.PARAMETER), type);
    return type.literals().stream()
        .map(
            literal ->
                arena.define(
                    id -> new Overloaded(id, literal, pos, OverloadKind.ENUM_LITERAL, signature)))
        .collect(ImmutableList.toImmutableList());
  }

  private TypeDecl enumeration(String name, List<Designator> literals) {
    TypeDecl type = arena.define(id -> TypeDecl.enumeration(id, identifier(name), POS, literals));
    add(type);
    enumerationLiterals(type, POS).forEach(this::add);
    return type;
  }

  private TypeDecl scalar(String name, TypeDecl.Kind kind) {
    TypeDecl type = arena.define(id -> TypeDecl.scalar(id, identifier(name), POS, kind));
    add(type);
    return type;
  }

  private TypeDecl subtype(String name, TypeDecl parent) {
    TypeDecl type = arena.define(id -> TypeDecl.subtype(id, identifier(name), POS, parent));
    add(type);
    return type;
  }

  private TypeDecl array(String name, TypeDecl index, TypeDecl element) {
    TypeDecl type = arena.define(id -> TypeDecl.array(id, identifier(name), POS, index, element));
    add(type);
    return type;
  }

  private void add(Declaration declaration) {
    // Predefined declarations never conflict; a duplicate here is a bug.
    boolean added = region.add(declaration, DiagnosticHandler.NULL);
    assert added : declaration.describe();
  }

  private static Designator identifier(String name) {
    return Designator.identifier(name);
  }
}
