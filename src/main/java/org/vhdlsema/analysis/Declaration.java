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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.ast.Designator;
import org.vhdlsema.ast.Mode;
import org.vhdlsema.ast.ObjectClass;
import org.vhdlsema.ast.SrcPos;

/**
 * An analyzed declaration (a "named entity"). Declarations are created by an {@link Arena}, which
 * assigns each a stable {@link #id}; AST references point at declarations by id.
 *
 * <p>The concrete kinds are nested subclasses. Apart from the regions owned by {@link Library} and
 * {@link Package}, declarations are immutable.
 */
public abstract class Declaration {

  /** This declaration's index in its Arena. */
  public final int id;

  public final Designator designator;

  /** Where this declaration was written; predefined declarations use a synthetic position. */
  public final SrcPos pos;

  private Declaration(int id, Designator designator, SrcPos pos) {
    this.id = id;
    this.designator = designator;
    this.pos = pos;
  }

  /** A short description for diagnostics, e.g. {@code signal 'clk'}. */
  public abstract String describe();

  /** True for subprograms and enumeration literals, which may share a designator. */
  public boolean isOverloadable() {
    return false;
  }

  /** True for interface objects and interface files, the only elements of a FormalRegion. */
  public boolean isInterface() {
    return false;
  }

  /**
   * Returns the type mark of an object, interface file, or loop parameter, or null if there is none
   * or it could not be resolved.
   */
  public @Nullable TypeDecl typeMark() {
    return null;
  }

  @Override
  public String toString() {
    return describe();
  }

  /** A constant, signal, variable, or shared variable; an interface object if it has a mode. */
  public static final class ObjectDecl extends Declaration {
    public final ObjectClass objectClass;
    public final @Nullable Mode mode;
    private final @Nullable TypeDecl subtype;
    public final boolean hasDefault;

    ObjectDecl(
        int id,
        Designator designator,
        SrcPos pos,
        ObjectClass objectClass,
        @Nullable Mode mode,
        @Nullable TypeDecl subtype,
        boolean hasDefault) {
      super(id, designator, pos);
      Preconditions.checkArgument(objectClass != ObjectClass.FILE);
      this.objectClass = objectClass;
      this.mode = mode;
      this.subtype = subtype;
      this.hasDefault = hasDefault;
    }

    @Override
    public boolean isInterface() {
      return mode != null;
    }

    @Override
    public @Nullable TypeDecl typeMark() {
      return subtype;
    }

    @Override
    public String describe() {
      String prefix = isInterface() && objectClass == ObjectClass.SIGNAL ? "port" : "";
      if (prefix.isEmpty()) {
        return String.format("%s %s", objectClass.describe(), designator.quoted());
      }
      return String.format("%s %s", prefix, designator.quoted());
    }
  }

  /** A file interface object. */
  public static final class InterfaceFile extends Declaration {
    private final @Nullable TypeDecl fileType;

    InterfaceFile(int id, Designator designator, SrcPos pos, @Nullable TypeDecl fileType) {
      super(id, designator, pos);
      this.fileType = fileType;
    }

    @Override
    public boolean isInterface() {
      return true;
    }

    @Override
    public @Nullable TypeDecl typeMark() {
      return fileType;
    }

    @Override
    public String describe() {
      return "file " + designator.quoted();
    }
  }

  /**
   * A type or subtype. A subtype has a parent (its type mark) and shares the parent's kind and
   * base type; constraints are not modelled.
   */
  public static final class TypeDecl extends Declaration {

    public enum Kind {
      ENUMERATION,
      INTEGER,
      REAL,
      PHYSICAL,
      ARRAY,
      ACCESS,
      FILE,
      UNIVERSAL_INTEGER,
      UNIVERSAL_REAL
    }

    public final Kind kind;
    private final @Nullable TypeDecl parent;
    private final @Nullable TypeDecl indexType;
    private final @Nullable TypeDecl elementType;
    private final ImmutableList<Designator> literals;

    private TypeDecl(
        int id,
        Designator designator,
        SrcPos pos,
        Kind kind,
        @Nullable TypeDecl parent,
        @Nullable TypeDecl indexType,
        @Nullable TypeDecl elementType,
        List<Designator> literals) {
      super(id, designator, pos);
      this.kind = kind;
      this.parent = parent;
      this.indexType = indexType;
      this.elementType = elementType;
      this.literals = ImmutableList.copyOf(literals);
    }

    /** Creates a scalar or access type with no further structure. */
    static TypeDecl scalar(int id, Designator designator, SrcPos pos, Kind kind) {
      Preconditions.checkArgument(kind != Kind.ARRAY && kind != Kind.ENUMERATION);
      return new TypeDecl(id, designator, pos, kind, null, null, null, ImmutableList.of());
    }

    static TypeDecl enumeration(
        int id, Designator designator, SrcPos pos, List<Designator> literals) {
      return new TypeDecl(id, designator, pos, Kind.ENUMERATION, null, null, null, literals);
    }

    static TypeDecl array(
        int id,
        Designator designator,
        SrcPos pos,
        @Nullable TypeDecl indexType,
        @Nullable TypeDecl elementType) {
      return new TypeDecl(
          id, designator, pos, Kind.ARRAY, null, indexType, elementType, ImmutableList.of());
    }

    static TypeDecl subtype(int id, Designator designator, SrcPos pos, TypeDecl parent) {
      return new TypeDecl(
          id, designator, pos, parent.kind, parent, null, null, ImmutableList.of());
    }

    public boolean isSubtype() {
      return parent != null;
    }

    /** Returns the type this (sub)type is ultimately derived from. */
    public TypeDecl baseType() {
      TypeDecl t = this;
      while (t.parent != null) {
        t = t.parent;
      }
      return t;
    }

    /** The index type of an array type, or null. */
    public @Nullable TypeDecl indexType() {
      return baseType().indexType;
    }

    /** The element type of an array type, or null. */
    public @Nullable TypeDecl elementType() {
      return baseType().elementType;
    }

    /** The literals of an enumeration type, in declaration order. */
    public ImmutableList<Designator> literals() {
      return baseType().literals;
    }

    public boolean isUniversal() {
      return kind == Kind.UNIVERSAL_INTEGER || kind == Kind.UNIVERSAL_REAL;
    }

    /**
     * Returns true if a value of type {@code actual} may be used where {@code expected} is
     * required: the base types are the same, or {@code actual} is a universal type that converts
     * implicitly to {@code expected} (or vice versa, for formals of universal type).
     */
    public static boolean isCompatible(TypeDecl actual, TypeDecl expected) {
      TypeDecl a = actual.baseType();
      TypeDecl e = expected.baseType();
      if (a == e) {
        return true;
      }
      return convertsImplicitly(a, e) || convertsImplicitly(e, a);
    }

    private static boolean convertsImplicitly(TypeDecl universal, TypeDecl other) {
      return switch (universal.kind) {
        case UNIVERSAL_INTEGER -> other.kind == Kind.INTEGER;
        case UNIVERSAL_REAL -> other.kind == Kind.REAL;
        default -> false;
      };
    }

    @Override
    public String describe() {
      return (isSubtype() ? "subtype " : "type ") + designator.quoted();
    }
  }

  /** A statement label. */
  public static final class Label extends Declaration {
    Label(int id, Designator designator, SrcPos pos) {
      super(id, designator, pos);
    }

    @Override
    public String describe() {
      return "label " + designator.quoted();
    }
  }

  /**
   * An entity, component, or configuration. Entities and components own their generic and port
   * formal regions; a configuration uses those of the entity it configures.
   */
  public static final class DesignUnit extends Declaration {

    public enum UnitKind {
      ENTITY,
      COMPONENT,
      CONFIGURATION;

      public String describe() {
        return name().toLowerCase();
      }
    }

    public final UnitKind unitKind;
    private final @Nullable FormalRegion generics;
    private final @Nullable FormalRegion ports;
    private final @Nullable DesignUnit entity;

    private DesignUnit(
        int id,
        Designator designator,
        SrcPos pos,
        UnitKind unitKind,
        @Nullable FormalRegion generics,
        @Nullable FormalRegion ports,
        @Nullable DesignUnit entity) {
      super(id, designator, pos);
      this.unitKind = unitKind;
      this.generics = generics;
      this.ports = ports;
      this.entity = entity;
    }

    static DesignUnit entityOrComponent(
        int id,
        Designator designator,
        SrcPos pos,
        UnitKind unitKind,
        FormalRegion generics,
        FormalRegion ports) {
      Preconditions.checkArgument(unitKind != UnitKind.CONFIGURATION);
      Preconditions.checkArgument(generics.kind == FormalRegion.Kind.GENERIC);
      Preconditions.checkArgument(ports.kind == FormalRegion.Kind.PORT);
      return new DesignUnit(id, designator, pos, unitKind, generics, ports, null);
    }

    /** A configuration of {@code entity}, or of an unknown entity if it is null. */
    static DesignUnit configuration(
        int id, Designator designator, SrcPos pos, @Nullable DesignUnit entity) {
      Preconditions.checkArgument(entity == null || entity.unitKind == UnitKind.ENTITY);
      return new DesignUnit(id, designator, pos, UnitKind.CONFIGURATION, null, null, entity);
    }

    /** The configured entity of a configuration; null for entities and components. */
    public @Nullable DesignUnit entity() {
      return entity;
    }

    /** Returns the generic region, or null for a configuration of an unknown entity. */
    public @Nullable FormalRegion generics() {
      return (entity != null) ? entity.generics : generics;
    }

    /** Returns the port region, or null for a configuration of an unknown entity. */
    public @Nullable FormalRegion ports() {
      return (entity != null) ? entity.ports : ports;
    }

    @Override
    public String describe() {
      return unitKind.describe() + " " + designator.quoted();
    }
  }

  /** The index of a for loop or for generate; a constant of the range's type. */
  public static final class LoopParameter extends Declaration {
    private final @Nullable TypeDecl type;

    LoopParameter(int id, Designator designator, SrcPos pos, @Nullable TypeDecl type) {
      super(id, designator, pos);
      this.type = type;
    }

    @Override
    public @Nullable TypeDecl typeMark() {
      return type;
    }

    @Override
    public String describe() {
      return "loop parameter " + designator.quoted();
    }
  }

  /**
   * A function, procedure, or enumeration literal. Enumeration literals behave like parameterless
   * functions returning their type.
   */
  public static final class Overloaded extends Declaration {

    public enum OverloadKind {
      FUNCTION,
      PROCEDURE,
      ENUM_LITERAL
    }

    public final OverloadKind overloadKind;
    public final Signature signature;

    Overloaded(
        int id, Designator designator, SrcPos pos, OverloadKind overloadKind, Signature signature) {
      super(id, designator, pos);
      // A function whose return type mark did not resolve has no return type either.
      Preconditions.checkArgument(
          overloadKind != OverloadKind.PROCEDURE || signature.returnType() == null);
      this.overloadKind = overloadKind;
      this.signature = signature;
    }

    @Override
    public boolean isOverloadable() {
      return true;
    }

    public boolean isFunction() {
      return overloadKind != OverloadKind.PROCEDURE;
    }

    public FormalRegion formals() {
      return signature.formals;
    }

    @Override
    public String describe() {
      String kind =
          switch (overloadKind) {
            case FUNCTION -> "function ";
            case PROCEDURE -> "procedure ";
            case ENUM_LITERAL -> "enum literal ";
          };
      String name =
          (designator.kind == Designator.Kind.IDENTIFIER) ? designator.text : designator.toString();
      return kind + name + signature.describe();
    }
  }

  /** A unit of a physical type, e.g. {@code ns}. */
  public static final class PhysicalUnit extends Declaration {
    private final TypeDecl type;

    PhysicalUnit(int id, Designator designator, SrcPos pos, TypeDecl type) {
      super(id, designator, pos);
      Preconditions.checkArgument(type.kind == TypeDecl.Kind.PHYSICAL);
      this.type = type;
    }

    @Override
    public TypeDecl typeMark() {
      return type;
    }

    @Override
    public String describe() {
      return "physical unit " + designator.quoted();
    }
  }

  /** A design library; its region holds the library's primary units. */
  public static final class Library extends Declaration {
    public final Scope region;

    Library(int id, Designator designator, SrcPos pos) {
      super(id, designator, pos);
      this.region = Scope.root();
    }

    @Override
    public String describe() {
      return "library " + designator.quoted();
    }
  }

  /** A package; its region holds the package's declarations. */
  public static final class Package extends Declaration {
    public final Scope region;

    Package(int id, Designator designator, SrcPos pos, Scope region) {
      super(id, designator, pos);
      this.region = region;
    }

    @Override
    public String describe() {
      return "package " + designator.quoted();
    }
  }
}
