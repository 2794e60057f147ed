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

package org.vhdlsema.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** An item of a declarative part (of an architecture, block, process, package or subprogram). */
public abstract class DeclarativeItem {

  public final SrcPos pos;

  DeclarativeItem(SrcPos pos) {
    this.pos = pos;
  }

  public abstract <T> T accept(Visitor<T> visitor);

  /** One method per kind of declarative item. */
  public interface Visitor<T> {
    T visitObjectDeclaration(ObjectDeclaration decl);

    T visitSubtypeDeclaration(SubtypeDeclaration decl);

    T visitEnumerationTypeDeclaration(EnumerationTypeDeclaration decl);

    T visitIntegerTypeDeclaration(IntegerTypeDeclaration decl);

    T visitArrayTypeDeclaration(ArrayTypeDeclaration decl);

    T visitComponentDeclaration(ComponentDeclaration decl);

    T visitSubprogramDeclaration(SubprogramDeclaration decl);

    T visitSubprogramBody(SubprogramBody body);

    T visitUseClause(UseClause use);
  }

  /** {@code signal a, b : bit := '0';} and likewise for constants and variables. */
  public static final class ObjectDeclaration extends DeclarativeItem {
    public final ObjectClass objectClass;
    public final ImmutableList<Ident> idents;
    public final SubtypeIndication subtype;
    public final @Nullable Expression defaultValue;

    public ObjectDeclaration(
        ObjectClass objectClass,
        List<Ident> idents,
        SubtypeIndication subtype,
        @Nullable Expression defaultValue) {
      super(idents.get(0).pos);
      this.objectClass = objectClass;
      this.idents = ImmutableList.copyOf(idents);
      this.subtype = subtype;
      this.defaultValue = defaultValue;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitObjectDeclaration(this);
    }
  }

  /** {@code subtype byte_index is integer range 0 to 7;} */
  public static final class SubtypeDeclaration extends DeclarativeItem {
    public final Ident ident;
    public final SubtypeIndication subtype;

    public SubtypeDeclaration(Ident ident, SubtypeIndication subtype) {
      super(ident.pos);
      this.ident = ident;
      this.subtype = subtype;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSubtypeDeclaration(this);
    }
  }

  /** {@code type state_t is (idle, busy, 'x');} */
  public static final class EnumerationTypeDeclaration extends DeclarativeItem {
    public final Ident ident;
    public final ImmutableList<Designator> literals;

    public EnumerationTypeDeclaration(Ident ident, List<Designator> literals) {
      super(ident.pos);
      this.ident = ident;
      this.literals = ImmutableList.copyOf(literals);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitEnumerationTypeDeclaration(this);
    }
  }

  /** {@code type count_t is range 0 to 255;} */
  public static final class IntegerTypeDeclaration extends DeclarativeItem {
    public final Ident ident;
    public final DiscreteRange.Range range;

    public IntegerTypeDeclaration(Ident ident, DiscreteRange.Range range) {
      super(ident.pos);
      this.ident = ident;
      this.range = range;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIntegerTypeDeclaration(this);
    }
  }

  /** {@code type word_t is array (0 to 15) of bit;} */
  public static final class ArrayTypeDeclaration extends DeclarativeItem {
    public final Ident ident;
    public final DiscreteRange index;
    public final SubtypeIndication element;

    public ArrayTypeDeclaration(Ident ident, DiscreteRange index, SubtypeIndication element) {
      super(ident.pos);
      this.ident = ident;
      this.index = index;
      this.element = element;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitArrayTypeDeclaration(this);
    }
  }

  /** {@code component counter is generic (...); port (...); end component;} */
  public static final class ComponentDeclaration extends DeclarativeItem {
    public final Ident ident;
    public final ImmutableList<InterfaceDeclaration> generics;
    public final ImmutableList<InterfaceDeclaration> ports;

    public ComponentDeclaration(
        Ident ident, List<InterfaceDeclaration> generics, List<InterfaceDeclaration> ports) {
      super(ident.pos);
      this.ident = ident;
      this.generics = ImmutableList.copyOf(generics);
      this.ports = ImmutableList.copyOf(ports);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitComponentDeclaration(this);
    }
  }

  /** A subprogram specification without a body. */
  public static final class SubprogramDeclaration extends DeclarativeItem {
    public final SubprogramSpecification specification;

    public SubprogramDeclaration(SubprogramSpecification specification) {
      super(specification.pos);
      this.specification = specification;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSubprogramDeclaration(this);
    }
  }

  /** A subprogram with its declarative part and statements. */
  public static final class SubprogramBody extends DeclarativeItem {
    public final SubprogramSpecification specification;
    public final ImmutableList<DeclarativeItem> declarations;
    public final ImmutableList<SequentialStatement> statements;

    public SubprogramBody(
        SubprogramSpecification specification,
        List<DeclarativeItem> declarations,
        List<SequentialStatement> statements) {
      super(specification.pos);
      this.specification = specification;
      this.declarations = ImmutableList.copyOf(declarations);
      this.statements = ImmutableList.copyOf(statements);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSubprogramBody(this);
    }
  }

  /**
   * {@code use work.pkg.all;} (with {@code all} true and {@code name} denoting the package) or
   * {@code use work.pkg.item;}.
   */
  public static final class UseClause extends DeclarativeItem {
    public final Name.Selected name;
    public final boolean all;

    public UseClause(Name.Selected name, boolean all) {
      super(name.pos);
      this.name = name;
      this.all = all;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitUseClause(this);
    }
  }
}
