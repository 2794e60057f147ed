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
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * An expression in the abstract syntax tree. Names ({@link Name}) are expressions; the remaining
 * kinds are nested here.
 *
 * <p>The set of kinds is closed: every kind has a method in {@link Visitor}, so adding a kind
 * forces every analysis to handle it.
 */
public abstract class Expression {

  public final SrcPos pos;

  Expression(SrcPos pos) {
    this.pos = pos;
  }

  public abstract <T> T accept(Visitor<T> visitor);

  /** Calls {@code action} with each name reference in this expression, outermost first. */
  public abstract void forEachReference(Consumer<Reference> action);

  /** One method per kind of expression. */
  public interface Visitor<T> {
    T visitSimpleName(Name.Simple name);

    T visitSelectedName(Name.Selected name);

    T visitCallName(Name.Call name);

    T visitIntegerLiteral(IntegerLiteral literal);

    T visitRealLiteral(RealLiteral literal);

    T visitStringLiteral(StringLiteral literal);

    T visitNullLiteral(NullLiteral literal);

    T visitPhysicalLiteral(PhysicalLiteral literal);

    T visitBinary(Binary binary);

    T visitUnary(Unary unary);

    T visitQualified(Qualified qualified);

    T visitAggregate(Aggregate aggregate);
  }

  /** An abstract literal without a decimal point, e.g. {@code 42}. */
  public static final class IntegerLiteral extends Expression {
    public final long value;

    public IntegerLiteral(SrcPos pos, long value) {
      super(pos);
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIntegerLiteral(this);
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {}
  }

  /** An abstract literal with a decimal point, e.g. {@code 1.5}. */
  public static final class RealLiteral extends Expression {
    public final double value;

    public RealLiteral(SrcPos pos, double value) {
      super(pos);
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitRealLiteral(this);
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {}
  }

  /** A string literal; {@code value} excludes the enclosing quotes. */
  public static final class StringLiteral extends Expression {
    public final String value;

    public StringLiteral(SrcPos pos, String value) {
      super(pos);
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitStringLiteral(this);
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {}
  }

  /** The literal {@code null}. */
  public static final class NullLiteral extends Expression {
    public NullLiteral(SrcPos pos) {
      super(pos);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitNullLiteral(this);
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {}
  }

  /** A physical literal such as {@code 10 ns}; the unit is resolved like any other name. */
  public static final class PhysicalLiteral extends Expression {
    public final double value;
    public final Name.Simple unit;

    public PhysicalLiteral(SrcPos pos, double value, Name.Simple unit) {
      super(pos);
      this.value = value;
      this.unit = unit;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitPhysicalLiteral(this);
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {
      unit.forEachReference(action);
    }
  }

  /**
   * A binary operator application. The operator is kept as a name (with an operator designator)
   * so that it can be bound to the selected overload.
   */
  public static final class Binary extends Expression {
    public final Name.Simple operator;
    public final Expression left;
    public final Expression right;

    public Binary(Name.Simple operator, Expression left, Expression right) {
      super(left.pos);
      this.operator = operator;
      this.left = left;
      this.right = right;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBinary(this);
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {
      operator.forEachReference(action);
      left.forEachReference(action);
      right.forEachReference(action);
    }
  }

  /** A unary operator application, e.g. {@code -x} or {@code not b}. */
  public static final class Unary extends Expression {
    public final Name.Simple operator;
    public final Expression operand;

    public Unary(Name.Simple operator, Expression operand) {
      super(operator.pos);
      this.operator = operator;
      this.operand = operand;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitUnary(this);
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {
      operator.forEachReference(action);
      operand.forEachReference(action);
    }
  }

  /** A qualified expression {@code type_mark'(operand)}. */
  public static final class Qualified extends Expression {
    public final Name typeMark;
    public final Expression operand;

    public Qualified(Name typeMark, Expression operand) {
      super(typeMark.pos);
      this.typeMark = typeMark;
      this.operand = operand;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitQualified(this);
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {
      typeMark.forEachReference(action);
      operand.forEachReference(action);
    }
  }

  /**
   * An array aggregate with positional elements and an optional {@code others} element, e.g.
   * {@code ('1', '0', others => '0')}.
   */
  public static final class Aggregate extends Expression {
    public final ImmutableList<Expression> positional;
    public final @Nullable Expression others;

    public Aggregate(SrcPos pos, List<Expression> positional, @Nullable Expression others) {
      super(pos);
      this.positional = ImmutableList.copyOf(positional);
      this.others = others;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAggregate(this);
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {
      positional.forEach(e -> e.forEachReference(action));
      if (others != null) {
        others.forEachReference(action);
      }
    }
  }
}
