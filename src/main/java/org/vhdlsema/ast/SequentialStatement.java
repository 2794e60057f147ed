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

/**
 * A statement of a process or subprogram body. Every statement may carry a label; the set of kinds
 * is closed and enumerated by {@link Visitor}.
 */
public abstract class SequentialStatement {

  public final SrcPos pos;
  private @Nullable Ident label;

  SequentialStatement(SrcPos pos) {
    this.pos = pos;
  }

  public @Nullable Ident label() {
    return label;
  }

  /** Sets this statement's label; returns this statement for convenience. */
  @SuppressWarnings("unchecked")
  public <S extends SequentialStatement> S labeled(Ident label) {
    this.label = label;
    return (S) this;
  }

  public abstract <T> T accept(Visitor<T> visitor);

  /** One method per kind of sequential statement. */
  public interface Visitor<T> {
    T visitWait(Wait stmt);

    T visitAssert(Assert stmt);

    T visitReport(Report stmt);

    T visitVariableAssignment(VariableAssignment stmt);

    T visitSignalAssignment(SignalAssignment stmt);

    T visitSignalForceAssignment(SignalForceAssignment stmt);

    T visitSignalReleaseAssignment(SignalReleaseAssignment stmt);

    T visitProcedureCall(ProcedureCall stmt);

    T visitIf(If stmt);

    T visitCase(Case stmt);

    T visitLoop(Loop stmt);

    T visitNext(Next stmt);

    T visitExit(Exit stmt);

    T visitReturn(Return stmt);

    T visitNull(Null stmt);
  }

  /** {@code wait [on sensitivity] [until condition] [for timeout];} */
  public static final class Wait extends SequentialStatement {
    public final ImmutableList<Name> sensitivity;
    public final @Nullable Expression condition;
    public final @Nullable Expression timeout;

    public Wait(
        SrcPos pos,
        List<Name> sensitivity,
        @Nullable Expression condition,
        @Nullable Expression timeout) {
      super(pos);
      this.sensitivity = ImmutableList.copyOf(sensitivity);
      this.condition = condition;
      this.timeout = timeout;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitWait(this);
    }
  }

  /** {@code assert condition [report message] [severity level];} */
  public static final class Assert extends SequentialStatement {
    public final Expression condition;
    public final @Nullable Expression report;
    public final @Nullable Expression severity;

    public Assert(
        SrcPos pos,
        Expression condition,
        @Nullable Expression report,
        @Nullable Expression severity) {
      super(pos);
      this.condition = condition;
      this.report = report;
      this.severity = severity;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAssert(this);
    }
  }

  /** {@code report message [severity level];} */
  public static final class Report extends SequentialStatement {
    public final Expression report;
    public final @Nullable Expression severity;

    public Report(SrcPos pos, Expression report, @Nullable Expression severity) {
      super(pos);
      this.report = report;
      this.severity = severity;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitReport(this);
    }
  }

  /** {@code target := value;} */
  public static final class VariableAssignment extends SequentialStatement {
    public final Name target;
    public final AssignmentRhs<Expression> rhs;

    public VariableAssignment(SrcPos pos, Name target, AssignmentRhs<Expression> rhs) {
      super(pos);
      this.target = target;
      this.rhs = rhs;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitVariableAssignment(this);
    }
  }

  /** {@code target <= waveform;} */
  public static final class SignalAssignment extends SequentialStatement {
    public final Name target;
    public final AssignmentRhs<Waveform> rhs;

    public SignalAssignment(SrcPos pos, Name target, AssignmentRhs<Waveform> rhs) {
      super(pos);
      this.target = target;
      this.rhs = rhs;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSignalAssignment(this);
    }
  }

  /** {@code target <= force value;} */
  public static final class SignalForceAssignment extends SequentialStatement {
    public final Name target;
    public final AssignmentRhs<Expression> rhs;

    public SignalForceAssignment(SrcPos pos, Name target, AssignmentRhs<Expression> rhs) {
      super(pos);
      this.target = target;
      this.rhs = rhs;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSignalForceAssignment(this);
    }
  }

  /** {@code target <= release;} */
  public static final class SignalReleaseAssignment extends SequentialStatement {
    public final Name target;

    public SignalReleaseAssignment(SrcPos pos, Name target) {
      super(pos);
      this.target = target;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSignalReleaseAssignment(this);
    }
  }

  /** {@code name;} or {@code name(arguments);} */
  public static final class ProcedureCall extends SequentialStatement {
    public final Name call;

    public ProcedureCall(SrcPos pos, Name call) {
      super(pos);
      this.call = call;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitProcedureCall(this);
    }
  }

  /** {@code if c1 then ... elsif c2 then ... else ... end if;} */
  public static final class If extends SequentialStatement {
    public final ImmutableList<Conditional<ImmutableList<SequentialStatement>>> conditionals;
    public final @Nullable ImmutableList<SequentialStatement> elseItem;

    public If(
        SrcPos pos,
        List<Conditional<ImmutableList<SequentialStatement>>> conditionals,
        @Nullable List<SequentialStatement> elseItem) {
      super(pos);
      this.conditionals = ImmutableList.copyOf(conditionals);
      this.elseItem = (elseItem == null) ? null : ImmutableList.copyOf(elseItem);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIf(this);
    }
  }

  /** {@code case expression is when choices => ... end case;} */
  public static final class Case extends SequentialStatement {
    public final Expression expression;
    public final ImmutableList<Alternative<ImmutableList<SequentialStatement>>> alternatives;

    public Case(
        SrcPos pos,
        Expression expression,
        List<Alternative<ImmutableList<SequentialStatement>>> alternatives) {
      super(pos);
      this.expression = expression;
      this.alternatives = ImmutableList.copyOf(alternatives);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCase(this);
    }
  }

  /**
   * {@code [for index in range | while condition] loop ... end loop;}. At most one of {@link
   * #forIndex} and {@link #whileCondition} is set; neither is set for a plain {@code loop}.
   */
  public static final class Loop extends SequentialStatement {
    public final @Nullable Ident forIndex;
    public final @Nullable DiscreteRange forRange;
    public final @Nullable Expression whileCondition;
    public final ImmutableList<SequentialStatement> statements;

    private Loop(
        SrcPos pos,
        @Nullable Ident forIndex,
        @Nullable DiscreteRange forRange,
        @Nullable Expression whileCondition,
        List<SequentialStatement> statements) {
      super(pos);
      this.forIndex = forIndex;
      this.forRange = forRange;
      this.whileCondition = whileCondition;
      this.statements = ImmutableList.copyOf(statements);
    }

    public static Loop forLoop(
        SrcPos pos, Ident index, DiscreteRange range, List<SequentialStatement> statements) {
      return new Loop(pos, index, range, null, statements);
    }

    public static Loop whileLoop(
        SrcPos pos, Expression condition, List<SequentialStatement> statements) {
      return new Loop(pos, null, null, condition, statements);
    }

    public static Loop plain(SrcPos pos, List<SequentialStatement> statements) {
      return new Loop(pos, null, null, null, statements);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLoop(this);
    }
  }

  /** {@code next [label] [when condition];} */
  public static final class Next extends SequentialStatement {
    public final Name.@Nullable Simple loopLabel;
    public final @Nullable Expression condition;

    public Next(SrcPos pos, Name.@Nullable Simple loopLabel, @Nullable Expression condition) {
      super(pos);
      this.loopLabel = loopLabel;
      this.condition = condition;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitNext(this);
    }
  }

  /** {@code exit [label] [when condition];} */
  public static final class Exit extends SequentialStatement {
    public final Name.@Nullable Simple loopLabel;
    public final @Nullable Expression condition;

    public Exit(SrcPos pos, Name.@Nullable Simple loopLabel, @Nullable Expression condition) {
      super(pos);
      this.loopLabel = loopLabel;
      this.condition = condition;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitExit(this);
    }
  }

  /** {@code return [expression];} */
  public static final class Return extends SequentialStatement {
    public final @Nullable Expression expression;

    public Return(SrcPos pos, @Nullable Expression expression) {
      super(pos);
      this.expression = expression;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitReturn(this);
    }
  }

  /** {@code null;} */
  public static final class Null extends SequentialStatement {
    public Null(SrcPos pos) {
      super(pos);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitNull(this);
    }
  }
}
