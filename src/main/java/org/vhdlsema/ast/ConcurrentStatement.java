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
 * A statement of an architecture, block, or generate body. Every statement may carry a label; the
 * set of kinds is closed and enumerated by {@link Visitor}.
 */
public abstract class ConcurrentStatement {

  public final SrcPos pos;
  private @Nullable Ident label;

  ConcurrentStatement(SrcPos pos) {
    this.pos = pos;
  }

  public @Nullable Ident label() {
    return label;
  }

  /** Sets this statement's label; returns this statement for convenience. */
  @SuppressWarnings("unchecked")
  public <S extends ConcurrentStatement> S labeled(Ident label) {
    this.label = label;
    return (S) this;
  }

  public abstract <T> T accept(Visitor<T> visitor);

  /** One method per kind of concurrent statement. */
  public interface Visitor<T> {
    T visitBlock(Block stmt);

    T visitProcess(Process stmt);

    T visitForGenerate(ForGenerate stmt);

    T visitIfGenerate(IfGenerate stmt);

    T visitCaseGenerate(CaseGenerate stmt);

    T visitInstance(Instance stmt);

    T visitSignalAssignment(SignalAssignment stmt);

    T visitProcedureCall(ProcedureCall stmt);

    T visitAssert(Assert stmt);
  }

  /**
   * {@code label: block [(guard)] [generic (...); [generic map (...);]] [port (...); [port map
   * (...);]] declarations begin statements end block;}
   *
   * <p>Null clause or map lists mean the clause or map is absent.
   */
  public static final class Block extends ConcurrentStatement {
    public final @Nullable Expression guardCondition;
    public final @Nullable ImmutableList<InterfaceDeclaration> genericClause;
    public final @Nullable ImmutableList<AssociationElement> genericMap;
    public final @Nullable ImmutableList<InterfaceDeclaration> portClause;
    public final @Nullable ImmutableList<AssociationElement> portMap;
    public final ImmutableList<DeclarativeItem> declarations;
    public final ImmutableList<ConcurrentStatement> statements;

    public Block(
        SrcPos pos,
        @Nullable Expression guardCondition,
        @Nullable List<InterfaceDeclaration> genericClause,
        @Nullable List<AssociationElement> genericMap,
        @Nullable List<InterfaceDeclaration> portClause,
        @Nullable List<AssociationElement> portMap,
        List<DeclarativeItem> declarations,
        List<ConcurrentStatement> statements) {
      super(pos);
      this.guardCondition = guardCondition;
      this.genericClause = copyOrNull(genericClause);
      this.genericMap = copyOrNull(genericMap);
      this.portClause = copyOrNull(portClause);
      this.portMap = copyOrNull(portMap);
      this.declarations = ImmutableList.copyOf(declarations);
      this.statements = ImmutableList.copyOf(statements);
    }

    /** A block without guard or header. */
    public Block(
        SrcPos pos, List<DeclarativeItem> declarations, List<ConcurrentStatement> statements) {
      this(pos, null, null, null, null, null, declarations, statements);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBlock(this);
    }
  }

  /**
   * {@code [postponed] process [(sensitivity) | (all)] declarations begin statements end process;}
   *
   * <p>If {@code sensitivityAll} is false an empty {@code sensitivity} list means the process has
   * no sensitivity list.
   */
  public static final class Process extends ConcurrentStatement {
    public final boolean postponed;
    public final boolean sensitivityAll;
    public final ImmutableList<Name> sensitivity;
    public final ImmutableList<DeclarativeItem> declarations;
    public final ImmutableList<SequentialStatement> statements;

    public Process(
        SrcPos pos,
        boolean postponed,
        boolean sensitivityAll,
        List<Name> sensitivity,
        List<DeclarativeItem> declarations,
        List<SequentialStatement> statements) {
      super(pos);
      this.postponed = postponed;
      this.sensitivityAll = sensitivityAll;
      this.sensitivity = ImmutableList.copyOf(sensitivity);
      this.declarations = ImmutableList.copyOf(declarations);
      this.statements = ImmutableList.copyOf(statements);
    }

    public Process(
        SrcPos pos,
        List<Name> sensitivity,
        List<DeclarativeItem> declarations,
        List<SequentialStatement> statements) {
      this(pos, false, false, sensitivity, declarations, statements);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitProcess(this);
    }
  }

  /** {@code label: for index in range generate body end generate;} */
  public static final class ForGenerate extends ConcurrentStatement {
    public final Ident index;
    public final DiscreteRange range;
    public final GenerateBody body;

    public ForGenerate(SrcPos pos, Ident index, DiscreteRange range, GenerateBody body) {
      super(pos);
      this.index = index;
      this.range = range;
      this.body = body;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitForGenerate(this);
    }
  }

  /** {@code label: if c1 generate ... elsif c2 generate ... else generate ... end generate;} */
  public static final class IfGenerate extends ConcurrentStatement {
    public final ImmutableList<Conditional<GenerateBody>> conditionals;
    public final @Nullable GenerateBody elseItem;

    public IfGenerate(
        SrcPos pos, List<Conditional<GenerateBody>> conditionals, @Nullable GenerateBody elseItem) {
      super(pos);
      this.conditionals = ImmutableList.copyOf(conditionals);
      this.elseItem = elseItem;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIfGenerate(this);
    }
  }

  /** {@code label: case expression generate when choices => ... end generate;} */
  public static final class CaseGenerate extends ConcurrentStatement {
    public final Expression expression;
    public final ImmutableList<Alternative<GenerateBody>> alternatives;

    public CaseGenerate(
        SrcPos pos, Expression expression, List<Alternative<GenerateBody>> alternatives) {
      super(pos);
      this.expression = expression;
      this.alternatives = ImmutableList.copyOf(alternatives);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCaseGenerate(this);
    }
  }

  /**
   * {@code label: entity work.e(arch) | component c | configuration cfg generic map (...) port map
   * (...);}
   */
  public static final class Instance extends ConcurrentStatement {

    /** The kind of design unit named by an instantiation. */
    public enum UnitKind {
      ENTITY,
      COMPONENT,
      CONFIGURATION
    }

    public final UnitKind unitKind;
    public final Name unitName;
    public final @Nullable Ident architecture;
    public final ImmutableList<AssociationElement> genericMap;
    public final ImmutableList<AssociationElement> portMap;

    public Instance(
        SrcPos pos,
        UnitKind unitKind,
        Name unitName,
        @Nullable Ident architecture,
        List<AssociationElement> genericMap,
        List<AssociationElement> portMap) {
      super(pos);
      this.unitKind = unitKind;
      this.unitName = unitName;
      this.architecture = architecture;
      this.genericMap = ImmutableList.copyOf(genericMap);
      this.portMap = ImmutableList.copyOf(portMap);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitInstance(this);
    }
  }

  /** A concurrent signal assignment: simple, conditional, or selected. */
  public static final class SignalAssignment extends ConcurrentStatement {
    public final boolean postponed;
    public final Name target;
    public final AssignmentRhs<Waveform> rhs;

    public SignalAssignment(
        SrcPos pos, boolean postponed, Name target, AssignmentRhs<Waveform> rhs) {
      super(pos);
      this.postponed = postponed;
      this.target = target;
      this.rhs = rhs;
    }

    public SignalAssignment(SrcPos pos, Name target, AssignmentRhs<Waveform> rhs) {
      this(pos, false, target, rhs);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSignalAssignment(this);
    }
  }

  /** A concurrent procedure call. */
  public static final class ProcedureCall extends ConcurrentStatement {
    public final boolean postponed;
    public final Name call;

    public ProcedureCall(SrcPos pos, boolean postponed, Name call) {
      super(pos);
      this.postponed = postponed;
      this.call = call;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitProcedureCall(this);
    }
  }

  /** A concurrent assertion. */
  public static final class Assert extends ConcurrentStatement {
    public final boolean postponed;
    public final Expression condition;
    public final @Nullable Expression report;
    public final @Nullable Expression severity;

    public Assert(
        SrcPos pos,
        boolean postponed,
        Expression condition,
        @Nullable Expression report,
        @Nullable Expression severity) {
      super(pos);
      this.postponed = postponed;
      this.condition = condition;
      this.report = report;
      this.severity = severity;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAssert(this);
    }
  }

  private static <T> @Nullable ImmutableList<T> copyOrNull(@Nullable List<T> list) {
    return (list == null) ? null : ImmutableList.copyOf(list);
  }
}
