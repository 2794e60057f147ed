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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.vhdlsema.analysis.Declaration.DesignUnit;
import org.vhdlsema.ast.ArchitectureBody;
import org.vhdlsema.ast.AssignmentRhs;
import org.vhdlsema.ast.AssociationElement;
import org.vhdlsema.ast.ConcurrentStatement;
import org.vhdlsema.ast.ConcurrentStatement.Instance.UnitKind;
import org.vhdlsema.ast.ConfigurationDeclaration;
import org.vhdlsema.ast.DeclarativeItem;
import org.vhdlsema.ast.Designator;
import org.vhdlsema.ast.EntityDeclaration;
import org.vhdlsema.ast.Expression;
import org.vhdlsema.ast.Mode;
import org.vhdlsema.ast.Name;
import org.vhdlsema.ast.PackageDeclaration;
import org.vhdlsema.ast.SequentialStatement;
import org.vhdlsema.ast.SubtypeIndication;
import org.vhdlsema.ast.Waveform;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AnalyzerTest {

  private final Vhdl v = new Vhdl();
  private final Analyzer analyzer = new Analyzer();
  private final DiagnosticList diagnostics = new DiagnosticList();

  /** {@code entity <name> is generic (width : natural := 8); port (clk : in bit; q : out bit);} */
  private EntityDeclaration register(String name) {
    return new EntityDeclaration(
        v.ident(name),
        ImmutableList.of(v.generic("width", "natural", v.integer(8))),
        ImmutableList.of(v.port("clk", Mode.IN, "bit"), v.port("q", Mode.OUT, "bit")));
  }

  private ArchitectureBody architecture(
      String entity, DeclarativeItem[] declarations, ConcurrentStatement... statements) {
    return new ArchitectureBody(
        v.ident("rtl"),
        v.name(entity),
        ImmutableList.copyOf(declarations),
        ImmutableList.copyOf(statements));
  }

  private ConcurrentStatement.SignalAssignment drive(Name target, Expression value) {
    return new ConcurrentStatement.SignalAssignment(
        v.pos(), target, new AssignmentRhs.Simple<>(Waveform.of(value)));
  }

  private DesignUnit unit(String name) {
    return (DesignUnit) analyzer.workRegion().lookupLocal(Designator.identifier(name)).asSingle();
  }

  private static DeclarativeItem[] items(DeclarativeItem... items) {
    return items;
  }

  @Test
  public void entityAndArchitecture() {
    ArchitectureBody rtl =
        architecture(
            "reg",
            items(v.signal("state", "bit")),
            new ConcurrentStatement.Process(
                    v.pos(),
                    ImmutableList.of(v.name("clk")),
                    ImmutableList.of(),
                    ImmutableList.of(
                        new SequentialStatement.SignalAssignment(
                            v.pos(),
                            v.name("q"),
                            new AssignmentRhs.Simple<>(Waveform.of(v.name("state"))))))
                .labeled(v.ident("update")));

    assertThat(analyzer.analyzeEntity(register("reg"), diagnostics)).isTrue();
    assertThat(analyzer.analyzeArchitecture(rtl, diagnostics)).isTrue();

    assertThat(diagnostics.messages()).isEmpty();
    DesignUnit reg = unit("reg");
    assertThat(reg.unitKind).isEqualTo(DesignUnit.UnitKind.ENTITY);
    assertThat(reg.ports().size()).isEqualTo(2);
    assertThat(analyzer.declarationOf(rtl.entityName.reference)).isSameInstanceAs(reg);
  }

  @Test
  public void architecturePortsAreReadOnlyWhereTheModeSaysSo() {
    analyzer.analyzeEntity(register("reg"), diagnostics);

    analyzer.analyzeArchitecture(
        architecture("reg", items(), drive(v.name("clk"), v.name("q"))), diagnostics);

    assertThat(diagnostics.messages())
        .containsExactly("port 'clk' may not be the target of an assignment");
  }

  @Test
  public void architectureOfUnknownEntityIsStillAnalyzed() {
    boolean completed =
        analyzer.analyzeArchitecture(
            architecture("nothing", items(), drive(v.name("q"), v.character('1'))), diagnostics);

    assertThat(completed).isTrue();
    assertThat(diagnostics.messages())
        .containsExactly("No declaration of 'nothing'", "No declaration of 'q'")
        .inOrder();
  }

  @Test
  public void architectureOfAPackage() {
    analyzer.analyzePackage(
        new PackageDeclaration(v.ident("util"), ImmutableList.of()), diagnostics);

    analyzer.analyzeArchitecture(architecture("util", items()), diagnostics);

    assertThat(diagnostics.messages()).containsExactly("Expected entity, got package 'util'");
  }

  /** {@link #register} with {@code constant reset_value : bit := '0';} in its declarative part. */
  private EntityDeclaration registerWithConstant(String name) {
    return new EntityDeclaration(
        v.ident(name),
        ImmutableList.of(),
        ImmutableList.of(v.port("clk", Mode.IN, "bit"), v.port("q", Mode.OUT, "bit")),
        ImmutableList.of(v.constant("reset_value", "bit", v.character('0'))),
        ImmutableList.of());
  }

  @Test
  public void entityDeclarationsAreVisibleInTheArchitecture() {
    analyzer.analyzeEntity(registerWithConstant("reg"), diagnostics);
    Name.Simple value = v.name("reset_value");

    analyzer.analyzeArchitecture(
        architecture("reg", items(), drive(v.name("q"), value)), diagnostics);

    assertThat(diagnostics.messages()).isEmpty();
    assertThat(analyzer.declarationOf(value.reference).describe())
        .isEqualTo("constant 'reset_value'");
  }

  @Test
  public void architectureCannotRedeclareWhatTheEntityDeclares() {
    analyzer.analyzeEntity(registerWithConstant("reg"), diagnostics);

    analyzer.analyzeArchitecture(
        architecture("reg", items(v.signal("reset_value", "bit"), v.signal("clk", "bit"))),
        diagnostics);

    assertThat(diagnostics.messages())
        .containsExactly(
            "Duplicate declaration of 'reset_value'", "Duplicate declaration of 'clk'")
        .inOrder();
  }

  @Test
  public void architecturesOfOneEntityDoNotShareDeclarations() {
    analyzer.analyzeEntity(registerWithConstant("reg"), diagnostics);
    Name.Simple state = v.name("state");

    analyzer.analyzeArchitecture(
        architecture("reg", items(v.signal("state", "bit")), drive(v.name("q"), v.name("state"))),
        diagnostics);
    analyzer.analyzeArchitecture(
        architecture("reg", items(v.signal("state", "bit"))), diagnostics);
    analyzer.analyzeArchitecture(
        architecture("reg", items(), drive(v.name("q"), state)), diagnostics);

    assertThat(diagnostics.messages()).containsExactly("No declaration of 'state'");
    assertThat(state.reference.isSet()).isFalse();
  }

  @Test
  public void duplicateDesignUnits() {
    analyzer.analyzeEntity(register("reg"), diagnostics);
    analyzer.analyzeEntity(register("reg"), diagnostics);

    assertThat(diagnostics.messages()).containsExactly("Duplicate declaration of 'reg'");
  }

  @Test
  public void entityStatementsSeeThePorts() {
    EntityDeclaration checked =
        new EntityDeclaration(
            v.ident("checked"),
            ImmutableList.of(),
            ImmutableList.of(v.port("ok", Mode.IN, "boolean")),
            ImmutableList.of(),
            ImmutableList.of(
                new ConcurrentStatement.Assert(
                    v.pos(), false, v.name("ok"), v.string("not ok"), null)));

    assertThat(analyzer.analyzeEntity(checked, diagnostics)).isTrue();
    assertThat(diagnostics.messages()).isEmpty();
  }

  @Test
  public void packageDeclarationsThroughUseClauseAndSelectedNames() {
    PackageDeclaration util =
        new PackageDeclaration(
            v.ident("util"),
            ImmutableList.of(
                v.constant("depth", "integer", v.integer(16)),
                v.enumType("level", "low", "high"),
                v.function("invert", "level", v.parameter("l", "level"))));
    Name.Selected depth = v.selected("work", "util", "depth");
    ArchitectureBody rtl =
        architecture(
            "reg",
            items(
                new DeclarativeItem.UseClause(v.selected("work", "util"), true),
                v.signal("lvl", "level"),
                v.constant("d", "integer", depth)),
            drive(v.name("lvl"), v.call("invert", v.name("high"))));

    assertThat(analyzer.analyzePackage(util, diagnostics)).isTrue();
    analyzer.analyzeEntity(register("reg"), diagnostics);
    analyzer.analyzeArchitecture(rtl, diagnostics);

    assertThat(diagnostics.messages()).isEmpty();
    assertThat(analyzer.declarationOf(depth.suffix.reference).describe())
        .isEqualTo("constant 'depth'");
  }

  @Test
  public void packageContentsAreNotDirectlyVisibleWithoutUse() {
    analyzer.analyzePackage(
        new PackageDeclaration(
            v.ident("util"), ImmutableList.of(v.constant("depth", "integer", v.integer(16)))),
        diagnostics);
    analyzer.analyzeEntity(register("reg"), diagnostics);

    analyzer.analyzeArchitecture(
        architecture("reg", items(v.constant("d", "integer", v.name("depth")))), diagnostics);

    assertThat(diagnostics.messages()).containsExactly("No declaration of 'depth'");
  }

  @Test
  public void configurationSharesTheEntityInterface() {
    analyzer.analyzeEntity(register("reg"), diagnostics);

    boolean completed =
        analyzer.analyzeConfiguration(
            new ConfigurationDeclaration(v.ident("reg_cfg"), v.name("reg")), diagnostics);

    assertThat(completed).isTrue();
    assertThat(diagnostics.messages()).isEmpty();
    DesignUnit config = unit("reg_cfg");
    assertThat(config.unitKind).isEqualTo(DesignUnit.UnitKind.CONFIGURATION);
    assertThat(config.entity()).isSameInstanceAs(unit("reg"));
    assertThat(config.ports()).isSameInstanceAs(unit("reg").ports());
  }

  @Test
  public void configurationInstanceUsesTheEntityPorts() {
    analyzer.analyzeEntity(register("reg"), diagnostics);
    analyzer.analyzeConfiguration(
        new ConfigurationDeclaration(v.ident("reg_cfg"), v.selected("work", "reg")), diagnostics);
    analyzer.analyzeEntity(
        new EntityDeclaration(v.ident("top"), ImmutableList.of(), ImmutableList.of()),
        diagnostics);

    analyzer.analyzeArchitecture(
        architecture(
            "top",
            items(v.signal("clock", "bit"), v.signal("out_bit", "bit")),
            new ConcurrentStatement.Instance(
                    v.pos(),
                    UnitKind.CONFIGURATION,
                    v.selected("work", "reg_cfg"),
                    null,
                    ImmutableList.of(v.named("width", v.integer(4))),
                    ImmutableList.of(
                        v.named("clk", v.name("clock")), v.named("q", v.name("out_bit"))))
                .labeled(v.ident("u0")),
            new ConcurrentStatement.Instance(
                    v.pos(),
                    UnitKind.ENTITY,
                    v.selected("work", "reg"),
                    v.ident("rtl"),
                    ImmutableList.of(),
                    ImmutableList.of(v.named("q", v.name("out_bit"))))
                .labeled(v.ident("u1"))),
        diagnostics);

    assertThat(diagnostics.messages()).containsExactly("No association of port 'clk'");
  }

  @Test
  public void configurationOfSomethingElse() {
    analyzer.analyzePackage(
        new PackageDeclaration(v.ident("util"), ImmutableList.of()), diagnostics);

    analyzer.analyzeConfiguration(
        new ConfigurationDeclaration(v.ident("cfg"), v.name("util")), diagnostics);
    analyzer.analyzeConfiguration(
        new ConfigurationDeclaration(v.ident("cfg2"), v.name("missing")), diagnostics);

    assertThat(diagnostics.messages())
        .containsExactly("Expected entity, got package 'util'", "No declaration of 'missing'")
        .inOrder();
    // Still declared, with an unknown interface.
    assertThat(unit("cfg").ports()).isNull();
  }

  @Test
  public void invalidFormalAbandonsTheUnitButKeepsEarlierDiagnostics() {
    analyzer.analyzeEntity(register("reg"), diagnostics);
    AssociationElement invalid =
        AssociationElement.named(v.selected("clk", "field"), v.name("clock"));

    boolean completed =
        analyzer.analyzeArchitecture(
            architecture(
                "reg",
                items(v.signal("clock", "bit")),
                drive(v.name("ghost"), v.character('0')),
                new ConcurrentStatement.Instance(
                    v.pos(),
                    UnitKind.ENTITY,
                    v.selected("work", "reg"),
                    null,
                    ImmutableList.of(),
                    ImmutableList.of(invalid)),
                drive(v.name("never_reached"), v.character('0'))),
            diagnostics);

    assertThat(completed).isFalse();
    assertThat(diagnostics.messages()).hasSize(2);
    assertThat(diagnostics.messages().get(0)).isEqualTo("No declaration of 'ghost'");
    assertThat(diagnostics.messages().get(1)).startsWith("Invalid formal part");
    assertThat(diagnostics.diagnostics().get(1).pos).isEqualTo(invalid.formal.pos);
    assertThrows(IllegalStateException.class, analyzer.journal::rollback);
  }

  @Test
  public void invalidFormalInsideAnOverloadTrialLeavesNothingBound() {
    analyzer.analyzeEntity(register("reg"), diagnostics);
    Name.Simple argument = v.name("state");
    Name.Call call =
        v.callWith(
            "f",
            AssociationElement.named(
                new Name.Call(v.name("x"), ImmutableList.of(v.positional(v.integer(0)))),
                argument),
            AssociationElement.named(v.selected("x", "y"), v.integer(1)));

    boolean completed =
        analyzer.analyzeArchitecture(
            architecture(
                "reg",
                items(
                    v.signal("state", "bit"),
                    v.function("f", "bit", v.parameter("x", "bit_vector")),
                    v.function("f", "bit", v.parameter("x", "string"))),
                drive(v.name("q"), call)),
            diagnostics);

    assertThat(completed).isFalse();
    assertThat(diagnostics.messages()).hasSize(1);
    assertThat(diagnostics.messages().get(0)).startsWith("Invalid formal part");
    assertThat(argument.reference.isSet()).isFalse();
    assertThrows(IllegalStateException.class, analyzer.journal::rollback);
  }

  @Test
  public void standardPackageIsVisibleEverywhere() {
    Name.Selected qualified = v.selected("std", "standard", "bit");

    analyzer.analyzeEntity(
        new EntityDeclaration(
            v.ident("e"),
            ImmutableList.of(),
            ImmutableList.of(v.port("p", Mode.IN, "std_logic_missing"))),
        diagnostics);
    analyzer.analyzePackage(
        new PackageDeclaration(
            v.ident("p"),
            ImmutableList.of(
                new DeclarativeItem.SubtypeDeclaration(
                    v.ident("b"), new SubtypeIndication(qualified)))),
        diagnostics);

    assertThat(diagnostics.messages()).containsExactly("No declaration of 'std_logic_missing'");
    assertThat(analyzer.declarationOf(qualified.suffix.reference))
        .isSameInstanceAs(analyzer.standard().bit);
  }
}
