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
import org.vhdlsema.analysis.Declaration.Overloaded;
import org.vhdlsema.analysis.Declaration.TypeDecl;
import org.vhdlsema.ast.DeclarativeItem;
import org.vhdlsema.ast.Designator;
import org.vhdlsema.ast.Expression;
import org.vhdlsema.ast.Name;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OverloadResolverTest {

  private final Vhdl v = new Vhdl();
  private final Analyzer analyzer = new Analyzer();
  private final DiagnosticList diagnostics = new DiagnosticList();

  /** Returns a region nested in the root that holds {@code items}, which must be error-free. */
  private Scope declare(DeclarativeItem... items) {
    Scope scope = analyzer.rootScope().nested();
    DiagnosticList setup = new DiagnosticList();
    analyzer.declarations.analyzeDeclarativePart(scope, ImmutableList.copyOf(items), setup);
    assertThat(setup.messages()).isEmpty();
    return scope;
  }

  private TypeCheck check(Scope scope, TypeDecl target, Expression expr) {
    return analyzer.expressions.analyzeWithTargetType(scope, target, expr, diagnostics);
  }

  private TypeDecl type(Scope scope, String name) {
    return (TypeDecl) scope.lookup(Designator.identifier(name)).asSingle();
  }

  private Declaration boundTo(Name.Simple name) {
    return analyzer.declarationOf(name.reference);
  }

  @Test
  public void returnTypeSelectsAmongSameParameterProfiles() {
    Scope scope =
        declare(
            v.function("f", "boolean", v.parameter("a", "integer"), v.parameter("b", "integer")),
            v.function("f", "integer", v.parameter("a", "integer"), v.parameter("b", "integer")));
    Name.Call call = v.call("f", v.integer(1), v.integer(2));

    TypeCheck result = check(scope, analyzer.std.booleanType, call);

    assertThat(result).isEqualTo(TypeCheck.OK);
    assertThat(diagnostics.messages()).isEmpty();
    Overloaded chosen = (Overloaded) boundTo((Name.Simple) call.prefix);
    assertThat(chosen.signature.returnType()).isSameInstanceAs(analyzer.std.booleanType);
  }

  @Test
  public void twoMismatchedNullaryCandidatesAreBothListed() {
    Scope scope = declare(v.function("g", "boolean"), v.function("g", "integer"));
    Name.Simple g = v.name("g");

    TypeCheck result = check(scope, analyzer.std.time, g);

    assertThat(result).isEqualTo(TypeCheck.NOT_OK);
    assertThat(diagnostics.messages()).containsExactly("Could not resolve 'g'");
    assertThat(diagnostics.diagnostics().get(0).related().stream().map(r -> r.message))
        .containsExactly(
            "Does not match function g[return boolean]",
            "Does not match function g[return integer]")
        .inOrder();
    assertThat(g.reference.isSet()).isFalse();
  }

  @Test
  public void singleMismatchedLiteralIsReportedDirectlyAndStillBound() {
    Scope scope = declare(v.enumType("color", "red", "green"));
    Name.Simple red = v.name("red");

    TypeCheck result = check(scope, analyzer.std.integer, red);

    assertThat(result).isEqualTo(TypeCheck.NOT_OK);
    assertThat(diagnostics.messages()).containsExactly("'red' does not match type 'integer'");
    assertThat(diagnostics.diagnostics().get(0).related()).isEmpty();
    assertThat(boundTo(red).designator).isEqualTo(Designator.identifier("red"));
  }

  @Test
  public void singleMismatchedCallReportsTheArgumentMismatch() {
    Scope scope = declare(v.function("f", "boolean", v.parameter("x", "bit")));
    Name.Call call = v.call("f", v.integer(3));

    TypeCheck result = check(scope, analyzer.std.booleanType, call);

    assertThat(result).isEqualTo(TypeCheck.NOT_OK);
    assertThat(diagnostics.messages()).containsExactly("integer literal does not match type 'bit'");
    assertThat(boundTo((Name.Simple) call.prefix)).isInstanceOf(Overloaded.class);
  }

  @Test
  public void ambiguousCallListsEveryMatchAndBindsNothing() {
    Scope scope =
        declare(
            v.integerType("small", 0, 10),
            v.function("f", "boolean", v.parameter("x", "integer")),
            v.function("f", "boolean", v.parameter("x", "small")));
    Name.Call call = v.call("f", v.integer(1));

    TypeCheck result = check(scope, analyzer.std.booleanType, call);

    assertThat(result).isEqualTo(TypeCheck.UNKNOWN);
    assertThat(diagnostics.messages()).containsExactly("Ambiguous use of 'f'");
    assertThat(diagnostics.diagnostics().get(0).related().stream().map(r -> r.message))
        .containsExactly(
            "Might be function f[integer return boolean]",
            "Might be function f[small return boolean]")
        .inOrder();
    assertThat(((Name.Simple) call.prefix).reference.isSet()).isFalse();
  }

  @Test
  public void unresolvedArgumentNeverMakesACallAmbiguous() {
    Scope scope =
        declare(
            v.integerType("small", 0, 10),
            v.function("f", "boolean", v.parameter("x", "integer")),
            v.function("f", "boolean", v.parameter("x", "small")));
    Name.Call call = v.call("f", v.name("nowhere"));

    TypeCheck result = check(scope, analyzer.std.booleanType, call);

    assertThat(result).isEqualTo(TypeCheck.UNKNOWN);
    assertThat(diagnostics.messages()).containsExactly("No declaration of 'nowhere'");
    assertThat(((Name.Simple) call.prefix).reference.isSet()).isFalse();
  }

  @Test
  public void unresolvedArgumentOfSingleCandidateGivesUnknown() {
    Scope scope =
        declare(
            v.function("f", "boolean", v.parameter("x", "integer"), v.parameter("y", "integer")));
    Name.Call call = v.call("f", v.integer(1), v.name("nowhere"));

    assertThat(check(scope, analyzer.std.booleanType, call)).isEqualTo(TypeCheck.UNKNOWN);
    assertThat(diagnostics.messages()).containsExactly("No declaration of 'nowhere'");
  }

  @Test
  public void rejectedCandidatesLeaveNoBindingsBehind() {
    Scope scope =
        declare(
            v.enumType("t1", "a", "b"),
            v.enumType("t2", "d", "e"),
            v.enumType("t3", "a", "c"),
            v.function("f", "boolean", v.parameter("x", "t1"), v.parameter("y", "t1")),
            v.function("f", "boolean", v.parameter("x", "t3"), v.parameter("y", "t2")));
    Name.Simple a = v.name("a");
    Name.Call call = v.call(v.name("f"), a, v.integer(1));

    TypeCheck result = check(scope, analyzer.std.booleanType, call);

    assertThat(result).isEqualTo(TypeCheck.NOT_OK);
    assertThat(diagnostics.messages()).containsExactly("Could not resolve 'f'");
    assertThat(diagnostics.diagnostics().get(0).related()).hasSize(2);
    // Each trial bound 'a' to a different literal; both bindings were undone.
    assertThat(a.reference.isSet()).isFalse();
    assertThat(((Name.Simple) call.prefix).reference.isSet()).isFalse();
  }

  @Test
  public void chosenCandidateRebindsArgumentsTheTrialsUndid() {
    Scope scope =
        declare(
            v.enumType("t1", "a", "b"),
            v.enumType("t3", "a", "c"),
            v.function("f", "boolean", v.parameter("x", "t1"), v.parameter("y", "t1")),
            v.function("f", "boolean", v.parameter("x", "t3"), v.parameter("y", "t3")));
    Name.Simple a = v.name("a");
    Name.Simple c = v.name("c");
    Name.Call call = v.call(v.name("f"), a, c);

    TypeCheck result = check(scope, analyzer.std.booleanType, call);

    assertThat(result).isEqualTo(TypeCheck.OK);
    assertThat(diagnostics.messages()).isEmpty();
    TypeDecl t3 = type(scope, "t3");
    assertThat(((Overloaded) boundTo(a)).signature.returnType()).isSameInstanceAs(t3);
    assertThat(((Overloaded) boundTo(c)).signature.returnType()).isSameInstanceAs(t3);
    // Every trial has been closed.
    assertThrows(IllegalStateException.class, analyzer.journal::rollback);
  }

  @Test
  public void operatorArityTellsUnaryFromBinary() {
    Scope scope = declare();
    Expression.Unary negation = v.unary("-", v.integer(1));

    assertThat(check(scope, analyzer.std.integer, negation)).isEqualTo(TypeCheck.OK);

    Overloaded chosen = (Overloaded) boundTo(negation.operator);
    assertThat(chosen.formals().size()).isEqualTo(1);
    assertThat(chosen.signature.returnType()).isSameInstanceAs(analyzer.std.integer);
  }

  @Test
  public void binaryOperatorOnUserType() {
    Scope scope =
        declare(
            v.integerType("count", 0, 100),
            v.signal("x", "count"),
            v.signal("y", "count"));
    Expression.Binary sum = v.binary(v.name("x"), "+", v.name("y"));

    assertThat(check(scope, type(scope, "count"), sum)).isEqualTo(TypeCheck.OK);
    assertThat(diagnostics.messages()).isEmpty();
    assertThat(boundTo(sum.operator).designator).isEqualTo(Designator.operator("+"));
  }

  @Test
  public void procedureCallIgnoresFunctions() {
    Scope scope =
        declare(
            v.function("p", "boolean", v.parameter("x", "integer")),
            v.procedure("p", v.parameter("x", "integer")));
    Name.Call call = v.call("p", v.integer(4));

    analyzer.expressions.analyzeProcedureCall(scope, call, diagnostics);

    assertThat(diagnostics.messages()).isEmpty();
    Overloaded chosen = (Overloaded) boundTo((Name.Simple) call.prefix);
    assertThat(chosen.isFunction()).isFalse();
  }

  @Test
  public void functionCannotBeCalledAsProcedure() {
    Scope scope = declare(v.function("f", "boolean", v.parameter("x", "integer")));

    analyzer.expressions.analyzeProcedureCall(scope, v.call("f", v.integer(4)), diagnostics);

    assertThat(diagnostics.messages()).containsExactly("Could not resolve 'f'");
  }

  @Test
  public void functionWithUnresolvedReturnTypeIsUncertain() {
    Scope scope = analyzer.rootScope().nested();
    DiagnosticList setup = new DiagnosticList();
    analyzer.declarations.analyzeDeclarativePart(
        scope,
        ImmutableList.of(
            v.function("h", "boolean"), v.function("h", "missing_type", v.parameter("x", "bit"))),
        setup);
    assertThat(setup.messages()).containsExactly("No declaration of 'missing_type'");
    Name.Simple h = v.name("h");

    assertThat(check(scope, analyzer.std.booleanType, h)).isEqualTo(TypeCheck.UNKNOWN);
    assertThat(diagnostics.messages()).isEmpty();
    assertThat(h.reference.isSet()).isFalse();
  }
}
