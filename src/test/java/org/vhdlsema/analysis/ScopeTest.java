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

import com.google.common.collect.ImmutableList;
import org.vhdlsema.analysis.Declaration.Label;
import org.vhdlsema.analysis.Declaration.Overloaded;
import org.vhdlsema.analysis.Declaration.Overloaded.OverloadKind;
import org.vhdlsema.ast.Designator;
import org.vhdlsema.ast.SrcPos;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ScopeTest {

  private final Arena arena = new Arena();
  private final StandardPackage std = new StandardPackage(arena);
  private final DiagnosticList diagnostics = new DiagnosticList();
  private int line;

  private SrcPos pos() {
    return new SrcPos("scope.vhd", ++line, 1);
  }

  private Label label(String name) {
    SrcPos pos = pos();
    return arena.define(id -> new Label(id, Designator.identifier(name), pos));
  }

  /** A function {@code name(parameter) return boolean}. */
  private Overloaded function(String name, Declaration.TypeDecl parameter) {
    return std.function(Designator.identifier(name), std.booleanType, parameter);
  }

  @Test
  public void nestedDeclarationsAreInvisibleFromTheParent() {
    Scope outer = Scope.root();
    Scope inner = outer.nested();
    Label a = label("a");
    Label b = label("b");
    outer.add(a, diagnostics);
    inner.add(b, diagnostics);

    assertThat(outer.lookup(Designator.identifier("b"))).isNull();
    assertThat(inner.lookup(Designator.identifier("a")).asSingle()).isSameInstanceAs(a);
    assertThat(inner.lookup(Designator.identifier("b")).asSingle()).isSameInstanceAs(b);
    assertThat(inner.parent()).isSameInstanceAs(outer);
    assertThat(diagnostics.isEmpty()).isTrue();
  }

  @Test
  public void nearestDeclarationShadows() {
    Scope outer = Scope.root();
    Scope inner = outer.nested();
    Label outerX = label("x");
    Label innerX = label("x");
    outer.add(outerX, diagnostics);
    inner.add(innerX, diagnostics);

    assertThat(inner.lookup(Designator.identifier("x")).asSingle()).isSameInstanceAs(innerX);
    assertThat(outer.lookup(Designator.identifier("x")).asSingle()).isSameInstanceAs(outerX);
    assertThat(diagnostics.isEmpty()).isTrue();
  }

  @Test
  public void extendedRegionContinuesTheOriginal() {
    Scope outer = Scope.root();
    Scope entity = outer.nested();
    Label port = label("p");
    entity.add(port, diagnostics);

    Scope first = entity.extend();
    Scope second = entity.extend();
    first.add(label("s"), diagnostics);
    second.add(label("s"), diagnostics);
    first.add(label("p"), diagnostics);

    assertThat(first.parent()).isSameInstanceAs(outer);
    assertThat(second.lookupLocal(Designator.identifier("p")).asSingle()).isSameInstanceAs(port);
    assertThat(entity.lookup(Designator.identifier("s"))).isNull();
    assertThat(diagnostics.messages()).containsExactly("Duplicate declaration of 'p'");
  }

  @Test
  public void duplicateInTheSameRegionIsReported() {
    Scope scope = Scope.root();
    Label first = label("x");
    Label second = label("x");

    assertThat(scope.add(first, diagnostics)).isTrue();
    assertThat(scope.add(second, diagnostics)).isFalse();

    assertThat(diagnostics.messages()).containsExactly("Duplicate declaration of 'x'");
    Diagnostic duplicate = diagnostics.diagnostics().get(0);
    assertThat(duplicate.pos).isEqualTo(second.pos);
    assertThat(duplicate.related()).hasSize(1);
    assertThat(duplicate.related().get(0).pos).isEqualTo(first.pos);
    assertThat(duplicate.related().get(0).message).isEqualTo("Previously defined here");
    assertThat(scope.lookup(Designator.identifier("x")).asSingle()).isSameInstanceAs(first);
  }

  @Test
  public void overloadsAccumulateAcrossRegions() {
    Scope outer = Scope.root();
    Scope inner = outer.nested();
    Overloaded onInteger = function("f", std.integer);
    Overloaded onBit = function("f", std.bit);
    outer.add(onInteger, diagnostics);
    inner.add(onBit, diagnostics);

    NamedEntities found = inner.lookup(Designator.identifier("f"));

    assertThat(found.isOverloaded()).isTrue();
    assertThat(found.asOverloaded().candidates()).containsExactly(onBit, onInteger).inOrder();
    assertThat(outer.lookup(Designator.identifier("f")).asOverloaded().candidates())
        .containsExactly(onInteger);
  }

  @Test
  public void innerHomographHidesOuterOne() {
    Scope outer = Scope.root();
    Scope inner = outer.nested();
    Overloaded outerF = function("f", std.integer);
    Overloaded innerF = function("f", std.natural);
    outer.add(outerF, diagnostics);
    inner.add(innerF, diagnostics);

    assertThat(inner.lookup(Designator.identifier("f")).asOverloaded().candidates())
        .containsExactly(innerF);
    assertThat(diagnostics.isEmpty()).isTrue();
  }

  @Test
  public void homographsInOneRegionConflict() {
    Scope scope = Scope.root();
    scope.add(function("f", std.integer), diagnostics);

    assertThat(scope.add(function("f", std.positive), diagnostics)).isFalse();
    assertThat(diagnostics.messages()).containsExactly("Duplicate declaration of 'f'");
  }

  @Test
  public void nonOverloadableDeclarationStopsTheOverloadSearch() {
    Scope outer = Scope.root();
    Scope middle = outer.nested();
    Scope inner = middle.nested();
    outer.add(function("f", std.integer), diagnostics);
    Label hiding = label("f");
    middle.add(hiding, diagnostics);
    Overloaded innerF = function("f", std.bit);
    inner.add(innerF, diagnostics);

    assertThat(inner.lookup(Designator.identifier("f")).asOverloaded().candidates())
        .containsExactly(innerF);
    assertThat(middle.lookup(Designator.identifier("f")).asSingle()).isSameInstanceAs(hiding);
  }

  @Test
  public void directDeclarationsTakePrecedenceOverUseClauses() {
    Scope pkg = Scope.root();
    Label fromPackage = label("x");
    pkg.add(fromPackage, diagnostics);
    Scope scope = Scope.root();
    Label local = label("x");
    scope.add(local, diagnostics);

    scope.useAll(pkg);

    assertThat(scope.lookup(Designator.identifier("x")).asSingle()).isSameInstanceAs(local);
  }

  @Test
  public void useMakesDeclarationsVisible() {
    Scope pkg = Scope.root();
    Label item = label("item");
    pkg.add(item, diagnostics);
    Scope scope = Scope.root().nested();

    assertThat(scope.lookup(Designator.identifier("item"))).isNull();
    scope.use(item);

    assertThat(scope.lookup(Designator.identifier("item")).asSingle()).isSameInstanceAs(item);
    assertThat(scope.lookupLocal(Designator.identifier("item"))).isNull();
  }

  @Test
  public void lookupLocalIgnoresEnclosingRegions() {
    Scope outer = Scope.root();
    Scope inner = outer.nested();
    outer.add(label("a"), diagnostics);

    assertThat(inner.lookupLocal(Designator.identifier("a"))).isNull();
    assertThat(outer.lookupLocal(Designator.identifier("a"))).isNotNull();
  }

  @Test
  public void notDeclaredMessage() {
    SrcPos pos = pos();
    Diagnostic diagnostic = Scope.notDeclared(pos, Designator.operator("+"));

    assertThat(diagnostic.message).isEqualTo("No declaration of \"+\"");
    assertThat(diagnostic.pos).isEqualTo(pos);
    assertThat(diagnostic.severity).isEqualTo(Diagnostic.Severity.ERROR);
  }

  @Test
  public void enumerationLiteralsOfDifferentTypesCoexist() {
    Scope scope = Scope.root();
    Declaration.TypeDecl t1 =
        arena.define(
            id ->
                Declaration.TypeDecl.enumeration(
                    id,
                    Designator.identifier("t1"),
                    pos(),
                    ImmutableList.of(Designator.identifier("a"))));
    Declaration.TypeDecl t2 =
        arena.define(
            id ->
                Declaration.TypeDecl.enumeration(
                    id,
                    Designator.identifier("t2"),
                    pos(),
                    ImmutableList.of(Designator.identifier("a"))));
    std.enumerationLiterals(t1, pos()).forEach(l -> scope.add(l, diagnostics));
    std.enumerationLiterals(t2, pos()).forEach(l -> scope.add(l, diagnostics));

    NamedEntities found = scope.lookup(Designator.identifier("a"));

    assertThat(diagnostics.isEmpty()).isTrue();
    assertThat(found.asOverloaded().size()).isEqualTo(2);
    assertThat(found.asOverloaded().candidates().get(0).overloadKind)
        .isEqualTo(OverloadKind.ENUM_LITERAL);
  }
}
