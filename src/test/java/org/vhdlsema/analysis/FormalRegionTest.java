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
import org.vhdlsema.analysis.Declaration.Label;
import org.vhdlsema.analysis.Declaration.ObjectDecl;
import org.vhdlsema.ast.Designator;
import org.vhdlsema.ast.Mode;
import org.vhdlsema.ast.ObjectClass;
import org.vhdlsema.ast.SrcPos;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FormalRegionTest {

  private static final SrcPos POS = new SrcPos("formals.vhd", 1, 1);

  private final Arena arena = new Arena();
  private final StandardPackage std = new StandardPackage(arena);

  private ObjectDecl port(String name, Mode mode) {
    return arena.define(
        id ->
            new ObjectDecl(
                id, Designator.identifier(name), POS, ObjectClass.SIGNAL, mode, std.bit, false));
  }

  @Test
  public void elementsKeepDeclarationOrder() {
    ObjectDecl clk = port("clk", Mode.IN);
    ObjectDecl q = port("q", Mode.OUT);
    FormalRegion ports = new FormalRegion.Builder(FormalRegion.Kind.PORT).add(clk).add(q).build();

    assertThat(ports.kind).isEqualTo(FormalRegion.Kind.PORT);
    assertThat(ports.size()).isEqualTo(2);
    assertThat(ports.nth(0)).isSameInstanceAs(clk);
    assertThat(ports.nth(1)).isSameInstanceAs(q);
    assertThat(ports.nth(2)).isNull();
    assertThat(ports.nth(-1)).isNull();
    assertThat(ports.indexOf(q)).isEqualTo(1);
    assertThat(ImmutableList.copyOf(ports)).containsExactly(clk, q).inOrder();
  }

  @Test
  public void lookupByDesignator() {
    ObjectDecl clk = port("clk", Mode.IN);
    FormalRegion ports = new FormalRegion.Builder(FormalRegion.Kind.PORT).add(clk).build();

    assertThat(ports.lookup(Designator.identifier("CLK"))).isSameInstanceAs(clk);
    assertThat(ports.lookup(Designator.identifier("rst"))).isNull();

    Diagnostic notFound = ports.notFound(POS, Designator.identifier("rst"));
    assertThat(notFound.message).isEqualTo("No declaration of 'rst'");
  }

  @Test
  public void emptyRegion() {
    FormalRegion none = FormalRegion.empty(FormalRegion.Kind.PARAMETER);

    assertThat(none.isEmpty()).isTrue();
    assertThat(none.nth(0)).isNull();
  }

  @Test
  public void onlyInterfaceDeclarationsMayBeAdded() {
    FormalRegion.Builder builder = new FormalRegion.Builder(FormalRegion.Kind.GENERIC);
    Label label = arena.define(id -> new Label(id, Designator.identifier("l"), POS));

    // Tests run with assertions enabled.
    assertThrows(AssertionError.class, () -> builder.add(label));
    assertThat(builder.build().isEmpty()).isTrue();
  }
}
