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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.analysis.Declaration.Overloaded;
import org.vhdlsema.ast.Designator;
import org.vhdlsema.ast.SrcPos;

/**
 * A declarative region, linked to the region that encloses it. A new Scope is created for each
 * block, process, generate body, loop, and subprogram body, and is dropped once that region has
 * been analyzed.
 *
 * <p>Lookup walks outward from the innermost region. A non-overloadable declaration hides any
 * declaration with the same designator in enclosing regions. Overloaded declarations (subprograms
 * and enumeration literals) are gathered from every enclosing region up to the first
 * non-overloadable one, an inner declaration hiding any outer one with the same profile.
 */
public final class Scope {

  private final @Nullable Scope parent;

  /**
   * Maps each designator declared directly in this region to its declarations: either a single
   * non-overloadable declaration or one or more overloadable ones, in declaration order.
   */
  private final Map<Designator, List<Declaration>> entries = new HashMap<>();

  /**
   * Declarations made visible in this region by use clauses. Direct declarations in the same region
   * take precedence.
   */
  private final Map<Designator, List<Declaration>> used = new HashMap<>();

  private Scope(@Nullable Scope parent) {
    this.parent = parent;
  }

  /** Returns a new outermost region. */
  public static Scope root() {
    return new Scope(null);
  }

  /** Returns a new region enclosed by this one. */
  public Scope nested() {
    return new Scope(this);
  }

  /**
   * Returns a region with the same parent that starts out holding everything declared or used
   * here. Later declarations in either region are not seen by the other.
   */
  public Scope extend() {
    Scope result = new Scope(parent);
    entries.forEach((designator, list) -> result.entries.put(designator, new ArrayList<>(list)));
    used.forEach((designator, list) -> result.used.put(designator, new ArrayList<>(list)));
    return result;
  }

  public @Nullable Scope parent() {
    return parent;
  }

  /**
   * Declares {@code declaration} in this region. Reports "Duplicate declaration" if it conflicts
   * with a declaration already made here; the earlier declaration is kept, and false is returned.
   */
  @CanIgnoreReturnValue
  public boolean add(Declaration declaration, DiagnosticHandler diagnostics) {
    List<Declaration> existing = entries.get(declaration.designator);
    if (existing == null) {
      existing = new ArrayList<>();
      entries.put(declaration.designator, existing);
    } else {
      for (Declaration prev : existing) {
        if (conflicts(prev, declaration)) {
          diagnostics.push(
              Diagnostic.error(
                      declaration.pos,
                      "Duplicate declaration of %s",
                      declaration.designator.quoted())
                  .addRelated(prev.pos, "Previously defined here"));
          return false;
        }
      }
    }
    existing.add(declaration);
    return true;
  }

  private static boolean conflicts(Declaration prev, Declaration declaration) {
    if (!prev.isOverloadable() || !declaration.isOverloadable()) {
      return true;
    }
    return ((Overloaded) prev).signature.isHomograph(((Overloaded) declaration).signature);
  }

  /**
   * Returns the overloaded declaration made directly in this region that has the same designator
   * and profile as {@code signature}, or null.
   */
  @Nullable Overloaded localHomograph(Designator designator, Signature signature) {
    List<Declaration> existing = entries.get(designator);
    if (existing != null) {
      for (Declaration prev : existing) {
        if (prev instanceof Overloaded overloaded && overloaded.signature.isHomograph(signature)) {
          return overloaded;
        }
      }
    }
    return null;
  }

  /** Makes {@code declaration} visible in this region, as a use clause naming it does. */
  public void use(Declaration declaration) {
    List<Declaration> existing =
        used.computeIfAbsent(declaration.designator, k -> new ArrayList<>());
    if (existing.contains(declaration)) {
      return;
    }
    if (!existing.isEmpty()
        && !(existing.get(0).isOverloadable() && declaration.isOverloadable())) {
      // Conflicting use-visible declarations; the first one stays visible.
      return;
    }
    existing.add(declaration);
  }

  /** Makes every declaration made directly in {@code region} visible here ({@code use p.all}). */
  public void useAll(Scope region) {
    region.entries.values().forEach(list -> list.forEach(this::use));
  }

  /**
   * Returns the declarations visible under {@code designator}, or null if there are none. Callers
   * report the miss (typically "No declaration of ...").
   */
  public @Nullable NamedEntities lookup(Designator designator) {
    List<Overloaded> overloads = null;
    for (Scope scope = this; scope != null; scope = scope.parent) {
      for (Map<Designator, List<Declaration>> map : ImmutableList.of(scope.entries, scope.used)) {
        List<Declaration> found = map.get(designator);
        if (found == null || found.isEmpty()) {
          continue;
        }
        Declaration first = found.get(0);
        if (!first.isOverloadable()) {
          if (overloads == null) {
            return NamedEntities.single(first);
          }
          return NamedEntities.overloaded(
              new OverloadedName(designator, ImmutableList.copyOf(overloads)));
        }
        if (overloads == null) {
          overloads = new ArrayList<>();
        }
        for (Declaration d : found) {
          addUnlessHidden(overloads, (Overloaded) d);
        }
      }
    }
    return (overloads == null)
        ? null
        : NamedEntities.overloaded(new OverloadedName(designator, ImmutableList.copyOf(overloads)));
  }

  /**
   * Like {@link #lookup}, but only considers declarations made directly in this region; used for
   * selected names such as {@code work.pkg.item}.
   */
  public @Nullable NamedEntities lookupLocal(Designator designator) {
    List<Declaration> found = entries.get(designator);
    if (found == null || found.isEmpty()) {
      return null;
    }
    Declaration first = found.get(0);
    if (!first.isOverloadable()) {
      return NamedEntities.single(first);
    }
    ImmutableList<Overloaded> overloads =
        found.stream().map(d -> (Overloaded) d).collect(ImmutableList.toImmutableList());
    return NamedEntities.overloaded(new OverloadedName(designator, overloads));
  }

  /** The diagnostic to report when a lookup fails. */
  public static Diagnostic notDeclared(SrcPos pos, Designator designator) {
    return Diagnostic.error(pos, "No declaration of %s", designator.quoted());
  }

  private static void addUnlessHidden(List<Overloaded> overloads, Overloaded candidate) {
    for (Overloaded prev : overloads) {
      if (prev == candidate || prev.signature.isHomograph(candidate.signature)) {
        return;
      }
    }
    overloads.add(candidate);
  }
}
