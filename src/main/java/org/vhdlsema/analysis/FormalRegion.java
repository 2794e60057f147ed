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
import java.util.Iterator;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.ast.Designator;
import org.vhdlsema.ast.SrcPos;

/**
 * The ordered interface elements of a subprogram (its parameters), or of an entity, component, or
 * block (its generics or its ports). Elements are interface objects or interface files, kept in
 * declaration order and looked up by exact designator.
 */
public final class FormalRegion implements Iterable<Declaration> {

  public enum Kind {
    GENERIC,
    PORT,
    PARAMETER
  }

  public final Kind kind;
  private final ImmutableList<Declaration> entities;

  private FormalRegion(Kind kind, ImmutableList<Declaration> entities) {
    this.kind = kind;
    this.entities = entities;
  }

  public static FormalRegion empty(Kind kind) {
    return new FormalRegion(kind, ImmutableList.of());
  }

  /** Returns the element with the given designator, or null if there is none. */
  public @Nullable Declaration lookup(Designator designator) {
    for (Declaration entity : entities) {
      if (entity.designator.equals(designator)) {
        return entity;
      }
    }
    return null;
  }

  /** The diagnostic to report when {@link #lookup} fails. */
  public Diagnostic notFound(SrcPos pos, Designator designator) {
    return Diagnostic.error(pos, "No declaration of %s", designator.quoted());
  }

  public int size() {
    return entities.size();
  }

  public boolean isEmpty() {
    return entities.isEmpty();
  }

  /** Returns the element at {@code index}, or null if the region is shorter than that. */
  public @Nullable Declaration nth(int index) {
    return (index >= 0 && index < entities.size()) ? entities.get(index) : null;
  }

  /** Returns the position of {@code entity} in this region, or -1. */
  public int indexOf(Declaration entity) {
    return entities.indexOf(entity);
  }

  @Override
  public Iterator<Declaration> iterator() {
    return entities.iterator();
  }

  /** Collects the elements of a FormalRegion as its interface list is analyzed. */
  static final class Builder {
    private final Kind kind;
    private final ImmutableList.Builder<Declaration> entities = ImmutableList.builder();

    Builder(Kind kind) {
      this.kind = kind;
    }

    /**
     * Appends an interface declaration. Anything else is a caller bug; it trips an assertion and is
     * otherwise ignored.
     */
    @CanIgnoreReturnValue
    Builder add(Declaration entity) {
      if (!entity.isInterface()) {
        assert false : "not an interface declaration: " + entity.describe();
        return this;
      }
      entities.add(entity);
      return this;
    }

    FormalRegion build() {
      ImmutableList<Declaration> list = entities.build();
      assert list.stream().map(e -> e.designator).distinct().count() == list.size()
          : "duplicate formal designator";
      return new FormalRegion(kind, list);
    }
  }
}
