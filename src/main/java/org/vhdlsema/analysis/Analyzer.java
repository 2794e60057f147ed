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

import static org.vhdlsema.ast.Designator.identifier;

import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.analysis.Declaration.DesignUnit;
import org.vhdlsema.analysis.Declaration.Library;
import org.vhdlsema.ast.ArchitectureBody;
import org.vhdlsema.ast.ConfigurationDeclaration;
import org.vhdlsema.ast.EntityDeclaration;
import org.vhdlsema.ast.Name;
import org.vhdlsema.ast.PackageDeclaration;
import org.vhdlsema.ast.Reference;
import org.vhdlsema.ast.SrcPos;

/**
 * Analyzes design units, resolving the references in their ASTs and reporting problems to a
 * DiagnosticHandler.
 *
 * <p>An Analyzer owns the declaration Arena, the predefined environment ({@code std.standard}),
 * and the libraries {@code std} and {@code work}. Units analyzed earlier are visible to later ones
 * through {@code work}, so an entity must be analyzed before its architectures.
 *
 * <p>Analysis is single-threaded; an Analyzer must not be shared between threads.
 */
public final class Analyzer {

  private static final SrcPos LIBRARY_POS = new SrcPos("library", 0, 0);

  final Arena arena = new Arena();
  final StandardPackage std = new StandardPackage(arena);
  final ReferenceJournal journal = new ReferenceJournal();

  final ExpressionAnalyzer expressions = new ExpressionAnalyzer(this);
  final OverloadResolver overloads = new OverloadResolver(this);
  final AssociationAnalyzer associations = new AssociationAnalyzer(this);
  final RangeAnalyzer ranges = new RangeAnalyzer(this);
  final TargetAnalyzer targets = new TargetAnalyzer(this);
  final DeclarativeAnalyzer declarations = new DeclarativeAnalyzer(this);
  final SequentialAnalyzer sequential = new SequentialAnalyzer(this);
  final ConcurrentAnalyzer concurrent = new ConcurrentAnalyzer(this);

  private final Scope root = Scope.root();
  private final Library stdLibrary;
  private final Library work;

  /** The declarative region of each entity, which its architectures extend. */
  private final Map<DesignUnit, Scope> entityRegions = new HashMap<>();

  public Analyzer() {
    stdLibrary = arena.define(id -> new Library(id, identifier("std"), LIBRARY_POS));
    work = arena.define(id -> new Library(id, identifier("work"), LIBRARY_POS));
    stdLibrary.region.add(std.pkg, DiagnosticHandler.NULL);
    root.add(stdLibrary, DiagnosticHandler.NULL);
    root.add(work, DiagnosticHandler.NULL);
    root.useAll(std.region());
  }

  public Arena arena() {
    return arena;
  }

  public StandardPackage standard() {
    return std;
  }

  /** The region of the {@code work} library, holding every unit analyzed so far. */
  public Scope workRegion() {
    return work.region;
  }

  /** The outermost region, in which {@code std} and {@code work} are declared. */
  Scope rootScope() {
    return root;
  }

  /** Returns the declaration {@code reference} is bound to, or null if it is unresolved. */
  public @Nullable Declaration declarationOf(Reference reference) {
    return arena.get(reference);
  }

  /** Binds {@code reference}; the binding is undone if an enclosing trial is rolled back. */
  void bind(Reference reference, Declaration declaration) {
    journal.bind(reference, declaration);
  }

  /**
   * Analyzes an entity declaration and adds the entity to {@code work}. Returns false if analysis
   * was abandoned; the reason is then the last diagnostic.
   */
  public boolean analyzeEntity(EntityDeclaration entity, DiagnosticHandler diagnostics) {
    return guarded(
        diagnostics,
        () -> {
          // Ports may refer to generics, and the entity's statements see both.
          Scope region = root.nested();
          FormalRegion generics =
              declarations.analyzeInterfaceList(
                  region, FormalRegion.Kind.GENERIC, entity.generics, diagnostics);
          FormalRegion ports =
              declarations.analyzeInterfaceList(
                  region, FormalRegion.Kind.PORT, entity.ports, diagnostics);
          DesignUnit unit =
              arena.define(
                  id ->
                      DesignUnit.entityOrComponent(
                          id,
                          entity.ident.designator(),
                          entity.ident.pos,
                          DesignUnit.UnitKind.ENTITY,
                          generics,
                          ports));
          work.region.add(unit, diagnostics);
          entityRegions.put(unit, region);
          declarations.analyzeDeclarativePart(region, entity.declarations, diagnostics);
          concurrent.analyzeConcurrentPart(region, entity.statements, diagnostics);
        });
  }

  /**
   * Analyzes an architecture of an entity that was analyzed earlier. The architecture's region
   * continues the entity's, so the entity's generics, ports and declarations are visible and may
   * not be redeclared.
   */
  public boolean analyzeArchitecture(ArchitectureBody architecture, DiagnosticHandler diagnostics) {
    return guarded(
        diagnostics,
        () -> {
          DesignUnit entity = resolveEntity(architecture.entityName, diagnostics);
          Scope entityRegion = (entity == null) ? null : entityRegions.get(entity);
          Scope region = (entityRegion == null) ? root.nested() : entityRegion.extend();
          declarations.analyzeDeclarativePart(region, architecture.declarations, diagnostics);
          concurrent.analyzeConcurrentPart(region, architecture.statements, diagnostics);
        });
  }

  /** Analyzes a package declaration; its declarations become visible as {@code work.<name>}. */
  public boolean analyzePackage(PackageDeclaration pkg, DiagnosticHandler diagnostics) {
    Scope region = root.nested();
    Declaration.Package unit =
        arena.define(
            id -> new Declaration.Package(id, pkg.ident.designator(), pkg.ident.pos, region));
    work.region.add(unit, diagnostics);
    return guarded(
        diagnostics,
        () -> declarations.analyzeDeclarativePart(region, pkg.declarations, diagnostics));
  }

  /** Analyzes a configuration declaration, which shares the interface of its entity. */
  public boolean analyzeConfiguration(
      ConfigurationDeclaration configuration, DiagnosticHandler diagnostics) {
    return guarded(
        diagnostics,
        () -> {
          DesignUnit entity = resolveEntity(configuration.entityName, diagnostics);
          work.region.add(
              arena.define(
                  id ->
                      DesignUnit.configuration(
                          id, configuration.ident.designator(), configuration.ident.pos, entity)),
              diagnostics);
        });
  }

  /**
   * Resolves the entity named by an architecture or configuration and binds the name to it. A
   * simple name denotes a unit of {@code work}. Returns null (after reporting) if the name does not
   * denote an entity.
   */
  private @Nullable DesignUnit resolveEntity(Name name, DiagnosticHandler diagnostics) {
    NamedEntities found;
    if (name instanceof Name.Simple simple) {
      found = work.region.lookupLocal(simple.designator);
      if (found == null) {
        diagnostics.push(Scope.notDeclared(simple.pos, simple.designator));
        return null;
      }
    } else {
      found = expressions.resolveName(root, name, diagnostics);
      if (found == null) {
        return null;
      }
    }
    if (!(found.asSingle() instanceof DesignUnit unit)
        || unit.unitKind != DesignUnit.UnitKind.ENTITY) {
      diagnostics.push(Diagnostic.error(name.pos, "Expected entity, got %s", found.describe()));
      return null;
    }
    if (name instanceof Name.Simple simple) {
      bind(simple.reference, unit);
    }
    return unit;
  }

  /**
   * Runs {@code analysis}; if it throws a FatalError, records it as the last diagnostic and
   * returns false.
   */
  private boolean guarded(DiagnosticHandler diagnostics, Runnable analysis) {
    try {
      analysis.run();
      return true;
    } catch (FatalError e) {
      diagnostics.push(Diagnostic.error(e.pos, e.msg));
      return false;
    }
  }
}
