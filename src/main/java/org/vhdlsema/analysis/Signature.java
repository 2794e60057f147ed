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

import java.util.StringJoiner;
import org.jspecify.annotations.Nullable;
import org.vhdlsema.analysis.Declaration.TypeDecl;

/** The parameter profile and result type of a subprogram or enumeration literal. */
public final class Signature {
  public final FormalRegion formals;
  private final @Nullable TypeDecl returnType;

  Signature(FormalRegion formals, @Nullable TypeDecl returnType) {
    this.formals = formals;
    this.returnType = returnType;
  }

  /** The return type of a function or enumeration literal; null for a procedure. */
  public @Nullable TypeDecl returnType() {
    return returnType;
  }

  /**
   * Returns true if calls with this signature can produce a value of {@code target}; with a null
   * target, true only for procedures.
   */
  boolean matchesReturnType(@Nullable TypeDecl target) {
    if (target == null || returnType == null) {
      return target == returnType;
    }
    return TypeDecl.isCompatible(returnType, target);
  }

  /**
   * Returns true if the two signatures have the same parameter base types and the same result base
   * type; such declarations cannot be distinguished by overload resolution.
   */
  boolean isHomograph(Signature other) {
    if (formals.size() != other.formals.size() || !sameBase(returnType, other.returnType)) {
      return false;
    }
    for (int i = 0; i < formals.size(); i++) {
      if (!sameBase(formals.nth(i).typeMark(), other.formals.nth(i).typeMark())) {
        return false;
      }
    }
    return true;
  }

  private static boolean sameBase(@Nullable TypeDecl t1, @Nullable TypeDecl t2) {
    if (t1 == null || t2 == null) {
      return t1 == t2;
    }
    return t1.baseType() == t2.baseType();
  }

  /** Returns e.g. {@code [integer, integer return boolean]}. */
  public String describe() {
    StringJoiner params = new StringJoiner(", ");
    for (Declaration formal : formals) {
      TypeDecl type = formal.typeMark();
      params.add(type == null ? "?" : type.designator.toString());
    }
    String result = params.toString();
    if (returnType != null) {
      String ret = "return " + returnType.designator;
      result = result.isEmpty() ? ret : result + " " + ret;
    }
    return "[" + result + "]";
  }
}
