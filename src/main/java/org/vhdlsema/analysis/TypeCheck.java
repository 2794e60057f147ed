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

/**
 * The outcome of checking an expression (or a whole parameter list) against an expected type.
 *
 * <p>UNKNOWN means the check could not be decided, typically because a name inside the expression
 * could not be resolved. It is distinct from NOT_OK: an overload candidate whose check is UNKNOWN
 * must not be reported as ambiguous or as a mismatch.
 */
public enum TypeCheck {
  OK,
  NOT_OK,
  UNKNOWN;

  /** Combines two checks of parts of the same construct: NOT_OK wins, then UNKNOWN. */
  public TypeCheck combine(TypeCheck other) {
    if (this == NOT_OK || other == NOT_OK) {
      return NOT_OK;
    } else if (this == UNKNOWN || other == UNKNOWN) {
      return UNKNOWN;
    }
    return OK;
  }

  public static TypeCheck of(boolean ok) {
    return ok ? OK : NOT_OK;
  }
}
