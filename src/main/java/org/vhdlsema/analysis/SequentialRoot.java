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

import org.jspecify.annotations.Nullable;
import org.vhdlsema.analysis.Declaration.TypeDecl;

/**
 * The construct whose statements are being analyzed, which determines what a {@code return}
 * statement may look like.
 */
public final class SequentialRoot {

  public enum Kind {
    PROCESS,
    PROCEDURE,
    FUNCTION,
    UNKNOWN
  }

  public static final SequentialRoot PROCESS = new SequentialRoot(Kind.PROCESS, null);
  public static final SequentialRoot PROCEDURE = new SequentialRoot(Kind.PROCEDURE, null);

  /**
   * A subprogram whose profile did not resolve, so it is unclear what it returns. Returned values
   * are analyzed untyped and a missing value is not reported.
   */
  public static final SequentialRoot UNKNOWN = new SequentialRoot(Kind.UNKNOWN, null);

  public final Kind kind;
  private final @Nullable TypeDecl returnType;

  private SequentialRoot(Kind kind, @Nullable TypeDecl returnType) {
    this.kind = kind;
    this.returnType = returnType;
  }

  /** The body of a function returning {@code returnType}. */
  public static SequentialRoot function(TypeDecl returnType) {
    return new SequentialRoot(Kind.FUNCTION, returnType);
  }

  /** The function's return type; null for other kinds of root. */
  public @Nullable TypeDecl returnType() {
    return returnType;
  }
}
