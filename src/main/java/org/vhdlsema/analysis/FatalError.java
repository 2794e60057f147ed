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

import com.google.errorprone.annotations.FormatMethod;
import org.vhdlsema.ast.SrcPos;

/**
 * Thrown when analysis of a design unit cannot continue in any meaningful way. It unwinds to the
 * design-unit entry point in {@link Analyzer}; diagnostics pushed before it was thrown are kept.
 */
public class FatalError extends RuntimeException {
  public final SrcPos pos;
  public final String msg;

  public FatalError(SrcPos pos, String msg) {
    super(msg);
    this.pos = pos;
    this.msg = msg;
  }

  @FormatMethod
  static FatalError of(SrcPos pos, String fmt, Object... fmtArgs) {
    return new FatalError(pos, String.format(fmt, fmtArgs));
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s)", msg, pos);
  }
}
