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

package org.vhdlsema.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A name: a simple name, a selected name {@code prefix.suffix}, or a call-like name {@code
 * prefix(associations)} (which may turn out to be a function call, an indexed name, or a type
 * conversion once the prefix is resolved).
 */
public abstract class Name extends Expression {

  Name(SrcPos pos) {
    super(pos);
  }

  /** A designator with a reference slot, e.g. {@code clk}, {@code '0'}, or {@code "+"}. */
  public static final class Simple extends Name {
    public final Designator designator;
    public final Reference reference = new Reference();

    public Simple(SrcPos pos, Designator designator) {
      super(pos);
      this.designator = designator;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSimpleName(this);
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {
      action.accept(reference);
    }

    @Override
    public String toString() {
      return designator.toString();
    }
  }

  /** A selected name such as {@code work.my_pkg.my_const}. */
  public static final class Selected extends Name {
    public final Name prefix;
    public final Simple suffix;

    public Selected(Name prefix, Simple suffix) {
      super(prefix.pos);
      this.prefix = prefix;
      this.suffix = suffix;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSelectedName(this);
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {
      prefix.forEachReference(action);
      suffix.forEachReference(action);
    }

    @Override
    public String toString() {
      return prefix + "." + suffix;
    }
  }

  /** A name followed by a parenthesized association list. */
  public static final class Call extends Name {
    public final Name prefix;
    public final ImmutableList<AssociationElement> arguments;

    public Call(Name prefix, List<AssociationElement> arguments) {
      super(prefix.pos);
      this.prefix = prefix;
      this.arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCallName(this);
    }

    @Override
    public void forEachReference(Consumer<Reference> action) {
      prefix.forEachReference(action);
      arguments.forEach(a -> a.forEachReference(action));
    }

    @Override
    public String toString() {
      return prefix + "(...)";
    }
  }
}
