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
import java.util.List;
import org.vhdlsema.ast.AssociationElement;
import org.vhdlsema.ast.Expression;

/**
 * The actual parameters at a call site, so that function calls and operator applications can be
 * resolved the same way: an association list, the two operands of a binary operator, or the
 * operand of a unary operator.
 */
abstract class Parameters {

  private Parameters() {}

  static Parameters associations(List<AssociationElement> elements) {
    return new AssociationList(ImmutableList.copyOf(elements));
  }

  /** The parameters of a name used without an argument list. */
  static Parameters none() {
    return new AssociationList(ImmutableList.of());
  }

  static Parameters binary(Expression left, Expression right) {
    return new Binary(left, right);
  }

  static Parameters unary(Expression operand) {
    return new Unary(operand);
  }

  /** For operators, the number of formals a candidate must have; -1 for association lists. */
  abstract int operatorArity();

  /** True for an empty association list. */
  boolean isEmpty() {
    return false;
  }

  static final class AssociationList extends Parameters {
    final ImmutableList<AssociationElement> elements;

    AssociationList(ImmutableList<AssociationElement> elements) {
      this.elements = elements;
    }

    @Override
    int operatorArity() {
      return -1;
    }

    @Override
    boolean isEmpty() {
      return elements.isEmpty();
    }
  }

  static final class Binary extends Parameters {
    final Expression left;
    final Expression right;

    Binary(Expression left, Expression right) {
      this.left = left;
      this.right = right;
    }

    @Override
    int operatorArity() {
      return 2;
    }
  }

  static final class Unary extends Parameters {
    final Expression operand;

    Unary(Expression operand) {
      this.operand = operand;
    }

    @Override
    int operatorArity() {
      return 1;
    }
  }
}
