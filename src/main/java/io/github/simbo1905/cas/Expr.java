// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Immutable expression tree. The variants are a closed set of records so every engine can dispatch
/// exhaustively on [#kind()]. Equality and hashing are structural: same variant and same ordered children,
/// with [Var] compared by name and [Const] by name and value.
///
/// Trees are never mutated. Every transformation returns a new tree that may share untouched subtrees
/// with its input.
public sealed interface Expr permits Var, Const, Add, Mul, Div, Pow, Neg, Func {

  Logger LOGGER = Logger.getLogger(Expr.class.getName());

  /// Promote a construction operand: an [Expr] is returned as is, a [Num] or boxed host number becomes a
  /// [Const]. Anything else is a contract failure.
  static Expr of(Object operand) {
    Objects.requireNonNull(operand, "operand must not be null");
    if (operand instanceof Expr expr) {
      return expr;
    }
    if (operand instanceof Num num) {
      return Const.of(num);
    }
    if (operand instanceof Number number) {
      return Const.of(Num.of(number));
    }
    final var msg = "Operand must be an Expr or a number but was " + operand.getClass().getName() + ": " + operand;
    LOGGER.severe(() -> msg);
    throw new IllegalArgumentException(msg);
  }

  Kind kind();

  /// Ordered, unmodifiable children. Empty for the leaves.
  List<Expr> children();

  /// Rebuild this variant over new children. The kind's arity is enforced.
  Expr withChildren(List<Expr> children);

  /// Discriminator used in the textual form. Functions override this with their name.
  default String symbol() {
    return kind().symbol();
  }

  /// Number of nodes in this tree
  default int size() {
    int count = 1;
    for (Expr child : children()) {
      count += child.size();
    }
    return count;
  }

  /// Distinct variables reachable from this node
  default Set<Var> dependencies() {
    final var vars = new LinkedHashSet<Var>();
    for (Expr child : children()) {
      vars.addAll(child.dependencies());
    }
    return Collections.unmodifiableSet(vars);
  }

  /// Unsimplified derivative with respect to `variable`
  default Expr derivative(Var variable) {
    return Derivatives.derivative(this, variable);
  }

  default Expr simplified() {
    return Simplifier.simplify(this);
  }

  default Set<Expr> factors() {
    return Factors.of(this);
  }

  default Add plus(Object other) {
    return Arithmetic.add(this, other);
  }

  default Add minus(Object other) {
    return Arithmetic.subtract(this, other);
  }

  default Mul times(Object other) {
    return Arithmetic.multiply(this, other);
  }

  default Div dividedBy(Object other) {
    return Arithmetic.divide(this, other);
  }

  default Pow pow(Object exponent) {
    return Arithmetic.power(this, exponent);
  }

  default Neg negate() {
    return Arithmetic.negate(this);
  }
}
