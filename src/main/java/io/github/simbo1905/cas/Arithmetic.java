// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.List;

/// Builders for the arithmetic operators. Each operand may be an [Expr], a [Num] or a boxed host number;
/// numbers are promoted to [Const] before the node is built. Any other operand type is rejected with an
/// [IllegalArgumentException].
///
/// The builders never simplify: `add(2, 3)` is the tree `(+, 2, 3)`, not `5`.
public final class Arithmetic {

  private Arithmetic() {
  }

  public static Add add(Object left, Object right) {
    return new Add(List.of(Expr.of(left), Expr.of(right)));
  }

  /// `left - right` is the sum of `left` and the negation of `right`
  public static Add subtract(Object left, Object right) {
    return new Add(List.of(Expr.of(left), new Neg(Expr.of(right))));
  }

  public static Mul multiply(Object left, Object right) {
    return new Mul(List.of(Expr.of(left), Expr.of(right)));
  }

  public static Div divide(Object numerator, Object denominator) {
    return new Div(Expr.of(numerator), Expr.of(denominator));
  }

  public static Pow power(Object base, Object exponent) {
    return new Pow(Expr.of(base), Expr.of(exponent));
  }

  /// Always builds a [Neg] node, even over a numeric constant: `negate(3)` is `(neg, 3)`, never `-3`
  public static Neg negate(Object operand) {
    return new Neg(Expr.of(operand));
  }
}
