// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;

import static io.github.simbo1905.cas.Expr.LOGGER;

/// Bottom-up simplification. Children are simplified first, then only sums and products are rewritten:
/// nested sums and products are flattened one level and their valued constants are folded into a single
/// constant. Every other variant is rebuilt over its simplified children unchanged.
///
/// Like terms are not collected, so `x + x` stays a sum of two terms. Named constants are never folded.
/// The pass is idempotent.
public final class Simplifier {

  private Simplifier() {
  }

  public static Expr simplify(Expr expr) {
    Objects.requireNonNull(expr, "expression must not be null");
    final var result = simplifyNode(expr);
    LOGGER.finer(() -> "Simplified " + expr.size() + " nodes to " + result.size() + " nodes");
    return result;
  }

  static Expr simplifyNode(Expr expr) {
    return switch (expr.kind()) {
      case VAR, CONST -> expr;
      case ADD -> simplifySum((Add) expr);
      case MUL -> simplifyProduct((Mul) expr);
      case DIV, POW, NEG, FUNC -> expr.withChildren(simplifyAll(expr.children()));
    };
  }

  static List<Expr> simplifyAll(List<Expr> children) {
    return children.stream().map(Simplifier::simplifyNode).toList();
  }

  static Expr simplifySum(Add add) {
    final List<Expr> terms = new ArrayList<>();
    Num sum = Num.ZERO;
    for (Expr child : simplifyAll(add.operands())) {
      if (child instanceof Add nested) {
        for (Expr inner : nested.operands()) {
          sum = fold(inner, sum, Num::plus, terms);
        }
      } else {
        sum = fold(child, sum, Num::plus, terms);
      }
    }
    if (!sum.isZero()) {
      terms.add(Const.of(sum));
    }
    if (terms.isEmpty()) {
      return Const.ZERO;
    }
    if (terms.size() == 1) {
      return terms.get(0);
    }
    return new Add(terms);
  }

  static Expr simplifyProduct(Mul mul) {
    final List<Expr> factors = new ArrayList<>();
    Num product = Num.ONE;
    for (Expr child : simplifyAll(mul.operands())) {
      if (child instanceof Mul nested) {
        for (Expr inner : nested.operands()) {
          product = fold(inner, product, Num::times, factors);
        }
      } else {
        product = fold(child, product, Num::times, factors);
      }
    }
    // zero absorbs every other factor
    if (product.isZero()) {
      final var absorbed = factors.size();
      LOGGER.finest(() -> "Zero product absorbed " + absorbed + " factors");
      return Const.ZERO;
    }
    if (!product.isOne()) {
      factors.add(Const.of(product));
    }
    if (factors.isEmpty()) {
      return Const.ONE;
    }
    if (factors.size() == 1) {
      return factors.get(0);
    }
    return new Mul(factors);
  }

  /// Accumulate a valued constant, or keep anything else as an explicit term
  private static Num fold(Expr term, Num accumulator, BinaryOperator<Num> operator, List<Expr> terms) {
    if (term instanceof Const constant && constant.isValued()) {
      final var folded = operator.apply(accumulator, constant.value());
      LOGGER.finest(() -> "Folded " + constant + " into " + folded);
      return folded;
    }
    terms.add(term);
    return accumulator;
  }
}
