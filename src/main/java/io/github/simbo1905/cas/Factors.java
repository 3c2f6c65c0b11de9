// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import static io.github.simbo1905.cas.Expr.LOGGER;

/// Factor sets. An integer constant factors into its positive divisors, a sum keeps the factors common to
/// every term, a product collects the factors of all its operands, and anything else is its own single factor.
public final class Factors {

  private Factors() {
  }

  public static Set<Expr> of(Expr expr) {
    Objects.requireNonNull(expr, "expression must not be null");
    return switch (expr.kind()) {
      case CONST -> {
        final var constant = (Const) expr;
        yield constant.value() instanceof Num.IntNum integer ? divisors(integer.value()) : Set.of(expr);
      }
      case ADD -> common(((Add) expr).operands());
      case MUL -> union(((Mul) expr).operands());
      case VAR, DIV, POW, NEG, FUNC -> Set.of(expr);
    };
  }

  /// Positive divisors in ascending order. Empty for zero and negative values.
  static Set<Expr> divisors(long value) {
    final var found = new TreeSet<Long>();
    for (long i = 1; i <= value / i; i++) {
      if (value % i == 0) {
        found.add(i);
        found.add(value / i);
      }
    }
    LOGGER.finest(() -> value + " has " + found.size() + " divisors");
    final var result = new LinkedHashSet<Expr>();
    found.forEach(divisor -> result.add(Const.of(divisor)));
    return Collections.unmodifiableSet(result);
  }

  static Set<Expr> common(List<Expr> terms) {
    if (terms.isEmpty()) {
      return Set.of();
    }
    final var shared = new LinkedHashSet<>(of(terms.get(0)));
    for (Expr term : terms.subList(1, terms.size())) {
      shared.retainAll(of(term));
    }
    return Collections.unmodifiableSet(shared);
  }

  static Set<Expr> union(List<Expr> operands) {
    final var all = new LinkedHashSet<Expr>();
    for (Expr operand : operands) {
      all.addAll(of(operand));
    }
    return Collections.unmodifiableSet(all);
  }
}
