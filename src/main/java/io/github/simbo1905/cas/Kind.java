// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static io.github.simbo1905.cas.Expr.LOGGER;

/// Discriminator tag for the closed set of [Expr] variants.
/// Carries the symbol used in the textual form and the arity the variant accepts.
public enum Kind {
  VAR("var", 0),
  CONST("const", 0),
  ADD("+", Kind.VARIADIC),
  MUL("*", Kind.VARIADIC),
  DIV("/", 2),
  POW("^", 2),
  NEG("neg", 1),
  // the textual symbol of a function node is its name
  FUNC("func", 1);

  static final int VARIADIC = -1;

  final String symbol;
  final int arity;

  Kind(String symbol, int arity) {
    this.symbol = symbol;
    this.arity = arity;
  }

  public String symbol() {
    return symbol;
  }

  public boolean isVariadic() {
    return arity == VARIADIC;
  }

  /// Fixed number of children, or -1 for Add and Mul
  public int arity() {
    return arity;
  }

  /// Fail fast when a rebuild would give this kind the wrong number of children
  List<Expr> checkArity(List<Expr> children) {
    Objects.requireNonNull(children, "children must not be null");
    if (!isVariadic() && children.size() != arity) {
      final var msg = this + " takes exactly " + arity + " children but was given " + children.size();
      LOGGER.severe(() -> msg);
      throw new IllegalArgumentException(msg);
    }
    return children;
  }

  /// Prefix form shared by all composite nodes: `(symbol, child1, child2)`
  static String render(String symbol, List<Expr> children) {
    return "(" + symbol + ", " + children.stream().map(Expr::toString).collect(Collectors.joining(", ")) + ")";
  }
}
