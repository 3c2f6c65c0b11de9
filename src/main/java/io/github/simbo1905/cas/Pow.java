// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.List;
import java.util.Objects;

/// `base` raised to `exponent`. Either side may be any expression.
public record Pow(Expr base, Expr exponent) implements Expr {
  public Pow {
    Objects.requireNonNull(base, "base must not be null");
    Objects.requireNonNull(exponent, "exponent must not be null");
  }

  public static Pow of(Object base, Object exponent) {
    return new Pow(Expr.of(base), Expr.of(exponent));
  }

  @Override
  public Kind kind() {
    return Kind.POW;
  }

  @Override
  public List<Expr> children() {
    return List.of(base, exponent);
  }

  @Override
  public Pow withChildren(List<Expr> children) {
    Kind.POW.checkArity(children);
    return new Pow(children.get(0), children.get(1));
  }

  @Override
  public String toString() {
    return Kind.render(symbol(), children());
  }
}
