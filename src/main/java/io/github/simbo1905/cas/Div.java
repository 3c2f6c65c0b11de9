// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.List;
import java.util.Objects;

/// Quotient of exactly two expressions
public record Div(Expr numerator, Expr denominator) implements Expr {
  public Div {
    Objects.requireNonNull(numerator, "numerator must not be null");
    Objects.requireNonNull(denominator, "denominator must not be null");
  }

  public static Div of(Object numerator, Object denominator) {
    return new Div(Expr.of(numerator), Expr.of(denominator));
  }

  @Override
  public Kind kind() {
    return Kind.DIV;
  }

  @Override
  public List<Expr> children() {
    return List.of(numerator, denominator);
  }

  @Override
  public Div withChildren(List<Expr> children) {
    Kind.DIV.checkArity(children);
    return new Div(children.get(0), children.get(1));
  }

  @Override
  public String toString() {
    return Kind.render(symbol(), children());
  }
}
