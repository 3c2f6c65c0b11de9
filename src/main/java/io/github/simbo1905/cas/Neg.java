// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.List;
import java.util.Objects;

public record Neg(Expr operand) implements Expr {
  public Neg {
    Objects.requireNonNull(operand, "operand must not be null");
  }

  public static Neg of(Object operand) {
    return new Neg(Expr.of(operand));
  }

  @Override
  public Kind kind() {
    return Kind.NEG;
  }

  @Override
  public List<Expr> children() {
    return List.of(operand);
  }

  @Override
  public Neg withChildren(List<Expr> children) {
    return new Neg(Kind.NEG.checkArity(children).get(0));
  }

  @Override
  public String toString() {
    return Kind.render(symbol(), children());
  }
}
