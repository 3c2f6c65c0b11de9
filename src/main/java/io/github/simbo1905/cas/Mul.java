// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.Arrays;
import java.util.List;

/// Product of any number of operands. An empty product is allowed.
public record Mul(List<Expr> operands) implements Expr {
  public Mul {
    operands = List.copyOf(operands);
  }

  /// Raw numbers are promoted to [Const]
  public static Mul of(Object... operands) {
    return new Mul(Arrays.stream(operands).map(Expr::of).toList());
  }

  @Override
  public Kind kind() {
    return Kind.MUL;
  }

  @Override
  public List<Expr> children() {
    return operands;
  }

  @Override
  public Mul withChildren(List<Expr> children) {
    return new Mul(Kind.MUL.checkArity(children));
  }

  @Override
  public String toString() {
    return Kind.render(symbol(), operands);
  }
}
