// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.Arrays;
import java.util.List;

/// Sum of any number of terms. An empty sum is allowed.
public record Add(List<Expr> operands) implements Expr {
  public Add {
    operands = List.copyOf(operands);
  }

  /// Raw numbers are promoted to [Const]
  public static Add of(Object... operands) {
    return new Add(Arrays.stream(operands).map(Expr::of).toList());
  }

  @Override
  public Kind kind() {
    return Kind.ADD;
  }

  @Override
  public List<Expr> children() {
    return operands;
  }

  @Override
  public Add withChildren(List<Expr> children) {
    return new Add(Kind.ADD.checkArity(children));
  }

  @Override
  public String toString() {
    return Kind.render(symbol(), operands);
  }
}
