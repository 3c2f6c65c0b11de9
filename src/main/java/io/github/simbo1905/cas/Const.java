// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.cas.Expr.LOGGER;

/// A constant leaf. A valued constant takes part in constant folding. A named constant with no value,
/// such as `pi`, is an opaque atom that is never folded. Equality compares both the name and the value.
public record Const(@Nullable Num value, @Nullable String name) implements Expr {

  public static final Const ZERO = new Const(Num.ZERO, null);
  public static final Const ONE = new Const(Num.ONE, null);

  public Const {
    if (value == null && name == null) {
      final var msg = "A constant needs a value or a name";
      LOGGER.severe(() -> msg);
      throw new IllegalArgumentException(msg);
    }
  }

  public static Const of(Num value) {
    return new Const(Objects.requireNonNull(value, "value must not be null"), null);
  }

  public static Const of(long value) {
    return new Const(new Num.IntNum(value), null);
  }

  public static Const of(double value) {
    return new Const(new Num.RealNum(value), null);
  }

  public static Const named(String name) {
    return new Const(null, Objects.requireNonNull(name, "name must not be null"));
  }

  public boolean isValued() {
    return value != null;
  }

  @Override
  public Kind kind() {
    return Kind.CONST;
  }

  @Override
  public List<Expr> children() {
    return List.of();
  }

  @Override
  public Const withChildren(List<Expr> children) {
    Kind.CONST.checkArity(children);
    return this;
  }

  @Override
  public String toString() {
    return name != null ? name : String.valueOf(value);
  }
}
