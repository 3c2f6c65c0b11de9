// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.List;
import java.util.Objects;

/// A named unary function applied to one argument.
/// The names [#SIN], [#COS], [#EXP] and [#LOG] have closed-form derivatives. Any other name is
/// differentiated symbolically by priming the name, so `f(x)` becomes `f'(x)`.
/// Two functions are equal when their names and arguments are equal, however they were built.
public record Func(String name, Expr argument) implements Expr {

  public static final String SIN = "sin";
  public static final String COS = "cos";
  public static final String EXP = "exp";
  public static final String LOG = "log";

  public Func {
    Objects.requireNonNull(name, "Function name must not be null");
    Objects.requireNonNull(argument, "Function argument must not be null");
  }

  public static Func of(String name, Object argument) {
    return new Func(name, Expr.of(argument));
  }

  public static Func sin(Object argument) {
    return of(SIN, argument);
  }

  public static Func cos(Object argument) {
    return of(COS, argument);
  }

  public static Func exp(Object argument) {
    return of(EXP, argument);
  }

  public static Func log(Object argument) {
    return of(LOG, argument);
  }

  /// The placeholder for this function's unknown derivative
  public Func primed() {
    return new Func(name + "'", argument);
  }

  @Override
  public Kind kind() {
    return Kind.FUNC;
  }

  @Override
  public String symbol() {
    return name;
  }

  @Override
  public List<Expr> children() {
    return List.of(argument);
  }

  @Override
  public Func withChildren(List<Expr> children) {
    return new Func(name, Kind.FUNC.checkArity(children).get(0));
  }

  @Override
  public String toString() {
    return Kind.render(name, children());
  }
}
