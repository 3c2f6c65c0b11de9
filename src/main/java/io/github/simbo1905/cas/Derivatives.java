// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.cas.Expr.LOGGER;

/// Structural differentiation. Each variant has its own rule and the result is a new tree that is
/// never simplified; callers run [Simplifier] on it when they want a normal form.
///
/// Powers are differentiated through the identity `a^b = exp(log(a) * b)`. That holds for any exponent
/// but only for a positive base. No check is made on the base.
public final class Derivatives {

  private Derivatives() {
  }

  /// @param expr     the tree to differentiate
  /// @param variable the variable to differentiate with respect to
  /// @return the unsimplified derivative
  public static Expr derivative(Expr expr, Var variable) {
    Objects.requireNonNull(expr, "expression must not be null");
    Objects.requireNonNull(variable, "variable must not be null");
    final var result = differentiate(expr, variable);
    LOGGER.finer(() -> "d/d" + variable + " of " + expr.size() + " nodes gave " + result.size() + " nodes");
    return result;
  }

  static Expr differentiate(Expr expr, Var variable) {
    return switch (expr.kind()) {
      case VAR -> ((Var) expr).name().equals(variable.name()) ? Const.ONE : Const.ZERO;
      case CONST -> Const.ZERO;
      case ADD -> new Add(((Add) expr).operands().stream()
          .map(term -> differentiate(term, variable))
          .toList());
      case MUL -> productRule((Mul) expr, variable);
      case DIV -> quotientRule((Div) expr, variable);
      case POW -> powerRule((Pow) expr, variable);
      case NEG -> new Neg(differentiate(((Neg) expr).operand(), variable));
      case FUNC -> chainRule((Func) expr, variable);
    };
  }

  /// Sum over each operand of the product with that one operand replaced by its derivative
  static Add productRule(Mul mul, Var variable) {
    final List<Expr> operands = mul.operands();
    final List<Expr> terms = new ArrayList<>(operands.size());
    for (int i = 0; i < operands.size(); i++) {
      final List<Expr> product = new ArrayList<>(operands);
      product.set(i, differentiate(operands.get(i), variable));
      terms.add(new Mul(product));
    }
    return new Add(terms);
  }

  /// `(b * a' - a * b') / b^2`
  static Div quotientRule(Div div, Var variable) {
    final var a = div.numerator();
    final var b = div.denominator();
    final var numerator = Arithmetic.subtract(
        Arithmetic.multiply(b, differentiate(a, variable)),
        Arithmetic.multiply(a, differentiate(b, variable)));
    return Arithmetic.divide(numerator, Arithmetic.power(b, 2));
  }

  static Expr powerRule(Pow pow, Var variable) {
    final var rewritten = Func.exp(Arithmetic.multiply(Func.log(pow.base()), pow.exponent()));
    return differentiate(rewritten, variable);
  }

  static Expr chainRule(Func func, Var variable) {
    final var argument = func.argument();
    final var inner = differentiate(argument, variable);
    return switch (func.name()) {
      case Func.SIN -> Arithmetic.multiply(Func.cos(argument), inner);
      case Func.COS -> Arithmetic.multiply(Arithmetic.negate(Func.sin(argument)), inner);
      case Func.EXP -> Arithmetic.multiply(Func.exp(argument), inner);
      case Func.LOG -> Arithmetic.divide(inner, argument);
      default -> Arithmetic.multiply(func.primed(), inner);
    };
  }
}
