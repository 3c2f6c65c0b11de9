// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArithmeticTest {

  static final Var X = Var.of("x");
  static final Var Y = Var.of("y");

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  @DisplayName("Each operator builds its node without simplifying")
  void operatorsBuildNodes() {
    assertEquals(new Add(List.of(X, Y)), Arithmetic.add(X, Y));
    assertEquals(new Add(List.of(X, new Neg(Y))), Arithmetic.subtract(X, Y));
    assertEquals(new Mul(List.of(X, Y)), Arithmetic.multiply(X, Y));
    assertEquals(new Div(X, Y), Arithmetic.divide(X, Y));
    assertEquals(new Pow(X, Y), Arithmetic.power(X, Y));
    assertEquals(new Neg(X), Arithmetic.negate(X));
    assertEquals(new Add(List.of(Const.of(2), Const.of(3))), Arithmetic.add(2, 3));
  }

  @Test
  @DisplayName("Numbers on either side are promoted")
  void numbersPromotedOnEitherSide() {
    assertEquals(new Add(List.of(Const.of(2), X)), Arithmetic.add(2, X));
    assertEquals(new Add(List.of(X, Const.of(2))), X.plus(2));
    assertEquals(new Add(List.of(Const.of(1), new Neg(X))), Arithmetic.subtract(1, X));
    assertEquals(new Mul(List.of(Const.of(0.5), X)), Arithmetic.multiply(0.5, X));
    assertEquals(new Div(Const.of(1), X), Arithmetic.divide(1, X));
    assertEquals(new Pow(Const.of(2), X), Arithmetic.power(2, X));
    assertEquals(new Pow(X, Const.of(Num.complex(0, 1))), X.pow(Num.complex(0, 1)));
  }

  @Test
  @DisplayName("Negating a constant builds a negation node rather than folding to a negative constant")
  void negationOfConstant() {
    // negation never folds a valued constant into a negative one, and the simplifier leaves Neg alone
    assertEquals(new Neg(Const.of(3)), Const.of(3).negate());
    assertEquals(new Neg(Const.of(3)), Arithmetic.negate(3));
  }

  @Test
  @DisplayName("Instance builders chain left to right")
  void chaining() {
    final var expr = X.times(2).plus(Y.dividedBy(X)).minus(1);
    final var expected = new Add(List.of(
        new Add(List.of(new Mul(List.of(X, Const.of(2))), new Div(Y, X))),
        new Neg(Const.of(1))));
    assertEquals(expected, expr);
    assertEquals("(+, (+, (*, x, 2), (/, y, x)), (neg, 1))", expr.toString());
  }

  @ParameterizedTest
  @ValueSource(strings = {"1", "x"})
  @DisplayName("Strings are not operands")
  void stringsRejected(String operand) {
    assertThrows(IllegalArgumentException.class, () -> Arithmetic.add(X, operand));
    assertThrows(IllegalArgumentException.class, () -> Arithmetic.multiply(operand, X));
    assertThrows(IllegalArgumentException.class, () -> X.pow(operand));
  }

  @Test
  @DisplayName("Unsupported number types and nulls are rejected")
  void unsupportedNumbers() {
    assertThrows(IllegalArgumentException.class, () -> Arithmetic.divide(X, BigDecimal.ONE));
    assertThrows(NullPointerException.class, () -> Arithmetic.negate(null));
    assertThrows(NullPointerException.class, () -> X.minus(null));
  }
}
