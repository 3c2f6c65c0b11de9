// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.cas;

import java.util.Objects;

import static io.github.simbo1905.cas.Expr.LOGGER;

/// Numeric value carried by a [Const]. Integers, reals and complex numbers are kept apart so that
/// integer constants can be factored while mixed arithmetic promotes to the wider kind.
/// Equality is numeric across the kinds: `IntNum(2)`, `RealNum(2.0)` and `ComplexNum(2, 0)` are equal
/// and hash alike.
public sealed interface Num permits Num.IntNum, Num.RealNum, Num.ComplexNum {

  Num ZERO = new IntNum(0);
  Num ONE = new IntNum(1);

  /// Promote a boxed Java number. Only the host primitives are accepted.
  static Num of(Number number) {
    Objects.requireNonNull(number, "number must not be null");
    if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte) {
      return new IntNum(number.longValue());
    }
    if (number instanceof Double || number instanceof Float) {
      return new RealNum(number.doubleValue());
    }
    final var msg = "Unsupported numeric type " + number.getClass().getName() + ": " + number;
    LOGGER.severe(() -> msg);
    throw new IllegalArgumentException(msg);
  }

  static Num complex(double re, double im) {
    return new ComplexNum(re, im);
  }

  double re();

  double im();

  /// 0 for integers, 1 for reals, 2 for complex
  int rank();

  default boolean isInteger() {
    return false;
  }

  default boolean isZero() {
    return re() == 0.0 && im() == 0.0;
  }

  default boolean isOne() {
    return re() == 1.0 && im() == 0.0;
  }

  default Num plus(Num other) {
    if (this instanceof IntNum a && other instanceof IntNum b) {
      return new IntNum(a.value() + b.value());
    }
    if (Math.max(rank(), other.rank()) == 1) {
      return new RealNum(re() + other.re());
    }
    return new ComplexNum(re() + other.re(), im() + other.im());
  }

  default Num times(Num other) {
    if (this instanceof IntNum a && other instanceof IntNum b) {
      return new IntNum(a.value() * b.value());
    }
    if (Math.max(rank(), other.rank()) == 1) {
      return new RealNum(re() * other.re());
    }
    return new ComplexNum(
        re() * other.re() - im() * other.im(),
        re() * other.im() + im() * other.re());
  }

  /// Numeric equality shared by all three records
  static boolean numericEquals(Num self, Object other) {
    if (self == other) {
      return true;
    }
    if (!(other instanceof Num that)) {
      return false;
    }
    if (self instanceof IntNum a && that instanceof IntNum b) {
      return a.value() == b.value();
    }
    if (self instanceof IntNum a) {
      return sameDouble(that.im(), 0.0) && exactlyLong(that.re(), a.value());
    }
    if (that instanceof IntNum b) {
      return sameDouble(self.im(), 0.0) && exactlyLong(self.re(), b.value());
    }
    return sameDouble(self.re(), that.re()) && sameDouble(self.im(), that.im());
  }

  static int numericHash(Num self) {
    if (sameDouble(self.im(), 0.0)) {
      return Double.hashCode(self.re() == 0.0 ? 0.0 : self.re());
    }
    return 31 * Double.hashCode(self.re() == 0.0 ? 0.0 : self.re()) + Double.hashCode(self.im());
  }

  // 0.0 and -0.0 are the same number, NaN is kept equal to itself
  private static boolean sameDouble(double a, double b) {
    return a == b || (Double.isNaN(a) && Double.isNaN(b));
  }

  // an integer equals a double only when the double is integral and converts back to the same long
  private static boolean exactlyLong(double d, long value) {
    return d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63 && (long) d == value;
  }

  private static String formatPart(double d) {
    if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e16) {
      return Long.toString((long) d);
    }
    return Double.toString(d);
  }

  record IntNum(long value) implements Num {
    @Override
    public double re() {
      return value;
    }

    @Override
    public double im() {
      return 0.0;
    }

    @Override
    public int rank() {
      return 0;
    }

    @Override
    public boolean isInteger() {
      return true;
    }

    @Override
    public boolean isZero() {
      return value == 0;
    }

    @Override
    public boolean isOne() {
      return value == 1;
    }

    @Override
    public boolean equals(Object obj) {
      return numericEquals(this, obj);
    }

    @Override
    public int hashCode() {
      return numericHash(this);
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  record RealNum(double value) implements Num {
    @Override
    public double re() {
      return value;
    }

    @Override
    public double im() {
      return 0.0;
    }

    @Override
    public int rank() {
      return 1;
    }

    @Override
    public boolean equals(Object obj) {
      return numericEquals(this, obj);
    }

    @Override
    public int hashCode() {
      return numericHash(this);
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  record ComplexNum(double re, double im) implements Num {
    @Override
    public int rank() {
      return 2;
    }

    @Override
    public boolean equals(Object obj) {
      return numericEquals(this, obj);
    }

    @Override
    public int hashCode() {
      return numericHash(this);
    }

    /// Renders `(1+2j)`, `(1-2j)` or `2j` for a zero real part
    @Override
    public String toString() {
      final var imaginary = formatPart(im) + "j";
      if (re == 0.0 && Double.doubleToRawLongBits(re) == 0L) {
        return imaginary;
      }
      final var sign = im < 0 ? "" : "+";
      return "(" + formatPart(re) + sign + imaginary + ")";
    }
  }
}
