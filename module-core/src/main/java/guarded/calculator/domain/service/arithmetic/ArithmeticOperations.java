package guarded.calculator.domain.service.arithmetic;

import static guarded.calculator.domain.service.validation.NumberValidator.validateNumber;

import guarded.calculator.error.exception.DivisionByZeroException;
import guarded.calculator.error.exception.InvalidInputException;
import guarded.calculator.error.exception.OverflowException;

/**
 * Binary arithmetic with overflow protection.
 *
 * <p>Pure domain service: no state, no logging. Each operation validates both operands with {@link
 * guarded.calculator.domain.service.validation.NumberValidator#validateNumber(double)} before use
 * and never returns NaN or an infinity.
 *
 * <h3>Overflow Policy</h3>
 *
 * <ul>
 *   <li>add / subtract / divide / power: post-check, an infinite result is an overflow
 *   <li>multiply: pre-check against {@link #OVERFLOW_THRESHOLD}, then post-check
 *   <li>safeDivide: division by zero and overflow both yield the caller's default
 * </ul>
 */
public final class ArithmeticOperations {

  /**
   * Pre-check threshold for multiplication.
   *
   * <p>Finite products above 1e307 are rejected as well.
   */
  public static final double OVERFLOW_THRESHOLD = 1e307;

  private ArithmeticOperations() {
    // Prevent instantiation
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Add two numbers.
   *
   * <p>Properties: commutative, {@code add(a, 0) == a}.
   *
   * @throws InvalidInputException if an operand is NaN or infinite
   * @throws OverflowException if the sum is infinite
   */
  public static double add(double a, double b) {
    validateNumber(a);
    validateNumber(b);

    double result = a + b;
    if (Double.isInfinite(result)) {
      throw new OverflowException("addition", a, b);
    }
    return result;
  }

  /**
   * Subtract b from a.
   *
   * <p>Properties: {@code subtract(a, 0) == a}, {@code subtract(a, a) == 0}.
   *
   * @throws InvalidInputException if an operand is NaN or infinite
   * @throws OverflowException if the difference is infinite
   */
  public static double subtract(double a, double b) {
    validateNumber(a);
    validateNumber(b);

    double result = a - b;
    if (Double.isInfinite(result)) {
      throw new OverflowException("subtraction", a, b);
    }
    return result;
  }

  /**
   * Multiply two numbers.
   *
   * <p>{@code |a| > OVERFLOW_THRESHOLD / |b|} is rejected before the product is computed; an
   * infinite product is rejected afterwards.
   *
   * @throws InvalidInputException if an operand is NaN or infinite
   * @throws OverflowException if the product would overflow
   */
  public static double multiply(double a, double b) {
    validateNumber(a);
    validateNumber(b);

    if (a != 0 && b != 0 && Math.abs(a) > OVERFLOW_THRESHOLD / Math.abs(b)) {
      throw new OverflowException("multiplication", a, b);
    }

    double result = a * b;
    if (Double.isInfinite(result)) {
      throw new OverflowException("multiplication", a, b);
    }
    return result;
  }

  /**
   * Divide a by b.
   *
   * @throws InvalidInputException if an operand is NaN or infinite
   * @throws DivisionByZeroException if b is zero (carries a as the numerator)
   * @throws OverflowException if the quotient is infinite
   */
  public static double divide(double a, double b) {
    validateNumber(a);
    validateNumber(b);

    if (b == 0) {
      throw new DivisionByZeroException(a);
    }

    double result = a / b;
    if (Double.isInfinite(result)) {
      throw new OverflowException("division", a, b);
    }
    return result;
  }

  /** {@link #safeDivide(double, double, double)} with a default of {@code 0.0}. */
  public static double safeDivide(double a, double b) {
    return safeDivide(a, b, 0.0);
  }

  /**
   * Divide a by b, returning {@code defaultValue} instead of failing on division by zero or
   * overflow.
   *
   * @param a dividend
   * @param b divisor
   * @param defaultValue sentinel result, must itself be finite
   * @return the quotient, or defaultValue
   * @throws InvalidInputException if any argument is NaN or infinite
   */
  public static double safeDivide(double a, double b, double defaultValue) {
    validateNumber(a);
    validateNumber(b);
    validateNumber(defaultValue);

    if (b == 0) {
      return defaultValue;
    }

    double result = a / b;
    return Double.isInfinite(result) ? defaultValue : result;
  }

  /**
   * Raise base to the power of exponent.
   *
   * @throws InvalidInputException if an operand is invalid, 0 is raised to a negative power, a
   *     negative base is raised to a non-integer power, or the computation has no real result
   * @throws OverflowException if the result is infinite
   */
  public static double power(double base, double exponent) {
    validateNumber(base);
    validateNumber(exponent);

    if (base == 0 && exponent < 0) {
      throw new InvalidInputException(
          new double[] {base, exponent}, "0 cannot be raised to negative power");
    }
    if (base < 0 && !isInteger(exponent)) {
      throw new InvalidInputException(
          new double[] {base, exponent}, "Negative base with non-integer exponent");
    }

    double result = Math.pow(base, exponent);

    // Math.pow signals domain errors with NaN
    if (Double.isNaN(result)) {
      throw new InvalidInputException(new double[] {base, exponent}, "math domain error");
    }
    if (Double.isInfinite(result)) {
      throw new OverflowException("exponentiation", base, exponent);
    }
    return result;
  }

  /**
   * Floored remainder of a divided by b.
   *
   * <p>The result takes the sign of the divisor ({@code 0 <= r < |b|} for positive b) and satisfies
   * {@code a == floor(a / b) * b + r}.
   *
   * @throws InvalidInputException if an operand is NaN or infinite
   * @throws DivisionByZeroException if b is zero (carries a as the numerator)
   */
  public static double modulo(double a, double b) {
    validateNumber(a);
    validateNumber(b);

    if (b == 0) {
      throw new DivisionByZeroException(a);
    }

    double remainder = a % b;
    if (remainder == 0) {
      return Math.copySign(0.0, b);
    }
    if ((remainder < 0) != (b < 0)) {
      remainder += b;
      // a tiny remainder rounds up to b; the result must stay below |b|
      if (remainder == b) {
        return Math.copySign(0.0, b);
      }
    }
    return remainder;
  }

  private static boolean isInteger(double value) {
    return value == Math.rint(value);
  }
}
