package guarded.calculator.domain.service.validation;

import guarded.calculator.error.exception.InvalidInputException;
import guarded.calculator.error.exception.OutOfRangeException;

/**
 * Input validation for numeric values.
 *
 * <p>Every validator returns its argument unchanged on success and throws otherwise. {@link
 * #validateNumber(double)} is the universal gate: NaN and both infinities are never valid anywhere,
 * and every other validator applies it first.
 *
 * <h3>Design Principles</h3>
 *
 * <ul>
 *   <li><b>Static Methods</b>: All methods are static, no state
 *   <li><b>Exact comparison</b>: zero checks use {@code ==}, no epsilon
 * </ul>
 */
public final class NumberValidator {

  private NumberValidator() {
    // Prevent instantiation
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Validate that a value is a finite number.
   *
   * @param value the value to validate
   * @return the validated value
   * @throws InvalidInputException if value is NaN or infinite
   */
  public static double validateNumber(double value) {
    if (Double.isNaN(value)) {
      throw new InvalidInputException(value, "NaN is not allowed");
    }
    if (Double.isInfinite(value)) {
      throw new InvalidInputException(value, "Infinity is not allowed");
    }
    return value;
  }

  /**
   * Validate a boxed number coming from an outer caller.
   *
   * <p>{@code null} is rejected; anything else is narrowed with {@link Number#doubleValue()} and
   * passed through {@link #validateNumber(double)}, so a value beyond double range is rejected as
   * infinite.
   *
   * @param value the value to validate
   * @return the validated value as a double
   * @throws InvalidInputException if value is null, NaN or infinite
   */
  public static double validateNumber(Number value) {
    if (value == null) {
      throw new InvalidInputException(null, "Expected number, got null");
    }
    return validateNumber(value.doubleValue());
  }

  /** Validate that a value is strictly positive. */
  public static double validatePositive(double value) {
    return validatePositive(value, false);
  }

  /**
   * Validate that a value is positive.
   *
   * @param value the value to validate
   * @param allowZero whether zero is considered valid
   * @return the validated value
   * @throws InvalidInputException if value is negative, or zero when zero is not allowed
   */
  public static double validatePositive(double value, boolean allowZero) {
    validateNumber(value);

    if (allowZero) {
      if (value < 0) {
        throw new InvalidInputException(value, "Value must be non-negative");
      }
    } else if (value <= 0) {
      throw new InvalidInputException(value, "Value must be positive");
    }
    return value;
  }

  /**
   * Validate that a value is not exactly zero.
   *
   * @throws InvalidInputException if value is zero (either sign)
   */
  public static double validateNonZero(double value) {
    validateNumber(value);

    if (value == 0) {
      throw new InvalidInputException(value, "Value must not be zero");
    }
    return value;
  }

  /** Inclusive range check; a null bound is unbounded on that side. */
  public static double validateRange(double value, Double min, Double max) {
    return validateRange(value, min, max, true);
  }

  /**
   * Validate that a value is within a range.
   *
   * @param value the value to validate
   * @param min lower bound, null for no limit
   * @param max upper bound, null for no limit
   * @param inclusive whether both bounds are inclusive
   * @return the validated value
   * @throws OutOfRangeException if value is outside the range
   */
  public static double validateRange(double value, Double min, Double max, boolean inclusive) {
    validateNumber(value);

    if (min != null && (inclusive ? value < min : value <= min)) {
      throw new OutOfRangeException(value, min, max);
    }
    if (max != null && (inclusive ? value > max : value >= max)) {
      throw new OutOfRangeException(value, min, max);
    }
    return value;
  }
}
