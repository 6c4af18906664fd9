package guarded.calculator.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CalculatorErrorCode implements ErrorCode {
  // === Input Errors ===
  INVALID_INPUT("K001", "%s: %s"),
  OUT_OF_RANGE("K002", "Value out of range [%s, %s]: %s"),

  // === Arithmetic Errors ===
  DIVISION_BY_ZERO("K003", "Division by zero: %s"),
  OVERFLOW("K004", "Overflow in %s: %s"),

  // === State Errors ===
  NOTHING_TO_UNDO("K005", "Nothing to undo");

  private final String code;
  private final String message;
}
