package guarded.calculator.error.exception;

import guarded.calculator.error.CalculatorErrorCode;
import lombok.Getter;

/** 0으로 나누기 예외 (나눗셈, 나머지 연산 공통). 피제수를 함께 보관합니다. */
@Getter
public class DivisionByZeroException extends CalculatorException {

  private final double numerator;

  public DivisionByZeroException(double numerator) {
    super(CalculatorErrorCode.DIVISION_BY_ZERO, numerator, numerator);
    this.numerator = numerator;
  }
}
