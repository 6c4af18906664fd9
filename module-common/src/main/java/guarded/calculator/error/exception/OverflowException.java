package guarded.calculator.error.exception;

import guarded.calculator.error.CalculatorErrorCode;
import lombok.Getter;

/**
 * 오버플로우 예외
 *
 * <p>연산 결과(또는 사전 검사 추정치)가 유한 범위를 벗어날 때 발생합니다. 연산 이름과 피연산자 목록을 함께 기록합니다.
 */
public class OverflowException extends CalculatorException {

  /** 연산 이름 (addition, multiplication, ...) */
  @Getter private final String operation;

  private final double[] operands;

  public OverflowException(String operation, double... operands) {
    super(CalculatorErrorCode.OVERFLOW, operands, operation, describe(operands));
    this.operation = operation;
    this.operands = operands.clone();
  }

  public double[] getOperands() {
    return operands.clone();
  }
}
