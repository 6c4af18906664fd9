package guarded.calculator.error.exception;

import guarded.calculator.error.CalculatorErrorCode;
import lombok.Getter;

/**
 * 잘못된 입력 예외
 *
 * <p>다음 경우에 발생:
 *
 * <ul>
 *   <li>NaN / Infinity / null 입력
 *   <li>도메인 전제 위반 (0의 음수 거듭제곱, 음수 밑의 비정수 거듭제곱 등)
 *   <li>부호/0 검증 실패
 * </ul>
 */
@Getter
public class InvalidInputException extends CalculatorException {

  private final String reason;

  public InvalidInputException(Object value, String reason) {
    super(CalculatorErrorCode.INVALID_INPUT, value, reason, describe(value));
    this.reason = reason;
  }

  public InvalidInputException(Object value) {
    this(value, "invalid input");
  }
}
