package guarded.calculator.error.exception;

import guarded.calculator.error.CalculatorErrorCode;
import lombok.Getter;

/**
 * 허용 범위 이탈 예외
 *
 * <p>CalculatorErrorCode.OUT_OF_RANGE 메시지 형식: "Value out of range [%s, %s]: %s". 지정되지 않은 경계는 -inf / inf로
 * 표기합니다.
 */
@Getter
public class OutOfRangeException extends CalculatorException {

  /** 하한 (null이면 제한 없음) */
  private final Double min;

  /** 상한 (null이면 제한 없음) */
  private final Double max;

  public OutOfRangeException(double value, Double min, Double max) {
    super(
        CalculatorErrorCode.OUT_OF_RANGE,
        value,
        min != null ? min : "-inf",
        max != null ? max : "inf",
        value);
    this.min = min;
    this.max = max;
  }
}
