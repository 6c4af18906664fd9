package guarded.calculator.error.exception;

import guarded.calculator.error.CalculatorErrorCode;
import guarded.calculator.error.ErrorCode;
import guarded.calculator.error.exception.base.BaseException;
import java.util.Arrays;

/**
 * 계산기 공통 예외
 *
 * <p>입력 검증, 산술 연산, 계산기 상태 오류가 모두 이 타입을 상속합니다. 구조적 오용(예: 되돌릴 이력이 없는 상태에서 {@code undo()})은 이
 * 타입으로 직접 던집니다.
 *
 * <h3>Usage Examples:</h3>
 *
 * <pre>
 * throw new CalculatorException(CalculatorErrorCode.NOTHING_TO_UNDO);
 * </pre>
 */
public class CalculatorException extends BaseException {

  /** 문제를 일으킨 값 (없으면 null) */
  private final Object value;

  public CalculatorException(CalculatorErrorCode errorCode) {
    super(errorCode);
    this.value = null;
  }

  /**
   * 문제 값과 메시지 인자를 함께 받는 생성자
   *
   * @param errorCode 오류 코드
   * @param value 문제를 일으킨 값 (double[]이면 복사하여 보관)
   * @param args 메시지 템플릿 인자
   */
  protected CalculatorException(ErrorCode errorCode, Object value, Object... args) {
    super(errorCode, args);
    this.value = value instanceof double[] arr ? arr.clone() : value;
  }

  public Object getValue() {
    return value instanceof double[] arr ? arr.clone() : value;
  }

  /** 메시지 출력용 값 표현 (배열은 원소 목록으로) */
  protected static String describe(Object value) {
    if (value instanceof double[] arr) {
      return Arrays.toString(arr);
    }
    return String.valueOf(value);
  }
}
