package guarded.calculator.error.exception.base;

import guarded.calculator.error.ErrorCode;
import lombok.Getter;

/**
 * 모든 계산기 예외의 최상위 타입
 *
 * <p>메시지는 {@link ErrorCode#getMessage()} 템플릿에 인자를 채워 완성합니다.
 */
@Getter
public abstract class BaseException extends RuntimeException {
  private final ErrorCode errorCode;

  // 고정된 에러 메시지를 사용할 때
  protected BaseException(ErrorCode errorCode) {
    super(errorCode.getMessage());
    this.errorCode = errorCode;
  }

  // 동적 인자를 받는 생성자 (String.format 활용)
  protected BaseException(ErrorCode errorCode, Object... args) {
    super(String.format(errorCode.getMessage(), args));
    this.errorCode = errorCode;
  }
}
