package guarded.calculator.error;

/**
 * 계산기 오류 코드 표준 인터페이스
 *
 * <p>{@link #getMessage()}는 {@link String#format(String, Object...)} 템플릿입니다.
 */
public interface ErrorCode {
  String getCode();

  String getMessage();
}
