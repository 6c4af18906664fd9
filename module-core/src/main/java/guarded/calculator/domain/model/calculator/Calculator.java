package guarded.calculator.domain.model.calculator;

import static guarded.calculator.domain.service.validation.NumberValidator.validateNumber;

import guarded.calculator.domain.service.arithmetic.ArithmeticOperations;
import guarded.calculator.error.CalculatorErrorCode;
import guarded.calculator.error.exception.CalculatorException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import lombok.extern.slf4j.Slf4j;

/**
 * 이력/되돌리기를 지원하는 상태 기반 계산기
 *
 * <p>현재 값과 {@link CalculatorState} 이력을 보관합니다. 모든 변경 메서드는 같은 인스턴스를 반환하므로 체이닝이 가능합니다.
 *
 * <h3>불변식</h3>
 *
 * <ul>
 *   <li>이력은 절대 비어 있지 않음 (생성/clear 시 첫 레코드 기록)
 *   <li>이력의 마지막 값 == 현재 값
 *   <li>현재 값은 항상 유한한 수
 * </ul>
 *
 * <p>실패한 호출은 상태를 바꾸지 않고 예외를 그대로 전파합니다. 스레드 안전하지 않으므로 여러 스레드에서 공유할 경우 외부에서 직렬화해야 합니다.
 *
 * <pre>{@code
 * Calculator calc = new Calculator(10);
 * calc.add(5).multiply(2).getValue(); // 30.0
 * calc.undo().getValue();             // 15.0
 * }</pre>
 */
@Slf4j
public class Calculator {

  private double value;
  private final List<CalculatorState> history;

  public Calculator() {
    this(0.0);
  }

  /**
   * @param initialValue 시작 값
   * @throws guarded.calculator.error.exception.InvalidInputException 유한한 수가 아닐 때
   */
  public Calculator(double initialValue) {
    this.value = validateNumber(initialValue);
    this.history = new ArrayList<>();
    recordState("init");
  }

  private Calculator(double value, List<CalculatorState> history) {
    this.value = value;
    this.history = new ArrayList<>(history);
  }

  public double getValue() {
    return value;
  }

  /** 지금까지의 이력 스냅샷 (수정 불가) */
  public List<CalculatorState> getHistory() {
    return List.copyOf(history);
  }

  public Calculator add(double operand) {
    return apply(ArithmeticOperations::add, operand, "add");
  }

  public Calculator subtract(double operand) {
    return apply(ArithmeticOperations::subtract, operand, "subtract");
  }

  public Calculator multiply(double operand) {
    return apply(ArithmeticOperations::multiply, operand, "multiply");
  }

  public Calculator divide(double operand) {
    return apply(ArithmeticOperations::divide, operand, "divide");
  }

  public Calculator power(double exponent) {
    return apply(ArithmeticOperations::power, exponent, "power");
  }

  /** 산술 연산 없이 값을 직접 지정 */
  public Calculator set(double newValue) {
    this.value = validateNumber(newValue);
    recordState("set", newValue);
    log.debug("[Calculator] set({}) -> {}", newValue, value);
    return this;
  }

  /** 0으로 초기화하고 이력을 clear 레코드 하나로 줄입니다. 실패하지 않습니다. */
  public Calculator clear() {
    this.value = 0.0;
    history.clear();
    recordState("clear");
    log.debug("[Calculator] clear -> {}", value);
    return this;
  }

  /**
   * 마지막 연산을 되돌립니다.
   *
   * @throws CalculatorException 최초 레코드만 남아 있을 때 (NOTHING_TO_UNDO)
   */
  public Calculator undo() {
    if (history.size() <= 1) {
      throw new CalculatorException(CalculatorErrorCode.NOTHING_TO_UNDO);
    }

    CalculatorState undone = history.remove(history.size() - 1);
    this.value = history.get(history.size() - 1).value();
    log.debug("[Calculator] undo {} -> {}", undone, value);
    return this;
  }

  /** 이후 변경이 서로 영향을 주지 않는 독립 사본 */
  public Calculator copy() {
    return new Calculator(value, history);
  }

  private Calculator apply(DoubleBinaryOperator operation, double operand, String name) {
    validateNumber(operand);
    // 연산이 실패하면 여기서 예외가 전파되고 상태는 그대로 유지됨
    double result = operation.applyAsDouble(value, operand);

    this.value = result;
    recordState(name, operand);
    log.debug("[Calculator] {}({}) -> {}", name, operand, result);
    return this;
  }

  private void recordState(String operation, double... operands) {
    history.add(new CalculatorState(value, operation, operands));
  }

  /** 값만 비교 (이력은 동등성에 포함되지 않음) */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Calculator other)) {
      return false;
    }
    return value == other.value;
  }

  @Override
  public int hashCode() {
    // 0.0 == -0.0 이므로 해시도 같아야 함
    return Double.hashCode(value == 0.0 ? 0.0 : value);
  }

  @Override
  public String toString() {
    return "Calculator(value=" + value + ", historyLength=" + history.size() + ")";
  }
}
