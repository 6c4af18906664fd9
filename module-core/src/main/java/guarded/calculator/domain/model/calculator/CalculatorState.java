package guarded.calculator.domain.model.calculator;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 계산기 이력 스냅샷 (불변)
 *
 * <p>성공한 변경 호출마다 하나씩 생성되며 생성 후 변경되지 않습니다.
 *
 * <h3>불변성 보장</h3>
 *
 * <ul>
 *   <li>Canonical constructor 방어적 복사
 *   <li>Accessor 방어적 복사
 * </ul>
 *
 * @param value 연산 적용 후의 값
 * @param operation 연산 이름 (init, add, set, clear, ...)
 * @param operands 연산에 전달된 피연산자 (순서 유지)
 */
public record CalculatorState(double value, String operation, double[] operands) {

  public CalculatorState(double value, String operation, double[] operands) {
    this.value = value;
    this.operation = Objects.requireNonNull(operation, "operation");
    this.operands = operands != null ? operands.clone() : new double[0];
  }

  @Override
  public double[] operands() {
    return operands.clone();
  }

  /** 피연산자 개수 */
  public int operandCount() {
    return operands.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CalculatorState other)) {
      return false;
    }
    return Double.compare(value, other.value) == 0
        && operation.equals(other.operation)
        && Arrays.equals(operands, other.operands);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(value, operation) + Arrays.hashCode(operands);
  }

  /** {@code add(5.0) = 15.0} 형식 */
  @Override
  public String toString() {
    String args =
        Arrays.stream(operands).mapToObj(String::valueOf).collect(Collectors.joining(", "));
    return operation + "(" + args + ") = " + value;
  }
}
