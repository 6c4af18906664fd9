package guarded.calculator.domain.model.calculator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import guarded.calculator.error.CalculatorErrorCode;
import guarded.calculator.error.exception.CalculatorException;
import guarded.calculator.error.exception.DivisionByZeroException;
import guarded.calculator.error.exception.InvalidInputException;
import guarded.calculator.error.exception.OverflowException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Calculator - 상태/이력/되돌리기")
class CalculatorTest {

  // ==================== Test Suite 1: Construction ====================

  @Nested
  @DisplayName("Construction")
  class Construction {

    @Test
    @DisplayName("default value is 0.0 with a single init record")
    void defaultConstructor() {
      Calculator calc = new Calculator();

      assertAll(
          "calculator",
          () -> assertEquals(0.0, calc.getValue()),
          () -> assertEquals(1, calc.getHistory().size()),
          () -> assertEquals("init", calc.getHistory().get(0).operation()),
          () -> assertEquals(0, calc.getHistory().get(0).operandCount()));
    }

    @Test
    void initialValueIsRecorded() {
      Calculator calc = new Calculator(10);

      assertThat(calc.getValue()).isEqualTo(10.0);
      assertThat(calc.getHistory()).containsExactly(new CalculatorState(10.0, "init", null));
    }

    @Test
    void nonFiniteInitialValueIsRejected() {
      assertThrows(InvalidInputException.class, () -> new Calculator(Double.NaN));
      assertThrows(InvalidInputException.class, () -> new Calculator(Double.NEGATIVE_INFINITY));
    }
  }

  // ==================== Test Suite 2: Chained operations ====================

  @Nested
  @DisplayName("Chained operations")
  class ChainedOperations {

    @Test
    @DisplayName("10 + 5 = 15, * 2 = 30, undo -> 15, undo -> 10, undo fails")
    void chainThenUndo() {
      Calculator calc = new Calculator(10);

      assertThat(calc.add(5).multiply(2).getValue()).isEqualTo(30.0);
      assertThat(calc.undo().getValue()).isEqualTo(15.0);
      assertThat(calc.undo().getValue()).isEqualTo(10.0);
      assertThatThrownBy(calc::undo).isInstanceOf(CalculatorException.class);
    }

    @Test
    void everyOperationIsRecordedWithItsOperand() {
      Calculator calc = new Calculator(2).power(3).subtract(2).divide(3).add(1);

      assertThat(calc.getValue()).isEqualTo(3.0);
      assertThat(calc.getHistory())
          .extracting(CalculatorState::operation)
          .containsExactly("init", "power", "subtract", "divide", "add");
      assertThat(calc.getHistory().get(1).operands()).containsExactly(3.0);
      assertThat(calc.getHistory().get(1).value()).isEqualTo(8.0);
    }

    @Test
    void mutatorsReturnSameInstance() {
      Calculator calc = new Calculator();

      assertThat(calc.add(1)).isSameAs(calc);
      assertThat(calc.set(3)).isSameAs(calc);
      assertThat(calc.undo()).isSameAs(calc);
      assertThat(calc.clear()).isSameAs(calc);
    }
  }

  // ==================== Test Suite 3: Failure atomicity ====================

  @Nested
  @DisplayName("Failure leaves state unchanged")
  class FailureAtomicity {

    @Test
    void divisionByZeroPropagatesUnchanged() {
      Calculator calc = new Calculator(10).add(5);
      List<CalculatorState> before = calc.getHistory();

      DivisionByZeroException e = assertThrows(DivisionByZeroException.class, () -> calc.divide(0));

      assertThat(e.getNumerator()).isEqualTo(15.0);
      assertThat(calc.getValue()).isEqualTo(15.0);
      assertThat(calc.getHistory()).isEqualTo(before);
    }

    @Test
    void overflowPropagatesUnchanged() {
      Calculator calc = new Calculator(1e308);

      assertThrows(OverflowException.class, () -> calc.multiply(10));
      assertThat(calc.getValue()).isEqualTo(1e308);
      assertThat(calc.getHistory()).hasSize(1);
    }

    @Test
    void invalidOperandIsRejected() {
      Calculator calc = new Calculator(1);

      assertThrows(InvalidInputException.class, () -> calc.add(Double.NaN));
      assertThrows(InvalidInputException.class, () -> calc.set(Double.POSITIVE_INFINITY));
      assertThrows(InvalidInputException.class, () -> calc.power(0.5).set(-4).power(0.5));

      // power(0.5) on 1 succeeded before the failing call
      assertThat(calc.getValue()).isEqualTo(-4.0);
      assertThat(calc.getHistory()).hasSize(3);
    }
  }

  // ==================== Test Suite 4: set / clear / undo ====================

  @Nested
  @DisplayName("set, clear, undo")
  class SetClearUndo {

    @Test
    void setRecordsOperand() {
      Calculator calc = new Calculator(1).set(42);

      CalculatorState last = calc.getHistory().get(1);
      assertThat(last.operation()).isEqualTo("set");
      assertThat(last.operands()).containsExactly(42.0);
      assertThat(calc.getValue()).isEqualTo(42.0);
    }

    @Test
    void clearTruncatesHistory() {
      Calculator calc = new Calculator(7).add(1).multiply(3).clear();

      assertThat(calc.getValue()).isZero();
      assertThat(calc.getHistory())
          .containsExactly(new CalculatorState(0.0, "clear", new double[0]));
      assertThatThrownBy(calc::undo).isInstanceOf(CalculatorException.class);
    }

    @Test
    void undoOnFreshInstanceFails() {
      CalculatorException e =
          assertThrows(CalculatorException.class, () -> new Calculator().undo());

      assertThat(e.getErrorCode()).isEqualTo(CalculatorErrorCode.NOTHING_TO_UNDO);
      assertThat(e.getMessage()).isEqualTo("Nothing to undo");
    }

    @Test
    void undoRestoresSetValue() {
      Calculator calc = new Calculator(3).set(9).add(1);

      assertThat(calc.undo().getValue()).isEqualTo(9.0);
      assertThat(calc.undo().getValue()).isEqualTo(3.0);
    }
  }

  // ==================== Test Suite 5: History snapshot / copy ====================

  @Nested
  @DisplayName("History snapshot and copy")
  class SnapshotAndCopy {

    @Test
    void historyIsUnmodifiable() {
      Calculator calc = new Calculator(1);

      assertThatThrownBy(() -> calc.getHistory().clear())
          .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void historySnapshotDoesNotFollowLaterMutation() {
      Calculator calc = new Calculator(1);
      List<CalculatorState> snapshot = calc.getHistory();

      calc.add(1);

      assertThat(snapshot).hasSize(1);
    }

    @Test
    void copyIsIndependent() {
      Calculator original = new Calculator(10).add(5);
      Calculator copy = original.copy();

      copy.multiply(2);
      original.subtract(5);

      assertThat(original.getValue()).isEqualTo(10.0);
      assertThat(copy.getValue()).isEqualTo(30.0);
      assertThat(copy.undo().undo().getValue()).isEqualTo(10.0);
      assertThat(original.getHistory()).hasSize(3);
    }

    @Test
    void copyHasSameHistoryContents() {
      Calculator original = new Calculator(2).power(2).set(-1);

      assertThat(original.copy().getHistory()).isEqualTo(original.getHistory());
    }
  }

  // ==================== Test Suite 6: Equality ====================

  @Nested
  @DisplayName("Equality")
  class Equality {

    @Test
    void equalityIgnoresHistory() {
      Calculator a = new Calculator(4);
      Calculator b = new Calculator(2).multiply(2);

      assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
      assertThat(a).isNotEqualTo(new Calculator(5));
    }

    @Test
    void signedZerosAreEqualAndHashAlike() {
      Calculator positive = new Calculator(0.0);
      Calculator negative = new Calculator(-0.0);

      assertThat(positive).isEqualTo(negative);
      assertThat(positive.hashCode()).isEqualTo(negative.hashCode());
    }

    @Test
    void toStringShowsValueAndHistoryLength() {
      assertThat(new Calculator(1).add(2)).hasToString("Calculator(value=3.0, historyLength=2)");
    }
  }
}
