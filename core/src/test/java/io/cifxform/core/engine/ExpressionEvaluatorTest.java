package io.cifxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ExpressionEvaluator")
class ExpressionEvaluatorTest {

    private static double valueOf(String expression, Map<String, Double> fields) {
        EvaluationResult result = ExpressionEvaluator.evaluate(expression, fields);
        assertThat(result.isSuccess()).as("evaluation of %s: %s", expression, result).isTrue();
        return result.value().getAsDouble();
    }

    @Nested
    @DisplayName("arithmetic")
    class Arithmetic {

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource(delimiter = '|', value = {
            "1 + 2 * 3       | 7",
            "(1 + 2) * 3     | 9",
            "10 / 4          | 2.5",
            "2 ^ 3 ^ 2       | 512",
            "-2 ^ 2          | -4",
            "--3             | 3",
            "+4 - -1         | 5",
            "1.5e2 + 0.5     | 150.5",
            "2E-1 * 10       | 2",
            "7 - 2 - 1       | 4"
        })
        void evaluatesWithPrecedence(String expression, double expected) {
            assertThat(valueOf(expression, Map.of())).isCloseTo(expected, within(1e-9));
        }
    }

    @Nested
    @DisplayName("field substitution")
    class Substitution {

        @Test
        void substitutesFieldValues() {
            Map<String, Double> fields = Map.of("_pd_meas.time", 120.0, "_pd_meas.step_count", 60.0);

            assertThat(valueOf("_pd_meas.time / _pd_meas.step_count", fields)).isEqualTo(2.0);
        }

        @Test
        @DisplayName("longer name wins over its prefix")
        void longestNameFirst() {
            Map<String, Double> fields = Map.of("_a", 1.0, "_a_b", 10.0);

            assertThat(valueOf("_a_b + _a", fields)).isEqualTo(11.0);
        }

        @Test
        void negativeValuesAreParenthesised() {
            Map<String, Double> fields = Map.of("_x", -3.0);

            assertThat(valueOf("_x ^ 2", fields)).isEqualTo(9.0);
            assertThat(ExpressionEvaluator.substitute("2 - _x", fields)).isEqualTo("2 - (-3.0)");
        }

        @Test
        void unknownFieldFails() {
            EvaluationResult result = ExpressionEvaluator.evaluate("_known + _unknown", Map.of("_known", 1.0));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.value()).isEmpty();
            assertThat(result.error()).contains("_unknown");
        }

        @Test
        @DisplayName("a name is not substituted inside a longer unknown name")
        void tokenBoundaries() {
            EvaluationResult result = ExpressionEvaluator.evaluate("_cell.a + 1", Map.of("_cell", 2.0));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.error()).contains("_cell.a");
        }

        @Test
        @DisplayName("non-finite field values are never substituted")
        void nonFiniteValuesAreSkipped() {
            Map<String, Double> fields = Map.of("_inf", Double.POSITIVE_INFINITY, "_nan", Double.NaN);

            assertThat(valueOf("1 + 1", fields)).isEqualTo(2.0);
            EvaluationResult result = ExpressionEvaluator.evaluate("_inf * 0", fields);
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.error()).isEqualTo("Unresolved field reference: _inf");
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @ParameterizedTest
        @ValueSource(strings = {"1 / 0", "1 / (2 - 2)", "(1 + 2", "1 +", "3 4", "1e", "abc", "", "   ", "2 $ 3"})
        void failWithoutThrowing(String expression) {
            EvaluationResult result = ExpressionEvaluator.evaluate(expression, Map.of(), "_target");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.error()).isNotBlank();
        }

        @Test
        void divisionByZeroIsNamed() {
            assertThat(ExpressionEvaluator.evaluate("1/0", Map.of()).error()).isEqualTo("Division by zero");
        }

        @Test
        void overflowIsNotFinite() {
            assertThat(ExpressionEvaluator.evaluate("10 ^ 400", Map.of()).error())
                    .isEqualTo("Result is not a finite number");
        }
    }

    @Test
    void formatNumberIsPlain() {
        assertThat(ExpressionEvaluator.formatNumber(2.0)).isEqualTo("2.0");
        assertThat(ExpressionEvaluator.formatNumber(0.25)).isEqualTo("0.25");
        assertThat(ExpressionEvaluator.formatNumber(1.0e-7)).isEqualTo("0.00000010");
    }
}
