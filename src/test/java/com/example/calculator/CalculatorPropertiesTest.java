package com.example.calculator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class CalculatorPropertiesTest {

    private static final double TOLERANCE = 1e-10;

    private final Calculator calc = new Calculator();

    @ParameterizedTest
    @CsvSource({"2, 3", "-1, 1", "0.1, 0.2", "-7.25, 3.5", "1000000, -2000000"})
    void additionIsCommutative(double a, double b) {
        assertThat(calc.add(a, b)).isEqualTo(calc.add(b, a));
    }

    @ParameterizedTest
    @CsvSource({"5, 3", "0, 5", "-3, -1", "0.1, 0.2", "42.5, -17"})
    void subtractionIsAntiCommutative(double a, double b) {
        assertThat(calc.subtract(a, b)).isEqualTo(-calc.subtract(b, a));
    }

    @ParameterizedTest
    @CsvSource({"7, 2", "0.1, 3", "-8, -2", "123.456, 0.001", "1e6, 7"})
    void divisionUndoesMultiplication(double a, double b) {
        assertThat(calc.divide(calc.multiply(a, b), b)).isCloseTo(a, within(TOLERANCE));
    }

    @ParameterizedTest
    @ValueSource(doubles = {5, -3, 0.5, 1e9})
    void zeroExponentYieldsOne(double base) {
        assertThat(calc.power(base, 0)).isEqualTo(1.0);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0, 2, 0.5, 10, 123.456, 1e-6})
    void squareRootSquaredRestoresValue(double x) {
        double root = calc.squareRoot(x);

        assertThat(root).isGreaterThanOrEqualTo(0.0);
        assertThat(root * root).isCloseTo(x, within(TOLERANCE));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-4.5, 0, 3, 1e12})
    void averageOfSingleElementIsThatElement(double value) {
        assertThat(calc.average(value)).isEqualTo(value);
    }

    @ParameterizedTest
    @CsvSource({"0.1, 0.7, 2.3, -5", "1, 2, 3, 4", "1e6, -3.25, 0, 17"})
    void averageIgnoresOrder(double a, double b, double c, double d) {
        double expected = calc.average(a, b, c, d);

        assertThat(calc.average(d, c, b, a)).isCloseTo(expected, within(TOLERANCE));
        assertThat(calc.average(b, d, a, c)).isCloseTo(expected, within(TOLERANCE));
    }
}
