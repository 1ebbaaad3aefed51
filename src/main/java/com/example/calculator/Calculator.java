package com.example.calculator;

import java.util.List;
import java.util.Objects;

/**
 * Provides basic arithmetic operations for real numbers.
 */
public final class Calculator {
    public double add(double a, double b) {
        return a + b;
    }

    public double subtract(double a, double b) {
        return a - b;
    }

    public double multiply(double a, double b) {
        return a * b;
    }

    /**
     * Divides {@code a} by {@code b}.
     *
     * @throws DivisionByZeroException when {@code b} is zero
     */
    public double divide(double a, double b) {
        if (b == 0.0) {
            throw new DivisionByZeroException();
        }
        return a / b;
    }

    public double power(double base, double exponent) {
        return Math.pow(base, exponent);
    }

    /**
     * Returns the non-negative square root of {@code value}.
     *
     * @throws InvalidDomainException when {@code value} is negative
     */
    public double squareRoot(double value) {
        if (value < 0.0) {
            throw new InvalidDomainException();
        }
        return Math.sqrt(value);
    }

    /**
     * Returns {@code pct} percent of {@code whole}.
     */
    public double percentage(double whole, double pct) {
        return whole * pct / 100.0;
    }

    /**
     * Computes the arithmetic mean of the given values.
     *
     * @param values values to average, in any order
     * @return sum of the values divided by their count
     * @throws EmptyInputException when no values are given
     */
    public double average(double... values) {
        Objects.requireNonNull(values, "values");
        if (values.length == 0) {
            throw new EmptyInputException();
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Computes the arithmetic mean of a sequence of mixed numeric values.
     *
     * @param values values to average; elements are read with {@link Number#doubleValue()}
     * @return sum of the values divided by their count
     * @throws EmptyInputException when the list is empty
     */
    public double average(List<? extends Number> values) {
        Objects.requireNonNull(values, "values");
        double[] unboxed = new double[values.size()];
        for (int i = 0; i < unboxed.length; i++) {
            unboxed[i] = Objects.requireNonNull(values.get(i), "values element").doubleValue();
        }
        return average(unboxed);
    }
}
