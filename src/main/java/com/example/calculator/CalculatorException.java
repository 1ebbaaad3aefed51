package com.example.calculator;

/**
 * Base type for the domain errors raised by {@link Calculator}.
 */
public abstract class CalculatorException extends ArithmeticException {
    private static final long serialVersionUID = 1L;

    protected CalculatorException(String message) {
        super(message);
    }
}
