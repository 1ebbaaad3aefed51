package com.example.calculator;

/**
 * Raised when a division is attempted with a zero divisor.
 */
public final class DivisionByZeroException extends CalculatorException {
    private static final long serialVersionUID = 1L;

    public static final String MESSAGE = "Cannot divide by zero";

    public DivisionByZeroException() {
        super(MESSAGE);
    }
}
