package com.example.calculator;

/**
 * Raised when the square root of a negative number is requested.
 */
public final class InvalidDomainException extends CalculatorException {
    private static final long serialVersionUID = 1L;

    public static final String MESSAGE = "Cannot calculate square root of negative number";

    public InvalidDomainException() {
        super(MESSAGE);
    }
}
