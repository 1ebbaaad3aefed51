package com.example.calculator;

public final class EmptyInputException extends CalculatorException {
    private static final long serialVersionUID = 1L;

    public static final String MESSAGE = "Cannot calculate average of empty list";

    public EmptyInputException() {
        super(MESSAGE);
    }
}
