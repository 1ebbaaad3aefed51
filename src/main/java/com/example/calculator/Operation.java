package com.example.calculator;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Names each {@link Calculator} operation and forwards positional arguments to it.
 */
public enum Operation {
    ADD("add", 2) {
        @Override
        double invoke(Calculator calculator, double[] args) {
            return calculator.add(args[0], args[1]);
        }
    },
    SUBTRACT("subtract", 2) {
        @Override
        double invoke(Calculator calculator, double[] args) {
            return calculator.subtract(args[0], args[1]);
        }
    },
    MULTIPLY("multiply", 2) {
        @Override
        double invoke(Calculator calculator, double[] args) {
            return calculator.multiply(args[0], args[1]);
        }
    },
    DIVIDE("divide", 2) {
        @Override
        double invoke(Calculator calculator, double[] args) {
            return calculator.divide(args[0], args[1]);
        }
    },
    POWER("power", 2) {
        @Override
        double invoke(Calculator calculator, double[] args) {
            return calculator.power(args[0], args[1]);
        }
    },
    SQUARE_ROOT("sqrt", 1) {
        @Override
        double invoke(Calculator calculator, double[] args) {
            return calculator.squareRoot(args[0]);
        }
    },
    PERCENTAGE("percentage", 2) {
        @Override
        double invoke(Calculator calculator, double[] args) {
            return calculator.percentage(args[0], args[1]);
        }
    },
    AVERAGE("average", -1) {
        @Override
        double invoke(Calculator calculator, double[] args) {
            return calculator.average(args);
        }
    };

    private static final int VARIADIC = -1;

    private final String commandName;
    private final int arity;

    Operation(String commandName, int arity) {
        this.commandName = commandName;
        this.arity = arity;
    }

    public String commandName() {
        return commandName;
    }

    public boolean isVariadic() {
        return arity == VARIADIC;
    }

    /**
     * Number of arguments the operation takes, or -1 when it accepts any number.
     */
    public int arity() {
        return arity;
    }

    /**
     * Forwards {@code args} to the matching calculator method.
     *
     * @throws IllegalArgumentException when the argument count does not match the arity
     */
    public double apply(Calculator calculator, double... args) {
        Objects.requireNonNull(calculator, "calculator");
        Objects.requireNonNull(args, "args");
        if (!isVariadic() && args.length != arity) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "%s expects %d argument(s) but got %d", commandName, arity, args.length));
        }
        return invoke(calculator, args);
    }

    abstract double invoke(Calculator calculator, double[] args);

    public static Optional<Operation> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (Operation operation : values()) {
            if (operation.commandName.equalsIgnoreCase(name)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}
