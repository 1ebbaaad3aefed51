package com.example.calculator;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple CLI bootstrap forwarding one operation to the calculator.
 *
 * <p>Usage: {@code <operation> <number>...}, for example {@code divide 7 2}.
 */
public final class Application {
    private static final Logger log = LoggerFactory.getLogger(Application.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CALCULATION_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private Application() {
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs one calculation and reports it on the given streams.
     *
     * @return process exit status
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args == null || args.length == 0) {
            err.println(usage());
            return EXIT_USAGE;
        }
        Optional<Operation> operation = Operation.fromName(args[0]);
        if (operation.isEmpty()) {
            err.println("Unknown operation: " + args[0]);
            err.println(usage());
            return EXIT_USAGE;
        }

        double[] operands;
        try {
            operands = parseOperands(Arrays.copyOfRange(args, 1, args.length));
        } catch (NumberFormatException ex) {
            log.warn("Rejected operands {}: {}", Arrays.toString(args), ex.getMessage());
            err.println(ex.getMessage());
            err.println(usage());
            return EXIT_USAGE;
        }

        log.debug("Applying {} to {}", operation.get().commandName(), Arrays.toString(operands));
        try {
            double result = operation.get().apply(new Calculator(), operands);
            out.println(ResultFormatter.format(result));
            return EXIT_OK;
        } catch (CalculatorException | IllegalArgumentException ex) {
            log.warn("{} failed: {}", operation.get().commandName(), ex.getMessage());
            err.println(ex.getMessage());
            return EXIT_CALCULATION_FAILED;
        }
    }

    private static double[] parseOperands(String[] raw) {
        double[] operands = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            operands[i] = Double.parseDouble(raw[i].trim());
        }
        return operands;
    }

    static String usage() {
        String names = Arrays.stream(Operation.values())
                .map(Operation::commandName)
                .collect(Collectors.joining("|"));
        return "usage: calculator <" + names + "> <number>...";
    }
}
