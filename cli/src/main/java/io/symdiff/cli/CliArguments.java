package io.symdiff.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parsed command line.
 *
 * @param configPath {@code --config} value, or {@code null}
 * @param domain {@code --domain} override, or {@code null} to use the configured domain
 * @param format {@code --format} override, or {@code null} to use the configured format
 * @param operation the requested operation; {@code null} only when {@code help} is set
 * @param expression the expression text of {@code --eval} or {@code --diff}
 * @param variable the {@code --by} variable of a derivative
 * @param order derivative order, {@code 1} unless {@code --order} is given
 * @param bindings raw {@code name=value} tokens in command-line order
 * @param help {@code --help} was requested
 */
public record CliArguments(
        String configPath,
        String domain,
        String format,
        Operation operation,
        String expression,
        String variable,
        int order,
        List<String> bindings,
        boolean help) {

    /** The two operations of the front end. */
    public enum Operation {
        EVAL("eval"),
        DIFF("diff");

        private final String label;

        Operation(String label) {
            this.label = label;
        }

        /** Name used in JSON output. */
        public String label() {
            return label;
        }
    }

    public static final String USAGE = String.join(
            System.lineSeparator(),
            "Usage:",
            "  symdiff [options] --eval <expr> [name=value ...]",
            "  symdiff [options] --diff <expr> --by <variable> [--order <n>] [name=value ...]",
            "  symdiff --help",
            "",
            "Options:",
            "  --config <path>              YAML configuration file (default: ./symdiff.yaml if present)",
            "  --domain auto|real|complex   numeric domain (default: auto-detect from the arguments)",
            "  --format text|json           output format (default: text)",
            "",
            "Exit codes: 0 success, 1 expression error, 2 usage, binding or configuration error");

    public CliArguments {
        bindings = List.copyOf(bindings);
    }

    /**
     * Parses raw arguments.
     *
     * @throws ArgumentException if the command line is unusable
     */
    public static CliArguments parse(String[] args) {
        String configPath = null;
        String domain = null;
        String format = null;
        Operation operation = null;
        String expression = null;
        String variable = null;
        String orderText = null;
        boolean help = false;
        List<String> bindings = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--help", "-h" -> help = true;
                case "--config" -> configPath = once(arg, configPath, value(args, ++i, arg));
                case "--domain" -> domain = once(arg, domain, choice(arg, value(args, ++i, arg), "auto", "real", "complex"));
                case "--format" -> format = once(arg, format, choice(arg, value(args, ++i, arg), "text", "json"));
                case "--by" -> variable = once(arg, variable, value(args, ++i, arg));
                case "--order" -> orderText = once(arg, orderText, value(args, ++i, arg));
                case "--eval", "--diff" -> {
                    if (operation != null) {
                        throw new ArgumentException("Only one of --eval and --diff may be given");
                    }
                    operation = "--eval".equals(arg) ? Operation.EVAL : Operation.DIFF;
                    expression = value(args, ++i, arg);
                }
                default -> {
                    if (arg.startsWith("--")) {
                        throw new ArgumentException("Unknown option: " + arg);
                    }
                    bindings.add(arg);
                }
            }
        }

        if (help) {
            return new CliArguments(configPath, domain, format, operation, expression, variable, 1, bindings, true);
        }
        if (operation == null) {
            throw new ArgumentException("One of --eval or --diff is required");
        }
        if (operation == Operation.DIFF && variable == null) {
            throw new ArgumentException("--diff requires --by <variable>");
        }
        if (operation == Operation.EVAL && (variable != null || orderText != null)) {
            throw new ArgumentException("--by and --order are only valid with --diff");
        }
        return new CliArguments(
                configPath, domain, format, operation, expression, variable, parseOrder(orderText), bindings, false);
    }

    /** Every raw argument that may mention the imaginary unit: the expression and the bindings. */
    public List<String> domainEvidence() {
        List<String> evidence = new ArrayList<>();
        if (expression != null) {
            evidence.add(expression);
        }
        evidence.addAll(bindings);
        return evidence;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new ArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static String once(String option, String current, String value) {
        if (current != null) {
            throw new ArgumentException(option + " may be given only once");
        }
        return value;
    }

    private static String choice(String option, String value, String... allowed) {
        String normalized = value.toLowerCase(Locale.ROOT);
        for (String candidate : allowed) {
            if (candidate.equals(normalized)) {
                return normalized;
            }
        }
        throw new ArgumentException(
                "Invalid value for " + option + ": '" + value + "'. Expected one of " + String.join(", ", allowed));
    }

    private static int parseOrder(String text) {
        if (text == null) {
            return 1;
        }
        try {
            int order = Integer.parseInt(text.trim());
            if (order < 0) {
                throw new ArgumentException("--order must not be negative, got: " + text);
            }
            return order;
        } catch (NumberFormatException e) {
            throw new ArgumentException("--order must be an integer, got: '" + text + "'", e);
        }
    }
}
