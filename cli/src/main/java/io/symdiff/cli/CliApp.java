package io.symdiff.cli;

import io.symdiff.cli.config.CliConfig;
import io.symdiff.cli.config.ConfigLoadException;
import io.symdiff.cli.config.ConfigLoader;
import io.symdiff.cli.output.ProblemDetail;
import io.symdiff.cli.output.ResultWriter;
import io.symdiff.core.engine.DomainRegistry;
import io.symdiff.core.engine.SymbolicEngine;
import io.symdiff.core.error.SymbolicException;
import io.symdiff.core.model.Expression;
import io.symdiff.core.model.Outcome;
import io.symdiff.core.model.Variable;
import io.symdiff.core.spi.NumericDomain;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One invocation of the command-line front end: argument parsing, configuration, domain
 * selection, binding parsing, then exactly one engine operation.
 *
 * <p>Never exits the JVM; {@link #run} returns the exit code and {@link SymdiffMain} exits.
 */
public final class CliApp {

    private static final Logger LOG = LoggerFactory.getLogger(CliApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_EXPRESSION_ERROR = 1;
    public static final int EXIT_USAGE_ERROR = 2;

    private static final String FALLBACK_DOMAIN = "real";

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;
    private final Path workingDirectory;
    private final DomainRegistry domains = DomainRegistry.withDefaults();

    public CliApp(PrintStream out, PrintStream err, Function<String, String> envLookup, Path workingDirectory) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
    }

    /**
     * Runs one invocation.
     *
     * @return {@link #EXIT_OK}, {@link #EXIT_EXPRESSION_ERROR} or {@link #EXIT_USAGE_ERROR}
     */
    public int run(String[] args) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (ArgumentException e) {
            ResultWriter writer = new ResultWriter(requestedFormat(args), out, err);
            writer.problem(ProblemDetail.usage(e.getMessage()));
            err.println(CliArguments.USAGE);
            return EXIT_USAGE_ERROR;
        }
        if (arguments.help()) {
            new ResultWriter("text", out, err).usage(CliArguments.USAGE);
            return EXIT_OK;
        }

        CliConfig config;
        try {
            config = ConfigLoader.resolve(arguments.configPath(), workingDirectory, envLookup)
                    .withOverrides(arguments.domain(), arguments.format());
        } catch (ConfigLoadException e) {
            LOG.warn("Configuration rejected: {}", e.getMessage());
            new ResultWriter(requestedFormat(args), out, err).problem(ProblemDetail.configuration(e.getMessage()));
            return EXIT_USAGE_ERROR;
        }

        LogbackConfigurator.configure(config);
        ResultWriter writer = new ResultWriter(config.outputFormat(), out, err);

        NumericDomain<?> domain = CliConfig.DOMAIN_AUTO.equals(config.domain())
                ? domains.detect(arguments.domainEvidence(), FALLBACK_DOMAIN)
                : domains.requireDomain(config.domain());
        LOG.debug("Domain selected: {} (configured: {})", domain.id(), config.domain());

        try {
            return execute(domain, config, arguments, writer);
        } catch (DuplicateBindingException e) {
            writer.problem(ProblemDetail.duplicateBinding(e));
            return EXIT_USAGE_ERROR;
        } catch (ArgumentException e) {
            writer.problem(ProblemDetail.usage(e.getMessage()));
            return EXIT_USAGE_ERROR;
        }
    }

    private <V> int execute(NumericDomain<V> domain, CliConfig config, CliArguments arguments, ResultWriter writer) {
        long start = System.nanoTime();
        Map<String, V> bindings = BindingParser.parse(arguments.bindings(), domain);
        SymbolicEngine<V> engine = new SymbolicEngine<>(domain, config.engineOptions());

        Outcome<Expression<V>> parsed = engine.parse(arguments.expression());
        if (parsed.isError()) {
            return fail(writer, parsed.error());
        }
        Expression<V> expression = parsed.value();

        String result;
        String value = null;
        switch (arguments.operation()) {
            case EVAL -> {
                Outcome<V> evaluated = engine.evaluate(expression, bindings);
                if (evaluated.isError()) {
                    return fail(writer, evaluated.error());
                }
                result = domain.format(evaluated.value());
            }
            case DIFF -> {
                if (!Variable.isValidName(arguments.variable())) {
                    throw new ArgumentException(
                            "--by must name a variable (letters only), got: '" + arguments.variable() + "'");
                }
                Expression<V> derivative = engine.differentiate(expression, arguments.variable(), arguments.order());
                result = engine.render(derivative);
                if (!bindings.isEmpty()) {
                    Outcome<V> evaluated = engine.evaluate(derivative, bindings);
                    if (evaluated.isError()) {
                        return fail(writer, evaluated.error());
                    }
                    value = domain.format(evaluated.value());
                }
            }
            default -> throw new IllegalStateException("Unhandled operation: " + arguments.operation());
        }

        writer.result(arguments.operation().label(), domain.id(), arguments.expression(), result, value);
        LOG.info(
                "symdiff {}: domain={}, nodes={}, bindings={}, elapsedMs={}",
                arguments.operation().label(),
                domain.id(),
                expression.size(),
                bindings.size(),
                (System.nanoTime() - start) / 1_000_000);
        return EXIT_OK;
    }

    private static int fail(ResultWriter writer, SymbolicException error) {
        LOG.info("Expression rejected: kind={}, phase={}", error.kind(), error.phase());
        writer.problem(ProblemDetail.expressionError(error));
        return EXIT_EXPRESSION_ERROR;
    }

    /** Output format for errors raised before the configuration is known. */
    private String requestedFormat(String[] args) {
        for (int i = 0; i + 1 < args.length; i++) {
            if ("--format".equals(args[i])) {
                return args[i + 1];
            }
        }
        String env = envLookup.apply("SYMDIFF_OUTPUT_FORMAT");
        return env != null ? env.trim() : "text";
    }
}
