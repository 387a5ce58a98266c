package io.symdiff.cli.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Prints results and problems in the configured output format.
 *
 * <p>Text mode prints the bare result (and the derivative's value on a second line) to the
 * output stream and errors as {@code Error: <detail>} to the error stream. JSON mode prints one
 * object per invocation to the output stream, for results and problems alike.
 */
public final class ResultWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final boolean json;
    private final PrintStream out;
    private final PrintStream err;

    /**
     * @param format {@code json} or {@code text}
     */
    public ResultWriter(String format, PrintStream out, PrintStream err) {
        this.json = "json".equalsIgnoreCase(format);
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
    }

    /**
     * Writes a successful result.
     *
     * @param operation {@code eval} or {@code diff}
     * @param domain the domain id used
     * @param input the expression as given
     * @param result the value or rendered derivative
     * @param value the derivative's value under the bindings, or {@code null}
     */
    public void result(String operation, String domain, String input, String result, String value) {
        if (!json) {
            out.println(result);
            if (value != null) {
                out.println(value);
            }
            return;
        }
        ObjectNode node = MAPPER.createObjectNode();
        node.put("operation", operation);
        node.put("domain", domain);
        node.put("input", input);
        node.put("result", result);
        if (value != null) {
            node.put("value", value);
        }
        out.println(toJson(node));
    }

    public void problem(JsonNode problem) {
        if (json) {
            out.println(toJson(problem));
        } else {
            err.println("Error: " + problem.path("detail").asText());
        }
    }

    /** Usage text always goes to the output stream as plain text. */
    public void usage(String text) {
        out.println(text);
    }

    private static String toJson(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
