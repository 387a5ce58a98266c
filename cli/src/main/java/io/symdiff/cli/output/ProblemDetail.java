package io.symdiff.cli.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.symdiff.cli.DuplicateBindingException;
import io.symdiff.core.error.ErrorKind;
import io.symdiff.core.error.ParseException;
import io.symdiff.core.error.SymbolicException;
import io.symdiff.core.error.UnboundVariableException;

/**
 * Builds RFC 9457-style problem objects for failed invocations.
 *
 * <pre>{@code
 * {
 *   "type": "urn:symdiff:error:invalid-character",
 *   "title": "Invalid Character",
 *   "detail": "Invalid character '$' at position 2",
 *   "position": 2
 * }
 * }</pre>
 *
 * <p>Expression errors use the URNs of {@link ErrorKind}; command-line and configuration errors
 * have their own URNs below. Thread-safe: all methods are stateless.
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_USAGE = "urn:symdiff:error:usage";
    static final String URN_CONFIGURATION = "urn:symdiff:error:configuration";

    private ProblemDetail() {
        // utility class
    }

    /** Problem for a parse or evaluation error; adds {@code position} or {@code variable} where known. */
    public static ObjectNode expressionError(SymbolicException error) {
        ObjectNode node = build(error.kind().urn(), error.kind().title(), error.detail());
        if (error instanceof ParseException parse) {
            node.put("position", parse.position());
        } else if (error instanceof UnboundVariableException unbound) {
            node.put("variable", unbound.variable());
        }
        return node;
    }

    public static ObjectNode duplicateBinding(DuplicateBindingException error) {
        ObjectNode node = build(ErrorKind.DUPLICATE_BINDING.urn(), ErrorKind.DUPLICATE_BINDING.title(), error.getMessage());
        node.put("variable", error.variable());
        return node;
    }

    /** Unusable command line or binding. */
    public static ObjectNode usage(String detail) {
        return build(URN_USAGE, "Invalid Arguments", detail);
    }

    public static ObjectNode configuration(String detail) {
        return build(URN_CONFIGURATION, "Invalid Configuration", detail);
    }

    static ObjectNode build(String type, String title, String detail) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("detail", detail);
        return node;
    }
}
