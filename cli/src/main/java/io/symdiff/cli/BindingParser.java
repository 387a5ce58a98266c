package io.symdiff.cli;

import io.symdiff.core.model.Variable;
import io.symdiff.core.spi.NumericDomain;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns {@code name=value} tokens into a binding map. Names must be legal variable names and
 * not reserved by the domain; values are parsed with {@link NumericDomain#parseValue}.
 */
public final class BindingParser {

    private BindingParser() {
        // utility class
    }

    /**
     * Parses the tokens in order.
     *
     * @return an unmodifiable map in command-line order
     * @throws DuplicateBindingException if a name occurs twice
     * @throws ArgumentException if a token is malformed or its value does not parse
     */
    public static <V> Map<String, V> parse(List<String> tokens, NumericDomain<V> domain) {
        Map<String, V> bindings = new LinkedHashMap<>();
        for (String token : tokens) {
            int eq = token.indexOf('=');
            if (eq < 0) {
                throw new ArgumentException("Binding must have the form name=value, got: '" + token + "'");
            }
            String name = token.substring(0, eq).trim();
            String text = token.substring(eq + 1);

            if (!Variable.isValidName(name)) {
                throw new ArgumentException("Invalid variable name in binding '" + token + "': names are letters only");
            }
            if (domain.reservedValue(name).isPresent()) {
                throw new ArgumentException(
                        "'" + name + "' is reserved in the " + domain.id() + " domain and cannot be bound");
            }
            if (bindings.containsKey(name)) {
                throw new DuplicateBindingException(name);
            }

            try {
                bindings.put(name, domain.parseValue(text));
            } catch (NumberFormatException e) {
                throw new ArgumentException(
                        "Invalid " + domain.id() + " value for '" + name + "': '" + text + "'", e);
            }
        }
        return Collections.unmodifiableMap(bindings);
    }
}
