package io.symdiff.core.error;

/**
 * Closed taxonomy of the errors the engine and its front end can report. Each kind carries a
 * stable URN and a short title, used when errors are rendered as problem objects.
 */
public enum ErrorKind {
    INVALID_CHARACTER("invalid-character", "Invalid Character"),
    MALFORMED_EXPRESSION("malformed-expression", "Malformed Expression"),
    UNBOUND_VARIABLE("unbound-variable", "Unbound Variable"),
    DIVISION_BY_ZERO("division-by-zero", "Division By Zero"),
    DOMAIN_ERROR("domain-error", "Domain Error"),
    DUPLICATE_BINDING("duplicate-binding", "Duplicate Binding");

    private static final String URN_PREFIX = "urn:symdiff:error:";

    private final String slug;
    private final String title;

    ErrorKind(String slug, String title) {
        this.slug = slug;
        this.title = title;
    }

    /** Stable identifier, e.g. {@code urn:symdiff:error:division-by-zero}. */
    public String urn() {
        return URN_PREFIX + slug;
    }

    public String title() {
        return title;
    }
}
