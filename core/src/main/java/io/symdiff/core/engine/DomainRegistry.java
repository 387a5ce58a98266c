package io.symdiff.core.engine;

import io.symdiff.core.domain.ComplexDomain;
import io.symdiff.core.domain.RealDomain;
import io.symdiff.core.spi.NumericDomain;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of numeric domains, keyed by {@link NumericDomain#id()}. Thread-safe: registration
 * and lookup can happen concurrently.
 */
public final class DomainRegistry {

    private final Map<String, NumericDomain<?>> domains = new ConcurrentHashMap<>();

    /** Returns a registry holding the {@code real} and {@code complex} domains. */
    public static DomainRegistry withDefaults() {
        DomainRegistry registry = new DomainRegistry();
        registry.register(new RealDomain());
        registry.register(new ComplexDomain());
        return registry;
    }

    /**
     * Registers a domain. If a domain with the same id is already registered, it is replaced
     * (last-write-wins semantics).
     *
     * @throws NullPointerException if domain or domain.id() is null
     * @throws IllegalArgumentException if domain.id() is empty
     */
    public void register(NumericDomain<?> domain) {
        if (domain == null) {
            throw new NullPointerException("domain must not be null");
        }
        String id = domain.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("domain id must not be null or empty");
        }
        domains.put(id, domain);
    }

    /**
     * Looks up a domain by id, throwing if not found.
     *
     * @throws IllegalArgumentException if no domain is registered with the given id
     */
    public NumericDomain<?> requireDomain(String domainId) {
        NumericDomain<?> domain = domains.get(domainId);
        if (domain == null) {
            throw new IllegalArgumentException(
                    "No numeric domain registered for id: '" + domainId + "', known: " + ids());
        }
        return domain;
    }

    /**
     * Picks the domain for a set of raw inputs: the first registered domain (in id order) that
     * claims any of the inputs, otherwise the domain registered as {@code fallbackId}.
     *
     * @throws IllegalArgumentException if nothing claims the input and {@code fallbackId} is unknown
     */
    public NumericDomain<?> detect(Collection<String> inputs, String fallbackId) {
        for (String id : ids()) {
            NumericDomain<?> domain = domains.get(id);
            if (domain != null && inputs.stream().anyMatch(domain::looksLikeInput)) {
                return domain;
            }
        }
        return requireDomain(fallbackId);
    }

    /** Registered ids in sorted order. */
    public Set<String> ids() {
        return new TreeSet<>(domains.keySet());
    }
}
