package br.edu.ifba.graphmemory.core;

import br.edu.ifba.graphmemory.exception.InvalidNamespaceException;

import java.util.regex.Pattern;

/**
 * Namespace identifier rules.
 */
public final class Namespaces {

    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9_-]+$");

    private Namespaces() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static boolean isValid(String namespace) {
        return namespace != null && VALID.matcher(namespace).matches();
    }

    /**
     * Returns the namespace unchanged or throws.
     *
     * @param namespace namespace to check
     * @return the namespace
     * @throws InvalidNamespaceException if it is null or contains characters outside {@code [A-Za-z0-9_-]}
     */
    public static String requireValid(String namespace) {
        if (!isValid(namespace)) {
            throw new InvalidNamespaceException(namespace);
        }
        return namespace;
    }
}
