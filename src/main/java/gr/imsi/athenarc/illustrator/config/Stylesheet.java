package gr.imsi.athenarc.illustrator.config;

import java.util.Optional;

/**
 * Resolved mapping from symbolic color names (e.g. {@code accent-1}) to concrete values.
 * Passed explicitly to every render call.
 */
@FunctionalInterface
public interface Stylesheet {

    Optional<String> lookup(String symbolicName);

    static Stylesheet empty() {
        return name -> Optional.empty();
    }
}
