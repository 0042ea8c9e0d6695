package com.multigallery.core.config;

import java.util.List;

/**
 * Thrown when a username configuration is invalid.
 *
 * <p>Carries every problem found, not just the first, so that all of them can be fixed
 * in one go.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> problems;

    /**
     * Creates an exception for one or more problems.
     *
     * @param summary one-line summary
     * @param problems individual problems, in the order they were found
     */
    public ConfigurationException(String summary, List<String> problems) {
        super(problems.isEmpty() ? summary : summary + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    /**
     * Creates an exception for a problem caused by another exception.
     *
     * @param summary one-line summary
     * @param cause underlying exception
     */
    public ConfigurationException(String summary, Throwable cause) {
        super(summary, cause);
        this.problems = List.of(summary);
    }

    /**
     * Returns the individual problems.
     *
     * @return problems, never empty
     */
    public List<String> problems() {
        return problems.isEmpty() ? List.of(getMessage()) : problems;
    }
}
