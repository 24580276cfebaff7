package io.github.manjago.stackgp.config;

import java.util.List;

/**
 * Invalid run configuration. Raised before any generation runs.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> problems;

    public ConfigurationException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    /**
     * @return one entry per offending setting
     */
    public List<String> getProblems() {
        return problems;
    }
}
