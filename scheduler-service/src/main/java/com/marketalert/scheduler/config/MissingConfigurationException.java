package com.marketalert.scheduler.config;

import java.util.List;

/**
 * Required settings are absent. Thrown during context startup, before the scheduling
 * loop exists, so the process exits with this diagnostic.
 */
public class MissingConfigurationException extends RuntimeException {

    private final List<String> missing;

    public MissingConfigurationException(List<String> missing) {
        super("Missing required configuration: " + String.join(", ", missing)
              + ". Set the corresponding environment variables and restart.");
        this.missing = List.copyOf(missing);
    }

    public List<String> getMissing() {
        return missing;
    }
}
