package io.clubone.outreach.outreach.exception;

import java.util.List;

/**
 * Startup-time configuration error, e.g. a follow-up step without a channel template.
 */
public class OutreachConfigurationException extends RuntimeException {

    private final List<String> missingKeys;

    public OutreachConfigurationException(String message, List<String> missingKeys) {
        super(message + " " + missingKeys);
        this.missingKeys = List.copyOf(missingKeys);
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }
}
