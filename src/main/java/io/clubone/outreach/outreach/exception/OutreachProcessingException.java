package io.clubone.outreach.outreach.exception;

/**
 * Raised when a single opportunity cannot be processed.
 * Carries enough context to record the failure without aborting the run.
 */
public class OutreachProcessingException extends RuntimeException {

    private final String leadId;
    private final String runId;
    private final String operation;

    public OutreachProcessingException(String message, String leadId, String runId, String operation) {
        super(message);
        this.leadId = leadId;
        this.runId = runId;
        this.operation = operation;
    }

    public OutreachProcessingException(String message, String leadId, String runId, String operation, Throwable cause) {
        super(message, cause);
        this.leadId = leadId;
        this.runId = runId;
        this.operation = operation;
    }

    public String getLeadId() {
        return leadId;
    }

    public String getRunId() {
        return runId;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public String toString() {
        return String.format("OutreachProcessingException{leadId=%s, runId=%s, operation='%s', message='%s'}",
                leadId, runId, operation, getMessage());
    }
}
