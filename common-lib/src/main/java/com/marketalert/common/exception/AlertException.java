package com.marketalert.common.exception;

/**
 * Raised when an alerting task fails in a way that is not a transient data-fetch problem.
 * Caught at the task boundary of the scheduling loop; never terminates the process.
 */
public class AlertException extends RuntimeException {

    private final String taskName;

    public AlertException(String taskName, String message) {
        super("[" + taskName + "] " + message);
        this.taskName = taskName;
    }

    public AlertException(String taskName, String message, Throwable cause) {
        super("[" + taskName + "] " + message, cause);
        this.taskName = taskName;
    }

    public String getTaskName() {
        return taskName;
    }
}
