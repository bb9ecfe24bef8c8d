package com.phillippitts.genesis.exception;

/**
 * Thrown when a daily task cannot be scheduled, typically because the time is not {@code HH:MM}.
 */
public class ReminderSchedulingException extends GenesisException {

    private final String timeText;

    public ReminderSchedulingException(String message, String timeText) {
        super(message);
        this.timeText = timeText;
    }

    public ReminderSchedulingException(String message, String timeText, Throwable cause) {
        super(message, cause);
        this.timeText = timeText;
    }

    public String getTimeText() {
        return timeText;
    }
}
