package com.phillippitts.genesis.service.time;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Spoken forms of the current time and date, e.g. "The current time is 3:07 PM." and
 * "Today is Tuesday, March 4, 2025."
 */
public class TimeUtility {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("h:mm a", Locale.US);
    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.US);

    private final Clock clock;

    public TimeUtility(Clock clock) {
        this.clock = clock;
    }

    public String tellTime() {
        return "The current time is " + LocalDateTime.now(clock).format(TIME_FORMAT) + ".";
    }

    public String tellDate() {
        return "Today is " + LocalDateTime.now(clock).format(DATE_FORMAT) + ".";
    }
}
