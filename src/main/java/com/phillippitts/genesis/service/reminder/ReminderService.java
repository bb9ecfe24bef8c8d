package com.phillippitts.genesis.service.reminder;

import com.phillippitts.genesis.service.connection.RobotOutput;
import com.phillippitts.genesis.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Daily spoken reminders on top of the {@link DailyTaskScheduler}.
 *
 * <p>A reminder for message {@code m} at {@code HH:MM} is named
 * {@code daily_reminder_<HHMM>_<first ten characters of m, spaces as underscores>}, so setting the
 * same reminder twice replaces it. Each firing speaks {@code "Reminder: " + m} once.
 */
public class ReminderService {

    private static final Logger LOG = LogManager.getLogger(ReminderService.class);
    static final String SPOKEN_PREFIX = "Reminder: ";

    private final DailyTaskScheduler scheduler;
    private final RobotOutput output;

    public ReminderService(DailyTaskScheduler scheduler, RobotOutput output) {
        this.scheduler = scheduler;
        this.output = output;
    }

    /**
     * @return the scheduler's confirmation or error message
     */
    public String setupReminder(String message, String time) {
        String name = reminderName(message, time);
        return scheduler.addTask(name, "Speak reminder: " + message, time, () -> speakReminder(message));
    }

    public String cancelReminder(String message, String time) {
        return cancelReminderByName(reminderName(message, time));
    }

    public String cancelReminderByName(String name) {
        return scheduler.removeTask(name);
    }

    public static String reminderName(String message, String time) {
        String prefix = message.length() <= 10 ? message : message.substring(0, 10);
        return "daily_reminder_" + time.replace(":", "") + "_" + prefix.replace(' ', '_');
    }

    private void speakReminder(String message) {
        LOG.info("Executing reminder: {}", LogSanitizer.truncate(message, LogSanitizer.PREVIEW_CHARS));
        output.speak(SPOKEN_PREFIX + message).whenComplete((ignored, error) -> {
            if (error != null) {
                LOG.error("Error speaking reminder '{}'", LogSanitizer.truncate(message, LogSanitizer.PREVIEW_CHARS), error);
            }
        });
    }
}
