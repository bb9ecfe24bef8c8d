package com.phillippitts.genesis.service.reminder;

import com.phillippitts.genesis.exception.ReminderSchedulingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Daily tasks on Spring's {@link TaskScheduler}, each driven by a cron trigger in the local zone.
 */
public class CronDailyTaskScheduler implements DailyTaskScheduler {

    private static final Logger LOG = LogManager.getLogger(CronDailyTaskScheduler.class);
    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    private final TaskScheduler scheduler;
    private final ZoneId zone;
    private final Map<String, ScheduledTask> tasks = new ConcurrentHashMap<>();

    public CronDailyTaskScheduler(TaskScheduler scheduler, ZoneId zone) {
        this.scheduler = scheduler;
        this.zone = zone;
    }

    @Override
    public String addTask(String name, String description, String time, Runnable action) {
        LocalTime at;
        try {
            at = parseTime(time);
        } catch (ReminderSchedulingException e) {
            LOG.warn("Rejected task '{}': {}", name, e.getMessage());
            return "Sorry, I couldn't understand the time '" + time + "'. Please use the HH:MM format.";
        }
        CronTrigger trigger = new CronTrigger(cronExpression(at), zone);
        ScheduledFuture<?> future = scheduler.schedule(() -> runTask(name, action), trigger);
        ScheduledTask previous = tasks.put(name, new ScheduledTask(name, description, at, future));
        if (previous != null) {
            previous.future().cancel(false);
            LOG.info("Replaced daily task '{}'", name);
        }
        LOG.info("Scheduled daily task '{}' at {}: {}", name, at, description);
        return "Task '" + name + "' scheduled daily at " + at + ".";
    }

    @Override
    public String removeTask(String name) {
        ScheduledTask removed = tasks.remove(name);
        if (removed == null) {
            return "No scheduled task named '" + name + "' was found.";
        }
        removed.future().cancel(false);
        LOG.info("Removed daily task '{}'", name);
        return "Task '" + name + "' has been cancelled.";
    }

    @Override
    public boolean hasTask(String name) {
        return tasks.containsKey(name);
    }

    @Override
    public Set<String> taskNames() {
        return Set.copyOf(tasks.keySet());
    }

    /**
     * Cancels every task without removing it from the scheduler's thread pool.
     */
    public void cancelAll() {
        tasks.values().forEach(task -> task.future().cancel(false));
        tasks.clear();
    }

    /**
     * Parses a 24-hour {@code H:MM} or {@code HH:MM} time.
     *
     * @throws ReminderSchedulingException if the text is not a valid time
     */
    static LocalTime parseTime(String time) {
        if (time == null) {
            throw new ReminderSchedulingException("Time is missing", null);
        }
        Matcher m = TIME_PATTERN.matcher(time.trim());
        if (!m.matches()) {
            throw new ReminderSchedulingException("Time must use HH:MM format: " + time, time);
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));
        if (hour > 23 || minute > 59) {
            throw new ReminderSchedulingException("Time out of range: " + time, time);
        }
        return LocalTime.of(hour, minute);
    }

    static String cronExpression(LocalTime at) {
        return "0 " + at.getMinute() + " " + at.getHour() + " * * *";
    }

    private void runTask(String name, Runnable action) {
        LOG.info("Running daily task '{}'", name);
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.error("Daily task '{}' failed", name, e);
        }
    }

    private record ScheduledTask(String name, String description, LocalTime time, ScheduledFuture<?> future) {
    }
}
