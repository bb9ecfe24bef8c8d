package com.phillippitts.genesis.service.reminder;

import java.util.Set;

/**
 * Registry of named tasks that run once a day at a local wall-clock time.
 */
public interface DailyTaskScheduler {

    /**
     * Schedules an action every day at {@code time}. A task with the same name is replaced.
     *
     * @param name unique task name
     * @param description human-readable description for logs
     * @param time local time as {@code HH:MM} (24-hour)
     * @param action work to run; failures are logged and the task stays scheduled
     * @return confirmation, or an error message when the time cannot be parsed
     */
    String addTask(String name, String description, String time, Runnable action);

    /**
     * Cancels a task.
     *
     * @return confirmation, or a message saying no such task exists
     */
    String removeTask(String name);

    boolean hasTask(String name);

    Set<String> taskNames();
}
