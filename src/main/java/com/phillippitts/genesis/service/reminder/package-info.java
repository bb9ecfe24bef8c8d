/**
 * Daily task scheduling and spoken reminders.
 */
package com.phillippitts.genesis.service.reminder;
