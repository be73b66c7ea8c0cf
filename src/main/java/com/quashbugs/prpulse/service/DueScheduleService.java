package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.model.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Decides which schedules fire in the current minute. Cron expressions are standard five-field
 * expressions evaluated in UTC.
 */
@Service
public class DueScheduleService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DueScheduleService.class);

    public List<Schedule> selectDue(List<Schedule> schedules, Instant now) {
        Instant currentMinute = now.truncatedTo(ChronoUnit.MINUTES);
        return schedules.stream()
                .filter(schedule -> isDue(schedule, currentMinute))
                .toList();
    }

    /**
     * A schedule is due when its cron fires exactly at the current minute and it has not already run for
     * that minute. Invalid expressions are never due.
     */
    public boolean isDue(Schedule schedule, Instant now) {
        Instant currentMinute = now.truncatedTo(ChronoUnit.MINUTES);
        List<CronExpression> crons;
        try {
            crons = parse(schedule.getCronExpression());
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Skipping schedule {}: invalid cron expression '{}': {}",
                    schedule.getId(), schedule.getCronExpression(), e.getMessage());
            return false;
        }

        // the next fire after the previous second is the current minute iff the cron fires now
        ZonedDateTime justBefore = ZonedDateTime.ofInstant(currentMinute.minusSeconds(1), ZoneOffset.UTC);
        boolean fires = crons.stream()
                .map(cron -> cron.next(justBefore))
                .anyMatch(nextFire -> nextFire != null && nextFire.toInstant().equals(currentMinute));
        if (!fires) {
            return false;
        }
        return schedule.getLastExecuted() == null || schedule.getLastExecuted().isBefore(currentMinute);
    }

    /**
     * Spring cron carries a leading seconds field and requires day-of-month AND day-of-week to match.
     * Standard cron fires when either restricted day field matches, so that case is split into two
     * expressions of which any may fire.
     */
    private static List<CronExpression> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("cron expression is empty");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException("expected 5 fields but found " + fields.length);
        }
        String minute = fields[0];
        String hour = fields[1];
        String dayOfMonth = fields[2];
        String month = fields[3];
        String dayOfWeek = fields[4];
        if (isRestricted(dayOfMonth) && isRestricted(dayOfWeek)) {
            return List.of(
                    CronExpression.parse(String.join(" ", "0", minute, hour, dayOfMonth, month, "*")),
                    CronExpression.parse(String.join(" ", "0", minute, hour, "*", month, dayOfWeek)));
        }
        return List.of(CronExpression.parse("0 " + String.join(" ", fields)));
    }

    // a day field starting with '*' (including steps like */2) leaves the other day field in charge
    private static boolean isRestricted(String dayField) {
        return !dayField.startsWith("*") && !dayField.equals("?");
    }
}
