package com.jalarm.cron;

import com.jalarm.error.SchedulingException.InvalidCronExpressionException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Computes cron occurrences in a schedule's own timezone. Accepts standard
 * five-field expressions (minute precision) and six-field expressions with a
 * leading seconds field. Stateless.
 *
 * <p>Five-field expressions follow Unix cron: when both day-of-month and
 * day-of-week are restricted, a day matching either one fires. Six-field
 * expressions keep Spring's semantics, where both must match.
 */
@Component
public class CronEvaluator {

    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;
    private static final int DAY_OF_MONTH = 3;
    private static final int DAY_OF_WEEK = 5;

    /**
     * Returns the first occurrence strictly after {@code after}, or {@code null}
     * when the expression never fires again.
     *
     * @throws InvalidCronExpressionException if the expression or timezone cannot be parsed
     */
    public Instant nextOccurrence(String cronExpression, String timezone, Instant after) {
        List<CronExpression> crons = parse(cronExpression);
        ZoneId zone = resolveZone(cronExpression, timezone);
        ZonedDateTime start = ZonedDateTime.ofInstant(after, zone);
        Instant earliest = null;
        for (CronExpression cron : crons) {
            ZonedDateTime next = cron.next(start);
            if (next != null && (earliest == null || next.toInstant().isBefore(earliest))) {
                earliest = next.toInstant();
            }
        }
        return earliest;
    }

    public void validate(String cronExpression, String timezone) {
        parse(cronExpression);
        resolveZone(cronExpression, timezone);
    }

    /**
     * Converts a five-field expression to Spring's six-field form.
     */
    static String normalize(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(input), "expression is empty");
        }
        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");
        if (parts.length == CRON_FIVE_FIELDS) {
            return "0 " + trimmed;
        }
        if (parts.length == CRON_SIX_FIELDS) {
            return trimmed;
        }
        throw new InvalidCronExpressionException(trimmed,
                "expected 5 or 6 fields, got " + parts.length);
    }

    /**
     * A five-field expression restricting both day fields becomes two expressions,
     * one per day field, whose union is the schedule.
     */
    private List<CronExpression> parse(String cronExpression) {
        String normalized = normalize(cronExpression);
        boolean unix = cronExpression.trim().split("\\s+").length == CRON_FIVE_FIELDS;
        String[] fields = normalized.split("\\s+");
        try {
            if (unix && isRestricted(fields[DAY_OF_MONTH]) && isRestricted(fields[DAY_OF_WEEK])) {
                return List.of(
                        CronExpression.parse(withField(fields, DAY_OF_WEEK, "*")),
                        CronExpression.parse(withField(fields, DAY_OF_MONTH, "*")));
            }
            return List.of(CronExpression.parse(normalized));
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(cronExpression.trim(), e.getMessage(), e);
        }
    }

    private static boolean isRestricted(String field) {
        return !"*".equals(field) && !"?".equals(field);
    }

    private static String withField(String[] fields, int index, String value) {
        String[] copy = fields.clone();
        copy[index] = value;
        return String.join(" ", copy);
    }

    private ZoneId resolveZone(String cronExpression, String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidCronExpressionException(cronExpression, "timezone is required");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new InvalidCronExpressionException(cronExpression, "unknown timezone " + timezone, e);
        }
    }
}
