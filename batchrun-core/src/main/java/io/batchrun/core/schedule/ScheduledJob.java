package io.batchrun.core.schedule;

import io.batchrun.core.command.Job;
import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import io.batchrun.core.recurrence.RecurrenceRule;
import java.util.Objects;

/// A job bound to a recurrence rule.
///
/// The six time fields are stored verbatim as specifier strings and parsed into a
/// {@link RecurrenceRule} on demand. Construction parses them once, so an instance
/// always has a valid rule.
///
/// ### Contracts
/// - **Precondition**: every specifier is at most {@link #MAX_SPECIFIER_LENGTH} characters
/// - **Invariant**: {@link #recurrenceRule()} never throws
///
/// @param id storage identifier, `0` before the scheduled job is saved
/// @param name unique name, not blank
/// @param job the job to run, not null
/// @param enabled whether queue items of this scheduled job may be claimed
/// @param timezone IANA zone the time fields are interpreted in, not null
/// @param comment free text, not null
public record ScheduledJob(
        long id,
        String name,
        Job job,
        boolean enabled,
        String timezone,
        String years,
        String months,
        String daysOfMonth,
        String weekdays,
        String hours,
        String minutes,
        String comment) {

    public static final int MAX_SPECIFIER_LENGTH = 200;

    public ScheduledJob {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(timezone, "timezone must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        years = orStar(years);
        months = orStar(months);
        daysOfMonth = orStar(daysOfMonth);
        weekdays = orStar(weekdays);
        hours = orStar(hours);
        minutes = orStar(minutes);
        comment = comment == null ? "" : comment;
        for (String spec : new String[] {years, months, daysOfMonth, weekdays, hours, minutes}) {
            if (spec.length() > MAX_SPECIFIER_LENGTH) {
                throw new BatchrunException(
                        ErrorCode.INVALID_SYNTAX,
                        "Specifier is longer than " + MAX_SPECIFIER_LENGTH + " characters");
            }
        }
        RecurrenceRule.create(timezone, years, months, daysOfMonth, weekdays, hours, minutes);
    }

    private static String orStar(String spec) {
        return spec == null || spec.isEmpty() ? "*" : spec;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder initialised from this scheduled job.
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .job(job)
                .enabled(enabled)
                .timezone(timezone)
                .years(years)
                .months(months)
                .daysOfMonth(daysOfMonth)
                .weekdays(weekdays)
                .hours(hours)
                .minutes(minutes)
                .comment(comment);
    }

    public ScheduledJob withId(long newId) {
        return toBuilder().id(newId).build();
    }

    /// Parses the time fields into a rule.
    ///
    /// @return the rule, never null
    public RecurrenceRule recurrenceRule() {
        return RecurrenceRule.create(
                timezone, years, months, daysOfMonth, weekdays, hours, minutes);
    }

    /// Renders as `Scheduled job "job" @ y=... m=... d=... w=... H=... M=...`.
    @Override
    public String toString() {
        return "Scheduled job \"" + job + "\" @ y=" + years + " m=" + months + " d=" + daysOfMonth
                + " w=" + weekdays + " H=" + hours + " M=" + minutes;
    }

    /// Builder for {@link ScheduledJob}; time fields default to `*`.
    public static final class Builder {
        private long id;
        private String name;
        private Job job;
        private boolean enabled = true;
        private String timezone = "Europe/Helsinki";
        private String years = "*";
        private String months = "*";
        private String daysOfMonth = "*";
        private String weekdays = "*";
        private String hours = "*";
        private String minutes = "*";
        private String comment = "";

        private Builder() {}

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder job(Job job) {
            this.job = job;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder years(String years) {
            this.years = years;
            return this;
        }

        public Builder months(String months) {
            this.months = months;
            return this;
        }

        public Builder daysOfMonth(String daysOfMonth) {
            this.daysOfMonth = daysOfMonth;
            return this;
        }

        public Builder weekdays(String weekdays) {
            this.weekdays = weekdays;
            return this;
        }

        public Builder hours(String hours) {
            this.hours = hours;
            return this;
        }

        public Builder minutes(String minutes) {
            this.minutes = minutes;
            return this;
        }

        public Builder comment(String comment) {
            this.comment = comment;
            return this;
        }

        public ScheduledJob build() {
            return new ScheduledJob(
                    id,
                    name != null ? name : (job != null ? job.name() : null),
                    job,
                    enabled,
                    timezone,
                    years,
                    months,
                    daysOfMonth,
                    weekdays,
                    hours,
                    minutes,
                    comment);
        }
    }
}
