package io.batchrun.serialization.definitions;

import io.batchrun.core.command.Job;
import io.batchrun.core.schedule.ScheduledJob;

/// A scheduled job as written in a definitions file. The job is referenced by name;
/// absent fields take the {@link ScheduledJob.Builder} defaults.
public record ScheduledJobDefinition(
        String name,
        String job,
        Boolean enabled,
        String timezone,
        String years,
        String months,
        String daysOfMonth,
        String weekdays,
        String hours,
        String minutes,
        String comment) {

    ScheduledJob toScheduledJob(Job resolved) {
        ScheduledJob.Builder builder =
                ScheduledJob.builder()
                        .job(resolved)
                        .years(years)
                        .months(months)
                        .daysOfMonth(daysOfMonth)
                        .weekdays(weekdays)
                        .hours(hours)
                        .minutes(minutes)
                        .comment(comment);
        if (name != null) {
            builder.name(name);
        }
        if (enabled != null) {
            builder.enabled(enabled);
        }
        if (timezone != null) {
            builder.timezone(timezone);
        }
        return builder.build();
    }
}
