package io.tickwise.standards.schedule;

import com.google.common.base.Optional;
import io.tickwise.client.config.Config;
import io.tickwise.spi.Schedule;
import io.tickwise.spi.ScheduleFactory;
import io.tickwise.spi.ScheduleResolver;

public class CronScheduleFactory
        implements ScheduleFactory
{
    @Override
    public String getType()
    {
        return "cron";
    }

    @Override
    public Schedule newSchedule(Config config, ScheduleResolver resolver)
    {
        CronSchedule schedule = CronSchedule.everySecond();

        Optional<Integer> month = config.getOptional("month", Integer.class);
        if (month.isPresent()) {
            schedule = schedule.month(month.get());
        }
        Optional<Integer> day = config.getOptional("day", Integer.class);
        if (day.isPresent()) {
            schedule = schedule.day(day.get());
        }
        Optional<Integer> weekday = config.getOptional("weekday", Integer.class);
        if (weekday.isPresent()) {
            schedule = schedule.weekday(weekday.get());
        }
        Optional<Integer> hour = config.getOptional("hour", Integer.class);
        if (hour.isPresent()) {
            schedule = schedule.hour(hour.get());
        }
        Optional<Integer> minute = config.getOptional("minute", Integer.class);
        if (minute.isPresent()) {
            schedule = schedule.minute(minute.get());
        }
        return schedule;
    }
}
