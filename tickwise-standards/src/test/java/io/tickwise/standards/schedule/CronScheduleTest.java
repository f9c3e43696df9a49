package io.tickwise.standards.schedule;

import com.google.common.base.Optional;
import io.tickwise.spi.Schedule;
import io.tickwise.spi.ScheduleErrorKind;
import io.tickwise.spi.ScheduleException;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;

import static java.time.ZoneOffset.UTC;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.fail;

public class CronScheduleTest
        extends ScheduleTestHelper
{
    @Test
    public void daily()
    {
        // schedule is 12:00:00 every day
        CronSchedule schedule = CronSchedule.everySecond().hour(12).minute(0);

        assertNext(schedule, "2023-01-01 08:00:00 +0000", "2023-01-01 12:00:00 +0000");
        assertNext(schedule, "2023-01-01 11:59:59 +0000", "2023-01-01 12:00:00 +0000");
        assertNext(schedule, "2023-01-01 12:00:00 +0000", "2023-01-02 12:00:00 +0000");
        assertNext(schedule, "2023-01-01 13:00:00 +0000", "2023-01-02 12:00:00 +0000");
    }

    @Test
    public void midnight()
    {
        CronSchedule schedule = CronSchedule.everySecond().hour(0).minute(0);

        assertNext(schedule, "2023-01-01 01:00:00 +0000", "2023-01-02 00:00:00 +0000");
        assertNext(schedule, "2023-01-02 01:00:00 +0000", "2023-01-03 00:00:00 +0000");
    }

    @Test
    public void monthly()
    {
        CronSchedule schedule = CronSchedule.everySecond().day(1).hour(12).minute(0);

        assertNext(schedule, "2023-01-01 00:00:00 +0000", "2023-01-01 12:00:00 +0000");
        assertNext(schedule, "2023-01-01 13:00:00 +0000", "2023-02-01 12:00:00 +0000");
        assertNext(schedule, "2023-12-15 00:00:00 +0000", "2024-01-01 12:00:00 +0000");
    }

    @Test
    public void monthlyMidMonth()
    {
        CronSchedule schedule = CronSchedule.everySecond().day(15).hour(0).minute(0);

        assertNext(schedule, "2023-01-01 00:00:00 +0000", "2023-01-15 00:00:00 +0000");
        assertNext(schedule, "2023-01-16 00:00:00 +0000", "2023-02-15 00:00:00 +0000");
    }

    @Test
    public void weekly()
    {
        // 0 is Monday. 2023-01-01 is a Sunday.
        CronSchedule schedule = CronSchedule.everySecond().weekday(0).hour(9).minute(0);

        assertNext(schedule, "2023-01-01 00:00:00 +0000", "2023-01-02 09:00:00 +0000");
        assertNext(schedule, "2023-01-02 09:01:00 +0000", "2023-01-09 09:00:00 +0000");
    }

    @Test
    public void saturdays()
    {
        CronSchedule schedule = CronSchedule.everySecond().weekday(5).hour(10).minute(0);

        assertNext(schedule, "2023-01-01 00:00:00 +0000", "2023-01-07 10:00:00 +0000");
        assertNext(schedule, "2023-01-07 11:00:00 +0000", "2023-01-14 10:00:00 +0000");
        assertNext(schedule, "2023-01-14 11:00:00 +0000", "2023-01-21 10:00:00 +0000");
    }

    @Test
    public void dayOverflowSkipsShortMonths()
    {
        CronSchedule schedule = CronSchedule.everySecond().day(31).hour(0).minute(0);

        // April has 30 days
        assertNext(schedule, "2023-04-01 00:00:00 +0000", "2023-05-31 00:00:00 +0000");
        // February
        assertNext(schedule, "2023-01-31 00:00:00 +0000", "2023-03-31 00:00:00 +0000");
    }

    @Test
    public void hourOverflowOnLastDayOfMonth()
    {
        CronSchedule schedule = CronSchedule.everySecond().hour(6);

        assertNext(schedule, "2023-01-31 23:00:00 +0000", "2023-02-01 06:00:00 +0000");
        assertNext(schedule, "2023-12-31 07:00:00 +0000", "2024-01-01 06:00:00 +0000");
    }

    @Test
    public void minuteOverflowAtEndOfYear()
    {
        CronSchedule schedule = CronSchedule.everySecond().minute(30);

        assertNext(schedule, "2023-12-31 23:45:00 +0000", "2024-01-01 00:30:00 +0000");
    }

    @Test
    public void yearOverflow()
    {
        CronSchedule schedule = CronSchedule.everySecond().month(3).day(1).hour(0).minute(0);

        assertNext(schedule, "2023-01-10 00:00:00 +0000", "2023-03-01 00:00:00 +0000");
        assertNext(schedule, "2023-03-01 00:00:00 +0000", "2024-03-01 00:00:00 +0000");
    }

    @Test
    public void leapDay()
    {
        CronSchedule schedule = CronSchedule.everySecond().month(2).day(29).hour(0).minute(0);

        assertNext(schedule, "2023-01-01 00:00:00 +0000", "2024-02-29 00:00:00 +0000");
        assertNext(schedule, "2024-02-29 00:00:00 +0000", "2028-02-29 00:00:00 +0000");
    }

    @Test
    public void dayAndWeekdayBothMatch()
    {
        // Friday the 13th
        CronSchedule schedule = CronSchedule.everySecond().day(13).weekday(4).hour(0).minute(0);

        assertNext(schedule, "2023-01-01 00:00:00 +0000", "2023-01-13 00:00:00 +0000");
        assertNext(schedule, "2023-01-13 00:00:00 +0000", "2023-10-13 00:00:00 +0000");
    }

    @Test
    public void everySecondWithoutFields()
    {
        CronSchedule schedule = CronSchedule.everySecond();

        assertNext(schedule, "2023-01-01 00:00:00 +0000", "2023-01-01 00:00:01 +0000");
        assertNext(schedule, "2023-01-01 23:59:59 +0000", "2023-01-02 00:00:00 +0000");
    }

    @Test
    public void minuteIsAlwaysAtSecondZero()
    {
        CronSchedule schedule = CronSchedule.everySecond().minute(0);

        assertNext(schedule, "2023-01-01 10:00:05 +0000", "2023-01-01 11:00:00 +0000");
        assertNext(schedule, "2023-01-01 09:59:59 +0000", "2023-01-01 10:00:00 +0000");
    }

    @Test
    public void subSecondQueryTime()
    {
        CronSchedule schedule = CronSchedule.everySecond().hour(12).minute(0);

        assertThat(schedule.nextOccurrence(instant("2023-01-01 11:59:59 +0000").plusMillis(500)),
                is(Optional.of(instant("2023-01-01 12:00:00 +0000"))));
    }

    @Test
    public void hourAndMinuteWithinOneDay()
    {
        CronSchedule schedule = CronSchedule.everySecond().hour(17).minute(45);

        Instant after = instant("2023-03-10 00:00:00 +0000");
        for (int i = 0; i < 500; i++) {
            after = after.plusSeconds(3593);
            Instant next = schedule.nextOccurrence(after).get();
            LocalDateTime dt = LocalDateTime.ofInstant(next, UTC);

            assertThat(dt.getHour(), is(17));
            assertThat(dt.getMinute(), is(45));
            assertThat(dt.getSecond(), is(0));
            assertThat(next, greaterThan(after));
            assertThat(Duration.between(after, next), lessThanOrEqualTo(Duration.ofDays(1)));
            // nothing earlier matches: one day before is at or before the queried time
            assertThat(next.minus(Duration.ofDays(1)).isAfter(after), is(false));
        }
    }

    @Test
    public void repeatedQueriesReturnSameResult()
    {
        CronSchedule schedule = CronSchedule.everySecond().day(1).hour(12).minute(0);
        Instant after = instant("2023-05-17 03:21:09 +0000");

        assertThat(schedule.nextOccurrence(after), is(schedule.nextOccurrence(after)));
    }

    @Test
    public void absentBeyondLatestDate()
    {
        assertThat(CronSchedule.everySecond().hour(1).nextOccurrence(Instant.MAX), is(Optional.<Instant>absent()));
        assertThat(CronSchedule.everySecond().nextOccurrence(Instant.parse("+999999999-12-31T23:59:59Z")),
                is(Optional.<Instant>absent()));
        assertThat(CronSchedule.everySecond().month(1).day(1).nextOccurrence(Instant.parse("+999999999-06-01T00:00:00Z")),
                is(Optional.<Instant>absent()));
        assertThat(CronSchedule.everySecond().nextOccurrence(Instant.parse("+999999999-12-31T23:59:58Z")),
                is(Optional.of(Instant.parse("+999999999-12-31T23:59:59Z"))));
    }

    @Test
    public void settersReturnNewSchedule()
    {
        CronSchedule base = CronSchedule.everySecond();
        CronSchedule withHour = base.hour(3);

        assertThat(base.getHour(), is(Optional.<Integer>absent()));
        assertThat(withHour.getHour(), is(Optional.of(3)));
    }

    @Test
    public void rejectOutOfRangeFields()
    {
        assertInvalid(() -> CronSchedule.everySecond().minute(60), ScheduleErrorKind.INVALID_CONFIGURATION);
        assertInvalid(() -> CronSchedule.everySecond().minute(-1), ScheduleErrorKind.INVALID_CONFIGURATION);
        assertInvalid(() -> CronSchedule.everySecond().hour(24), ScheduleErrorKind.INVALID_CONFIGURATION);
        assertInvalid(() -> CronSchedule.everySecond().day(0), ScheduleErrorKind.INVALID_CONFIGURATION);
        assertInvalid(() -> CronSchedule.everySecond().day(32), ScheduleErrorKind.INVALID_CONFIGURATION);
        assertInvalid(() -> CronSchedule.everySecond().month(0), ScheduleErrorKind.INVALID_CONFIGURATION);
        assertInvalid(() -> CronSchedule.everySecond().month(13), ScheduleErrorKind.INVALID_CONFIGURATION);
        assertInvalid(() -> CronSchedule.everySecond().weekday(7), ScheduleErrorKind.INVALID_CONFIGURATION);
    }

    @Test
    public void rejectDayThatNeverOccursInMonth()
    {
        assertInvalid(() -> CronSchedule.everySecond().day(31).month(2), ScheduleErrorKind.INVALID_DATE_TIME);
        assertInvalid(() -> CronSchedule.everySecond().month(2).day(30), ScheduleErrorKind.INVALID_DATE_TIME);
        assertInvalid(() -> CronSchedule.everySecond().month(4).day(31), ScheduleErrorKind.INVALID_DATE_TIME);
        assertInvalid(() -> CronSchedule.everySecond().day(31).month(11), ScheduleErrorKind.INVALID_DATE_TIME);
    }

    @Test
    public void newScheduleFromConfig()
    {
        Schedule schedule = new CronScheduleFactory().newSchedule(newConfig()
                .set("day", 1)
                .set("hour", 12)
                .set("minute", 0), null);

        assertNext(schedule, "2023-01-01 13:00:00 +0000", "2023-02-01 12:00:00 +0000");
    }

    @Test(expected = ScheduleException.class)
    public void rejectInvalidConfig()
    {
        new CronScheduleFactory().newSchedule(newConfig()
                .set("month", 2)
                .set("day", 31), null);
    }

    private static void assertNext(Schedule schedule, String after, String expected)
    {
        assertThat(schedule.nextOccurrence(instant(after)), is(Optional.of(instant(expected))));
    }

    private static void assertInvalid(Runnable func, ScheduleErrorKind kind)
    {
        try {
            func.run();
            fail();
        }
        catch (ScheduleException ex) {
            assertThat(ex.getKind(), is(kind));
        }
    }
}
