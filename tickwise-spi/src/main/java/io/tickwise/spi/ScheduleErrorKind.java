package io.tickwise.spi;

public enum ScheduleErrorKind
{
    INVALID_CONFIGURATION("Invalid schedule configuration"),
    TIME_IN_PAST("Time has already passed"),
    INVALID_DURATION("Duration is zero or negative"),
    INVALID_REPETITION("Invalid repetition count"),
    INVALID_DATE_TIME("Invalid date/time specification");

    private final String message;

    ScheduleErrorKind(String message)
    {
        this.message = message;
    }

    public String getMessage()
    {
        return message;
    }
}
