package io.tickwise.spi;

import io.tickwise.client.config.ConfigException;

import static java.util.Locale.ENGLISH;

/**
 * An exception thrown when a schedule or a job is built with parameters that can never work.
 *
 * <p>
 * Thrown only while building. Computing the next occurrence of a schedule never throws
 * this exception; a schedule without further occurrences returns absent instead.
 * </p>
 */
public class ScheduleException
        extends ConfigException
{
    private final ScheduleErrorKind kind;

    public ScheduleException(ScheduleErrorKind kind, String detail)
    {
        super(String.format(ENGLISH, "%s: %s", kind.getMessage(), detail));
        this.kind = kind;
    }

    public ScheduleErrorKind getKind()
    {
        return kind;
    }
}
