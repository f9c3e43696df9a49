package io.tickwise.spi;

import com.google.common.base.Optional;

import java.time.Instant;

public interface Schedule
{
    // earliest occurrence strictly after the given time.
    // absent if this schedule never fires again.
    Optional<Instant> nextOccurrence(Instant after);
}
