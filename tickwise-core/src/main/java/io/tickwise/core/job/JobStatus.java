package io.tickwise.core.job;

import java.time.Instant;
import org.immutables.value.Value;
import com.google.common.base.Optional;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

@Value.Immutable
@JsonSerialize(as = ImmutableJobStatus.class)
@JsonDeserialize(as = ImmutableJobStatus.class)
public interface JobStatus
{
    int getRepeats();

    Optional<Integer> getMaxRepeats();

    Optional<Instant> getEndTime();

    /**
     * Next occurrence of the schedule after the time this status was taken.
     * Absent if the job is exhausted or the schedule has no further occurrence.
     */
    Optional<Instant> getNextOccurrence();

    boolean getExhausted();

    static JobStatus of(int repeats, Optional<Integer> maxRepeats, Optional<Instant> endTime,
            Optional<Instant> nextOccurrence, boolean exhausted)
    {
        return ImmutableJobStatus.builder()
            .repeats(repeats)
            .maxRepeats(maxRepeats)
            .endTime(endTime)
            .nextOccurrence(nextOccurrence)
            .exhausted(exhausted)
            .build();
    }
}
