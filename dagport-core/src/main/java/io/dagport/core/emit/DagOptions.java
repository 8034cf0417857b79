package io.dagport.core.emit;

import com.google.common.base.Optional;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

@Value.Immutable
public abstract class DagOptions
{
    public abstract String getDagName();

    /**
     * Days between runs. Absent for a DAG that is only triggered manually.
     */
    public abstract Optional<Integer> getScheduleInterval();

    public abstract Optional<Integer> getStartDaysAgo();

    public static ImmutableDagOptions.Builder builder()
    {
        return ImmutableDagOptions.builder();
    }

    public static DagOptions of(String dagName)
    {
        return builder().dagName(dagName).build();
    }

    @Value.Check
    protected void check()
    {
        checkState(!getDagName().isEmpty(), "dag name must not be empty");
        checkState(!getScheduleInterval().isPresent() || getScheduleInterval().get() > 0,
                "schedule interval must be positive");
        checkState(!getStartDaysAgo().isPresent() || getStartDaysAgo().get() >= 0,
                "start days ago must not be negative");
    }
}
