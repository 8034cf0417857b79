package io.dagport.core.emit;

import io.dagport.spi.TriggerPolicy;

/**
 * Airflow names of the trigger policies.
 */
public final class TriggerRules
{
    private TriggerRules()
    { }

    public static String toAirflow(TriggerPolicy policy)
    {
        switch (policy) {
        case ALL_UPSTREAM_SUCCEEDED:
            return "all_success";
        case ANY_UPSTREAM_FAILED:
            return "one_failed";
        case ALL_UPSTREAM_DONE:
            return "all_done";
        case ANY_UPSTREAM_SUCCEEDED_OR_SKIPPED:
            return "none_failed_min_one_success";
        default:
            throw new AssertionError("Unknown trigger policy: " + policy);
        }
    }
}
