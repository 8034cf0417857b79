package io.dagport.spi;

/**
 * Run condition of a task, derived from the kinds of its incoming relations.
 */
public enum TriggerPolicy
{
    ALL_UPSTREAM_SUCCEEDED,
    ANY_UPSTREAM_FAILED,
    ALL_UPSTREAM_DONE,
    ANY_UPSTREAM_SUCCEEDED_OR_SKIPPED;
}
