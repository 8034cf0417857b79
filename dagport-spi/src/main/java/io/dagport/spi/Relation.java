package io.dagport.spi;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

/**
 * "to" must not start until "from" has reached a terminal state, subject to
 * the trigger policy of "to".
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRelation.class)
@JsonDeserialize(as = ImmutableRelation.class)
public abstract class Relation
{
    public abstract String getFrom();

    public abstract String getTo();

    public abstract EdgeKind getKind();

    public static Relation of(String from, String to, EdgeKind kind)
    {
        return ImmutableRelation.builder()
            .from(from)
            .to(to)
            .kind(kind)
            .build();
    }

    public static Relation structural(String from, String to)
    {
        return of(from, to, EdgeKind.STRUCTURAL);
    }

    @Value.Check
    protected void check()
    {
        checkState(!getFrom().equals(getTo()), "task %s can't depend on itself", getFrom());
    }

    @Override
    public String toString()
    {
        return getFrom() + " -> " + getTo() + " (" + getKind() + ")";
    }
}
