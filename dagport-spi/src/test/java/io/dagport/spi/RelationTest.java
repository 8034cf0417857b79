package io.dagport.spi;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class RelationTest
{
    @Rule public ExpectedException exception = ExpectedException.none();

    @Test
    public void kindIsPartOfIdentity()
    {
        assertThat(Relation.of("a", "b", EdgeKind.NORMAL), is(Relation.of("a", "b", EdgeKind.NORMAL)));
        assertThat(Relation.of("a", "b", EdgeKind.NORMAL), is(not(Relation.of("a", "b", EdgeKind.ERROR))));
        assertThat(Relation.structural("a", "b").getKind(), is(EdgeKind.STRUCTURAL));
    }

    @Test
    public void onlyErrorIsFailurePath()
    {
        assertThat(EdgeKind.ERROR.isFailurePath(), is(true));
        assertThat(EdgeKind.NORMAL.isFailurePath(), is(false));
        assertThat(EdgeKind.STRUCTURAL.isFailurePath(), is(false));
    }

    @Test
    public void rejectSelfLoop()
    {
        exception.expect(IllegalStateException.class);
        exception.expectMessage("task a can't depend on itself");
        Relation.of("a", "a", EdgeKind.NORMAL);
    }

    @Test
    public void readableToString()
    {
        assertThat(Relation.of("a", "b", EdgeKind.ERROR).toString(), is("a -> b (ERROR)"));
    }
}
