package io.dagport.spi;

public enum EdgeKind
{
    /**
     * An "ok" transition, a decision case, a fork path or a join successor.
     */
    NORMAL,

    /**
     * An "error" transition.
     */
    ERROR,

    /**
     * A relation introduced by translation itself, such as a prepare task
     * feeding its action or an edge relinked around an elided marker.
     */
    STRUCTURAL;

    public boolean isFailurePath()
    {
        return this == ERROR;
    }
}
