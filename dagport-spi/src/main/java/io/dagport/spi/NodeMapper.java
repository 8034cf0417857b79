package io.dagport.spi;

public interface NodeMapper
{
    /**
     * Tag this mapper translates: the control element name such as
     * {@code decision}, or the action body element name such as {@code shell}.
     */
    String getType();

    Translation translate(MappingContext context);

    /**
     * A passthrough node does no work of its own and is removed from the
     * compiled graph after its relations are rewired.
     */
    default boolean isPassthrough()
    {
        return false;
    }
}
