package io.dagport.standards.mapper;

/**
 * Marker of the workflow entry. Removed from the compiled graph.
 */
public class StartMapper
        extends DummyTaskMapper
{
    @Override
    public String getType()
    {
        return "start";
    }

    @Override
    public boolean isPassthrough()
    {
        return true;
    }
}
