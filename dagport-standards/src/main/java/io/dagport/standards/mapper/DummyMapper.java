package io.dagport.standards.mapper;

/**
 * Used for actions no other mapper handles.
 */
public class DummyMapper
        extends DummyTaskMapper
{
    @Override
    public String getType()
    {
        return "dummy";
    }
}
