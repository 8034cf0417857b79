package io.dagport.standards.mapper;

public class EndMapper
        extends DummyTaskMapper
{
    @Override
    public String getType()
    {
        return "end";
    }
}
