package io.dagport.standards.mapper;

public class ForkMapper
        extends DummyTaskMapper
{
    @Override
    public String getType()
    {
        return "fork";
    }
}
