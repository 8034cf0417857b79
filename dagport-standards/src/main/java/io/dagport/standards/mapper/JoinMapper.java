package io.dagport.standards.mapper;

public class JoinMapper
        extends DummyTaskMapper
{
    @Override
    public String getType()
    {
        return "join";
    }
}
