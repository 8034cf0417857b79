package io.dagport.core.workflow;

/**
 * A node mapper rejected the element it was asked to translate.
 */
public class MappingException
        extends RuntimeException
{
    private final String nodeName;
    private final String mapperType;

    public MappingException(String nodeName, String mapperType, Throwable cause)
    {
        super("Failed to translate node '" + nodeName + "' of type " + mapperType + ": " + cause.getMessage(), cause);
        this.nodeName = nodeName;
        this.mapperType = mapperType;
    }

    public String getNodeName()
    {
        return nodeName;
    }

    public String getMapperType()
    {
        return mapperType;
    }
}
