package io.dagport.spi;

import java.util.Map;
import com.google.common.collect.ImmutableMap;
import org.w3c.dom.Element;

/**
 * Input handed to a {@link NodeMapper}. The element is the node's own element
 * for control nodes and the action body (for example {@code <shell>}) for
 * actions. Mappers must treat it as read-only.
 */
public class MappingContext
{
    private final String nodeName;
    private final Element element;
    private final Map<String, String> params;

    public MappingContext(String nodeName, Element element, Map<String, String> params)
    {
        this.nodeName = nodeName;
        this.element = element;
        this.params = ImmutableMap.copyOf(params);
    }

    public String getNodeName()
    {
        return nodeName;
    }

    public Element getElement()
    {
        return element;
    }

    public Map<String, String> getParams()
    {
        return params;
    }

    public String getTaskId()
    {
        return toTaskId(nodeName);
    }

    public static String toTaskId(String nodeName)
    {
        String id = nodeName.replaceAll("[^a-zA-Z0-9_]", "_");
        if (!id.isEmpty() && Character.isDigit(id.charAt(0))) {
            id = "_" + id;
        }
        return id;
    }
}
