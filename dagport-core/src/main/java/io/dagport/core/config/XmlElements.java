package io.dagport.core.config;

import java.util.ArrayList;
import java.util.List;
import com.google.common.base.Optional;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Namespace-agnostic accessors over DOM elements. Oozie documents declare a
 * versioned default namespace per action type, so elements are matched by
 * local name only.
 */
public final class XmlElements
{
    private XmlElements()
    { }

    public static String localName(Element element)
    {
        String name = element.getLocalName();
        return name != null ? name : element.getTagName();
    }

    public static List<Element> children(Element parent)
    {
        List<Element> elements = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }

    public static List<Element> children(Element parent, String localName)
    {
        List<Element> elements = new ArrayList<>();
        for (Element child : children(parent)) {
            if (localName(child).equals(localName)) {
                elements.add(child);
            }
        }
        return elements;
    }

    public static Optional<Element> child(Element parent, String localName)
    {
        for (Element child : children(parent)) {
            if (localName(child).equals(localName)) {
                return Optional.of(child);
            }
        }
        return Optional.absent();
    }

    public static Optional<String> childText(Element parent, String localName)
    {
        return child(parent, localName).transform(XmlElements::text);
    }

    public static List<String> childTexts(Element parent, String localName)
    {
        List<String> texts = new ArrayList<>();
        for (Element child : children(parent, localName)) {
            texts.add(text(child));
        }
        return texts;
    }

    public static String text(Element element)
    {
        return element.getTextContent().trim();
    }

    public static Optional<String> attribute(Element element, String name)
    {
        if (!element.hasAttribute(name)) {
            return Optional.absent();
        }
        return Optional.of(element.getAttribute(name));
    }
}
