package io.dagport.standards.mapper;

import java.util.LinkedHashMap;
import java.util.Map;
import com.google.common.base.Optional;
import io.dagport.core.config.ElResolver;
import io.dagport.core.config.XmlElements;
import io.dagport.spi.ConfigException;
import org.w3c.dom.Element;

public final class ConfigurationExtractor
{
    private ConfigurationExtractor()
    { }

    /**
     * Name/value pairs of the action's {@code <configuration>} block in
     * document order, with parameters resolved.
     */
    public static Map<String, String> extract(Element action, Map<String, String> params)
    {
        Map<String, String> properties = new LinkedHashMap<>();
        Optional<Element> configuration = XmlElements.child(action, "configuration");
        if (!configuration.isPresent()) {
            return properties;
        }
        for (Element property : XmlElements.children(configuration.get(), "property")) {
            Optional<String> name = XmlElements.childText(property, "name");
            if (!name.isPresent() || name.get().isEmpty()) {
                throw new ConfigException("<property> of <configuration> must have a <name>");
            }
            String value = XmlElements.childText(property, "value").or("");
            properties.put(ElResolver.resolve(name.get(), params), ElResolver.resolve(value, params));
        }
        return properties;
    }
}
