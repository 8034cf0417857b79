package io.dagport.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

public class PropertyUtils
{
    private PropertyUtils()
    { }

    public static Properties loadFile(Path file)
        throws IOException
    {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        return props;
    }

    public static Map<String, String> toMap(Properties props)
    {
        return toMap(props, "");
    }

    /**
     * Entries whose key starts with prefix, with the prefix removed. Keys are
     * sorted so that the result doesn't depend on hash order.
     */
    public static Map<String, String> toMap(Properties props, String prefix)
    {
        Map<String, String> map = new TreeMap<>();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(prefix)) {
                map.put(key.substring(prefix.length()), props.getProperty(key));
            }
        }
        return map;
    }
}
