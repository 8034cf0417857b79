package io.dagport.core.emit;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import com.google.common.io.Resources;
import io.dagport.spi.TemplateException;

/**
 * Template sources loaded from the classpath, kept for the lifetime of one
 * conversion run.
 */
public class TemplateCache
{
    public static final String TEMPLATE_BASE = "io/dagport/templates/";

    private final ClassLoader classLoader;
    private final Map<String, String> sources = new HashMap<>();

    public TemplateCache()
    {
        this(TemplateCache.class.getClassLoader());
    }

    public TemplateCache(ClassLoader classLoader)
    {
        this.classLoader = classLoader;
    }

    public synchronized String get(String templateName)
        throws TemplateException
    {
        String source = sources.get(templateName);
        if (source == null) {
            source = load(templateName);
            sources.put(templateName, source);
        }
        return source;
    }

    public synchronized int size()
    {
        return sources.size();
    }

    private String load(String templateName)
        throws TemplateException
    {
        URL url = classLoader.getResource(TEMPLATE_BASE + templateName);
        if (url == null) {
            throw new TemplateException("Template not found: " + templateName);
        }
        try {
            return Resources.toString(url, StandardCharsets.UTF_8);
        }
        catch (IOException ex) {
            throw new TemplateException("Failed to read template " + templateName, ex);
        }
    }
}
