package io.dagport.core.emit;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import com.hubspot.jinjava.Jinjava;
import com.hubspot.jinjava.JinjavaConfig;
import com.hubspot.jinjava.interpret.RenderResult;
import com.hubspot.jinjava.interpret.TemplateError;
import com.hubspot.jinjava.interpret.TemplateError.ErrorType;
import com.hubspot.jinjava.lib.fn.ELFunctionDefinition;
import io.dagport.spi.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders task templates with Jinja syntax. Templates may call
 * {@code py(value)} to embed a value as a Python literal.
 */
public class TemplateRenderer
{
    private static final Logger logger = LoggerFactory.getLogger(TemplateRenderer.class);

    private final TemplateCache cache;
    private final Jinjava jinjava;

    public TemplateRenderer(TemplateCache cache)
    {
        this.cache = cache;
        this.jinjava = new Jinjava(
                JinjavaConfig.newBuilder()
                .withLocale(Locale.ENGLISH)
                .withCharset(StandardCharsets.UTF_8)
                .build());
        jinjava.setResourceLocator((name, encoding, interpreter) -> {
            throw new RuntimeException("include and import tags are not allowed in task templates");
        });
        jinjava.getGlobalContext().registerFunction(new ELFunctionDefinition("", "py",
                    PythonLiterals.class, "toLiteral", Object.class));
    }

    public String render(String templateName, Map<String, Object> bindings)
        throws TemplateException
    {
        String source = cache.get(templateName);
        RenderResult result = jinjava.renderForResult(source, bindings);

        List<TemplateError> fatal = result.getErrors().stream()
            .filter(error -> error.getSeverity() == ErrorType.FATAL)
            .collect(Collectors.toList());
        if (!fatal.isEmpty()) {
            String messages = fatal.stream()
                .map(error -> "line " + error.getLineno() + ": " + error.getMessage())
                .collect(Collectors.joining(", "));
            throw new TemplateException("Failed to render template " + templateName + ": " + messages);
        }
        logger.trace("Rendered template {}:\n{}", templateName, result.getOutput());
        return result.getOutput();
    }
}
