package io.dagport.standards.mapper;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.dagport.core.config.ElResolver;
import io.dagport.core.config.XmlElements;
import io.dagport.spi.MappingContext;
import io.dagport.spi.NodeMapper;
import io.dagport.spi.Task;
import io.dagport.spi.Translation;

/**
 * Translates a kill node into a task that fails with the node's message.
 */
public class KillMapper
        implements NodeMapper
{
    static final String DEFAULT_MESSAGE = "Workflow killed";

    @Override
    public String getType()
    {
        return "kill";
    }

    @Override
    public Translation translate(MappingContext context)
    {
        String message = XmlElements.childText(context.getElement(), "message")
            .transform(text -> ElResolver.resolve(text, context.getParams()))
            .or(DEFAULT_MESSAGE);
        String command = "echo " + ShellQuoting.quote(message) + " >&2; exit 1";

        Task task = Task.builder()
            .taskId(context.getTaskId())
            .templateName("kill.tpl")
            .templateParams(ImmutableMap.of("message", message, "bash_command", command))
            .build();
        return Translation.of(task, ImmutableSet.of(AirflowImports.BASH_OPERATOR));
    }
}
