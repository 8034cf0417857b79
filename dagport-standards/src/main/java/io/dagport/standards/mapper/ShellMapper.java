package io.dagport.standards.mapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import com.google.common.collect.ImmutableSet;
import io.dagport.core.config.ElResolver;
import io.dagport.core.config.XmlElements;
import io.dagport.spi.ConfigException;
import io.dagport.spi.MappingContext;
import io.dagport.spi.NodeMapper;
import io.dagport.spi.Task;
import io.dagport.spi.Translation;
import org.w3c.dom.Element;

/**
 * Runs the {@code <exec>} command of a shell action on the Dataproc cluster
 * through Pig's {@code sh} command.
 */
public class ShellMapper
        implements NodeMapper
{
    @Override
    public String getType()
    {
        return "shell";
    }

    @Override
    public Translation translate(MappingContext context)
    {
        Element action = context.getElement();
        Map<String, String> params = context.getParams();

        String exec = XmlElements.childText(action, "exec")
            .toJavaUtil()
            .orElseThrow(() -> new ConfigException("shell action must have an <exec> element"));
        List<String> command = new ArrayList<>();
        command.add(ElResolver.resolve(exec, params));
        for (String argument : XmlElements.childTexts(action, "argument")) {
            command.add(ElResolver.resolve(argument, params));
        }

        Task task = Task.builder()
            .taskId(context.getTaskId())
            .templateName("shell.tpl")
            .putTemplateParams("pig_command", "sh " + ShellQuoting.join(command))
            .putTemplateParams("properties", ConfigurationExtractor.extract(action, params))
            .putTemplateParams("files", FileArchiveExtractor.extractFiles(action, params))
            .putTemplateParams("archives", FileArchiveExtractor.extractArchives(action, params))
            .build();
        return PrepareSupport.compose(context, task, ImmutableSet.of(AirflowImports.DATAPROC_OPERATOR));
    }
}
