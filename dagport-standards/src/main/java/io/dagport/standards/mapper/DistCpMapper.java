package io.dagport.standards.mapper;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import com.google.common.collect.ImmutableSet;
import io.dagport.core.config.ElResolver;
import io.dagport.core.config.XmlElements;
import io.dagport.spi.MappingContext;
import io.dagport.spi.NodeMapper;
import io.dagport.spi.Task;
import io.dagport.spi.Translation;
import org.w3c.dom.Element;

/**
 * Runs Hadoop DistCp with the action's {@code <arg>} list as a Dataproc
 * Hadoop job.
 */
public class DistCpMapper
        implements NodeMapper
{
    @Override
    public String getType()
    {
        return "distcp";
    }

    @Override
    public Translation translate(MappingContext context)
    {
        Element action = context.getElement();
        Map<String, String> params = context.getParams();

        List<String> args = XmlElements.childTexts(action, "arg").stream()
            .map(arg -> ElResolver.resolve(arg, params))
            .collect(Collectors.toList());

        Task task = Task.builder()
            .taskId(context.getTaskId())
            .templateName("distcp.tpl")
            .putTemplateParams("distcp_args", args)
            .putTemplateParams("properties", ConfigurationExtractor.extract(action, params))
            .build();
        return PrepareSupport.compose(context, task, ImmutableSet.of(AirflowImports.DATAPROC_OPERATOR));
    }
}
