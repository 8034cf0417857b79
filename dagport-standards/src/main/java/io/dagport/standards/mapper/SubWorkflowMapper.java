package io.dagport.standards.mapper;

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
 * Triggers the DAG converted from the sub-workflow's application directory.
 * The DAG id is the last segment of {@code <app-path>}.
 */
public class SubWorkflowMapper
        implements NodeMapper
{
    @Override
    public String getType()
    {
        return "sub-workflow";
    }

    @Override
    public Translation translate(MappingContext context)
    {
        Element action = context.getElement();
        Map<String, String> params = context.getParams();

        String appPath = XmlElements.childText(action, "app-path")
            .transform(path -> ElResolver.resolve(path, params))
            .toJavaUtil()
            .orElseThrow(() -> new ConfigException("sub-workflow action must have an <app-path> element"));

        Task task = Task.builder()
            .taskId(context.getTaskId())
            .templateName("subwf.tpl")
            .putTemplateParams("app_path", appPath)
            .putTemplateParams("trigger_dag_id", dagIdOf(appPath))
            .putTemplateParams("propagate_configuration", XmlElements.child(action, "propagate-configuration").isPresent())
            .putTemplateParams("properties", ConfigurationExtractor.extract(action, params))
            .build();
        return Translation.of(task, ImmutableSet.of(AirflowImports.DAGRUN_OPERATOR));
    }

    static String dagIdOf(String appPath)
    {
        String path = appPath;
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        if (name.isEmpty()) {
            throw new ConfigException("Can't derive a DAG id from app-path " + appPath);
        }
        return name;
    }
}
