package io.dagport.standards.mapper;

import java.util.LinkedHashMap;
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
 * Runs a Pig script on the Dataproc cluster. The script is expected to be
 * uploaded next to the DAG under {@code gcp_uri_prefix}.
 */
public class PigMapper
        implements NodeMapper
{
    @Override
    public String getType()
    {
        return "pig";
    }

    @Override
    public Translation translate(MappingContext context)
    {
        Element action = context.getElement();
        Map<String, String> params = context.getParams();

        String script = XmlElements.childText(action, "script")
            .toJavaUtil()
            .orElseThrow(() -> new ConfigException("pig action must have a <script> element"));

        Map<String, String> variables = new LinkedHashMap<>();
        for (String param : XmlElements.childTexts(action, "param")) {
            int eq = param.indexOf('=');
            if (eq <= 0) {
                throw new ConfigException("<param> of a pig action must be of the form KEY=VALUE but got: " + param);
            }
            variables.put(param.substring(0, eq), ElResolver.resolve(param.substring(eq + 1), params));
        }

        Task task = Task.builder()
            .taskId(context.getTaskId())
            .templateName("pig.tpl")
            .putTemplateParams("script_file_name", ElResolver.resolve(script, params))
            .putTemplateParams("params_dict", variables)
            .putTemplateParams("properties", ConfigurationExtractor.extract(action, params))
            .putTemplateParams("files", FileArchiveExtractor.extractFiles(action, params))
            .putTemplateParams("archives", FileArchiveExtractor.extractArchives(action, params))
            .build();
        return PrepareSupport.compose(context, task, ImmutableSet.of(AirflowImports.DATAPROC_OPERATOR));
    }
}
