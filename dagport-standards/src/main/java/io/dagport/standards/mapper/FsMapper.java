package io.dagport.standards.mapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.dagport.core.config.XmlElements;
import io.dagport.spi.ConfigException;
import io.dagport.spi.ImmutableTranslation;
import io.dagport.spi.MappingContext;
import io.dagport.spi.NodeMapper;
import io.dagport.spi.Relation;
import io.dagport.spi.Task;
import io.dagport.spi.Translation;
import org.w3c.dom.Element;

/**
 * Translates each file system operation of an fs action into its own task,
 * chained in document order. An fs action without operations becomes a
 * single task doing nothing.
 */
public class FsMapper
        implements NodeMapper
{
    static final String FS_OP_TEMPLATE = "fs_op.tpl";

    @Override
    public String getType()
    {
        return "fs";
    }

    @Override
    public Translation translate(MappingContext context)
    {
        List<Element> operations = XmlElements.children(context.getElement());
        if (operations.isEmpty()) {
            return Translation.of(
                    Task.of(context.getTaskId(), DummyTaskMapper.DUMMY_TEMPLATE),
                    ImmutableSet.of(AirflowImports.DUMMY_OPERATOR));
        }

        ImmutableTranslation.Builder builder = Translation.builder()
            .addImports(AirflowImports.DATAPROC_OPERATOR);
        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < operations.size(); i++) {
            String command = pigCommand(operations.get(i), context.getParams());
            tasks.add(Task.builder()
                    .taskId(context.getTaskId() + "_fs_" + i)
                    .templateName(FS_OP_TEMPLATE)
                    .templateParams(ImmutableMap.of("pig_command", command))
                    .build());
        }
        builder.addAllTasks(tasks);
        for (int i = 1; i < tasks.size(); i++) {
            builder.addRelations(Relation.structural(tasks.get(i - 1).getTaskId(), tasks.get(i).getTaskId()));
        }
        return builder.build();
    }

    static String pigCommand(Element operation, Map<String, String> params)
    {
        String tag = XmlElements.localName(operation);
        switch (tag) {
        case "mkdir":
            return fs("-mkdir", "-p", path(operation, "path", params));
        case "delete":
            return fs("-rm", "-f", "-r", path(operation, "path", params));
        case "move":
            return fs("-mv", path(operation, "source", params), path(operation, "target", params));
        case "touchz":
            return fs("-touchz", path(operation, "path", params));
        case "chmod":
            return fs(recursive(operation, "-chmod"), required(operation, "permissions"), path(operation, "path", params));
        case "chgrp":
            return fs(recursive(operation, "-chgrp"), required(operation, "group"), path(operation, "path", params));
        default:
            throw new ConfigException("Unsupported fs operation: " + tag);
        }
    }

    private static String fs(String... words)
    {
        return "fs " + String.join(" ", words);
    }

    private static String recursive(Element operation, String command)
    {
        if (XmlElements.child(operation, "recursive").isPresent()) {
            return command + " -R";
        }
        return command;
    }

    private static String path(Element operation, String attribute, Map<String, String> params)
    {
        return ShellQuoting.quote(HdfsPaths.normalize(required(operation, attribute), params));
    }

    private static String required(Element operation, String attribute)
    {
        String value = operation.getAttribute(attribute);
        if (value.isEmpty()) {
            throw new ConfigException("<" + XmlElements.localName(operation) + "> of an fs action must have a '" + attribute + "' attribute");
        }
        return value;
    }
}
