package io.dagport.core.emit;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.inject.Inject;
import io.dagport.core.workflow.CompiledNode;
import io.dagport.core.workflow.CompiledWorkflow;
import io.dagport.spi.Relation;
import io.dagport.spi.Task;
import io.dagport.spi.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a compiled workflow as an Airflow DAG file.
 */
public class DagWriter
{
    private static final Logger logger = LoggerFactory.getLogger(DagWriter.class);

    public static final String DAG_TEMPLATE = "dag.tpl";

    static final String INDENT = "    ";

    static final ImmutableList<String> BASE_IMPORTS = ImmutableList.of(
            "import datetime",
            "from airflow import models",
            "from airflow.utils import dates");

    private final ObjectMapper mapper;

    @Inject
    public DagWriter(ObjectMapper mapper)
    {
        this.mapper = mapper;
    }

    /**
     * Removes the output directory if it exists and writes
     * {@code <dag-name>.py} into a fresh one.
     */
    public Path write(CompiledWorkflow workflow, Map<String, String> params, DagOptions options, Path outputDirectory)
        throws IOException, TemplateException
    {
        String content = render(workflow, params, options);

        if (Files.exists(outputDirectory)) {
            MoreFiles.deleteRecursively(outputDirectory, RecursiveDeleteOption.ALLOW_INSECURE);
        }
        Files.createDirectories(outputDirectory);

        Path file = outputDirectory.resolve(options.getDagName() + ".py");
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write(content);
        }
        logger.info("Saved DAG {} to {}", options.getDagName(), file);
        return file;
    }

    public String render(CompiledWorkflow workflow, Map<String, String> params, DagOptions options)
        throws TemplateException
    {
        // one cache per run
        TemplateRenderer renderer = new TemplateRenderer(new TemplateCache());
        StringBuilder sb = new StringBuilder();

        writeDependencies(sb, workflow.getDependencies());
        sb.append("PARAMS = ").append(toJson(params)).append("\n\n");
        writeHeader(sb, renderer, options);
        writeTasks(sb, renderer, workflow);
        sb.append("\n\n");
        writeRelations(sb, workflow.getRelations());
        return sb.toString();
    }

    private void writeDependencies(StringBuilder sb, Set<String> dependencies)
    {
        Set<String> lines = new TreeSet<>(BASE_IMPORTS);
        lines.addAll(dependencies);
        sb.append(String.join("\n", lines)).append("\n\n");
    }

    private String toJson(Map<String, String> params)
    {
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter(INDENT, "\n"));
        try {
            return mapper.writer(printer).writeValueAsString(new TreeMap<>(params));
        }
        catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize params", ex);
        }
    }

    private void writeHeader(StringBuilder sb, TemplateRenderer renderer, DagOptions options)
        throws TemplateException
    {
        Map<String, Object> bindings = new HashMap<>();
        bindings.put("dag_name", options.getDagName());
        bindings.put("schedule_interval", options.getScheduleInterval().orNull());
        bindings.put("start_days_ago", options.getStartDaysAgo().or(0));
        sb.append(renderer.render(DAG_TEMPLATE, bindings));
        logger.debug("Wrote DAG header");
    }

    private void writeTasks(StringBuilder sb, TemplateRenderer renderer, CompiledWorkflow workflow)
        throws TemplateException
    {
        Map<String, String> entryTasks = new LinkedHashMap<>();
        for (CompiledNode node : workflow.getNodes()) {
            entryTasks.put(node.getName(), node.getTasks().get(0).getTaskId());
        }

        for (Task task : workflow.getTasks()) {
            for (String node : task.getReferencedNodes()) {
                if (!entryTasks.containsKey(node)) {
                    throw new TemplateException("Task " + task.getTaskId() + " refers to node " + node + " which has no task in the DAG");
                }
            }
            Map<String, Object> bindings = new HashMap<>(task.getTemplateParams());
            bindings.put("task_id", task.getTaskId());
            bindings.put("trigger_rule", TriggerRules.toAirflow(task.getTriggerPolicy()));
            bindings.put("entry_tasks", entryTasks);

            String text = renderer.render(task.getTemplateName(), bindings);
            indent(sb, text);
            logger.debug("Wrote task {}", task.getTaskId());
        }
    }

    private void writeRelations(StringBuilder sb, Set<Relation> relations)
    {
        // edges of different kinds between the same pair are one dependency in Airflow
        Set<String> lines = new TreeSet<>();
        for (Relation relation : relations) {
            lines.add(relation.getFrom() + ".set_downstream(" + relation.getTo() + ")");
        }
        for (String line : lines) {
            sb.append(INDENT).append(line).append("\n");
        }
    }

    private static void indent(StringBuilder sb, String text)
    {
        for (String line : Splitter.on('\n').split(text)) {
            if (!line.trim().isEmpty()) {
                sb.append(INDENT).append(line);
            }
            sb.append("\n");
        }
    }
}
