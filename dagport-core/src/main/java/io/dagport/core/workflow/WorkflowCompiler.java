package io.dagport.core.workflow;

import java.util.Map;
import java.util.Set;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Compiles an Oozie workflow document into a task graph whose run conditions
 * are expressed as trigger policies.
 * <p>
 * Compilation is a pure function of its input: nothing is returned unless
 * every step succeeds.
 */
public class WorkflowCompiler
{
    private static final Logger logger = LoggerFactory.getLogger(WorkflowCompiler.class);

    private final WorkflowParser parser;
    private final TriggerRuleCompiler triggerRuleCompiler;
    private final MarkerElision markerElision;
    private final DependencyCollector dependencyCollector;

    @Inject
    public WorkflowCompiler(WorkflowParser parser, TriggerRuleCompiler triggerRuleCompiler,
            MarkerElision markerElision, DependencyCollector dependencyCollector)
    {
        this.parser = parser;
        this.triggerRuleCompiler = triggerRuleCompiler;
        this.markerElision = markerElision;
        this.dependencyCollector = dependencyCollector;
    }

    public CompiledWorkflow compile(String name, Element root, Map<String, String> params)
    {
        Workflow workflow = parser.parse(name, root, params);
        triggerRuleCompiler.assignTriggerPolicies(workflow);
        markerElision.elideMarkers(workflow);
        Set<String> dependencies = dependencyCollector.collectDependencies(workflow);

        CompiledWorkflow compiled = CompiledWorkflow.of(workflow, dependencies);
        logger.info("Compiled workflow {}: {} nodes, {} tasks, {} relations",
                name, compiled.getNodes().size(), compiled.getTasks().size(), compiled.getRelations().size());
        if (compiled.getEntryTaskIds().size() != 1) {
            logger.warn("Workflow {} has {} entry tasks: {}", name, compiled.getEntryTaskIds().size(), compiled.getEntryTaskIds());
        }
        return compiled;
    }
}
