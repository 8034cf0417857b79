package io.dagport.core.workflow;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import com.google.inject.Inject;
import io.dagport.spi.EdgeKind;
import io.dagport.spi.Relation;
import io.dagport.spi.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes passthrough nodes such as the start node and reattaches their
 * upstream tasks directly to their single successor.
 */
public class MarkerElision
{
    private static final Logger logger = LoggerFactory.getLogger(MarkerElision.class);

    private final TriggerRuleCompiler triggerRuleCompiler;

    @Inject
    public MarkerElision(TriggerRuleCompiler triggerRuleCompiler)
    {
        this.triggerRuleCompiler = triggerRuleCompiler;
    }

    public void elideMarkers(Workflow workflow)
    {
        List<ParsedNode> markers = workflow.getNodes().stream()
            .filter(ParsedNode::isPassthrough)
            .collect(Collectors.toList());

        GraphValidator validator = GraphValidator.builder();
        for (ParsedNode marker : markers) {
            int fanOut = workflow.getOutgoingRelations(marker.getLastTaskId()).size();
            validator.check(marker.getName(), fanOut == 1,
                    "is a passthrough node and must have exactly one outgoing relation but has %d", fanOut);
        }
        validator.validate("passthrough nodes");

        Set<String> changed = new LinkedHashSet<>();
        for (ParsedNode marker : markers) {
            Relation out = workflow.getOutgoingRelations(marker.getLastTaskId()).get(0);
            List<Relation> incoming = workflow.getIncomingRelations(marker.getFirstTaskId());

            for (Task task : marker.getTasks()) {
                workflow.getIncomingRelations(task.getTaskId()).forEach(workflow::removeRelation);
                workflow.getOutgoingRelations(task.getTaskId()).forEach(workflow::removeRelation);
            }
            for (Relation in : incoming) {
                // an error edge keeps its kind so the successor still runs on failure
                EdgeKind kind = in.getKind() == EdgeKind.ERROR ? EdgeKind.ERROR : EdgeKind.STRUCTURAL;
                workflow.addRelation(Relation.of(in.getFrom(), out.getTo(), kind));
            }
            workflow.removeNode(marker.getName());

            workflow.findNodeOfTask(out.getTo()).toJavaUtil()
                .ifPresent(successor -> changed.add(successor.getName()));
            logger.debug("Elided passthrough node {}", marker.getName());
        }

        triggerRuleCompiler.assignTriggerPolicies(workflow, changed);
    }
}
