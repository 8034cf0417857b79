package io.dagport.core.workflow;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.dagport.spi.Relation;
import io.dagport.spi.Task;
import io.dagport.spi.TriggerPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns the trigger policy of every task from the kinds of its incoming
 * relations. The assignment depends on the relation set only, so running it
 * again on an unchanged graph yields the same result.
 */
public class TriggerRuleCompiler
{
    private static final Logger logger = LoggerFactory.getLogger(TriggerRuleCompiler.class);

    public void assignTriggerPolicies(Workflow workflow)
    {
        assignTriggerPolicies(workflow, workflow.getNodeNames());
    }

    public void assignTriggerPolicies(Workflow workflow, Collection<String> nodeNames)
    {
        Set<String> convergences = new DecisionConvergence(workflow).find();
        for (String name : ImmutableList.copyOf(nodeNames)) {
            Optional<ParsedNode> node = workflow.getNode(name);
            if (!node.isPresent()) {
                continue;
            }
            List<Task> tasks = node.get().getTasks();
            for (int i = 0; i < tasks.size(); i++) {
                Task task = tasks.get(i);
                // only the first task receives relations from other nodes
                boolean convergence = i == 0 && convergences.contains(name);
                TriggerPolicy policy = classify(workflow.getIncomingRelations(task.getTaskId()), convergence);
                node.get().setTriggerPolicy(i, policy);
                logger.debug("Trigger policy of task {}: {}", task.getTaskId(), policy);
            }
        }
    }

    static TriggerPolicy classify(Collection<Relation> incoming, boolean decisionConvergence)
    {
        if (incoming.isEmpty()) {
            return TriggerPolicy.ALL_UPSTREAM_SUCCEEDED;
        }
        long failurePaths = incoming.stream()
            .filter(relation -> relation.getKind().isFailurePath())
            .count();
        if (failurePaths == incoming.size()) {
            return TriggerPolicy.ANY_UPSTREAM_FAILED;
        }
        if (failurePaths > 0) {
            return TriggerPolicy.ALL_UPSTREAM_DONE;
        }
        if (decisionConvergence) {
            return TriggerPolicy.ANY_UPSTREAM_SUCCEEDED_OR_SKIPPED;
        }
        return TriggerPolicy.ALL_UPSTREAM_SUCCEEDED;
    }
}
