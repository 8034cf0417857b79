package io.dagport.core.workflow;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.dagport.spi.Relation;
import io.dagport.spi.Task;
import org.immutables.value.Value;

/**
 * Result of compiling one workflow, handed to the emitter.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCompiledWorkflow.class)
@JsonDeserialize(as = ImmutableCompiledWorkflow.class)
public abstract class CompiledWorkflow
{
    public abstract String getName();

    public abstract List<CompiledNode> getNodes();

    public abstract Set<Relation> getRelations();

    public abstract Set<String> getDependencies();

    public abstract List<String> getEntryTaskIds();

    public List<Task> getTasks()
    {
        return getNodes().stream()
            .flatMap(node -> node.getTasks().stream())
            .collect(Collectors.toList());
    }

    public Optional<CompiledNode> getNode(String name)
    {
        for (CompiledNode node : getNodes()) {
            if (node.getName().equals(name)) {
                return Optional.of(node);
            }
        }
        return Optional.absent();
    }

    public Optional<Task> getTask(String taskId)
    {
        for (Task task : getTasks()) {
            if (task.getTaskId().equals(taskId)) {
                return Optional.of(task);
            }
        }
        return Optional.absent();
    }

    static CompiledWorkflow of(Workflow workflow, Set<String> dependencies)
    {
        return ImmutableCompiledWorkflow.builder()
            .name(workflow.getName())
            .nodes(workflow.getNodes().stream()
                    .map(CompiledNode::of)
                    .collect(Collectors.toList()))
            .relations(workflow.getRelations())
            .dependencies(dependencies)
            .entryTaskIds(workflow.getEntryTaskIds())
            .build();
    }
}
