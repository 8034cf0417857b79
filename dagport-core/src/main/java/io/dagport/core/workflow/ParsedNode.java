package io.dagport.core.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.dagport.spi.ImmutableTask;
import io.dagport.spi.Relation;
import io.dagport.spi.Task;
import io.dagport.spi.Translation;
import io.dagport.spi.TriggerPolicy;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A source workflow node together with the tasks it was translated into.
 * Only the trigger policies of its tasks change after parsing.
 */
public class ParsedNode
{
    private final String name;
    private final NodeType nodeType;
    private final String mapperType;
    private final boolean passthrough;
    private final List<Task> tasks;
    private final List<Relation> internalRelations;
    private final Set<String> imports;

    public ParsedNode(String name, NodeType nodeType, String mapperType,
            boolean passthrough, Translation translation)
    {
        checkArgument(!translation.getTasks().isEmpty(), "node %s has no tasks", name);
        this.name = name;
        this.nodeType = nodeType;
        this.mapperType = mapperType;
        this.passthrough = passthrough;
        this.tasks = new ArrayList<>(translation.getTasks());
        this.internalRelations = ImmutableList.copyOf(translation.getRelations());
        this.imports = ImmutableSet.copyOf(translation.getImports());
    }

    public String getName()
    {
        return name;
    }

    public NodeType getNodeType()
    {
        return nodeType;
    }

    public String getMapperType()
    {
        return mapperType;
    }

    public boolean isPassthrough()
    {
        return passthrough;
    }

    public List<Task> getTasks()
    {
        return ImmutableList.copyOf(tasks);
    }

    public List<Relation> getInternalRelations()
    {
        return internalRelations;
    }

    public Set<String> getImports()
    {
        return imports;
    }

    /**
     * Task receiving the node's incoming relations.
     */
    public String getFirstTaskId()
    {
        return tasks.get(0).getTaskId();
    }

    /**
     * Task carrying the node's outgoing relations.
     */
    public String getLastTaskId()
    {
        return tasks.get(tasks.size() - 1).getTaskId();
    }

    public boolean hasTask(String taskId)
    {
        return tasks.stream().anyMatch(task -> task.getTaskId().equals(taskId));
    }

    void setTriggerPolicy(int taskIndex, TriggerPolicy policy)
    {
        tasks.set(taskIndex, ImmutableTask.copyOf(tasks.get(taskIndex)).withTriggerPolicy(policy));
    }

    @Override
    public String toString()
    {
        return nodeType.getTag() + ":" + name;
    }
}
