package io.dagport.core.workflow;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import com.google.common.base.Optional;
import io.dagport.spi.Relation;
import io.dagport.spi.Task;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Mutable task graph of one workflow while it is being compiled.
 */
public class Workflow
{
    private final String name;
    private final Map<String, ParsedNode> nodes = new LinkedHashMap<>();
    private final Set<Relation> relations = new LinkedHashSet<>();
    private final Map<String, String> forkJoins = new HashMap<>();

    public Workflow(String name)
    {
        this.name = name;
    }

    public String getName()
    {
        return name;
    }

    public Collection<ParsedNode> getNodes()
    {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Set<String> getNodeNames()
    {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public Optional<ParsedNode> getNode(String nodeName)
    {
        return Optional.fromNullable(nodes.get(nodeName));
    }

    public boolean hasNode(String nodeName)
    {
        return nodes.containsKey(nodeName);
    }

    void addNode(ParsedNode node)
    {
        checkArgument(!nodes.containsKey(node.getName()), "node %s already exists", node.getName());
        nodes.put(node.getName(), node);
    }

    void removeNode(String nodeName)
    {
        nodes.remove(nodeName);
    }

    public Optional<ParsedNode> findNodeOfTask(String taskId)
    {
        for (ParsedNode node : nodes.values()) {
            if (node.hasTask(taskId)) {
                return Optional.of(node);
            }
        }
        return Optional.absent();
    }

    public List<Task> getTasks()
    {
        return nodes.values().stream()
            .flatMap(node -> node.getTasks().stream())
            .collect(Collectors.toList());
    }

    public Set<Relation> getRelations()
    {
        return Collections.unmodifiableSet(relations);
    }

    void addRelation(Relation relation)
    {
        relations.add(relation);
    }

    void removeRelation(Relation relation)
    {
        relations.remove(relation);
    }

    public List<Relation> getIncomingRelations(String taskId)
    {
        return relations.stream()
            .filter(relation -> relation.getTo().equals(taskId))
            .collect(Collectors.toList());
    }

    public List<Relation> getOutgoingRelations(String taskId)
    {
        return relations.stream()
            .filter(relation -> relation.getFrom().equals(taskId))
            .collect(Collectors.toList());
    }

    /**
     * Tasks without incoming relations. Normally exactly one after markers
     * are elided.
     */
    public List<String> getEntryTaskIds()
    {
        Set<String> targets = relations.stream()
            .map(Relation::getTo)
            .collect(Collectors.toSet());
        return getTasks().stream()
            .map(Task::getTaskId)
            .filter(taskId -> !targets.contains(taskId))
            .collect(Collectors.toList());
    }

    /**
     * Join node paired with each fork node, keyed by fork name.
     */
    public Map<String, String> getForkJoins()
    {
        return Collections.unmodifiableMap(forkJoins);
    }

    void setForkJoins(Map<String, String> pairs)
    {
        forkJoins.clear();
        forkJoins.putAll(pairs);
    }
}
