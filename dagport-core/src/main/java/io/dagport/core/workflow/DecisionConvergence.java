package io.dagport.core.workflow;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Multiset;
import com.google.common.collect.SetMultimap;
import io.dagport.spi.Relation;

/**
 * Finds nodes where two or more arms of one decision meet again.
 * <p>
 * An arm covers every node reachable from the arm's first node without
 * passing through another decision, or through a join whose fork is not
 * itself part of the arm. A node is a convergence when it is covered by at
 * least two arms of the same decision and has at least two incoming
 * relations.
 */
class DecisionConvergence
{
    private final Workflow workflow;
    private final SetMultimap<String, String> successors = LinkedHashMultimap.create();
    private final Map<String, String> forkOfJoin = new HashMap<>();

    DecisionConvergence(Workflow workflow)
    {
        this.workflow = workflow;

        Map<String, String> nodeOfTask = new HashMap<>();
        for (ParsedNode node : workflow.getNodes()) {
            node.getTasks().forEach(task -> nodeOfTask.put(task.getTaskId(), node.getName()));
        }
        for (Relation relation : workflow.getRelations()) {
            String from = nodeOfTask.get(relation.getFrom());
            String to = nodeOfTask.get(relation.getTo());
            if (from != null && to != null && !from.equals(to)) {
                successors.put(from, to);
            }
        }
        workflow.getForkJoins().forEach((fork, join) -> forkOfJoin.put(join, fork));
    }

    Set<String> find()
    {
        Set<String> convergences = new LinkedHashSet<>();
        for (ParsedNode node : workflow.getNodes()) {
            if (node.getNodeType() != NodeType.DECISION) {
                continue;
            }
            Multiset<String> coverage = HashMultiset.create();
            for (String arm : successors.get(node.getName())) {
                coverage.addAll(armOf(arm));
            }
            for (Multiset.Entry<String> entry : coverage.entrySet()) {
                if (entry.getCount() >= 2 && incomingCount(entry.getElement()) >= 2) {
                    convergences.add(entry.getElement());
                }
            }
        }
        return convergences;
    }

    private Set<String> armOf(String first)
    {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(first);
        while (!queue.isEmpty()) {
            String name = queue.poll();
            if (!visited.add(name)) {
                continue;
            }
            NodeType type = workflow.getNode(name).get().getNodeType();
            if (type == NodeType.DECISION) {
                continue;
            }
            if (type == NodeType.JOIN && !visited.contains(forkOfJoin.get(name))) {
                continue;
            }
            queue.addAll(successors.get(name));
        }
        return visited;
    }

    private int incomingCount(String nodeName)
    {
        ParsedNode node = workflow.getNode(nodeName).get();
        return workflow.getIncomingRelations(node.getFirstTaskId()).size();
    }
}
