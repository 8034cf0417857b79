package io.dagport.core.workflow;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import com.google.common.base.Optional;
import com.google.common.collect.Multimap;

/**
 * Pairs every fork with the single join all of its paths converge on.
 * <p>
 * Only success-path transitions are followed. A path may end at a kill node;
 * it must not reach the end node. A nested fork is stepped over through its
 * own join.
 */
class ForkJoinAnalyzer
{
    private final Map<String, NodeType> types;
    private final Multimap<String, String> successors;
    private final Map<String, Optional<String>> results = new HashMap<>();
    private final GraphValidator validator = GraphValidator.builder();

    ForkJoinAnalyzer(Map<String, NodeType> types, Multimap<String, String> successors)
    {
        this.types = types;
        this.successors = successors;
    }

    Map<String, String> analyze(Collection<String> forks)
    {
        Map<String, String> pairs = new LinkedHashMap<>();
        Map<String, String> forkOfJoin = new HashMap<>();
        for (String fork : forks) {
            Optional<String> join = joinOf(fork);
            if (!join.isPresent()) {
                continue;
            }
            String other = forkOfJoin.putIfAbsent(join.get(), fork);
            if (other != null) {
                validator.error(join.get(), "is the join of both fork '%s' and fork '%s'", other, fork);
            }
            else {
                pairs.put(fork, join.get());
            }
        }
        validator.validate("fork/join balance");
        return pairs;
    }

    private Optional<String> joinOf(String fork)
    {
        Optional<String> known = results.get(fork);
        if (known != null) {
            return known;
        }
        results.put(fork, Optional.absent());

        Set<String> joins = new TreeSet<>();
        Set<String> visited = new HashSet<>();
        for (String path : successors.get(fork)) {
            walk(fork, path, joins, visited);
        }

        Optional<String> result = Optional.absent();
        if (joins.size() == 1) {
            result = Optional.of(joins.iterator().next());
        }
        else if (joins.isEmpty()) {
            validator.error(fork, "has no path reaching a join node");
        }
        else {
            validator.error(fork, "has paths ending at different join nodes %s", joins);
        }
        results.put(fork, result);
        return result;
    }

    private void walk(String fork, String name, Set<String> joins, Set<String> visited)
    {
        if (!visited.add(name)) {
            return;
        }
        switch (types.get(name)) {
        case JOIN:
            joins.add(name);
            return;
        case END:
            validator.error(fork, "has a path reaching end node '%s' before a join node", name);
            return;
        case KILL:
            return;
        case FORK:
            Optional<String> inner = joinOf(name);
            if (inner.isPresent()) {
                for (String next : successors.get(inner.get())) {
                    walk(fork, next, joins, visited);
                }
            }
            return;
        default:
            for (String next : successors.get(name)) {
                walk(fork, next, joins, visited);
            }
        }
    }
}
