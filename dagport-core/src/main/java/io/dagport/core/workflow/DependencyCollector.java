package io.dagport.core.workflow;

import java.util.LinkedHashSet;
import java.util.Set;

public class DependencyCollector
{
    /**
     * Union of the import statements every node needs, in node order.
     */
    public Set<String> collectDependencies(Workflow workflow)
    {
        Set<String> dependencies = new LinkedHashSet<>();
        for (ParsedNode node : workflow.getNodes()) {
            dependencies.addAll(node.getImports());
        }
        return dependencies;
    }
}
