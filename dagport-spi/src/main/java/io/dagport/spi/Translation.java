package io.dagport.spi;

import java.util.List;
import java.util.Set;
import org.immutables.value.Value;

/**
 * Tasks produced for a single node, in execution order, with the relations
 * linking them and the import statements their templates need.
 * <p>
 * The first task receives the node's incoming relations and the last one
 * carries its outgoing relations.
 */
@Value.Immutable
public abstract class Translation
{
    public abstract List<Task> getTasks();

    public abstract List<Relation> getRelations();

    public abstract Set<String> getImports();

    public static ImmutableTranslation.Builder builder()
    {
        return ImmutableTranslation.builder();
    }

    public static Translation of(Task task, Set<String> imports)
    {
        return builder()
            .addTasks(task)
            .imports(imports)
            .build();
    }
}
