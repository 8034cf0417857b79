package io.dagport.core.workflow;

import java.util.List;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.dagport.spi.Task;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableCompiledNode.class)
@JsonDeserialize(as = ImmutableCompiledNode.class)
public abstract class CompiledNode
{
    public abstract String getName();

    public abstract NodeType getNodeType();

    public abstract String getMapperType();

    public abstract List<Task> getTasks();

    static CompiledNode of(ParsedNode node)
    {
        return ImmutableCompiledNode.builder()
            .name(node.getName())
            .nodeType(node.getNodeType())
            .mapperType(node.getMapperType())
            .tasks(node.getTasks())
            .build();
    }
}
