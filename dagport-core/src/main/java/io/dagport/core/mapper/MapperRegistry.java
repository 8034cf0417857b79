package io.dagport.core.mapper;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import io.dagport.spi.NodeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lookup table of node mappers keyed by type. Immutable once built, so a
 * single instance is shared by concurrent compilations.
 */
public class MapperRegistry
{
    private static final Logger logger = LoggerFactory.getLogger(MapperRegistry.class);

    /**
     * Type of the mapper used for action types nothing else is registered for.
     */
    public static final String FALLBACK_ACTION_TYPE = "dummy";

    private final Map<String, NodeMapper> map;

    @Inject
    public MapperRegistry(Set<NodeMapper> injectedMappers)
    {
        this.map = buildTypeMap(injectedMappers);
    }

    public static MapperRegistry of(NodeMapper... mappers)
    {
        return new MapperRegistry(ImmutableSet.copyOf(mappers));
    }

    public Optional<NodeMapper> get(String type)
    {
        return Optional.fromNullable(map.get(type));
    }

    public Optional<NodeMapper> getActionMapper(String actionType)
    {
        NodeMapper mapper = map.get(actionType);
        if (mapper != null) {
            return Optional.of(mapper);
        }
        NodeMapper fallback = map.get(FALLBACK_ACTION_TYPE);
        if (fallback != null) {
            logger.warn("No mapper is registered for action type '{}'. Converting it with '{}'", actionType, FALLBACK_ACTION_TYPE);
        }
        return Optional.fromNullable(fallback);
    }

    public Set<String> getTypes()
    {
        return map.keySet();
    }

    private static Map<String, NodeMapper> buildTypeMap(Collection<NodeMapper> mappers)
    {
        ImmutableMap.Builder<String, NodeMapper> builder = ImmutableMap.builder();

        for (NodeMapper mapper : mappers) {
            builder.put(mapper.getType(), mapper);
        }

        // fails on duplicated types
        return builder.build();
    }
}
