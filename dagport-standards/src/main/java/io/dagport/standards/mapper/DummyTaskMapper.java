package io.dagport.standards.mapper;

import com.google.common.collect.ImmutableSet;
import io.dagport.spi.MappingContext;
import io.dagport.spi.NodeMapper;
import io.dagport.spi.Task;
import io.dagport.spi.Translation;

/**
 * Base of mappers whose node becomes a single task doing nothing.
 */
abstract class DummyTaskMapper
        implements NodeMapper
{
    static final String DUMMY_TEMPLATE = "dummy.tpl";

    @Override
    public Translation translate(MappingContext context)
    {
        return Translation.of(
                Task.of(context.getTaskId(), DUMMY_TEMPLATE),
                ImmutableSet.of(AirflowImports.DUMMY_OPERATOR));
    }
}
