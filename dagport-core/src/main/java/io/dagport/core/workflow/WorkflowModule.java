package io.dagport.core.workflow;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.dagport.core.mapper.MapperRegistry;
import io.dagport.spi.NodeMapper;

public class WorkflowModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        // mappers are contributed by other modules
        Multibinder.newSetBinder(binder, NodeMapper.class);

        binder.bind(MapperRegistry.class).in(Scopes.SINGLETON);
        binder.bind(WorkflowParser.class).in(Scopes.SINGLETON);
        binder.bind(TriggerRuleCompiler.class).in(Scopes.SINGLETON);
        binder.bind(MarkerElision.class).in(Scopes.SINGLETON);
        binder.bind(DependencyCollector.class).in(Scopes.SINGLETON);
        binder.bind(WorkflowCompiler.class).in(Scopes.SINGLETON);
    }
}
