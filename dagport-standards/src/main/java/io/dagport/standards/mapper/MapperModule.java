package io.dagport.standards.mapper;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.dagport.spi.NodeMapper;

public class MapperModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        addStandardMapper(binder, StartMapper.class);
        addStandardMapper(binder, EndMapper.class);
        addStandardMapper(binder, KillMapper.class);
        addStandardMapper(binder, DecisionMapper.class);
        addStandardMapper(binder, ForkMapper.class);
        addStandardMapper(binder, JoinMapper.class);
        addStandardMapper(binder, DummyMapper.class);
        addStandardMapper(binder, ShellMapper.class);
        addStandardMapper(binder, DistCpMapper.class);
        addStandardMapper(binder, PigMapper.class);
        addStandardMapper(binder, FsMapper.class);
        addStandardMapper(binder, SubWorkflowMapper.class);
    }

    protected void addStandardMapper(Binder binder, Class<? extends NodeMapper> mapper)
    {
        Multibinder.newSetBinder(binder, NodeMapper.class)
                .addBinding().to(mapper).in(Scopes.SINGLETON);
    }
}
