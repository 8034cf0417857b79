package io.dagport.standards.mapper;

import com.google.common.collect.ImmutableMap;
import io.dagport.spi.ConfigException;
import io.dagport.spi.Task;
import io.dagport.spi.Translation;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static io.dagport.standards.mapper.MapperTestingUtils.context;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class SubWorkflowMapperTest
{
    @Rule public ExpectedException exception = ExpectedException.none();

    @Test
    public void triggersChildDag()
    {
        String xml = "<sub-workflow>" +
            "<app-path>${nameNode}/user/alice/child/</app-path>" +
            "<propagate-configuration/>" +
            "<configuration><property><name>a</name><value>b</value></property></configuration>" +
            "</sub-workflow>";

        Translation translation = new SubWorkflowMapper().translate(context("child-wf", xml, ImmutableMap.of("nameNode", "hdfs://nn")));

        Task task = translation.getTasks().get(0);
        assertThat(task.getTaskId(), is("child_wf"));
        assertThat(task.getTemplateParams().get("app_path"), is("hdfs://nn/user/alice/child/"));
        assertThat(task.getTemplateParams().get("trigger_dag_id"), is("child"));
        assertThat(task.getTemplateParams().get("propagate_configuration"), is(true));
        assertThat(task.getTemplateParams().get("properties"), is(ImmutableMap.of("a", "b")));
        assertThat(translation.getImports(), contains(AirflowImports.DAGRUN_OPERATOR));
    }

    @Test
    public void appPathIsRequired()
    {
        exception.expect(ConfigException.class);
        exception.expectMessage("sub-workflow action must have an <app-path> element");
        new SubWorkflowMapper().translate(context("s", "<sub-workflow/>", ImmutableMap.of()));
    }

    @Test
    public void dagIdNeedsPathSegment()
    {
        assertThat(SubWorkflowMapper.dagIdOf("child"), is("child"));
        exception.expect(ConfigException.class);
        SubWorkflowMapper.dagIdOf("/");
    }
}
