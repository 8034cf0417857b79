package io.dagport.standards.mapper;

import java.util.List;
import java.util.stream.Collectors;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.dagport.spi.ConfigException;
import io.dagport.spi.MappingContext;
import io.dagport.spi.Task;
import io.dagport.spi.Translation;
import org.junit.Rule;
import org.slf4j.LoggerFactory;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static io.dagport.standards.mapper.MapperTestingUtils.CLUSTER_PARAMS;
import static io.dagport.standards.mapper.MapperTestingUtils.context;
import static io.dagport.standards.mapper.MapperTestingUtils.element;
import static io.dagport.standards.mapper.PrepareSupport.prepareCommand;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class PrepareSupportTest
{
    @Rule public ExpectedException exception = ExpectedException.none();

    @Test
    public void deleteAndMkdirPaths()
    {
        String xml = "<shell><prepare>" +
            "<delete path=\"${nameNode}/tmp/a\"/>" +
            "<mkdir path=\"hdfs:///tmp/b\"/>" +
            "<delete path=\"/tmp/c\"/>" +
            "</prepare></shell>";

        assertThat(prepareCommand(element(xml), CLUSTER_PARAMS).get(),
                is("$DAGS_FOLDER/../data/prepare.sh -c cluster -r region -d \"/tmp/a\" \"/tmp/c\" -m \"/tmp/b\""));
    }

    @Test
    public void noPrepareBlock()
    {
        assertThat(prepareCommand(element("<shell><exec>ls</exec></shell>"), CLUSTER_PARAMS).isPresent(), is(false));
        assertThat(prepareCommand(element("<shell><prepare/></shell>"), CLUSTER_PARAMS).isPresent(), is(false));
    }

    @Test
    public void composeWithoutPrepareKeepsSingleTask()
    {
        MappingContext context = context("a", "<shell/>", CLUSTER_PARAMS);
        Task task = Task.of("a", "shell.tpl");

        Translation translation = PrepareSupport.compose(context, task, ImmutableSet.of("import x"));

        assertThat(translation.getTasks().size(), is(1));
        assertThat(translation.getImports(), is(ImmutableSet.of("import x")));
    }

    @Test
    public void composeWithPrepareLogsAddedTask()
    {
        Logger logger = (Logger) LoggerFactory.getLogger(PrepareSupport.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            MappingContext context = context("a", "<shell><prepare><mkdir path=\"/x\"/></prepare></shell>", CLUSTER_PARAMS);

            Translation translation = PrepareSupport.compose(context, Task.of("a", "shell.tpl"), ImmutableSet.of("import x"));

            assertThat(translation.getTasks().size(), is(2));
            List<String> messages = appender.list.stream()
                .map(ILoggingEvent::getFormattedMessage)
                .collect(Collectors.toList());
            assertThat(messages, contains("Adding prepare task a_prepare before a"));
        }
        finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    public void clusterIsRequired()
    {
        exception.expect(ConfigException.class);
        exception.expectMessage("Parameter 'dataproc_cluster' is required");
        prepareCommand(element("<shell><prepare><mkdir path=\"/x\"/></prepare></shell>"), ImmutableMap.of("gcp_region", "r"));
    }
}
