package io.dagport.core.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ParamsLoaderTest
{
    @Rule public TemporaryFolder folder = new TemporaryFolder();

    private Path dir;

    @Before
    public void setUp()
    {
        dir = folder.getRoot().toPath();
    }

    private void writeFile(String name, String content)
            throws Exception
    {
        Files.write(dir.resolve(name), content.getBytes(UTF_8));
    }

    @Test
    public void missingFilesAreSkipped()
            throws Exception
    {
        Map<String, String> params = new ParamsLoader().load(dir, ImmutableMap.of("user.name", "alice"), ImmutableMap.of());

        assertThat(params, is(ImmutableMap.of("user.name", "alice")));
    }

    @Test
    public void laterSourcesOverrideEarlierOnes()
            throws Exception
    {
        writeFile(ParamsLoader.JOB_PROPERTIES, "a=job\nb=job\nc=job\n");
        writeFile(ParamsLoader.CONFIGURATION_PROPERTIES, "b=conf\nc=conf\n");

        Map<String, String> params = new ParamsLoader().load(dir,
                ImmutableMap.of("a", "base", "d", "base"),
                ImmutableMap.of("c", "override"));

        assertThat(params.get("a"), is("job"));
        assertThat(params.get("b"), is("conf"));
        assertThat(params.get("c"), is("override"));
        assertThat(params.get("d"), is("base"));
    }

    @Test
    public void fileValuesReferToEarlierParams()
            throws Exception
    {
        writeFile(ParamsLoader.JOB_PROPERTIES, "nameNode=hdfs://nn:8020\nexamplesRoot=examples\n");
        writeFile(ParamsLoader.CONFIGURATION_PROPERTIES,
                "oozie.wf.application.path=${nameNode}/user/${user.name}/${examplesRoot}/app\n");

        Map<String, String> params = new ParamsLoader().load(dir, ImmutableMap.of("user.name", "alice"), ImmutableMap.of());

        assertThat(params.get("oozie.wf.application.path"), is("hdfs://nn:8020/user/alice/examples/app"));
    }

    @Test
    public void fileValuesReferToEntriesOfSameFile()
            throws Exception
    {
        writeFile(ParamsLoader.JOB_PROPERTIES,
                "appPath=${root}/apps\nroot=${nameNode}/user\nnameNode=hdfs://nn\nloop=${loop}\n");

        Map<String, String> params = new ParamsLoader().load(dir, ImmutableMap.of(), ImmutableMap.of());

        assertThat(params.get("appPath"), is("hdfs://nn/user/apps"));
        assertThat(params.get("loop"), is("${loop}"));
    }
}
