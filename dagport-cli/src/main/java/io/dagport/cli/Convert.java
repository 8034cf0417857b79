package io.dagport.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import com.beust.jcommander.Parameter;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.dagport.core.emit.DagOptions;
import io.dagport.core.emit.DagWriter;
import io.dagport.core.workflow.CompiledWorkflow;
import io.dagport.spi.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.dagport.cli.SystemExitException.systemExit;

public class Convert
        extends WorkflowCommand
{
    private static final Logger logger = LoggerFactory.getLogger(Convert.class);

    @Inject DagWriter dagWriter;

    @Parameter(names = {"-o", "--output"})
    String outputDirectory = null;

    @Parameter(names = {"-n", "--dag-name"})
    String dagName = null;

    @Parameter(names = {"--start-days-ago"})
    Integer startDaysAgo = null;

    @Parameter(names = {"--schedule-interval"})
    Integer scheduleInterval = null;

    @Override
    public void main()
            throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }
        if (outputDirectory == null) {
            throw usage("-o, --output option is required");
        }
        convert();
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " convert -i <dir> -o <dir> [options...]");
        err.println("  Options:");
        err.println("    -i, --input DIR                  Oozie application directory containing workflow.xml");
        err.println("    -o, --output DIR                 directory to write the DAG file to (recreated)");
        err.println("    -n, --dag-name NAME              name of the DAG (default: name of the input directory)");
        err.println("    -u, --user NAME                  value of the user.name parameter (default: $USER)");
        err.println("        --start-days-ago N           start date of the DAG as days before today (default: 0)");
        err.println("        --schedule-interval N        days between DAG runs (default: not scheduled)");
        err.println("    -p, --param KEY=VALUE            overwrite a parameter (use multiple times to set many parameters)");
        err.println("    -P, --params-file PATH           read parameters from a properties file");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }

    private void convert()
            throws Exception
    {
        Properties systemProps = loadSystemProperties();
        Path input = inputDirectory();
        Map<String, String> params = loadParams(input, systemProps);

        String name = dagName != null ? dagName : defaultDagName(input);
        CompiledWorkflow workflow = compile(name, input, params);

        DagOptions options = DagOptions.builder()
            .dagName(name)
            .scheduleInterval(Optional.fromNullable(scheduleInterval != null ? scheduleInterval : intProperty(systemProps, "dag.schedule-interval")))
            .startDaysAgo(Optional.fromNullable(startDaysAgo != null ? startDaysAgo : intProperty(systemProps, "dag.start-days-ago")))
            .build();

        Path file = dagWriter.write(workflow, params, options, Paths.get(outputDirectory));
        logger.debug("Converted {} into {}", input, file);
        out.println("Wrote " + file);
    }

    private static Integer intProperty(Properties props, String key)
    {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException ex) {
            throw new ConfigException("Config " + key + " must be an integer but got: " + value, ex);
        }
    }
}
