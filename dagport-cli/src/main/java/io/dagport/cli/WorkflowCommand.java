package io.dagport.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import com.beust.jcommander.Parameter;
import com.google.inject.Inject;
import io.dagport.core.config.ParamsLoader;
import io.dagport.core.config.PropertyUtils;
import io.dagport.core.config.WorkflowXmlLoader;
import io.dagport.core.workflow.CompiledWorkflow;
import io.dagport.core.workflow.WorkflowCompiler;
import org.w3c.dom.Element;

import static io.dagport.cli.SystemExitException.systemExit;

/**
 * Base of commands that compile the workflow of an Oozie application
 * directory.
 */
public abstract class WorkflowCommand
        extends Command
{
    public static final String PARAMS_PREFIX = "params.";

    @Inject protected WorkflowXmlLoader xmlLoader;
    @Inject protected ParamsLoader paramsLoader;
    @Inject protected WorkflowCompiler compiler;

    @Parameter(names = {"-i", "--input"})
    protected String inputDirectory = null;

    @Parameter(names = {"-u", "--user"})
    protected String user = null;

    @Parameter(names = {"-p", "--param"}, validateWith = ParameterValidator.class)
    protected List<String> paramsList = new ArrayList<>();

    @Parameter(names = {"-P", "--params-file"})
    protected String paramsFile = null;

    protected Path inputDirectory()
        throws SystemExitException
    {
        if (inputDirectory == null) {
            throw usage("-i, --input option is required");
        }
        Path dir = Paths.get(inputDirectory).toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            throw systemExit("Input directory does not exist: " + dir);
        }
        return dir;
    }

    protected Map<String, String> loadParams(Path inputDirectory, Properties systemProps)
        throws IOException
    {
        Map<String, String> base = new LinkedHashMap<>(PropertyUtils.toMap(systemProps, PARAMS_PREFIX));
        base.put("user.name", user != null ? user : env.getOrDefault("USER", System.getProperty("user.name")));

        Map<String, String> overrides = new LinkedHashMap<>();
        if (paramsFile != null) {
            overrides.putAll(PropertyUtils.toMap(PropertyUtils.loadFile(Paths.get(paramsFile))));
        }
        overrides.putAll(ParameterValidator.toMap(paramsList));

        return paramsLoader.load(inputDirectory, base, overrides);
    }

    protected CompiledWorkflow compile(String name, Path inputDirectory, Map<String, String> params)
        throws IOException, SystemExitException
    {
        Path file = inputDirectory.resolve(WorkflowXmlLoader.WORKFLOW_FILE_NAME);
        if (!Files.exists(file)) {
            throw systemExit(WorkflowXmlLoader.WORKFLOW_FILE_NAME + " not found in " + inputDirectory);
        }
        Element root = xmlLoader.load(file);
        return compiler.compile(name, root, params);
    }

    protected static String defaultDagName(Path inputDirectory)
    {
        return inputDirectory.getFileName().toString();
    }
}
