package io.dagport.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.google.inject.Inject;
import io.dagport.core.config.PropertyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class Command
{
    private static final Logger logger = LoggerFactory.getLogger(Command.class);

    public static final String CONFIG_ENV = "DAGPORT_CONFIG";

    @Inject @Environment protected Map<String, String> env;
    @Inject @ProgramName protected String programName;
    @Inject @StdOut protected PrintStream out;
    @Inject @StdErr protected PrintStream err;

    @Parameter()
    protected List<String> args = new ArrayList<>();

    @Parameter(names = {"-c", "--config"})
    protected String configPath = null;

    @Parameter(names = {"-l", "--log-level"})
    protected String logLevel = "info";

    @DynamicParameter(names = "-X")
    protected Map<String, String> systemProperties = new HashMap<>();

    @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
    protected boolean help;

    public abstract void main() throws Exception;

    public abstract SystemExitException usage(String error);

    protected Properties loadSystemProperties()
        throws IOException
    {
        // Later sources win:
        // 1. Default config file (unless --config was specified)
        // 2. DAGPORT_CONFIG env var
        // 3. JVM system properties (-D... and -X...)
        // 4. Explicit configuration file (if --config was specified)

        Properties props = new Properties();

        if (configPath == null) {
            Path defaultConfigPath = ConfigUtil.defaultConfigPath(env);
            try {
                props.putAll(PropertyUtils.loadFile(defaultConfigPath));
            }
            catch (NoSuchFileException ex) {
                logger.trace("configuration file not found: {}", defaultConfigPath, ex);
            }
        }

        props.load(new StringReader(env.getOrDefault(CONFIG_ENV, "")));

        props.putAll(System.getProperties());

        if (configPath != null) {
            props.putAll(PropertyUtils.loadFile(Paths.get(configPath)));
        }

        return props;
    }
}
