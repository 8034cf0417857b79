package io.dagport.cli;

import java.io.PrintStream;
import java.util.Map;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.MissingCommandException;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.module.guice.ObjectMapperModule;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import io.dagport.core.workflow.WorkflowModule;
import io.dagport.standards.mapper.MapperModule;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Strings.isNullOrEmpty;
import static io.dagport.cli.ConfigUtil.defaultConfigPath;
import static io.dagport.cli.SystemExitException.systemExit;

public class Main
{
    private static final String DEFAULT_PROGRAM_NAME = "dagport";

    private final String version;
    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;
    private final String programName;

    public Main(String version, Map<String, String> env, PrintStream out, PrintStream err)
    {
        this.version = version;
        this.env = env;
        this.out = out;
        this.err = err;
        this.programName = System.getProperty("io.dagport.cli.programName", DEFAULT_PROGRAM_NAME);
    }

    public static class MainOptions
    {
        @Parameter(names = {"-c", "--config"})
        protected String configPath = null;

        @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
        boolean help;
    }

    public static void main(String... args)
    {
        int code = new Main(buildVersion(), System.getenv(), System.out, System.err).cli(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static String buildVersion()
    {
        String version = Main.class.getPackage().getImplementationVersion();
        return version != null ? version : "unknown";
    }

    protected void addCommands(JCommander jc, Injector injector)
    {
        jc.addCommand("convert", injector.getInstance(Convert.class));
        jc.addCommand("check", injector.getInstance(Check.class), "c");
    }

    protected Injector createInjector()
    {
        return Guice.createInjector(
                new ObjectMapperModule()
                    .registerModule(new GuavaModule()),
                new WorkflowModule(),
                new MapperModule(),
                new AbstractModule()
                {
                    @Override
                    protected void configure()
                    {
                        bind(new TypeLiteral<Map<String, String>>() {}).annotatedWith(Environment.class).toInstance(env);
                        bind(String.class).annotatedWith(ProgramName.class).toInstance(programName);
                        bind(PrintStream.class).annotatedWith(StdOut.class).toInstance(out);
                        bind(PrintStream.class).annotatedWith(StdErr.class).toInstance(err);
                    }
                });
    }

    public int cli(String... args)
    {
        for (String arg : args) {
            if ("--version".equals(arg)) {
                out.println(version);
                return 0;
            }
        }
        if (args.length == 0) {
            usage(null);
            return 0;
        }

        boolean verbose = false;

        MainOptions mainOpts = new MainOptions();
        JCommander jc = new JCommander(mainOpts);
        jc.setProgramName(programName);

        addCommands(jc, createInjector());

        // Disable @ expansion
        jc.setExpandAtSign(false);
        jc.getCommands().values().forEach(c -> c.setExpandAtSign(false));

        try {
            try {
                jc.parse(args);
            }
            catch (MissingCommandException ex) {
                throw usage("available commands are: " + jc.getCommands().keySet());
            }

            if (mainOpts.help) {
                throw usage(null);
            }

            Command command = getParsedCommand(jc);
            if (command == null) {
                throw usage(null);
            }

            verbose = processCommonOptions(mainOpts, command);

            command.main();
            return 0;
        }
        catch (ParameterException ex) {
            err.println("error: " + ex.getMessage());
            return 1;
        }
        catch (SystemExitException ex) {
            if (ex.getMessage() != null) {
                err.println("error: " + ex.getMessage());
            }
            return ex.getCode();
        }
        catch (Exception ex) {
            String message = formatExceptionMessage(ex);
            if (message.trim().isEmpty()) {
                // prevent silent crash
                ex.printStackTrace(err);
            }
            else {
                err.println("error: " + message);
                if (verbose) {
                    ex.printStackTrace(err);
                }
            }
            return 1;
        }
    }

    private static Command getParsedCommand(JCommander jc)
    {
        String commandName = jc.getParsedCommand();
        if (commandName == null) {
            return null;
        }

        return (Command) jc.getCommands().get(commandName).getObjects().get(0);
    }

    private boolean processCommonOptions(MainOptions mainOpts, Command command)
            throws SystemExitException
    {
        if (command.help) {
            throw command.usage(null);
        }

        boolean verbose;

        switch (command.logLevel) {
        case "error":
        case "warn":
        case "info":
            verbose = false;
            break;
        case "debug":
        case "trace":
            verbose = true;
            break;
        default:
            throw usage("Unknown log level '" + command.logLevel + "'");
        }

        if (command.configPath == null) {
            command.configPath = mainOpts.configPath;
        }

        configureLogging(command.logLevel);

        for (Map.Entry<String, String> pair : command.systemProperties.entrySet()) {
            System.setProperty(pair.getKey(), pair.getValue());
        }

        return verbose;
    }

    private static void configureLogging(String level)
    {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();

        // logback uses system property to embed variables in XML file
        Level lv = Level.toLevel(level.toUpperCase(), Level.DEBUG);
        System.setProperty("dagport.log.level", lv.toString());

        try {
            configurator.doConfigure(Main.class.getResource("/io/dagport/cli/logback-console.xml"));
        }
        catch (JoranException ex) {
            throw new RuntimeException(ex);
        }
    }

    /**
     * Messages of the exception and its causes, one per line, skipping
     * messages already shown.
     */
    static String formatExceptionMessage(Throwable ex)
    {
        StringBuilder sb = new StringBuilder();
        Throwable current = ex;
        while (current != null) {
            String message = current.getMessage();
            if (isNullOrEmpty(message)) {
                message = current.getClass().getSimpleName();
            }
            if (sb.indexOf(message) < 0) {
                if (sb.length() > 0) {
                    sb.append("\n> ");
                }
                sb.append(message);
            }
            current = current.getCause();
        }
        return sb.toString();
    }

    private SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " <command> [options...]");
        err.println("  Commands:");
        err.println("    convert -i <dir> -o <dir>          convert an Oozie workflow into an Airflow DAG");
        err.println("    c[heck] -i <dir>                   show the compiled task graph of an Oozie workflow");
        err.println("");
        err.println("  Options:");
        showCommonOptions(env, err);
        if (error == null) {
            err.println("Use `<command> --help` to see detailed usage of a command.");
            return systemExit(null);
        }
        else {
            return systemExit(error);
        }
    }

    public static void showCommonOptions(Map<String, String> env, PrintStream err)
    {
        err.println("    -l, --log-level LEVEL            log level (error, warn, info, debug or trace)");
        err.println("    -X KEY=VALUE                     set a system property");
        err.println("    -c, --config PATH.properties     Configuration file (default: " + defaultConfigPath(env) + ")");
        err.println("    --version                        show version");
        err.println("");
    }
}
