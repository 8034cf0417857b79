package io.dagport.cli;

import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import io.dagport.core.emit.TriggerRules;
import io.dagport.core.workflow.CompiledNode;
import io.dagport.core.workflow.CompiledWorkflow;
import io.dagport.spi.Relation;
import io.dagport.spi.Task;

import static io.dagport.cli.SystemExitException.systemExit;

public class Check
        extends WorkflowCommand
{
    @Override
    public void main()
            throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }
        check();
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " check -i <dir> [options...]");
        err.println("  Options:");
        err.println("    -i, --input DIR                  Oozie application directory containing workflow.xml");
        err.println("    -u, --user NAME                  value of the user.name parameter (default: $USER)");
        err.println("    -p, --param KEY=VALUE            overwrite a parameter (use multiple times to set many parameters)");
        err.println("    -P, --params-file PATH           read parameters from a properties file");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }

    private void check()
            throws Exception
    {
        Properties systemProps = loadSystemProperties();
        Path input = inputDirectory();
        Map<String, String> params = loadParams(input, systemProps);
        CompiledWorkflow workflow = compile(defaultDagName(input), input, params);

        ln("  Workflow: %s", workflow.getName());
        ln("");

        ln("  Tasks (%d):", workflow.getTasks().size());
        for (CompiledNode node : workflow.getNodes()) {
            for (Task task : node.getTasks()) {
                ln("    %s [%s] %s (%s)", task.getTaskId(), node.getMapperType(),
                        task.getTriggerPolicy(), TriggerRules.toAirflow(task.getTriggerPolicy()));
            }
        }
        ln("");

        ln("  Relations (%d):", workflow.getRelations().size());
        for (Relation relation : workflow.getRelations()) {
            ln("    %s", relation);
        }
        ln("");

        ln("  Entry tasks: %s", String.join(", ", workflow.getEntryTaskIds()));
        ln("");

        ln("  Parameters:");
        for (Map.Entry<String, String> param : new TreeMap<>(params).entrySet()) {
            ln("    %s = %s", param.getKey(), param.getValue());
        }
        ln("");

        ln("  Imports:");
        for (String dependency : workflow.getDependencies()) {
            ln("    %s", dependency);
        }
    }

    private void ln(String format, Object... args)
    {
        out.println(String.format(format, args));
    }
}
