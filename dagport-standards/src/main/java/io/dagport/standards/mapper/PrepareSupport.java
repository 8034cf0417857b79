package io.dagport.standards.mapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.dagport.core.config.XmlElements;
import io.dagport.spi.MappingContext;
import io.dagport.spi.Relation;
import io.dagport.spi.Task;
import io.dagport.spi.Translation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Adds the task that runs an action's {@code <prepare>} block before the
 * action itself:
 *
 * <pre>
 * &lt;prepare&gt;
 *     &lt;delete path="..."/&gt;
 *     &lt;mkdir path="..."/&gt;
 * &lt;/prepare&gt;
 * </pre>
 */
public final class PrepareSupport
{
    private static final Logger logger = LoggerFactory.getLogger(PrepareSupport.class);

    public static final String PREPARE_TEMPLATE = "prepare.tpl";
    public static final String PREPARE_SUFFIX = "_prepare";
    public static final String PREPARE_SCRIPT = "$DAGS_FOLDER/../data/prepare.sh";

    static final String CLUSTER_PARAM = "dataproc_cluster";
    static final String REGION_PARAM = "gcp_region";

    private PrepareSupport()
    { }

    /**
     * Returns the translation of an action consisting of the given task,
     * preceded by a prepare task when the action declares one.
     */
    public static Translation compose(MappingContext context, Task actionTask, Set<String> imports)
    {
        Optional<String> command = prepareCommand(context.getElement(), context.getParams());
        if (!command.isPresent()) {
            return Translation.of(actionTask, imports);
        }

        Task prepare = Task.builder()
            .taskId(actionTask.getTaskId() + PREPARE_SUFFIX)
            .templateName(PREPARE_TEMPLATE)
            .templateParams(ImmutableMap.of("prepare_command", command.get()))
            .build();
        logger.debug("Adding prepare task {} before {}", prepare.getTaskId(), actionTask.getTaskId());
        return Translation.builder()
            .addTasks(prepare, actionTask)
            .addRelations(Relation.structural(prepare.getTaskId(), actionTask.getTaskId()))
            .imports(imports)
            .addImports(AirflowImports.BASH_OPERATOR)
            .build();
    }

    static Optional<String> prepareCommand(Element action, Map<String, String> params)
    {
        Optional<Element> prepare = XmlElements.child(action, "prepare");
        if (!prepare.isPresent()) {
            return Optional.absent();
        }

        List<String> deletePaths = new ArrayList<>();
        List<String> mkdirPaths = new ArrayList<>();
        for (Element operation : XmlElements.children(prepare.get())) {
            String path = "\"" + HdfsPaths.normalize(operation.getAttribute("path"), params) + "\"";
            if (XmlElements.localName(operation).equals("delete")) {
                deletePaths.add(path);
            }
            else {
                mkdirPaths.add(path);
            }
        }
        if (deletePaths.isEmpty() && mkdirPaths.isEmpty()) {
            return Optional.absent();
        }

        StringBuilder sb = new StringBuilder(PREPARE_SCRIPT)
            .append(" -c ").append(ShellQuoting.quote(HdfsPaths.require(params, CLUSTER_PARAM)))
            .append(" -r ").append(ShellQuoting.quote(HdfsPaths.require(params, REGION_PARAM)));
        if (!deletePaths.isEmpty()) {
            sb.append(" -d ").append(String.join(" ", deletePaths));
        }
        if (!mkdirPaths.isEmpty()) {
            sb.append(" -m ").append(String.join(" ", mkdirPaths));
        }
        return Optional.of(sb.toString());
    }
}
