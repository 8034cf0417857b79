package io.dagport.spi;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

@Value.Immutable
@JsonSerialize(as = ImmutableTask.class)
@JsonDeserialize(as = ImmutableTask.class)
public abstract class Task
{
    private static final Pattern TASK_ID_PATTERN = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    public abstract String getTaskId();

    public abstract String getTemplateName();

    @Value.Default
    public TriggerPolicy getTriggerPolicy()
    {
        return TriggerPolicy.ALL_UPSTREAM_SUCCEEDED;
    }

    public abstract Map<String, Object> getTemplateParams();

    /**
     * Names of other nodes whose entry task the template looks up through
     * {@code entry_tasks}.
     */
    public abstract List<String> getReferencedNodes();

    public static ImmutableTask.Builder builder()
    {
        return ImmutableTask.builder();
    }

    public static Task of(String taskId, String templateName)
    {
        return builder()
            .taskId(taskId)
            .templateName(templateName)
            .build();
    }

    @Value.Check
    protected void check()
    {
        checkState(TASK_ID_PATTERN.matcher(getTaskId()).matches(),
                "task id must be a valid identifier: %s", getTaskId());
        checkState(!getTemplateName().isEmpty(), "template name of task %s must not be empty", getTaskId());
    }
}
