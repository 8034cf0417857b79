package io.dagport.core.workflow;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import com.google.common.collect.ImmutableList;

/**
 * The control flow of a workflow is malformed. Carries every violation found
 * by the validation step that failed.
 */
public class StructuralException
        extends RuntimeException
{
    public static class Failure
    {
        private final String nodeName;
        private final String message;

        public Failure(String nodeName, String message)
        {
            this.nodeName = nodeName;
            this.message = message;
        }

        public String getNodeName()
        {
            return nodeName;
        }

        public String getMessage()
        {
            return message;
        }

        @Override
        public String toString()
        {
            return "node '" + nodeName + "' " + message;
        }
    }

    private final List<Failure> failures;

    public StructuralException(String message, List<Failure> failures)
    {
        super(buildMessage(message, failures));
        this.failures = ImmutableList.copyOf(failures);
    }

    public StructuralException(String nodeName, String message)
    {
        this("Invalid workflow structure", ImmutableList.of(new Failure(nodeName, message)));
    }

    private static String buildMessage(String message, List<Failure> failures)
    {
        StringBuilder sb = new StringBuilder();
        sb.append(message);
        for (Failure failure : failures) {
            sb.append("\n  ");
            sb.append(failure);
        }
        return sb.toString();
    }

    public List<Failure> getFailures()
    {
        return failures;
    }

    public Set<String> getNodeNames()
    {
        return failures.stream()
            .map(Failure::getNodeName)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
