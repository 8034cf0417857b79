package io.dagport.core.workflow;

import java.util.ArrayList;
import java.util.List;

import static java.util.Locale.ENGLISH;

class GraphValidator
{
    static GraphValidator builder()
    {
        return new GraphValidator();
    }

    private final List<StructuralException.Failure> failures = new ArrayList<>();

    private GraphValidator()
    { }

    GraphValidator error(String nodeName, String message, Object... args)
    {
        failures.add(new StructuralException.Failure(nodeName, String.format(ENGLISH, message, args)));
        return this;
    }

    GraphValidator check(String nodeName, boolean expression, String message, Object... args)
    {
        if (!expression) {
            error(nodeName, message, args);
        }
        return this;
    }

    boolean hasErrors()
    {
        return !failures.isEmpty();
    }

    void validate(String step)
    {
        if (!failures.isEmpty()) {
            throw new StructuralException("Validating " + step + " failed", failures);
        }
    }
}
