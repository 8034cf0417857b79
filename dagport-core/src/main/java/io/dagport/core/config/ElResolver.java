package io.dagport.core.config;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code ${name}} expressions with known parameter values.
 * Expressions that don't name a known parameter, such as function calls
 * like {@code ${wf:id()}}, are kept as they are.
 */
public class ElResolver
{
    private static final Pattern EXPRESSION = Pattern.compile("\\$\\{([^}]+)\\}");

    private ElResolver()
    { }

    public static String resolve(String value, Map<String, String> params)
    {
        Matcher m = EXPRESSION.matcher(value);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            String name = m.group(1).trim();
            String replacement = params.containsKey(name) ? params.get(name) : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public static boolean containsExpression(String value)
    {
        return EXPRESSION.matcher(value).find();
    }
}
