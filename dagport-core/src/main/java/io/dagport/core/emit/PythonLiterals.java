package io.dagport.core.emit;

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;

/**
 * Formats template values as Python source literals.
 */
public final class PythonLiterals
{
    private PythonLiterals()
    { }

    public static String toLiteral(Object value)
    {
        StringBuilder sb = new StringBuilder();
        append(sb, value);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Object value)
    {
        if (value == null) {
            sb.append("None");
        }
        else if (value instanceof Boolean) {
            sb.append((Boolean) value ? "True" : "False");
        }
        else if (value instanceof Number) {
            sb.append(value);
        }
        else if (value instanceof Map) {
            sb.append('{');
            Iterator<? extends Map.Entry<?, ?>> it = ((Map<?, ?>) value).entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<?, ?> entry = it.next();
                append(sb, entry.getKey());
                sb.append(": ");
                append(sb, entry.getValue());
                if (it.hasNext()) {
                    sb.append(", ");
                }
            }
            sb.append('}');
        }
        else if (value instanceof Collection) {
            sb.append('[');
            Iterator<?> it = ((Collection<?>) value).iterator();
            while (it.hasNext()) {
                append(sb, it.next());
                if (it.hasNext()) {
                    sb.append(", ");
                }
            }
            sb.append(']');
        }
        else {
            appendString(sb, value.toString());
        }
    }

    private static void appendString(StringBuilder sb, String s)
    {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
            case '"':
                sb.append("\\\"");
                break;
            case '\\':
                sb.append("\\\\");
                break;
            case '\n':
                sb.append("\\n");
                break;
            case '\r':
                sb.append("\\r");
                break;
            case '\t':
                sb.append("\\t");
                break;
            default:
                sb.append(c);
            }
        }
        sb.append('"');
    }
}
