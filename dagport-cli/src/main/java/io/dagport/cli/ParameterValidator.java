package io.dagport.cli;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.ParameterException;

public class ParameterValidator
        implements IParameterValidator
{
    @Override
    public void validate(String name, String value)
        throws ParameterException
    {
        if (!value.contains("=")) {
            throw new ParameterException("Parameter " + name + " expected a value of the form KEY=VALUE but got: " + value);
        }
    }

    /**
     * Splits KEY=VALUE pairs at the first '='. Later pairs win. JCommander
     * splits option values at commas, so a value without '=' continues the
     * value of the pair before it.
     */
    public static Map<String, String> toMap(List<String> list)
    {
        Map<String, String> map = new LinkedHashMap<>();
        String key = null;

        for (String value : list) {
            int eq = value.indexOf('=');
            if (eq >= 0) {
                key = value.substring(0, eq);
                map.put(key, value.substring(eq + 1));
            }
            else if (key != null) {
                map.put(key, map.get(key) + "," + value);
            }
            else {
                throw new ParameterException("Expected a value of the form KEY=VALUE but got: " + value);
            }
        }

        return map;
    }
}
